///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;

/**
 * The data unit of an HDU in memory.
 *
 * @see ImageExtension
 * @see TableExtension
 * @see CorruptedExtension
 */
public abstract class Extension {

    // package-private constructor so that only this package can add extensions.
    Extension() {
    }

    /**
     * Creates an image extension.
     *
     * @param image
     *     The image.
     *
     * @return A new extension.
     *
     * @throws NullPointerException
     *     if {@code image} is {@code null}.
     */
    public static ImageExtension image(TypedImage image) {
        ArgumentUtil.checkNotNull(image, "image");
        return new ImageExtension(image);
    }

    /**
     * Creates an ASCII table extension.
     *
     * @param table
     *     The table.
     *
     * @return A new extension.
     *
     * @throws NullPointerException
     *     if {@code table} is {@code null}.
     */
    public static TableExtension table(AsciiTable table) {
        ArgumentUtil.checkNotNull(table, "table");
        return new TableExtension(table);
    }

    /**
     * @return The kind of extension that this data unit is written as.
     */
    public abstract ExtensionKind kind();

    /**
     * @return The value of {@code BITPIX} in this data unit's header.
     */
    abstract Bitpix bitpix();

    /**
     * @return The value of {@code NAXISn} in this data unit's header.
     */
    abstract int[] shape();

    /**
     * Writes a data unit that has passed every check.
     */
    interface DataWriter {
        void write(FitsWriter writer, CodecOptions options) throws IOException;
    }

    /**
     * Runs every check that could stop this data unit from being written. Nothing is written to any stream.
     *
     * @return The step which writes the data unit.
     *
     * @throws FitsException
     *     if this data unit cannot be written.
     */
    abstract DataWriter prepareWrite() throws FitsException;

    /**
     * Writes this data unit, padded to a whole number of blocks.
     * <p>
     * If this data unit cannot be written, nothing is written.
     * </p>
     *
     * @param writer
     *     The writer, positioned after this data unit's header.
     * @param options
     *     The codec options.
     *
     * @throws FitsException
     *     if this data unit cannot be written.
     * @throws IOException
     *     if the underlying stream fails.
     */
    public void writeTo(FitsWriter writer, CodecOptions options) throws IOException {
        ArgumentUtil.checkNotNull(writer, "writer");
        ArgumentUtil.checkNotNull(options, "options");
        prepareWrite().write(writer, options);
    }

    /**
     * Writes this data unit with the default codec options.
     *
     * @param writer
     *     The writer, positioned after this data unit's header.
     *
     * @throws FitsException
     *     if this data unit cannot be written.
     * @throws IOException
     *     if the underlying stream fails.
     */
    public void writeTo(FitsWriter writer) throws IOException {
        writeTo(writer, CodecOptions.DEFAULT);
    }
}
