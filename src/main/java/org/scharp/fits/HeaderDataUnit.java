///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * A header and the data unit that follows it (an "HDU").
 * <p>
 * A FITS file is a sequence of HDUs. The first is the primary HDU and the rest are extensions. A header whose
 * {@code NAXIS} is 0 has no data unit.
 * </p>
 */
public final class HeaderDataUnit {

    private static final Logger log = LoggerFactory.getLogger(HeaderDataUnit.class);

    private final Header header;
    private final Extension extension;

    HeaderDataUnit(Header header, Extension extension) {
        this.header = header;
        this.extension = extension;
    }

    /**
     * Creates an HDU for writing.
     *
     * @param metadata
     *     The descriptive keywords of the header.
     * @param extension
     *     The data unit, or {@code null} for a header without data.
     *
     * @throws NullPointerException
     *     if {@code metadata} is {@code null}.
     */
    public HeaderDataUnit(Metadata metadata, Extension extension) {
        ArgumentUtil.checkNotNull(metadata, "metadata");
        this.header = new Header(HeaderEncoder.describe(extension), metadata, 0);
        this.extension = extension;
    }

    /**
     * Reads the next HDU with the default codec options.
     *
     * @param reader
     *     The reader, positioned at the start of a header.
     *
     * @return The HDU.
     *
     * @throws FitsException
     *     if the header or data unit is malformed or unsupported.
     * @throws IOException
     *     if the source ends or fails.
     */
    public static HeaderDataUnit decode(FitsReader reader) throws IOException {
        return decode(reader, CodecOptions.DEFAULT);
    }

    /**
     * Reads the next HDU.
     *
     * @param reader
     *     The reader, positioned at the start of a header.
     * @param options
     *     The codec options.
     *
     * @return The HDU.
     *
     * @throws FitsException
     *     if the header or data unit is malformed or unsupported.
     * @throws IOException
     *     if the source ends or fails.
     */
    public static HeaderDataUnit decode(FitsReader reader, CodecOptions options) throws IOException {
        return decode(reader, options, false);
    }

    /**
     * Reads every remaining HDU with the default codec options.
     *
     * @param reader
     *     The reader, positioned at the start of a header.
     *
     * @return The HDUs in the order they were read.
     *
     * @throws FitsException
     *     if a header is malformed or unsupported.
     * @throws IOException
     *     if the source ends in the middle of an HDU or fails.
     * @see #decodeAll(FitsReader, CodecOptions)
     */
    public static List<HeaderDataUnit> decodeAll(FitsReader reader) throws IOException {
        return decodeAll(reader, CodecOptions.DEFAULT);
    }

    /**
     * Reads every remaining HDU.
     * <p>
     * A table whose rows cannot be parsed does not stop the decoding. Its HDU is given a {@link CorruptedExtension}
     * and the HDUs after it are still read. Every other problem is fatal.
     * </p>
     *
     * @param reader
     *     The reader, positioned at the start of a header.
     * @param options
     *     The codec options.
     *
     * @return The HDUs in the order they were read.
     *
     * @throws FitsException
     *     if a header is malformed or unsupported.
     * @throws IOException
     *     if the source ends in the middle of an HDU or fails.
     */
    public static List<HeaderDataUnit> decodeAll(FitsReader reader, CodecOptions options) throws IOException {
        ArgumentUtil.checkNotNull(reader, "reader");
        ArgumentUtil.checkNotNull(options, "options");

        List<HeaderDataUnit> hdus = new ArrayList<>();
        while (reader.hasRemaining()) {
            hdus.add(decode(reader, options, true));
        }
        log.debug("decoded {} HDUs", hdus.size());
        return hdus;
    }

    private static HeaderDataUnit decode(FitsReader reader, CodecOptions options, boolean keepCorruptedTables)
        throws IOException {
        ArgumentUtil.checkNotNull(reader, "reader");
        ArgumentUtil.checkNotNull(options, "options");

        Header header = HeaderReader.read(reader, options);
        ExtensionLayout layout = ExtensionResolver.resolve(header.options(), header.metadata());

        Extension extension;
        if (layout instanceof ImageLayout imageLayout) {
            extension = imageLayout.hasData() ? new ImageExtension(ImageCodec.decode(reader, imageLayout, options))
                : null;
        } else {
            TableLayout tableLayout = (TableLayout) layout;
            byte[] data = AsciiTableCodec.readData(reader, tableLayout);
            try {
                extension = new TableExtension(AsciiTableCodec.parseRows(data, tableLayout));
            } catch (TableFormatException exception) {
                if (!keepCorruptedTables) {
                    throw exception;
                }
                log.warn("keeping a table whose rows could not be parsed: {}", exception.getMessage());
                extension = new CorruptedExtension(tableLayout, data, exception);
            }
        }

        return new HeaderDataUnit(header, extension);
    }

    /**
     * @return The header.
     */
    public Header header() {
        return header;
    }

    /**
     * @return The descriptive keywords of the header.
     */
    public Metadata metadata() {
        return header.metadata();
    }

    /**
     * @return The data unit, or {@code null} if the header has none.
     */
    public Extension extension() {
        return extension;
    }

    /**
     * Writes this HDU with the default codec options.
     *
     * @param writer
     *     The writer.
     * @param primary
     *     {@code true} if this is the first HDU of the file.
     *
     * @throws IllegalArgumentException
     *     if {@code primary} is {@code true} and the data unit is a table, or if a keyword can't be written.
     * @throws FitsException
     *     if the data unit can't be written.
     * @throws IOException
     *     if the underlying stream fails.
     */
    public void writeTo(FitsWriter writer, boolean primary) throws IOException {
        writeTo(writer, primary, CodecOptions.DEFAULT);
    }

    /**
     * Writes this HDU.
     *
     * @param writer
     *     The writer.
     * @param primary
     *     {@code true} if this is the first HDU of the file.
     * @param options
     *     The codec options.
     *
     * @throws IllegalArgumentException
     *     if {@code primary} is {@code true} and the data unit is a table.
     * @throws FitsException
     *     if the header or the data unit can't be written. Nothing is written in this case.
     * @throws IOException
     *     if the underlying stream fails.
     */
    public void writeTo(FitsWriter writer, boolean primary, CodecOptions options) throws IOException {
        ArgumentUtil.checkNotNull(writer, "writer");
        ArgumentUtil.checkNotNull(options, "options");
        Extension.DataWriter dataWriter = extension == null ? null : extension.prepareWrite();
        List<KeywordRecord> records = HeaderEncoder.records(header, extension, primary);
        HeaderEncoder.write(records, writer);
        if (dataWriter != null) {
            dataWriter.write(writer, options);
        }
    }
}
