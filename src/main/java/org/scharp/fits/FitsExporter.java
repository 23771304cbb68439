///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Streams HDUs to a FITS file.
 * <p>
 * The first HDU that is written is the primary HDU and the rest are extensions. For example:
 * </p>
 * <pre>
 * try (FitsExporter exporter = new FitsExporter(Path.of("ngc4151.fits"))) {
 *     exporter.writeHdu(new HeaderDataUnit(metadata, Extension.image(image)));
 *     exporter.writeHdu(new HeaderDataUnit(new Metadata(), Extension.table(table)));
 * }
 * </pre>
 */
public final class FitsExporter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FitsExporter.class);

    private final FitsWriter writer;
    private final CodecOptions options;
    private int hduCount;
    private boolean closed;

    /**
     * Creates an exporter that writes to a stream.
     *
     * @param outputStream
     *     The stream. It is closed when this exporter is closed.
     * @param options
     *     The codec options.
     *
     * @throws NullPointerException
     *     if {@code outputStream} or {@code options} is {@code null}.
     */
    public FitsExporter(OutputStream outputStream, CodecOptions options) {
        ArgumentUtil.checkNotNull(options, "options");
        this.writer = new FitsWriter(outputStream);
        this.options = options;
    }

    /**
     * Creates an exporter that writes to a stream with the default codec options.
     *
     * @param outputStream
     *     The stream. It is closed when this exporter is closed.
     */
    public FitsExporter(OutputStream outputStream) {
        this(outputStream, CodecOptions.DEFAULT);
    }

    /**
     * Creates an exporter that writes to a file with the default codec options.
     *
     * @param targetLocation
     *     The path to the file. If the file doesn't exist, then it will be created. If the file does exist, then its
     *     contents will be replaced.
     *
     * @throws IOException
     *     If the file can't be created.
     */
    public FitsExporter(Path targetLocation) throws IOException {
        this(targetLocation, CodecOptions.DEFAULT);
    }

    /**
     * Creates an exporter that writes to a file.
     *
     * @param targetLocation
     *     The path to the file. If the file doesn't exist, then it will be created. If the file does exist, then its
     *     contents will be replaced.
     * @param options
     *     The codec options.
     *
     * @throws IOException
     *     If the file can't be created.
     */
    public FitsExporter(Path targetLocation, CodecOptions options) throws IOException {
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");
        ArgumentUtil.checkNotNull(options, "options");
        this.writer = FitsWriter.create(targetLocation);
        this.options = options;
    }

    /**
     * Writes the next HDU.
     *
     * @param hdu
     *     The HDU. The first HDU must not hold a table.
     *
     * @throws IllegalStateException
     *     if this exporter has been closed.
     * @throws IllegalArgumentException
     *     if the first HDU holds a table.
     * @throws IOException
     *     if the HDU can't be written.
     */
    public void writeHdu(HeaderDataUnit hdu) throws IOException {
        ArgumentUtil.checkNotNull(hdu, "hdu");
        if (closed) {
            throw new IllegalStateException("Cannot invoke writeHdu on closed exporter");
        }

        hdu.writeTo(writer, hduCount == 0, options);
        hduCount++;
    }

    /**
     * @return The number of HDUs written so far.
     */
    public int hduCount() {
        return hduCount;
    }

    /**
     * Flushes any buffered data and closes the output.
     * <p>
     * This is safe to invoke multiple times.
     * </p>
     *
     * @throws IOException
     *     if there was a problem flushing any buffered data.
     */
    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            writer.close();
            log.debug("exported {} HDUs in {} blocks", hduCount, writer.blocksWritten());
        }
    }

    /**
     * Writes a FITS file with the given HDUs.
     *
     * @param targetLocation
     *     The path to the file. If the file doesn't exist, then it will be created. If the file does exist, then its
     *     contents will be replaced.
     * @param hdus
     *     The HDUs, primary first.
     *
     * @throws IOException
     *     If the file can't be written.
     * @throws NullPointerException
     *     If {@code targetLocation} or {@code hdus} is {@code null}.
     */
    public static void exportHdus(Path targetLocation, List<HeaderDataUnit> hdus) throws IOException {
        ArgumentUtil.checkNotNull(targetLocation, "targetLocation");
        ArgumentUtil.checkNotNull(hdus, "hdus");

        try (FitsExporter exporter = new FitsExporter(targetLocation)) {
            for (HeaderDataUnit hdu : hdus) {
                if (hdu == null) {
                    throw new NullPointerException("hdus must not contain a null HDU");
                }
                exporter.writeHdu(hdu);
            }
        }
    }
}
