///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Writes a FITS stream in whole 2880-byte blocks.
 * <p>
 * This is the only class that writes to the underlying stream. Instances of this class are not thread-safe.
 * </p>
 */
public final class FitsWriter implements Closeable, Flushable {

    private final OutputStream outputStream;
    private long blocksWritten;

    /**
     * Creates a writer over a stream.
     * <p>
     * The writer takes ownership of the stream, which is closed when this writer is closed.
     * </p>
     *
     * @param outputStream
     *     The stream to write to.
     *
     * @throws NullPointerException
     *     if {@code outputStream} is {@code null}.
     */
    public FitsWriter(OutputStream outputStream) {
        ArgumentUtil.checkNotNull(outputStream, "outputStream");
        this.outputStream = outputStream;
        this.blocksWritten = 0;
    }

    /**
     * Creates a writer for a file. If the file exists, its contents are replaced.
     *
     * @param path
     *     The file to write.
     *
     * @return A new writer.
     *
     * @throws IOException
     *     if the file cannot be created.
     */
    public static FitsWriter create(Path path) throws IOException {
        ArgumentUtil.checkNotNull(path, "path");
        return new FitsWriter(Files.newOutputStream(path));
    }

    /**
     * Writes whole blocks.
     *
     * @param data
     *     The data to write. Its length must be a multiple of {@value FitsReader#BLOCK_SIZE}.
     *
     * @throws BlockIoException
     *     if the length of {@code data} is not a multiple of the block size.
     * @throws IOException
     *     if the underlying stream fails.
     */
    public void writeBlocks(byte[] data) throws IOException {
        ArgumentUtil.checkNotNull(data, "data");
        if (data.length % FitsReader.BLOCK_SIZE != 0) {
            throw BlockIoException.notBlockSized(data.length);
        }

        outputStream.write(data);
        blocksWritten += data.length / FitsReader.BLOCK_SIZE;
    }

    /**
     * Writes data, pads the final partial block with zero bytes, and flushes the stream.
     *
     * @param data
     *     The array holding the data.
     * @param length
     *     How many bytes of {@code data} to write.
     *
     * @throws IOException
     *     if the underlying stream fails.
     */
    public void writeBlocksZeroPadded(byte[] data, int length) throws IOException {
        writeBlocksPadded(data, length, (byte) 0);
    }

    /**
     * Writes data, pads the final partial block with a given byte, and flushes the stream.
     * <p>
     * If {@code length} is already a multiple of the block size, no padding is written.
     * </p>
     *
     * @param data
     *     The array holding the data.
     * @param length
     *     How many bytes of {@code data} to write.
     * @param padding
     *     The byte with which to fill the rest of the final block.
     *
     * @throws IllegalArgumentException
     *     if {@code length} is negative or greater than the length of {@code data}.
     * @throws IOException
     *     if the underlying stream fails.
     */
    public void writeBlocksPadded(byte[] data, int length, byte padding) throws IOException {
        ArgumentUtil.checkNotNull(data, "data");
        ArgumentUtil.checkNotNegative(length, "length");
        if (data.length < length) {
            throw new IllegalArgumentException("length must not be greater than the length of data");
        }

        outputStream.write(data, 0, length);

        int excess = length % FitsReader.BLOCK_SIZE;
        if (excess != 0) {
            byte[] paddingBytes = new byte[FitsReader.BLOCK_SIZE - excess];
            Arrays.fill(paddingBytes, padding);
            outputStream.write(paddingBytes);
        }
        blocksWritten += MathUtil.blocksFor(length);

        outputStream.flush();
    }

    /**
     * @return The number of blocks that have been written so far.
     */
    public long blocksWritten() {
        return blocksWritten;
    }

    @Override
    public void flush() throws IOException {
        outputStream.flush();
    }

    @Override
    public void close() throws IOException {
        outputStream.close();
    }
}
