///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a FITS stream in whole 2880-byte blocks.
 * <p>
 * This is the only class that reads from the underlying stream. Every read transfers a whole number of blocks, so a
 * caller never sees a partial block.
 * </p>
 * <p>
 * Instances of this class are not thread-safe.
 * </p>
 */
public final class FitsReader implements Closeable {

    /** The size of a FITS block in bytes. */
    public static final int BLOCK_SIZE = 2880;

    private static final long UNKNOWN_LENGTH = -1;

    private final PushbackInputStream inputStream;
    private final long totalBlocks;
    private long blocksRead;

    private FitsReader(InputStream inputStream, long totalBlocks) {
        this.inputStream = new PushbackInputStream(inputStream, 1);
        this.totalBlocks = totalBlocks;
        this.blocksRead = 0;
    }

    /**
     * Creates a reader over a stream of unknown length.
     * <p>
     * The reader takes ownership of the stream, which is closed when this reader is closed.
     * </p>
     *
     * @param inputStream
     *     The stream to read.
     *
     * @throws NullPointerException
     *     if {@code inputStream} is {@code null}.
     */
    public FitsReader(InputStream inputStream) {
        this(checkedStream(inputStream), UNKNOWN_LENGTH);
    }

    private static InputStream checkedStream(InputStream inputStream) {
        ArgumentUtil.checkNotNull(inputStream, "inputStream");
        return inputStream;
    }

    /**
     * Opens a FITS file for reading.
     *
     * @param path
     *     The file to read.
     *
     * @return A reader positioned at the start of the file.
     *
     * @throws BlockIoException
     *     if the file's size is not a multiple of {@value #BLOCK_SIZE}.
     * @throws IOException
     *     if the file cannot be opened.
     */
    public static FitsReader open(Path path) throws IOException {
        ArgumentUtil.checkNotNull(path, "path");

        long size = Files.size(path);
        if (size % BLOCK_SIZE != 0) {
            throw BlockIoException.notBlockSized(size);
        }
        return new FitsReader(Files.newInputStream(path), size / BLOCK_SIZE);
    }

    /**
     * Reads a number of blocks.
     *
     * @param blockCount
     *     The number of blocks to read.
     *
     * @return A new array of exactly {@code blockCount * 2880} bytes.
     *
     * @throws IllegalArgumentException
     *     if {@code blockCount} is negative or so large that the result cannot be held in one array.
     * @throws BlockIoException
     *     if the source ends before {@code blockCount} blocks can be read.
     * @throws IOException
     *     if the underlying stream fails.
     */
    public byte[] readBlocks(int blockCount) throws IOException {
        ArgumentUtil.checkNotNegative(blockCount, "blockCount");
        if (Integer.MAX_VALUE / BLOCK_SIZE < blockCount) {
            throw new IllegalArgumentException("blockCount must not be greater than " + Integer.MAX_VALUE / BLOCK_SIZE);
        }

        byte[] buffer = new byte[blockCount * BLOCK_SIZE];
        readBlocksInto(buffer);
        return buffer;
    }

    /**
     * Fills a buffer with the next blocks from the source.
     *
     * @param buffer
     *     The buffer to fill. Its length must be a multiple of {@value #BLOCK_SIZE}.
     *
     * @throws BlockIoException
     *     if the buffer is not block sized or if the source ends before the buffer can be filled.
     * @throws IOException
     *     if the underlying stream fails.
     */
    public void readBlocksInto(byte[] buffer) throws IOException {
        ArgumentUtil.checkNotNull(buffer, "buffer");
        if (buffer.length % BLOCK_SIZE != 0) {
            throw BlockIoException.notBlockSized(buffer.length);
        }

        long requestedBlocks = buffer.length / BLOCK_SIZE;
        if (totalBlocks != UNKNOWN_LENGTH && totalBlocks - blocksRead < requestedBlocks) {
            throw BlockIoException.endOfSource(totalBlocks - blocksRead, requestedBlocks);
        }

        int bytesRead = inputStream.readNBytes(buffer, 0, buffer.length);
        if (bytesRead != buffer.length) {
            throw BlockIoException.endOfSource(bytesRead / BLOCK_SIZE, requestedBlocks);
        }
        blocksRead += requestedBlocks;
    }

    /**
     * Determines whether there is at least one more byte to read.
     *
     * @return {@code true} if the source is not exhausted.
     *
     * @throws IOException
     *     if the underlying stream fails.
     */
    public boolean hasRemaining() throws IOException {
        if (totalBlocks != UNKNOWN_LENGTH) {
            return blocksRead < totalBlocks;
        }

        int next = inputStream.read();
        if (next == -1) {
            return false;
        }
        inputStream.unread(next);
        return true;
    }

    /**
     * @return The number of blocks that have been read so far.
     */
    public long blocksRead() {
        return blocksRead;
    }

    @Override
    public void close() throws IOException {
        inputStream.close();
    }
}
