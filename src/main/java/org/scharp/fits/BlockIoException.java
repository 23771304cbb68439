///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Thrown when a block-level read or write cannot be honored.
 */
public final class BlockIoException extends FitsException {

    private static final long serialVersionUID = 1L;

    /**
     * The reasons a block-level transfer can fail.
     */
    public enum Reason {
        /** The source ended before the requested number of blocks could be read. */
        END_OF_SOURCE,

        /** A buffer's length was not a multiple of the 2880-byte block size. */
        NOT_BLOCK_SIZED,
    }

    private final Reason reason;
    private final long remainingBlocks;
    private final long requestedBlocks;
    private final long size;

    private BlockIoException(String message, Reason reason, long remainingBlocks, long requestedBlocks, long size) {
        super(message);
        this.reason = reason;
        this.remainingBlocks = remainingBlocks;
        this.requestedBlocks = requestedBlocks;
        this.size = size;
    }

    static BlockIoException endOfSource(long remainingBlocks, long requestedBlocks) {
        return new BlockIoException(
            "requested " + requestedBlocks + " blocks but only " + remainingBlocks + " remain in the source",
            Reason.END_OF_SOURCE,
            remainingBlocks,
            requestedBlocks,
            -1);
    }

    static BlockIoException notBlockSized(long size) {
        return new BlockIoException(
            "size " + size + " is not a multiple of the block size " + FitsReader.BLOCK_SIZE,
            Reason.NOT_BLOCK_SIZED,
            -1,
            -1,
            size);
    }

    /**
     * @return Why the transfer failed.
     */
    public Reason reason() {
        return reason;
    }

    /**
     * @return The number of whole blocks that were left in the source, or -1 if the reason is not
     *     {@link Reason#END_OF_SOURCE}.
     */
    public long remainingBlocks() {
        return remainingBlocks;
    }

    /**
     * @return The number of blocks that were requested, or -1 if the reason is not {@link Reason#END_OF_SOURCE}.
     */
    public long requestedBlocks() {
        return requestedBlocks;
    }

    /**
     * @return The misaligned size in bytes, or -1 if the reason is not {@link Reason#NOT_BLOCK_SIZED}.
     */
    public long size() {
        return size;
    }
}
