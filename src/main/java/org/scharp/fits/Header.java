///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * The header of an HDU: its structural options and its descriptive metadata.
 */
public final class Header {

    private final HduOptions options;
    private final Metadata metadata;
    private final int blockCount;

    Header(HduOptions options, Metadata metadata, int blockCount) {
        assert options != null : "options must not be null";
        assert metadata != null : "metadata must not be null";
        assert 0 <= blockCount : "blockCount must not be negative";

        this.options = options;
        this.metadata = metadata;
        this.blockCount = blockCount;
    }

    /**
     * @return The structural keywords of this header.
     */
    public HduOptions options() {
        return options;
    }

    /**
     * @return The descriptive keywords of this header.
     */
    public Metadata metadata() {
        return metadata;
    }

    /**
     * @return The number of blocks this header occupied in the stream it was read from, or 0 if it was not read from
     *     a stream.
     */
    public int blockCount() {
        return blockCount;
    }
}
