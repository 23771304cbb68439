///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Settings that control how HDUs are decoded and encoded.
 * <p>
 * None of these settings change the bytes that are written or the values that are read.
 * </p>
 * <p>
 * Instances of this class are immutable. Use {@link #builder()} to create one.
 * </p>
 */
public final class CodecOptions {

    /** The options used when none are given. */
    public static final CodecOptions DEFAULT = builder().build();

    private final StrictnessMode strictness;
    private final int maxBlocksPerTransfer;
    private final boolean parallelConversion;

    private CodecOptions(Builder builder) {
        this.strictness = builder.strictness;
        this.maxBlocksPerTransfer = builder.maxBlocksPerTransfer;
        this.parallelConversion = builder.parallelConversion;
    }

    /**
     * @return How strictly headers are checked.
     */
    public StrictnessMode strictness() {
        return strictness;
    }

    /**
     * @return The largest number of blocks that the array codec reads or writes in one call.
     */
    public int maxBlocksPerTransfer() {
        return maxBlocksPerTransfer;
    }

    /**
     * @return Whether the conversion between bytes and array elements runs on multiple threads.
     */
    public boolean parallelConversion() {
        return parallelConversion;
    }

    /**
     * Creates a new builder for {@code CodecOptions}.
     *
     * @return A new builder initialized with strict header checking, 128 blocks per transfer, and sequential
     *     conversion.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder for {@link CodecOptions}.
     */
    public static final class Builder {

        private StrictnessMode strictness;
        private int maxBlocksPerTransfer;
        private boolean parallelConversion;

        private Builder() {
            this.strictness = StrictnessMode.STRICT;
            this.maxBlocksPerTransfer = 128;
            this.parallelConversion = false;
        }

        /**
         * Sets how strictly headers are checked.
         *
         * @param strictness
         *     The strictness mode.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code strictness} is {@code null}.
         */
        public Builder strictness(StrictnessMode strictness) {
            ArgumentUtil.checkNotNull(strictness, "strictness");
            this.strictness = strictness;
            return this;
        }

        /**
         * Sets the largest number of blocks that the array codec reads or writes in one call.
         *
         * @param maxBlocksPerTransfer
         *     The number of blocks. Larger values trade memory for fewer I/O calls.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code maxBlocksPerTransfer} is not positive or is too large for one buffer.
         */
        public Builder maxBlocksPerTransfer(int maxBlocksPerTransfer) {
            ArgumentUtil.checkPositive(maxBlocksPerTransfer, "maxBlocksPerTransfer");
            if (Integer.MAX_VALUE / FitsReader.BLOCK_SIZE < maxBlocksPerTransfer) {
                throw new IllegalArgumentException("maxBlocksPerTransfer must not be greater than "
                    + Integer.MAX_VALUE / FitsReader.BLOCK_SIZE);
            }
            this.maxBlocksPerTransfer = maxBlocksPerTransfer;
            return this;
        }

        /**
         * Sets whether the conversion between bytes and array elements runs on multiple threads.
         * <p>
         * Reading and writing the stream is always sequential.
         * </p>
         *
         * @param parallelConversion
         *     {@code true} to convert on the common fork/join pool.
         *
         * @return This builder
         */
        public Builder parallelConversion(boolean parallelConversion) {
            this.parallelConversion = parallelConversion;
            return this;
        }

        /**
         * Creates the options.
         *
         * @return A new {@code CodecOptions}.
         */
        public CodecOptions build() {
            return new CodecOptions(this);
        }
    }
}
