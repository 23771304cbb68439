///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/** Utility methods for reading big endian numbers from a byte array */
final class ReadUtil {

    // private constructor to prevent anyone from instantiating the class.
    private ReadUtil() {
    }

    /**
     * Reads a two byte big endian number from an array.
     *
     * @param data
     *     The array to read from.
     * @param offset
     *     The offset of the first (most significant) byte.
     *
     * @return The number.
     */
    static short read2(byte[] data, int offset) {
        return (short) ((data[offset] << 8) | (data[offset + 1] & 0xFF));
    }

    /**
     * Reads a four byte big endian number from an array.
     *
     * @param data
     *     The array to read from.
     * @param offset
     *     The offset of the first (most significant) byte.
     *
     * @return The number.
     */
    static int read4(byte[] data, int offset) {
        return (data[offset] << 24) |
            ((data[offset + 1] & 0xFF) << 16) |
            ((data[offset + 2] & 0xFF) << 8) |
            (data[offset + 3] & 0xFF);
    }

    /**
     * Reads an eight byte big endian number from an array.
     *
     * @param data
     *     The array to read from.
     * @param offset
     *     The offset of the first (most significant) byte.
     *
     * @return The number.
     */
    static long read8(byte[] data, int offset) {
        return ((long) read4(data, offset) << 32) | (read4(data, offset + 4) & 0xFFFFFFFFL);
    }
}
