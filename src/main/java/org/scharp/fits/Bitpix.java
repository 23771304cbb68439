///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * The element types that a FITS array can have, as given by the {@code BITPIX} keyword.
 */
public enum Bitpix {

    /** Unsigned 8-bit integers. */
    BYTE(8),

    /** Signed 16-bit integers. */
    SHORT(16),

    /** Signed 32-bit integers. */
    INT(32),

    /** Signed 64-bit integers. */
    LONG(64),

    /** IEEE 754 single precision floating point numbers. */
    FLOAT(-32),

    /** IEEE 754 double precision floating point numbers. */
    DOUBLE(-64);

    static final String KEYWORD = "BITPIX";

    private final int code;

    Bitpix(int code) {
        this.code = code;
    }

    /**
     * @return The value of the {@code BITPIX} keyword for this type.
     */
    public int code() {
        return code;
    }

    /**
     * @return The number of bytes that one element of this type occupies.
     */
    public int byteWidth() {
        return Math.abs(code) / 8;
    }

    /**
     * Gets the type for a {@code BITPIX} value.
     *
     * @param code
     *     The value of the {@code BITPIX} keyword.
     *
     * @return The type.
     *
     * @throws InvalidHeaderException
     *     if {@code code} is not one of 8, 16, 32, 64, -32, or -64.
     */
    public static Bitpix fromCode(int code) throws InvalidHeaderException {
        for (Bitpix bitpix : values()) {
            if (bitpix.code == code) {
                return bitpix;
            }
        }
        throw InvalidHeaderException.invalidBitpix(Integer.toString(code));
    }
}
