///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A class for holding utility methods.
 */
abstract class MathUtil {

    // private constructor to prevent anyone from instantiating the class.
    private MathUtil() {
    }

    /**
     * Computes dividend / divisor, but instead of truncating any remainder, it always rounds up.
     *
     * @param dividend
     *     the dividend
     * @param divisor
     *     the divisor
     *
     * @return The result of the calculation.
     */
    // This can be replaced by Math.ceilDiv() in Java 18
    static long divideAndRoundUp(long dividend, long divisor) {
        assert 0 < divisor : "divideAndRoundUp doesn't handle non-positive divisors";
        assert 0 <= dividend : "divideAndRoundUp doesn't handle negative numbers";

        return (dividend + divisor - 1) / divisor;
    }

    /**
     * Computes how many 2880-byte blocks are needed to hold a given number of bytes.
     *
     * @param byteCount
     *     The number of bytes.
     *
     * @return The number of blocks.
     */
    static long blocksFor(long byteCount) {
        return divideAndRoundUp(byteCount, FitsReader.BLOCK_SIZE);
    }

    /**
     * Computes the product of the entries in a shape.
     * <p>
     * The product of an empty shape is zero because a FITS array with no axes holds no data.
     * </p>
     *
     * @param shape
     *     The extent of each axis.
     *
     * @return The product of all extents.
     *
     * @throws ArithmeticException
     *     if the product overflows a {@code long}.
     */
    static long product(int[] shape) {
        if (shape.length == 0) {
            return 0;
        }
        long product = 1;
        for (int extent : shape) {
            product = Math.multiplyExact(product, extent);
        }
        return product;
    }
}
