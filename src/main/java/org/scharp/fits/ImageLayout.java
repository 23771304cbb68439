///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * The layout of an image: its element type and the extent of each axis.
 */
public final class ImageLayout extends ExtensionLayout {

    private final Bitpix bitpix;
    private final int[] shape;
    private final int elementCount;

    ImageLayout(Bitpix bitpix, int[] shape, int elementCount) {
        this.bitpix = bitpix;
        this.shape = shape.clone();
        this.elementCount = elementCount;
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.IMAGE;
    }

    /**
     * @return The element type.
     */
    public Bitpix bitpix() {
        return bitpix;
    }

    /**
     * @return The extent of each axis. The first axis varies fastest.
     */
    public int[] shape() {
        return shape.clone();
    }

    /**
     * @return The number of elements, which is the product of the extents, or 0 if there are no axes.
     */
    public int elementCount() {
        return elementCount;
    }

    /**
     * @return {@code true} if a data unit follows the header. A header with {@code NAXIS = 0} has no data.
     */
    public boolean hasData() {
        return shape.length != 0;
    }

    @Override
    public long dataBlockCount() {
        return MathUtil.blocksFor((long) elementCount * bitpix.byteWidth());
    }
}
