///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * An image of signed 64-bit integers.
 */
public final class LongImage extends TypedImage {

    private final long[] elements;

    private LongImage(long[] elements, int[] shape, int[] strides, int offset) {
        super(shape, strides, offset);
        this.elements = elements;
    }

    /**
     * Creates an image from elements in column-major order, in which the first axis varies fastest.
     *
     * @param shape
     *     The extent of each axis.
     * @param data
     *     The elements. The array is copied.
     *
     * @return A new image.
     *
     * @throws NullPointerException
     *     if {@code shape} or {@code data} is {@code null}.
     * @throws IllegalArgumentException
     *     if an extent is negative or the length of {@code data} is not the number of elements in {@code shape}.
     */
    public static LongImage columnMajor(int[] shape, long[] data) {
        int[] checkedShape = checkShape(shape);
        ArgumentUtil.checkNotNull(data, "data");
        checkDataLength(checkedShape, data.length);
        return new LongImage(data.clone(), checkedShape, columnMajorStrides(checkedShape), 0);
    }

    /**
     * Creates an image from elements in row-major order, in which the last axis varies fastest.
     *
     * @param shape
     *     The extent of each axis.
     * @param data
     *     The elements. The array is copied.
     *
     * @return A new image whose layout is {@link MemoryLayout#ROW_MAJOR}.
     *
     * @throws NullPointerException
     *     if {@code shape} or {@code data} is {@code null}.
     * @throws IllegalArgumentException
     *     if an extent is negative or the length of {@code data} is not the number of elements in {@code shape}.
     */
    public static LongImage rowMajor(int[] shape, long[] data) {
        int[] checkedShape = checkShape(shape);
        int[] reversedShape = new int[checkedShape.length];
        for (int axis = 0; axis < checkedShape.length; axis++) {
            reversedShape[axis] = checkedShape[checkedShape.length - 1 - axis];
        }
        return columnMajor(reversedShape, data).transpose();
    }

    /**
     * Creates an image of zeros.
     *
     * @param shape
     *     The extent of each axis.
     *
     * @return A new column-major image.
     *
     * @throws NullPointerException
     *     if {@code shape} is {@code null}.
     * @throws IllegalArgumentException
     *     if an extent is negative.
     */
    public static LongImage zeros(int[] shape) {
        int[] checkedShape = checkShape(shape);
        long[] elements = new long[(int) MathUtil.product(checkedShape)];
        return new LongImage(elements, checkedShape, columnMajorStrides(checkedShape), 0);
    }

    @Override
    public Bitpix bitpix() {
        return Bitpix.LONG;
    }

    /**
     * Gets an element.
     *
     * @param index
     *     One 0-based index per axis.
     *
     * @return The element.
     *
     * @throws IllegalArgumentException
     *     if the number of indexes isn't the number of axes.
     * @throws IndexOutOfBoundsException
     *     if an index is out of range for its axis.
     */
    public long get(int... index) {
        return elements[storageIndex(index)];
    }

    /**
     * Sets an element.
     *
     * @param value
     *     The new value.
     * @param index
     *     One 0-based index per axis.
     *
     * @throws IllegalArgumentException
     *     if the number of indexes isn't the number of axes.
     * @throws IndexOutOfBoundsException
     *     if an index is out of range for its axis.
     */
    public void set(long value, int... index) {
        elements[storageIndex(index)] = value;
    }

    /**
     * @return A copy of the elements in column-major order.
     */
    public long[] toArray() {
        long[] copy = new long[elementCount()];
        for (int position = 0; position < copy.length; position++) {
            copy[position] = elements[storageIndexAt(position)];
        }
        return copy;
    }

    @Override
    public LongImage transpose() {
        return (LongImage) super.transpose();
    }

    @Override
    public LongImage slice(int axis, int from, int to) {
        return (LongImage) super.slice(axis, from, to);
    }

    @Override
    LongImage view(int[] shape, int[] strides, int offset) {
        return new LongImage(elements, shape, strides, offset);
    }

    @Override
    void decodeElement(byte[] data, int byteOffset, int storageIndex) {
        elements[storageIndex] = ReadUtil.read8(data, byteOffset);
    }

    @Override
    void encodeElement(byte[] data, int byteOffset, int storageIndex) {
        WriteUtil.write8(data, byteOffset, elements[storageIndex]);
    }

    @Override
    Object elementArray() {
        return toArray();
    }
}
