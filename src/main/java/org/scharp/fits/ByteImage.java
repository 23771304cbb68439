///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * An image of unsigned 8-bit integers, stored as Java {@code byte}s.
 */
public final class ByteImage extends TypedImage {

    private final byte[] elements;

    private ByteImage(byte[] elements, int[] shape, int[] strides, int offset) {
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
    public static ByteImage columnMajor(int[] shape, byte[] data) {
        int[] checkedShape = checkShape(shape);
        ArgumentUtil.checkNotNull(data, "data");
        checkDataLength(checkedShape, data.length);
        return new ByteImage(data.clone(), checkedShape, columnMajorStrides(checkedShape), 0);
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
    public static ByteImage rowMajor(int[] shape, byte[] data) {
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
    public static ByteImage zeros(int[] shape) {
        int[] checkedShape = checkShape(shape);
        byte[] elements = new byte[(int) MathUtil.product(checkedShape)];
        return new ByteImage(elements, checkedShape, columnMajorStrides(checkedShape), 0);
    }

    @Override
    public Bitpix bitpix() {
        return Bitpix.BYTE;
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
    public byte get(int... index) {
        return elements[storageIndex(index)];
    }

    /**
     * Gets an element as the unsigned value that FITS gives it.
     *
     * @param index
     *     One 0-based index per axis.
     *
     * @return The element, from 0 to 255.
     *
     * @throws IllegalArgumentException
     *     if the number of indexes isn't the number of axes.
     * @throws IndexOutOfBoundsException
     *     if an index is out of range for its axis.
     */
    public int getUnsigned(int... index) {
        return Byte.toUnsignedInt(get(index));
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
    public void set(byte value, int... index) {
        elements[storageIndex(index)] = value;
    }

    /**
     * @return A copy of the elements in column-major order.
     */
    public byte[] toArray() {
        byte[] copy = new byte[elementCount()];
        for (int position = 0; position < copy.length; position++) {
            copy[position] = elements[storageIndexAt(position)];
        }
        return copy;
    }

    @Override
    public ByteImage transpose() {
        return (ByteImage) super.transpose();
    }

    @Override
    public ByteImage slice(int axis, int from, int to) {
        return (ByteImage) super.slice(axis, from, to);
    }

    @Override
    ByteImage view(int[] shape, int[] strides, int offset) {
        return new ByteImage(elements, shape, strides, offset);
    }

    @Override
    void decodeElement(byte[] data, int byteOffset, int storageIndex) {
        elements[storageIndex] = data[byteOffset];
    }

    @Override
    void encodeElement(byte[] data, int byteOffset, int storageIndex) {
        data[byteOffset] = elements[storageIndex];
    }

    @Override
    Object elementArray() {
        return toArray();
    }
}
