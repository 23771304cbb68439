///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.Arrays;
import java.util.Objects;

/**
 * An n-dimensional array of numbers of a single {@link Bitpix} type.
 * <p>
 * An image is a view of a primitive storage array. The element at index {@code (i0, i1, ..., in)} is stored at
 * {@code offset + i0 * stride0 + i1 * stride1 + ... + in * striden}. A new image is stored in column-major order, in
 * which the first axis varies fastest. {@link #transpose()} and {@link #slice(int, int, int)} create views which share
 * the storage of the image they came from, so setting an element through a view changes the original.
 * </p>
 * <p>
 * There is exactly one subclass for each {@code Bitpix}: {@link ByteImage}, {@link ShortImage}, {@link IntImage},
 * {@link LongImage}, {@link FloatImage}, and {@link DoubleImage}.
 * </p>
 * <p>
 * Instances of this class are mutable and not thread-safe.
 * </p>
 */
public abstract class TypedImage {

    private final int[] shape;
    private final int[] strides;
    private final int offset;

    // package-private constructor so that only this package can add element types.
    TypedImage(int[] shape, int[] strides, int offset) {
        assert shape.length == strides.length : "shape and strides have different lengths";
        this.shape = shape;
        this.strides = strides;
        this.offset = offset;
    }

    /**
     * Checks a shape and copies it.
     *
     * @param shape
     *     The extent of each axis.
     *
     * @return A copy of {@code shape}.
     *
     * @throws NullPointerException
     *     if {@code shape} is {@code null}.
     * @throws IllegalArgumentException
     *     if an extent is negative or there are too many elements for an array.
     */
    static int[] checkShape(int[] shape) {
        ArgumentUtil.checkNotNull(shape, "shape");
        for (int extent : shape) {
            ArgumentUtil.checkNotNegative(extent, "extent");
        }
        try {
            long elementCount = MathUtil.product(shape);
            if (Integer.MAX_VALUE < elementCount) {
                throw new IllegalArgumentException("shape " + Arrays.toString(shape) + " has too many elements");
            }
        } catch (ArithmeticException exception) {
            throw new IllegalArgumentException("shape " + Arrays.toString(shape) + " has too many elements", exception);
        }
        return shape.clone();
    }

    /**
     * Computes the strides of a column-major array.
     *
     * @param shape
     *     The extent of each axis.
     *
     * @return The strides.
     */
    static int[] columnMajorStrides(int[] shape) {
        int[] strides = new int[shape.length];
        int stride = 1;
        for (int axis = 0; axis < shape.length; axis++) {
            strides[axis] = stride;
            stride *= shape[axis];
        }
        return strides;
    }

    /**
     * Checks that the length of a data array matches a shape.
     */
    static void checkDataLength(int[] shape, int dataLength) {
        long elementCount = MathUtil.product(shape);
        if (elementCount != dataLength) {
            throw new IllegalArgumentException(
                "shape " + Arrays.toString(shape) + " has " + elementCount + " elements but data has " + dataLength);
        }
    }

    /**
     * Creates an image of zeros.
     *
     * @param bitpix
     *     The element type.
     * @param shape
     *     The extent of each axis.
     *
     * @return A new column-major image whose class matches {@code bitpix}.
     *
     * @throws NullPointerException
     *     if {@code bitpix} or {@code shape} is {@code null}.
     * @throws IllegalArgumentException
     *     if an extent is negative.
     */
    public static TypedImage allocate(Bitpix bitpix, int[] shape) {
        ArgumentUtil.checkNotNull(bitpix, "bitpix");
        switch (bitpix) {
            case BYTE:
                return ByteImage.zeros(shape);
            case SHORT:
                return ShortImage.zeros(shape);
            case INT:
                return IntImage.zeros(shape);
            case LONG:
                return LongImage.zeros(shape);
            case FLOAT:
                return FloatImage.zeros(shape);
            case DOUBLE:
                return DoubleImage.zeros(shape);
            default:
                throw new AssertionError("unhandled bitpix " + bitpix);
        }
    }

    /**
     * @return The element type.
     */
    public abstract Bitpix bitpix();

    /**
     * Creates a view of this image's storage.
     */
    abstract TypedImage view(int[] shape, int[] strides, int offset);

    /**
     * Sets the element at a position in storage from its big-endian encoding.
     *
     * @param data
     *     The encoded elements.
     * @param byteOffset
     *     The offset of the element's encoding in {@code data}.
     * @param storageIndex
     *     The position in storage.
     */
    abstract void decodeElement(byte[] data, int byteOffset, int storageIndex);

    /**
     * Writes the big-endian encoding of the element at a position in storage.
     *
     * @param data
     *     The array to write to.
     * @param byteOffset
     *     The offset in {@code data} to write to.
     * @param storageIndex
     *     The position in storage.
     */
    abstract void encodeElement(byte[] data, int byteOffset, int storageIndex);

    /**
     * @return The column-major elements as a primitive array.
     */
    abstract Object elementArray();

    /**
     * @return The extent of each axis.
     */
    public int[] shape() {
        return shape.clone();
    }

    /**
     * @return The number of axes.
     */
    public int axisCount() {
        return shape.length;
    }

    /**
     * @return The number of elements. An image with no axes has no elements.
     */
    public int elementCount() {
        return (int) MathUtil.product(shape);
    }

    int[] strides() {
        return strides.clone();
    }

    int offset() {
        return offset;
    }

    /**
     * Determines how the elements of this image are arranged in storage.
     *
     * @return The layout.
     */
    public MemoryLayout layout() {
        if (elementCount() <= 1 || isContiguous(false)) {
            return MemoryLayout.COLUMN_MAJOR;
        }
        if (isContiguous(true)) {
            return MemoryLayout.ROW_MAJOR;
        }
        return MemoryLayout.DISCONTIGUOUS;
    }

    private boolean isContiguous(boolean lastAxisFastest) {
        int expectedStride = 1;
        for (int i = 0; i < shape.length; i++) {
            int axis = lastAxisFastest ? shape.length - 1 - i : i;
            if (shape[axis] == 1) {
                continue;
            }
            if (strides[axis] != expectedStride) {
                return false;
            }
            expectedStride *= shape[axis];
        }
        return true;
    }

    /**
     * Creates a view of this image with its axes in reverse order.
     *
     * @return A view that shares this image's storage.
     */
    public TypedImage transpose() {
        int[] reversedShape = new int[shape.length];
        int[] reversedStrides = new int[strides.length];
        for (int axis = 0; axis < shape.length; axis++) {
            reversedShape[axis] = shape[shape.length - 1 - axis];
            reversedStrides[axis] = strides[strides.length - 1 - axis];
        }
        return view(reversedShape, reversedStrides, offset);
    }

    /**
     * Creates a view of a range along one axis of this image.
     *
     * @param axis
     *     The 0-based axis.
     * @param from
     *     The first index to include.
     * @param to
     *     The index after the last one to include.
     *
     * @return A view that shares this image's storage.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code axis} is not an axis of this image, or if {@code from} and {@code to} are not a range within it.
     */
    public TypedImage slice(int axis, int from, int to) {
        Objects.checkIndex(axis, shape.length);
        Objects.checkFromToIndex(from, to, shape[axis]);

        int[] slicedShape = shape.clone();
        slicedShape[axis] = to - from;
        return view(slicedShape, strides.clone(), offset + from * strides[axis]);
    }

    /**
     * Finds where the element at an index is stored.
     *
     * @param index
     *     One 0-based index per axis.
     *
     * @return The position in storage.
     *
     * @throws IllegalArgumentException
     *     if the number of indexes isn't the number of axes.
     * @throws IndexOutOfBoundsException
     *     if an index is out of range for its axis.
     */
    int storageIndex(int[] index) {
        ArgumentUtil.checkNotNull(index, "index");
        if (index.length != shape.length) {
            throw new IllegalArgumentException(
                "index has " + index.length + " entries but the image has " + shape.length + " axes");
        }
        int storageIndex = offset;
        for (int axis = 0; axis < shape.length; axis++) {
            if (index[axis] < 0 || shape[axis] <= index[axis]) {
                throw new IndexOutOfBoundsException(
                    "index " + Arrays.toString(index) + " is out of range for shape " + Arrays.toString(shape));
            }
            storageIndex += index[axis] * strides[axis];
        }
        return storageIndex;
    }

    /**
     * Finds where the element at a column-major position is stored.
     *
     * @param position
     *     The 0-based position of the element when the image is walked with its first axis varying fastest.
     *
     * @return The position in storage.
     */
    int storageIndexAt(int position) {
        int storageIndex = offset;
        int remaining = position;
        for (int axis = 0; axis < shape.length; axis++) {
            storageIndex += (remaining % shape[axis]) * strides[axis];
            remaining /= shape[axis];
        }
        return storageIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bitpix(), Arrays.hashCode(shape), Arrays.deepHashCode(new Object[] { elementArray() }));
    }

    /**
     * Determines if this image is equal to another object.
     * <p>
     * Two images are equal if they have the same element type, the same shape, and the same elements. How the
     * elements are arranged in storage doesn't matter.
     * </p>
     *
     * @param other
     *     The object with which to compare this image.
     *
     * @return {@code true}, if this image is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TypedImage otherImage)) {
            return false;
        }

        return bitpix() == otherImage.bitpix() &&
            Arrays.equals(shape, otherImage.shape) &&
            Objects.deepEquals(elementArray(), otherImage.elementArray());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + Arrays.toString(shape);
    }
}
