///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.stream.IntStream;

/**
 * Converts between the data unit of an image HDU and a {@link TypedImage}.
 * <p>
 * A data unit holds the elements of the image in column-major order, each encoded as a big-endian number, followed by
 * zero bytes up to the end of its last block. The data unit is transferred in batches of at most
 * {@link CodecOptions#maxBlocksPerTransfer()} blocks.
 * </p>
 */
final class ImageCodec {

    private static final Logger log = LoggerFactory.getLogger(ImageCodec.class);

    // private constructor to prevent anyone from instantiating the class.
    private ImageCodec() {
    }

    /**
     * Reads the data unit of an image.
     *
     * @param reader
     *     The reader, positioned at the start of the data unit.
     * @param layout
     *     The layout of the image.
     * @param options
     *     The options which control the size of each read and whether elements are converted in parallel.
     *
     * @return A new column-major image.
     *
     * @throws BlockIoException
     *     if the source ends before the data unit does.
     * @throws IOException
     *     if the underlying stream fails.
     */
    static TypedImage decode(FitsReader reader, ImageLayout layout, CodecOptions options) throws IOException {
        TypedImage image = TypedImage.allocate(layout.bitpix(), layout.shape());
        if (!layout.hasData()) {
            return image;
        }

        final int elementWidth = layout.bitpix().byteWidth();
        final int elementsPerBlock = FitsReader.BLOCK_SIZE / elementWidth;
        final int elementCount = layout.elementCount();

        long remainingBlocks = layout.dataBlockCount();
        int firstElement = 0;
        while (0 < remainingBlocks) {
            int batchBlocks = (int) Math.min(remainingBlocks, options.maxBlocksPerTransfer());
            byte[] buffer = reader.readBlocks(batchBlocks);
            remainingBlocks -= batchBlocks;

            // elements which fall in the padding of the last block are dropped
            int batchElements = Math.min(batchBlocks * elementsPerBlock, elementCount - firstElement);
            final int first = firstElement;
            if (options.parallelConversion()) {
                IntStream.range(0, batchElements).parallel().forEach(
                    i -> image.decodeElement(buffer, i * elementWidth, first + i));
            } else {
                for (int i = 0; i < batchElements; i++) {
                    image.decodeElement(buffer, i * elementWidth, first + i);
                }
            }
            firstElement += batchElements;
        }

        log.debug("decoded {} elements of {}", elementCount, layout.bitpix());
        return image;
    }

    /**
     * Checks that an image can be written.
     *
     * @param image
     *     The image.
     *
     * @throws UnsupportedMemoryLayoutException
     *     if the image's layout is {@link MemoryLayout#DISCONTIGUOUS}.
     */
    static void checkEncodable(TypedImage image) throws UnsupportedMemoryLayoutException {
        if (image.layout() == MemoryLayout.DISCONTIGUOUS) {
            throw new UnsupportedMemoryLayoutException(image + " is a discontiguous view and cannot be written");
        }
    }

    /**
     * Writes an image as a data unit.
     *
     * @param image
     *     The image. Its layout must be column-major or row-major.
     * @param writer
     *     The writer, positioned after the image's header.
     * @param options
     *     The options which control the size of each write and whether elements are converted in parallel.
     *
     * @throws UnsupportedMemoryLayoutException
     *     if the image's layout is {@link MemoryLayout#DISCONTIGUOUS}.
     * @throws IOException
     *     if the underlying stream fails.
     */
    static void encode(TypedImage image, FitsWriter writer, CodecOptions options) throws IOException {
        checkEncodable(image);
        MemoryLayout memoryLayout = image.layout();

        final int elementWidth = image.bitpix().byteWidth();
        final int elementCount = image.elementCount();
        final int elementsPerBatch = options.maxBlocksPerTransfer() * (FitsReader.BLOCK_SIZE / elementWidth);
        final boolean columnMajor = memoryLayout == MemoryLayout.COLUMN_MAJOR;
        final int offset = image.offset();

        ColumnMajorWalk walk = new ColumnMajorWalk(image);
        int firstElement = 0;
        while (firstElement < elementCount) {
            int batchElements = Math.min(elementsPerBatch, elementCount - firstElement);
            int batchBytes = batchElements * elementWidth;
            byte[] buffer = new byte[(int) MathUtil.blocksFor(batchBytes) * FitsReader.BLOCK_SIZE];

            final int first = firstElement;
            if (options.parallelConversion()) {
                IntStream.range(0, batchElements).parallel().forEach(
                    i -> image.encodeElement(buffer, i * elementWidth,
                        columnMajor ? offset + first + i : image.storageIndexAt(first + i)));
            } else {
                for (int i = 0; i < batchElements; i++) {
                    int storageIndex = columnMajor ? offset + first + i : walk.next();
                    image.encodeElement(buffer, i * elementWidth, storageIndex);
                }
            }

            firstElement += batchElements;
            if (firstElement < elementCount) {
                writer.writeBlocks(buffer);
            } else {
                writer.writeBlocksZeroPadded(buffer, batchBytes);
            }
        }

        log.debug("encoded {} elements of {} from a {} image", elementCount, image.bitpix(), memoryLayout);
    }

    /**
     * Walks the storage positions of an image with its first axis varying fastest, like an odometer.
     */
    private static final class ColumnMajorWalk {
        private final int[] shape;
        private final int[] strides;
        private final int[] counter;
        private int storageIndex;

        ColumnMajorWalk(TypedImage image) {
            shape = image.shape();
            strides = image.strides();
            counter = new int[shape.length];
            storageIndex = image.offset();
        }

        int next() {
            int current = storageIndex;

            // advance the counter
            for (int axis = 0; axis < shape.length; axis++) {
                counter[axis]++;
                storageIndex += strides[axis];
                if (counter[axis] < shape[axis]) {
                    break;
                }
                storageIndex -= shape[axis] * strides[axis];
                counter[axis] = 0;
            }

            return current;
        }
    }
}
