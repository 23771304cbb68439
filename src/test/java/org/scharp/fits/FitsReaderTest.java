///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link FitsReader}. */
public class FitsReaderTest {

    private static byte[] numberedBlocks(int blockCount) {
        byte[] data = new byte[blockCount * FitsReader.BLOCK_SIZE];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) (i / FitsReader.BLOCK_SIZE + 1);
        }
        return data;
    }

    @Test
    void testReadBlocks() throws IOException {
        byte[] data = numberedBlocks(3);
        try (FitsReader reader = new FitsReader(new ByteArrayInputStream(data))) {
            assertTrue(reader.hasRemaining());

            byte[] first = reader.readBlocks(1);
            assertEquals(FitsReader.BLOCK_SIZE, first.length);
            assertEquals(1, first[0]);
            assertEquals(1, first[FitsReader.BLOCK_SIZE - 1]);
            assertEquals(1, reader.blocksRead());

            // reading nothing is allowed
            assertEquals(0, reader.readBlocks(0).length);
            assertEquals(1, reader.blocksRead());

            byte[] rest = new byte[2 * FitsReader.BLOCK_SIZE];
            reader.readBlocksInto(rest);
            assertEquals(2, rest[0]);
            assertEquals(3, rest[rest.length - 1]);
            assertEquals(3, reader.blocksRead());

            assertFalse(reader.hasRemaining());
        }
    }

    @Test
    void testReadPastEnd() throws IOException {
        FitsReader reader = new FitsReader(new ByteArrayInputStream(numberedBlocks(2)));
        BlockIoException exception = assertThrows(BlockIoException.class, () -> reader.readBlocks(3));
        assertEquals(BlockIoException.Reason.END_OF_SOURCE, exception.reason());
        assertEquals("requested 3 blocks but only 2 remain in the source", exception.getMessage());
        assertEquals(2, exception.remainingBlocks());
        assertEquals(3, exception.requestedBlocks());
        assertEquals(0, reader.blocksRead());
    }

    @Test
    void testReadPartialBlock() {
        // a stream of unknown length which ends in the middle of a block
        FitsReader reader = new FitsReader(new ByteArrayInputStream(new byte[FitsReader.BLOCK_SIZE + 100]));
        BlockIoException exception = assertThrows(BlockIoException.class, () -> reader.readBlocks(2));
        assertEquals("requested 2 blocks but only 1 remain in the source", exception.getMessage());
    }

    @Test
    void testReadIntoUnalignedBuffer() {
        FitsReader reader = new FitsReader(new ByteArrayInputStream(numberedBlocks(1)));
        BlockIoException exception = assertThrows(BlockIoException.class, () -> reader.readBlocksInto(new byte[100]));
        assertEquals(BlockIoException.Reason.NOT_BLOCK_SIZED, exception.reason());
        assertEquals("size 100 is not a multiple of the block size 2880", exception.getMessage());
        assertEquals(100, exception.size());
    }

    @Test
    void testBadArguments() {
        FitsReader reader = new FitsReader(new ByteArrayInputStream(numberedBlocks(1)));

        Exception exception = assertThrows(IllegalArgumentException.class, () -> reader.readBlocks(-1));
        assertEquals("blockCount must not be negative", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> reader.readBlocks(Integer.MAX_VALUE));
        assertEquals("blockCount must not be greater than 745654", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> reader.readBlocksInto(null));
        assertEquals("buffer must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> new FitsReader(null));
        assertEquals("inputStream must not be null", exception.getMessage());
    }

    @Test
    void testOpen() throws IOException {
        Path targetDirectory = Files.createTempDirectory("fits-readerTest");
        Path file = targetDirectory.resolve("blocks.fits");
        Path misaligned = targetDirectory.resolve("misaligned.fits");
        try {
            Files.write(file, numberedBlocks(2));
            try (FitsReader reader = FitsReader.open(file)) {
                assertTrue(reader.hasRemaining());
                assertArrayEquals(numberedBlocks(2), reader.readBlocks(2));
                assertFalse(reader.hasRemaining());

                // the file's length is known, so nothing is read
                BlockIoException exception = assertThrows(BlockIoException.class, () -> reader.readBlocks(1));
                assertEquals("requested 1 blocks but only 0 remain in the source", exception.getMessage());
            }

            Files.write(misaligned, new byte[FitsReader.BLOCK_SIZE + 1]);
            BlockIoException exception = assertThrows(BlockIoException.class, () -> FitsReader.open(misaligned));
            assertEquals("size 2881 is not a multiple of the block size 2880", exception.getMessage());
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(misaligned);
            Files.deleteIfExists(targetDirectory);
        }
    }
}
