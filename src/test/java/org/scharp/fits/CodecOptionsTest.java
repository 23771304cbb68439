///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link CodecOptions}. */
public class CodecOptionsTest {

    @Test
    void testDefaults() {
        CodecOptions options = CodecOptions.DEFAULT;
        assertEquals(StrictnessMode.STRICT, options.strictness());
        assertEquals(128, options.maxBlocksPerTransfer());
        assertFalse(options.parallelConversion());
    }

    @Test
    void testBuilder() {
        CodecOptions.Builder builder = CodecOptions.builder()
            .strictness(StrictnessMode.LENIENT)
            .maxBlocksPerTransfer(3)
            .parallelConversion(true);
        CodecOptions options = builder.build();

        assertEquals(StrictnessMode.LENIENT, options.strictness());
        assertEquals(3, options.maxBlocksPerTransfer());
        assertTrue(options.parallelConversion());

        // changing the builder doesn't change the options that it built
        builder.maxBlocksPerTransfer(1);
        assertEquals(3, options.maxBlocksPerTransfer());
        assertEquals(1, builder.build().maxBlocksPerTransfer());
    }

    @Test
    void testBuilderBadArguments() {
        CodecOptions.Builder builder = CodecOptions.builder();

        Exception exception = assertThrows(IllegalArgumentException.class, () -> builder.maxBlocksPerTransfer(0));
        assertEquals("maxBlocksPerTransfer must be positive", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> builder.maxBlocksPerTransfer(745655));
        assertEquals("maxBlocksPerTransfer must not be greater than 745654", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.strictness(null));
        assertEquals("strictness must not be null", exception.getMessage());

        // the largest legal value
        assertEquals(745654, builder.maxBlocksPerTransfer(745654).build().maxBlocksPerTransfer());
    }
}
