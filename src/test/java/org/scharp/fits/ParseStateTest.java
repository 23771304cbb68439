///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link ParseState}. */
public class ParseStateTest {

    @Test
    void testScanning() {
        ParseState state = ParseState.SCANNING;
        assertEquals(ParseState.Mode.SCANNING, state.mode());
        assertNull(state.keyword());
        assertNull(state.partialValue());
        assertFalse(state.isOpen());
        assertEquals("SCANNING", state.toString());
    }

    @Test
    void testAppend() {
        ParseState state = ParseState.extendedString("TEST", "'abc&'");
        assertEquals(ParseState.Mode.EXTENDED_STRING, state.mode());
        assertEquals("TEST", state.keyword());
        assertTrue(state.isOpen());

        ParseState longer = state.append("'def&'");
        assertEquals("'abcdef&'", longer.partialValue());
        assertTrue(longer.isOpen());

        // the original state is unchanged
        assertEquals("'abc&'", state.partialValue());

        ParseState closed = longer.append("'ghi'");
        assertEquals("'abcdefghi'", closed.partialValue());
        assertEquals("TEST", closed.keyword());
        assertFalse(closed.isOpen());
        assertEquals("EXTENDED_STRING{TEST='abcdefghi'}", closed.toString());

        // appending to a closed string is a bug in the caller
        AssertionError error = assertThrows(AssertionError.class, () -> closed.append("'jkl'"));
        assertEquals("the string has already been closed", error.getMessage());
        error = assertThrows(AssertionError.class, () -> ParseState.SCANNING.append("'jkl'"));
        assertEquals("only an extended string can be appended to", error.getMessage());
    }

    @Test
    void testEquals() {
        ParseState state = ParseState.extendedString("TEST", "'abc&'");
        assertEquals(state, ParseState.extendedString("TEST", "'abc&'"));
        assertEquals(state.hashCode(), ParseState.extendedString("TEST", "'abc&'").hashCode());
        assertNotEquals(state, ParseState.extendedString("OTHER", "'abc&'"));
        assertNotEquals(state, ParseState.extendedString("TEST", "'abd&'"));
        assertNotEquals(state, ParseState.SCANNING);
        assertSame(ParseState.SCANNING, ParseState.SCANNING);
    }
}
