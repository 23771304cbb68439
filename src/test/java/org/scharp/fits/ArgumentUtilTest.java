///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link ArgumentUtil}. */
public class ArgumentUtilTest {

    /** Tests for {@link ArgumentUtil#checkNotNull(Object, String)} */
    @Test
    void testCheckNotNull() {
        ArgumentUtil.checkNotNull("", "arg");
        ArgumentUtil.checkNotNull(new int[0], "arg");

        Exception exception = assertThrows(NullPointerException.class, () -> ArgumentUtil.checkNotNull(null, "myArg"));
        assertEquals("myArg must not be null", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkNotNegative(int, String)} */
    @Test
    void testCheckNotNegative() {
        ArgumentUtil.checkNotNegative(0, "arg");
        ArgumentUtil.checkNotNegative(1, "arg");
        ArgumentUtil.checkNotNegative(Integer.MAX_VALUE, "arg");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkNotNegative(-1, "blockCount"));
        assertEquals("blockCount must not be negative", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkNotNegative(Integer.MIN_VALUE, "arg"));
        assertEquals("arg must not be negative", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkPositive(int, String)} */
    @Test
    void testCheckPositive() {
        ArgumentUtil.checkPositive(1, "arg");
        ArgumentUtil.checkPositive(Integer.MAX_VALUE, "arg");

        Exception exception = assertThrows(IllegalArgumentException.class, () -> ArgumentUtil.checkPositive(0, "width"));
        assertEquals("width must be positive", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ArgumentUtil.checkPositive(-5, "width"));
        assertEquals("width must be positive", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkKeyword(String, String)} */
    @Test
    void testCheckKeyword() {
        ArgumentUtil.checkKeyword("", "keyword");
        ArgumentUtil.checkKeyword("SIMPLE", "keyword");
        ArgumentUtil.checkKeyword("DATE-OBS", "keyword");
        ArgumentUtil.checkKeyword("TEST_KEY", "keyword");
        ArgumentUtil.checkKeyword("NAXIS999", "keyword");

        Exception exception = assertThrows(
            NullPointerException.class,
            () -> ArgumentUtil.checkKeyword(null, "keyword"));
        assertEquals("keyword must not be null", exception.getMessage());

        // nine characters is one too many
        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkKeyword("TEST_KEYS", "keyword"));
        assertEquals("keyword must not be longer than 8 characters", exception.getMessage());

        // lower case isn't permitted
        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkKeyword("simple", "keyword"));
        assertEquals("keyword must only contain A-Z, 0-9, '-', and '_'", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkKeyword("A B", "myKeyword"));
        assertEquals("myKeyword must only contain A-Z, 0-9, '-', and '_'", exception.getMessage());
    }
}
