///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link ValueUtil}. */
public class ValueUtilTest {

    @Test
    void testQuoteAndUnquote() {
        assertTrue(ValueUtil.isString("'UIT     '"));
        assertFalse(ValueUtil.isString("16"));
        assertFalse(ValueUtil.isString(null));

        assertEquals("UIT", ValueUtil.unquote("'UIT     '"));
        assertEquals("UIT/GSFC", ValueUtil.unquote("'UIT/GSFC'"));
        assertEquals("O'HARA", ValueUtil.unquote("'O''HARA '"));
        assertEquals("  leading", ValueUtil.unquote("'  leading'"));
        assertEquals("", ValueUtil.unquote("''"));
        assertEquals("", ValueUtil.unquote("'        '"));

        // a value that isn't quoted is only trimmed
        assertEquals("16", ValueUtil.unquote(" 16 "));

        // short strings are padded to eight characters
        assertEquals("'UIT     '", ValueUtil.quote("UIT"));
        assertEquals("'        '", ValueUtil.quote(""));
        assertEquals("'INTENSIFIED-FILM'", ValueUtil.quote("INTENSIFIED-FILM"));
        assertEquals("'O''HARA '", ValueUtil.quote("O'HARA"));
    }

    @Test
    void testParseLogical() throws InvalidHeaderException {
        assertTrue(ValueUtil.parseLogical("EXTEND", "T"));
        assertFalse(ValueUtil.parseLogical("EXTEND", "F"));

        InvalidHeaderException exception = assertThrows(
            InvalidHeaderException.class,
            () -> ValueUtil.parseLogical("EXTEND", "Y"));
        assertEquals(InvalidHeaderException.Reason.FORMAT_ERROR, exception.reason());
        assertEquals("EXTEND has value \"Y\" which is not T or F", exception.getMessage());
        assertEquals("EXTEND", exception.keyword());
        assertEquals("Y", exception.value());

        exception = assertThrows(InvalidHeaderException.class, () -> ValueUtil.parseLogical("EXTEND", null));
        assertEquals(InvalidHeaderException.Reason.NO_VALUE, exception.reason());
        assertEquals("EXTEND requires a value", exception.getMessage());
    }

    @Test
    void testParseNumbers() throws InvalidHeaderException {
        assertEquals(-32, ValueUtil.parseLong("BITPIX", "-32"));
        assertEquals(512, ValueUtil.parseCount("NAXIS1", "512"));
        assertEquals(2.0587209E-16, ValueUtil.parseDouble("BSCALE", "2.0587209E-16"));
        assertEquals(182.0044, ValueUtil.parseDouble("NOMRA", "182.0044"));

        // Fortran double precision exponents
        assertEquals(1.5E3, ValueUtil.parseDouble("TZERO1", "1.5D3"));
        assertEquals(-2.5E-2, ValueUtil.parseFortranDouble("-2.5d-2"));

        InvalidHeaderException exception = assertThrows(
            InvalidHeaderException.class,
            () -> ValueUtil.parseLong("PCOUNT", "1.5"));
        assertEquals(InvalidHeaderException.Reason.FORMAT_ERROR, exception.reason());
        assertEquals("PCOUNT has value \"1.5\" which is not an integer", exception.getMessage());

        exception = assertThrows(InvalidHeaderException.class, () -> ValueUtil.parseCount("NAXIS2", "-1"));
        assertEquals(InvalidHeaderException.Reason.FORMAT_ERROR, exception.reason());
        assertEquals("NAXIS2 has value \"-1\" which is not a count between 0 and 2147483647", exception.getMessage());

        exception = assertThrows(InvalidHeaderException.class, () -> ValueUtil.parseDouble("TSCAL1", "'one'"));
        assertEquals("TSCAL1 has value \"'one'\" which is not a number", exception.getMessage());
    }

    @Test
    void testParseDate() throws InvalidHeaderException {
        // the legacy DD/MM/YY form is in the twentieth century
        assertEquals(LocalDateTime.of(1995, 3, 13, 0, 0), ValueUtil.parseDate("DATE-OBS", "'13/03/95'"));

        assertEquals(LocalDateTime.of(1996, 4, 5, 0, 0), ValueUtil.parseDate("DATE", "'1996-04-05'"));
        assertEquals(LocalDateTime.of(1996, 4, 5, 0, 0), ValueUtil.parseDate("DATE", "'96-04-05'"));
        assertEquals(LocalDateTime.of(2024, 12, 31, 23, 59, 58), ValueUtil.parseDate("DATE", "'2024-12-31T23:59:58'"));
        assertEquals(
            LocalDateTime.of(2024, 12, 31, 23, 59, 58, 250_000_000),
            ValueUtil.parseDate("DATE", "'2024-12-31T23:59:58.25'"));
        assertEquals(LocalDateTime.of(12345, 1, 2, 0, 0), ValueUtil.parseDate("DATE", "'012345-01-02'"));

        for (String badDate : new String[] { "'1996-13-05'", "'1996/04/05'", "'96-4'", "'1996-04-05T12:00'",
            "'199-04-05'", "'tomorrow'" }) {
            InvalidHeaderException exception = assertThrows(
                InvalidHeaderException.class,
                () -> ValueUtil.parseDate("DATE", badDate));
            assertEquals(InvalidHeaderException.Reason.FORMAT_ERROR, exception.reason(), badDate);
            assertEquals("DATE has value \"" + badDate + "\" which is not a date", exception.getMessage());
        }

        InvalidHeaderException exception = assertThrows(
            InvalidHeaderException.class,
            () -> ValueUtil.parseDate("DATE", null));
        assertEquals(InvalidHeaderException.Reason.NO_VALUE, exception.reason());
        assertNull(exception.value());
    }

    @Test
    void testFormatDate() {
        assertEquals("'1995-03-13T00:00:00'", ValueUtil.formatDate(LocalDateTime.of(1995, 3, 13, 0, 0)));

        // fractional seconds are dropped
        assertEquals("'2024-12-31T23:59:58'",
            ValueUtil.formatDate(LocalDateTime.of(2024, 12, 31, 23, 59, 58, 999_000_000)));
    }
}
