///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility methods for converting between the raw value text of a header record and Java values.
 */
final class ValueUtil {

    /** The legacy {@code DD/MM/YY} date form, which always refers to the 20th century. */
    private static final Pattern LEGACY_DATE = Pattern.compile("^(\\d{2})/(\\d{2})/(\\d{2})$");

    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    // private constructor to prevent anyone from instantiating the class.
    private ValueUtil() {
    }

    /**
     * Determines whether a raw value is a quoted string.
     *
     * @param raw
     *     The raw value text.
     *
     * @return {@code true} if {@code raw} starts with a single quote.
     */
    static boolean isString(String raw) {
        return raw != null && raw.startsWith("'");
    }

    /**
     * Removes the quotes from a string value.
     * <p>
     * Doubled quotes within the string become a single quote and trailing spaces are removed. A value that isn't
     * quoted is returned trimmed.
     * </p>
     *
     * @param raw
     *     The raw value text.
     *
     * @return The string's content.
     */
    static String unquote(String raw) {
        String trimmed = raw.trim();
        if (2 <= trimmed.length() && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return trimmed.substring(1, trimmed.length() - 1).replace("''", "'").stripTrailing();
        }
        return trimmed;
    }

    /**
     * Quotes a string for use as a value.
     * <p>
     * Short strings are padded to eight characters so that the closing quote is in column 20 or later.
     * </p>
     *
     * @param text
     *     The string.
     *
     * @return The raw value text.
     */
    static String quote(String text) {
        String escaped = text.replace("'", "''");
        if (escaped.length() < 8) {
            escaped = escaped + " ".repeat(8 - escaped.length());
        }
        return "'" + escaped + "'";
    }

    /**
     * Parses a logical value.
     *
     * @param keyword
     *     The keyword whose value is being parsed, for diagnostics.
     * @param raw
     *     The raw value text.
     *
     * @return The value.
     *
     * @throws InvalidHeaderException
     *     if {@code raw} is {@code null} or is not {@code T} or {@code F}.
     */
    static boolean parseLogical(String keyword, String raw) throws InvalidHeaderException {
        if (raw == null) {
            throw InvalidHeaderException.noValue(keyword);
        }
        switch (raw) {
            case "T":
                return true;
            case "F":
                return false;
            default:
                throw InvalidHeaderException.formatError(keyword, raw, "T or F");
        }
    }

    /**
     * Parses an integer value.
     *
     * @param keyword
     *     The keyword whose value is being parsed, for diagnostics.
     * @param raw
     *     The raw value text.
     *
     * @return The value.
     *
     * @throws InvalidHeaderException
     *     if {@code raw} is {@code null} or is not an integer.
     */
    static long parseLong(String keyword, String raw) throws InvalidHeaderException {
        if (raw == null) {
            throw InvalidHeaderException.noValue(keyword);
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException exception) {
            throw InvalidHeaderException.formatError(keyword, raw, "an integer", exception);
        }
    }

    /**
     * Parses an integer value that must fit in an {@code int} and must not be negative.
     *
     * @param keyword
     *     The keyword whose value is being parsed, for diagnostics.
     * @param raw
     *     The raw value text.
     *
     * @return The value.
     *
     * @throws InvalidHeaderException
     *     if {@code raw} is {@code null}, is not an integer, or is out of range.
     */
    static int parseCount(String keyword, String raw) throws InvalidHeaderException {
        long value = parseLong(keyword, raw);
        if (value < 0 || Integer.MAX_VALUE < value) {
            throw InvalidHeaderException.formatError(keyword, raw, "a count between 0 and " + Integer.MAX_VALUE);
        }
        return (int) value;
    }

    /**
     * Parses a real value. Exponents may be written with {@code D} as well as {@code E}.
     *
     * @param keyword
     *     The keyword whose value is being parsed, for diagnostics.
     * @param raw
     *     The raw value text.
     *
     * @return The value.
     *
     * @throws InvalidHeaderException
     *     if {@code raw} is {@code null} or is not a number.
     */
    static double parseDouble(String keyword, String raw) throws InvalidHeaderException {
        if (raw == null) {
            throw InvalidHeaderException.noValue(keyword);
        }
        try {
            return parseFortranDouble(raw);
        } catch (NumberFormatException exception) {
            throw InvalidHeaderException.formatError(keyword, raw, "a number", exception);
        }
    }

    /**
     * Parses a number written by Fortran, which may use {@code D} for the exponent.
     *
     * @param text
     *     The number's text, without surrounding spaces.
     *
     * @return The number.
     *
     * @throws NumberFormatException
     *     if {@code text} is not a number.
     */
    static double parseFortranDouble(String text) {
        return Double.parseDouble(text.replace('D', 'E').replace('d', 'e'));
    }

    /**
     * Parses a date value.
     * <p>
     * The forms {@code YYYY-MM-DD} and {@code YYYY-MM-DDThh:mm:ss[.sss]} are accepted, where a two digit year is
     * taken to be in the 1900s. The legacy form {@code DD/MM/YY} is also accepted. All dates are UTC.
     * </p>
     *
     * @param keyword
     *     The keyword whose value is being parsed, for diagnostics.
     * @param raw
     *     The raw value text.
     *
     * @return The date.
     *
     * @throws InvalidHeaderException
     *     if {@code raw} is {@code null} or is not a date.
     */
    static LocalDateTime parseDate(String keyword, String raw) throws InvalidHeaderException {
        if (raw == null) {
            throw InvalidHeaderException.noValue(keyword);
        }
        String text = unquote(raw);

        try {
            Matcher legacy = LEGACY_DATE.matcher(text);
            if (legacy.matches()) {
                int day = Integer.parseInt(legacy.group(1));
                int month = Integer.parseInt(legacy.group(2));
                int year = 1900 + Integer.parseInt(legacy.group(3));
                return LocalDateTime.of(year, month, day, 0, 0);
            }

            String[] dateAndTime = text.split("T", -1);
            if (2 < dateAndTime.length) {
                throw InvalidHeaderException.formatError(keyword, raw, "a date");
            }

            String[] dateParts = dateAndTime[0].split("-", -1);
            if (dateParts.length != 3) {
                throw InvalidHeaderException.formatError(keyword, raw, "a date");
            }
            int year = parseYear(keyword, raw, dateParts[0]);
            int month = Integer.parseInt(dateParts[1]);
            int day = Integer.parseInt(dateParts[2]);

            int hour = 0;
            int minute = 0;
            int second = 0;
            int nanosecond = 0;
            if (dateAndTime.length == 2) {
                String[] timeParts = dateAndTime[1].split(":", -1);
                if (timeParts.length != 3) {
                    throw InvalidHeaderException.formatError(keyword, raw, "a date");
                }
                hour = Integer.parseInt(timeParts[0]);
                minute = Integer.parseInt(timeParts[1]);

                String[] secondParts = timeParts[2].split("\\.", -1);
                second = Integer.parseInt(secondParts[0]);
                if (secondParts.length == 2) {
                    // scale the fraction to nanoseconds
                    String fraction = (secondParts[1] + "000000000").substring(0, 9);
                    nanosecond = Integer.parseInt(fraction);
                } else if (2 < secondParts.length) {
                    throw InvalidHeaderException.formatError(keyword, raw, "a date");
                }
            }

            return LocalDateTime.of(year, month, day, hour, minute, second, nanosecond);
        } catch (NumberFormatException | DateTimeException exception) {
            throw InvalidHeaderException.formatError(keyword, raw, "a date", exception);
        }
    }

    private static int parseYear(String keyword, String raw, String yearText) throws InvalidHeaderException {
        switch (yearText.length()) {
            case 2:
                return 1900 + Integer.parseInt(yearText);
            case 4:
            case 6:
                return Integer.parseInt(yearText);
            default:
                throw InvalidHeaderException.formatError(keyword, raw, "a date");
        }
    }

    /**
     * Formats a date as a quoted value.
     *
     * @param dateTime
     *     The date.
     *
     * @return The raw value text, in the form {@code 'YYYY-MM-DDThh:mm:ss'}.
     */
    static String formatDate(LocalDateTime dateTime) {
        return quote(DATE_TIME_FORMAT.format(dateTime));
    }
}
