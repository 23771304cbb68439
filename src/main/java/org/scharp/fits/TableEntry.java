///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.Locale;
import java.util.Objects;

/**
 * One value in an ASCII table: text, an integer, or a floating point number.
 * <p>
 * An entry never converts between types. Asking for the value of an entry as a type other than its own is an error.
 * </p>
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class TableEntry {

    /**
     * The types of table entry.
     */
    public enum EntryType {
        /** Text, from an {@code Aw} field. */
        TEXT,

        /** A 64-bit integer, from an {@code Iw} field. */
        INT,

        /** A double precision number, from an {@code Ew.d}, {@code Fw.d}, or {@code Dw.d} field. */
        FLOAT,
    }

    private final EntryType type;
    private final String text;
    private final long integer;
    private final double real;

    private TableEntry(EntryType type, String text, long integer, double real) {
        this.type = type;
        this.text = text;
        this.integer = integer;
        this.real = real;
    }

    /**
     * Creates a text entry.
     *
     * @param text
     *     The text.
     *
     * @return A new entry.
     *
     * @throws NullPointerException
     *     if {@code text} is {@code null}.
     */
    public static TableEntry text(String text) {
        ArgumentUtil.checkNotNull(text, "text");
        return new TableEntry(EntryType.TEXT, text, 0, 0);
    }

    /**
     * Creates an integer entry.
     *
     * @param value
     *     The integer.
     *
     * @return A new entry.
     */
    public static TableEntry integer(long value) {
        return new TableEntry(EntryType.INT, null, value, 0);
    }

    /**
     * Creates a floating point entry.
     *
     * @param value
     *     The number.
     *
     * @return A new entry.
     */
    public static TableEntry real(double value) {
        return new TableEntry(EntryType.FLOAT, null, 0, value);
    }

    /**
     * @return The type of this entry.
     */
    public EntryType type() {
        return type;
    }

    /**
     * @return This entry's text.
     *
     * @throws IllegalStateException
     *     if this entry is not a text entry.
     */
    public String asText() {
        checkType(EntryType.TEXT);
        return text;
    }

    /**
     * @return This entry's integer.
     *
     * @throws IllegalStateException
     *     if this entry is not an integer entry.
     */
    public long asLong() {
        checkType(EntryType.INT);
        return integer;
    }

    /**
     * @return This entry's number.
     *
     * @throws IllegalStateException
     *     if this entry is not a floating point entry.
     */
    public double asDouble() {
        checkType(EntryType.FLOAT);
        return real;
    }

    private void checkType(EntryType requestedType) {
        if (type != requestedType) {
            throw new IllegalStateException("entry is " + type + ", not " + requestedType);
        }
    }

    /**
     * Parses the text of a field.
     * <p>
     * Text fields are kept exactly as they are, including surrounding spaces. Numeric fields are trimmed before they
     * are parsed, and a numeric field that is entirely blank is zero.
     * </p>
     *
     * @param field
     *     The text of the field.
     * @param format
     *     The format of the field.
     *
     * @return The entry.
     *
     * @throws TableFormatException
     *     if the format is invalid, if {@code field} doesn't have the width of the format, or if a numeric field
     *     can't be parsed.
     */
    static TableEntry parse(String field, TableEntryFormat format) throws TableFormatException {
        if (!format.isValid()) {
            throw new TableFormatException(TableFormatException.Reason.INVALID_FORTRAN_FORMAT_CODE,
                "\"" + format.toFortranCode() + "\" is not a valid Fortran format code");
        }

        int length = field.codePointCount(0, field.length());
        if (length != format.width()) {
            throw new TableFormatException(TableFormatException.Reason.FIELD_SIZE_MISMATCH,
                "field \"" + field + "\" has " + length + " characters but format " + format + " requires "
                    + format.width());
        }

        String trimmed = field.trim();
        try {
            switch (format.kind()) {
                case CHAR:
                    return text(field);
                case INT:
                    return integer(trimmed.isEmpty() ? 0 : Long.parseLong(trimmed));
                case FLOAT:
                    return real(trimmed.isEmpty() ? 0.0 : ValueUtil.parseFortranDouble(trimmed));
                default:
                    throw new AssertionError("unhandled format kind " + format.kind());
            }
        } catch (NumberFormatException exception) {
            throw new TableFormatException(TableFormatException.Reason.MALFORMED_FIELD,
                "field \"" + field + "\" is not a number in format " + format, exception);
        }
    }

    /**
     * Formats this entry as the text of a field.
     * <p>
     * Text is left-justified and numbers are right-justified.
     * </p>
     *
     * @param format
     *     The format of the field.
     *
     * @return Exactly {@code format.width()} ASCII characters.
     *
     * @throws TableFormatException
     *     if this entry's type doesn't match the format, if it contains non-ASCII text, or if it is too wide for the
     *     field.
     */
    String format(TableEntryFormat format) throws TableFormatException {
        if (!format.isValid() || format.entryType() != type) {
            throw new TableFormatException(TableFormatException.Reason.TYPE_MISMATCH,
                type + " entry cannot be written with format " + format);
        }

        String formatted;
        switch (format.kind()) {
            case CHAR:
                if (!text.matches("^\\p{ASCII}*$")) {
                    throw new TableFormatException(TableFormatException.Reason.MALFORMED_FIELD,
                        "text \"" + text + "\" must only contain ASCII characters");
                }
                formatted = text;
                break;
            case INT:
                formatted = Long.toString(integer);
                break;
            case FLOAT:
                formatted = formatReal(format);
                break;
            default:
                throw new AssertionError("unhandled format kind " + format.kind());
        }

        if (format.width() < formatted.length()) {
            throw new TableFormatException(TableFormatException.Reason.FIELD_OVERFLOW,
                "\"" + formatted + "\" is too wide for format " + format);
        }

        String padding = " ".repeat(format.width() - formatted.length());
        return type == EntryType.TEXT ? formatted + padding : padding + formatted;
    }

    private String formatReal(TableEntryFormat format) {
        switch (format.letter()) {
            case 'F':
                return String.format(Locale.ROOT, "%." + format.decimalDigits() + "f", real);
            case 'D':
                return String.format(Locale.ROOT, "%." + format.decimalDigits() + "E", real).replace('E', 'D');
            default:
                return String.format(Locale.ROOT, "%." + format.decimalDigits() + "E", real);
        }
    }

    /**
     * Creates the text of a field which holds no entry.
     *
     * @param format
     *     The format of the field.
     *
     * @return {@code format.width()} spaces.
     */
    static String blankField(TableEntryFormat format) {
        return " ".repeat(format.width());
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, integer, real);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TableEntry otherEntry)) {
            return false;
        }

        return type == otherEntry.type &&
            Objects.equals(text, otherEntry.text) &&
            integer == otherEntry.integer &&
            Double.compare(real, otherEntry.real) == 0;
    }

    @Override
    public String toString() {
        switch (type) {
            case TEXT:
                return "TEXT(" + text + ")";
            case INT:
                return "INT(" + integer + ")";
            default:
                return "FLOAT(" + real + ")";
        }
    }
}
