///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.HashMap;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The format of a field in an ASCII table, as given by a Fortran format code in a {@code TFORMn} keyword.
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()} so that its instances suitable for use in a HashMap.
 * </p>
 *
 * <p>
 * The supported codes are {@code Aw} (text), {@code Iw} (integer), and {@code Ew.d}, {@code Fw.d}, or {@code Dw.d}
 * (floating point), where "w" is the width of the field in characters and "d" is the number of digits to the right
 * of the decimal point. Any other code produces a format of kind {@link Kind#INVALID}.
 * </p>
 */
public final class TableEntryFormat {

    /**
     * The kinds of field format.
     */
    public enum Kind {
        /** A text field ({@code Aw}). */
        CHAR,

        /** An integer field ({@code Iw}). */
        INT,

        /** A floating point field ({@code Ew.d}, {@code Fw.d}, or {@code Dw.d}). */
        FLOAT,

        /** A code that isn't recognized. */
        INVALID,
    }

    private static final Pattern WIDTH_ONLY = Pattern.compile("^([AI])(\\d{1,9})$");
    private static final Pattern WIDTH_AND_DIGITS = Pattern.compile("^([EFD])(\\d{1,9})\\.(\\d{1,9})$");

    private final Kind kind;
    private final char letter;
    private final int width;
    private final int decimalDigits;
    private final String invalidCode;

    private TableEntryFormat(Kind kind, char letter, int width, int decimalDigits, String invalidCode) {
        this.kind = kind;
        this.letter = letter;
        this.width = width;
        this.decimalDigits = decimalDigits;
        this.invalidCode = invalidCode;
    }

    /**
     * Creates a text format ({@code Aw}).
     *
     * @param width
     *     The width of the field in characters. This must be positive.
     *
     * @return A new format.
     *
     * @throws IllegalArgumentException
     *     if {@code width} is not positive.
     */
    public static TableEntryFormat character(int width) {
        ArgumentUtil.checkPositive(width, "format width");
        return new TableEntryFormat(Kind.CHAR, 'A', width, 0, null);
    }

    /**
     * Creates an integer format ({@code Iw}).
     *
     * @param width
     *     The width of the field in characters. This must be positive.
     *
     * @return A new format.
     *
     * @throws IllegalArgumentException
     *     if {@code width} is not positive.
     */
    public static TableEntryFormat integer(int width) {
        ArgumentUtil.checkPositive(width, "format width");
        return new TableEntryFormat(Kind.INT, 'I', width, 0, null);
    }

    /**
     * Creates an exponential floating point format ({@code Ew.d}).
     *
     * @param width
     *     The width of the field in characters. This must be positive.
     * @param decimalDigits
     *     The number of digits to the right of the decimal point. This must not be negative and must be less than
     *     {@code width}.
     *
     * @return A new format.
     *
     * @throws IllegalArgumentException
     *     if {@code width} or {@code decimalDigits} is out of range.
     */
    public static TableEntryFormat floating(int width, int decimalDigits) {
        return floating('E', width, decimalDigits);
    }

    /**
     * Creates a floating point format.
     *
     * @param letter
     *     The Fortran letter: {@code E} (exponential), {@code F} (fixed), or {@code D} (exponential with {@code D}
     *     marking the exponent).
     * @param width
     *     The width of the field in characters. This must be positive.
     * @param decimalDigits
     *     The number of digits to the right of the decimal point. This must not be negative and must be less than
     *     {@code width}.
     *
     * @return A new format.
     *
     * @throws IllegalArgumentException
     *     if {@code letter} is not E, F, or D, or if {@code width} or {@code decimalDigits} is out of range.
     */
    public static TableEntryFormat floating(char letter, int width, int decimalDigits) {
        if (letter != 'E' && letter != 'F' && letter != 'D') {
            throw new IllegalArgumentException("format letter must be E, F, or D");
        }
        ArgumentUtil.checkPositive(width, "format width");
        ArgumentUtil.checkNotNegative(decimalDigits, "format decimalDigits");
        if (width <= decimalDigits) {
            throw new IllegalArgumentException("format decimalDigits must be less than format width");
        }
        return new TableEntryFormat(Kind.FLOAT, letter, width, decimalDigits, null);
    }

    /**
     * Parses a Fortran format code.
     *
     * @param code
     *     The code, for example {@code A8}, {@code I11}, or {@code E15.7}. Surrounding spaces are ignored.
     *
     * @return The format. If {@code code} is not recognized, the format's kind is {@link Kind#INVALID}.
     *
     * @throws NullPointerException
     *     if {@code code} is {@code null}.
     */
    public static TableEntryFormat fromFortranCode(String code) {
        ArgumentUtil.checkNotNull(code, "code");
        String trimmed = code.trim();

        Matcher widthOnly = WIDTH_ONLY.matcher(trimmed);
        if (widthOnly.matches()) {
            int width = Integer.parseInt(widthOnly.group(2));
            if (0 < width) {
                return widthOnly.group(1).equals("A") ? character(width) : integer(width);
            }
        }

        Matcher widthAndDigits = WIDTH_AND_DIGITS.matcher(trimmed);
        if (widthAndDigits.matches()) {
            int width = Integer.parseInt(widthAndDigits.group(2));
            int decimalDigits = Integer.parseInt(widthAndDigits.group(3));
            if (0 < width && decimalDigits < width) {
                return floating(widthAndDigits.group(1).charAt(0), width, decimalDigits);
            }
        }

        return new TableEntryFormat(Kind.INVALID, '\0', 0, 0, trimmed);
    }

    /**
     * @return The kind of this format.
     */
    public Kind kind() {
        return kind;
    }

    /**
     * @return {@code true} if this format's kind is not {@link Kind#INVALID}.
     */
    public boolean isValid() {
        return kind != Kind.INVALID;
    }

    /**
     * @return The Fortran letter of this format ({@code A}, {@code I}, {@code E}, {@code F}, or {@code D}).
     */
    public char letter() {
        return letter;
    }

    /**
     * @return The width of a field in characters. This is 0 for an invalid format.
     */
    public int width() {
        return width;
    }

    /**
     * @return The number of digits to the right of the decimal point. This is 0 for text and integer formats.
     */
    public int decimalDigits() {
        return decimalDigits;
    }

    /**
     * @return The type of entry that a field with this format holds.
     *
     * @throws IllegalStateException
     *     if this format is invalid.
     */
    public TableEntry.EntryType entryType() {
        switch (kind) {
            case CHAR:
                return TableEntry.EntryType.TEXT;
            case INT:
                return TableEntry.EntryType.INT;
            case FLOAT:
                return TableEntry.EntryType.FLOAT;
            default:
                throw new IllegalStateException("invalid format " + invalidCode + " has no entry type");
        }
    }

    /**
     * Gets this format as a Fortran format code.
     *
     * @return A string such as {@code A8}, {@code I11}, or {@code E15.7}. For an invalid format, the code it was
     *     parsed from.
     */
    public String toFortranCode() {
        switch (kind) {
            case CHAR:
            case INT:
                return letter + Integer.toString(width);
            case FLOAT:
                return letter + Integer.toString(width) + "." + decimalDigits;
            default:
                return invalidCode;
        }
    }

    /**
     * Gets a hash code for this format.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return this format's hash code
     */
    @Override
    public int hashCode() {
        return Objects.hash(kind, letter, width, decimalDigits, invalidCode);
    }

    /**
     * Determines if this format is equal to another object.
     * <p>
     * Two formats are equal if they have the same Fortran format code.
     * </p>
     *
     * @param other
     *     The object with which to compare this format
     *
     * @return {@code true}, if this format is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TableEntryFormat otherFormat)) {
            return false;
        }

        return kind == otherFormat.kind &&
            letter == otherFormat.letter &&
            width == otherFormat.width &&
            decimalDigits == otherFormat.decimalDigits &&
            Objects.equals(invalidCode, otherFormat.invalidCode);
    }

    /**
     * @return This format's Fortran format code.
     */
    @Override
    public String toString() {
        return toFortranCode();
    }
}
