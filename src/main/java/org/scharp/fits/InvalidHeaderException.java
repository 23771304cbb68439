///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Thrown when a header cannot be decoded or describes a data unit that this library cannot represent.
 * <p>
 * The exception identifies the keyword and the raw value which caused the failure, when there is one.
 * </p>
 */
public final class InvalidHeaderException extends FitsException {

    private static final long serialVersionUID = 1L;

    /**
     * The reasons a header can be rejected.
     */
    public enum Reason {
        /** A record was not valid UTF-8. */
        MALFORMED_RECORD,

        /** A keyword which requires a value had none. */
        NO_VALUE,

        /** A value could not be parsed as the type its keyword requires. */
        FORMAT_ERROR,

        /** A keyword required by the extension was never given. */
        MISSING_KEYWORD,

        /** An {@code NAXISn} keyword was given before {@code NAXIS} or with n larger than {@code NAXIS}. */
        NAXIS_OUT_OF_BOUNDS,

        /** A per-field or per-parameter keyword was given before its count or with an index larger than it. */
        FIELD_OUT_OF_BOUNDS,

        /** {@code BITPIX} was not one of 8, 16, 32, 64, -32, or -64. */
        INVALID_BITPIX,

        /** {@code NAXIS} had a value that the extension does not permit. */
        INVALID_NAXIS,

        /** {@code PCOUNT} had a value that the extension does not permit. */
        INVALID_PCOUNT,

        /** {@code GCOUNT} had a value that the extension does not permit. */
        INVALID_GCOUNT,

        /** {@code SIMPLE = F}. */
        NON_CONFORMING,

        /** The extension is recognized but cannot be decoded. */
        UNSUPPORTED_EXTENSION,

        /** {@code XTENSION} named an extension type that is not recognized. */
        INVALID_EXTENSION_NAME,

        /** The data unit has more elements than a Java array can hold. */
        ARRAY_TOO_LARGE,

        /** A value or comment held characters outside of ASCII, so its record cannot be written. */
        NON_ASCII_VALUE,

        /** A keyword held characters other than A-Z, 0-9, '-', and '_', so its record cannot be written. */
        INVALID_KEYWORD,
    }

    private final Reason reason;
    private final String keyword;
    private final String value;
    private final int index;
    private final int declaredCount;

    private InvalidHeaderException(String message, Reason reason, String keyword, String value, int index,
        int declaredCount, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.keyword = keyword;
        this.value = value;
        this.index = index;
        this.declaredCount = declaredCount;
    }

    private static InvalidHeaderException create(String message, Reason reason, String keyword, String value) {
        return new InvalidHeaderException(message, reason, keyword, value, -1, -1, null);
    }

    static InvalidHeaderException malformedRecord(int recordNumber, Throwable cause) {
        return new InvalidHeaderException(
            "header record " + recordNumber + " is not valid UTF-8",
            Reason.MALFORMED_RECORD,
            null,
            null,
            recordNumber,
            -1,
            cause);
    }

    static InvalidHeaderException noValue(String keyword) {
        return create(keyword + " requires a value", Reason.NO_VALUE, keyword, null);
    }

    static InvalidHeaderException formatError(String keyword, String value, String expected) {
        return formatError(keyword, value, expected, null);
    }

    static InvalidHeaderException formatError(String keyword, String value, String expected, Throwable cause) {
        return new InvalidHeaderException(
            keyword + " has value \"" + value + "\" which is not " + expected,
            Reason.FORMAT_ERROR,
            keyword,
            value,
            -1,
            -1,
            cause);
    }

    static InvalidHeaderException missingKeyword(String keyword) {
        return create("header is missing " + keyword, Reason.MISSING_KEYWORD, keyword, null);
    }

    static InvalidHeaderException naxisOutOfBounds(String keyword, int index, int naxes) {
        return new InvalidHeaderException(
            keyword + " is out of bounds for NAXIS = " + naxes,
            Reason.NAXIS_OUT_OF_BOUNDS,
            keyword,
            null,
            index,
            naxes,
            null);
    }

    static InvalidHeaderException fieldOutOfBounds(String keyword, int index, String countKeyword, int count) {
        return new InvalidHeaderException(
            keyword + " is out of bounds for " + countKeyword + " = " + count,
            Reason.FIELD_OUT_OF_BOUNDS,
            keyword,
            null,
            index,
            count,
            null);
    }

    static InvalidHeaderException invalidBitpix(String value) {
        return create(
            "BITPIX = " + value + " is not one of 8, 16, 32, 64, -32, -64",
            Reason.INVALID_BITPIX,
            Bitpix.KEYWORD,
            value);
    }

    static InvalidHeaderException invalidNaxis(int value, int required) {
        return create(
            "NAXIS = " + value + " but the extension requires " + required,
            Reason.INVALID_NAXIS,
            "NAXIS",
            Integer.toString(value));
    }

    static InvalidHeaderException invalidPCount(long value, long required) {
        return create(
            "PCOUNT = " + value + " but the extension requires " + required,
            Reason.INVALID_PCOUNT,
            "PCOUNT",
            Long.toString(value));
    }

    static InvalidHeaderException invalidGCount(long value, long required) {
        return create(
            "GCOUNT = " + value + " but the extension requires " + required,
            Reason.INVALID_GCOUNT,
            "GCOUNT",
            Long.toString(value));
    }

    static InvalidHeaderException nonConforming() {
        return create("SIMPLE = F, the file does not conform to the FITS standard", Reason.NON_CONFORMING, "SIMPLE",
            "F");
    }

    static InvalidHeaderException unsupportedExtension(ExtensionKind kind) {
        return create(
            kind + " extensions are not supported",
            Reason.UNSUPPORTED_EXTENSION,
            kind == ExtensionKind.GROUPS ? "GROUPS" : "XTENSION",
            kind.name());
    }

    static InvalidHeaderException invalidExtensionName(String value) {
        return create(
            "XTENSION = " + value + " is not a recognized extension",
            Reason.INVALID_EXTENSION_NAME,
            "XTENSION",
            value);
    }

    static InvalidHeaderException arrayTooLarge(String shape) {
        return create(
            "an array of shape " + shape + " has too many elements",
            Reason.ARRAY_TOO_LARGE,
            "NAXIS",
            shape);
    }

    static InvalidHeaderException nonAsciiValue(String keyword, String text) {
        return create(
            keyword + " has value \"" + text + "\" which is not ASCII and cannot be written",
            Reason.NON_ASCII_VALUE,
            keyword,
            text);
    }

    static InvalidHeaderException invalidKeyword(String keyword) {
        return create(
            "keyword \"" + keyword + "\" must only contain A-Z, 0-9, '-', and '_' to be written",
            Reason.INVALID_KEYWORD,
            keyword,
            null);
    }

    /**
     * @return Why the header was rejected.
     */
    public Reason reason() {
        return reason;
    }

    /**
     * @return The keyword which caused the failure, or {@code null} if the failure isn't tied to one keyword.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * @return The raw value which caused the failure, or {@code null} if there was none.
     */
    public String value() {
        return value;
    }

    /**
     * @return For the out-of-bounds reasons, the 1-based index from the keyword. For {@link Reason#MALFORMED_RECORD},
     *     the 0-based record number. Otherwise -1.
     */
    public int index() {
        return index;
    }

    /**
     * @return For the out-of-bounds reasons, the count that had been declared when the keyword was given. Otherwise
     *     -1.
     */
    public int declaredCount() {
        return declaredCount;
    }
}
