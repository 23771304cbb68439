///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Thrown when the rows of an ASCII table cannot be decoded or encoded.
 */
public final class TableFormatException extends FitsException {

    private static final long serialVersionUID = 1L;

    /**
     * The reasons a table can be rejected.
     */
    public enum Reason {
        /** A field's text did not have the number of characters its format declares. */
        FIELD_SIZE_MISMATCH,

        /** A {@code TFORMn} value was not a recognized Fortran format code. */
        INVALID_FORTRAN_FORMAT_CODE,

        /** An entry did not have the type of the column it was added to. */
        TYPE_MISMATCH,

        /** A field or entry was outside of the table. */
        INDEX_OUT_OF_RANGE,

        /** A numeric field's text could not be parsed as a number. */
        MALFORMED_FIELD,

        /** A value was too wide to be written in its field. */
        FIELD_OVERFLOW,
    }

    private final Reason reason;

    TableFormatException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    TableFormatException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * @return Why the table was rejected.
     */
    public Reason reason() {
        return reason;
    }
}
