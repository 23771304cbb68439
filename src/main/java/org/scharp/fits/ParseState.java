///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.Objects;

/**
 * The state of a {@link HeaderAssembler} between records.
 * <p>
 * The assembler is either scanning records one at a time, or it is in the middle of a string value which is being
 * continued across {@code CONTINUE} records, in which case the state holds the keyword and the value so far.
 * </p>
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
final class ParseState {

    /** The modes that a header assembler can be in. */
    enum Mode {
        SCANNING,
        EXTENDED_STRING,
    }

    /** A string value ends with this when it is continued in the next record. */
    static final String CONTINUATION_MARKER = "&'";

    static final ParseState SCANNING = new ParseState(Mode.SCANNING, null, null);

    private final Mode mode;
    private final String keyword;
    private final String partialValue;

    private ParseState(Mode mode, String keyword, String partialValue) {
        this.mode = mode;
        this.keyword = keyword;
        this.partialValue = partialValue;
    }

    /**
     * Creates the state for a string value that continues in the following records.
     *
     * @param keyword
     *     The keyword whose value is being continued.
     * @param partialValue
     *     The raw value given so far, including the leading quote and the trailing continuation marker.
     *
     * @return A new state.
     */
    static ParseState extendedString(String keyword, String partialValue) {
        assert keyword != null : "keyword must not be null";
        assert partialValue != null : "partialValue must not be null";
        return new ParseState(Mode.EXTENDED_STRING, keyword, partialValue);
    }

    /**
     * Joins the next piece of a continued string to the value so far.
     * <p>
     * The continuation marker at the end of the partial value and the opening quote of {@code continuation} are
     * removed at the join.
     * </p>
     *
     * @param continuation
     *     The raw value of a {@code CONTINUE} record.
     *
     * @return The state holding the longer value.
     */
    ParseState append(String continuation) {
        assert mode == Mode.EXTENDED_STRING : "only an extended string can be appended to";
        assert isOpen() : "the string has already been closed";

        String head = partialValue.substring(0, partialValue.length() - CONTINUATION_MARKER.length());
        String tail = continuation.startsWith("'") ? continuation.substring(1) : continuation;
        return new ParseState(Mode.EXTENDED_STRING, keyword, head + tail);
    }

    /**
     * @return {@code true} if the value so far ends with the continuation marker, so another {@code CONTINUE}
     *     record is expected.
     */
    boolean isOpen() {
        return partialValue != null && partialValue.endsWith(CONTINUATION_MARKER);
    }

    Mode mode() {
        return mode;
    }

    /**
     * @return The keyword whose value is being continued, or {@code null} when scanning.
     */
    String keyword() {
        return keyword;
    }

    /**
     * @return The raw value so far, or {@code null} when scanning.
     */
    String partialValue() {
        return partialValue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, keyword, partialValue);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ParseState otherState)) {
            return false;
        }

        return mode == otherState.mode &&
            Objects.equals(keyword, otherState.keyword) &&
            Objects.equals(partialValue, otherState.partialValue);
    }

    @Override
    public String toString() {
        return mode == Mode.SCANNING ? "SCANNING" : "EXTENDED_STRING{" + keyword + "=" + partialValue + "}";
    }
}
