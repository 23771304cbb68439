///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One 80-byte header record, split into its keyword, value, and comment.
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 *
 * <p>
 * A record has the layout
 * </p>
 * <pre>
 * columns 1-8    keyword, padded with spaces
 * columns 9-10   "= " if the record has a value
 * columns 11-80  value, optionally followed by "/" and a comment
 * </pre>
 * <p>
 * {@code COMMENT} and {@code HISTORY} records hold free text in columns 9-80. {@code CONTINUE} records hold a value
 * in columns 11-80 without the {@code "= "} indicator.
 * </p>
 */
public final class KeywordRecord {

    /** The size of a header record in bytes. */
    public static final int RECORD_SIZE = 80;

    /** The number of records in one block. */
    public static final int RECORDS_PER_BLOCK = FitsReader.BLOCK_SIZE / RECORD_SIZE;

    static final int KEYWORD_LENGTH = 8;

    private static final int VALUE_OFFSET = 10;
    private static final int FIXED_FORMAT_VALUE_WIDTH = 20;
    private static final int MINIMUM_STRING_WIDTH = 8;

    static final String COMMENT = "COMMENT";
    static final String HISTORY = "HISTORY";
    static final String CONTINUE = "CONTINUE";
    static final String END = "END";

    private static final KeywordRecord END_RECORD = new KeywordRecord(END, null, null);

    private final String keyword;
    private final String value;
    private final String comment;

    /**
     * Creates a record.
     *
     * @param keyword
     *     The record's keyword. This must not be {@code null}.
     * @param value
     *     The record's raw value text (for example {@code 16}, {@code T}, or {@code 'NGC4151 '}), or {@code null} if
     *     it has none.
     * @param comment
     *     The record's comment or free text, or {@code null} if it has none.
     *
     * @throws NullPointerException
     *     if {@code keyword} is {@code null}.
     */
    public KeywordRecord(String keyword, String value, String comment) {
        ArgumentUtil.checkNotNull(keyword, "keyword");
        this.keyword = keyword;
        this.value = value;
        this.comment = comment;
    }

    /**
     * Creates a {@code COMMENT} record.
     *
     * @param text
     *     The comment text.
     *
     * @return A new record
     */
    static KeywordRecord comment(String text) {
        return new KeywordRecord(COMMENT, null, text);
    }

    /**
     * Creates a {@code HISTORY} record.
     *
     * @param text
     *     The history text.
     *
     * @return A new record
     */
    static KeywordRecord history(String text) {
        return new KeywordRecord(HISTORY, null, text);
    }

    /**
     * @return The {@code END} record.
     */
    static KeywordRecord end() {
        return END_RECORD;
    }

    /**
     * Splits an 80-byte record into its keyword, value, and comment.
     *
     * @param record
     *     An array holding exactly one record.
     *
     * @return The split record.
     *
     * @throws IllegalArgumentException
     *     if {@code record} is not {@value #RECORD_SIZE} bytes.
     * @throws InvalidHeaderException
     *     if the record is not valid UTF-8.
     */
    public static KeywordRecord parse(byte[] record) throws InvalidHeaderException {
        ArgumentUtil.checkNotNull(record, "record");
        if (record.length != RECORD_SIZE) {
            throw new IllegalArgumentException("record must be " + RECORD_SIZE + " bytes");
        }
        return parse(record, 0, 0);
    }

    /**
     * Splits a record within a block.
     *
     * @param data
     *     The array holding the record.
     * @param offset
     *     The offset of the record's first byte.
     * @param recordNumber
     *     The position of the record in its header, for diagnostics.
     *
     * @return The split record.
     *
     * @throws InvalidHeaderException
     *     if the record is not valid UTF-8.
     */
    static KeywordRecord parse(byte[] data, int offset, int recordNumber) throws InvalidHeaderException {
        assert offset + RECORD_SIZE <= data.length : "record extends past the end of the data";

        String keyword = decode(data, offset, KEYWORD_LENGTH, recordNumber).trim();

        if (COMMENT.equals(keyword) || HISTORY.equals(keyword)) {
            // Everything after the keyword is free text.
            String text = decode(data, offset + KEYWORD_LENGTH, RECORD_SIZE - KEYWORD_LENGTH, recordNumber).trim();
            return new KeywordRecord(keyword, null, text);
        }

        boolean hasValueIndicator = data[offset + KEYWORD_LENGTH] == '=' && data[offset + KEYWORD_LENGTH + 1] == ' ';
        if (hasValueIndicator || CONTINUE.equals(keyword)) {
            String remainder = decode(data, offset + VALUE_OFFSET, RECORD_SIZE - VALUE_OFFSET, recordNumber).trim();
            return splitValue(keyword, remainder);
        }

        return new KeywordRecord(keyword, null, null);
    }

    private static String decode(byte[] data, int offset, int length, int recordNumber)
        throws InvalidHeaderException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(data, offset, length)).toString();
        } catch (CharacterCodingException exception) {
            throw InvalidHeaderException.malformedRecord(recordNumber, exception);
        }
    }

    private static KeywordRecord splitValue(String keyword, String remainder) {
        int separator = remainder.indexOf('/', endOfQuotedString(remainder));
        String value;
        String comment;
        if (separator == -1) {
            value = remainder;
            comment = null;
        } else {
            value = remainder.substring(0, separator).trim();
            comment = remainder.substring(separator + 1).trim();
        }
        return new KeywordRecord(keyword, value.isEmpty() ? null : value, comment);
    }

    /**
     * Finds where a quoted string ends so that a slash within the string is not taken as the start of the comment.
     *
     * @param text
     *     The value and comment text.
     *
     * @return The index just past the closing quote, or 0 if {@code text} doesn't start with a quote.
     */
    private static int endOfQuotedString(String text) {
        if (!text.startsWith("'")) {
            return 0;
        }

        int index = 1;
        while (index < text.length()) {
            if (text.charAt(index) == '\'') {
                if (index + 1 < text.length() && text.charAt(index + 1) == '\'') {
                    // a doubled quote is a quote character within the string
                    index += 2;
                    continue;
                }
                return index + 1;
            }
            index++;
        }

        // unterminated, so there is no comment
        return text.length();
    }

    /**
     * @return This record's keyword, trimmed. This may be empty for a blank record.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * @return This record's raw value text, trimmed, or {@code null} if it has none.
     */
    public String value() {
        return value;
    }

    /**
     * @return This record's comment or free text, trimmed, or {@code null} if it has none.
     */
    public String comment() {
        return comment;
    }

    /**
     * @return {@code true} if this record ends a header.
     */
    public boolean isEnd() {
        return END.equals(keyword);
    }

    /**
     * Checks that this record can be written.
     * <p>
     * Decoded records may hold UTF-8 text or keywords that are not legal on output.
     * </p>
     *
     * @throws InvalidHeaderException
     *     if the keyword has characters other than A-Z, 0-9, '-', and '_', or if the value or comment has
     *     characters outside of ASCII.
     */
    void checkWritable() throws InvalidHeaderException {
        if (KEYWORD_LENGTH < keyword.length() || !keyword.matches("^[A-Z0-9_-]*$")) {
            throw InvalidHeaderException.invalidKeyword(keyword);
        }
        if (value != null && !isAscii(value)) {
            throw InvalidHeaderException.nonAsciiValue(keyword, value);
        }
        if (comment != null && !isAscii(comment)) {
            throw InvalidHeaderException.nonAsciiValue(keyword, comment);
        }
    }

    private static boolean isAscii(String text) {
        return text.matches("^\\p{ASCII}*$");
    }

    /**
     * Formats this record as 80 ASCII characters.
     * <p>
     * Strings start in column 11. Other values are right-justified to column 30. A comment follows the value after
     * {@code " / "} and is truncated if it doesn't fit.
     * </p>
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset of the record's first byte.
     *
     * @throws IllegalArgumentException
     *     if the keyword or value cannot be written in a record.
     */
    void writeTo(byte[] data, int offset) {
        WriteUtil.writeAscii(data, offset, format(), RECORD_SIZE);
    }

    String format() {
        if (!keyword.isEmpty()) {
            ArgumentUtil.checkKeyword(keyword, "keyword");
        }
        StringBuilder builder = new StringBuilder(RECORD_SIZE);
        builder.append(keyword);
        builder.append(" ".repeat(KEYWORD_LENGTH - keyword.length()));

        if (value == null) {
            if (comment != null) {
                builder.append(comment);
            }
        } else {
            builder.append(CONTINUE.equals(keyword) ? "  " : "= ");
            if (value.startsWith("'")) {
                builder.append(value);
                // the closing quote of a short string goes in column 20 or later
                int padding = MINIMUM_STRING_WIDTH + 2 - value.length();
                if (0 < padding) {
                    builder.append(" ".repeat(padding));
                }
            } else {
                if (value.length() < FIXED_FORMAT_VALUE_WIDTH) {
                    builder.append(" ".repeat(FIXED_FORMAT_VALUE_WIDTH - value.length()));
                }
                builder.append(value);
            }
            if (RECORD_SIZE < builder.length()) {
                throw new IllegalArgumentException("value of " + keyword + " is too long for one record");
            }
            if (comment != null && !comment.isEmpty()) {
                builder.append(" / ");
                builder.append(comment);
            }
        }

        if (RECORD_SIZE < builder.length()) {
            builder.setLength(RECORD_SIZE);
        }
        String formatted = builder.toString();
        if (!isAscii(formatted)) {
            throw new IllegalArgumentException("record for " + keyword + " must only contain ASCII characters");
        }
        return formatted;
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyword, value, comment);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof KeywordRecord otherRecord)) {
            return false;
        }

        return keyword.equals(otherRecord.keyword) &&
            Objects.equals(value, otherRecord.value) &&
            Objects.equals(comment, otherRecord.comment);
    }

    @Override
    public String toString() {
        return "KeywordRecord{keyword=" + keyword + ", value=" + value + ", comment=" + comment + "}";
    }
}
