///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the options and metadata of one header from its records.
 * <p>
 * Records must be given in the order in which they appear in the header. Keywords that describe the structure of the
 * data are collected into an {@link HduOptions}. All other keywords are given to a {@link MetaContainer}. A string
 * value that ends with {@code &'} is joined with the values of the {@code CONTINUE} records that follow it before it
 * is stored.
 * </p>
 * <p>
 * {@code COMMENT} and {@code HISTORY} records are collected and stored as the generic tags {@code COMMENT} and
 * {@code HISTORY} (one line per record) when the header is finished.
 * </p>
 * <p>
 * Instances of this class are not thread-safe and assemble exactly one header.
 * </p>
 */
public final class HeaderAssembler {

    private static final Logger log = LoggerFactory.getLogger(HeaderAssembler.class);

    private static final String NAXIS = "NAXIS";
    private static final Pattern NAXIS_KEYWORD = Pattern.compile("^NAXIS(\\d*)$");
    private static final Pattern INDEXED_KEYWORD =
        Pattern.compile("^(TBCOL|TFORM|TSCAL|TZERO|TNULL|TDISP|PSCAL|PZERO)(\\d+)$");

    private final MetaContainer metadata;
    private final StrictnessMode strictness;
    private final HduOptions options;
    private final List<String> comments;
    private final List<String> history;
    private ParseState state;
    private int recordCount;
    private boolean ended;
    private boolean finished;

    /**
     * Creates an assembler which strictly checks every keyword.
     *
     * @param metadata
     *     Where to store descriptive keywords.
     */
    public HeaderAssembler(MetaContainer metadata) {
        this(metadata, StrictnessMode.STRICT);
    }

    /**
     * Creates an assembler.
     *
     * @param metadata
     *     Where to store descriptive keywords.
     * @param strictness
     *     How to handle descriptive keywords whose values cannot be parsed.
     *
     * @throws NullPointerException
     *     if {@code metadata} or {@code strictness} is {@code null}.
     */
    public HeaderAssembler(MetaContainer metadata, StrictnessMode strictness) {
        ArgumentUtil.checkNotNull(metadata, "metadata");
        ArgumentUtil.checkNotNull(strictness, "strictness");

        this.metadata = metadata;
        this.strictness = strictness;
        this.options = new HduOptions();
        this.comments = new ArrayList<>();
        this.history = new ArrayList<>();
        this.state = ParseState.SCANNING;
        this.recordCount = 0;
        this.ended = false;
        this.finished = false;
    }

    /**
     * Processes the next record of the header.
     *
     * @param record
     *     The record.
     *
     * @return {@code true} if {@code record} was the {@code END} record, after which no more records may be given.
     *
     * @throws IllegalStateException
     *     if the {@code END} record has already been given or the header has been finished.
     * @throws InvalidHeaderException
     *     if the record cannot be processed.
     */
    public boolean accept(KeywordRecord record) throws InvalidHeaderException {
        ArgumentUtil.checkNotNull(record, "record");
        if (ended || finished) {
            throw new IllegalStateException("no records may follow the END record");
        }
        recordCount++;

        String keyword = record.keyword();
        String value = record.value();

        if (KeywordRecord.CONTINUE.equals(keyword)) {
            if (state.mode() == ParseState.Mode.EXTENDED_STRING && state.isOpen()) {
                if (value == null) {
                    throw InvalidHeaderException.noValue(KeywordRecord.CONTINUE);
                }
                state = state.append(value);
            } else if (value != null) {
                // There is no string to continue, so this is only commentary.
                appendLine(comments, value);
            }
            return false;
        }

        if (state.mode() == ParseState.Mode.EXTENDED_STRING) {
            closeExtendedString();
        }

        if (record.isEnd()) {
            ended = true;
            return true;
        }

        processRecord(record);
        return false;
    }

    private void closeExtendedString() throws InvalidHeaderException {
        String keyword = state.keyword();
        String value = state.partialValue();
        state = ParseState.SCANNING;
        putMetaTag(keyword, value);
    }

    private void processRecord(KeywordRecord record) throws InvalidHeaderException {
        String keyword = record.keyword();
        String value = record.value();

        Matcher naxisMatcher = NAXIS_KEYWORD.matcher(keyword);
        if (naxisMatcher.matches()) {
            parseNaxis(keyword, naxisMatcher.group(1), value);
            return;
        }

        switch (keyword) {
            case "SIMPLE":
                if (!ValueUtil.parseLogical(keyword, value)) {
                    throw InvalidHeaderException.nonConforming();
                }
                options.setConforming(true);
                options.setExtensionKind(ExtensionKind.PRIMARY);
                return;

            case Bitpix.KEYWORD:
                parseBitpix(value);
                return;

            case ExtensionKind.KEYWORD:
                if (value == null) {
                    throw InvalidHeaderException.noValue(keyword);
                }
                options.setExtensionKind(ExtensionKind.fromExtensionName(ValueUtil.unquote(value)));
                return;

            case "EXTEND":
                options.setExtendsFile(ValueUtil.parseLogical(keyword, value));
                return;

            case "GROUPS":
                options.setHasGroups(ValueUtil.parseLogical(keyword, value));
                return;

            case "INHERIT":
                options.setInherits(ValueUtil.parseLogical(keyword, value));
                return;

            case "PCOUNT":
                options.setParameterCount(ValueUtil.parseLong(keyword, value));
                return;

            case "GCOUNT":
                options.setGroupCount(ValueUtil.parseLong(keyword, value));
                return;

            case "THEAP":
                options.setHeapOffset(ValueUtil.parseLong(keyword, value));
                return;

            case "TFIELDS":
                int fieldCount = ValueUtil.parseCount(keyword, value);
                if (HduOptions.MAX_FIELDS < fieldCount) {
                    throw InvalidHeaderException.formatError(keyword, value,
                        "a count between 0 and " + HduOptions.MAX_FIELDS);
                }
                options.setFieldCount(fieldCount);
                return;

            case KeywordRecord.COMMENT:
                appendLine(comments, record.comment());
                return;

            case KeywordRecord.HISTORY:
                appendLine(history, record.comment());
                return;

            default:
                break;
        }

        Matcher indexedMatcher = INDEXED_KEYWORD.matcher(keyword);
        if (indexedMatcher.matches()) {
            parseIndexedKeyword(keyword, indexedMatcher.group(1), Integer.parseInt(indexedMatcher.group(2)), value);
            return;
        }

        if (value == null) {
            // blank records and keywords without a value carry nothing to store
            return;
        }

        if (ValueUtil.isString(value) && value.endsWith(ParseState.CONTINUATION_MARKER)) {
            state = ParseState.extendedString(keyword, value);
            return;
        }

        putMetaTag(keyword, value);
    }

    private void parseNaxis(String keyword, String axisDigits, String value) throws InvalidHeaderException {
        if (axisDigits.isEmpty()) {
            int naxis = ValueUtil.parseCount(keyword, value);
            if (HduOptions.MAX_FIELDS < naxis) {
                throw InvalidHeaderException.formatError(keyword, value, "a count between 0 and 999");
            }
            options.setNaxis(naxis);
            return;
        }

        // The keyword is at most eight characters, so the axis number has at most three digits.
        int axis = Integer.parseInt(axisDigits);
        int naxes = options.shapeLength();
        if (axis < 1 || naxes < axis) {
            throw InvalidHeaderException.naxisOutOfBounds(keyword, axis, naxes);
        }
        options.setAxisExtent(axis, ValueUtil.parseCount(keyword, value));
    }

    private void parseBitpix(String value) throws InvalidHeaderException {
        long code = ValueUtil.parseLong(Bitpix.KEYWORD, value);
        if (code < Integer.MIN_VALUE || Integer.MAX_VALUE < code) {
            throw InvalidHeaderException.invalidBitpix(value);
        }
        options.setBitpix(Bitpix.fromCode((int) code).code());
    }

    private void parseIndexedKeyword(String keyword, String root, int index, String value)
        throws InvalidHeaderException {
        if (root.startsWith("P")) {
            long parameterCount = options.parameterCount();
            if (index < 1 || parameterCount < index) {
                throw InvalidHeaderException.fieldOutOfBounds(keyword, index, "PCOUNT",
                    (int) Math.min(parameterCount, Integer.MAX_VALUE));
            }
            if ("PSCAL".equals(root)) {
                options.setParameterScale(index, ValueUtil.parseDouble(keyword, value));
            } else {
                options.setParameterZero(index, ValueUtil.parseDouble(keyword, value));
            }
            return;
        }

        int fieldCount = Math.max(0, options.fieldCount());
        if (index < 1 || fieldCount < index) {
            throw InvalidHeaderException.fieldOutOfBounds(keyword, index, "TFIELDS", fieldCount);
        }

        switch (root) {
            case "TBCOL":
                options.setColumnStart(index, ValueUtil.parseCount(keyword, value));
                break;
            case "TFORM":
                options.setFieldFormat(index, ValueUtil.unquote(requireValue(keyword, value)));
                break;
            case "TSCAL":
                options.setFieldScale(index, ValueUtil.parseDouble(keyword, value));
                break;
            case "TZERO":
                options.setFieldZero(index, ValueUtil.parseDouble(keyword, value));
                break;
            case "TNULL":
                options.setFieldNull(index, ValueUtil.unquote(requireValue(keyword, value)));
                break;
            case "TDISP":
                options.setFieldDisplayFormat(index, ValueUtil.unquote(requireValue(keyword, value)));
                break;
            default:
                throw new AssertionError("unhandled indexed keyword " + root);
        }
    }

    private static String requireValue(String keyword, String value) throws InvalidHeaderException {
        if (value == null) {
            throw InvalidHeaderException.noValue(keyword);
        }
        return value;
    }

    /**
     * Stores a descriptive keyword, using a typed tag for the keywords with well-known meanings.
     */
    private void putMetaTag(String keyword, String value) throws InvalidHeaderException {
        switch (keyword) {
            case "DATE":
                LocalDateTime lastModified = parseDate(keyword, value);
                if (lastModified != null) {
                    metadata.setLastModified(lastModified);
                }
                break;

            case "DATE-OBS":
                LocalDateTime creationDate = parseDate(keyword, value);
                if (creationDate != null) {
                    metadata.setCreationDate(creationDate);
                }
                break;

            case "AUTHOR":
                String author = ValueUtil.unquote(value);
                metadata.setAuthor(author);

                // The author of the data is presumed to be the author of its reference.
                ReferencePublication publication = metadata.referencePublication();
                if (publication == null) {
                    metadata.setReferencePublication(new ReferencePublication("", List.of(author)));
                } else if (publication.authors().isEmpty()) {
                    metadata.setReferencePublication(publication.withAuthors(List.of(author)));
                }
                break;

            case "REFERENC":
                String title = ValueUtil.unquote(value);
                ReferencePublication reference = metadata.referencePublication();
                if (reference == null) {
                    metadata.setReferencePublication(new ReferencePublication(title, List.of()));
                } else {
                    metadata.setReferencePublication(reference.withTitle(title));
                }
                break;

            case "TELESCOP":
                metadata.setTelescope(ValueUtil.unquote(value));
                break;

            case "INSTRUME":
                metadata.setInstrument(ValueUtil.unquote(value));
                break;

            case "OBJECT":
                metadata.setObject(ValueUtil.unquote(value));
                break;

            default:
                metadata.putTag(keyword, value);
                break;
        }
    }

    /**
     * Parses a date, honoring the strictness mode.
     *
     * @return The date, or {@code null} if it could not be parsed and was stored as a generic tag instead.
     */
    private LocalDateTime parseDate(String keyword, String value) throws InvalidHeaderException {
        try {
            return ValueUtil.parseDate(keyword, value);
        } catch (InvalidHeaderException exception) {
            if (strictness == StrictnessMode.STRICT) {
                throw exception;
            }
            log.warn("keeping unparseable {} as a generic tag: {}", keyword, exception.getMessage());
            metadata.putTag(keyword, value);
            return null;
        }
    }

    private static void appendLine(List<String> lines, String text) {
        lines.add(text == null ? "" : text);
    }

    /**
     * Completes the header.
     * <p>
     * A string value that is still being continued is stored, and the collected commentary and history are stored as
     * generic tags.
     * </p>
     *
     * @return The structural options of the header.
     *
     * @throws IllegalStateException
     *     if the header has already been finished.
     * @throws InvalidHeaderException
     *     if the final string value cannot be stored.
     */
    public HduOptions finish() throws InvalidHeaderException {
        if (finished) {
            throw new IllegalStateException("the header has already been finished");
        }
        finished = true;

        if (state.mode() == ParseState.Mode.EXTENDED_STRING) {
            closeExtendedString();
        }
        if (!comments.isEmpty()) {
            metadata.putTag(KeywordRecord.COMMENT, String.join("\n", comments));
        }
        if (!history.isEmpty()) {
            metadata.putTag(KeywordRecord.HISTORY, String.join("\n", history));
        }

        log.debug("assembled a header of {} records (END {})", recordCount, ended ? "found" : "not found");
        return options;
    }

    /**
     * @return The state between records.
     */
    ParseState state() {
        return state;
    }

    /**
     * @return The options collected so far.
     */
    HduOptions options() {
        return options;
    }

    /**
     * @return {@code true} if the {@code END} record has been given.
     */
    boolean isEnded() {
        return ended;
    }
}
