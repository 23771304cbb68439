///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes the header of an HDU.
 * <p>
 * The structural keywords are derived from the data unit, not copied from the header that was read, so that a header
 * always describes the data that follows it. The descriptive keywords come from the metadata.
 * </p>
 */
final class HeaderEncoder {

    private static final Logger log = LoggerFactory.getLogger(HeaderEncoder.class);

    /** The number of characters of free text in a COMMENT or HISTORY record. */
    private static final int FREE_TEXT_WIDTH = KeywordRecord.RECORD_SIZE - KeywordRecord.KEYWORD_LENGTH;

    /** The longest raw value that fits in one record. */
    private static final int MAX_VALUE_WIDTH = KeywordRecord.RECORD_SIZE - 10;

    /** The number of characters of a long string that go in each record, leaving room for {@code '} and {@code &'}. */
    private static final int CONTINUED_CHUNK_WIDTH = MAX_VALUE_WIDTH - 3;

    private static final Set<String> STRUCTURAL_KEYWORDS = Set.of(
        "SIMPLE", Bitpix.KEYWORD, ExtensionKind.KEYWORD, "EXTEND", "GROUPS", "INHERIT", "PCOUNT", "GCOUNT", "THEAP",
        "TFIELDS", KeywordRecord.COMMENT, KeywordRecord.HISTORY, KeywordRecord.CONTINUE, KeywordRecord.END);

    private static final Pattern STRUCTURAL_INDEXED_KEYWORD = Pattern.compile(
        "^(NAXIS|TBCOL|TFORM|TSCAL|TZERO|TNULL|TDISP|PSCAL|PZERO)\\d*$");

    private static final Pattern FIELD_LABEL_KEYWORD = Pattern.compile("^TTYPE\\d+$");

    // private constructor to prevent anyone from instantiating the class.
    private HeaderEncoder() {
    }

    /**
     * Derives the structural options of a data unit.
     *
     * @param extension
     *     The data unit, or {@code null} for a header without data.
     *
     * @return New options.
     */
    static HduOptions describe(Extension extension) {
        HduOptions options = new HduOptions();
        options.setExtensionKind(extension == null ? ExtensionKind.IMAGE : extension.kind());
        options.setBitpix(extension == null ? Bitpix.BYTE.code() : extension.bitpix().code());

        int[] shape = extension == null ? new int[0] : extension.shape();
        options.setNaxis(shape.length);
        for (int axis = 0; axis < shape.length; axis++) {
            options.setAxisExtent(axis + 1, shape[axis]);
        }

        if (extension instanceof TableExtension tableExtension) {
            AsciiTable table = tableExtension.table();
            options.setFieldCount(table.columnCount());
            int start = 1;
            for (int field = 1; field <= table.columnCount(); field++) {
                Column column = table.column(field - 1);
                options.setColumnStart(field, start);
                options.setFieldFormat(field, column.format().toFortranCode());
                start += column.width();
            }
        } else if (extension instanceof CorruptedExtension corruptedExtension) {
            List<TableField> fields = corruptedExtension.layout().fields();
            options.setFieldCount(fields.size());
            for (int field = 1; field <= fields.size(); field++) {
                options.setColumnStart(field, fields.get(field - 1).start() + 1);
                options.setFieldFormat(field, fields.get(field - 1).format().toFortranCode());
            }
        }

        return options;
    }

    /**
     * Builds the records of a header, not including {@code END}.
     *
     * @param header
     *     The header whose metadata and field options are written.
     * @param extension
     *     The data unit that follows the header, or {@code null} if there is none.
     * @param primary
     *     {@code true} if this is the first HDU of a file.
     *
     * @return The records.
     *
     * @throws IllegalArgumentException
     *     if {@code primary} is {@code true} but the data unit is a table.
     */
    static List<KeywordRecord> records(Header header, Extension extension, boolean primary) {
        if (primary && extension != null && extension.kind() == ExtensionKind.TABLE) {
            throw new IllegalArgumentException("an ASCII table cannot be the primary HDU");
        }

        HduOptions derived = describe(extension);
        List<KeywordRecord> records = new ArrayList<>();
        Set<String> written = new HashSet<>();

        // mandatory keywords, in the order that the FITS standard requires
        if (primary) {
            add(records, written, "SIMPLE", "T");
        } else {
            add(records, written, ExtensionKind.KEYWORD, ValueUtil.quote(derived.extensionKind().extensionName()));
        }
        add(records, written, Bitpix.KEYWORD, Integer.toString(derived.bitpix()));
        add(records, written, "NAXIS", Integer.toString(derived.naxis()));
        int[] shape = derived.shape();
        for (int axis = 0; axis < shape.length; axis++) {
            add(records, written, "NAXIS" + (axis + 1), Integer.toString(shape[axis]));
        }
        if (primary) {
            add(records, written, "EXTEND", "T");
        } else {
            add(records, written, "PCOUNT", "0");
            add(records, written, "GCOUNT", "1");
        }

        if (derived.fieldCount() != HduOptions.UNSET) {
            addTableKeywords(records, written, derived, header, extension);
        }

        addTypedTags(records, written, header.metadata());
        addGenericTags(records, written, header.metadata());
        return records;
    }

    private static void addTableKeywords(List<KeywordRecord> records, Set<String> written, HduOptions derived,
        Header header, Extension extension) {

        HduOptions stored = header.options();
        boolean sameFields = stored.fieldCount() == derived.fieldCount();

        add(records, written, "TFIELDS", Integer.toString(derived.fieldCount()));
        for (int field = 1; field <= derived.fieldCount(); field++) {
            String label = fieldLabel(extension, field);
            if (!label.isEmpty()) {
                add(records, written, "TTYPE" + field, ValueUtil.quote(label));
            }
            add(records, written, "TBCOL" + field, Integer.toString(derived.columnStart(field)));
            add(records, written, "TFORM" + field, ValueUtil.quote(derived.fieldFormat(field)));

            if (sameFields) {
                if (stored.fieldScale(field) != 1.0) {
                    add(records, written, "TSCAL" + field, Double.toString(stored.fieldScale(field)));
                }
                if (stored.fieldZero(field) != 0.0) {
                    add(records, written, "TZERO" + field, Double.toString(stored.fieldZero(field)));
                }
                if (stored.fieldNull(field) != null) {
                    add(records, written, "TNULL" + field, ValueUtil.quote(stored.fieldNull(field)));
                }
                if (stored.fieldDisplayFormat(field) != null) {
                    add(records, written, "TDISP" + field, ValueUtil.quote(stored.fieldDisplayFormat(field)));
                }
            }
        }
    }

    private static String fieldLabel(Extension extension, int field) {
        if (extension instanceof TableExtension tableExtension) {
            return tableExtension.table().column(field - 1).label();
        }
        return ((CorruptedExtension) extension).layout().fields().get(field - 1).label();
    }

    private static void addTypedTags(List<KeywordRecord> records, Set<String> written, Metadata metadata) {
        if (metadata.lastModified() != null) {
            add(records, written, "DATE", ValueUtil.formatDate(metadata.lastModified()));
        }
        if (metadata.creationDate() != null) {
            add(records, written, "DATE-OBS", ValueUtil.formatDate(metadata.creationDate()));
        }

        ReferencePublication publication = metadata.referencePublication();
        if (metadata.author() != null) {
            addString(records, written, "AUTHOR", metadata.author());
        } else if (publication != null && !publication.authors().isEmpty()) {
            addString(records, written, "AUTHOR", String.join(", ", publication.authors()));
        }
        if (publication != null && !publication.title().isEmpty()) {
            addString(records, written, "REFERENC", publication.title());
        }

        if (metadata.telescope() != null) {
            addString(records, written, "TELESCOP", metadata.telescope());
        }
        if (metadata.instrument() != null) {
            addString(records, written, "INSTRUME", metadata.instrument());
        }
        if (metadata.object() != null) {
            addString(records, written, "OBJECT", metadata.object());
        }
    }

    private static void addGenericTags(List<KeywordRecord> records, Set<String> written, Metadata metadata) {
        for (Map.Entry<String, String> tag : metadata.tags().entrySet()) {
            String keyword = tag.getKey();
            if (written.contains(keyword) || isStructural(keyword)) {
                continue;
            }
            if (FIELD_LABEL_KEYWORD.matcher(keyword).matches()) {
                // field labels are written with the table's columns
                continue;
            }

            String rawValue = tag.getValue();
            if (ValueUtil.isString(rawValue)) {
                addString(records, written, keyword, ValueUtil.unquote(rawValue));
            } else {
                add(records, written, keyword, rawValue);
            }
        }

        String comments = metadata.tag(KeywordRecord.COMMENT);
        if (comments != null) {
            for (String text : wrap(comments)) {
                records.add(KeywordRecord.comment(text));
            }
        }
        String history = metadata.tag(KeywordRecord.HISTORY);
        if (history != null) {
            for (String text : wrap(history)) {
                records.add(KeywordRecord.history(text));
            }
        }
    }

    private static boolean isStructural(String keyword) {
        return STRUCTURAL_KEYWORDS.contains(keyword) || STRUCTURAL_INDEXED_KEYWORD.matcher(keyword).matches();
    }

    private static void add(List<KeywordRecord> records, Set<String> written, String keyword, String rawValue) {
        records.add(new KeywordRecord(keyword, rawValue, null));
        written.add(keyword);
    }

    /**
     * Adds a string value, spreading it over {@code CONTINUE} records if it doesn't fit in one.
     */
    private static void addString(List<KeywordRecord> records, Set<String> written, String keyword, String text) {
        String quoted = ValueUtil.quote(text);
        if (quoted.length() <= MAX_VALUE_WIDTH) {
            add(records, written, keyword, quoted);
            return;
        }

        List<String> chunks = new ArrayList<>();
        StringBuilder chunk = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String escaped = c == '\'' ? "''" : String.valueOf(c);

            // a doubled quote is never split between records
            if (CONTINUED_CHUNK_WIDTH < chunk.length() + escaped.length()) {
                chunks.add(chunk.toString());
                chunk.setLength(0);
            }
            chunk.append(escaped);
        }
        chunks.add(chunk.toString());

        for (int i = 0; i < chunks.size(); i++) {
            boolean last = i == chunks.size() - 1;
            String rawValue = "'" + chunks.get(i) + (last ? "'" : ParseState.CONTINUATION_MARKER);
            if (i == 0) {
                add(records, written, keyword, rawValue);
            } else {
                records.add(new KeywordRecord(KeywordRecord.CONTINUE, rawValue, null));
            }
        }
    }

    /**
     * Splits free text into lines which fit in a COMMENT or HISTORY record.
     */
    private static List<String> wrap(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            if (line.isEmpty()) {
                lines.add(line);
                continue;
            }
            for (int start = 0; start < line.length(); start += FREE_TEXT_WIDTH) {
                lines.add(line.substring(start, Math.min(line.length(), start + FREE_TEXT_WIDTH)));
            }
        }
        return lines;
    }

    /**
     * Writes the records of a header, followed by {@code END} and spaces to the end of its last block.
     *
     * @param records
     *     The records, not including {@code END}.
     * @param writer
     *     The writer.
     *
     * @return The number of blocks written.
     *
     * @throws InvalidHeaderException
     *     if a record cannot be written. Nothing is written in this case.
     * @throws IOException
     *     if the underlying stream fails.
     */
    static int write(List<KeywordRecord> records, FitsWriter writer) throws IOException {
        byte[] data = new byte[(records.size() + 1) * KeywordRecord.RECORD_SIZE];
        int offset = 0;
        for (KeywordRecord record : records) {
            record.checkWritable();
            record.writeTo(data, offset);
            offset += KeywordRecord.RECORD_SIZE;
        }
        KeywordRecord.end().writeTo(data, offset);

        writer.writeBlocksPadded(data, data.length, (byte) ' ');

        int blockCount = (int) MathUtil.blocksFor(data.length);
        log.debug("wrote a header of {} records in {} blocks", records.size() + 1, blockCount);
        return blockCount;
    }
}
