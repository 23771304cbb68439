///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the data unit of an ASCII table HDU and an {@link AsciiTable}.
 * <p>
 * A data unit holds the rows of the table one after another, each exactly {@code NAXIS1} characters wide, followed by
 * spaces up to the end of its last block. Each field of a row is written in the Fortran format of its column.
 * </p>
 */
final class AsciiTableCodec {

    private static final Logger log = LoggerFactory.getLogger(AsciiTableCodec.class);

    // private constructor to prevent anyone from instantiating the class.
    private AsciiTableCodec() {
    }

    /**
     * Reads every block of a table's data unit without parsing it.
     *
     * @param reader
     *     The reader, positioned at the start of the data unit.
     * @param layout
     *     The layout of the table.
     *
     * @return The data unit, including the padding of its last block.
     *
     * @throws BlockIoException
     *     if the source ends before the data unit does.
     * @throws IOException
     *     if the underlying stream fails.
     */
    static byte[] readData(FitsReader reader, TableLayout layout) throws IOException {
        return reader.readBlocks((int) layout.dataBlockCount());
    }

    /**
     * Parses the rows of a table's data unit.
     *
     * @param data
     *     The data unit. Anything after the last row is ignored.
     * @param layout
     *     The layout of the table.
     *
     * @return A new table with one column for each field of the layout.
     *
     * @throws TableFormatException
     *     if a field lies outside a row, is not valid UTF-8, or can't be parsed in its format.
     */
    static AsciiTable parseRows(byte[] data, TableLayout layout) throws TableFormatException {
        final int rowWidth = layout.rowWidth();
        final int rowCount = layout.rowCount();
        assert (long) rowWidth * rowCount <= data.length : "data is shorter than the table";

        List<Column> columns = new ArrayList<>(layout.fields().size());
        for (TableField field : layout.fields()) {
            if (rowWidth < (long) field.start() + field.width()) {
                throw new TableFormatException(TableFormatException.Reason.INDEX_OUT_OF_RANGE,
                    "field " + field + " extends past the end of a row of " + rowWidth + " characters");
            }
            columns.add(Column.create(field.label(), field.format()));
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

        for (int row = 0; row < rowCount; row++) {
            int rowOffset = row * rowWidth;
            for (int i = 0; i < columns.size(); i++) {
                TableField field = layout.fields().get(i);
                Column column = columns.get(i);

                String text;
                try {
                    text = decoder.decode(ByteBuffer.wrap(data, rowOffset + field.start(), field.width())).toString();
                } catch (CharacterCodingException exception) {
                    throw new TableFormatException(TableFormatException.Reason.MALFORMED_FIELD,
                        "field " + (i + 1) + " of row " + (row + 1) + " is not valid UTF-8", exception);
                }

                TableEntry entry = TableEntry.parse(text, field.format());
                if (entry.type() != column.entryType()) {
                    throw new TableFormatException(TableFormatException.Reason.TYPE_MISMATCH,
                        entry.type() + " entry cannot be added to column \"" + column.label() + "\" which holds "
                            + column.entryType() + " entries");
                }
                column.push(entry);
            }
        }

        log.debug("parsed {} rows of {} fields", rowCount, columns.size());
        return new AsciiTable(columns);
    }

    /**
     * Reads and parses the data unit of a table.
     *
     * @param reader
     *     The reader, positioned at the start of the data unit.
     * @param layout
     *     The layout of the table.
     *
     * @return A new table.
     *
     * @throws TableFormatException
     *     if a field can't be parsed.
     * @throws IOException
     *     if the data unit can't be read.
     */
    static AsciiTable decode(FitsReader reader, TableLayout layout) throws IOException {
        return parseRows(readData(reader, layout), layout);
    }

    /**
     * Formats the rows of a table.
     * <p>
     * Columns that are shorter than the longest one are written with blank fields.
     * </p>
     *
     * @param table
     *     The table.
     *
     * @return The rows, one after another, without padding.
     *
     * @throws TableFormatException
     *     if an entry can't be written in its column's format.
     */
    static byte[] formatRows(AsciiTable table) throws TableFormatException {
        final int rowCount = table.rowCount();
        byte[] data = new byte[Math.multiplyExact(table.rowWidth(), rowCount)];

        int offset = 0;
        for (int row = 0; row < rowCount; row++) {
            for (Column column : table.columns()) {
                String field = column.toAsciiField(row);
                assert field.length() == column.width() : "field of " + column.label() + " has the wrong width";
                WriteUtil.writeAscii(data, offset, field, column.width());
                offset += column.width();
            }
        }
        return data;
    }

    /**
     * Writes formatted rows as a data unit, padded with spaces to the end of its last block.
     *
     * @param rows
     *     The rows, as returned by {@link #formatRows}.
     * @param writer
     *     The writer, positioned after the table's header.
     *
     * @throws IOException
     *     if the underlying stream fails.
     */
    static void writeRows(byte[] rows, FitsWriter writer) throws IOException {
        writer.writeBlocksPadded(rows, rows.length, (byte) ' ');
        log.debug("encoded {} bytes of rows", rows.length);
    }

    /**
     * Writes a table as a data unit.
     * <p>
     * Nothing is written if an entry can't be formatted.
     * </p>
     *
     * @param table
     *     The table.
     * @param writer
     *     The writer, positioned after the table's header.
     *
     * @throws TableFormatException
     *     if an entry can't be written in its column's format.
     * @throws IOException
     *     if the underlying stream fails.
     */
    static void encode(AsciiTable table, FitsWriter writer) throws IOException {
        writeRows(formatRows(table), writer);
    }
}
