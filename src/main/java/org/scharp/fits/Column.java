///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A column of an ASCII table: a label, a field format, and a sequence of entries that all have the type of the
 * format.
 */
public interface Column {

    /**
     * Creates an empty column for a format.
     *
     * @param label
     *     The column's label. This may be empty but must not be {@code null}.
     * @param format
     *     The format of the column's fields.
     *
     * @return A text, integer, or floating point column, according to the format.
     *
     * @throws NullPointerException
     *     if {@code label} or {@code format} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code format} is invalid.
     */
    static Column create(String label, TableEntryFormat format) {
        ArgumentUtil.checkNotNull(label, "label");
        ArgumentUtil.checkNotNull(format, "format");
        switch (format.kind()) {
            case CHAR:
                return new TextColumn(label, format);
            case INT:
                return new IntColumn(label, format);
            case FLOAT:
                return new FloatColumn(label, format);
            default:
                throw new IllegalArgumentException("format " + format + " is not a valid Fortran format code");
        }
    }

    /**
     * @return The column's label. This may be empty.
     */
    String label();

    /**
     * @return The format of the column's fields.
     */
    TableEntryFormat format();

    /**
     * @return The type of every entry in this column.
     */
    TableEntry.EntryType entryType();

    /**
     * @return The width of the column's fields in characters.
     */
    default int width() {
        return format().width();
    }

    /**
     * @return The number of entries in this column.
     */
    int size();

    /**
     * Adds an entry to the end of this column.
     *
     * @param entry
     *     The entry.
     *
     * @throws IllegalArgumentException
     *     if the entry's type is not this column's type.
     */
    void push(TableEntry entry);

    /**
     * Removes the last entry of this column.
     *
     * @return The removed entry.
     *
     * @throws java.util.NoSuchElementException
     *     if this column is empty.
     */
    TableEntry pop();

    /**
     * Gets an entry.
     *
     * @param row
     *     The 0-based row of the entry.
     *
     * @return The entry.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code row} is negative or not less than {@link #size()}.
     */
    TableEntry get(int row);

    /**
     * Replaces an entry.
     *
     * @param row
     *     The 0-based row of the entry.
     * @param entry
     *     The new entry.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code row} is negative or not less than {@link #size()}.
     * @throws IllegalArgumentException
     *     if the entry's type is not this column's type.
     */
    void set(int row, TableEntry entry);

    /**
     * Removes an entry, moving the entries after it up by one row.
     *
     * @param row
     *     The 0-based row of the entry.
     *
     * @return The removed entry.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code row} is negative or not less than {@link #size()}.
     */
    TableEntry remove(int row);

    /**
     * Formats an entry as the text of its field.
     *
     * @param row
     *     The 0-based row. A row at or after the end of this column gives a blank field.
     *
     * @return Exactly {@link #width()} ASCII characters.
     *
     * @throws TableFormatException
     *     if the entry cannot be written in the field.
     */
    String toAsciiField(int row) throws TableFormatException;
}
