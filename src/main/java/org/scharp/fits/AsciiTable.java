///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ASCII table: an ordered list of columns, each with its own label, format, and entries.
 * <p>
 * Columns may have different numbers of entries. The table has as many rows as its longest column, and shorter
 * columns are written with blank fields in the rows they lack. A row occupies the sum of the widths of the columns.
 * </p>
 * <p>
 * Instances of this class are mutable and not thread-safe.
 * </p>
 */
public final class AsciiTable {

    private final List<Column> columns;

    /**
     * Creates a table with no columns.
     */
    public AsciiTable() {
        this.columns = new ArrayList<>();
    }

    /**
     * Creates a table from a list of columns.
     *
     * @param columns
     *     The columns. The list is copied, but the columns are not.
     *
     * @throws NullPointerException
     *     if {@code columns} is {@code null} or contains {@code null}.
     */
    public AsciiTable(List<Column> columns) {
        ArgumentUtil.checkNotNull(columns, "columns");
        this.columns = new ArrayList<>(columns.size());
        for (Column column : columns) {
            addColumn(column);
        }
    }

    /**
     * Adds a column to the right of the existing columns.
     *
     * @param column
     *     The column.
     *
     * @throws NullPointerException
     *     if {@code column} is {@code null}.
     */
    public void addColumn(Column column) {
        ArgumentUtil.checkNotNull(column, "column");
        columns.add(column);
    }

    /**
     * Adds an entry to the end of each column.
     *
     * @param row
     *     The entries, one for each column in order.
     *
     * @throws IllegalArgumentException
     *     if the number of entries is not the number of columns, or if an entry's type doesn't match its column. In
     *     this case, no column is changed.
     */
    public void addRow(List<TableEntry> row) {
        ArgumentUtil.checkNotNull(row, "row");
        if (row.size() != columns.size()) {
            throw new IllegalArgumentException(
                "row has " + row.size() + " entries but the table has " + columns.size() + " columns");
        }

        // check every entry before changing any column
        for (int i = 0; i < row.size(); i++) {
            TableEntry entry = row.get(i);
            ArgumentUtil.checkNotNull(entry, "entry");
            if (entry.type() != columns.get(i).entryType()) {
                throw new IllegalArgumentException("entry " + i + " is " + entry.type() + " but column \""
                    + columns.get(i).label() + "\" holds " + columns.get(i).entryType() + " entries");
            }
        }
        for (int i = 0; i < row.size(); i++) {
            columns.get(i).push(row.get(i));
        }
    }

    /**
     * @return The columns of this table, as an unmodifiable list.
     */
    public List<Column> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Gets a column.
     *
     * @param index
     *     The 0-based index of the column.
     *
     * @return The column.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code index} is negative or not less than {@link #columnCount()}.
     */
    public Column column(int index) {
        return columns.get(index);
    }

    /**
     * @return The number of columns.
     */
    public int columnCount() {
        return columns.size();
    }

    /**
     * @return The number of rows, which is the number of entries in the longest column.
     */
    public int rowCount() {
        int rowCount = 0;
        for (Column column : columns) {
            rowCount = Math.max(rowCount, column.size());
        }
        return rowCount;
    }

    /**
     * @return The number of characters in one row.
     */
    public int rowWidth() {
        int rowWidth = 0;
        for (Column column : columns) {
            rowWidth += column.width();
        }
        return rowWidth;
    }

    /**
     * Gets an entry.
     *
     * @param column
     *     The 0-based index of the column.
     * @param row
     *     The 0-based index of the row.
     *
     * @return The entry.
     *
     * @throws IndexOutOfBoundsException
     *     if there is no entry at ({@code column}, {@code row}).
     */
    public TableEntry entry(int column, int row) {
        if (column < 0 || columns.size() <= column || row < 0 || columns.get(column).size() <= row) {
            throw new IndexOutOfBoundsException("(" + column + ", " + row + ") is out of range for a table of "
                + columns.size() + " columns and " + rowCount() + " rows");
        }
        return columns.get(column).get(row);
    }
}
