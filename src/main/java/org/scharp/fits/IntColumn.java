///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A column of integers, stored without boxing.
 */
public final class IntColumn implements Column {

    private static final int INITIAL_CAPACITY = 16;

    private final String label;
    private final TableEntryFormat format;
    private long[] values;
    private int size;

    IntColumn(String label, TableEntryFormat format) {
        assert format.kind() == TableEntryFormat.Kind.INT : "format must be INT";
        this.label = label;
        this.format = format;
        this.values = new long[INITIAL_CAPACITY];
        this.size = 0;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public TableEntryFormat format() {
        return format;
    }

    @Override
    public TableEntry.EntryType entryType() {
        return TableEntry.EntryType.INT;
    }

    @Override
    public int size() {
        return size;
    }

    private long valueOf(TableEntry entry) {
        ArgumentUtil.checkNotNull(entry, "entry");
        if (entry.type() != TableEntry.EntryType.INT) {
            throw new IllegalArgumentException(
                "column \"" + label + "\" holds INT entries, not " + entry.type() + " entries");
        }
        return entry.asLong();
    }

    @Override
    public void push(TableEntry entry) {
        long value = valueOf(entry);
        if (size == values.length) {
            values = Arrays.copyOf(values, size * 2);
        }
        values[size] = value;
        size++;
    }

    @Override
    public TableEntry pop() {
        if (size == 0) {
            throw new NoSuchElementException("column \"" + label + "\" is empty");
        }
        size--;
        return TableEntry.integer(values[size]);
    }

    @Override
    public TableEntry get(int row) {
        return TableEntry.integer(getLong(row));
    }

    @Override
    public void set(int row, TableEntry entry) {
        Objects.checkIndex(row, size);
        values[row] = valueOf(entry);
    }

    @Override
    public TableEntry remove(int row) {
        TableEntry removed = get(row);
        System.arraycopy(values, row + 1, values, row, size - row - 1);
        size--;
        return removed;
    }

    /**
     * Gets the value of an entry without wrapping it in a {@link TableEntry}.
     *
     * @param row
     *     The 0-based row of the entry.
     *
     * @return The value.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code row} is negative or not less than {@link #size()}.
     */
    public long getLong(int row) {
        Objects.checkIndex(row, size);
        return values[row];
    }

    @Override
    public String toAsciiField(int row) throws TableFormatException {
        return row < size() ? get(row).format(format) : TableEntry.blankField(format);
    }
}
