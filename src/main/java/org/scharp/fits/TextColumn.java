///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A column of text.
 */
public final class TextColumn implements Column {

    private static final int INITIAL_CAPACITY = 16;

    private final String label;
    private final TableEntryFormat format;
    private final List<String> values;

    TextColumn(String label, TableEntryFormat format) {
        assert format.kind() == TableEntryFormat.Kind.CHAR : "format must be CHAR";
        this.label = label;
        this.format = format;
        this.values = new ArrayList<>(INITIAL_CAPACITY);
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
        return TableEntry.EntryType.TEXT;
    }

    @Override
    public int size() {
        return values.size();
    }

    private String valueOf(TableEntry entry) {
        ArgumentUtil.checkNotNull(entry, "entry");
        if (entry.type() != TableEntry.EntryType.TEXT) {
            throw new IllegalArgumentException(
                "column \"" + label + "\" holds TEXT entries, not " + entry.type() + " entries");
        }
        return entry.asText();
    }

    @Override
    public void push(TableEntry entry) {
        values.add(valueOf(entry));
    }

    @Override
    public TableEntry pop() {
        if (values.isEmpty()) {
            throw new NoSuchElementException("column \"" + label + "\" is empty");
        }
        return TableEntry.text(values.remove(values.size() - 1));
    }

    @Override
    public TableEntry get(int row) {
        return TableEntry.text(values.get(row));
    }

    @Override
    public void set(int row, TableEntry entry) {
        Objects.checkIndex(row, values.size());
        values.set(row, valueOf(entry));
    }

    @Override
    public TableEntry remove(int row) {
        return TableEntry.text(values.remove(row));
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
    public String getText(int row) {
        return values.get(row);
    }

    @Override
    public String toAsciiField(int row) throws TableFormatException {
        return row < size() ? get(row).format(format) : TableEntry.blankField(format);
    }
}
