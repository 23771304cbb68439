///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.Objects;

/**
 * Where a field of an ASCII table is found within a row, how it is formatted, and what it's called.
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class TableField {

    private final int start;
    private final TableEntryFormat format;
    private final String label;

    /**
     * Creates a field description.
     *
     * @param start
     *     The 0-based offset of the field's first character within a row.
     * @param format
     *     The field's format.
     * @param label
     *     The field's label. This may be empty.
     *
     * @throws NullPointerException
     *     if {@code format} or {@code label} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code start} is negative.
     */
    public TableField(int start, TableEntryFormat format, String label) {
        ArgumentUtil.checkNotNegative(start, "start");
        ArgumentUtil.checkNotNull(format, "format");
        ArgumentUtil.checkNotNull(label, "label");

        this.start = start;
        this.format = format;
        this.label = label;
    }

    /**
     * @return The 0-based offset of the field's first character within a row.
     */
    public int start() {
        return start;
    }

    /**
     * @return The number of characters in the field.
     */
    public int width() {
        return format.width();
    }

    /**
     * @return The field's format.
     */
    public TableEntryFormat format() {
        return format;
    }

    /**
     * @return The field's label. This may be empty.
     */
    public String label() {
        return label;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, format, label);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TableField otherField)) {
            return false;
        }

        return start == otherField.start && format.equals(otherField.format) && label.equals(otherField.label);
    }

    @Override
    public String toString() {
        return "TableField{start=" + start + ", format=" + format + ", label=" + label + "}";
    }
}
