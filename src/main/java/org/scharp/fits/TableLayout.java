///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.List;

/**
 * The layout of an ASCII table: the width of a row, the number of rows, and where each field is in a row.
 */
public final class TableLayout extends ExtensionLayout {

    private final int rowWidth;
    private final int rowCount;
    private final List<TableField> fields;

    TableLayout(int rowWidth, int rowCount, List<TableField> fields) {
        this.rowWidth = rowWidth;
        this.rowCount = rowCount;
        this.fields = List.copyOf(fields);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.TABLE;
    }

    /**
     * @return The number of characters in a row ({@code NAXIS1}).
     */
    public int rowWidth() {
        return rowWidth;
    }

    /**
     * @return The number of rows ({@code NAXIS2}).
     */
    public int rowCount() {
        return rowCount;
    }

    /**
     * @return The fields of a row, in the order of their {@code TBCOLn} keywords, as an unmodifiable list.
     */
    public List<TableField> fields() {
        return fields;
    }

    @Override
    public long dataBlockCount() {
        return MathUtil.blocksFor((long) rowWidth * rowCount);
    }
}
