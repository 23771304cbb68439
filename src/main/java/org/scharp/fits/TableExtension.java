///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A data unit that holds an ASCII table.
 */
public final class TableExtension extends Extension {

    private final AsciiTable table;

    TableExtension(AsciiTable table) {
        this.table = table;
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.TABLE;
    }

    /**
     * @return The table. This is not a copy.
     */
    public AsciiTable table() {
        return table;
    }

    @Override
    Bitpix bitpix() {
        return Bitpix.BYTE;
    }

    @Override
    int[] shape() {
        return new int[] { table.rowWidth(), table.rowCount() };
    }

    /**
     * {@inheritDoc}
     * <p>
     * The rows are formatted here, so that an entry which doesn't fit its column is found before anything is written.
     * </p>
     *
     * @throws TableFormatException
     *     if an entry cannot be written in its column's format.
     */
    @Override
    DataWriter prepareWrite() throws FitsException {
        byte[] rows = AsciiTableCodec.formatRows(table);
        return (writer, options) -> AsciiTableCodec.writeRows(rows, writer);
    }
}
