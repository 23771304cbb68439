///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A table data unit that was read but whose rows could not be parsed.
 * <p>
 * The raw bytes are kept so that a caller can inspect them. A corrupted data unit cannot be written.
 * </p>
 */
public final class CorruptedExtension extends Extension {

    private final TableLayout layout;
    private final byte[] rawData;
    private final TableFormatException cause;

    CorruptedExtension(TableLayout layout, byte[] rawData, TableFormatException cause) {
        this.layout = layout;
        this.rawData = rawData;
        this.cause = cause;
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.TABLE;
    }

    /**
     * @return The layout that the header described.
     */
    public TableLayout layout() {
        return layout;
    }

    /**
     * @return A copy of the data unit, including the padding of its last block.
     */
    public byte[] rawData() {
        return rawData.clone();
    }

    /**
     * @return The error that was found while parsing the rows.
     */
    public TableFormatException cause() {
        return cause;
    }

    @Override
    Bitpix bitpix() {
        return Bitpix.BYTE;
    }

    @Override
    int[] shape() {
        return new int[] { layout.rowWidth(), layout.rowCount() };
    }

    /**
     * Always fails, because a corrupted data unit is never written.
     *
     * @throws FitsException
     *     always.
     */
    @Override
    DataWriter prepareWrite() throws FitsException {
        throw new FitsException("a corrupted table cannot be written", cause);
    }
}
