///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link ExtensionResolver}. */
public class ExtensionResolverTest {

    private static HduOptions primaryImage(int bitpix, int... shape) {
        HduOptions options = new HduOptions();
        options.setExtensionKind(ExtensionKind.PRIMARY);
        options.setConforming(true);
        options.setBitpix(bitpix);
        options.setNaxis(shape.length);
        for (int i = 0; i < shape.length; i++) {
            options.setAxisExtent(i + 1, shape[i]);
        }
        return options;
    }

    /**
     * @return The options of a table whose rows are 20 characters wide, with the fields NAME (A8 at column 1), MAG
     *     (F6.2 at column 10) and COUNT (I4 at column 17).
     */
    private static HduOptions starTable(int rowCount) {
        HduOptions options = new HduOptions();
        options.setExtensionKind(ExtensionKind.TABLE);
        options.setBitpix(8);
        options.setNaxis(2);
        options.setAxisExtent(1, 20);
        options.setAxisExtent(2, rowCount);
        options.setFieldCount(3);
        options.setColumnStart(1, 1);
        options.setFieldFormat(1, "A8");
        options.setColumnStart(2, 10);
        options.setFieldFormat(2, "F6.2");
        options.setColumnStart(3, 17);
        options.setFieldFormat(3, "I4");
        return options;
    }

    private static InvalidHeaderException assertInvalid(HduOptions options, InvalidHeaderException.Reason reason,
        String expectedMessage) {
        InvalidHeaderException exception = assertThrows(
            InvalidHeaderException.class,
            () -> ExtensionResolver.resolve(options, new Metadata()));
        assertEquals(reason, exception.reason());
        assertEquals(expectedMessage, exception.getMessage());
        return exception;
    }

    private static TableFormatException assertTableFormatError(HduOptions options,
        TableFormatException.Reason reason, String expectedMessage) {
        TableFormatException exception = assertThrows(
            TableFormatException.class,
            () -> ExtensionResolver.resolve(options, new Metadata()));
        assertEquals(reason, exception.reason());
        assertEquals(expectedMessage, exception.getMessage());
        return exception;
    }

    @Test
    void testResolvePrimaryImage() throws FitsException {
        ExtensionLayout layout = ExtensionResolver.resolve(primaryImage(16, 512, 512), new Metadata());

        ImageLayout imageLayout = assertInstanceOf(ImageLayout.class, layout);
        assertEquals(ExtensionKind.IMAGE, imageLayout.kind());
        assertEquals(Bitpix.SHORT, imageLayout.bitpix());
        assertArrayEquals(new int[] { 512, 512 }, imageLayout.shape());
        assertEquals(262144, imageLayout.elementCount());
        assertTrue(imageLayout.hasData());

        // 524288 bytes need 183 blocks
        assertEquals(183, imageLayout.dataBlockCount());
    }

    @Test
    void testResolveImageExtension() throws FitsException {
        HduOptions options = primaryImage(-64, 3, 4, 5);
        options.setExtensionKind(ExtensionKind.IMAGE);

        ImageLayout layout = (ImageLayout) ExtensionResolver.resolve(options, new Metadata());
        assertEquals(Bitpix.DOUBLE, layout.bitpix());
        assertEquals(60, layout.elementCount());
        assertEquals(1, layout.dataBlockCount());
    }

    @Test
    void testResolveWithoutAxes() throws FitsException {
        ImageLayout layout = (ImageLayout) ExtensionResolver.resolve(primaryImage(8), new Metadata());
        assertFalse(layout.hasData());
        assertEquals(0, layout.dataBlockCount());
    }

    @Test
    void testResolveEmptyAxis() throws FitsException {
        ImageLayout layout = (ImageLayout) ExtensionResolver.resolve(primaryImage(32, 10, 0), new Metadata());
        assertEquals(0, layout.elementCount());
        assertEquals(0, layout.dataBlockCount());
    }

    @Test
    void testMissingSimple() {
        HduOptions options = primaryImage(8, 10);
        options.setExtensionKind(null);
        InvalidHeaderException exception = assertInvalid(options, InvalidHeaderException.Reason.MISSING_KEYWORD,
            "header is missing SIMPLE");
        assertEquals("SIMPLE", exception.keyword());
    }

    @Test
    void testMissingBitpix() {
        assertInvalid(primaryImage(0, 10), InvalidHeaderException.Reason.MISSING_KEYWORD, "header is missing BITPIX");

        HduOptions table = starTable(2);
        table.setBitpix(0);
        assertInvalid(table, InvalidHeaderException.Reason.MISSING_KEYWORD, "header is missing BITPIX");
    }

    @Test
    void testInvalidBitpix() {
        InvalidHeaderException exception = assertInvalid(primaryImage(24, 10),
            InvalidHeaderException.Reason.INVALID_BITPIX, "BITPIX = 24 is not one of 8, 16, 32, 64, -32, -64");
        assertEquals("24", exception.value());

        // a table must be made of characters
        HduOptions table = starTable(2);
        table.setBitpix(16);
        assertInvalid(table, InvalidHeaderException.Reason.INVALID_BITPIX,
            "BITPIX = 16 is not one of 8, 16, 32, 64, -32, -64");
    }

    @Test
    void testMissingNaxis() {
        HduOptions options = new HduOptions();
        options.setExtensionKind(ExtensionKind.PRIMARY);
        options.setBitpix(8);
        assertInvalid(options, InvalidHeaderException.Reason.MISSING_KEYWORD, "header is missing NAXIS");
    }

    @Test
    void testInvalidPCountAndGCount() {
        HduOptions options = primaryImage(8, 10);
        options.setParameterCount(4);
        InvalidHeaderException exception = assertInvalid(options, InvalidHeaderException.Reason.INVALID_PCOUNT,
            "PCOUNT = 4 but the extension requires 0");
        assertEquals("PCOUNT", exception.keyword());

        options = primaryImage(8, 10);
        options.setGroupCount(3);
        assertInvalid(options, InvalidHeaderException.Reason.INVALID_GCOUNT,
            "GCOUNT = 3 but the extension requires 1");

        HduOptions table = starTable(2);
        table.setGroupCount(0);
        assertInvalid(table, InvalidHeaderException.Reason.INVALID_GCOUNT, "GCOUNT = 0 but the extension requires 1");
    }

    @Test
    void testArrayTooLarge() {
        InvalidHeaderException exception = assertInvalid(primaryImage(8, 100000, 100000),
            InvalidHeaderException.Reason.ARRAY_TOO_LARGE, "an array of shape [100000, 100000] has too many elements");
        assertEquals("[100000, 100000]", exception.value());

        // the product overflows a long
        assertInvalid(primaryImage(8, Integer.MAX_VALUE, Integer.MAX_VALUE, Integer.MAX_VALUE),
            InvalidHeaderException.Reason.ARRAY_TOO_LARGE,
            "an array of shape [2147483647, 2147483647, 2147483647] has too many elements");
    }

    @Test
    void testUnsupportedExtensions() {
        HduOptions groups = primaryImage(16, 0, 3);
        groups.setHasGroups(true);
        InvalidHeaderException exception = assertInvalid(groups, InvalidHeaderException.Reason.UNSUPPORTED_EXTENSION,
            "GROUPS extensions are not supported");
        assertEquals("GROUPS", exception.keyword());

        for (ExtensionKind kind : List.of(ExtensionKind.BINTABLE, ExtensionKind.FOREIGN, ExtensionKind.DUMP)) {
            HduOptions options = primaryImage(8, 10);
            options.setExtensionKind(kind);
            exception = assertInvalid(options, InvalidHeaderException.Reason.UNSUPPORTED_EXTENSION,
                kind + " extensions are not supported");
            assertEquals("XTENSION", exception.keyword());
            assertEquals(kind.name(), exception.value());
        }
    }

    @Test
    void testResolveTable() throws FitsException {
        Metadata metadata = new Metadata();
        metadata.putTag("TTYPE1", "'NAME    '");
        metadata.putTag("TTYPE2", "'MAG'");

        ExtensionLayout layout = ExtensionResolver.resolve(starTable(5), metadata);
        TableLayout tableLayout = assertInstanceOf(TableLayout.class, layout);
        assertEquals(ExtensionKind.TABLE, tableLayout.kind());
        assertEquals(20, tableLayout.rowWidth());
        assertEquals(5, tableLayout.rowCount());
        assertEquals(1, tableLayout.dataBlockCount());

        // TBCOLn is converted to a 0-based start and a field without TTYPEn has an empty label
        assertEquals(List.of(
                new TableField(0, TableEntryFormat.character(8), "NAME"),
                new TableField(9, TableEntryFormat.floating('F', 6, 2), "MAG"),
                new TableField(16, TableEntryFormat.integer(4), "")),
            tableLayout.fields());
    }

    @Test
    void testResolveTableLabelIndirection() throws FitsException {
        Metadata metadata = new Metadata();
        metadata.putTag("TTYPE1", "'STARNAME'");
        metadata.putTag("STARNAME", "'Catalog designation'");
        metadata.putTag("TTYPE2", "'MAG'");
        metadata.putTag("TTYPE3", "''");

        TableLayout layout = (TableLayout) ExtensionResolver.resolve(starTable(1), metadata);
        assertEquals("Catalog designation", layout.fields().get(0).label());
        assertEquals("MAG", layout.fields().get(1).label());
        assertEquals("", layout.fields().get(2).label());
    }

    @Test
    void testResolveEmptyTable() throws FitsException {
        HduOptions options = starTable(0);
        options.setFieldCount(0);
        TableLayout layout = (TableLayout) ExtensionResolver.resolve(options, new Metadata());
        assertEquals(0, layout.rowCount());
        assertEquals(List.of(), layout.fields());
        assertEquals(0, layout.dataBlockCount());
    }

    @Test
    void testTableRequiresTwoAxes() {
        HduOptions options = starTable(2);
        options.setNaxis(1);
        options.setAxisExtent(1, 20);
        InvalidHeaderException exception = assertInvalid(options, InvalidHeaderException.Reason.INVALID_NAXIS,
            "NAXIS = 1 but the extension requires 2");
        assertEquals("1", exception.value());
    }

    @Test
    void testTableMissingKeywords() {
        HduOptions withoutFields = new HduOptions();
        withoutFields.setExtensionKind(ExtensionKind.TABLE);
        withoutFields.setBitpix(8);
        withoutFields.setNaxis(2);
        assertInvalid(withoutFields, InvalidHeaderException.Reason.MISSING_KEYWORD, "header is missing TFIELDS");

        HduOptions withoutColumn = starTable(2);
        withoutColumn.setColumnStart(2, 0);
        assertInvalid(withoutColumn, InvalidHeaderException.Reason.MISSING_KEYWORD, "header is missing TBCOL2");

        HduOptions withoutFormat = starTable(2);
        withoutFormat.setFieldFormat(3, null);
        assertInvalid(withoutFormat, InvalidHeaderException.Reason.MISSING_KEYWORD, "header is missing TFORM3");
    }

    @Test
    void testTableInvalidFormat() {
        HduOptions options = starTable(2);
        options.setFieldFormat(2, "F6.7");
        assertTableFormatError(options, TableFormatException.Reason.INVALID_FORTRAN_FORMAT_CODE,
            "TFORM2 = 'F6.7' is not a valid Fortran format code");

        options.setFieldFormat(2, "1PE12.4");
        assertTableFormatError(options, TableFormatException.Reason.INVALID_FORTRAN_FORMAT_CODE,
            "TFORM2 = '1PE12.4' is not a valid Fortran format code");
    }

    @Test
    void testTableFieldEndingAtEndOfRow() throws FitsException {
        TableLayout layout = (TableLayout) ExtensionResolver.resolve(starTableWithField(1, 13, "A8"), new Metadata());
        assertEquals(12, layout.fields().get(0).start());
    }

    @Test
    void testTableFieldPastEndOfRow() {
        HduOptions options = starTable(2);
        options.setColumnStart(3, 18);
        assertTableFormatError(options, TableFormatException.Reason.INDEX_OUT_OF_RANGE,
            "field 3 (TBCOL3 = 18, TFORM3 = I4) extends past the end of a row of 20 characters");

        assertTableFormatError(starTableWithField(1, 14, "A8"), TableFormatException.Reason.INDEX_OUT_OF_RANGE,
            "field 1 (TBCOL1 = 14, TFORM1 = A8) extends past the end of a row of 20 characters");
    }

    private static HduOptions starTableWithField(int field, int columnStart, String format) {
        HduOptions options = starTable(1);
        options.setColumnStart(field, columnStart);
        options.setFieldFormat(field, format);
        return options;
    }
}
