///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link FitsExporter}. */
public class FitsExporterTest {

    private static HeaderDataUnit primaryImage() {
        Metadata metadata = new Metadata();
        metadata.setTelescope("UIT");
        metadata.setObject("NGC4151");
        metadata.setCreationDate(LocalDateTime.of(1995, 3, 13, 6, 16, 22));
        metadata.putTag("FILTER", "'B1'");
        metadata.putTag("EXPTIME", "8355");

        // NAXIS1 = 2, NAXIS2 = 3
        ShortImage image = ShortImage.columnMajor(new int[] { 2, 3 }, new short[] { 1, 2, 3, 4, -5, 32767 });
        return new HeaderDataUnit(metadata, Extension.image(image));
    }

    private static HeaderDataUnit starTable() {
        AsciiTable table = new AsciiTable();
        table.addColumn(Column.create("NAME", TableEntryFormat.character(8)));
        table.addColumn(Column.create("MAG", TableEntryFormat.floating('F', 6, 2)));
        table.addColumn(Column.create("COUNT", TableEntryFormat.integer(4)));
        table.addRow(List.of(TableEntry.text("M31"), TableEntry.real(3.44), TableEntry.integer(7)));
        table.addRow(List.of(TableEntry.text("NGC4151"), TableEntry.real(11.48), TableEntry.integer(12)));

        Metadata metadata = new Metadata();
        metadata.putTag("EXTNAME", "'STARS'");
        return new HeaderDataUnit(metadata, Extension.table(table));
    }

    private static byte[] export(HeaderDataUnit... hdus) throws IOException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try (FitsExporter exporter = new FitsExporter(outputStream)) {
            for (HeaderDataUnit hdu : hdus) {
                exporter.writeHdu(hdu);
            }
            assertEquals(hdus.length, exporter.hduCount());
        }
        return outputStream.toByteArray();
    }

    @Test
    void testExportAndDecode() throws IOException {
        byte[] data = export(primaryImage(), starTable());

        // header, image, header, table
        assertEquals(4 * FitsReader.BLOCK_SIZE, data.length);

        List<HeaderDataUnit> hdus = HeaderDataUnit.decodeAll(new FitsReader(new ByteArrayInputStream(data)));
        assertEquals(2, hdus.size());

        HeaderDataUnit image = hdus.get(0);
        assertEquals("UIT", image.metadata().telescope());
        assertEquals("NGC4151", image.metadata().object());
        assertEquals(LocalDateTime.of(1995, 3, 13, 6, 16, 22), image.metadata().creationDate());
        assertEquals("'B1      '", image.metadata().tag("FILTER"));
        assertEquals("8355", image.metadata().tag("EXPTIME"));
        assertEquals(((ImageExtension) primaryImage().extension()).image(),
            ((ImageExtension) image.extension()).image());

        HeaderDataUnit table = hdus.get(1);
        assertEquals("'STARS   '", table.metadata().tag("EXTNAME"));
        AsciiTable decodedTable = ((TableExtension) table.extension()).table();
        assertEquals(3, decodedTable.columnCount());
        assertEquals("COUNT", decodedTable.column(2).label());
        assertEquals(TableEntry.text("NGC4151 "), decodedTable.entry(0, 1));
        assertEquals(TableEntry.real(3.44), decodedTable.entry(1, 0));
        assertEquals(TableEntry.integer(12), decodedTable.entry(2, 1));
    }

    @Test
    void testExportRoundTripIsStable() throws IOException {
        byte[] data = export(primaryImage(), starTable());
        List<HeaderDataUnit> hdus = HeaderDataUnit.decodeAll(new FitsReader(new ByteArrayInputStream(data)));

        // writing what was read produces the same bytes
        assertArrayEquals(data, export(hdus.toArray(new HeaderDataUnit[0])));
    }

    @Test
    void testTableCannotBeFirst() {
        FitsExporter exporter = new FitsExporter(new ByteArrayOutputStream());
        Exception exception = assertThrows(IllegalArgumentException.class, () -> exporter.writeHdu(starTable()));
        assertEquals("an ASCII table cannot be the primary HDU", exception.getMessage());
        assertEquals(0, exporter.hduCount());
    }

    /** Tests that an image which can't be written leaves no header behind. */
    @Test
    void testDiscontiguousImageWritesNothing() {
        short[] elements = new short[16];
        for (int i = 0; i < elements.length; i++) {
            elements[i] = (short) i;
        }
        ShortImage middleRows = ShortImage.columnMajor(new int[] { 4, 4 }, elements).slice(0, 1, 3);
        HeaderDataUnit hdu = new HeaderDataUnit(new Metadata(), Extension.image(middleRows));

        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        FitsExporter exporter = new FitsExporter(outputStream);
        Exception exception = assertThrows(UnsupportedMemoryLayoutException.class, () -> exporter.writeHdu(hdu));
        assertEquals("ShortImage[2, 4] is a discontiguous view and cannot be written", exception.getMessage());

        assertEquals(0, outputStream.size());
        assertEquals(0, exporter.hduCount());
    }

    /** Tests that a table with an entry too wide for its column leaves no header behind. */
    @Test
    void testOverflowingTableWritesNothing() throws IOException {
        AsciiTable table = new AsciiTable();
        table.addColumn(Column.create("COUNT", TableEntryFormat.integer(2)));
        table.addRow(List.of(TableEntry.integer(5)));
        table.addRow(List.of(TableEntry.integer(500)));
        HeaderDataUnit hdu = new HeaderDataUnit(new Metadata(), Extension.table(table));

        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        FitsExporter exporter = new FitsExporter(outputStream);
        exporter.writeHdu(primaryImage());
        assertEquals(2 * FitsReader.BLOCK_SIZE, outputStream.size());

        TableFormatException exception = assertThrows(TableFormatException.class, () -> exporter.writeHdu(hdu));
        assertEquals(TableFormatException.Reason.FIELD_OVERFLOW, exception.reason());

        assertEquals(2 * FitsReader.BLOCK_SIZE, outputStream.size());
        assertEquals(1, exporter.hduCount());

        // the exporter can go on after a failed HDU
        exporter.writeHdu(starTable());
        assertEquals(4 * FitsReader.BLOCK_SIZE, outputStream.size());
        assertEquals(2, HeaderDataUnit.decodeAll(
            new FitsReader(new ByteArrayInputStream(outputStream.toByteArray()))).size());
    }

    @Test
    void testWriteAfterClose() throws IOException {
        FitsExporter exporter = new FitsExporter(new ByteArrayOutputStream());
        exporter.close();

        // closing twice is harmless
        exporter.close();

        Exception exception = assertThrows(IllegalStateException.class, () -> exporter.writeHdu(primaryImage()));
        assertEquals("Cannot invoke writeHdu on closed exporter", exception.getMessage());
    }

    @Test
    void testNullArguments() {
        Exception exception = assertThrows(NullPointerException.class, () -> new FitsExporter((OutputStream) null));
        assertEquals("outputStream must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> new FitsExporter((Path) null));
        assertEquals("targetLocation must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class,
            () -> new FitsExporter(new ByteArrayOutputStream(), null));
        assertEquals("options must not be null", exception.getMessage());

        FitsExporter exporter = new FitsExporter(new ByteArrayOutputStream());
        exception = assertThrows(NullPointerException.class, () -> exporter.writeHdu(null));
        assertEquals("hdu must not be null", exception.getMessage());
    }

    @Test
    void testExportHdus() throws IOException {
        Path targetDirectory = Files.createTempDirectory("fits-export");
        Path targetLocation = targetDirectory.resolve("uit.fits");
        try {
            FitsExporter.exportHdus(targetLocation, List.of(primaryImage(), starTable()));
            assertEquals(4 * FitsReader.BLOCK_SIZE, Files.size(targetLocation));

            try (FitsReader reader = FitsReader.open(targetLocation)) {
                List<HeaderDataUnit> hdus = HeaderDataUnit.decodeAll(reader);
                assertEquals(2, hdus.size());
                assertThat(hdus.get(1).extension(), instanceOf(TableExtension.class));
            }
        } finally {
            Files.deleteIfExists(targetLocation);
            Files.delete(targetDirectory);
        }
    }

    @Test
    void testExportHdusWithNull() throws IOException {
        Path targetDirectory = Files.createTempDirectory("fits-export");
        Path targetLocation = targetDirectory.resolve("partial.fits");
        try {
            List<HeaderDataUnit> hdus = Arrays.asList(primaryImage(), null);
            Exception exception = assertThrows(NullPointerException.class,
                () -> FitsExporter.exportHdus(targetLocation, hdus));
            assertEquals("hdus must not contain a null HDU", exception.getMessage());
        } finally {
            Files.deleteIfExists(targetLocation);
            Files.delete(targetDirectory);
        }
    }

    /** Tests that an independent FITS implementation can read what is exported. */
    @Test
    void testNomTamReadsExport() throws Exception {
        byte[] data = export(primaryImage(), starTable());

        try (Fits fits = new Fits(new ByteArrayInputStream(data))) {
            BasicHDU<?> image = fits.getHDU(0);
            assertEquals(16, image.getHeader().getIntValue("BITPIX"));
            assertEquals(2, image.getHeader().getIntValue("NAXIS1"));
            assertEquals(3, image.getHeader().getIntValue("NAXIS2"));
            assertEquals("UIT", image.getHeader().getStringValue("TELESCOP"));

            // nom.tam indexes the last axis first
            short[][] kernel = (short[][]) image.getKernel();
            assertArrayEquals(new short[] { 1, 2 }, kernel[0]);
            assertArrayEquals(new short[] { 3, 4 }, kernel[1]);
            assertArrayEquals(new short[] { -5, 32767 }, kernel[2]);

            BasicHDU<?> table = fits.getHDU(1);
            assertEquals("TABLE", table.getHeader().getStringValue("XTENSION"));
            assertEquals(3, table.getHeader().getIntValue("TFIELDS"));
            assertEquals(2, table.getHeader().getIntValue("NAXIS2"));
            assertEquals("MAG", table.getHeader().getStringValue("TTYPE2"));
            assertEquals("F6.2", table.getHeader().getStringValue("TFORM2"));
        }
    }

    /** Tests reading a file written by an independent FITS implementation. */
    @Test
    void testDecodeNomTamFile() throws Exception {
        short[][] pixels = {
            { 1, 2, 3 },
            { 4, 5, 6 },
        };

        Path targetDirectory = Files.createTempDirectory("fits-nom-tam");
        Path targetLocation = targetDirectory.resolve("pixels.fits");
        try {
            try (Fits fits = new Fits()) {
                BasicHDU<?> hdu = Fits.makeHDU(pixels);
                hdu.getHeader().addValue("OBJECT", "M87", "target");
                fits.addHDU(hdu);
                fits.write(targetLocation.toFile());
            }

            try (FitsReader reader = FitsReader.open(targetLocation)) {
                HeaderDataUnit hdu = HeaderDataUnit.decode(reader);
                assertFalse(reader.hasRemaining());

                assertEquals("M87", hdu.metadata().object());
                ShortImage image = (ShortImage) ((ImageExtension) hdu.extension()).image();
                assertArrayEquals(new int[] { 3, 2 }, image.shape());
                assertEquals(2, image.get(1, 0));
                assertEquals(4, image.get(0, 1));
                assertArrayEquals(new short[] { 1, 2, 3, 4, 5, 6 }, image.toArray());
            }
        } finally {
            Files.deleteIfExists(targetLocation);
            Files.delete(targetDirectory);
        }
    }
}
