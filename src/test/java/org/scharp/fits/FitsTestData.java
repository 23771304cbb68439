///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Headers and helpers shared by the unit tests.
 */
final class FitsTestData {

    /** A header block of an image from the Ultraviolet Imaging Telescope. */
    static final String[] UIT_RECORDS = {
        "SIMPLE  =                    T  / FLIGHT22 05Apr96 RSH                          ",
        "BITPIX  =                   16  / SIGNED 16-BIT INTEGERS                        ",
        "NAXIS   =                    2  / 2-DIMENSIONAL IMAGES                          ",
        "NAXIS1  =                  512  / SAMPLES PER LINE                              ",
        "NAXIS2  =                  512  / LINES PER IMAGE                               ",
        "EXTEND  =                    T  / FILE MAY HAVE EXTENSIONS                      ",
        "DATATYPE= 'INTEGER*2'           / SAME INFORMATION AS BITPIX                    ",
        "TELESCOP= 'UIT     '            / TELECOPE USED                                 ",
        "INSTRUME= 'INTENSIFIED-FILM'    / DETECTOR USED                                 ",
        "OBJECT  = 'NGC4151 '            / TARGET NAME                                   ",
        "OBJECT2 = '_       '            / ALTERNATIVE TARGET NAME                       ",
        "CATEGORY= 'FLIGHT  '            / TARGET CATEGORY                               ",
        "JOTFID  = '8116-14 '            / ASTRO MISSION TARGET ID                       ",
        "IMAGE   = 'FUV2582 '            / IMAGE NUMBER                                  ",
        "ORIGIN  = 'UIT/GSFC'            / WHERE TAPE WRITTEN                            ",
        "ASTRO   =                    2  / ASTRO MISSION NUMBER                          ",
        "FRAMENO = 'b0582   '            / ANNOTATED FRAME NUMBER                        ",
        "CATHODE = 'CSI     '            / IMAGE TUBE PHOTOCATHODE                       ",
        "FILTER  = 'B1      '            / CAMERA/FILTER IDENTIFIER                      ",
        "PDSDATIM= '06-JUL-1995  07:20'  / MICRODENSITOMETRY DATE & TIME                 ",
        "PDSID   =                   21  / MICRODENSITOMETER IDENT                       ",
        "PDSAPERT=                   20  / MICROD. APERTURE, MICRONS                     ",
        "PDSSTEP =                   10  / MICROD. STEP SIZE, MICRONS                    ",
        "PIXELSIZ=        8.0000000E+01  / CURRENT PIXEL SIZE, MICRONS                   ",
        "EQUINOX =        2.0000000E+03  / EQUINOX OF BEST COORDINATES                   ",
        "NOMRA   =             182.0044  / 1950 I.P.S.  R.A., DEGREES                    ",
        "NOMDEC  =              39.6839  / 1950 I.P.S.  DEC., DEGREES                    ",
        "NOMROLL =             323.9500  / I.P.S. ROLL ANGLE                             ",
        "NOMSCALE=        5.6832500E+01  / NOMINAL PLATE SCL (ARCSEC/MM)                 ",
        "CALIBCON=          5.00000E-16  / PREFLIGHT LAB CALIB FOR CAMERA                ",
        "FEXPTIME= '8355    '            / EXPOSURE TIME, APPLICABLE FRM                 ",
        "DATE-OBS= '13/03/95'            / DATE OF OBSERVATION (GMT)                     ",
        "TIME-OBS=        6.2728000E+00  / TIME OF OBS (HOURS GMT)                       ",
        "BSCALE  =        2.0587209E-16  / CALIBRATION CONST                             ",
        "BUNIT   = 'ERGS/CM**2/S/ANGSTRM'                                                ",
        "END     =              0.00000  / ADDITIVE CONST FOR CALIB.                     "
    };

    private FitsTestData() {
    }

    /**
     * Lays out records as a header, padding each record to 80 characters and the last block with spaces.
     */
    static byte[] header(String... records) {
        int blockCount = (int) MathUtil.blocksFor((long) records.length * KeywordRecord.RECORD_SIZE);
        byte[] data = new byte[blockCount * FitsReader.BLOCK_SIZE];
        Arrays.fill(data, (byte) ' ');
        for (int i = 0; i < records.length; i++) {
            assert records[i].length() <= KeywordRecord.RECORD_SIZE : "TEST BUG: record is too long";
            byte[] record = records[i].getBytes(StandardCharsets.US_ASCII);
            System.arraycopy(record, 0, data, i * KeywordRecord.RECORD_SIZE, record.length);
        }
        return data;
    }

    /**
     * Formats a record with a value in fixed format.
     */
    static String record(String keyword, String value) {
        return new KeywordRecord(keyword, value, null).format();
    }

    /**
     * Pads data with zeros to a whole number of blocks.
     */
    static byte[] zeroPadded(byte[] data) {
        return Arrays.copyOf(data, (int) MathUtil.blocksFor(data.length) * FitsReader.BLOCK_SIZE);
    }

    /**
     * Joins byte arrays.
     */
    static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            stream.writeBytes(part);
        }
        return stream.toByteArray();
    }
}
