///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Checks the options of a finished header against the rules of the FITS standard for its kind of extension, and
 * describes the data that follows it.
 */
final class ExtensionResolver {

    private static final Logger log = LoggerFactory.getLogger(ExtensionResolver.class);

    /** The largest number of elements that a Java array can reliably hold. */
    private static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    // private constructor to prevent anyone from instantiating the class.
    private ExtensionResolver() {
    }

    /**
     * Describes the data that follows a header.
     *
     * @param options
     *     The header's options.
     * @param metadata
     *     The header's metadata, in which the column labels of a table are found.
     *
     * @return An {@link ImageLayout} or a {@link TableLayout}.
     *
     * @throws InvalidHeaderException
     *     if the options are not valid for their extension, or describe an extension that is not supported.
     * @throws TableFormatException
     *     if a table field has an invalid format or does not fit within a row.
     */
    static ExtensionLayout resolve(HduOptions options, MetaContainer metadata) throws FitsException {
        ExtensionKind kind = options.extensionKind();
        if (kind == null) {
            throw InvalidHeaderException.missingKeyword("SIMPLE");
        }
        if (kind == ExtensionKind.PRIMARY) {
            kind = options.hasGroups() ? ExtensionKind.GROUPS : ExtensionKind.IMAGE;
        }

        ExtensionLayout layout;
        switch (kind) {
            case IMAGE:
                layout = resolveImage(options);
                break;
            case TABLE:
                layout = resolveTable(options, metadata);
                break;
            default:
                throw InvalidHeaderException.unsupportedExtension(kind);
        }

        log.debug("resolved {} data of {} blocks", layout.kind(), layout.dataBlockCount());
        return layout;
    }

    private static ImageLayout resolveImage(HduOptions options) throws InvalidHeaderException {
        if (options.bitpix() == 0) {
            throw InvalidHeaderException.missingKeyword(Bitpix.KEYWORD);
        }
        Bitpix bitpix = Bitpix.fromCode(options.bitpix());

        int[] shape = checkShape(options);
        checkSingleGroup(options);

        int elementCount;
        try {
            long product = MathUtil.product(shape);
            if (MAX_ARRAY_LENGTH < product) {
                throw InvalidHeaderException.arrayTooLarge(Arrays.toString(shape));
            }
            elementCount = (int) product;
        } catch (ArithmeticException exception) {
            throw InvalidHeaderException.arrayTooLarge(Arrays.toString(shape));
        }

        return new ImageLayout(bitpix, shape, elementCount);
    }

    private static int[] checkShape(HduOptions options) throws InvalidHeaderException {
        if (options.naxis() == HduOptions.UNSET) {
            throw InvalidHeaderException.missingKeyword("NAXIS");
        }
        if (options.naxis() != options.shapeLength()) {
            throw InvalidHeaderException.naxisOutOfBounds("NAXIS", options.shapeLength(), options.naxis());
        }
        return options.shape();
    }

    private static void checkSingleGroup(HduOptions options) throws InvalidHeaderException {
        if (options.parameterCount() != 0) {
            throw InvalidHeaderException.invalidPCount(options.parameterCount(), 0);
        }
        if (options.groupCount() != 1) {
            throw InvalidHeaderException.invalidGCount(options.groupCount(), 1);
        }
    }

    private static TableLayout resolveTable(HduOptions options, MetaContainer metadata) throws FitsException {
        if (options.bitpix() == 0) {
            throw InvalidHeaderException.missingKeyword(Bitpix.KEYWORD);
        }
        if (options.bitpix() != Bitpix.BYTE.code()) {
            throw InvalidHeaderException.invalidBitpix(Integer.toString(options.bitpix()));
        }

        int[] shape = checkShape(options);
        if (shape.length != 2) {
            throw InvalidHeaderException.invalidNaxis(shape.length, 2);
        }
        checkSingleGroup(options);

        if (options.fieldCount() == HduOptions.UNSET) {
            throw InvalidHeaderException.missingKeyword("TFIELDS");
        }

        int rowWidth = shape[0];
        int rowCount = shape[1];
        long dataSize = MathUtil.blocksFor((long) rowWidth * rowCount) * FitsReader.BLOCK_SIZE;
        if (MAX_ARRAY_LENGTH < dataSize) {
            throw InvalidHeaderException.arrayTooLarge(Arrays.toString(shape));
        }

        List<TableField> fields = new ArrayList<>(options.fieldCount());
        for (int field = 1; field <= options.fieldCount(); field++) {
            int columnStart = options.columnStart(field);
            if (columnStart == 0) {
                throw InvalidHeaderException.missingKeyword("TBCOL" + field);
            }
            String code = options.fieldFormat(field);
            if (code == null) {
                throw InvalidHeaderException.missingKeyword("TFORM" + field);
            }

            TableEntryFormat format = TableEntryFormat.fromFortranCode(code);
            if (!format.isValid()) {
                throw new TableFormatException(TableFormatException.Reason.INVALID_FORTRAN_FORMAT_CODE,
                    "TFORM" + field + " = '" + code + "' is not a valid Fortran format code");
            }

            // TBCOLn is 1-based
            int start = columnStart - 1;
            if (rowWidth < (long) start + format.width()) {
                throw new TableFormatException(TableFormatException.Reason.INDEX_OUT_OF_RANGE,
                    "field " + field + " (TBCOL" + field + " = " + columnStart + ", TFORM" + field + " = " + format
                        + ") extends past the end of a row of " + rowWidth + " characters");
            }

            fields.add(new TableField(start, format, label(metadata, field)));
        }

        return new TableLayout(rowWidth, rowCount, fields);
    }

    /**
     * Finds the label of a table field.
     * <p>
     * The value of {@code TTYPEn} names the field. If the header also has a keyword by that name, the value of that
     * keyword is the label instead.
     * </p>
     */
    private static String label(MetaContainer metadata, int field) {
        String rawName = metadata.tag("TTYPE" + field);
        if (rawName == null) {
            return "";
        }

        String name = ValueUtil.unquote(rawName);
        String indirect = name.isEmpty() ? null : metadata.tag(name);
        return indirect == null ? name : ValueUtil.unquote(indirect);
    }
}
