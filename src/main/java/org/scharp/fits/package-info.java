///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library reads and writes FITS (Flexible Image Transport System) files.
 * </p>
 *
 * <p>
 * See the documentation for {@link org.scharp.fits.HeaderDataUnit} for reading a FITS file and
 * {@link org.scharp.fits.FitsExporter} for writing one.
 * </p>
 *
 * <h2>A FITS Primer for Java Programmers</h2>
 *
 * <p>
 * A FITS file is a sequence of 2880-byte blocks. The blocks hold a sequence of "header data units" (HDUs), each of which
 * is a header followed by an optional data unit. A header is a sequence of 80-character records, 36 per block, of the
 * form {@code KEYWORD = value / comment}, ending with an {@code END} record. The first HDU is the "primary" HDU. The
 * HDUs after it are "extensions", and their first record names their kind with {@code XTENSION}.
 * </p>
 *
 * <p>
 * Some keywords are structural. {@code BITPIX} gives the type of an array's elements and {@code NAXIS},
 * {@code NAXIS1}, {@code NAXIS2}, ... give its shape. The data unit holds the elements as big-endian numbers in
 * column-major order, in which the first axis varies fastest. An ASCII table is an array of bytes where each row is a
 * line of fixed-width text fields, each described by its {@code TBCOLn} (starting column) and {@code TFORMn} (Fortran
 * format code). Every other keyword describes the data, and is collected in {@link org.scharp.fits.Metadata}.
 * </p>
 *
 * <p>
 * A string value is at most 68 characters. Longer strings end with {@code &} and continue in the value of the
 * following {@code CONTINUE} records.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * Problems with the content of a file are reported as subclasses of {@link org.scharp.fits.FitsException}, which is an
 * {@link java.io.IOException}. The decoder stops at the first problem (fail-fast), with the exception of
 * {@link org.scharp.fits.HeaderDataUnit#decodeAll}, which keeps a table whose rows can't be parsed as a
 * {@link org.scharp.fits.CorruptedExtension}. Dates which can't be parsed may be kept as plain text by decoding with
 * {@link org.scharp.fits.StrictnessMode#LENIENT}.
 * </p>
 */
package org.scharp.fits;
