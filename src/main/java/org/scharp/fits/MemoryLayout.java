///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * How the elements of a {@link TypedImage} are arranged in its storage array.
 * <p>
 * Axes with an extent of 1 don't affect the layout.
 * </p>
 */
public enum MemoryLayout {

    /** The elements form one run of storage in which the first axis varies fastest. This is the FITS order. */
    COLUMN_MAJOR,

    /** The elements form one run of storage in which the last axis varies fastest. */
    ROW_MAJOR,

    /** The elements are spread over storage with gaps, as happens with a slice of an image. */
    DISCONTIGUOUS,
}
