///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * How strictly a header should be checked for well-formedness.
 * <p>
 * Keywords that describe the structure of the data (such as {@code BITPIX} and {@code NAXIS}) are always checked
 * strictly, since the data cannot be read without them.
 * </p>
 */
public enum StrictnessMode {

    /**
     * Throw exceptions for any keyword whose value cannot be parsed, including descriptive keywords like
     * {@code DATE-OBS}.
     */
    STRICT,

    /**
     * Log a warning for a descriptive keyword whose value cannot be parsed and keep its raw value as a generic tag.
     */
    LENIENT,
}
