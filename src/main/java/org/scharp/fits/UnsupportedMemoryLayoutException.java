///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Thrown when an image view cannot be written because its elements are not laid out as one contiguous column-major
 * or row-major run of storage.
 */
public final class UnsupportedMemoryLayoutException extends FitsException {

    private static final long serialVersionUID = 1L;

    UnsupportedMemoryLayoutException(String message) {
        super(message);
    }
}
