///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;

/**
 * The base class for all problems found in the content of a FITS stream, as opposed to problems with the underlying
 * stream itself (which are reported as a plain {@link IOException}).
 */
public class FitsException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new {@code FitsException}.
     *
     * @param message
     *     A description of the problem.
     */
    public FitsException(String message) {
        super(message);
    }

    /**
     * Creates a new {@code FitsException} with an underlying cause.
     *
     * @param message
     *     A description of the problem.
     * @param cause
     *     The exception which triggered this one.
     */
    public FitsException(String message, Throwable cause) {
        super(message, cause);
    }
}
