///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * A validated description of the data that follows a header.
 *
 * @see ImageLayout
 * @see TableLayout
 */
public abstract class ExtensionLayout {

    // package-private constructor so that only this package can add layouts.
    ExtensionLayout() {
    }

    /**
     * @return The kind of data.
     */
    public abstract ExtensionKind kind();

    /**
     * @return The number of blocks that the data occupies, including the padding of its final block.
     */
    public abstract long dataBlockCount();
}
