///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.Locale;

/**
 * The kinds of header data unit, as given by the {@code SIMPLE}, {@code GROUPS}, and {@code XTENSION} keywords.
 */
public enum ExtensionKind {

    /** The primary HDU, declared with {@code SIMPLE = T}. */
    PRIMARY(null),

    /** An image extension ({@code XTENSION = 'IMAGE'}). */
    IMAGE("IMAGE"),

    /** An ASCII table extension ({@code XTENSION = 'TABLE'}). */
    TABLE("TABLE"),

    /** A binary table extension ({@code XTENSION = 'BINTABLE'}). */
    BINTABLE("BINTABLE"),

    /** A primary HDU holding random groups ({@code GROUPS = T}). */
    GROUPS(null),

    /** A foreign file encapsulation ({@code XTENSION = 'FOREIGN'}). */
    FOREIGN("FOREIGN"),

    /** A raw dump ({@code XTENSION = 'DUMP'}). */
    DUMP("DUMP");

    static final String KEYWORD = "XTENSION";

    private final String extensionName;

    ExtensionKind(String extensionName) {
        this.extensionName = extensionName;
    }

    /**
     * @return The value of {@code XTENSION} for this kind, or {@code null} if this kind is not an extension.
     */
    public String extensionName() {
        return extensionName;
    }

    /**
     * Gets the kind for a value of {@code XTENSION}.
     *
     * @param name
     *     The unquoted value. Trailing spaces are ignored.
     *
     * @return The extension kind.
     *
     * @throws InvalidHeaderException
     *     if {@code name} is not a recognized extension.
     */
    static ExtensionKind fromExtensionName(String name) throws InvalidHeaderException {
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "IMAGE":
            case "IUEIMAGE": // an early name for IMAGE
                return IMAGE;
            case "TABLE":
                return TABLE;
            case "BINTABLE":
            case "A3DTABLE": // an early name for BINTABLE
                return BINTABLE;
            case "FOREIGN":
                return FOREIGN;
            case "DUMP":
                return DUMP;
            default:
                throw InvalidHeaderException.invalidExtensionName(name);
        }
    }
}
