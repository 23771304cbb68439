///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.time.LocalDateTime;

/**
 * The destination for the keywords of a header that don't describe the structure of the data.
 * <p>
 * A handful of keywords with well-known meanings are stored as typed tags. Every other keyword is stored as a generic
 * tag holding the keyword's raw value text, including the quotes of a string value.
 * </p>
 *
 * @see Metadata
 */
public interface MetaContainer {

    /**
     * Sets the date on which the data was observed ({@code DATE-OBS}).
     *
     * @param creationDate
     *     The date, in UTC.
     */
    void setCreationDate(LocalDateTime creationDate);

    /**
     * Sets the date on which the HDU was last written ({@code DATE}).
     *
     * @param lastModified
     *     The date, in UTC.
     */
    void setLastModified(LocalDateTime lastModified);

    /**
     * Sets who compiled the data ({@code AUTHOR}).
     *
     * @param author
     *     The author.
     */
    void setAuthor(String author);

    /**
     * Sets the telescope used to acquire the data ({@code TELESCOP}).
     *
     * @param telescope
     *     The telescope.
     */
    void setTelescope(String telescope);

    /**
     * Sets the instrument used to acquire the data ({@code INSTRUME}).
     *
     * @param instrument
     *     The instrument.
     */
    void setInstrument(String instrument);

    /**
     * Sets the name of the object observed ({@code OBJECT}).
     *
     * @param object
     *     The object.
     */
    void setObject(String object);

    /**
     * Gets the publication in which the data was referenced.
     *
     * @return The reference publication, or {@code null} if none has been set.
     */
    ReferencePublication referencePublication();

    /**
     * Sets the publication in which the data was referenced ({@code REFERENC}).
     *
     * @param referencePublication
     *     The reference publication.
     */
    void setReferencePublication(ReferencePublication referencePublication);

    /**
     * Stores a generic tag, replacing any existing tag with the same keyword.
     *
     * @param keyword
     *     The keyword.
     * @param rawValue
     *     The keyword's raw value text.
     */
    void putTag(String keyword, String rawValue);

    /**
     * Looks up a generic tag.
     *
     * @param keyword
     *     The keyword.
     *
     * @return The raw value text of the tag, or {@code null} if there is no such tag.
     */
    String tag(String keyword);
}
