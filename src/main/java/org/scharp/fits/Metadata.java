///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The descriptive metadata of one HDU.
 * <p>
 * Generic tags are kept in the order in which they were first added, which is the order in which they are written
 * back to a header.
 * </p>
 * <p>
 * Instances of this class are mutable and not thread-safe.
 * </p>
 */
public final class Metadata implements MetaContainer {

    private final Map<String, String> tags;
    private LocalDateTime creationDate;
    private LocalDateTime lastModified;
    private String author;
    private String telescope;
    private String instrument;
    private String object;
    private ReferencePublication referencePublication;

    /**
     * Creates an empty set of metadata.
     */
    public Metadata() {
        tags = new LinkedHashMap<>();
    }

    /**
     * @return The date on which the data was observed, or {@code null} if it's not known.
     */
    public LocalDateTime creationDate() {
        return creationDate;
    }

    @Override
    public void setCreationDate(LocalDateTime creationDate) {
        this.creationDate = creationDate;
    }

    /**
     * @return The date on which the HDU was last written, or {@code null} if it's not known.
     */
    public LocalDateTime lastModified() {
        return lastModified;
    }

    @Override
    public void setLastModified(LocalDateTime lastModified) {
        this.lastModified = lastModified;
    }

    /**
     * @return Who compiled the data, or {@code null} if it's not known.
     */
    public String author() {
        return author;
    }

    @Override
    public void setAuthor(String author) {
        this.author = author;
    }

    /**
     * @return The telescope used to acquire the data, or {@code null} if it's not known.
     */
    public String telescope() {
        return telescope;
    }

    @Override
    public void setTelescope(String telescope) {
        this.telescope = telescope;
    }

    /**
     * @return The instrument used to acquire the data, or {@code null} if it's not known.
     */
    public String instrument() {
        return instrument;
    }

    @Override
    public void setInstrument(String instrument) {
        this.instrument = instrument;
    }

    /**
     * @return The name of the object observed, or {@code null} if it's not known.
     */
    public String object() {
        return object;
    }

    @Override
    public void setObject(String object) {
        this.object = object;
    }

    @Override
    public ReferencePublication referencePublication() {
        return referencePublication;
    }

    @Override
    public void setReferencePublication(ReferencePublication referencePublication) {
        this.referencePublication = referencePublication;
    }

    /**
     * {@inheritDoc}
     *
     * @throws NullPointerException
     *     if {@code keyword} or {@code rawValue} is {@code null}.
     */
    @Override
    public void putTag(String keyword, String rawValue) {
        ArgumentUtil.checkNotNull(keyword, "keyword");
        ArgumentUtil.checkNotNull(rawValue, "rawValue");
        tags.put(keyword, rawValue);
    }

    @Override
    public String tag(String keyword) {
        return tags.get(keyword);
    }

    /**
     * Removes a generic tag.
     *
     * @param keyword
     *     The keyword of the tag to remove.
     *
     * @return The raw value text of the removed tag, or {@code null} if there was no such tag.
     */
    public String removeTag(String keyword) {
        return tags.remove(keyword);
    }

    /**
     * @return All generic tags as an unmodifiable map from keyword to raw value text, in insertion order.
     */
    public Map<String, String> tags() {
        return Collections.unmodifiableMap(tags);
    }
}
