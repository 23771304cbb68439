///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.List;
import java.util.Objects;

/**
 * A publication which references the data of an HDU.
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class ReferencePublication {

    private final String title;
    private final List<String> authors;

    /**
     * Creates a reference publication.
     *
     * @param title
     *     The title, or citation, of the publication. This may be empty but must not be {@code null}.
     * @param authors
     *     The publication's authors. This must not be {@code null}.
     *
     * @throws NullPointerException
     *     if {@code title} or {@code authors} is {@code null}, or if {@code authors} contains {@code null}.
     */
    public ReferencePublication(String title, List<String> authors) {
        ArgumentUtil.checkNotNull(title, "title");
        ArgumentUtil.checkNotNull(authors, "authors");

        this.title = title;
        this.authors = List.copyOf(authors);
    }

    /**
     * @return The title of the publication. This may be empty but is never {@code null}.
     */
    public String title() {
        return title;
    }

    /**
     * @return The authors of the publication, as an unmodifiable list.
     */
    public List<String> authors() {
        return authors;
    }

    /**
     * @param newTitle
     *     The new title.
     *
     * @return A copy of this publication with a different title.
     */
    public ReferencePublication withTitle(String newTitle) {
        return new ReferencePublication(newTitle, authors);
    }

    /**
     * @param newAuthors
     *     The new authors.
     *
     * @return A copy of this publication with different authors.
     */
    public ReferencePublication withAuthors(List<String> newAuthors) {
        return new ReferencePublication(title, newAuthors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, authors);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ReferencePublication otherPublication)) {
            return false;
        }

        return title.equals(otherPublication.title) && authors.equals(otherPublication.authors);
    }

    @Override
    public String toString() {
        return "ReferencePublication{title=" + title + ", authors=" + authors + "}";
    }
}
