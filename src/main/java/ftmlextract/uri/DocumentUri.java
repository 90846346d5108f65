// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.uri;

import ftmlextract.util.annotation.Nullable;

/**
 * Identifies a document.
 *
 * @param path The slash-separated document path, e.g. {@code course/intro}.
 */
public record DocumentUri(String path) {
    public DocumentUri {
        if (!UriNames.isValidPath(path)) {
            throw new IllegalArgumentException("Not a valid document path: '" + path + '\'');
        }
    }

    /**
     * Parses a document URI, returning {@code null} if the string isn't one.
     */
    public static @Nullable DocumentUri parse(final String string) {
        return UriNames.isValidPath(string) ? new DocumentUri(string) : null;
    }

    /**
     * Returns the URI of an element of this document, or {@code null} if {@code name} isn't a valid name.
     */
    public @Nullable DocumentElementUri element(final String name) {
        return UriNames.isValidPath(name) ? new DocumentElementUri(this, name) : null;
    }

    /**
     * Returns the last segment of the path.
     */
    public String name() {
        return UriNames.lastSegment(path);
    }

    @Override
    public String toString() {
        return path;
    }
}
