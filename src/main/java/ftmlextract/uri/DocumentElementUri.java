// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.uri;

import ftmlextract.util.annotation.Nullable;

/**
 * Identifies an element of a document, such as a section or a variable declaration, written {@code document#path}.
 * Elements nested in a section extend the section's path: {@code doc#section/definition}.
 */
public record DocumentElementUri(DocumentUri document, String path) {
    public DocumentElementUri {
        if (!UriNames.isValidPath(path)) {
            throw new IllegalArgumentException("Not a valid element path: '" + path + '\'');
        }
    }

    /**
     * Parses a document element URI of the form {@code document#path}, returning {@code null} if the string isn't one.
     */
    public static @Nullable DocumentElementUri parse(final String string) {
        final var separator = string.indexOf('#');
        if (separator < 0) {
            return null;
        }
        final var document = DocumentUri.parse(string.substring(0, separator));
        return (document != null) ? document.element(string.substring(separator + 1)) : null;
    }

    /**
     * Returns the URI of an element nested in this one, or {@code null} if {@code name} isn't a valid name.
     */
    public @Nullable DocumentElementUri child(final String name) {
        return UriNames.isValidPath(name) ? new DocumentElementUri(document, path + '/' + name) : null;
    }

    /**
     * Returns the last segment of the path.
     */
    public String name() {
        return UriNames.lastSegment(path);
    }

    @Override
    public String toString() {
        return document + "#" + path;
    }
}
