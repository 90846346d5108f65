// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.uri;

import ftmlextract.util.annotation.Nullable;

/**
 * Identifies a module. Nested modules extend the path of their parent: {@code outer/inner}.
 *
 * @param path The slash-separated module path.
 */
public record ModuleUri(String path) {
    public ModuleUri {
        if (!UriNames.isValidPath(path)) {
            throw new IllegalArgumentException("Not a valid module path: '" + path + '\'');
        }
    }

    /**
     * Parses a module URI, returning {@code null} if the string isn't one.
     */
    public static @Nullable ModuleUri parse(final String string) {
        return UriNames.isValidPath(string) ? new ModuleUri(string) : null;
    }

    /**
     * Returns the URI of a module nested in this one, or {@code null} if {@code name} isn't a valid name.
     */
    public @Nullable ModuleUri nested(final String name) {
        return UriNames.isValidPath(name) ? new ModuleUri(path + '/' + name) : null;
    }

    /**
     * Returns the URI of a symbol declared in this module, or {@code null} if {@code name} isn't a valid name.
     */
    public @Nullable SymbolUri symbol(final String name) {
        return UriNames.isValidPath(name) ? new SymbolUri(this, name) : null;
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
