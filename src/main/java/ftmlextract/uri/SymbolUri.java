// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.uri;

import ftmlextract.util.annotation.Nullable;

/**
 * Identifies a symbol declared in a module, written {@code module?name}.
 */
public record SymbolUri(ModuleUri module, String name) {
    public SymbolUri {
        if (!UriNames.isValidPath(name)) {
            throw new IllegalArgumentException("Not a valid symbol name: '" + name + '\'');
        }
    }

    /**
     * Parses a symbol URI of the form {@code module?name}, returning {@code null} if the string isn't one.
     */
    public static @Nullable SymbolUri parse(final String string) {
        final var separator = string.indexOf('?');
        if (separator < 0) {
            return null;
        }
        final var module = ModuleUri.parse(string.substring(0, separator));
        return (module != null) ? module.symbol(string.substring(separator + 1)) : null;
    }

    /**
     * Returns the URI of the module with this symbol's name, nested in the symbol's module. Declarations inside a
     * structure live there.
     */
    public ModuleUri asNestedModule() {
        return new ModuleUri(module.path() + '/' + name);
    }

    @Override
    public String toString() {
        return module + "?" + name;
    }
}
