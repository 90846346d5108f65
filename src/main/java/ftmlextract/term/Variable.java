// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.term;

import ftmlextract.uri.DocumentElementUri;

/**
 * A variable occurring in a term.
 */
public sealed interface Variable {
    /**
     * A variable that couldn't be resolved to a declaration and is known by name only.
     */
    record Name(String name) implements Variable {
    }

    /**
     * A variable resolved to its declaration.
     *
     * @param isSequence Whether the declaration declares a sequence variable.
     */
    record Ref(DocumentElementUri declaration, boolean isSequence) implements Variable {
    }
}
