// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.domain;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import ftmlextract.term.Term;
import ftmlextract.uri.SymbolUri;
import ftmlextract.util.annotation.Nullable;

/**
 * What a morphism does with one symbol of its domain.
 *
 * @param original    The symbol of the domain module.
 * @param morphism    The morphism the assignment belongs to.
 * @param definiens   The term the symbol is mapped to, if assigned.
 * @param refinedType The type the symbol gets in the image, if refined.
 * @param newName     The name the symbol gets in the image, if renamed.
 * @param macroname   The macro name of the renamed symbol, if given.
 */
public record Assignment(
    SymbolUri original,
    SymbolUri morphism,
    @Nullable Term definiens,
    @Nullable Term refinedType,
    @Nullable String newName,
    @Nullable String macroname
) {
    /**
     * Returns an assignment of {@code original} that doesn't change anything yet.
     */
    public static Assignment of(final SymbolUri original, final SymbolUri morphism) {
        return new Assignment(original, morphism, null, null, null, null);
    }

    /**
     * Returns a copy with the given definiens and refined type, keeping the present ones where the new ones are
     * {@code null}.
     */
    @CheckReturnValue
    public Assignment withTerms(final @Nullable Term definiens, final @Nullable Term refinedType) {
        return new Assignment(
            original,
            morphism,
            (definiens != null) ? definiens : this.definiens,
            (refinedType != null) ? refinedType : this.refinedType,
            newName,
            macroname
        );
    }

    @CheckReturnValue
    public Assignment withName(final @Nullable String newName, final @Nullable String macroname) {
        return new Assignment(original, morphism, definiens, refinedType, newName, macroname);
    }
}
