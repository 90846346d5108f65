// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.domain;

import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import ftmlextract.term.ArgumentMode;
import ftmlextract.term.AssociativityType;
import ftmlextract.term.Term;
import ftmlextract.util.annotation.Nullable;

/**
 * Everything known about a declared symbol.
 *
 * @param arity          The mode of each argument; empty for constants.
 * @param roles          Free-form role identifiers, e.g. {@code textsymdecl}.
 * @param associativity  How iterated applications are presented, if declared.
 * @param reorderArgs    A permutation of argument indices for presentation, if declared.
 * @param macroName      The name of the authoring macro, if any.
 * @param type           The declared type, if any.
 * @param definiens      The definiens, if any.
 */
public record SymbolData(
    List<ArgumentMode> arity,
    List<String> roles,
    @Nullable AssociativityType associativity,
    @Nullable String reorderArgs,
    @Nullable String macroName,
    @Nullable Term type,
    @Nullable Term definiens
) {
    public SymbolData {
        arity = List.copyOf(arity);
        roles = List.copyOf(roles);
    }

    @CheckReturnValue
    public SymbolData withType(final Term newType) {
        return new SymbolData(arity, roles, associativity, reorderArgs, macroName, newType, definiens);
    }

    @CheckReturnValue
    public SymbolData withDefiniens(final Term newDefiniens) {
        return new SymbolData(arity, roles, associativity, reorderArgs, macroName, type, newDefiniens);
    }
}
