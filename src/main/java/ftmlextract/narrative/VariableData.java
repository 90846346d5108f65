// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.narrative;

import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import ftmlextract.term.ArgumentMode;
import ftmlextract.term.AssociativityType;
import ftmlextract.term.Term;
import ftmlextract.util.annotation.Nullable;

/**
 * Everything known about a declared variable.
 *
 * @param isSequence Whether this declares a sequence variable.
 * @param isBound    Whether the variable is bound by the surrounding statement.
 */
public record VariableData(
    String name,
    boolean isSequence,
    boolean isBound,
    List<ArgumentMode> arity,
    List<String> roles,
    @Nullable AssociativityType associativity,
    @Nullable String reorderArgs,
    @Nullable String macroName,
    @Nullable Term type,
    @Nullable Term definiens
) {
    public VariableData {
        arity = List.copyOf(arity);
        roles = List.copyOf(roles);
    }

    @CheckReturnValue
    public VariableData withType(final Term newType) {
        return new VariableData(
            name, isSequence, isBound, arity, roles, associativity, reorderArgs, macroName, newType, definiens
        );
    }

    @CheckReturnValue
    public VariableData withDefiniens(final Term newDefiniens) {
        return new VariableData(
            name, isSequence, isBound, arity, roles, associativity, reorderArgs, macroName, type, newDefiniens
        );
    }
}
