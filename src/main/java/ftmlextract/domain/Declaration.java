// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.domain;

import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import ftmlextract.term.Term;
import ftmlextract.uri.Language;
import ftmlextract.uri.ModuleUri;
import ftmlextract.uri.SymbolUri;
import ftmlextract.util.annotation.Nullable;

/**
 * A finished domain declaration.
 */
public sealed interface Declaration {
    /**
     * A module, possibly nested in another one.
     *
     * @param metatheory The module providing the meta theory, if declared.
     * @param language   The natural language of the module's narrative, if declared.
     * @param signature  The language of the module this one translates, if it is a translation.
     */
    record Module(
        ModuleUri uri,
        @Nullable ModuleUri metatheory,
        @Nullable Language language,
        @Nullable Language signature,
        List<Declaration> declarations
    ) implements Declaration {
        public Module {
            declarations = List.copyOf(declarations);
        }
    }

    /**
     * A symbol declaration.
     */
    record Symbol(SymbolUri uri, SymbolData data) implements Declaration {
        /**
         * Returns a copy of this declaration with the given definiens.
         */
        @CheckReturnValue
        public Symbol withDefiniens(final Term definiens) {
            return new Symbol(uri, data.withDefiniens(definiens));
        }
    }

    /**
     * An import of another module's declarations.
     */
    record Import(ModuleUri module) implements Declaration {
    }

    /**
     * A mathematical structure: a named bundle of declarations, declared inside a module.
     *
     * @param macroname The macro name that refers to the structure, if any.
     */
    record Structure(
        SymbolUri uri,
        @Nullable String macroname,
        List<Declaration> declarations
    ) implements Declaration {
        public Structure {
            declarations = List.copyOf(declarations);
        }
    }

    /**
     * A morphism from another module into the module that declares it.
     *
     * @param domain      The module whose symbols are mapped.
     * @param isTotal     Whether every symbol of the domain must be assigned.
     * @param assignments The assignments, at most one per domain symbol, in order of first appearance.
     */
    record Morphism(
        SymbolUri uri,
        ModuleUri domain,
        boolean isTotal,
        List<Assignment> assignments
    ) implements Declaration {
        public Morphism {
            assignments = List.copyOf(assignments);
        }
    }
}
