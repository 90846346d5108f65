// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.term;

import java.util.List;
import ftmlextract.uri.SymbolUri;

/**
 * A formal term. Terms are immutable.
 */
public sealed interface Term {
    /**
     * A reference to a declared symbol.
     */
    record Symbol(SymbolUri uri) implements Term {
    }

    /**
     * A reference to a variable.
     */
    record Var(Variable variable) implements Term {
    }

    /**
     * A function application: {@code head(arguments...)}.
     */
    record Application(Term head, List<Argument> arguments) implements Term {
        public Application {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * A binding application: {@code head} binds the variables among its {@code arguments} in {@code body}.
     */
    record Binding(Term head, List<BoundArgument> arguments, Term body) implements Term {
        public Binding {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * A term slot whose content isn't a single formal term, e.g. plain text or several terms mixed with text.
     *
     * @param text  The text content of the annotated element.
     * @param terms The formal terms found inside, in document order.
     */
    record Informal(String text, List<Term> terms) implements Term {
        public Informal {
            terms = List.copyOf(terms);
        }
    }
}
