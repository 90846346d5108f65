// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.term;

import java.util.List;

/**
 * A finished argument of a {@link Term.Binding}: either a plain argument or a variable bound by the binder.
 */
public sealed interface BoundArgument {
    record Simple(Term term) implements BoundArgument {
    }

    record WholeSequence(Term term) implements BoundArgument {
    }

    record Sequence(List<Term> terms) implements BoundArgument {
        public Sequence {
            terms = List.copyOf(terms);
        }
    }

    /**
     * A single bound variable.
     */
    record Bound(Variable variable) implements BoundArgument {
    }

    /**
     * A bound sequence variable given as a whole.
     */
    record WholeBoundSequence(Variable variable) implements BoundArgument {
    }

    /**
     * A sequence of bound variables given element by element.
     */
    record BoundSequence(List<Variable> variables) implements BoundArgument {
        public BoundSequence {
            variables = List.copyOf(variables);
        }
    }
}
