// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.term;

import java.util.List;

/**
 * A finished argument of an {@link Term.Application}.
 */
public sealed interface Argument {
    /**
     * A single term.
     */
    record Simple(Term term) implements Argument {
    }

    /**
     * A sequence argument given as one term denoting the whole sequence.
     */
    record WholeSequence(Term term) implements Argument {
    }

    /**
     * A sequence argument given element by element.
     */
    record Sequence(List<Term> terms) implements Argument {
        public Sequence {
            terms = List.copyOf(terms);
        }
    }
}
