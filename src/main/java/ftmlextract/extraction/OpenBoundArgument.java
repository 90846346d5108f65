// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.ArrayList;
import java.util.List;
import ftmlextract.term.ArgumentPosition;
import ftmlextract.term.BoundArgument;
import ftmlextract.term.Term;
import ftmlextract.term.Variable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One argument slot of a binding under construction.
 * <p>
 * Works like {@link OpenArgument}, except that slots written in a bound-variable mode remember that they should hold
 * variables; on close, such slots whose content really is variables become bound arguments.
 */
public sealed interface OpenBoundArgument {
    /**
     * Returns the finished argument, or {@code null} if the slot is unset or a sequence element is missing.
     */
    @Nullable BoundArgument close();

    String describe();

    /**
     * Writes {@code term} into the slot at {@code position}, growing {@code arguments} as needed.
     * <p>
     * Signals {@link ExtractionError.Reason#MISMATCHED_ARGUMENT} if the slot can't take it.
     */
    static void set(final List<OpenBoundArgument> arguments, final ArgumentPosition position, final Term term) {
        final var index = position.index();
        while (arguments.size() <= index) {
            arguments.add(Unset.instance);
        }
        final var slot = arguments.get(index);
        final var shouldBeVariable = position.mode().isBound();
        if (slot instanceof Unset) {
            if (position instanceof final ArgumentPosition.Sequence seq) {
                final var terms = new ArrayList<@Nullable Term>();
                OpenArgument.Sparse.put(terms, seq.sequenceIndex(), term);
                arguments.set(index, new Sparse(terms, shouldBeVariable));
            } else if (position.mode().isSequence()) {
                arguments.set(index, new WholeSequence(term, shouldBeVariable));
            } else {
                arguments.set(index, new Simple(term, shouldBeVariable));
            }
        } else if (slot instanceof final Sparse sparse && position instanceof final ArgumentPosition.Sequence seq) {
            if (!OpenArgument.Sparse.put(sparse.terms(), seq.sequenceIndex(), term)) {
                throw mismatch(position, "sequence element already set");
            }
        } else {
            throw mismatch(position, "argument already set as " + slot.describe());
        }
    }

    private static RuntimeException mismatch(final ArgumentPosition position, final String message) {
        throw ExtractionErrorCondition.signal(
            FtmlKey.ARG,
            ExtractionError.Reason.MISMATCHED_ARGUMENT,
            "cannot write bound position " + position.surfaceString() + " in mode " + position.mode() + ": " + message
        );
    }

    final class Unset implements OpenBoundArgument {
        private Unset() {
        }

        @Override
        public @Nullable BoundArgument close() {
            return null;
        }

        @Override
        public String describe() {
            return "unset";
        }

        static final Unset instance = new Unset();
    }

    record Simple(Term term, boolean shouldBeVariable) implements OpenBoundArgument {
        @Override
        public BoundArgument close() {
            if (shouldBeVariable && term instanceof final Term.Var var) {
                return new BoundArgument.Bound(var.variable());
            }
            return new BoundArgument.Simple(term);
        }

        @Override
        public String describe() {
            return "a simple argument";
        }
    }

    record WholeSequence(Term term, boolean shouldBeVariable) implements OpenBoundArgument {
        @Override
        public BoundArgument close() {
            if (shouldBeVariable && term instanceof final Term.Var var) {
                return new BoundArgument.WholeBoundSequence(var.variable());
            }
            return new BoundArgument.WholeSequence(term);
        }

        @Override
        public String describe() {
            return "a whole sequence";
        }
    }

    record Sparse(List<@Nullable Term> terms, boolean shouldBeVariable) implements OpenBoundArgument {
        @Override
        public @Nullable BoundArgument close() {
            final var dense = OpenArgument.Sparse.dense(terms);
            if (dense == null) {
                return null;
            }
            if (shouldBeVariable) {
                final var variables = new ArrayList<Variable>(dense.size());
                for (final var term : dense) {
                    if (!(term instanceof final Term.Var var)) {
                        return new BoundArgument.Sequence(dense);
                    }
                    variables.add(var.variable());
                }
                return new BoundArgument.BoundSequence(variables);
            }
            return new BoundArgument.Sequence(dense);
        }

        @Override
        public String describe() {
            return "a sequence given element by element";
        }
    }
}
