// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

import java.util.ArrayList;
import java.util.List;
import ftmlextract.term.Argument;
import ftmlextract.term.ArgumentPosition;
import ftmlextract.term.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One argument slot of an application under construction.
 * <p>
 * Argument annotations may appear in any order, and sequence arguments may be given element by element, so slots
 * are filled incrementally by {@link #set(List, ArgumentPosition, Term)} and finished by {@link #close()}.
 * {@link Simple} and {@link WholeSequence} slots are final; a {@link Sparse} slot accepts further elements but
 * never overwrites one.
 */
public sealed interface OpenArgument {
    /**
     * Returns the finished argument, or {@code null} if the slot is unset or a sequence element is missing.
     */
    @Nullable Argument close();

    /**
     * Writes {@code term} into the slot at {@code position}, growing {@code arguments} as needed.
     * <p>
     * Signals {@link ExtractionError.Reason#MISMATCHED_ARGUMENT} if the slot can't take it.
     */
    static void set(final List<OpenArgument> arguments, final ArgumentPosition position, final Term term) {
        final var index = position.index();
        while (arguments.size() <= index) {
            arguments.add(Unset.instance);
        }
        final var slot = arguments.get(index);
        if (slot instanceof Unset) {
            arguments.set(index, fill(position, term));
        } else if (slot instanceof final Sparse sparse && position instanceof final ArgumentPosition.Sequence seq) {
            if (!Sparse.put(sparse.terms(), seq.sequenceIndex(), term)) {
                throw mismatch(position, "sequence element already set");
            }
        } else {
            throw mismatch(position, "argument already set as " + slot.describe());
        }
    }

    /**
     * Returns a short description of the slot's state for error messages.
     */
    String describe();

    private static OpenArgument fill(final ArgumentPosition position, final Term term) {
        if (position instanceof final ArgumentPosition.Sequence seq) {
            final var terms = new ArrayList<@Nullable Term>();
            Sparse.put(terms, seq.sequenceIndex(), term);
            return new Sparse(terms);
        }
        return position.mode().isSequence() ? new WholeSequence(term) : new Simple(term);
    }

    private static RuntimeException mismatch(final ArgumentPosition position, final String message) {
        throw ExtractionErrorCondition.signal(
            FtmlKey.ARG,
            ExtractionError.Reason.MISMATCHED_ARGUMENT,
            "cannot write position " + position.surfaceString() + " in mode " + position.mode() + ": " + message
        );
    }

    /**
     * A slot nothing has been written to yet.
     */
    final class Unset implements OpenArgument {
        private Unset() {
        }

        @Override
        public @Nullable Argument close() {
            return null;
        }

        @Override
        public String describe() {
            return "unset";
        }

        static final Unset instance = new Unset();
    }

    record Simple(Term term) implements OpenArgument {
        @Override
        public Argument close() {
            return new Argument.Simple(term);
        }

        @Override
        public String describe() {
            return "a simple argument";
        }
    }

    record WholeSequence(Term term) implements OpenArgument {
        @Override
        public Argument close() {
            return new Argument.WholeSequence(term);
        }

        @Override
        public String describe() {
            return "a whole sequence";
        }
    }

    /**
     * A sequence given element by element; {@code null} entries haven't been written yet.
     */
    record Sparse(List<@Nullable Term> terms) implements OpenArgument {
        @Override
        public @Nullable Argument close() {
            final var dense = dense(terms);
            return (dense != null) ? new Argument.Sequence(dense) : null;
        }

        @Override
        public String describe() {
            return "a sequence given element by element";
        }

        /**
         * Sets the element at {@code index}, growing the list as needed. Returns {@code false} if it was already set.
         */
        static boolean put(final List<@Nullable Term> terms, final int index, final Term term) {
            while (terms.size() <= index) {
                terms.add(null);
            }
            if (terms.get(index) != null) {
                return false;
            }
            terms.set(index, term);
            return true;
        }

        /**
         * Returns the terms without gaps, or {@code null} if there is a gap.
         */
        static @Nullable List<Term> dense(final List<@Nullable Term> terms) {
            final var result = new ArrayList<Term>(terms.size());
            for (final var term : terms) {
                if (term == null) {
                    return null;
                }
                result.add(term);
            }
            return result;
        }
    }
}
