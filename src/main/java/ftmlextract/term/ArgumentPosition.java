// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.term;

import ftmlextract.util.annotation.Nullable;

/**
 * The slot an argument annotation fills.
 * <p>
 * In attribute values, positions are one-based: {@code "2"} is the second argument, {@code "31"} is the first element
 * of the third argument. Internally, all indices are zero-based.
 */
public sealed interface ArgumentPosition {
    /**
     * Returns the zero-based argument index.
     */
    int index();

    /**
     * Returns the mode of the slot.
     */
    ArgumentMode mode();

    /**
     * Returns the one-based attribute value denoting this position.
     */
    String surfaceString();

    /**
     * Parses a position written as an attribute value. A single digit denotes a whole argument; longer strings are
     * an argument digit followed by a decimal sequence index without leading zeros. Both must be non-zero and below
     * 256.
     *
     * @param mode The slot mode, or {@code null} for {@link ArgumentMode#SIMPLE}.
     * @return The position, or {@code null} if the string isn't a valid position.
     */
    static @Nullable ArgumentPosition parse(final String string, final @Nullable ArgumentMode mode) {
        final var effectiveMode = (mode != null) ? mode : ArgumentMode.SIMPLE;
        if (string.isEmpty()) {
            return null;
        }
        final var first = string.charAt(0);
        if (first < '1' || first > '9') {
            return null;
        }
        final var argument = first - '0';
        if (string.length() == 1) {
            return new Simple(argument - 1, effectiveMode);
        }
        final var rest = string.substring(1);
        if (rest.length() > 3 || rest.charAt(0) == '0' || !rest.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return null;
        }
        final var sequenceIndex = Integer.parseInt(rest);
        if (sequenceIndex <= 0 || sequenceIndex >= 256) {
            return null;
        }
        return new Sequence(argument - 1, sequenceIndex - 1, effectiveMode);
    }

    /**
     * A whole argument.
     */
    record Simple(int index, ArgumentMode mode) implements ArgumentPosition {
        @Override
        public String surfaceString() {
            return Integer.toString(index + 1);
        }
    }

    /**
     * One element of a sequence argument.
     */
    record Sequence(int index, int sequenceIndex, ArgumentMode mode) implements ArgumentPosition {
        @Override
        public String surfaceString() {
            return Integer.toString(index + 1) + (sequenceIndex + 1);
        }
    }
}
