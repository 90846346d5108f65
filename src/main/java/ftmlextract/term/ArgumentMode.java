// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import ftmlextract.util.annotation.Nullable;

/**
 * How an argument slot is filled.
 */
public enum ArgumentMode {
    /**
     * A single term.
     */
    SIMPLE('i'),
    /**
     * A sequence of terms.
     */
    SEQUENCE('a'),
    /**
     * A single variable bound by the binder.
     */
    BOUND_VARIABLE('b'),
    /**
     * A sequence of variables bound by the binder.
     */
    BOUND_VARIABLE_SEQUENCE('B');

    ArgumentMode(final char character) {
        this.character = character;
    }

    /**
     * Returns the character used for this mode in attribute values.
     */
    public char character() {
        return character;
    }

    /**
     * Returns whether slots in this mode take sequences.
     */
    public boolean isSequence() {
        return this == SEQUENCE || this == BOUND_VARIABLE_SEQUENCE;
    }

    /**
     * Returns whether slots in this mode take bound variables.
     */
    public boolean isBound() {
        return this == BOUND_VARIABLE || this == BOUND_VARIABLE_SEQUENCE;
    }

    /**
     * Returns the mode denoted by the given character, or {@code null} if there is none.
     */
    public static @Nullable ArgumentMode fromCharacter(final char character) {
        for (final var mode : values()) {
            if (mode.character == character) {
                return mode;
            }
        }
        return null;
    }

    /**
     * Parses an arity specification: either a decimal number of simple arguments, or one mode character per argument,
     * like {@code "iaB"}. Returns {@code null} if the string is neither.
     */
    public static @Nullable List<ArgumentMode> parseArity(final String string) {
        if (string.isEmpty()) {
            return null;
        }
        if (string.chars().allMatch(c -> c >= '0' && c <= '9')) {
            final int count;
            try {
                count = Integer.parseInt(string);
            } catch (final NumberFormatException e) {
                return null;
            }
            return (count <= maxArity) ? List.copyOf(Collections.nCopies(count, SIMPLE)) : null;
        }
        final var result = new ArrayList<ArgumentMode>(string.length());
        for (int i = 0; i < string.length(); i += 1) {
            final var mode = fromCharacter(string.charAt(i));
            if (mode == null) {
                return null;
            }
            result.add(mode);
        }
        return List.copyOf(result);
    }

    private static final int maxArity = 255;

    private final char character;
}
