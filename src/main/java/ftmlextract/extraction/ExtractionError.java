// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.extraction;

/**
 * A semantic extraction error: what went wrong with which FTML attribute.
 *
 * @param key     The offending key.
 * @param reason  The kind of error.
 * @param message A user-readable description.
 */
public record ExtractionError(FtmlKey key, Reason reason, String message) {
    @Override
    public String toString() {
        return key.attributeName() + ": " + reason + ": " + message;
    }

    /**
     * Kinds of extraction errors.
     */
    public enum Reason {
        /**
         * A required attribute is absent or empty.
         */
        MISSING_KEY,
        /**
         * An attribute value couldn't be parsed.
         */
        INVALID_VALUE,
        /**
         * An attribute value isn't a valid URI of the expected kind.
         */
        INVALID_URI,
        INVALID_LANGUAGE,
        /**
         * An annotation requires an enclosing construct that isn't there.
         */
        NOT_IN,
        /**
         * An annotation appears inside a construct that doesn't allow it.
         */
        INVALID_IN,
        /**
         * An element ended while the innermost open frame didn't belong to it.
         */
        UNEXPECTED_END,
        /**
         * Something that can be given only once was given twice.
         */
        DUPLICATE_VALUE,
        /**
         * An application or binding was closed with an argument slot left unfilled.
         */
        MISSING_ARGUMENT,
        /**
         * An argument slot was written in a way that conflicts with what it already holds.
         */
        MISMATCHED_ARGUMENT,
    }
}
