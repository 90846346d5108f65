// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something that code further up the call stack may want to react to. Handlers run
 * <em>before</em> the stack is unwound, so they can still see restart points established deeper down, for example
 * the per-attribute restart the HTML front end sets up around every rule.
 */
public abstract class Condition {
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the user-readable, one-line message of this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves a longer user-readable description. Defaults to {@link #message()}.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
