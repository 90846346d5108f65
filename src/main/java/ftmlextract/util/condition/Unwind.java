// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.util.condition;

/**
 * The throwable used by {@link Restart#unwindTo()} to carry control to its restart point.
 * <p>
 * Extends {@link Throwable} directly, because it is neither an error nor an exception. Code should not catch it
 * except where a restart point is established.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
