// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.util;

import org.jetbrains.annotations.NotNull;

/**
 * Facilities for throwing checked throwables without declaring them.
 * <p>
 * Used for {@link ftmlextract.util.condition.Unwind}, which travels through rule and close callbacks that have no
 * reason to mention it in their signatures.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable unchecked, regardless of its type.
     * <p>
     * Never returns normally; the declared return type lets call sites write {@code throw SneakyThrow.doThrow(t)} to
     * keep control flow analysis happy.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E is inferred as RuntimeException at the call site and erased to Throwable in bytecode, so the cast is a no-op.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
