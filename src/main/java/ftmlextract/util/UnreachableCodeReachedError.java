// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when control flow reaches a state that an earlier check ruled out, such as a close marker whose frame type
 * was already matched.
 * <p>
 * Extends {@link AssertionError}, since reaching it is always a programming error.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
