// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.util.condition;

/**
 * A condition as seen by a {@link HandlerProcedure}.
 *
 * @param condition The condition being signaled.
 * @param isFatal   {@code true} iff it was signaled with {@link ConditionContext#error(Condition)}.
 */
public record SignaledCondition(Condition condition, boolean isFatal) {
}
