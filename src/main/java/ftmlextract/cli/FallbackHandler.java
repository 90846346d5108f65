// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.cli;

import ftmlextract.util.Trace;
import ftmlextract.util.condition.Condition;
import ftmlextract.util.condition.ConditionContext;
import ftmlextract.util.condition.HandlerProcedure;
import ftmlextract.util.condition.SignaledCondition;

/**
 * The outermost condition handler: reports fatal conditions nothing else handled, then unwinds to the newest restart.
 * Non-fatal conditions are ignored.
 */
final class FallbackHandler implements HandlerProcedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            return;
        }
        final var restarts = ConditionContext.restarts();
        try (final var streams = Streams.acquire()) {
            showCondition(streams, condition.condition());
            if (restarts.isEmpty()) {
                streams.err().println("No restarts available.");
                return;
            }
            final var restart = restarts.get(0);
            streams.err().println("Invoking restart " + restart.name() + ".");
            restart.unwindTo();
        }
    }

    private static void showCondition(final Streams streams, final Condition condition) {
        final var err = streams.err();
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static final FallbackHandler instance = new FallbackHandler();
}
