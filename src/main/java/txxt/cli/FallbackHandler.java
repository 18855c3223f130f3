// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.cli;

import txxt.source.LocatedCondition;
import txxt.util.Trace;
import txxt.util.condition.Condition;
import txxt.util.condition.ConditionContext;
import txxt.util.condition.HandlerProcedure;
import txxt.util.condition.SignaledCondition;

/**
 * The outermost handler: reports conditions nobody else handled.
 * <p>
 * Non-fatal conditions tied to a source position are printed as warnings. A fatal condition is printed with the
 * operation trace, and control is transferred to the most recently established restart.
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
            if (condition.condition() instanceof final LocatedCondition c) {
                try (final var streams = Streams.acquire()) {
                    showCondition(streams, c, "Warning: a condition");
                }
            }
            return;
        }
        final var restarts = ConditionContext.restarts();
        try (final var streams = Streams.acquire()) {
            showCondition(streams, condition.condition(), "A fatal condition");
            if (restarts.isEmpty()) {
                streams.err().println("No restarts available.");
                return;
            }
            streams.err().println("Invoking restart " + restarts.get(0).name() + '.');
        }
        restarts.get(0).unwindTo();
    }

    static void showCondition(final Streams streams, final Condition condition, final String prefix) {
        final var err = streams.err();
        err.println(prefix + " of type " + condition.getClass().getName() + " has been signaled.");
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
