// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.test;

import java.util.ArrayList;
import txxt.util.condition.Condition;
import txxt.util.condition.ConditionContext;
import txxt.util.condition.Handler;
import txxt.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void signalWithoutHandlersReturns() {
        ConditionContext.signal(new NoteCondition("ignored"));
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void handlersRunNewestFirst() {
        final var seen = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> seen.add("outer"))) {
            outer.use();
            try (final var inner = new Handler(signaled -> seen.add("inner"))) {
                inner.use();
                ConditionContext.signal(new NoteCondition("x"));
            }
            ConditionContext.signal(new NoteCondition("y"));
        }
        assertThat(seen).containsExactly("inner", "outer", "outer");
    }

    @Test
    void handlerUnwindsToRestart() {
        final var result = ConditionContext.withRestart("give-up", restart -> {
            try (final var handler = new Handler(signaled -> restart.unwindTo())) {
                handler.use();
                ConditionContext.signal(new NoteCondition("stop"));
                return "finished";
            }
        });
        assertThat(result).isNull();
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void restartsAreListedNewestFirst() {
        final var names = ConditionContext.withRestart("outer", outer ->
            ConditionContext.withRestart("inner", inner ->
                ConditionContext.restarts().stream().map(restart -> restart.name()).toList()
            )
        );
        assertThat(names).containsExactly("inner", "outer");
    }

    @Test
    void unwindingPassesThroughInnerRestarts() {
        final var reached = new ArrayList<String>();
        final var result = ConditionContext.withRestart("outer", outer -> {
            final var inner = ConditionContext.withRestart("inner", ignored -> {
                outer.unwindTo();
                return "inner body";
            });
            reached.add("after inner");
            return inner;
        });
        assertThat(result).isNull();
        assertThat(reached).isEmpty();
    }

    @Test
    void unhandledErrorThrows() {
        final var condition = new NoteCondition("fatal");
        assertThatExceptionOfType(UnhandledErrorError.class)
            .isThrownBy(() -> ConditionContext.error(condition))
            .satisfies(error -> assertThat(error.condition()).isSameAs(condition));
    }

    @Test
    void handlerSignalingOnlyReachesOlderHandlers() {
        final var seen = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> seen.add("outer: " + signaled.condition().message()))) {
            outer.use();
            try (final var inner = new Handler(signaled -> {
                seen.add("inner: " + signaled.condition().message());
                if (signaled.condition().message().equals("first")) {
                    ConditionContext.signal(new NoteCondition("nested"));
                }
            })) {
                inner.use();
                ConditionContext.signal(new NoteCondition("first"));
            }
        }
        assertThat(seen).containsExactly("inner: first", "outer: nested", "outer: first");
    }

    private static final class NoteCondition extends Condition {
        NoteCondition(final String message) {
            super(message);
        }
    }
}
