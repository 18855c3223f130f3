// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.util.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import txxt.util.SneakyThrow;
import txxt.util.annotation.Nullable;

/**
 * The per-thread registry of condition handlers and restart points.
 * <p>
 * Instances are never exposed: every operation works on the calling thread's context through static methods. Since
 * parsing one document never crosses threads, nothing here is shared between threads.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as non-fatal.
     * <p>
     * Handlers run from the newest to the oldest. If every handler returns normally, so does this method. A handler may
     * instead unwind to a restart, in which case this method throws {@link Unwind} sneakily.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as fatal.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that if every handler declines, {@link UnhandledErrorError} is
     * thrown. The method never returns normally; its return type lets call sites write {@code throw error(...)}.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs {@code callback} with a restart point named {@code restartName} established around it.
     *
     * @return The value returned by {@code callback}, or {@code null} if control was transferred to this restart.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the calling thread's active restarts, newest first.
     */
    public static List<Restart> restarts() {
        final var result = new ArrayList<Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            result.add(restart);
        }
        return Collections.unmodifiableList(result);
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final SignaledCondition condition) {
        // A handler that signals a condition of its own must only reach the handlers older than itself.
        final var start = (currentHandler == null) ? firstHandler : currentHandler.next;
        for (var handler = start; handler != null; handler = handler.next) {
            final var saved = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = saved;
            }
        }
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    @SuppressWarnings("nullness:type.argument")
    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);
}
