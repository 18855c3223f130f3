// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when every handler declined the fatal condition.
 * <p>
 * Reaching this means nobody established a way to recover, which is a programming error, hence
 * {@link AssertionError}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled with no handler unwinding: " + condition);
        this.condition = condition;
    }

    /**
     * Returns the condition nobody handled.
     */
    public Condition condition() {
        return condition;
    }

    private final transient Condition condition;
}
