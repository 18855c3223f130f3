// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.util.condition;

import txxt.util.SneakyThrow;
import txxt.util.annotation.Nullable;

/**
 * A named point that handlers can transfer control to.
 * <p>
 * Restarts are only created by {@link ConditionContext#withRestart(String, RestartCallback)}.
 */
public final class Restart {
    Restart(final String name) {
        final var context = ConditionContext.localContext();
        next = context.firstRestart;
        this.name = name;
        ownerContext = context;
        context.firstRestart = this;
    }

    /**
     * Retrieves the user-readable name of this restart.
     */
    public String name() {
        return name;
    }

    /**
     * Transfers control to this restart point. Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void unlink() {
        assert ownerContext == ConditionContext.localContext() : "Restart unlinked by a different thread";
        assert ownerContext.firstRestart == this : "Restart chain corrupt";
        ownerContext.firstRestart = next;
    }

    @Override
    public String toString() {
        return "Restart[" + name + "]";
    }

    final @Nullable Restart next;
    private final String name;
    private final ConditionContext ownerContext;
}
