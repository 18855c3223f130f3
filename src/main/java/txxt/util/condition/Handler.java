// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.util.condition;

import txxt.util.SneakyThrow;
import txxt.util.annotation.Nullable;

/**
 * A registered condition handler, meant for try-with-resources.
 * <p>
 * The handler is active from construction until {@link #close()}.
 */
public final class Handler implements AutoCloseable {
    /**
     * Registers a new handler running {@code procedure} in the calling thread's {@link ConditionContext}.
     */
    public Handler(final HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing; referencing the resource keeps compilers from warning that it is unused.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters the handler.
     */
    @Override
    public void close() {
        assert ownerContext == ConditionContext.localContext() : "Handler closed by a different thread";
        assert ownerContext.firstHandler == this : "Handler chain corrupt";
        ownerContext.firstHandler = next;
    }

    void handle(final SignaledCondition condition) {
        try {
            procedure.handle(condition);
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        }
    }

    final @Nullable Handler next;
    private final HandlerProcedure procedure;
    private final ConditionContext ownerContext;
}
