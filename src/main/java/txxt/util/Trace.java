// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package txxt.util;

import java.util.ArrayList;
import java.util.List;
import txxt.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable description of the operation in progress, meant for try-with-resources.
 * <p>
 * Traces give context to diagnostics: when a condition is reported, the active traces say which stage of the pipeline
 * and which part of the document were being processed. They are not a machine stack trace.
 * <p>
 * A trace must be closed by the thread that created it.
 */
public final class Trace implements AutoCloseable {
    /**
     * Registers a new trace whose message is computed lazily, at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Registers a new trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var context = localContext();
        next = context.firstTrace;
        this.messageOrSupplier = messageOrSupplier;
        ownerContext = context;
        context.firstTrace = this;
    }

    /**
     * Returns the messages of the calling thread's active traces, most recently established first.
     */
    public static List<String> activeTraces() {
        final var result = new ArrayList<String>();
        for (var trace = localContext().firstTrace; trace != null; trace = trace.next) {
            result.add(trace.message());
        }
        return result;
    }

    /**
     * Does nothing; referencing the resource keeps compilers from warning that it is unused.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters the trace. Use try-with-resources instead of calling this directly.
     */
    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.firstTrace == this : "Trace chain corrupt";
        ownerContext.firstTrace = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var string = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = string;
        return string;
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // Never null, CF doesn't understand withInitial.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // Either the message itself or a MessageSupplier not yet run.
    private Object messageOrSupplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace firstTrace = null;
    }
}
