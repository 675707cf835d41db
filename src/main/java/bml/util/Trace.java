// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.util;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable description of the operation in progress, registered for the lifetime of a try-with-resources
 * block.
 * <p>
 * Traces answer "what was being done" when a condition is signaled: condition handlers run before the stack is
 * unwound, so they can still see every trace established between the signal point and themselves. They are not a
 * machine stack trace, only a breadcrumb trail like "Reading top-level element 'server' at line 12".
 * <p>
 * Each thread has its own trace chain. A trace must be closed by the thread that created it.
 */
public final class Trace implements AutoCloseable {
    /**
     * Registers a new trace whose message is computed only if somebody asks for it.
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
        next = context.innermost;
        this.messageOrSupplier = messageOrSupplier;
        ownerContext = context;
        context.innermost = this;
    }

    /**
     * Returns the messages of the calling thread's active traces, innermost first.
     * <p>
     * The returned list is a snapshot and does not change when traces are later opened or closed.
     */
    public static List<String> activeTraces() {
        final var messages = new ArrayList<String>();
        for (var trace = localContext().innermost; trace != null; trace = trace.next) {
            messages.add(trace.message());
        }
        return List.copyOf(messages);
    }

    /**
     * Does nothing. Exists so that try-with-resources variables count as used.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters this trace. Only meant to be called by try-with-resources.
     */
    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.innermost == this : "Trace chain corrupt";
        ownerContext.innermost = next;
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

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // A String once computed, a MessageSupplier before that.
    private Object messageOrSupplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace innermost = null;
    }
}
