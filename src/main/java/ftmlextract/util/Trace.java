// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package ftmlextract.util;

import java.util.ArrayList;
import java.util.List;
import ftmlextract.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A trace message, to be used within try-with-resources.
 * <p>
 * Traces describe what the current thread is doing in user-readable terms, such as "applying data-ftml-arg on
 * &lt;span&gt;". They are attached to extraction diagnostics and printed by the command line front end when something
 * goes wrong; they are not a machine stack trace.
 * <p>
 * A trace must never be used outside the thread that created it.
 */
public final class Trace implements AutoCloseable {
    /**
     * Establishes a trace whose message is computed on first use, at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Establishes a trace with the given message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object object) {
        final var context = localContext();
        next = context.firstTrace;
        messageOrSupplier = object;
        ownerContext = context;
        context.firstTrace = this;
    }

    /**
     * Returns the calling thread's active trace messages, most recently established first.
     */
    public static List<String> activeTraces() {
        final var result = new ArrayList<String>();
        for (var trace = localContext().firstTrace; trace != null; trace = trace.next) {
            result.add(trace.message());
        }
        return result;
    }

    /**
     * Does nothing. Silences warnings about auto-closeable resources that are never referenced.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Removes the trace from the current thread's chain. Called by try-with-resources, never manually.
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

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // Either the message itself or the MessageSupplier that computes it.
    private Object messageOrSupplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace firstTrace = null;
    }
}
