// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable description of the operation in progress, intended to be used within try-with-resources.
 * <p>
 * Traces tell the user <em>where</em> in a template a problem happened ("Expanding hypertag menu", "Analyzing
 * hypertag definition item"); they're not a machine stack trace. The active traces of the calling thread are listed
 * by {@link #activeTraces()}, newest first.
 * <p>
 * Trace objects must never leave the thread that created them.
 */
public final class Trace implements AutoCloseable {
    /**
     * Pushes a trace with a <em>lazily evaluated</em> message. The supplier is called at most once, and only if
     * somebody asks for the message.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Pushes a trace with the given message.
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
     * Returns an iterable over the calling thread's active trace messages, starting with the most recent one.
     */
    public static Iterable<String> activeTraces() {
        return IterableImpl.instance;
    }

    /**
     * Returns a snapshot of the calling thread's active trace messages, starting with the most recent one.
     */
    public static List<String> snapshot() {
        final var result = new ArrayList<String>();
        for (final var message : activeTraces()) {
            result.add(message);
        }
        return result;
    }

    /**
     * Does nothing; silences warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Pops the trace. Use try-with-resources instead of calling this directly.
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
    // Either the message itself or the MessageSupplier that produces it.
    private Object messageOrSupplier;
    private final Context ownerContext;

    /**
     * Lazily produces a trace or condition message.
     */
    @FunctionalInterface
    public interface MessageSupplier {
        String get();
    }

    private static final class Context {
        private @Nullable Trace firstTrace = null;
    }

    private static final class IterableImpl implements Iterable<String> {
        @Override
        public @NonNull Iterator<String> iterator() {
            return new IteratorImpl(localContext().firstTrace);
        }

        private static final IterableImpl instance = new IterableImpl();
    }

    private static final class IteratorImpl implements Iterator<String> {
        private IteratorImpl(final @Nullable Trace firstTrace) {
            current = firstTrace;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public String next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more traces left");
            }
            current = result.next;
            return result.message();
        }

        private @Nullable Trace current;
    }
}
