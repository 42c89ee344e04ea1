// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.util.condition;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A condition handler, intended to be used within try-with-resources.
 * <p>
 * Whenever a condition is signaled, the procedures of all installed handlers run from the most recently installed to
 * the oldest, until one of them transfers control away.
 */
public final class Handler implements AutoCloseable {
    /**
     * Installs a new handler in the calling thread's {@link ConditionContext}.
     */
    public Handler(final @NotNull Procedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing; silences warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Uninstalls the handler.
     */
    @Override
    public void close() {
        assert ownerContext == ConditionContext.localContext() : "Handler closed by a different thread";
        assert ownerContext.firstHandler == this : "Handler chain corrupt";
        ownerContext.firstHandler = next;
    }

    void handle(final @NotNull SignaledCondition condition) throws Unwind {
        procedure.handle(condition);
    }

    final @Nullable Handler next;
    private final @NotNull Procedure procedure;
    private final @NotNull ConditionContext ownerContext;

    /**
     * The code a handler runs for each signaled condition.
     */
    @FunctionalInterface
    public interface Procedure {
        /**
         * Processes the given condition.
         * <p>
         * A procedure declines a condition by returning normally, and handles it by transferring control away, usually
         * with {@link Restart#unwindTo()}.
         */
        void handle(@NotNull SignaledCondition condition) throws Unwind;
    }
}
