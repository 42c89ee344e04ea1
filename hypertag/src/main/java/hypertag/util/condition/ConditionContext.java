// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import hypertag.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Keeps track of the handlers and restart points installed in the calling thread.
 * <p>
 * Each thread has its own context; only static methods operating on the current thread's context are exposed.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition.
     * <p>
     * Handlers run from the newest to the oldest; once one of them transfers control away, the older ones don't run.
     * If all of them return normally, so does this method.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as an error.
     * <p>
     * Like {@link #signal(Condition)}, except that if every handler declines, {@link UnhandledErrorError} is thrown.
     * Never returns normally: the declared return type lets call sites write {@code throw ConditionContext.error(c)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Executes the given body with a restart point around it.
     *
     * @param restartName The user-readable name of the restart point.
     * @param body        The code to execute; the restart object is passed as an argument.
     * @return The value returned by {@code body}, or {@code null} if control was transferred to this restart point.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull Restart.Body<? extends T> body
    ) {
        final var restart = new Restart(restartName);
        try {
            return body.call(restart);
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
     * Returns an iterable over all active restart points, from the newest one to the oldest.
     */
    public static @NotNull Iterable<@NotNull Restart> restarts() {
        final var context = localContext();
        return () -> new RestartIterator(context.firstRestart);
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final @NotNull SignaledCondition condition) {
        for (var handler = findFirstHandler(); handler != null; handler = handler.next) {
            final var currentSave = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } catch (final Unwind unwind) {
                throw SneakyThrow.doThrow(unwind);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    private @Nullable Handler findFirstHandler() {
        // A condition signaled from inside a handler only reaches the handlers older than that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);

    private static final class RestartIterator implements Iterator<@NotNull Restart> {
        private RestartIterator(final @Nullable Restart firstRestart) {
            current = firstRestart;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public @NotNull Restart next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more restarts left");
            }
            current = result.next;
            return result;
        }

        private @Nullable Restart current;
    }
}
