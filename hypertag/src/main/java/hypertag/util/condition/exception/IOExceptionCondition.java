// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.util.condition.exception;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import hypertag.util.condition.Condition;
import org.jetbrains.annotations.NotNull;

/**
 * A condition type indicating that reading a template or writing its output failed.
 */
public final class IOExceptionCondition extends Condition {
    /**
     * Initializes a new {@code IOExceptionCondition} representing the given {@link IOException}.
     */
    public IOExceptionCondition(final @NotNull IOException exception) {
        super(String.valueOf(exception.getMessage()));
        this.exception = exception;
    }

    /**
     * Retrieves the wrapped exception.
     */
    public @NotNull IOException exception() {
        return exception;
    }

    @Override
    public @NotNull String detailedMessage() {
        final var charset = StandardCharsets.UTF_8;
        final var stream = new ByteArrayOutputStream();
        final var printStream = new PrintStream(stream, false, charset);
        exception.printStackTrace(printStream);
        printStream.flush();
        return stream.toString(charset);
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + exception;
    }

    private final @NotNull IOException exception;
}
