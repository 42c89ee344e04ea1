// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when execution reaches a branch that the surrounding code rules out, such as an AST node kind the
 * translator does not know about.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
