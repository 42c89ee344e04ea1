// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.scope;

/**
 * Thrown on stack misuse: popping an empty stack, resetting to a position above the current top, or touching the
 * read-only trunk of a {@link StackBranch}.
 * <p>
 * Correct translation never does any of these, so this extends {@link AssertionError}.
 */
public final class StackUnderflowError extends AssertionError {
    StackUnderflowError(final String message) {
        super(message);
    }
}
