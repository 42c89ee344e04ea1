// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.scope;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A stack of values addressed by absolute position, bottom being zero.
 */
public interface ValueStack {
    /**
     * The number of values on the stack; the position the next push goes to.
     */
    int position();

    /**
     * Reads the value at the given position.
     *
     * @throws StackUnderflowError If the position isn't on the stack.
     */
    @Nullable Object get(int index);

    /**
     * Overwrites the value at the given position.
     *
     * @throws StackUnderflowError If the position isn't on the stack or isn't writable.
     */
    void set(int index, @Nullable Object value);

    void push(@Nullable Object value);

    /**
     * Removes and returns the top value.
     *
     * @throws StackUnderflowError If nothing can be popped.
     */
    @Nullable Object pop();

    /**
     * Truncates the stack to the given position.
     *
     * @throws StackUnderflowError If the position is above the current top, or below what this stack may discard.
     */
    void reset(int newPosition);
}
