// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.scope;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A stack that shares a read-only prefix, the <dfn>trunk</dfn>, with another stack and keeps its own values on top.
 * <p>
 * The trunk's length is captured at construction: values pushed to the other stack afterwards are invisible here, and
 * values pushed here never reach the other stack. Values inside the trunk are read through to the other stack, so the
 * other stack must not be reset below the captured length while the branch is in use.
 */
public final class StackBranch implements ValueStack {
    /**
     * Creates a branch whose trunk is everything currently on {@code trunk}.
     */
    public StackBranch(final ValueStack trunk) {
        this.trunk = trunk;
        trunkLength = trunk.position();
    }

    public int trunkLength() {
        return trunkLength;
    }

    @Override
    public int position() {
        return trunkLength + upper.position();
    }

    @Override
    public @Nullable Object get(final int index) {
        if (index < 0) {
            throw new StackUnderflowError("Negative stack position " + index);
        }
        return (index < trunkLength) ? trunk.get(index) : upper.get(index - trunkLength);
    }

    @Override
    public void set(final int index, final @Nullable Object value) {
        if (index < trunkLength) {
            throw new StackUnderflowError("Write to position " + index + " inside a read-only trunk");
        }
        upper.set(index - trunkLength, value);
    }

    @Override
    public void push(final @Nullable Object value) {
        upper.push(value);
    }

    @Override
    public @Nullable Object pop() {
        if (upper.position() == 0) {
            throw new StackUnderflowError("Pop into a read-only trunk");
        }
        return upper.pop();
    }

    @Override
    public void reset(final int newPosition) {
        if (newPosition < trunkLength) {
            throw new StackUnderflowError(
                "Stack reset to position " + newPosition + " inside a trunk of length " + trunkLength
            );
        }
        upper.reset(newPosition - trunkLength);
    }

    private final ValueStack trunk;
    private final int trunkLength;
    private final ArrayStack upper = new ArrayStack();
}
