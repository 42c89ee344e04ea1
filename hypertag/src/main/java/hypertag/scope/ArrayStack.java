// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.scope;

import java.util.ArrayList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A plain growable {@link ValueStack}.
 */
public final class ArrayStack implements ValueStack {
    @Override
    public int position() {
        return values.size();
    }

    @Override
    public @Nullable Object get(final int index) {
        checkIndex(index);
        return values.get(index);
    }

    @Override
    public void set(final int index, final @Nullable Object value) {
        checkIndex(index);
        values.set(index, value);
    }

    @Override
    public void push(final @Nullable Object value) {
        values.add(value);
    }

    @Override
    public @Nullable Object pop() {
        if (values.isEmpty()) {
            throw new StackUnderflowError("Pop from an empty stack");
        }
        return values.remove(values.size() - 1);
    }

    @Override
    public void reset(final int newPosition) {
        if (newPosition < 0 || newPosition > values.size()) {
            throw new StackUnderflowError(
                "Stack reset to position " + newPosition + " while the top is at " + values.size()
            );
        }
        values.subList(newPosition, values.size()).clear();
    }

    private void checkIndex(final int index) {
        if (index < 0 || index >= values.size()) {
            throw new StackUnderflowError("Position " + index + " is outside a stack of " + values.size());
        }
    }

    private final ArrayList<@Nullable Object> values = new ArrayList<>();
}
