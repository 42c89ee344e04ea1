// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.scope;

import java.util.List;
import hypertag.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An activation record on a {@link ValueStack}.
 * <p>
 * A frame occupies {@code [pointer, pointer + 1 + slots)}: the position of the lexically enclosing frame (its
 * <dfn>access link</dfn>, -1 for the document frame) followed by one slot per variable. Variables of enclosing
 * frames are reached by following access links, one hop per level of nesting.
 *
 * @param stack   The stack holding the frame.
 * @param depth   Lexical nesting level: 0 for the document, one more for each enclosing hypertag.
 * @param pointer Position of the frame's access link.
 */
public record Frame(ValueStack stack, int depth, int pointer) {
    /**
     * Pushes a new frame on top of the stack.
     *
     * @param accessLink The pointer of the lexically enclosing frame, or -1 for none.
     * @param values     Initial values of the first slots.
     * @param slotCount  Total number of slots; slots past {@code values} start unassigned.
     */
    public static Frame open(
        final ValueStack stack,
        final int depth,
        final int accessLink,
        final List<@Nullable Object> values,
        final int slotCount
    ) {
        assert values.size() <= slotCount : "More initial values than slots";
        final var pointer = stack.position();
        stack.push(accessLink);
        for (final var value : values) {
            stack.push(value);
        }
        for (int i = values.size(); i < slotCount; i += 1) {
            stack.push(unassigned);
        }
        return new Frame(stack, depth, pointer);
    }

    /**
     * Follows the given number of access links.
     */
    public Frame outer(final int hops) {
        var frame = this;
        for (int i = 0; i < hops; i += 1) {
            final var link = frame.stack.get(frame.pointer);
            if (!(link instanceof Integer linkPointer) || linkPointer < 0) {
                throw new StackUnderflowError("Access link chain ends " + (hops - i) + " hops too early");
            }
            frame = new Frame(stack, frame.depth - 1, linkPointer);
        }
        return frame;
    }

    /**
     * Reads a variable slot, forcing it if it holds a {@link LazyValue}.
     *
     * @param name The variable's name, for the error message.
     */
    public @Nullable Object load(final int slot, final String name) {
        final var value = stack.get(pointer + 1 + slot);
        if (value == unassigned) {
            throw ConditionContext.error(new UndefinedSymbolCondition(
                name,
                "Variable '" + name + "' referenced before assignment"
            ));
        }
        return (value instanceof LazyValue<?> lazy) ? lazy.get() : value;
    }

    public void store(final int slot, final @Nullable Object value) {
        stack.set(pointer + 1 + slot, value);
    }

    /**
     * Returns the same frame seen through another stack that shares this frame's positions.
     */
    public Frame on(final ValueStack otherStack) {
        return new Frame(otherStack, depth, pointer);
    }

    /**
     * Pops this frame and everything above it.
     */
    public void close() {
        stack.reset(pointer);
    }

    private static final Object unassigned = new Object() {
        @Override
        public String toString() {
            return "<unassigned>";
        }
    };
}
