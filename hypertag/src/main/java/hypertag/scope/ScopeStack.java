// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.scope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A stack of name bindings where the newest binding of a name shadows older ones, plus the absolute indentation of
 * the block being analyzed.
 * <p>
 * Popping a binding makes the shadowed one visible again. {@link #checkpoint()} and {@link #reset(Checkpoint)} undo
 * everything bound, and any indentation added, since the checkpoint; that's how local scopes end.
 * <p>
 * The indentation always starts with a newline, so it can be assigned to nodes as an absolute indentation.
 */
public final class ScopeStack<V> {
    /**
     * Binds {@code name} to {@code value}, shadowing any current binding.
     */
    public void push(final String name, final V value) {
        final var previous = lookup.get(name);
        entries.add(new Entry<>(name, value, (previous == null) ? -1 : previous));
        lookup.put(name, entries.size() - 1);
    }

    /**
     * Binds every entry of the map, in iteration order.
     */
    public void pushAll(final Map<String, ? extends V> bindings) {
        for (final var entry : bindings.entrySet()) {
            push(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Removes the newest binding, making whatever it shadowed visible again.
     *
     * @throws StackUnderflowError If there are no bindings.
     */
    public Binding<V> pop() {
        if (entries.isEmpty()) {
            throw new StackUnderflowError("Pop from an empty scope stack");
        }
        final var entry = entries.remove(entries.size() - 1);
        if (entry.previous() < 0) {
            lookup.remove(entry.name());
        } else {
            lookup.put(entry.name(), entry.previous());
        }
        return new Binding<>(entry.name(), entry.value());
    }

    public boolean contains(final String name) {
        return lookup.containsKey(name);
    }

    /**
     * Returns the newest binding of the name, or {@code null} if it's unbound.
     */
    public @Nullable V get(final String name) {
        final var index = lookup.get(name);
        return (index == null) ? null : entries.get(index).value();
    }

    /**
     * The number of bindings, shadowed ones included.
     */
    public int size() {
        return entries.size();
    }

    public Checkpoint checkpoint() {
        return new Checkpoint(entries.size(), indentation.length());
    }

    /**
     * Pops every binding made since the checkpoint and cuts the indentation back to the length it had. Indentation
     * that has since been dedented below the checkpoint is left as it is. Resetting to the current state, or to the
     * same checkpoint twice, changes nothing.
     *
     * @throws StackUnderflowError If the checkpoint holds more bindings than the stack.
     */
    public void reset(final Checkpoint checkpoint) {
        if (checkpoint.size() > entries.size()) {
            throw new StackUnderflowError(
                "Scope reset to " + checkpoint + " above the current size " + entries.size()
            );
        }
        while (entries.size() > checkpoint.size()) {
            pop();
        }
        if (indentation.length() > checkpoint.indentationLength()) {
            indentation.setLength(checkpoint.indentationLength());
        }
    }

    /**
     * Returns the names bound since the checkpoint, each with its newest value.
     */
    public Map<String, V> bindingsSince(final Checkpoint checkpoint) {
        final var result = new LinkedHashMap<String, V>();
        for (int i = checkpoint.size(); i < entries.size(); i += 1) {
            final var entry = entries.get(i);
            result.remove(entry.name());
            result.put(entry.name(), entry.value());
        }
        return result;
    }

    /**
     * Appends one whitespace character to the indentation.
     */
    public void indent(final char whitespace) {
        indentation.append(whitespace);
    }

    /**
     * Removes the last indentation character, which must be {@code whitespace}.
     *
     * @throws StackUnderflowError If there's no such character to remove.
     */
    public void dedent(final char whitespace) {
        final var length = indentation.length();
        if (length <= 1 || indentation.charAt(length - 1) != whitespace) {
            throw new StackUnderflowError("Dedent doesn't match the current indentation");
        }
        indentation.setLength(length - 1);
    }

    /**
     * The current absolute indentation: a newline followed by the indentation characters.
     */
    public String indentation() {
        return indentation.toString();
    }

    private final ArrayList<Entry<V>> entries = new ArrayList<>();
    private final HashMap<String, Integer> lookup = new HashMap<>();
    private final StringBuilder indentation = new StringBuilder("\n");

    /**
     * A name together with the value it was bound to.
     */
    public record Binding<V>(String name, V value) {
    }

    /**
     * A saved scope stack state.
     *
     * @param size              Number of bindings.
     * @param indentationLength Length of the indentation, the leading newline included.
     */
    public record Checkpoint(int size, int indentationLength) {
    }

    private record Entry<V>(String name, V value, int previous) {
    }
}
