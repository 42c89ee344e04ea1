// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.dom;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import hypertag.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A flat, immutable list of nodes: the body of an element and the result of translating a block.
 * <p>
 * Strict construction flattens nested sequences, collections, iterators, streams and arrays, and drops
 * {@code null}s; anything else signals a {@link StructuralTypeCondition}. Strings in particular are not nodes.
 */
public final class Sequence implements Iterable<Node> {
    private Sequence(final List<Node> nodes) {
        this.nodes = nodes;
    }

    public static Sequence empty() {
        return empty;
    }

    /**
     * Returns the strict flattening of the given items.
     */
    public static Sequence of(final @Nullable Object... items) {
        if (items == null) {
            return empty;
        }
        return flatten(Arrays.asList(items));
    }

    /**
     * Returns the strict flattening of the given items.
     */
    public static Sequence flatten(final Iterable<?> items) {
        final var result = new ArrayList<Node>();
        for (final var item : items) {
            flattenInto(result, item);
        }
        return result.isEmpty() ? empty : new Sequence(Collections.unmodifiableList(result));
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Node get(final int index) {
        return nodes.get(index);
    }

    /**
     * Returns the unmodifiable list of nodes.
     */
    public List<Node> nodes() {
        return nodes;
    }

    /**
     * Returns the nodes from {@code from}, inclusive, to {@code to}, exclusive, without revalidating them.
     */
    public Sequence slice(final int from, final int to) {
        return new Sequence(List.copyOf(nodes.subList(from, to)));
    }

    @Override
    public Iterator<Node> iterator() {
        return nodes.iterator();
    }

    public Stream<Node> stream() {
        return nodes.stream();
    }

    /**
     * Assigns the same indentation to every node of this sequence; see {@link Node#setIndent(String)}.
     */
    public void setIndent(final @Nullable String indent) {
        for (final var node : nodes) {
            node.setIndent(indent);
        }
    }

    /**
     * Concatenates the renderings of all nodes.
     */
    public String render() {
        final var builder = new StringBuilder();
        for (final var node : nodes) {
            builder.append(node.render());
        }
        return builder.toString();
    }

    /**
     * Returns all nodes of the subtrees rooted at this sequence's nodes that match the selector, in pre-order.
     */
    public Sequence select(final Selector selector) {
        final var result = new ArrayList<Node>();
        collectMatching(result, selector);
        return result.isEmpty() ? empty : new Sequence(Collections.unmodifiableList(result));
    }

    /**
     * Convenience form of {@link #select(Selector)}; {@code null} criteria match anything.
     */
    public Sequence select(
        final @Nullable String tag,
        final @Nullable String id,
        final @Nullable String className,
        final Map<String, @Nullable Object> attributes
    ) {
        return select(new Selector(tag, id, className, attributes));
    }

    private void collectMatching(final List<Node> result, final Selector selector) {
        for (final var node : nodes) {
            if (selector.matches(node)) {
                result.add(node);
            }
            node.body().collectMatching(result, selector);
        }
    }

    private static void flattenInto(final List<Node> result, final @Nullable Object item) {
        if (item == null) {
            return;
        }
        if (item instanceof Node node) {
            result.add(node);
        } else if (item instanceof Sequence sequence) {
            result.addAll(sequence.nodes);
        } else if (item instanceof Iterable<?> iterable) {
            for (final var element : iterable) {
                flattenInto(result, element);
            }
        } else if (item instanceof Iterator<?> iterator) {
            while (iterator.hasNext()) {
                flattenInto(result, iterator.next());
            }
        } else if (item instanceof Stream<?> stream) {
            stream.forEachOrdered(element -> flattenInto(result, element));
        } else if (item instanceof Object[] array) {
            for (final var element : array) {
                flattenInto(result, element);
            }
        } else {
            throw ConditionContext.error(new StructuralTypeCondition(item));
        }
    }

    private final List<Node> nodes;

    private static final Sequence empty = new Sequence(List.of());
}
