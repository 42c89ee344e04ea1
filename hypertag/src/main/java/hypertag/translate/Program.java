// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.translate;

import java.util.List;
import java.util.Map;
import hypertag.dom.Node;
import hypertag.scope.ArrayStack;
import hypertag.scope.Frame;
import hypertag.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An analyzed document, which can be executed any number of times.
 */
public final class Program {
    Program(final Fragment fragment, final int slotCount, final Map<String, HypertagDefinition> hypertags) {
        this.fragment = fragment;
        this.slotCount = slotCount;
        this.hypertags = Map.copyOf(hypertags);
    }

    /**
     * Translates the document into a fresh tree, on a fresh value stack.
     * <p>
     * The stack is left as it is afterwards, so closures taken from document-level hypertags stay usable for as long
     * as they're reachable.
     */
    public Node.Root execute() {
        try (final var trace = new Trace("Translating document")) {
            trace.use();
            final var frame = Frame.open(new ArrayStack(), 0, -1, List.of(), slotCount);
            return Node.root(fragment.translate(frame));
        }
    }

    /**
     * Returns the hypertag of the given name defined at the document level, or {@code null} if there's none.
     */
    public @Nullable HypertagDefinition hypertag(final String name) {
        return hypertags.get(name);
    }

    /**
     * All hypertags defined at the document level, by name.
     */
    public Map<String, HypertagDefinition> hypertags() {
        return hypertags;
    }

    /**
     * Number of variable slots of the document frame.
     */
    public int slotCount() {
        return slotCount;
    }

    private final Fragment fragment;
    private final int slotCount;
    private final Map<String, HypertagDefinition> hypertags;
}
