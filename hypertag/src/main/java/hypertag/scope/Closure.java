// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.scope;

import java.util.List;
import java.util.Map;
import hypertag.dom.Node;
import hypertag.dom.Sequence;
import hypertag.dom.Tag;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link ScopedTag} taken as a value, together with the stack state at that point.
 * <p>
 * The closure branches the stack where it was created, so later expansions see the variables visible at creation time
 * and nothing pushed afterwards. It's also an ordinary {@link Tag}, rendering its expansion as text, so it can be
 * handed to code that knows nothing about frames.
 */
public final class Closure implements Tag {
    /**
     * Captures {@code hypertag} as seen from {@code frame}, which must be the topmost frame of its stack.
     */
    public Closure(final ScopedTag hypertag, final Frame frame) {
        this.hypertag = hypertag;
        branch = new StackBranch(frame.stack());
        this.frame = frame.on(branch);
    }

    public ScopedTag hypertag() {
        return hypertag;
    }

    /**
     * The lexical depth of the frame the closure was created in.
     */
    public int depth() {
        return frame.depth();
    }

    public StackBranch stack() {
        return branch;
    }

    /**
     * Expands the captured hypertag on the captured stack branch.
     */
    public Sequence expandNodes(
        final Sequence body,
        final List<@Nullable Object> attributes,
        final Map<String, @Nullable Object> namedAttributes
    ) {
        return hypertag.expand(frame, body, attributes, namedAttributes);
    }

    @Override
    public String name() {
        return hypertag.name();
    }

    @Override
    public boolean isVoid() {
        return !hypertag.acceptsBody();
    }

    @Override
    public String expand(
        final Body body,
        final List<@Nullable Object> attributes,
        final Map<String, @Nullable Object> namedAttributes
    ) {
        final Sequence nodes;
        if (body instanceof Body.Nodes bodyNodes) {
            nodes = bodyNodes.nodes();
        } else if (body.isEmpty()) {
            nodes = Sequence.empty();
        } else {
            nodes = Sequence.of(Node.text(body.render()));
        }
        final var output = expandNodes(nodes, attributes, namedAttributes);
        output.setIndent("\n");
        return Node.root(output).render();
    }

    @Override
    public String toString() {
        return "Closure[" + hypertag.name() + ", depth " + frame.depth() + "]";
    }

    private final ScopedTag hypertag;
    private final StackBranch branch;
    private final Frame frame;
}
