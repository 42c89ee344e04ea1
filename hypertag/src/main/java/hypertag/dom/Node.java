// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import hypertag.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The base class for document tree nodes.
 * <p>
 * A node's indentation is one of:
 * <ul>
 *     <li>{@code null}: the node has no indentation of its own and is transparent to indentation passed down;</li>
 *     <li><dfn>absolute</dfn>, starting with a newline: the full indentation of the line the node starts on, as
 *     assigned during translation;</li>
 *     <li><dfn>relative</dfn>: the extra indentation over the parent, obtained by stripping the parent's absolute
 *     indentation.</li>
 * </ul>
 * Setting an indentation on a node converts the absolute indentations of its descendants into relative ones, so by
 * the time a tree is rendered from its {@link Root}, every indentation is relative or empty.
 * <p>
 * Indentation and the outline flag are mutable, since they're assigned while the tree is assembled; tags and
 * attributes never change after construction.
 */
public abstract sealed class Node permits Node.Element, Node.Root, Node.Text {
    Node(final boolean outline) {
        this.outline = outline;
    }

    /**
     * Returns a new element node with the given construction parameters, whose body is the flattening of
     * {@code body}.
     */
    public static Element element(final Parameters parameters, final @Nullable Object... body) {
        return new Element(parameters, Sequence.of(body));
    }

    /**
     * Returns a new inline element node with the given tag, no attributes and no indentation.
     */
    public static Element tagged(final Tag tag, final @Nullable Object... body) {
        return element(Parameters.tagged(tag), body);
    }

    /**
     * Returns a new inline element node without a tag, rendering as its body alone.
     */
    public static Element group(final @Nullable Object... body) {
        return element(Parameters.none(), body);
    }

    /**
     * Returns a new inline text node with no indentation.
     */
    public static Text text(final String text) {
        return new Text(text, Parameters.none());
    }

    /**
     * Returns a new text node with the given indentation and outline flag.
     *
     * @throws IllegalArgumentException If the parameters carry a tag or attributes.
     */
    public static Text text(final String text, final Parameters parameters) {
        return new Text(text, parameters);
    }

    /**
     * Returns a new root node over the flattening of {@code body}. Top-level nodes are expected to carry absolute
     * indentations (or none).
     */
    public static Root root(final @Nullable Object... body) {
        return new Root(Sequence.of(body));
    }

    /**
     * The node's indentation; see the class documentation for its three forms.
     */
    public final @Nullable String indent() {
        return indent;
    }

    /**
     * Checks whether the node starts on a new line.
     */
    public final boolean isOutline() {
        return outline;
    }

    /**
     * Makes the node start on a new line.
     */
    public final void markOutline() {
        outline = true;
    }

    /**
     * The node's children; empty for text nodes.
     */
    public abstract Sequence body();

    /**
     * Assigns the node's indentation and, when it's non-empty, relativizes the absolute indentations of the
     * descendants against it.
     *
     * @throws MalformedIndentError If a descendant's absolute indentation doesn't extend {@code indent}.
     */
    public void setIndent(final @Nullable String indent) {
        this.indent = indent;
        if (indent != null && !indent.isEmpty()) {
            relativizeChildren(indent);
        }
    }

    /**
     * Returns the nodes of this node's subtree, excluding the node itself, that match the given selector, in
     * pre-order.
     */
    public final Sequence select(final Selector selector) {
        return body().select(selector);
    }

    /**
     * Renders the node: a leading newline if the node is outline, then the body, indented by the node's relative
     * indentation if the node is outline.
     *
     * @throws MalformedIndentError If the node is outline and its indentation is still absolute.
     */
    public String render() {
        final var text = renderBody();
        if (!outline) {
            return text;
        }
        final var currentIndent = indent;
        if (currentIndent == null || currentIndent.isEmpty()) {
            return "\n" + text;
        }
        if (Indentation.isAbsolute(currentIndent)) {
            throw new MalformedIndentError("Rendering an outline node whose indentation is still absolute");
        }
        return Indentation.addIndent("\n" + text, currentIndent);
    }

    abstract String renderBody();

    final void relativeIndent(final String parentIndent) {
        final var currentIndent = indent;
        if (currentIndent == null) {
            relativizeChildren(parentIndent);
        } else if (Indentation.isAbsolute(currentIndent)) {
            if (!currentIndent.startsWith(parentIndent)) {
                throw new MalformedIndentError(
                    "Node indentation " + quote(currentIndent) + " doesn't extend the parent's " + quote(parentIndent)
                );
            }
            indent = currentIndent.substring(parentIndent.length());
        }
    }

    private void relativizeChildren(final String parentIndent) {
        for (final var child : body()) {
            child.relativeIndent(parentIndent);
        }
    }

    private static String quote(final String indent) {
        return '"' + indent.replace("\n", "\\n").replace("\t", "\\t") + '"';
    }

    private @Nullable String indent = null;
    private boolean outline;

    /**
     * A node with an optional tag, attributes and a body. Without a tag, it renders as its body.
     */
    public static final class Element extends Node {
        private Element(final Parameters parameters, final Sequence body) {
            super(parameters.outline());
            tag = parameters.tag();
            attributes = parameters.attributes();
            namedAttributes = parameters.namedAttributes();
            this.body = body;
            setIndent(parameters.indent());
        }

        public @Nullable Tag tag() {
            return tag;
        }

        public List<@Nullable Object> attributes() {
            return attributes;
        }

        public Map<String, @Nullable Object> namedAttributes() {
            return namedAttributes;
        }

        @Override
        public Sequence body() {
            return body;
        }

        @Override
        String renderBody() {
            final var currentTag = tag;
            if (currentTag == null) {
                return body.render();
            }
            final Tag.Body tagBody;
            if (currentTag.isVoid()) {
                if (!body.isEmpty()) {
                    throw ConditionContext.error(new VoidBodyCondition(currentTag.name()));
                }
                tagBody = Tag.Body.empty();
            } else if (currentTag.isTextual()) {
                tagBody = new Tag.Body.Markup(body.render());
            } else {
                tagBody = new Tag.Body.Nodes(body);
            }
            return currentTag.expand(tagBody, attributes, namedAttributes);
        }

        private final @Nullable Tag tag;
        private final List<@Nullable Object> attributes;
        private final Map<String, @Nullable Object> namedAttributes;
        private final Sequence body;
    }

    /**
     * The root of a document tree.
     * <p>
     * The root is built with a newline as its indentation, so that top-level nodes carrying absolute indentations
     * become relative, and then its own indentation is cleared.
     */
    public static final class Root extends Node {
        private Root(final Sequence body) {
            super(false);
            this.body = body;
            setIndent("\n");
            setIndent("");
        }

        @Override
        public Sequence body() {
            return body;
        }

        /**
         * Renders the document, dropping the newline that precedes the first outline node.
         */
        @Override
        public String render() {
            return render(true);
        }

        /**
         * Renders the document.
         *
         * @param dropLeadingNewline Whether a single leading newline is removed from the output.
         */
        public String render(final boolean dropLeadingNewline) {
            final var text = super.render();
            return (dropLeadingNewline && text.startsWith("\n")) ? text.substring(1) : text;
        }

        @Override
        String renderBody() {
            return body.render();
        }

        private final Sequence body;
    }

    /**
     * A leaf holding text that has already been escaped as needed.
     */
    public static final class Text extends Node {
        private Text(final String text, final Parameters parameters) {
            super(parameters.outline());
            if (parameters.tag() != null || !parameters.attributes().isEmpty()
                || !parameters.namedAttributes().isEmpty()) {
                throw new IllegalArgumentException("Text nodes carry no tag nor attributes");
            }
            this.text = text;
            setIndent(parameters.indent());
        }

        public String text() {
            return text;
        }

        @Override
        public Sequence body() {
            return Sequence.empty();
        }

        @Override
        String renderBody() {
            return text;
        }

        private final String text;
    }

    /**
     * Node construction parameters.
     *
     * @param indent          Initial indentation, usually absolute or {@code null}.
     * @param outline         Whether the node starts on a new line.
     * @param tag             The tag applied to the body, or {@code null} for none.
     * @param attributes      Positional attributes passed to the tag.
     * @param namedAttributes Named attributes passed to the tag, in order.
     */
    public record Parameters(
        @Nullable String indent,
        boolean outline,
        @Nullable Tag tag,
        List<@Nullable Object> attributes,
        Map<String, @Nullable Object> namedAttributes
    ) {
        public Parameters {
            attributes = Collections.unmodifiableList(new ArrayList<>(attributes));
            namedAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(namedAttributes));
        }

        /**
         * Parameters of an inline node with no indentation, no tag and no attributes.
         */
        public static Parameters none() {
            return none;
        }

        public static Parameters tagged(final Tag tag) {
            return new Parameters(null, false, tag, List.of(), Map.of());
        }

        public static Parameters tagged(
            final Tag tag,
            final List<@Nullable Object> attributes,
            final Map<String, @Nullable Object> namedAttributes
        ) {
            return new Parameters(null, false, tag, attributes, namedAttributes);
        }

        @CheckReturnValue
        public Parameters withIndent(final @Nullable String newIndent) {
            return new Parameters(newIndent, outline, tag, attributes, namedAttributes);
        }

        @CheckReturnValue
        public Parameters withOutline(final boolean newOutline) {
            return new Parameters(indent, newOutline, tag, attributes, namedAttributes);
        }

        private static final Parameters none = new Parameters(null, false, null, List.of(), Map.of());
    }
}
