// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.dom;

import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The contract between the document tree and anything that turns a node's body into markup.
 * <p>
 * The traits decide what {@link #expand(Body, List, Map)} receives: a void tag always gets an empty body, a textual
 * tag gets its body already rendered, any other tag gets the node sequence itself.
 */
public interface Tag {
    /**
     * The name the tag is known by in templates.
     */
    String name();

    /**
     * Void tags accept no body; a node carrying a non-empty body under a void tag fails to render.
     */
    default boolean isVoid() {
        return false;
    }

    /**
     * Textual tags receive their body rendered to a string instead of as nodes.
     */
    default boolean isTextual() {
        return false;
    }

    /**
     * Pure tags produce output that depends only on their arguments, so references to them don't make a hypertag
     * impure.
     */
    default boolean isPure() {
        return false;
    }

    /**
     * Produces the markup for one node.
     *
     * @param body            The node's body, shaped according to the tag's traits.
     * @param attributes      Positional attributes, in order.
     * @param namedAttributes Named attributes, in order of appearance.
     */
    String expand(Body body, List<@Nullable Object> attributes, Map<String, @Nullable Object> namedAttributes);

    /**
     * The body handed to a tag.
     */
    sealed interface Body permits Body.Empty, Body.Markup, Body.Nodes {
        boolean isEmpty();

        String render();

        static Body empty() {
            return Empty.instance;
        }

        /**
         * No body at all; what void tags receive.
         */
        final class Empty implements Body {
            private Empty() {
            }

            @Override
            public boolean isEmpty() {
                return true;
            }

            @Override
            public String render() {
                return "";
            }

            private static final Empty instance = new Empty();
        }

        /**
         * A body already rendered to text, for textual tags.
         */
        record Markup(String text) implements Body {
            @Override
            public boolean isEmpty() {
                return text.isEmpty();
            }

            @Override
            public String render() {
                return text;
            }
        }

        /**
         * The body nodes themselves.
         */
        record Nodes(Sequence nodes) implements Body {
            @Override
            public boolean isEmpty() {
                return nodes.isEmpty();
            }

            @Override
            public String render() {
                return nodes.render();
            }
        }
    }
}
