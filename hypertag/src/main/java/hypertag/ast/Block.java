// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.ast;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A block: a unit of template content, usually one source line with its indented children.
 * <p>
 * Blocks that produce no output of their own (definitions, imports, assignments) have no layout and report the
 * default outline layout.
 */
public sealed interface Block {
    default Layout layout() {
        return Layout.outlined();
    }

    /**
     * The kinds of text blocks.
     */
    enum TextMode {
        /**
         * Plain text, escaped for the output language.
         */
        NORMAL,
        /**
         * Markup, copied to the output as is.
         */
        MARKUP,
        /**
         * Literal text with no embedded expressions, copied as is.
         */
        VERBATIM,
        /**
         * A comment, producing no output.
         */
        COMMENT,
    }

    /**
     * Text, possibly spanning several lines, with embedded expressions concatenated in order.
     */
    record Text(TextMode mode, List<Expression> parts, Layout layout) implements Block {
        public Text {
            parts = List.copyOf(parts);
        }

        public static Text of(final String text) {
            return new Text(TextMode.NORMAL, List.of(new Expression.Literal(text)), Layout.outlined());
        }
    }

    /**
     * A tag chain applied to a body, innermost tag last. The body is a local scope.
     */
    record Struct(List<TagOccurrence> chain, List<Block> body, Layout layout) implements Block {
        public Struct {
            if (chain.isEmpty()) {
                throw new IllegalArgumentException("Structural block without tags");
            }
            chain = List.copyOf(chain);
            body = List.copyOf(body);
        }
    }

    /**
     * A hypertag definition; the hypertag is visible after the definition, up to the end of the enclosing scope.
     *
     * @param bodyParameter Name of the attribute receiving the occurrence's body, or {@code null} for a void hypertag.
     */
    record Hypertag(String name, @Nullable String bodyParameter, List<Parameter> parameters, List<Block> body)
        implements Block {
        public Hypertag {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }
    }

    /**
     * Imports symbols from a module.
     *
     * @param path    Module path, {@code null} for the context module.
     * @param symbols Marked symbols ({@code %tag}, {@code $variable}), or {@code *} for all public ones.
     */
    record Import(@Nullable String path, List<String> symbols) implements Block {
        public Import {
            symbols = List.copyOf(symbols);
        }

        public static final String WILDCARD = "*";
    }

    /**
     * Renders the body of the first clause whose test is true, else the else body if there is one.
     */
    record If(List<Clause> clauses, List<Block> elseBody, Layout layout) implements Block {
        public If {
            clauses = List.copyOf(clauses);
            elseBody = List.copyOf(elseBody);
        }

        public record Clause(Expression test, List<Block> body) {
            public Clause {
                body = List.copyOf(body);
            }
        }
    }

    /**
     * Renders the body once per element of an iterable, with the element bound to {@code variable}.
     */
    record For(String variable, Expression iterable, List<Block> body, Layout layout) implements Block {
        public For {
            body = List.copyOf(body);
        }
    }

    /**
     * Renders the body as long as the test holds.
     */
    record While(Expression test, List<Block> body, Layout layout) implements Block {
        public While {
            body = List.copyOf(body);
        }
    }

    /**
     * Renders the first alternative that completes without an error, or nothing if all fail.
     */
    record Try(List<List<Block>> alternatives, Layout layout) implements Block {
        public Try {
            alternatives = alternatives.stream().map(List::copyOf).toList();
        }
    }

    /**
     * Binds a variable in the current scope.
     */
    record Assignment(String variable, Expression value) implements Block {
    }

    /**
     * Inserts the nodes an expression evaluates to.
     */
    record Embed(Expression expression, Layout layout) implements Block {
    }
}
