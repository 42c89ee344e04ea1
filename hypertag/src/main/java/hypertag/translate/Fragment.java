// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.translate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import hypertag.ast.Block;
import hypertag.dom.Node;
import hypertag.dom.Sequence;
import hypertag.runtime.Environment;
import hypertag.scope.Frame;
import hypertag.util.condition.ConditionContext;
import hypertag.util.condition.Handler;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An analyzed block, ready to produce nodes.
 * <p>
 * Fragments producing output give their top-level nodes the absolute indentation computed during analysis; the
 * enclosing element, or eventually the document root, turns it into a relative one.
 */
sealed interface Fragment {
    Sequence translate(Frame frame);

    /**
     * Blocks producing no output: hypertag definitions and imports, which act at analysis time only.
     */
    record Nothing() implements Fragment {
        @Override
        public Sequence translate(final Frame frame) {
            return Sequence.empty();
        }
    }

    /**
     * Consecutive blocks, whose outputs are concatenated.
     */
    record Blocks(List<Fragment> fragments) implements Fragment {
        public Blocks {
            fragments = List.copyOf(fragments);
        }

        @Override
        public Sequence translate(final Frame frame) {
            final var outputs = new ArrayList<Sequence>(fragments.size());
            for (final var fragment : fragments) {
                outputs.add(fragment.translate(frame));
            }
            return Sequence.flatten(outputs);
        }
    }

    /**
     * Applies a block's layout: the first node starts on a new line if the block is outline, and blank lines of
     * the margin precede it.
     */
    record Placed(Fragment inner, boolean outline, int margin) implements Fragment {
        @Override
        public Sequence translate(final Frame frame) {
            final var output = inner.translate(frame);
            if (outline && !output.isEmpty()) {
                output.get(0).markOutline();
            }
            if (margin == 0) {
                return output;
            }
            return Sequence.of(Node.text("\n".repeat(margin)), output);
        }
    }

    record Text(Block.TextMode mode, List<Evaluator> parts, Environment environment, String indentation)
        implements Fragment {
        public Text {
            parts = List.copyOf(parts);
        }

        @Override
        public Sequence translate(final Frame frame) {
            if (mode == Block.TextMode.COMMENT) {
                return Sequence.empty();
            }
            final var builder = new StringBuilder();
            for (final var part : parts) {
                builder.append(Values.toText(part.evaluate(frame)));
            }
            final var text = (mode == Block.TextMode.NORMAL)
                ? environment.escape(builder.toString())
                : builder.toString();
            final var node = Node.text(text);
            node.setIndent(indentation);
            return Sequence.of(node);
        }
    }

    /**
     * A structural block: the tag chain is applied to the body's output from the innermost tag outwards.
     */
    record Struct(List<TagApplication> chain, Fragment body, String indentation) implements Fragment {
        public Struct {
            chain = List.copyOf(chain);
        }

        @Override
        public Sequence translate(final Frame frame) {
            var output = body.translate(frame);
            for (int i = chain.size() - 1; i >= 0; i -= 1) {
                output = chain.get(i).apply(frame, output);
            }
            output.setIndent(indentation);
            return output;
        }
    }

    record Embed(Evaluator expression, String indentation) implements Fragment {
        @Override
        public Sequence translate(final Frame frame) {
            final var output = Sequence.of(expression.evaluate(frame));
            output.setIndent(indentation);
            return output;
        }
    }

    record If(List<Clause> clauses, @Nullable Fragment elseBody) implements Fragment {
        public If {
            clauses = List.copyOf(clauses);
        }

        @Override
        public Sequence translate(final Frame frame) {
            for (final var clause : clauses) {
                if (Values.isTrue(clause.test().evaluate(frame))) {
                    return clause.body().translate(frame);
                }
            }
            return (elseBody == null) ? Sequence.empty() : elseBody.translate(frame);
        }

        record Clause(Evaluator test, Fragment body) {
        }
    }

    /**
     * A loop storing each element in a slot of the current frame.
     */
    record For(int slot, Evaluator iterable, Fragment body) implements Fragment {
        @Override
        public Sequence translate(final Frame frame) {
            final var value = iterable.evaluate(frame);
            final Iterable<?> elements;
            if (value instanceof Iterable<?> iterableValue) {
                elements = iterableValue;
            } else if (value instanceof Object[] array) {
                elements = Arrays.asList(array);
            } else {
                throw ConditionContext.error(new EvaluationErrorCondition(
                    "Can't iterate over " + Values.describe(value)
                ));
            }
            final var outputs = new ArrayList<Sequence>();
            for (final var element : elements) {
                frame.store(slot, element);
                outputs.add(body.translate(frame));
            }
            return Sequence.flatten(outputs);
        }
    }

    record While(Evaluator test, Fragment body) implements Fragment {
        @Override
        public Sequence translate(final Frame frame) {
            final var outputs = new ArrayList<Sequence>();
            while (Values.isTrue(test.evaluate(frame))) {
                outputs.add(body.translate(frame));
            }
            return Sequence.flatten(outputs);
        }
    }

    /**
     * Produces the output of the first alternative during which no error was signaled. Conditions that aren't errors
     * don't interrupt an alternative.
     */
    record Try(List<Fragment> alternatives) implements Fragment {
        public Try {
            alternatives = List.copyOf(alternatives);
        }

        @Override
        public Sequence translate(final Frame frame) {
            for (final var alternative : alternatives) {
                final var output = ConditionContext.<Sequence>withRestart(RESTART_NAME, restart -> {
                    try (final var handler = new Handler(signaled -> {
                        if (signaled.isFatal()) {
                            restart.unwindTo();
                        }
                    })) {
                        handler.use();
                        return alternative.translate(frame);
                    }
                });
                if (output != null) {
                    return output;
                }
            }
            return Sequence.empty();
        }

        static final String RESTART_NAME = "try-next-alternative";
    }

    record Assign(int slot, Evaluator value) implements Fragment {
        @Override
        public Sequence translate(final Frame frame) {
            frame.store(slot, value.evaluate(frame));
            return Sequence.empty();
        }
    }
}
