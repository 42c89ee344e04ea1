// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.translate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import hypertag.dom.Node;
import hypertag.dom.Sequence;
import hypertag.dom.Tag;
import hypertag.scope.Closure;
import hypertag.scope.Frame;
import hypertag.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One analyzed tag occurrence of a structural block, applied to the nodes its body produced.
 */
sealed interface TagApplication {
    Sequence apply(Frame frame, Sequence body);

    /**
     * Attribute expressions of an occurrence.
     */
    record Arguments(List<Evaluator> positional, List<Named> named) {
        public Arguments {
            positional = List.copyOf(positional);
            named = List.copyOf(named);
        }

        List<@Nullable Object> evaluatePositional(final Frame frame) {
            final var result = new ArrayList<@Nullable Object>(positional.size());
            for (final var evaluator : positional) {
                result.add(evaluator.evaluate(frame));
            }
            return result;
        }

        /**
         * Evaluates named attributes in order. A repeated name gets the space-separated text of all its values, so
         * that {@code class} can be given several times.
         */
        Map<String, @Nullable Object> evaluateNamed(final Frame frame) {
            final var result = new LinkedHashMap<String, @Nullable Object>();
            for (final var attribute : named) {
                final var value = attribute.value().evaluate(frame);
                if (result.containsKey(attribute.name())) {
                    final var previous = Values.toText(result.get(attribute.name()));
                    result.put(attribute.name(), previous + " " + Values.toText(value));
                } else {
                    result.put(attribute.name(), value);
                }
            }
            return result;
        }

        record Named(String name, Evaluator value) {
        }
    }

    /**
     * A tag from the environment: the body becomes an element node the tag expands when rendered.
     */
    record External(Tag tag, Arguments arguments) implements TagApplication {
        @Override
        public Sequence apply(final Frame frame, final Sequence body) {
            final var parameters = Node.Parameters.tagged(
                tag,
                arguments.evaluatePositional(frame),
                arguments.evaluateNamed(frame)
            );
            return Sequence.of(Node.element(parameters, body));
        }
    }

    /**
     * A hypertag defined in the template, expanded right away.
     *
     * @param indentation Absolute indentation of the occurrence, given to the expansion's top-level nodes.
     */
    record Native(HypertagDefinition definition, Arguments arguments, String indentation) implements TagApplication {
        @Override
        public Sequence apply(final Frame frame, final Sequence body) {
            final var output = definition.expand(
                frame,
                body,
                arguments.evaluatePositional(frame),
                arguments.evaluateNamed(frame)
            );
            output.setIndent(indentation);
            return output;
        }
    }

    /**
     * A tag held by a variable, resolved on each application.
     */
    record Dynamic(Evaluator tagValue, String name, Arguments arguments, String indentation)
        implements TagApplication {
        @Override
        public Sequence apply(final Frame frame, final Sequence body) {
            final var value = tagValue.evaluate(frame);
            if (value instanceof Closure closure) {
                final var output = closure.expandNodes(
                    body,
                    arguments.evaluatePositional(frame),
                    arguments.evaluateNamed(frame)
                );
                output.setIndent(indentation);
                return output;
            } else if (value instanceof Tag tag) {
                return new External(tag, arguments).apply(frame, body);
            }
            throw ConditionContext.error(new EvaluationErrorCondition(
                "Variable $" + name + " used as a tag holds " + Values.describe(value) + ", not a tag"
            ));
        }
    }
}
