// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.translate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import hypertag.ast.Expression;
import hypertag.scope.Closure;
import hypertag.scope.Frame;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An analyzed expression: every name is resolved, variables to a number of access link hops and a slot.
 */
sealed interface Evaluator {
    @Nullable Object evaluate(Frame frame);

    record Constant(@Nullable Object value) implements Evaluator {
        @Override
        public @Nullable Object evaluate(final Frame frame) {
            return value;
        }
    }

    record Load(int hops, int slot, String name) implements Evaluator {
        @Override
        public @Nullable Object evaluate(final Frame frame) {
            return frame.outer(hops).load(slot, name);
        }
    }

    /**
     * Takes a hypertag defined in the template as a value, capturing the current stack.
     */
    record HypertagValue(HypertagDefinition definition) implements Evaluator {
        @Override
        public Closure evaluate(final Frame frame) {
            return new Closure(definition, frame);
        }
    }

    record ListOf(List<Evaluator> elements) implements Evaluator {
        @Override
        public List<@Nullable Object> evaluate(final Frame frame) {
            final var result = new ArrayList<@Nullable Object>(elements.size());
            for (final var element : elements) {
                result.add(element.evaluate(frame));
            }
            return Collections.unmodifiableList(result);
        }
    }

    record Not(Evaluator operand) implements Evaluator {
        @Override
        public Boolean evaluate(final Frame frame) {
            return !Values.isTrue(operand.evaluate(frame));
        }
    }

    record Negate(Evaluator operand) implements Evaluator {
        @Override
        public @Nullable Object evaluate(final Frame frame) {
            return Values.negate(operand.evaluate(frame));
        }
    }

    record Binary(Expression.BinaryOperator operator, Evaluator left, Evaluator right) implements Evaluator {
        @Override
        public @Nullable Object evaluate(final Frame frame) {
            final var leftValue = left.evaluate(frame);
            // and/or return the operand that decided the result.
            if (operator == Expression.BinaryOperator.AND) {
                return Values.isTrue(leftValue) ? right.evaluate(frame) : leftValue;
            } else if (operator == Expression.BinaryOperator.OR) {
                return Values.isTrue(leftValue) ? leftValue : right.evaluate(frame);
            }
            return Values.apply(operator, leftValue, right.evaluate(frame));
        }
    }

    record Conditional(Evaluator test, Evaluator then, Evaluator otherwise) implements Evaluator {
        @Override
        public @Nullable Object evaluate(final Frame frame) {
            return Values.isTrue(test.evaluate(frame)) ? then.evaluate(frame) : otherwise.evaluate(frame);
        }
    }

    record Index(Evaluator target, Evaluator key) implements Evaluator {
        @Override
        public @Nullable Object evaluate(final Frame frame) {
            return Values.index(target.evaluate(frame), key.evaluate(frame));
        }
    }
}
