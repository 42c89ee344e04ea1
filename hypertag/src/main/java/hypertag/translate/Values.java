// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.translate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import hypertag.ast.Expression;
import hypertag.dom.Node;
import hypertag.dom.Sequence;
import hypertag.util.condition.ConditionContext;
import hypertag.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Operations on template values.
 * <p>
 * Integers are {@link BigInteger}s; other integral {@link Number}s are widened to them, {@link Double}s and
 * {@link Float}s are floating point. An operation involving a floating point operand produces a {@link Double}.
 */
final class Values {
    private Values() {
    }

    /**
     * Checks whether a value counts as true in a condition: {@code null}, {@code false}, zero, and empty strings,
     * collections, maps and node sequences are false.
     */
    static boolean isTrue(final @Nullable Object value) {
        if (value == null) {
            return false;
        } else if (value instanceof Boolean bool) {
            return bool;
        } else if (value instanceof BigInteger integer) {
            return integer.signum() != 0;
        } else if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue() != 0.0;
        } else if (value instanceof Number number) {
            return number.longValue() != 0;
        } else if (value instanceof CharSequence text) {
            return text.length() != 0;
        } else if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        } else if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        } else if (value instanceof Sequence sequence) {
            return !sequence.isEmpty();
        }
        return true;
    }

    /**
     * Converts a value to text for output: {@code null} is empty, nodes and node sequences are rendered.
     */
    static String toText(final @Nullable Object value) {
        if (value == null) {
            return "";
        } else if (value instanceof Sequence sequence) {
            return sequence.render();
        } else if (value instanceof Node node) {
            return node.render();
        }
        return value.toString();
    }

    static @Nullable Object negate(final @Nullable Object operand) {
        final var number = toNumber(operand);
        if (number == null) {
            throw signalError("Can't negate " + describe(operand));
        }
        return (number instanceof BigInteger integer) ? integer.negate() : -number.doubleValue();
    }

    /**
     * Applies a binary operator other than {@code and} and {@code or}, which short-circuit and are evaluated by the
     * caller.
     */
    static @Nullable Object apply(
        final Expression.BinaryOperator operator,
        final @Nullable Object left,
        final @Nullable Object right
    ) {
        return switch (operator) {
            case PLUS -> add(left, right);
            case MINUS, TIMES, DIVIDE, MODULO -> arithmetic(operator, left, right);
            case EQUAL -> isEqual(left, right);
            case NOT_EQUAL -> !isEqual(left, right);
            case LESS -> compare(operator, left, right) < 0;
            case LESS_EQUAL -> compare(operator, left, right) <= 0;
            case GREATER -> compare(operator, left, right) > 0;
            case GREATER_EQUAL -> compare(operator, left, right) >= 0;
            case AND, OR -> throw new IllegalArgumentException("Short-circuit operator " + operator.symbol());
        };
    }

    /**
     * Looks up an element of a list or a node sequence by integer index, negative ones counting from the end, or a
     * value of a map by key.
     */
    static @Nullable Object index(final @Nullable Object target, final @Nullable Object key) {
        if (target instanceof Map<?, ?> map) {
            if (!map.containsKey(key)) {
                throw signalError("No key " + describe(key) + " in the map");
            }
            return map.get(key);
        }
        final List<?> list;
        if (target instanceof List<?> targetList) {
            list = targetList;
        } else if (target instanceof Sequence sequence) {
            list = sequence.nodes();
        } else {
            throw signalError("Can't index into " + describe(target));
        }
        final var number = toNumber(key);
        if (!(number instanceof BigInteger integer)) {
            throw signalError("List index must be an integer, got " + describe(key));
        }
        final var size = BigInteger.valueOf(list.size());
        final var position = (integer.signum() < 0) ? integer.add(size) : integer;
        if (position.signum() < 0 || position.compareTo(size) >= 0) {
            throw signalError("List index " + integer + " out of range for size " + list.size());
        }
        return list.get(position.intValueExact());
    }

    private static @Nullable Object add(final @Nullable Object left, final @Nullable Object right) {
        if (left instanceof CharSequence || right instanceof CharSequence) {
            return toText(left) + toText(right);
        }
        if (left instanceof List<?> leftList && right instanceof List<?> rightList) {
            final var result = new ArrayList<@Nullable Object>(leftList);
            result.addAll(rightList);
            return result;
        }
        if (left instanceof Sequence leftNodes && right instanceof Sequence rightNodes) {
            return Sequence.of(leftNodes, rightNodes);
        }
        return arithmetic(Expression.BinaryOperator.PLUS, left, right);
    }

    private static Object arithmetic(
        final Expression.BinaryOperator operator,
        final @Nullable Object left,
        final @Nullable Object right
    ) {
        final var leftNumber = toNumber(left);
        final var rightNumber = toNumber(right);
        if (leftNumber == null || rightNumber == null) {
            throw signalError(
                "Operator " + operator.symbol() + " can't be applied to " + describe(left) + " and " + describe(right)
            );
        }
        if (leftNumber instanceof BigInteger a && rightNumber instanceof BigInteger b) {
            return switch (operator) {
                case PLUS -> a.add(b);
                case MINUS -> a.subtract(b);
                case TIMES -> a.multiply(b);
                case DIVIDE -> divide(a, b);
                case MODULO -> floorModulo(a, b);
                default -> throw new IllegalArgumentException("Not an arithmetic operator: " + operator.symbol());
            };
        }
        final var a = leftNumber.doubleValue();
        final var b = rightNumber.doubleValue();
        return switch (operator) {
            case PLUS -> a + b;
            case MINUS -> a - b;
            case TIMES -> a * b;
            case DIVIDE -> {
                if (b == 0.0) {
                    throw signalError("Division by zero");
                }
                yield a / b;
            }
            case MODULO -> {
                if (b == 0.0) {
                    throw signalError("Modulo by zero");
                }
                final var remainder = a % b;
                yield (remainder != 0.0 && (remainder < 0) != (b < 0)) ? remainder + b : remainder;
            }
            default -> throw new IllegalArgumentException("Not an arithmetic operator: " + operator.symbol());
        };
    }

    // Exact when divisible, floating point otherwise.
    private static Object divide(final BigInteger a, final BigInteger b) {
        if (b.signum() == 0) {
            throw signalError("Division by zero");
        }
        final var quotientAndRemainder = a.divideAndRemainder(b);
        if (quotientAndRemainder[1].signum() == 0) {
            return quotientAndRemainder[0];
        }
        return new BigDecimal(a).divide(new BigDecimal(b), MathContext.DECIMAL64).doubleValue();
    }

    private static BigInteger floorModulo(final BigInteger a, final BigInteger b) {
        if (b.signum() == 0) {
            throw signalError("Modulo by zero");
        }
        final var remainder = a.remainder(b);
        return (remainder.signum() != 0 && remainder.signum() != b.signum()) ? remainder.add(b) : remainder;
    }

    private static boolean isEqual(final @Nullable Object left, final @Nullable Object right) {
        final var leftNumber = toNumber(left);
        final var rightNumber = toNumber(right);
        if (leftNumber != null && rightNumber != null) {
            return compareNumbers(leftNumber, rightNumber) == 0;
        }
        return Objects.equals(left, right);
    }

    private static int compare(
        final Expression.BinaryOperator operator,
        final @Nullable Object left,
        final @Nullable Object right
    ) {
        final var leftNumber = toNumber(left);
        final var rightNumber = toNumber(right);
        if (leftNumber != null && rightNumber != null) {
            return compareNumbers(leftNumber, rightNumber);
        }
        if (left instanceof String leftString && right instanceof String rightString) {
            return leftString.compareTo(rightString);
        }
        throw signalError(
            "Operator " + operator.symbol() + " can't compare " + describe(left) + " and " + describe(right)
        );
    }

    private static int compareNumbers(final Number left, final Number right) {
        if (left instanceof BigInteger a && right instanceof BigInteger b) {
            return a.compareTo(b);
        }
        return Double.compare(left.doubleValue(), right.doubleValue());
    }

    /**
     * Returns the value as a {@link BigInteger} or a {@link Double}, or {@code null} if it isn't a number.
     */
    private static @Nullable Number toNumber(final @Nullable Object value) {
        if (value instanceof BigInteger integer) {
            return integer;
        } else if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        } else if (value instanceof Number number) {
            return BigInteger.valueOf(number.longValue());
        }
        return null;
    }

    static String describe(final @Nullable Object value) {
        return (value == null) ? "null" : value.getClass().getSimpleName() + " " + value;
    }

    private static UnhandledErrorError signalError(final String message) {
        return ConditionContext.error(new EvaluationErrorCondition(message));
    }
}
