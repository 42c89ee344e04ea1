// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.ast;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An expression embedded in a template.
 */
public sealed interface Expression {
    /**
     * A constant: a string, an integer ({@link java.math.BigInteger}), a boolean or {@code null}.
     */
    record Literal(@Nullable Object value) implements Expression {
    }

    /**
     * A variable reference, {@code $name}.
     */
    record Variable(String name) implements Expression {
    }

    /**
     * A tag taken as a value, {@code %name}. A hypertag defined in the template yields a closure.
     */
    record TagValue(String name) implements Expression {
    }

    record ListOf(List<Expression> elements) implements Expression {
        public ListOf {
            elements = List.copyOf(elements);
        }
    }

    record Unary(UnaryOperator operator, Expression operand) implements Expression {
    }

    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
    }

    /**
     * {@code then} if {@code test} is true, else {@code otherwise}.
     */
    record Conditional(Expression test, Expression then, Expression otherwise) implements Expression {
    }

    /**
     * An element of a list or a value of a map.
     */
    record Index(Expression target, Expression key) implements Expression {
    }

    enum UnaryOperator {
        NOT("not"),
        NEGATE("neg");

        UnaryOperator(final String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        private final String symbol;
    }

    enum BinaryOperator {
        PLUS("+"),
        MINUS("-"),
        TIMES("*"),
        DIVIDE("/"),
        MODULO("mod"),
        EQUAL("=="),
        NOT_EQUAL("!="),
        LESS("<"),
        LESS_EQUAL("<="),
        GREATER(">"),
        GREATER_EQUAL(">="),
        AND("and"),
        OR("or");

        BinaryOperator(final String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Looks up an operator by its symbol, or returns {@code null} if there's none.
         */
        public static @Nullable BinaryOperator bySymbol(final String symbol) {
            return Lookup.bySymbol.get(symbol);
        }

        private final String symbol;

        private static final class Lookup {
            private static final Map<String, BinaryOperator> bySymbol = new HashMap<>();

            static {
                for (final var operator : values()) {
                    bySymbol.put(operator.symbol, operator);
                }
            }
        }
    }
}
