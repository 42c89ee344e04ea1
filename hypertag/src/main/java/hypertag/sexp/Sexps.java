// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.sexp;

import java.math.BigInteger;
import java.util.List;
import hypertag.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Common operations on S-expressions.
 */
public final class Sexps {
    private Sexps() {
    }

    /**
     * Returns the integer the given {@code sexp} represents, or {@code null} if it isn't an integer.
     */
    public static @Nullable BigInteger asInteger(final Sexp sexp) {
        return (sexp instanceof Sexp.Integer integer) ? integer.value() : null;
    }

    /**
     * Returns the string the given {@code sexp} represents, or {@code null} if it isn't a string.
     */
    public static @Nullable String asString(final Sexp sexp) {
        return (sexp instanceof Sexp.String string) ? string.value() : null;
    }

    /**
     * Returns the elements of the given {@code sexp}, or {@code null} if it isn't a list.
     */
    public static @Nullable List<Sexp> asList(final Sexp sexp) {
        return (sexp instanceof Sexp.List list) ? list.value() : null;
    }

    /**
     * Returns the given {@code sexp} as a symbol, or {@code null} if it isn't one.
     */
    public static Sexp.@Nullable Symbol asSymbol(final Sexp sexp) {
        return (sexp instanceof Sexp.Symbol symbol) ? symbol : null;
    }

    /**
     * Returns the given {@code sexp} iff it's a keyword, that is a symbol whose name starts with a colon and has
     * more after it, or {@code null} otherwise.
     */
    public static Sexp.@Nullable Symbol asKeyword(final Sexp sexp) {
        return (sexp instanceof Sexp.Symbol symbol && symbol.symbolName().length() > 1
            && symbol.symbolName().startsWith(":")) ? symbol : null;
    }

    /**
     * Pretty-prints the given S-expression, for error messages.
     */
    public static String prettyPrint(final Sexp sexp) {
        final var prettyPrinter = new PrettyPrinter();
        prettyPrinter.appendDispatch(sexp, 1);
        return prettyPrinter.builder.toString();
    }

    private static final class PrettyPrinter {
        private void appendDispatch(final Sexp sexp, final int level) {
            if (sexp instanceof Sexp.Integer integer) {
                builder.append(integer.value());
            } else if (sexp instanceof Sexp.String string) {
                append(string.value());
            } else if (sexp instanceof Sexp.List list) {
                append(list.value(), level);
            } else if (sexp instanceof Sexp.Symbol symbol) {
                builder.append(symbol.symbolName());
            } else {
                throw new UnreachableCodeReachedError();
            }
        }

        private void append(final String string) {
            final var replaced = string.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
            builder.append('"');
            builder.append(replaced);
            builder.append('"');
        }

        private void append(final List<Sexp> list, final int level) {
            final var iterator = list.iterator();
            if (!iterator.hasNext()) {
                builder.append("()");
                return;
            }
            builder.append('(');
            appendDispatch(iterator.next(), level + 1);
            final var indentation = " ".repeat(level);
            while (iterator.hasNext()) {
                builder.append('\n');
                builder.append(indentation);
                appendDispatch(iterator.next(), level + 1);
            }
            builder.append(')');
        }

        private final StringBuilder builder = new StringBuilder();
    }
}
