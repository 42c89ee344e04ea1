// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.sexp;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The base type of S-expression objects, which are all immutable.
 */
public sealed interface Sexp {
    /**
     * Base interface for symbols. Interned symbols are compared by identity.
     */
    sealed interface Symbol extends Sexp {
        java.lang.String symbolName();
    }

    record Integer(BigInteger value) implements Sexp {
    }

    /**
     * A proper list; dotted lists don't exist here.
     */
    record List(java.util.List<Sexp> value) implements Sexp {
        public List {
            value = java.util.List.copyOf(value);
        }
    }

    record String(java.lang.String value) implements Sexp {
    }

    /**
     * A symbol Java code doesn't refer to by identity, such as a tag or variable name.
     */
    final class RegularSymbol implements Sexp.Symbol {
        /**
         * Initializes a new, <em>uninterned</em> symbol; prefer {@link SymbolTable#intern(java.lang.String)}.
         */
        public RegularSymbol(final java.lang.String name) {
            this.name = name;
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private final java.lang.String name;
    }

    /**
     * Symbols the form converter gives a meaning to.
     */
    enum KnownSymbol implements Sexp.Symbol {
        TRUE("true"),
        FALSE("false"),
        NULL("null"),
        TEXT("text"),
        MARKUP("markup"),
        VERBATIM("verbatim"),
        COMMENT("comment"),
        DEF("def"),
        IMPORT("import"),
        IF("if"),
        ELSE("else"),
        FOR("for"),
        WHILE("while"),
        TRY("try"),
        ASSIGN("="),
        EMBED("@"),
        CHAIN(":"),
        WILDCARD("*"),
        LIST("list"),
        NOT("not"),
        NEGATE("neg"),
        GET("get"),
        KW_INLINE(":inline"),
        KW_INDENT(":indent"),
        KW_MARGIN(":margin");

        KnownSymbol(final java.lang.String name) {
            this.name = name;
        }

        /**
         * Returns the known symbol with the given name, or {@code null} if there's none.
         */
        public static @Nullable KnownSymbol byName(final java.lang.String name) {
            return Lookup.byName.get(name);
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private final java.lang.String name;

        private static final class Lookup {
            private static final Map<java.lang.String, KnownSymbol> byName = new HashMap<>();

            static {
                for (final var symbol : values()) {
                    byName.put(symbol.name, symbol);
                }
            }
        }
    }
}
