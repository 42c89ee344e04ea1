// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.sexp;

import java.util.HashMap;
import org.jetbrains.annotations.NotNull;

/**
 * A table for interning symbols, so that they can be compared by identity.
 * <p>
 * One table is used per template read; it isn't thread-safe.
 */
public final class SymbolTable {
    /**
     * Returns the canonical symbol with the given name: the known symbol if there is one, otherwise the symbol this
     * table created on first request.
     */
    public @NotNull Sexp.Symbol intern(final @NotNull String symbolName) {
        final var knownSymbol = Sexp.KnownSymbol.byName(symbolName);
        if (knownSymbol != null) {
            return knownSymbol;
        }
        return symbols.computeIfAbsent(symbolName, Sexp.RegularSymbol::new);
    }

    private final HashMap<String, Sexp.RegularSymbol> symbols = new HashMap<>();
}
