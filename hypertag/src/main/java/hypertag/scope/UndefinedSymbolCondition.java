// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.scope;

import hypertag.util.condition.Condition;

/**
 * A condition type indicating that a name could not be resolved: an undefined variable or tag, a symbol missing from
 * an imported module, an unknown module, or a variable read before any assignment.
 */
public final class UndefinedSymbolCondition extends Condition {
    /**
     * Initializes a new {@code UndefinedSymbolCondition} about the given symbol.
     */
    public UndefinedSymbolCondition(final String symbol, final String message) {
        super(message);
        this.symbol = symbol;
    }

    /**
     * The unresolved symbol, including its {@code %} or {@code $} mark where there is one.
     */
    public String symbol() {
        return symbol;
    }

    private final String symbol;
}
