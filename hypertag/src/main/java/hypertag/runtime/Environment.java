// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.runtime;

import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Where templates import names from.
 * <p>
 * Symbols carry a mark: {@code %name} for tags and {@code $name} for variables. A {@code null} path means the
 * context module, {@value #CONTEXT_PATH}, which holds whatever the caller passed in for this rendering.
 */
public interface Environment {
    /**
     * Imports a single symbol.
     *
     * @param symbol A marked symbol; an unmarked one is taken as a tag.
     * @return The symbol's value.
     */
    @Nullable Object importOne(String symbol, @Nullable String path);

    /**
     * Imports every public symbol of a module, keyed by marked symbol. Symbols whose name starts with an underscore
     * are private.
     */
    Map<String, @Nullable Object> importAll(@Nullable String path);

    /**
     * The symbols every document sees without importing anything.
     */
    Map<String, @Nullable Object> importDefault();

    /**
     * Escapes plain text for the output language.
     */
    String escape(String text);

    String CONTEXT_PATH = "~";
    char TAG_MARK = '%';
    char VARIABLE_MARK = '$';

    static String tagSymbol(final String name) {
        return TAG_MARK + name;
    }

    static String variableSymbol(final String name) {
        return VARIABLE_MARK + name;
    }

    /**
     * Adds the tag mark to a symbol that carries no mark.
     */
    static String markedSymbol(final String symbol) {
        if (!symbol.isEmpty() && (symbol.charAt(0) == TAG_MARK || symbol.charAt(0) == VARIABLE_MARK)) {
            return symbol;
        }
        return tagSymbol(symbol);
    }

    /**
     * Checks whether a marked symbol is private to its module.
     */
    static boolean isPrivate(final String symbol) {
        return symbol.length() > 1 && symbol.charAt(1) == '_';
    }
}
