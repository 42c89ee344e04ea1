// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.markup;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Character escaping for HTML text and attribute values.
 */
public final class Escaping {
    private Escaping() {
    }

    /**
     * Escapes {@code <}, {@code >} and {@code &} for use as element text.
     */
    public static String escapeText(final String text) {
        return escape(text, TextEscaper.instance);
    }

    /**
     * Quotes an attribute value: double quotes if the value contains none, else single quotes if it contains none of
     * those, else double quotes with all special characters escaped.
     */
    public static String quoteAttribute(final String value) {
        if (value.indexOf('"') < 0) {
            return '"' + value + '"';
        }
        if (value.indexOf('\'') < 0) {
            return '\'' + value + '\'';
        }
        return '"' + escape(value, AttributeEscaper.instance) + '"';
    }

    private static String escape(final String string, final Escaper escaper) {
        var indexToEscape = findCharacterToEscape(string, 0, escaper);
        if (indexToEscape < 0) {
            return string;
        }
        final var builder = new StringBuilder(string.length() + 16);
        int index = 0;
        while (indexToEscape >= 0) {
            builder.append(string, index, indexToEscape);
            builder.append(Objects.requireNonNull(escaper.escape(string.charAt(indexToEscape))));
            index = indexToEscape + 1;
            indexToEscape = findCharacterToEscape(string, index, escaper);
        }
        builder.append(string, index, string.length());
        return builder.toString();
    }

    private static int findCharacterToEscape(final String string, final int startIndex, final Escaper escaper) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escaper.escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private sealed interface Escaper {
        @Nullable String escape(char character);
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '&' -> "&amp;";
                default -> null;
            };
        }

        private static final TextEscaper instance = new TextEscaper();
    }

    private static final class AttributeEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '"' -> "&quot;";
                case '\n' -> "&#10;";
                case '\r' -> "&#13;";
                case '\t' -> "&#9;";
                default -> TextEscaper.instance.escape(character);
            };
        }

        private static final AttributeEscaper instance = new AttributeEscaper();
    }
}
