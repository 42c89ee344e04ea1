// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.dom;

import java.util.ArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-indentation arithmetic on multi-line strings.
 * <p>
 * Only {@code \n} separates lines. Adding indentation skips lines of length zero, but indents lines holding
 * whitespace only. Computing the common indentation ignores both kinds of blank line.
 */
public final class Indentation {
    private Indentation() {
    }

    /**
     * Prepends {@code indent} to every line of {@code text} that isn't zero-length, whitespace-only lines included.
     */
    public static String addIndent(final String text, final String indent) {
        if (indent.isEmpty()) {
            return text;
        }
        return lineStart.matcher(text).replaceAll(Matcher.quoteReplacement(indent));
    }

    /**
     * Removes the common indentation of {@code text}, as computed by {@link #getIndent(String)}.
     */
    public static String delIndent(final String text) {
        return delIndent(text, getIndent(text));
    }

    /**
     * Removes {@code indent} from the start of the text and from the start of every following line that begins with
     * it. Lines that don't begin with {@code indent} are left alone.
     */
    public static String delIndent(final String text, final String indent) {
        if (indent.isEmpty()) {
            return text;
        }
        final var stripped = text.startsWith(indent) ? text.substring(indent.length()) : text;
        return stripped.replace("\n" + indent, "\n");
    }

    /**
     * Returns the longest whitespace prefix shared by all non-blank lines of {@code text}; the empty string if there's
     * no such line.
     */
    public static String getIndent(final String text) {
        final var lines = new ArrayList<String>();
        for (final var line : text.split("\n", -1)) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        if (lines.isEmpty()) {
            return "";
        }

        final var first = lines.get(0);
        var shortest = first.length();
        for (final var line : lines) {
            shortest = Math.min(shortest, line.length());
        }
        for (int column = 0; column < shortest; column += 1) {
            final var character = first.charAt(column);
            if (!Character.isWhitespace(character)) {
                return first.substring(0, column);
            }
            for (final var line : lines) {
                if (line.charAt(column) != character) {
                    return first.substring(0, column);
                }
            }
        }
        return first.substring(0, shortest);
    }

    /**
     * Checks whether the given indentation is absolute, that is, begins with a newline.
     */
    public static boolean isAbsolute(final String indent) {
        return indent.startsWith("\n");
    }

    // Start of a line that has at least one character; UNIX_LINES so that only \n ends a line.
    private static final Pattern lineStart = Pattern.compile("^(?=.)", Pattern.MULTILINE | Pattern.UNIX_LINES);
}
