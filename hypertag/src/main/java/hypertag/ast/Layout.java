// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.ast;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Where a block sits in the source.
 *
 * @param indent  Indentation of the block relative to its parent block, whitespace only; {@code null} means the
 *                translator's default step for outline blocks and none for inline ones.
 * @param outline Whether the block starts on its own line; a block following its parent's header on the same line is
 *                inline.
 * @param margin  Number of blank lines preceding the block.
 */
public record Layout(@Nullable String indent, boolean outline, int margin) {
    public Layout {
        if (margin < 0) {
            throw new IllegalArgumentException("Negative margin " + margin);
        }
        if (indent != null && !indent.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new IllegalArgumentException("Block indentation must be spaces or tabs");
        }
    }

    public static Layout outlined() {
        return outlineLayout;
    }

    public static Layout inlined() {
        return inlineLayout;
    }

    @CheckReturnValue
    public Layout withIndent(final @Nullable String newIndent) {
        return new Layout(newIndent, outline, margin);
    }

    @CheckReturnValue
    public Layout withMargin(final int newMargin) {
        return new Layout(indent, outline, newMargin);
    }

    private static final Layout outlineLayout = new Layout(null, true, 0);
    private static final Layout inlineLayout = new Layout(null, false, 0);
}
