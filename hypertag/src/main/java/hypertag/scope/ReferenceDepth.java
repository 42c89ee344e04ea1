// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.scope;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The minimum depth of the frames some code reads from, or nothing if it reads no variables at all.
 * <p>
 * Names from the environment count as depth -1.
 */
public final class ReferenceDepth {
    public @Nullable Integer value() {
        return value;
    }

    public void add(final int depth) {
        final var current = value;
        value = (current == null) ? depth : Math.min(current, depth);
    }

    /**
     * Adds the given depth if there is one; {@code null} leaves the value unchanged.
     */
    public void merge(final @Nullable Integer depth) {
        if (depth != null) {
            add(depth);
        }
    }

    @Override
    public String toString() {
        return "ReferenceDepth[" + value + "]";
    }

    private @Nullable Integer value = null;
}
