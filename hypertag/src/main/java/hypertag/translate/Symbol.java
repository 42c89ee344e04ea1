// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.translate;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * What a name resolves to during analysis.
 */
sealed interface Symbol {
    /**
     * A value supplied by the environment, fixed for the whole analysis.
     */
    record External(@Nullable Object value) implements Symbol {
    }

    /**
     * A variable living in a frame slot.
     *
     * @param frameDepth Depth of the frame holding the slot.
     * @param localScope Identifier of the local scope the variable was bound in; assignments in the same scope reuse
     *                   the slot, assignments in nested scopes bind a new one.
     */
    record Variable(int frameDepth, int localScope, int slot, String name) implements Symbol {
    }

    /**
     * A hypertag defined in the template.
     */
    record Hypertag(HypertagDefinition definition) implements Symbol {
    }
}
