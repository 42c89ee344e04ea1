// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.ast;

import java.util.List;

/**
 * A whole template: its top-level blocks, in order.
 */
public record Document(List<Block> blocks) {
    public Document {
        blocks = List.copyOf(blocks);
    }

    public static Document of(final Block... blocks) {
        return new Document(List.of(blocks));
    }
}
