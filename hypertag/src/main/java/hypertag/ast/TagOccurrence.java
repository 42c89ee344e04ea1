// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.ast;

import java.util.List;

/**
 * One tag in the header of a structural block, with its attributes.
 *
 * @param name       The tag name, without a mark; a variable holding a tag is written with its {@code $} mark.
 * @param positional Positional attribute expressions.
 * @param named      Named attributes, in source order; a name may repeat.
 */
public record TagOccurrence(String name, List<Expression> positional, List<NamedAttribute> named) {
    public TagOccurrence {
        positional = List.copyOf(positional);
        named = List.copyOf(named);
    }

    public static TagOccurrence of(final String name) {
        return new TagOccurrence(name, List.of(), List.of());
    }

    /**
     * A named attribute of an occurrence.
     */
    public record NamedAttribute(String name, Expression value) {
    }
}
