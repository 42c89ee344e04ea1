// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.ast;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A regular attribute of a hypertag definition.
 *
 * @param name         The attribute name, without a mark.
 * @param defaultValue The default, evaluated in the definition's scope when the attribute is read; {@code null} makes
 *                     the attribute required.
 */
public record Parameter(String name, @Nullable Expression defaultValue) {
    public static Parameter required(final String name) {
        return new Parameter(name, null);
    }
}
