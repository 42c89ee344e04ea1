// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.markup;

import java.util.Map;
import hypertag.dom.Tag;

/**
 * Tags available in every document regardless of dialect.
 */
public final class BuiltinTags {
    private BuiltinTags() {
    }

    /**
     * Returns the unmodifiable map of built-in tags, keyed by name.
     */
    public static Map<String, Tag> all() {
        return tags;
    }

    private static final Map<String, Tag> tags = Map.of(
        DedentTag.instance().name(), DedentTag.instance(),
        JavascriptTag.instance().name(), JavascriptTag.instance()
    );
}
