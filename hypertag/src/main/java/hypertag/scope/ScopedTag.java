// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.scope;

import java.util.List;
import java.util.Map;
import hypertag.dom.Sequence;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A tag defined inside a template, whose expansion runs in a new frame linked to the frame it was defined in.
 */
public interface ScopedTag {
    String name();

    /**
     * Whether the tag declares a body attribute; one that doesn't rejects a non-empty body.
     */
    boolean acceptsBody();

    /**
     * Expands the tag into nodes.
     *
     * @param caller The frame of the expansion site; its stack receives the new frame.
     */
    Sequence expand(
        Frame caller,
        Sequence body,
        List<@Nullable Object> attributes,
        Map<String, @Nullable Object> namedAttributes
    );
}
