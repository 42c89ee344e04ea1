// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.dom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Criteria for {@link Sequence#select(Selector)}. A {@code null} criterion, or an empty attribute map, matches
 * anything.
 *
 * @param tag        Name of the node's tag.
 * @param id         Exact value of the {@code id} attribute.
 * @param className  One of the whitespace-separated words of the {@code class} attribute.
 * @param attributes Named attributes that must be present with equal values.
 */
public record Selector(
    @Nullable String tag,
    @Nullable String id,
    @Nullable String className,
    Map<String, @Nullable Object> attributes
) {
    public Selector {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * A selector matching every node.
     */
    public static Selector any() {
        return new Selector(null, null, null, Map.of());
    }

    @CheckReturnValue
    public Selector withTag(final String newTag) {
        return new Selector(newTag, id, className, attributes);
    }

    @CheckReturnValue
    public Selector withId(final String newId) {
        return new Selector(tag, newId, className, attributes);
    }

    @CheckReturnValue
    public Selector withClassName(final String newClassName) {
        return new Selector(tag, id, newClassName, attributes);
    }

    @CheckReturnValue
    public Selector withAttribute(final String name, final @Nullable Object value) {
        final var newAttributes = new LinkedHashMap<>(attributes);
        newAttributes.put(name, value);
        return new Selector(tag, id, className, newAttributes);
    }

    /**
     * Checks whether the given node, by itself, meets all criteria.
     */
    public boolean matches(final Node node) {
        if (!(node instanceof Node.Element element)) {
            return tag == null && id == null && className == null && attributes.isEmpty();
        }
        final var nodeTag = element.tag();
        if (tag != null && (nodeTag == null || !tag.equals(nodeTag.name()))) {
            return false;
        }
        final var named = element.namedAttributes();
        if (id != null && !id.equals(asString(named.get("id")))) {
            return false;
        }
        if (className != null && !hasClass(asString(named.get("class")), className)) {
            return false;
        }
        for (final var entry : attributes.entrySet()) {
            if (!named.containsKey(entry.getKey()) || !Objects.equals(named.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static @Nullable String asString(final @Nullable Object value) {
        return (value == null) ? null : value.toString();
    }

    private static boolean hasClass(final @Nullable String classes, final String wanted) {
        if (classes == null) {
            return false;
        }
        for (final var word : classes.trim().split("\\s+")) {
            if (word.equals(wanted)) {
                return true;
            }
        }
        return false;
    }
}
