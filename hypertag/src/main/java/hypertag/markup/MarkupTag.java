// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.markup;

import java.util.List;
import java.util.Map;
import hypertag.dom.ArgumentErrorCondition;
import hypertag.dom.Tag;
import hypertag.dom.VoidBodyCondition;
import hypertag.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A tag rendering a single (X)HTML element.
 * <p>
 * Attributes are named only; {@code true} renders as a boolean attribute and {@code false} or {@code null} omits the
 * attribute. A void element renders as {@code <name attrs />}. The closing tag of a non-void element goes on its own
 * line when the body starts with a newline.
 */
public final class MarkupTag implements Tag {
    /**
     * Initializes a new markup tag.
     *
     * @param name   The element name, used verbatim in the output.
     * @param isVoid Whether the element takes no content.
     * @param mode   The dialect deciding how boolean attributes are written.
     */
    public MarkupTag(final String name, final boolean isVoid, final MarkupMode mode) {
        this.name = name;
        this.isVoid = isVoid;
        this.mode = mode;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isVoid() {
        return isVoid;
    }

    @Override
    public boolean isPure() {
        return true;
    }

    public MarkupMode mode() {
        return mode;
    }

    @Override
    public String expand(
        final Body body,
        final List<@Nullable Object> attributes,
        final Map<String, @Nullable Object> namedAttributes
    ) {
        if (!attributes.isEmpty()) {
            throw ConditionContext.error(new ArgumentErrorCondition(
                name,
                "Element '" + name + "' takes no positional attributes but " + attributes.size() + " were given"
            ));
        }
        final var openingTag = openingTag(namedAttributes);
        if (isVoid) {
            if (!body.isEmpty()) {
                throw ConditionContext.error(new VoidBodyCondition(name));
            }
            return "<" + openingTag + " />";
        }
        final var text = body.render();
        final var closingNewline = text.startsWith("\n") ? "\n" : "";
        return "<" + openingTag + ">" + text + closingNewline + "</" + name + ">";
    }

    @Override
    public String toString() {
        return "MarkupTag[" + name + (isVoid ? ", void, " : ", ") + mode + "]";
    }

    private String openingTag(final Map<String, @Nullable Object> namedAttributes) {
        final var builder = new StringBuilder(name);
        for (final var entry : namedAttributes.entrySet()) {
            final var attributeName = entry.getKey();
            final var value = entry.getValue();
            if (value == null || Boolean.FALSE.equals(value)) {
                continue;
            }
            builder.append(' ');
            if (Boolean.TRUE.equals(value)) {
                builder.append(attributeName);
                if (mode == MarkupMode.XHTML) {
                    builder.append("=\"").append(attributeName).append('"');
                }
            } else {
                builder.append(attributeName).append('=').append(Escaping.quoteAttribute(value.toString()));
            }
        }
        return builder.toString();
    }

    private final String name;
    private final boolean isVoid;
    private final MarkupMode mode;
}
