// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.markup;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import hypertag.dom.ArgumentErrorCondition;
import hypertag.dom.Indentation;
import hypertag.dom.Tag;
import hypertag.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@code dedent}: removes indentation from its rendered body.
 * <p>
 * With {@code nested} true, the default, all leading whitespace of every line goes away, blank lines included;
 * otherwise only the indentation common to all lines is removed.
 */
public final class DedentTag implements Tag {
    private DedentTag() {
    }

    public static DedentTag instance() {
        return instance;
    }

    @Override
    public String name() {
        return "dedent";
    }

    @Override
    public boolean isTextual() {
        return true;
    }

    @Override
    public boolean isPure() {
        return true;
    }

    @Override
    public String expand(
        final Body body,
        final List<@Nullable Object> attributes,
        final Map<String, @Nullable Object> namedAttributes
    ) {
        final var text = body.render();
        return isNested(attributes, namedAttributes)
            ? leadingWhitespace.matcher(text).replaceAll("")
            : Indentation.delIndent(text);
    }

    private boolean isNested(
        final List<@Nullable Object> attributes,
        final Map<String, @Nullable Object> namedAttributes
    ) {
        if (attributes.size() > 1 || (attributes.size() == 1 && namedAttributes.containsKey("nested"))) {
            throw ConditionContext.error(new ArgumentErrorCondition(name(), "dedent takes a single 'nested' flag"));
        }
        for (final var key : namedAttributes.keySet()) {
            if (!key.equals("nested")) {
                throw ConditionContext.error(new ArgumentErrorCondition(
                    name(),
                    "dedent got an unexpected keyword attribute '" + key + "'"
                ));
            }
        }
        final var value = attributes.isEmpty() ? namedAttributes.getOrDefault("nested", true) : attributes.get(0);
        return value != null && !Boolean.FALSE.equals(value);
    }

    private static final Pattern leadingWhitespace = Pattern.compile("^\\s+", Pattern.MULTILINE | Pattern.UNIX_LINES);
    private static final DedentTag instance = new DedentTag();
}
