// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.markup;

import java.util.List;
import java.util.Map;
import hypertag.dom.ArgumentErrorCondition;
import hypertag.dom.Tag;
import hypertag.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@code javascript}: wraps its rendered body in a {@code <script>} element, inside an HTML comment so that the code
 * isn't parsed as markup.
 */
public final class JavascriptTag implements Tag {
    private JavascriptTag() {
    }

    public static JavascriptTag instance() {
        return instance;
    }

    @Override
    public String name() {
        return "javascript";
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
        if (!attributes.isEmpty() || !namedAttributes.isEmpty()) {
            throw ConditionContext.error(new ArgumentErrorCondition(name(), "javascript takes no attributes"));
        }
        return "<script type=\"text/javascript\">\n<!--\n" + body.render() + "\n-->\n</script>";
    }

    private static final JavascriptTag instance = new JavascriptTag();
}
