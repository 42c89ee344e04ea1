// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.test;

import java.util.List;
import java.util.Map;
import hypertag.dom.ArgumentErrorCondition;
import hypertag.dom.Node;
import hypertag.markup.BuiltinTags;
import hypertag.markup.DedentTag;
import hypertag.markup.JavascriptTag;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class BuiltinTagsTest {
    @Test
    void registryHoldsBuiltins() {
        assertThat(BuiltinTags.all())
            .containsEntry("dedent", DedentTag.instance())
            .containsEntry("javascript", JavascriptTag.instance())
            .hasSize(2);
        assertThat(DedentTag.instance().isTextual()).isTrue();
        assertThat(JavascriptTag.instance().isTextual()).isTrue();
    }

    @Test
    void nestedDedentStripsEveryLine() {
        final var node = Node.tagged(DedentTag.instance(), Node.text("    a\n      b\n  c"));
        assertThat(node.render()).isEqualTo("a\nb\nc");
    }

    @Test
    void flatDedentKeepsRelativeIndentation() {
        final var positional = Node.element(
            Node.Parameters.tagged(DedentTag.instance(), List.of(false), Map.of()),
            Node.text("    a\n      b")
        );
        assertThat(positional.render()).isEqualTo("a\n  b");

        final var named = Node.element(
            Node.Parameters.tagged(DedentTag.instance(), List.of(), Map.of("nested", false)),
            Node.text("  x\n  y")
        );
        assertThat(named.render()).isEqualTo("x\ny");
    }

    @Test
    void dedentRejectsUnknownAttributes() {
        Conditions.expectFatal(
            ArgumentErrorCondition.class,
            () -> Node.element(
                Node.Parameters.tagged(DedentTag.instance(), List.of(), Map.of("deep", true)),
                Node.text("x")
            ).render()
        );
    }

    @Test
    void javascriptWrapsCodeInScriptElement() {
        final var node = Node.tagged(JavascriptTag.instance(), Node.text("f();"));
        assertThat(node.render()).isEqualTo("<script type=\"text/javascript\">\n<!--\nf();\n-->\n</script>");
    }

    @Test
    void javascriptTakesNoAttributes() {
        final var condition = Conditions.expectFatal(
            ArgumentErrorCondition.class,
            () -> Node.element(
                Node.Parameters.tagged(JavascriptTag.instance(), List.of("x"), Map.of()),
                Node.text("f();")
            ).render()
        );
        assertThat(condition.tagName()).isEqualTo("javascript");
    }
}
