// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.test;

import java.util.List;
import java.util.Map;
import hypertag.dom.MalformedIndentError;
import hypertag.dom.Node;
import hypertag.dom.VoidBodyCondition;
import hypertag.markup.MarkupMode;
import hypertag.markup.MarkupTag;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import org.junit.jupiter.api.Test;

final class NodeTest {
    @Test
    void nestedOutlineElementsAreIndentedRelativeToParents() {
        final var text = Node.text("x", outlineAt("\n    "));
        final var span = Node.element(Node.Parameters.tagged(spanTag).withIndent("\n  ").withOutline(true), text);
        final var div = Node.element(Node.Parameters.tagged(divTag).withIndent("\n").withOutline(true), span);
        final var root = Node.root(div);

        assertThat(text.indent()).isEqualTo("  ");
        assertThat(span.indent()).isEqualTo("  ");
        assertThat(div.indent()).isEmpty();
        assertThat(root.render()).isEqualTo("<div>\n  <span>\n    x\n  </span>\n</div>");
    }

    @Test
    void inlineBodyStaysOnTheSameLine() {
        final var root = Node.root(
            Node.element(Node.Parameters.tagged(divTag).withIndent("\n").withOutline(true), Node.text("x"))
        );
        assertThat(root.render()).isEqualTo("<div>x</div>");
    }

    @Test
    void rootDropsOnlyTheFirstNewline() {
        final var root = Node.root(Node.text("a", outlineAt("\n")), Node.text("b", outlineAt("\n")));
        assertThat(root.render()).isEqualTo("a\nb");
        assertThat(root.render(false)).isEqualTo("\na\nb");
    }

    @Test
    void tailLinesOfTextFollowTheIndentation() {
        final var root = Node.root(Node.text("a\nb", outlineAt("\n  ")));
        assertThat(root.render()).isEqualTo("  a\n  b");
    }

    @Test
    void nodeWithoutIndentationPassesItsParentsThrough() {
        final var text = Node.text("x", outlineAt("\n    "));
        final var group = Node.group(text);
        Node.element(Node.Parameters.tagged(divTag).withIndent("\n  "), group);
        assertThat(group.indent()).isNull();
        assertThat(text.indent()).isEqualTo("  ");
    }

    @Test
    void outlineContainerIndentsInlineChildrenAndTextLines() {
        final var div = Node.element(
            Node.Parameters.none().withIndent("  ").withOutline(true),
            Node.tagged(spanTag, Node.text("a")),
            Node.text("\nb\n")
        );
        assertThat(div.render()).isEqualTo("\n  <span>a</span>\n  b\n");
    }

    @Test
    void groupRendersBodyOnly() {
        assertThat(Node.group(Node.text("a"), Node.text("b")).render()).isEqualTo("ab");
    }

    @Test
    void childIndentationMustExtendParents() {
        final var text = Node.text("x", outlineAt("\n "));
        assertThatExceptionOfType(MalformedIndentError.class)
            .isThrownBy(() -> Node.element(Node.Parameters.tagged(divTag).withIndent("\n  "), text));
    }

    @Test
    void outlineNodeWithAbsoluteIndentationCannotBeRendered() {
        final var text = Node.text("x", outlineAt("\n  "));
        assertThatExceptionOfType(MalformedIndentError.class).isThrownBy(text::render);
    }

    @Test
    void textNodesCarryNoTag() {
        assertThatIllegalArgumentException().isThrownBy(() -> Node.text("x", Node.Parameters.tagged(divTag)));
    }

    @Test
    void voidElementRendersWithoutBody() {
        assertThat(Node.tagged(brTag).render()).isEqualTo("<br />");
        final var condition = Conditions.expectFatal(
            VoidBodyCondition.class,
            () -> Node.tagged(brTag, Node.text("x")).render()
        );
        assertThat(condition.tagName()).isEqualTo("br");
    }

    @Test
    void parametersAreCopied() {
        final var parameters = Node.Parameters.tagged(divTag, List.<Object>of("a"), Map.<String, Object>of("id", "x"));
        final var element = Node.element(parameters);
        assertThat(element.tag()).isSameAs(divTag);
        assertThat(element.attributes()).containsExactly("a");
        assertThat(element.namedAttributes()).containsEntry("id", "x");
        assertThat(element.isOutline()).isFalse();
        element.markOutline();
        assertThat(element.isOutline()).isTrue();
    }

    private static Node.Parameters outlineAt(final String indent) {
        return Node.Parameters.none().withIndent(indent).withOutline(true);
    }

    private static final MarkupTag divTag = new MarkupTag("div", false, MarkupMode.HTML);
    private static final MarkupTag spanTag = new MarkupTag("span", false, MarkupMode.HTML);
    private static final MarkupTag brTag = new MarkupTag("br", true, MarkupMode.HTML);
}
