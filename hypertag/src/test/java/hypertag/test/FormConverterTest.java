// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.test;

import java.math.BigInteger;
import java.util.List;
import hypertag.ast.Block;
import hypertag.ast.Document;
import hypertag.ast.Expression;
import hypertag.ast.FormConversionErrorCondition;
import hypertag.ast.FormConverter;
import hypertag.ast.Layout;
import hypertag.ast.Parameter;
import hypertag.ast.TagOccurrence;
import hypertag.sexp.reader.ByteStream;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class FormConverterTest {
    @Test
    void stringIsPlainText() {
        assertThat(convert("\"hello\"").blocks()).containsExactly(Block.Text.of("hello"));
    }

    @Test
    void structuralBlockTakesLayoutKeywords() {
        final var block = single("(div :inline true :margin 2 :indent \"\\t\" \"x\")");
        assertThat(block).isInstanceOf(Block.Struct.class);
        final var struct = (Block.Struct) block;
        assertThat(struct.chain()).containsExactly(TagOccurrence.of("div"));
        assertThat(struct.layout()).isEqualTo(new Layout("\t", false, 2));
        assertThat(struct.body()).containsExactly(Block.Text.of("x"));
    }

    @Test
    void tagChainKeepsAttributes() {
        final var struct = (Block.Struct) single("((: div (a 1 :href \"x.html\")) \"link\")");
        assertThat(struct.chain()).containsExactly(
            TagOccurrence.of("div"),
            new TagOccurrence(
                "a",
                List.of(literal(1)),
                List.of(new TagOccurrence.NamedAttribute("href", new Expression.Literal("x.html")))
            )
        );
        assertThat(struct.layout()).isEqualTo(Layout.outlined());
    }

    @Test
    void tagMarksAreStrippedAndVariablesKept() {
        final var struct = (Block.Struct) single("(%p (($tag :class \"c\")))");
        assertThat(struct.chain()).containsExactly(TagOccurrence.of("p"));
        final var inner = (Block.Struct) struct.body().get(0);
        assertThat(inner.chain().get(0).name()).isEqualTo("$tag");
    }

    @Test
    void hypertagDefinitionListsParameters() {
        final var block = single("(def box (@body $title ($level 2)) (h1 (text $title)) (@ @body))");
        assertThat(block).isInstanceOf(Block.Hypertag.class);
        final var hypertag = (Block.Hypertag) block;
        assertThat(hypertag.name()).isEqualTo("box");
        assertThat(hypertag.bodyParameter()).isEqualTo("body");
        assertThat(hypertag.parameters()).containsExactly(
            Parameter.required("title"),
            new Parameter("level", literal(2))
        );
        assertThat(hypertag.body()).hasSize(2);
        assertThat(hypertag.body().get(1))
            .isEqualTo(new Block.Embed(new Expression.Variable("body"), Layout.outlined()));
    }

    @Test
    void importMarksBareNamesAsTags() {
        final var block = (Block.Import) single("(import \"lib\" * $x y %z)");
        assertThat(block.path()).isEqualTo("lib");
        assertThat(block.symbols()).containsExactly(Block.Import.WILDCARD, "$x", "%y", "%z");

        final var context = (Block.Import) single("(import $title)");
        assertThat(context.path()).isNull();
        assertThat(context.symbols()).containsExactly("$title");
    }

    @Test
    void controlBlocksAreConverted() {
        final var ifBlock = (Block.If) single("(if ((< $x 1) \"small\") ((< $x 10) \"medium\") (else \"large\"))");
        assertThat(ifBlock.clauses()).hasSize(2);
        assertThat(ifBlock.elseBody()).containsExactly(Block.Text.of("large"));

        final var forBlock = (Block.For) single("(for $item $items (text $item))");
        assertThat(forBlock.variable()).isEqualTo("item");
        assertThat(forBlock.iterable()).isEqualTo(new Expression.Variable("items"));

        final var tryBlock = (Block.Try) single("(try ((text $a)) (\"fallback\"))");
        assertThat(tryBlock.alternatives()).hasSize(2);
        assertThat(tryBlock.alternatives().get(1)).containsExactly(Block.Text.of("fallback"));

        final var assignment = (Block.Assignment) single("(= $x (+ $x 1))");
        assertThat(assignment.variable()).isEqualTo("x");
    }

    @Test
    void textModesAreKept() {
        final var markup = (Block.Text) single("(markup :inline true \"<b>\" $x)");
        assertThat(markup.mode()).isEqualTo(Block.TextMode.MARKUP);
        assertThat(markup.parts()).containsExactly(new Expression.Literal("<b>"), new Expression.Variable("x"));
        assertThat(markup.layout()).isEqualTo(Layout.inlined());
        assertThat(((Block.Text) single("(comment \"note\")")).mode()).isEqualTo(Block.TextMode.COMMENT);
    }

    @Test
    void binaryOperatorsFoldLeft() {
        final var expression = expression("(+ 1 2 3)");
        assertThat(expression).isEqualTo(new Expression.Binary(
            Expression.BinaryOperator.PLUS,
            new Expression.Binary(Expression.BinaryOperator.PLUS, literal(1), literal(2)),
            literal(3)
        ));
    }

    @Test
    void specialExpressionsAreRecognized() {
        assertThat(expression("(- $x)"))
            .isEqualTo(new Expression.Unary(Expression.UnaryOperator.NEGATE, new Expression.Variable("x")));
        assertThat(expression("(not true)"))
            .isEqualTo(new Expression.Unary(Expression.UnaryOperator.NOT, new Expression.Literal(true)));
        assertThat(expression("(get $m \"k\")"))
            .isEqualTo(new Expression.Index(new Expression.Variable("m"), new Expression.Literal("k")));
        assertThat(expression("(if null %div \"x\")")).isEqualTo(new Expression.Conditional(
            new Expression.Literal(null),
            new Expression.TagValue("div"),
            new Expression.Literal("x")
        ));
        assertThat(expression("(list 1 false)"))
            .isEqualTo(new Expression.ListOf(List.of(literal(1), new Expression.Literal(false))));
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
        "()",
        "12",
        "(text bare)",
        "(def box ($x @body))",
        "(def box)",
        "(def box $x)",
        "(import)",
        "(if (else \"x\"))",
        "(if (true \"a\") (else \"b\") (false \"c\"))",
        "(try)",
        "(div :inline maybe)",
        "(div :indent \"x\")",
        "(div :margin -1)",
        "(= $x)",
        "(= x 1)",
        "(@ $x $y)",
        "((div :class) \"x\")",
        "((div :a 1 2) \"x\")",
        "(text (unknown 1 2))",
        "(text (+ 1))",
        "(text (not 1 2))",
        "(verbatim $x)",
        "((:) \"x\")",
    })
    void malformedFormsSignalConversionError(final String form) {
        Conditions.expectFatal(FormConversionErrorCondition.class, () -> convert(form));
    }

    private static Document convert(final String text) {
        return FormConverter.read(ByteStream.of(text));
    }

    private static Block single(final String text) {
        final var blocks = convert(text).blocks();
        assertThat(blocks).hasSize(1);
        return blocks.get(0);
    }

    private static Expression expression(final String text) {
        final var embed = (Block.Embed) single("(@ " + text + ")");
        return embed.expression();
    }

    private static Expression literal(final int value) {
        return new Expression.Literal(BigInteger.valueOf(value));
    }
}
