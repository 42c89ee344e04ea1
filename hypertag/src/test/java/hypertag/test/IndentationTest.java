// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.test;

import java.util.ArrayList;
import java.util.stream.LongStream;
import hypertag.dom.Indentation;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class IndentationTest {
    static LongStream provideSeeds() {
        return RandomUtils.provideSeeds();
    }

    @Test
    void addIndentSkipsEmptyLines() {
        assertThat(Indentation.addIndent("a\nb", "  ")).isEqualTo("  a\n  b");
        assertThat(Indentation.addIndent("a\n\nb", "  ")).isEqualTo("  a\n\n  b");
        assertThat(Indentation.addIndent("\nx", "\t")).isEqualTo("\n\tx");
        assertThat(Indentation.addIndent("a\n", "  ")).isEqualTo("  a\n");
        assertThat(Indentation.addIndent("a\n \nb", "  ")).isEqualTo("  a\n   \n  b");
        assertThat(Indentation.addIndent("a\nb", "")).isEqualTo("a\nb");
    }

    @Test
    void addIndentTreatsOnlyLineFeedAsSeparator() {
        assertThat(Indentation.addIndent("a\rb", " ")).isEqualTo(" a\rb");
    }

    @Test
    void getIndentFindsCommonPrefix() {
        assertThat(Indentation.getIndent("  a\n    b\n")).isEqualTo("  ");
        assertThat(Indentation.getIndent("    a\n      \n    b")).isEqualTo("    ");
        assertThat(Indentation.getIndent("  a\n\tb")).isEmpty();
        assertThat(Indentation.getIndent("a\n  b")).isEmpty();
        assertThat(Indentation.getIndent("  a\n  a")).isEqualTo("  ");
    }

    @Test
    void getIndentOfBlankTextIsEmpty() {
        assertThat(Indentation.getIndent("")).isEmpty();
        assertThat(Indentation.getIndent("\n\n")).isEmpty();
        assertThat(Indentation.getIndent("   \n\t")).isEmpty();
    }

    @Test
    void delIndentRemovesGivenPrefix() {
        assertThat(Indentation.delIndent("  a\n    b")).isEqualTo("a\n  b");
        assertThat(Indentation.delIndent("  a\n b", "  ")).isEqualTo("a\n b");
        assertThat(Indentation.delIndent("a\n  b", "  ")).isEqualTo("a\nb");
        assertThat(Indentation.delIndent("text", "")).isEqualTo("text");
    }

    @Test
    void absoluteIndentationStartsWithNewline() {
        assertThat(Indentation.isAbsolute("\n  ")).isTrue();
        assertThat(Indentation.isAbsolute("\n")).isTrue();
        assertThat(Indentation.isAbsolute("  ")).isFalse();
        assertThat(Indentation.isAbsolute("")).isFalse();
    }

    @ParameterizedTest(name = "seed = {0}")
    @MethodSource("provideSeeds")
    void delIndentUndoesAddIndent(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        for (int iteration = 0; iteration < 100; iteration += 1) {
            final var lines = new ArrayList<String>();
            lines.add(RandomUtils.generateWord(random));
            final var lineCount = random.nextInt(10);
            for (int i = 0; i < lineCount; i += 1) {
                final var isEmpty = random.nextInt(4) == 0;
                lines.add(isEmpty ? "" : RandomUtils.generateIndent(random, 4) + RandomUtils.generateWord(random));
            }
            final var text = String.join("\n", lines);
            final var indent = RandomUtils.generateIndent(random, 6);

            final var indented = Indentation.addIndent(text, indent);
            assertThat(Indentation.getIndent(indented)).isEqualTo(indent);
            assertThat(Indentation.delIndent(indented)).isEqualTo(text);
        }
    }
}
