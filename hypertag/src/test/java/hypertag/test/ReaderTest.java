// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.test;

import java.math.BigInteger;
import java.util.List;
import hypertag.sexp.Sexp;
import hypertag.sexp.Sexps;
import hypertag.sexp.SymbolTable;
import hypertag.sexp.reader.ByteStream;
import hypertag.sexp.reader.ReadErrorCondition;
import hypertag.sexp.reader.Reader;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class ReaderTest {
    @Test
    void readsListsStringsIntegersAndSymbols() {
        final var forms = read("(div \"a\\nb \\\"q\\\"\" 12 -3 - $x)\n; comment\n\"tail\"");
        assertThat(forms).hasSize(2);

        final var list = Sexps.asList(forms.get(0));
        assertThat(list).isNotNull().hasSize(6);
        assertThat(Sexps.asSymbol(list.get(0))).extracting(Sexp.Symbol::symbolName).isEqualTo("div");
        assertThat(Sexps.asString(list.get(1))).isEqualTo("a\nb \"q\"");
        assertThat(Sexps.asInteger(list.get(2))).isEqualTo(BigInteger.valueOf(12));
        assertThat(Sexps.asInteger(list.get(3))).isEqualTo(BigInteger.valueOf(-3));
        assertThat(Sexps.asSymbol(list.get(4))).extracting(Sexp.Symbol::symbolName).isEqualTo("-");
        assertThat(Sexps.asSymbol(list.get(5))).extracting(Sexp.Symbol::symbolName).isEqualTo("$x");
        assertThat(Sexps.asString(forms.get(1))).isEqualTo("tail");
    }

    @Test
    void symbolsAreInterned() {
        final var forms = read("(foo foo if :inline)");
        final var list = Sexps.asList(forms.get(0));
        assertThat(list).isNotNull();
        assertThat(list.get(0)).isSameAs(list.get(1));
        assertThat(list.get(2)).isSameAs(Sexp.KnownSymbol.IF);
        assertThat(list.get(3)).isSameAs(Sexp.KnownSymbol.KW_INLINE);
        assertThat(Sexps.asKeyword(list.get(3))).isNotNull();
        assertThat(Sexps.asKeyword(list.get(0))).isNull();
    }

    @Test
    void emptyInputHasNoForms() {
        assertThat(read("")).isEmpty();
        assertThat(read("  ; only a comment")).isEmpty();
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"(div", ")", "(a #b)", "\"unterminated", "(x 'y)", "(a | b)"})
    void malformedInputSignalsReadError(final String input) {
        Conditions.expectFatal(ReadErrorCondition.class, () -> read(input));
    }

    @Test
    void readErrorsCarryLocation() {
        final var condition = Conditions.expectFatal(ReadErrorCondition.class, () -> read("(a)\n\n(b\n #)"));
        assertThat(condition.location().lineNumber()).isEqualTo(4);
        assertThat(condition.location().topLevelFormLine()).isEqualTo(3);
        assertThat(condition.detailedMessage()).contains("line 4");
    }

    @Test
    void prettyPrintingQuotesStrings() {
        final var form = read("(p \"say \\\"hi\\\"\" 1)").get(0);
        assertThat(Sexps.prettyPrint(form)).isEqualTo("(p\n \"say \\\"hi\\\"\"\n 1)");
    }

    private static List<Sexp> read(final String text) {
        return new Reader(ByteStream.of(text), new SymbolTable()).readAll();
    }
}
