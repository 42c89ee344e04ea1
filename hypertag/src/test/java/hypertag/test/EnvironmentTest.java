// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.test;

import java.util.Map;
import hypertag.markup.DedentTag;
import hypertag.markup.MarkupMode;
import hypertag.markup.MarkupTag;
import hypertag.runtime.Environment;
import hypertag.runtime.StandardEnvironment;
import hypertag.scope.UndefinedSymbolCondition;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class EnvironmentTest {
    @Test
    void defaultImportsHoldMarkupAndBuiltins() {
        final var defaults = StandardEnvironment.html().importDefault();
        assertThat(defaults).containsKeys("%div", "%DIV", "%br", "%dedent", "%javascript");
        assertThat(defaults.get("%dedent")).isSameAs(DedentTag.instance());
        assertThat(defaults).doesNotContainKey("div");
    }

    @Test
    void xhtmlModeUsesLowerCaseTagsOnly() {
        final var environment = StandardEnvironment.builder().markupMode(MarkupMode.XHTML).build();
        assertThat(environment.markupMode()).isEqualTo(MarkupMode.XHTML);
        assertThat(environment.importDefault()).containsKey("%div").doesNotContainKey("%DIV");
        assertThat(environment.importDefault().get("%div")).isInstanceOf(MarkupTag.class);
        assertThat(((MarkupTag) environment.importDefault().get("%div")).mode()).isEqualTo(MarkupMode.XHTML);
    }

    @Test
    void contextModuleHoldsVariablesAndTags() {
        final var tag = new MarkupTag("custom", false, MarkupMode.HTML);
        final var environment = StandardEnvironment.builder()
            .variable("title", "Home")
            .variable("_secret", 42)
            .tag("custom", tag)
            .build();

        assertThat(environment.importOne("$title", null)).isEqualTo("Home");
        assertThat(environment.importOne("custom", null)).isSameAs(tag);
        assertThat(environment.importOne("%custom", Environment.CONTEXT_PATH)).isSameAs(tag);
        assertThat(environment.importOne("$_secret", null)).isEqualTo(42);
        assertThat(environment.importAll(null)).containsOnlyKeys("$title", "%custom");
        assertThat(environment.importDefault()).doesNotContainKey("$title");
    }

    @Test
    void missingSymbolsAndPathsSignal() {
        final var environment = StandardEnvironment.html();
        final var symbol = Conditions.expectFatal(
            UndefinedSymbolCondition.class,
            () -> environment.importOne("$missing", null)
        );
        assertThat(symbol.symbol()).isEqualTo("$missing");

        final var path = Conditions.expectFatal(
            UndefinedSymbolCondition.class,
            () -> environment.importAll("no/such/module")
        );
        assertThat(path.message()).contains("no/such/module");
    }

    @Test
    void modulesAreImportedByPath() {
        final var environment = StandardEnvironment.builder()
            .module("site", Map.of("$author", "Jane", "%_helper", DedentTag.instance()))
            .build();
        assertThat(environment.importOne("$author", "site")).isEqualTo("Jane");
        assertThat(environment.importAll("site")).containsOnlyKeys("$author");
        assertThat(environment.importOne("div", StandardEnvironment.HTML_PATH)).isInstanceOf(MarkupTag.class);
        assertThat(environment.importAll(StandardEnvironment.BUILTINS_PATH)).containsOnlyKeys("%dedent", "%javascript");
    }

    @Test
    void symbolMarksAreAddedOnlyWhenMissing() {
        assertThat(Environment.markedSymbol("div")).isEqualTo("%div");
        assertThat(Environment.markedSymbol("%div")).isEqualTo("%div");
        assertThat(Environment.markedSymbol("$x")).isEqualTo("$x");
        assertThat(Environment.isPrivate("$_x")).isTrue();
        assertThat(Environment.isPrivate("$x_")).isFalse();
    }

    @Test
    void textIsEscaped() {
        assertThat(StandardEnvironment.html().escape("<b> & </b>")).isEqualTo("&lt;b&gt; &amp; &lt;/b&gt;");
    }
}
