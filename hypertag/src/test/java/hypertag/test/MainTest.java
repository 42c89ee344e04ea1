// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import hypertag.cli.Main;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class MainTest {
    @Test
    void rendersFilesWithContextVariables() throws IOException {
        final var page = write("page.hts", "(import $title) (h1 (text :inline true $title))");
        final var result = run("", "--var", "title=Home & Away", page.toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).isEqualTo("<h1>Home &amp; Away</h1>" + System.lineSeparator());
        assertThat(result.err()).isEmpty();
    }

    @Test
    void markupModeAndIndentationAreConfigurable() throws IOException {
        final var page = write("form.hts", "(div ((input :disabled true)))");
        final var result = run("", "--xhtml", "--indent", "4", "--", page.toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .isEqualTo("<div>\n    <input disabled=\"disabled\" />\n</div>" + System.lineSeparator());
    }

    @Test
    void emptyCommandLinePrintsUsage() {
        assertUsage(run(""));
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"--indent x file", "--indent 99 file", "--var novalue file", "--bogus file", "--xhtml"})
    void malformedCommandLinesPrintUsage(final String commandLine) {
        assertUsage(run("", commandLine.split(" ")));
    }

    @Test
    void endOfInputAbortsOnError() {
        final var missing = directory.resolve("missing.hts");
        final var result = run("", missing.toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.out()).isEmpty();
        assertThat(result.err())
            .contains("IOExceptionCondition")
            .contains("Rendering template " + missing)
            .contains("1. skip-file")
            .contains("2. abort-process")
            .contains("End of input found, picking the last restart.");
    }

    @Test
    void skippingAFileRendersTheRest() throws IOException {
        final var broken = write("broken.hts", "(nosuch \"x\")");
        final var good = write("good.hts", "\"fine\"");
        final var result = run("9\nnot a number\n1\n", broken.toString(), good.toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.out()).isEqualTo("fine" + System.lineSeparator());
        assertThat(result.err())
            .contains("UndefinedSymbolCondition")
            .contains("Undefined tag 'nosuch'")
            .contains("Invalid restart index 9, value out of bounds.")
            .contains("Restart index not an integer");
    }

    private static void assertUsage(final Result result) {
        assertThat(result.exitCode()).isEqualTo(64);
        assertThat(result.err()).startsWith("Usage: hypertag");
        assertThat(result.out()).isEmpty();
    }

    private Path write(final String name, final String contents) throws IOException {
        return Files.writeString(directory.resolve(name), contents, StandardCharsets.UTF_8);
    }

    private static Result run(final String input, final String... args) {
        final var out = new ByteArrayOutputStream();
        final var err = new ByteArrayOutputStream();
        final int exitCode;
        try (final var outStream = new PrintStream(out, true, StandardCharsets.UTF_8);
             final var errStream = new PrintStream(err, true, StandardCharsets.UTF_8)) {
            exitCode = Main.run(
                args,
                outStream,
                errStream,
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8))
            );
        }
        return new Result(exitCode, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    @TempDir
    Path directory;

    private record Result(int exitCode, String out, String err) {
    }
}
