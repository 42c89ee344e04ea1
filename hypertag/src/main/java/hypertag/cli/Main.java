// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import hypertag.ast.FormConverter;
import hypertag.markup.MarkupMode;
import hypertag.runtime.StandardEnvironment;
import hypertag.sexp.reader.ByteStream;
import hypertag.translate.Translator;
import hypertag.util.Trace;
import hypertag.util.condition.ConditionContext;
import hypertag.util.condition.Handler;
import hypertag.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Renders template files written in the S-expression form to standard output.
 * <p>
 * Usage: {@code hypertag [--xhtml] [--indent N] [--var NAME=VALUE]... FILE...}. Variables given with {@code --var}
 * are strings in the context module, which templates import with {@code (import *)} or {@code (import $NAME)}.
 */
public final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(run(args, Streams.standard()).value);
    }

    /**
     * Runs the program with the given streams and returns the exit code, without exiting.
     */
    public static int run(final String[] args, final PrintStream out, final PrintStream err, final InputStream in) {
        return run(args, new Streams(out, err, in, StandardCharsets.UTF_8)).value;
    }

    private static ExitCode run(final String[] args, final Streams streams) {
        final var options = Options.parse(args);
        if (options == null) {
            streams.err().println(USAGE);
            return ExitCode.USAGE;
        }

        try (final var handler = new Handler(new FallbackHandler(streams))) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                final var translator = new Translator(options.environment(), options.indentStep());
                var allRendered = true;
                for (final var file : options.files()) {
                    final var rendered = ConditionContext.withRestart("skip-file", skipRestart -> {
                        renderFile(translator, file, streams.out());
                        return Boolean.TRUE;
                    });
                    allRendered &= (rendered != null);
                }
                return allRendered ? ExitCode.SUCCESS : ExitCode.ERROR;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        } finally {
            streams.out().flush();
        }
    }

    private static void renderFile(final Translator translator, final Path file, final PrintStream out) {
        try (final var trace = new Trace(() -> "Rendering template " + file)) {
            trace.use();
            final String output;
            try (final var stream = Files.newInputStream(file)) {
                output = translator.render(FormConverter.read(new ByteStream(stream)));
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            out.println(output);
        }
    }

    private static final String USAGE = "Usage: hypertag [--xhtml] [--indent N] [--var NAME=VALUE]... FILE...";

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }

    private record Options(MarkupMode markupMode, String indentStep, Map<String, String> variables, List<Path> files) {
        /**
         * Parses the command line, returning {@code null} if it's malformed.
         */
        private static @Nullable Options parse(final String[] args) {
            var markupMode = MarkupMode.HTML;
            var indentStep = Translator.DEFAULT_INDENT_STEP;
            final var variables = new LinkedHashMap<String, String>();
            final var files = new ArrayList<Path>();
            var optionsEnded = false;
            for (int i = 0; i < args.length; i += 1) {
                final var arg = args[i];
                if (optionsEnded || !arg.startsWith("--")) {
                    files.add(Path.of(arg));
                } else if (arg.equals("--")) {
                    optionsEnded = true;
                } else if (arg.equals("--xhtml")) {
                    markupMode = MarkupMode.XHTML;
                } else if (arg.equals("--indent") && i + 1 < args.length) {
                    i += 1;
                    final int width;
                    try {
                        width = Integer.parseInt(args[i]);
                    } catch (final NumberFormatException e) {
                        return null;
                    }
                    if (width < 0 || width > 16) {
                        return null;
                    }
                    indentStep = " ".repeat(width);
                } else if (arg.equals("--var") && i + 1 < args.length) {
                    i += 1;
                    final var assignment = args[i];
                    final var equals = assignment.indexOf('=');
                    if (equals <= 0) {
                        return null;
                    }
                    variables.put(assignment.substring(0, equals), assignment.substring(equals + 1));
                } else {
                    return null;
                }
            }
            return files.isEmpty() ? null : new Options(markupMode, indentStep, variables, files);
        }

        private StandardEnvironment environment() {
            var builder = StandardEnvironment.builder().markupMode(markupMode);
            for (final var entry : variables.entrySet()) {
                builder = builder.variable(entry.getKey(), entry.getValue());
            }
            return builder.build();
        }
    }
}
