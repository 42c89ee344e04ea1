// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.cli;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;

/**
 * The standard streams the command line interface talks through.
 */
final class Streams {
    Streams(final PrintStream out, final PrintStream err, final InputStream in, final Charset inputCharset) {
        this.out = out;
        this.err = err;
        this.in = new BufferedReader(new InputStreamReader(in, inputCharset));
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    static Streams standard() {
        final var console = System.console();
        final var charset = (console == null) ? Charset.defaultCharset() : console.charset();
        return new Streams(System.out, System.err, System.in, charset);
    }

    PrintStream out() {
        return out;
    }

    PrintStream err() {
        return err;
    }

    BufferedReader in() {
        return in;
    }

    private final PrintStream out;
    private final PrintStream err;
    private final BufferedReader in;
}
