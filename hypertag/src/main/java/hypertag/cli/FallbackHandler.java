// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import hypertag.util.Trace;
import hypertag.util.condition.Condition;
import hypertag.util.condition.ConditionContext;
import hypertag.util.condition.Handler;
import hypertag.util.condition.Restart;
import hypertag.util.condition.SignaledCondition;

/**
 * The outermost handler: reports a fatal condition with the active operation trace and asks the user which restart
 * to take. At the end of input, the last, outermost restart is taken.
 */
final class FallbackHandler implements Handler.Procedure {
    FallbackHandler(final Streams streams) {
        this.streams = streams;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            return;
        }
        final var restarts = new ArrayList<Restart>();
        ConditionContext.restarts().forEach(restarts::add);
        showCondition(condition.condition());
        chooseRestart(restarts).unwindTo();
    }

    private void showCondition(final Condition condition) {
        final var err = streams.err();
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private Restart chooseRestart(final List<Restart> restarts) {
        if (restarts.isEmpty()) {
            throw new IllegalStateException("No restarts available");
        }

        final var err = streams.err();
        showRestarts(err, restarts);
        final var last = restarts.get(restarts.size() - 1);
        while (true) {
            err.print("Enter restart number > ");
            err.flush();
            try {
                final var line = streams.in().readLine();
                if (line == null) {
                    err.println("End of input found, picking the last restart.");
                    return last;
                }
                final var index = Integer.parseInt(line.strip());
                if (index >= 1 && index <= restarts.size()) {
                    return restarts.get(index - 1);
                } else {
                    err.println("Invalid restart index " + index + ", value out of bounds.");
                }
            } catch (final NumberFormatException e) {
                err.println("Restart index not an integer: " + e);
            } catch (final IOException e) {
                err.println("I/O error occurred: " + e);
                err.println("Picking the last restart.");
                return last;
            }
        }
    }

    private static void showRestarts(final PrintStream stream, final List<Restart> restarts) {
        int index = 1;
        stream.println("Available restarts:");
        for (final var restart : restarts) {
            stream.println(" " + index + ". " + restart.name());
            index += 1;
        }
        stream.println();
    }

    private final Streams streams;
}
