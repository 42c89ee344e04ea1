// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.test;

import java.util.ArrayList;
import java.util.List;
import hypertag.util.condition.Condition;
import hypertag.util.condition.ConditionContext;
import hypertag.util.condition.Handler;
import static org.assertj.core.api.Assertions.assertThat;

final class Conditions {
    private Conditions() {
    }

    /**
     * Runs {@code body}, which must signal a fatal condition of the given type, and returns that condition. Control
     * leaves {@code body} at the point of the signal.
     */
    static <C extends Condition> C expectFatal(final Class<C> type, final Runnable body) {
        final var captured = new ArrayList<Condition>(1);
        final var completed = ConditionContext.withRestart("test-capture", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.isFatal()) {
                    captured.add(signaled.condition());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                body.run();
                return Boolean.TRUE;
            }
        });
        assertThat(completed).as("a fatal condition to be signaled").isNull();
        assertThat(captured).singleElement().isInstanceOf(type);
        return type.cast(captured.get(0));
    }

    /**
     * Runs {@code body} and returns the non-fatal conditions it signaled, in order.
     */
    static List<Condition> collectSignals(final Runnable body) {
        final var signals = new ArrayList<Condition>();
        try (final var handler = new Handler(signaled -> {
            if (!signaled.isFatal()) {
                signals.add(signaled.condition());
            }
        })) {
            handler.use();
            body.run();
        }
        return signals;
    }
}
