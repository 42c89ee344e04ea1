// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.LongStream;
import hypertag.scope.ScopeStack;
import hypertag.scope.StackUnderflowError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class ScopeStackTest {
    static LongStream provideSeeds() {
        return RandomUtils.provideSeeds();
    }

    @Test
    void newerBindingsShadowOlderOnes() {
        final var scope = new ScopeStack<Integer>();
        scope.push("$x", 1);
        scope.push("$y", 2);
        scope.push("$x", 3);
        assertThat(scope.get("$x")).isEqualTo(3);
        assertThat(scope.size()).isEqualTo(3);

        final var popped = scope.pop();
        assertThat(popped.name()).isEqualTo("$x");
        assertThat(popped.value()).isEqualTo(3);
        assertThat(scope.get("$x")).isEqualTo(1);

        scope.pop();
        scope.pop();
        assertThat(scope.contains("$x")).isFalse();
        assertThat(scope.get("$x")).isNull();
        assertThatExceptionOfType(StackUnderflowError.class).isThrownBy(scope::pop);
    }

    @Test
    void resetUndoesBindingsAndIndentation() {
        final var scope = new ScopeStack<String>();
        scope.push("%a", "outer");
        scope.indent(' ');
        final var checkpoint = scope.checkpoint();

        scope.push("%a", "inner");
        scope.push("%b", "new");
        scope.indent('\t');
        assertThat(scope.indentation()).isEqualTo("\n \t");

        scope.reset(checkpoint);
        assertThat(scope.get("%a")).isEqualTo("outer");
        assertThat(scope.contains("%b")).isFalse();
        assertThat(scope.indentation()).isEqualTo("\n ");

        scope.reset(checkpoint);
        scope.reset(scope.checkpoint());
        assertThat(scope.size()).isEqualTo(1);
        assertThat(scope.indentation()).isEqualTo("\n ");
    }

    @Test
    void resetAboveCurrentStateFails() {
        final var scope = new ScopeStack<String>();
        scope.push("%a", "a");
        final var checkpoint = scope.checkpoint();
        scope.pop();
        assertThatExceptionOfType(StackUnderflowError.class).isThrownBy(() -> scope.reset(checkpoint));
    }

    @Test
    void resetKeepsIndentationDedentedPastTheCheckpoint() {
        final var scope = new ScopeStack<String>();
        scope.indent(' ');
        scope.indent(' ');
        final var checkpoint = scope.checkpoint();
        scope.dedent(' ');
        scope.push("$a", "a");

        scope.reset(checkpoint);
        assertThat(scope.contains("$a")).isFalse();
        assertThat(scope.indentation()).isEqualTo("\n ");
    }

    @Test
    void bindingsSinceGivesNewestValues() {
        final var scope = new ScopeStack<Integer>();
        scope.push("$a", 0);
        final var checkpoint = scope.checkpoint();
        scope.pushAll(Map.of("$b", 1));
        scope.push("$c", 2);
        scope.push("$b", 3);
        assertThat(scope.bindingsSince(checkpoint)).containsExactly(Map.entry("$c", 2), Map.entry("$b", 3));
    }

    @Test
    void dedentMustMatchIndentation() {
        final var scope = new ScopeStack<String>();
        assertThat(scope.indentation()).isEqualTo("\n");
        assertThatExceptionOfType(StackUnderflowError.class).isThrownBy(() -> scope.dedent(' '));
        scope.indent(' ');
        assertThatExceptionOfType(StackUnderflowError.class).isThrownBy(() -> scope.dedent('\t'));
        scope.dedent(' ');
        assertThat(scope.indentation()).isEqualTo("\n");
    }

    @ParameterizedTest(name = "seed = {0}")
    @MethodSource("provideSeeds")
    void resetRestoresEveryVisibleBinding(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        final var scope = new ScopeStack<Integer>();
        final var names = new ArrayList<String>();
        for (int i = 0; i < 16; i += 1) {
            names.add("$" + RandomUtils.generateWord(random));
        }

        for (int round = 0; round < 50; round += 1) {
            for (int i = random.nextInt(20); i > 0; i -= 1) {
                scope.push(names.get(random.nextInt(names.size())), random.nextInt());
            }
            final var snapshot = visibleBindings(scope, names);
            final var indentation = scope.indentation();
            final var checkpoint = scope.checkpoint();

            for (int i = random.nextInt(20); i > 0; i -= 1) {
                scope.push(names.get(random.nextInt(names.size())), random.nextInt());
                if (random.nextBoolean()) {
                    scope.indent(random.nextBoolean() ? ' ' : '\t');
                }
            }
            scope.reset(checkpoint);

            assertThat(visibleBindings(scope, names)).isEqualTo(snapshot);
            assertThat(scope.indentation()).isEqualTo(indentation);
            assertThat(scope.checkpoint()).isEqualTo(checkpoint);
        }
    }

    @Test
    void pushAllKeepsIterationOrder() {
        final var bindings = new LinkedHashMap<String, Integer>();
        bindings.put("$x", 1);
        bindings.put("$x2", 2);
        final var scope = new ScopeStack<Integer>();
        scope.pushAll(bindings);
        assertThat(scope.pop().name()).isEqualTo("$x2");
    }

    private static Map<String, Integer> visibleBindings(final ScopeStack<Integer> scope, final Iterable<String> names) {
        final var result = new HashMap<String, Integer>();
        for (final var name : names) {
            final var value = scope.get(name);
            if (value != null) {
                result.put(name, value);
            }
        }
        return result;
    }
}
