// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import hypertag.dom.Node;
import hypertag.dom.Sequence;
import hypertag.scope.ArrayStack;
import hypertag.scope.Closure;
import hypertag.scope.Frame;
import hypertag.scope.LazyValue;
import hypertag.scope.ReferenceDepth;
import hypertag.scope.ScopedTag;
import hypertag.scope.StackBranch;
import hypertag.scope.StackUnderflowError;
import hypertag.scope.UndefinedSymbolCondition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class FrameTest {
    @Test
    void framesFollowAccessLinks() {
        final var stack = new ArrayStack();
        final var document = Frame.open(stack, 0, -1, List.of("top"), 2);
        final var inner = Frame.open(stack, 1, document.pointer(), List.of("inner"), 1);

        assertThat(stack.position()).isEqualTo(5);
        assertThat(inner.load(0, "x")).isEqualTo("inner");
        assertThat(inner.outer(1)).isEqualTo(document);
        assertThat(inner.outer(1).load(0, "y")).isEqualTo("top");
        assertThatExceptionOfType(StackUnderflowError.class).isThrownBy(() -> inner.outer(2));

        inner.close();
        assertThat(stack.position()).isEqualTo(3);
    }

    @Test
    void unassignedSlotSignalsUndefinedSymbol() {
        final var frame = Frame.open(new ArrayStack(), 0, -1, List.of(), 1);
        final var condition = Conditions.expectFatal(UndefinedSymbolCondition.class, () -> frame.load(0, "later"));
        assertThat(condition.symbol()).isEqualTo("later");

        frame.store(0, null);
        assertThat(frame.load(0, "later")).isNull();
    }

    @Test
    void lazySlotsAreForcedOnce() {
        final var evaluations = new int[1];
        final var lazy = LazyValue.of(() -> {
            evaluations[0] += 1;
            return "value";
        });
        final var frame = Frame.open(new ArrayStack(), 0, -1, List.of(lazy), 1);

        assertThat(lazy.isEvaluated()).isFalse();
        assertThat(frame.load(0, "x")).isEqualTo("value");
        assertThat(frame.load(0, "x")).isEqualTo("value");
        assertThat(evaluations[0]).isEqualTo(1);
        assertThat(lazy.isEvaluated()).isTrue();
    }

    @Test
    void lazyNullIsRemembered() {
        final var evaluations = new int[1];
        final LazyValue<@Nullable Object> lazy = LazyValue.of(() -> {
            evaluations[0] += 1;
            return null;
        });
        assertThat(lazy.get()).isNull();
        assertThat(lazy.get()).isNull();
        assertThat(evaluations[0]).isEqualTo(1);
    }

    @ParameterizedTest(name = "trunk length = {0}")
    @ValueSource(ints = {0, 1, 7, 100})
    void branchSharesTrunkAndIsolatesPushes(final int trunkLength) {
        final var trunk = new ArrayStack();
        for (int i = 0; i < trunkLength; i += 1) {
            trunk.push(i);
        }
        final var branch = new StackBranch(trunk);
        for (int i = 0; i < 5; i += 1) {
            branch.push("branch" + i);
        }
        trunk.push("late");

        assertThat(branch.trunkLength()).isEqualTo(trunkLength);
        assertThat(branch.position()).isEqualTo(trunkLength + 5);
        assertThat(trunk.position()).isEqualTo(trunkLength + 1);
        assertThat(branch.get(trunkLength)).isEqualTo("branch0");
        assertThat(trunk.get(trunkLength)).isEqualTo("late");
        if (trunkLength > 0) {
            assertThat(branch.get(trunkLength - 1)).isEqualTo(trunkLength - 1);
            assertThatExceptionOfType(StackUnderflowError.class).isThrownBy(() -> branch.set(0, "x"));
            assertThatExceptionOfType(StackUnderflowError.class).isThrownBy(() -> branch.reset(trunkLength - 1));
        }

        assertThat(branch.pop()).isEqualTo("branch4");
        branch.reset(trunkLength);
        assertThat(branch.position()).isEqualTo(trunkLength);
        assertThatExceptionOfType(StackUnderflowError.class).isThrownBy(branch::pop);
    }

    @Test
    void arrayStackChecksBounds() {
        final var stack = new ArrayStack();
        assertThatExceptionOfType(StackUnderflowError.class).isThrownBy(stack::pop);
        stack.push("a");
        assertThatExceptionOfType(StackUnderflowError.class).isThrownBy(() -> stack.get(1));
        assertThatExceptionOfType(StackUnderflowError.class).isThrownBy(() -> stack.reset(2));
        stack.set(0, "b");
        assertThat(stack.pop()).isEqualTo("b");
    }

    @Test
    void closureExpandsOnCapturedStack() {
        final var stack = new ArrayStack();
        final var document = Frame.open(stack, 0, -1, List.of("captured"), 1);
        final var hypertag = new EchoTag();
        final var closure = new Closure(hypertag, document);

        // Frames pushed after the capture aren't visible to the closure.
        Frame.open(stack, 1, document.pointer(), List.of("other"), 1);

        assertThat(closure.depth()).isZero();
        assertThat(closure.name()).isEqualTo("echo");
        assertThat(closure.isVoid()).isTrue();
        final var output = closure.expandNodes(Sequence.empty(), List.of(), Map.of());
        assertThat(output.render()).isEqualTo("captured");
        assertThat(hypertag.framePointers).containsExactly(2);
        assertThat(closure.stack().position()).isEqualTo(2);
        assertThat(stack.position()).isEqualTo(4);
    }

    @Test
    void closureIgnoresBindingsPushedAfterCapture() {
        final var stack = new ArrayStack();
        final var document = Frame.open(stack, 0, -1, List.of("left", "unused"), 2);
        final var hypertag = new EchoTag();
        final var closure = new Closure(hypertag, document);
        final var trunkLength = stack.position();

        // Five more bindings on the main stack, the first one shadowing the captured slot.
        final var shadowing = Frame.open(stack, 1, document.pointer(), List.of("right", "b", "c", "d", "e"), 5);
        assertThat(shadowing.load(0, "value")).isEqualTo("right");

        final var output = closure.expandNodes(Sequence.empty(), List.of(), Map.of());
        assertThat(output.render()).isEqualTo("left");
        assertThat(hypertag.framePointers).containsExactly(trunkLength);
        assertThat(closure.stack().trunkLength()).isEqualTo(trunkLength);
        assertThat(stack.position()).isEqualTo(trunkLength + 6);
        assertThat(shadowing.load(0, "value")).isEqualTo("right");
    }

    @Test
    void closureRendersAsPlainTag() {
        final var document = Frame.open(new ArrayStack(), 0, -1, List.of("value"), 1);
        final var closure = new Closure(new EchoTag(), document);
        assertThat(Node.tagged(closure).render()).isEqualTo("value");
    }

    @Test
    void referenceDepthKeepsMinimum() {
        final var depth = new ReferenceDepth();
        assertThat(depth.value()).isNull();
        depth.merge(null);
        assertThat(depth.value()).isNull();
        depth.add(2);
        depth.merge(3);
        assertThat(depth.value()).isEqualTo(2);
        depth.add(-1);
        assertThat(depth.value()).isEqualTo(-1);
    }

    // Renders the first slot of the frame it's expanded in, pushing a frame of its own meanwhile.
    private static final class EchoTag implements ScopedTag {
        @Override
        public String name() {
            return "echo";
        }

        @Override
        public boolean acceptsBody() {
            return false;
        }

        @Override
        public Sequence expand(
            final Frame caller,
            final Sequence body,
            final List<@Nullable Object> attributes,
            final Map<String, @Nullable Object> namedAttributes
        ) {
            final var frame = Frame.open(caller.stack(), caller.depth() + 1, caller.pointer(), List.of(), 0);
            try {
                framePointers.add(frame.pointer());
                return Sequence.of(Node.text(String.valueOf(frame.outer(1).load(0, "value"))));
            } finally {
                frame.close();
            }
        }

        private final List<Integer> framePointers = new ArrayList<>();
    }
}
