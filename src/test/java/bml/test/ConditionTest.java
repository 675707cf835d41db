// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.test;

import java.util.ArrayList;
import bml.util.Trace;
import bml.util.condition.Condition;
import bml.util.condition.ConditionContext;
import bml.util.condition.Handler;
import bml.util.condition.Restart;
import bml.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;

final class ConditionTest {
    @Test
    void declinedSignalReturns() {
        final var seen = new ArrayList<String>();
        try (final var handler = new Handler(condition -> seen.add(condition.condition().message()))) {
            handler.use();
            ConditionContext.signal(new TestCondition("first"));
            ConditionContext.signal(new TestCondition("second"));
        }
        assertThat(seen).containsExactly("first", "second");
    }

    @Test
    void declinedErrorIsThrown() {
        final var condition = new TestCondition("fatal");
        final var fatalFlags = new ArrayList<Boolean>();
        try (final var handler = new Handler(signaled -> fatalFlags.add(signaled.isFatal()))) {
            handler.use();
            assertThatThrownBy(() -> {
                throw ConditionContext.error(condition);
            }).isInstanceOfSatisfying(UnhandledErrorError.class, e -> assertThat(e.condition()).isSameAs(condition));
        }
        assertThat(fatalFlags).containsExactly(true);
    }

    @Test
    void handlersRunNewestFirst() {
        final var order = new ArrayList<String>();
        try (final var outer = new Handler(condition -> order.add("outer"))) {
            outer.use();
            try (final var inner = new Handler(condition -> order.add("inner"))) {
                inner.use();
                ConditionContext.signal(new TestCondition("x"));
            }
            ConditionContext.signal(new TestCondition("y"));
        }
        assertThat(order).containsExactly("inner", "outer", "outer");
    }

    @Test
    void conditionSignaledInsideAHandlerSkipsThatHandler() {
        final var order = new ArrayList<String>();
        try (final var outer = new Handler(condition -> order.add("outer: " + condition.condition().message()))) {
            outer.use();
            try (final var inner = new Handler(condition -> {
                order.add("inner: " + condition.condition().message());
                if (condition.condition().message().equals("x")) {
                    ConditionContext.signal(new TestCondition("nested"));
                }
            })) {
                inner.use();
                ConditionContext.signal(new TestCondition("x"));
            }
        }
        assertThat(order).containsExactly("inner: x", "outer: nested", "outer: x");
    }

    @Test
    void unwindingReachesTheRestart() {
        final var reachedEnd = new ArrayList<Boolean>();
        final var result = ConditionContext.<String>withRestart("Give up", restart -> {
            assertThat(ConditionContext.restarts()).extracting(Restart::name).containsExactly("Give up");
            try (final var handler = new Handler(condition -> restart.unwindTo())) {
                handler.use();
                try (final var trace = new Trace("Doing something")) {
                    trace.use();
                    ConditionContext.signal(new TestCondition("boom"));
                    reachedEnd.add(true);
                }
            }
            return "finished";
        });
        assertThat(result).isNull();
        assertThat(reachedEnd).isEmpty();
        assertThat(ConditionContext.restarts()).isEmpty();
        assertThat(Trace.activeTraces()).isEmpty();
    }

    @Test
    void unwindingPassesThroughInnerRestarts() {
        final var innerResult = new ArrayList<String>();
        final var result = ConditionContext.<String>withRestart("Outer", outer -> {
            try (final var handler = new Handler(condition -> outer.unwindTo())) {
                handler.use();
                innerResult.add(String.valueOf(ConditionContext.<String>withRestart("Inner", inner -> {
                    assertThat(ConditionContext.restarts()).extracting(Restart::name)
                        .containsExactly("Inner", "Outer");
                    ConditionContext.signal(new TestCondition("boom"));
                    return "inner finished";
                })));
            }
            return "outer finished";
        });
        assertThat(result).isNull();
        assertThat(innerResult).isEmpty();
    }

    @Test
    void restartReturnsCallbackResult() {
        assertThat(ConditionContext.<String>withRestart("Unused", restart -> "value")).isEqualTo("value");
    }

    @Test
    void tracesAreListedInnermostFirst() {
        try (final var outer = new Trace("Outer")) {
            outer.use();
            try (final var inner = new Trace(() -> "Inner " + 42)) {
                inner.use();
                assertThat(Trace.activeTraces()).containsExactly("Inner 42", "Outer");
            }
            assertThat(Trace.activeTraces()).containsExactly("Outer");
        }
    }

    @Test
    void conditionDescribesItself() {
        final var condition = new TestCondition("something happened");
        assertThat(condition.detailedMessage()).isEqualTo("something happened");
        assertThat(condition).hasToString(TestCondition.class.getName() + ": something happened");
    }

    private static final class TestCondition extends Condition {
        TestCondition(final String message) {
            super(message);
        }
    }
}
