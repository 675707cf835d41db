// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.test;

import bml.util.collection.OrderedMultimap;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;
import org.junit.jupiter.api.Test;

final class OrderedMultimapTest {
    @Test
    void emptyWorks() {
        final var map = OrderedMultimap.<String, Integer>empty();
        assertThat(map.isEmpty()).isTrue();
        assertThat(map.size()).isZero();
        assertThat(map.entries()).isEmpty();
        assertThat(map.getAll("a")).isEmpty();
        assertThat(map.getFirst("a")).isNull();
        assertThat(map.containsKey("a")).isFalse();
        assertThat(new OrderedMultimap.Builder<String, Integer>().freeze()).isSameAs(map);
    }

    @Test
    void entriesKeepAppendOrderAcrossKeys() {
        final var map = sample();
        assertThat(map.entries()).containsExactly(
            new OrderedMultimap.Entry<>("a", 1),
            new OrderedMultimap.Entry<>("b", 2),
            new OrderedMultimap.Entry<>("a", 3),
            new OrderedMultimap.Entry<>("c", 4)
        );
        assertThat(map.size()).isEqualTo(4);
        assertThat(map).asString().isEqualTo("[a=1, b=2, a=3, c=4]");
    }

    @Test
    void lookupByKeyWorks() {
        final var map = sample();
        assertThat(map.getAll("a")).containsExactly(1, 3);
        assertThat(map.getAll("c")).containsExactly(4);
        assertThat(map.getAll("z")).isEmpty();
        assertThat(map.getFirst("a")).isEqualTo(1);
        assertThat(map.getFirst("z")).isNull();
        assertThat(map.containsKey("b")).isTrue();
        assertThat(map.keySet()).containsExactly("a", "b", "c");
    }

    @Test
    void entriesCanBeTraversedBackwards() {
        final var entries = sample().entries();
        final var iterator = entries.listIterator(entries.size());
        assertThat(iterator.previous().value()).isEqualTo(4);
        assertThat(iterator.previous().value()).isEqualTo(3);
        assertThat(iterator.previous().value()).isEqualTo(2);
        assertThat(iterator.previous().value()).isEqualTo(1);
        assertThat(iterator.hasPrevious()).isFalse();
    }

    @Test
    void isImmutable() {
        final var map = sample();
        assertThatExceptionOfType(UnsupportedOperationException.class)
            .isThrownBy(() -> map.entries().add(new OrderedMultimap.Entry<>("d", 5)));
        assertThatExceptionOfType(UnsupportedOperationException.class).isThrownBy(() -> map.getAll("a").add(5));
        assertThatExceptionOfType(UnsupportedOperationException.class).isThrownBy(() -> map.keySet().add("d"));
    }

    @Test
    void freezeClearsTheBuilder() {
        final var builder = new OrderedMultimap.Builder<String, Integer>();
        builder.append("a", 1);
        final var first = builder.freeze();
        assertThat(builder.size()).isZero();
        builder.append("b", 2);
        final var second = builder.freeze();
        assertThat(first.entries()).containsExactly(new OrderedMultimap.Entry<>("a", 1));
        assertThat(second.entries()).containsExactly(new OrderedMultimap.Entry<>("b", 2));
    }

    @Test
    void equalsWorks() {
        assertThat(sample()).isEqualTo(sample());
        assertThat(sample()).hasSameHashCodeAs(sample());
        final var builder = new OrderedMultimap.Builder<String, Integer>();
        builder.append("b", 2);
        builder.append("a", 1);
        builder.append("a", 3);
        builder.append("c", 4);
        assertThat(builder.freeze()).isNotEqualTo(sample());
    }

    @Test
    void entriesRejectNull() {
        assertThatNullPointerException().isThrownBy(() -> new OrderedMultimap.Entry<>(null, 1));
        assertThatNullPointerException().isThrownBy(() -> new OrderedMultimap.Entry<>("a", null));
    }

    private static OrderedMultimap<String, Integer> sample() {
        final var builder = new OrderedMultimap.Builder<String, Integer>();
        builder.append("a", 1);
        builder.append("b", 2);
        builder.append("a", 3);
        builder.append("c", 4);
        return builder.freeze();
    }
}
