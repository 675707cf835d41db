// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bml.util.collection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable multimap that remembers the global order in which entries were appended.
 * <p>
 * Keys may repeat. {@link #entries()} yields every entry in append order, across all keys, and {@link #getAll(Object)}
 * yields the values of one key, again in append order. Besides the entry list, a hash index maps each key to its own
 * value list, so locating a key's group is a single hash probe (expected constant time) rather than a scan.
 * <p>
 * Instances are built with a {@link Builder} and can't be changed afterwards. Immutability is shallow: it does not
 * extend to the keys and values themselves.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public final class OrderedMultimap<K, V> {
    private OrderedMultimap(final List<Entry<K, V>> entries, final Map<K, List<V>> groups) {
        this.entries = entries;
        this.groups = groups;
    }

    /**
     * Returns an empty multimap.
     */
    @SuppressWarnings("unchecked")
    public static <K, V> OrderedMultimap<K, V> empty() {
        return (OrderedMultimap<K, V>) EmptyHolder.instance;
    }

    /**
     * Returns all entries in append order.
     * <p>
     * The list is immutable, its size is known up front and it can be traversed from either end.
     */
    public List<Entry<K, V>> entries() {
        return entries;
    }

    /**
     * Returns the values appended under {@code key}, in append order, or an empty list if there are none.
     * <p>
     * Complexity: one hash lookup.
     */
    public List<V> getAll(final K key) {
        final var group = groups.get(key);
        return (group == null) ? List.of() : group;
    }

    /**
     * Returns the first value appended under {@code key}, or {@code null} if there is none.
     */
    public @Nullable V getFirst(final K key) {
        final var group = groups.get(key);
        return (group == null) ? null : group.get(0);
    }

    /**
     * Returns {@code true} iff at least one entry has the given key.
     */
    public boolean containsKey(final K key) {
        return groups.containsKey(key);
    }

    /**
     * Returns the distinct keys, in the order of their first appearance.
     */
    public Set<K> keySet() {
        return Collections.unmodifiableSet(groups.keySet());
    }

    /**
     * Returns the number of entries, counting every repeated key.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns {@code true} iff this multimap has no entries.
     */
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Two multimaps are equal iff their entry lists are equal, that is they hold equal entries in the same order.
     */
    @Override
    public boolean equals(final @Nullable Object object) {
        return object instanceof OrderedMultimap<?, ?> other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    private final List<Entry<K, V>> entries;
    private final Map<K, List<V>> groups;

    /**
     * A single key-value pair of an {@link OrderedMultimap}.
     */
    public record Entry<K, V>(K key, V value) {
        public Entry {
            Objects.requireNonNull(key);
            Objects.requireNonNull(value);
        }

        @Override
        public String toString() {
            return key + "=" + value;
        }
    }

    /**
     * An append-only builder that can be {@link #freeze() frozen} into an {@link OrderedMultimap}.
     *
     * @param <K> the type of keys
     * @param <V> the type of values
     */
    public static final class Builder<K, V> {
        /**
         * Initializes a new empty builder.
         */
        public Builder() {
        }

        /**
         * Appends the given entry after all entries appended so far.
         */
        public void append(final K key, final V value) {
            entries.add(new Entry<>(key, value));
            groups.computeIfAbsent(key, k -> new ArrayList<>(1)).add(value);
        }

        /**
         * Returns the number of entries appended so far.
         */
        public int size() {
            return entries.size();
        }

        /**
         * Returns an immutable multimap holding the entries appended so far, and clears this builder.
         */
        @CheckReturnValue
        public OrderedMultimap<K, V> freeze() {
            if (entries.isEmpty()) {
                return empty();
            }
            final var frozenGroups = new LinkedHashMap<K, List<V>>(groups.size() * 2);
            groups.forEach((key, values) -> frozenGroups.put(key, List.copyOf(values)));
            final var result = new OrderedMultimap<>(List.copyOf(entries), Collections.unmodifiableMap(frozenGroups));
            entries.clear();
            groups.clear();
            return result;
        }

        private final ArrayList<Entry<K, V>> entries = new ArrayList<>();
        private final LinkedHashMap<K, List<V>> groups = new LinkedHashMap<>();
    }

    private static final class EmptyHolder {
        private static final OrderedMultimap<?, ?> instance = new OrderedMultimap<>(List.of(), Map.of());
    }
}
