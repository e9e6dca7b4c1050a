/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.collectionloader.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;

/**
 * A thread-safe, keyed collection of items kept sorted by a remote order value. Stands in
 * for the local store a {@link LocalCollectionLoaderHelper} imports pages into.
 *
 * <p>Upserting an item whose key is already present replaces the item and moves it to its
 * new order. Items with the same order keep their insertion order.
 *
 * <p>Readers see an immutable snapshot rebuilt on every change, so indexes read from one
 * {@link #snapshot()} stay consistent while the collection is being modified.
 *
 * @param <K> the item key type
 * @param <T> the item type; must implement value equality
 * @since 4.0.0
 */
public final class LocalCollection<K, T> {

    private static final Comparator<Entry<?>> ORDERING =
        Comparator.<Entry<?>>comparingLong(entry -> entry.order).thenComparingLong(entry -> entry.sequence);

    private final Function<? super T, ? extends K> keyOf;
    private final Map<K, Entry<T>> entries = new HashMap<>();
    private long nextSequence;
    private volatile List<T> ordered = List.of();

    /**
     * @param keyOf extracts the key identifying an item
     */
    public LocalCollection(Function<? super T, ? extends K> keyOf) {
        this.keyOf = Objects.requireNonNull(keyOf, "keyOf");
    }

    /**
     * Inserts an item, or replaces the item with the same key.
     *
     * @param item the item
     * @param order the order of the item in the collection
     * @return the replaced item, if any
     */
    public synchronized Optional<T> upsert(T item, long order) {
        Objects.requireNonNull(item, "item");
        K key = keyOf.apply(item);
        Entry<T> previous = entries.put(key, new Entry<>(item, order, nextSequence++));
        rebuild();
        return previous == null ? Optional.empty() : Optional.of(previous.item);
    }

    /**
     * Removes the item with the same key as the given one.
     *
     * @param item the item to remove
     * @return true if an item was removed
     */
    public synchronized boolean remove(T item) {
        return removeKey(keyOf.apply(item));
    }

    public synchronized boolean removeKey(K key) {
        if (entries.remove(key) == null) {
            return false;
        }
        rebuild();
        return true;
    }

    public synchronized void clear() {
        entries.clear();
        rebuild();
    }

    public synchronized Optional<T> get(K key) {
        Entry<T> entry = entries.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.item);
    }

    public synchronized OptionalLong orderOf(K key) {
        Entry<T> entry = entries.get(key);
        return entry == null ? OptionalLong.empty() : OptionalLong.of(entry.order);
    }

    public int size() {
        return ordered.size();
    }

    /**
     * @param index index in the current order
     * @return the item at index
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public T itemAt(int index) {
        return ordered.get(index);
    }

    /**
     * @return the items in order, as an immutable list
     */
    public List<T> snapshot() {
        return ordered;
    }

    private void rebuild() {
        List<Entry<T>> sorted = new ArrayList<>(entries.values());
        sorted.sort(ORDERING);
        List<T> items = new ArrayList<>(sorted.size());
        for (Entry<T> entry : sorted) {
            items.add(entry.item);
        }
        ordered = Collections.unmodifiableList(items);
    }

    @Override
    public String toString() {
        return "LocalCollection" + ordered;
    }

    private static final class Entry<T> {
        private final T item;
        private final long order;
        private final long sequence;

        Entry(T item, long order, long sequence) {
            this.item = item;
            this.order = order;
            this.sequence = sequence;
        }
    }
}
