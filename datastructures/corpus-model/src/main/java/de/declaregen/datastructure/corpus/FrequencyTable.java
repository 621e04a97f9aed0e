/* Copyright (C) 2024 The DeclareGen Authors
 * This file is part of DeclareGen.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.declaregen.datastructure.corpus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A read-only frequency table. Keys keep the order in which they were first counted, which makes every table derived
 * from the same input iterate identically.
 *
 * @param <K>
 *         key type
 */
public final class FrequencyTable<K> {

    private static final FrequencyTable<?> EMPTY = new FrequencyTable<>(Collections.emptyMap(), 0);

    private final Map<K, Long> counts;
    private final long total;

    private FrequencyTable(Map<K, Long> counts, long total) {
        this.counts = counts;
        this.total = total;
    }

    @SuppressWarnings("unchecked")
    public static <K> FrequencyTable<K> empty() {
        return (FrequencyTable<K>) EMPTY;
    }

    public long get(K key) {
        Long count = counts.get(key);
        return count == null ? 0 : count;
    }

    public boolean contains(K key) {
        return counts.containsKey(key);
    }

    /**
     * Returns the sum of all counts.
     */
    public long getTotal() {
        return total;
    }

    /**
     * Returns the number of distinct keys.
     */
    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public Set<K> keySet() {
        return counts.keySet();
    }

    public Map<K, Long> asMap() {
        return counts;
    }

    /**
     * Returns the relative frequency of the given key, or 0 for an empty table.
     */
    public double getProbability(K key) {
        return total == 0 ? 0.0 : (double) get(key) / total;
    }

    /**
     * Returns the key with the highest count. Ties go to the key counted first.
     */
    public @Nullable K getMostFrequent() {
        K best = null;
        long bestCount = 0;
        for (Entry<K, Long> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FrequencyTable<?> that = (FrequencyTable<?>) o;
        return total == that.total && counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        List<Entry<K, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort((arg0, arg1) -> -Long.compare(arg0.getValue(), arg1.getValue()));
        StringBuilder sb = new StringBuilder();
        for (Entry<K, Long> entry : entries) {
            sb.append(entry.getValue()).append(": ").append(entry.getKey()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Mutable accumulator for a {@link FrequencyTable}. Not thread-safe.
     *
     * @param <K>
     *         key type
     */
    public static final class Counter<K> {

        private final Map<K, Long> map = new LinkedHashMap<>();
        private long total;

        public Counter<K> count(K key) {
            return add(key, 1);
        }

        public Counter<K> add(K key, long amount) {
            if (amount < 0) {
                throw new IllegalArgumentException("Cannot count a negative amount: " + amount);
            }
            map.merge(key, amount, Long::sum);
            total += amount;
            return this;
        }

        public long getTotal() {
            return total;
        }

        public FrequencyTable<K> toTable() {
            if (map.isEmpty()) {
                return empty();
            }
            return new FrequencyTable<>(Collections.unmodifiableMap(new LinkedHashMap<>(map)), total);
        }
    }
}
