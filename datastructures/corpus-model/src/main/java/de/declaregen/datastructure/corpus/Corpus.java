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
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import net.automatalib.words.Word;

/**
 * An immutable multiset of sequences, kept in insertion order.
 *
 * @param <I>
 *         symbol type
 */
public final class Corpus<I> implements Iterable<Word<I>> {

    private static final Corpus<?> EMPTY = new Corpus<>(Collections.emptyList());

    private final List<Word<I>> sequences;

    private Corpus(List<Word<I>> sequences) {
        this.sequences = sequences;
    }

    @SuppressWarnings("unchecked")
    public static <I> Corpus<I> empty() {
        return (Corpus<I>) EMPTY;
    }

    public static <I> Corpus<I> of(Collection<? extends Word<I>> sequences) {
        return new Corpus<>(Collections.unmodifiableList(new ArrayList<>(sequences)));
    }

    @SafeVarargs
    public static <I> Corpus<I> of(Word<I>... sequences) {
        return of(List.of(sequences));
    }

    /**
     * Creates a corpus from plain symbol lists, e.g. as produced by a log reader.
     */
    public static <I> Corpus<I> fromLists(Collection<? extends List<? extends I>> sequences) {
        List<Word<I>> words = new ArrayList<>(sequences.size());
        for (List<? extends I> seq : sequences) {
            words.add(Word.fromList(seq));
        }
        return new Corpus<>(Collections.unmodifiableList(words));
    }

    public int size() {
        return sequences.size();
    }

    public boolean isEmpty() {
        return sequences.isEmpty();
    }

    public Word<I> get(int index) {
        return sequences.get(index);
    }

    public List<Word<I>> getSequences() {
        return sequences;
    }

    public Stream<Word<I>> stream() {
        return sequences.stream();
    }

    /**
     * Derives a new corpus holding the sequences that match the given predicate.
     */
    public Corpus<I> filter(Predicate<? super Word<I>> predicate) {
        return new Corpus<>(Collections.unmodifiableList(sequences.stream()
                                                                  .filter(predicate)
                                                                  .collect(Collectors.toList())));
    }

    /**
     * Returns the total number of symbol occurrences.
     */
    public long countSymbols() {
        long n = 0;
        for (Word<I> w : sequences) {
            n += w.length();
        }
        return n;
    }

    @Override
    public Iterator<Word<I>> iterator() {
        return sequences.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return sequences.equals(((Corpus<?>) o).sequences);
    }

    @Override
    public int hashCode() {
        return sequences.hashCode();
    }

    @Override
    public String toString() {
        return sequences.toString();
    }
}
