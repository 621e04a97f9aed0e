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
package de.declaregen.algorithm.sampling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

import de.declaregen.datastructure.corpus.Corpus;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outcome of a batch generation. Every requested index either holds a sequence or a failure; one failed index
 * does not affect the others.
 *
 * @param <I>
 *         symbol type
 */
public final class GenerationResult<I> {

    private final List<@Nullable Word<I>> slots;
    private final SortedMap<Integer, RuntimeException> failures;

    GenerationResult(List<@Nullable Word<I>> slots, SortedMap<Integer, RuntimeException> failures) {
        this.slots = Collections.unmodifiableList(slots);
        this.failures = Collections.unmodifiableSortedMap(failures);
    }

    public int getRequested() {
        return slots.size();
    }

    /**
     * Returns the sequence generated for the given index, or {@code null} if that index failed.
     */
    public @Nullable Word<I> get(int index) {
        return slots.get(index);
    }

    /**
     * Returns the successfully generated sequences in index order.
     */
    public List<Word<I>> getTraces() {
        List<Word<I>> traces = new ArrayList<>(slots.size());
        for (Word<I> w : slots) {
            if (w != null) {
                traces.add(w);
            }
        }
        return traces;
    }

    public Corpus<I> toCorpus() {
        return Corpus.of(getTraces());
    }

    public SortedMap<Integer, RuntimeException> getFailures() {
        return failures;
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    /**
     * Returns all sequences, or throws the failure of the lowest failed index.
     */
    public List<Word<I>> getTracesOrThrow() {
        if (!failures.isEmpty()) {
            throw failures.get(failures.firstKey());
        }
        return getTraces();
    }

    @Override
    public String toString() {
        return "GenerationResult[requested=" + slots.size() + ", failed=" + failures.size() + ']';
    }
}
