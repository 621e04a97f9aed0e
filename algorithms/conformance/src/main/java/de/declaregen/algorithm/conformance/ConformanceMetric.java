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
package de.declaregen.algorithm.conformance;

import de.declaregen.datastructure.corpus.Corpus;

/**
 * A conformance measure between two corpora. Lower values mean more conformant corpora.
 *
 * @param <I>
 *         symbol type
 */
@FunctionalInterface
public interface ConformanceMetric<I> {

    /**
     * Computes the distance between two corpora without modifying either.
     */
    double distance(Corpus<I> first, Corpus<I> second);

    /**
     * Returns the largest value {@link #distance(Corpus, Corpus)} can take.
     */
    default double maxDistance() {
        return 1;
    }

    /**
     * Maps the distance onto {@code [0, 1]}, where 1 means identical and 0 means maximally distant corpora.
     */
    default double similarity(Corpus<I> first, Corpus<I> second) {
        return 1 - distance(first, second) / maxDistance();
    }
}
