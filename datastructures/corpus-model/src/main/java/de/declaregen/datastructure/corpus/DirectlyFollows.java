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

import net.automatalib.commons.util.Pair;
import net.automatalib.words.Word;

/**
 * Computes the directly-follows relation of a set of sequences: how often each ordered pair of adjacent symbols
 * occurs.
 */
public final class DirectlyFollows {

    private DirectlyFollows() {
        // prevent instantiation
    }

    public static <I> FrequencyTable<Pair<I, I>> of(Iterable<? extends Word<I>> sequences) {
        FrequencyTable.Counter<Pair<I, I>> counter = new FrequencyTable.Counter<>();
        for (Word<I> seq : sequences) {
            for (int i = 1; i < seq.length(); i++) {
                counter.count(Pair.of(seq.getSymbol(i - 1), seq.getSymbol(i)));
            }
        }
        return counter.toTable();
    }
}
