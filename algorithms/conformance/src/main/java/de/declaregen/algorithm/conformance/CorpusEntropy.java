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

import java.util.ArrayList;
import java.util.List;

import de.declaregen.datastructure.corpus.Corpus;
import de.declaregen.datastructure.corpus.FrequencyTable;
import net.automatalib.words.Word;

/**
 * Shannon entropy of the symbol distribution of a corpus, in base 10.
 * <p>
 * In {@link Mode#TRACE trace} mode the sequences are taken as they are; in {@link Mode#PREFIX prefix} mode every
 * non-empty prefix of every sequence is taken, which weights early symbols more heavily.
 */
public final class CorpusEntropy {

    public enum Mode {
        TRACE,
        PREFIX
    }

    private final double value;
    private final int sequenceCount;

    private CorpusEntropy(double value, int sequenceCount) {
        this.value = value;
        this.sequenceCount = sequenceCount;
    }

    public static <I> CorpusEntropy of(Corpus<I> corpus, Mode mode) {
        List<Word<I>> sequences = mode == Mode.PREFIX ? prefixes(corpus) : corpus.getSequences();
        return new CorpusEntropy(entropy(sequences), sequences.size());
    }

    public static <I> double entropy(Iterable<? extends Word<I>> sequences) {
        FrequencyTable.Counter<I> counter = new FrequencyTable.Counter<>();
        for (Word<I> seq : sequences) {
            for (I sym : seq) {
                counter.count(sym);
            }
        }
        FrequencyTable<I> table = counter.toTable();

        double h = 0;
        for (long count : table.asMap().values()) {
            double p = (double) count / table.getTotal();
            h -= p * Math.log10(p);
        }
        return h;
    }

    private static <I> List<Word<I>> prefixes(Corpus<I> corpus) {
        List<Word<I>> result = new ArrayList<>();
        for (Word<I> seq : corpus) {
            for (int i = 1; i <= seq.length(); i++) {
                result.add(seq.prefix(i));
            }
        }
        return result;
    }

    public double getValue() {
        return value;
    }

    /**
     * Returns the number of sequences the entropy was computed over, e.g. for normalization.
     */
    public int getSequenceCount() {
        return sequenceCount;
    }

    @Override
    public String toString() {
        return "CorpusEntropy[value=" + value + ", sequences=" + sequenceCount + ']';
    }
}
