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

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import de.declaregen.datastructure.corpus.Corpus;
import de.declaregen.datastructure.corpus.DirectlyFollows;
import de.declaregen.datastructure.corpus.FrequencyTable;
import de.declaregen.exception.EmptyCorpusException;
import de.declaregen.exception.UnknownSymbolException;
import net.automatalib.commons.util.Pair;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compares the directly-follows distributions of two corpora.
 * <p>
 * Each corpus' directly-follows counts are normalized to a probability distribution over the union of the pairs seen
 * in either corpus (unseen pairs have probability 0). A corpus without any pair contributes the all-zero vector. The
 * distance is the L1 or L2 norm of the difference of both vectors; it is symmetric and 0 exactly for identical
 * distributions.
 *
 * @param <I>
 *         symbol type
 */
public class DirectlyFollowsDistance<I> implements ConformanceMetric<I> {

    public enum Norm {
        /** Sum of absolute differences, between 0 and 2. */
        L1,
        /** Euclidean norm of the difference, between 0 and sqrt(2). */
        L2
    }

    private final Norm norm;
    private final @Nullable Alphabet<I> alphabet;

    public DirectlyFollowsDistance() {
        this(Norm.L1, null);
    }

    public DirectlyFollowsDistance(Norm norm) {
        this(norm, null);
    }

    /**
     * Constructor.
     *
     * @param norm
     *         the norm applied to the difference of the distributions
     * @param alphabet
     *         if not {@code null}, both corpora must only use symbols of this alphabet
     */
    public DirectlyFollowsDistance(Norm norm, @Nullable Alphabet<I> alphabet) {
        this.norm = norm;
        this.alphabet = alphabet;
    }

    public Norm getNorm() {
        return norm;
    }

    @Override
    public double maxDistance() {
        return norm == Norm.L1 ? 2 : Math.sqrt(2);
    }

    /**
     * {@inheritDoc}
     *
     * @throws EmptyCorpusException
     *         if either corpus contains no sequence
     * @throws UnknownSymbolException
     *         if a fixed alphabet was given and a corpus uses a symbol outside of it
     */
    @Override
    public double distance(Corpus<I> first, Corpus<I> second) {
        FrequencyTable<Pair<I, I>> df1 = directlyFollows(first);
        FrequencyTable<Pair<I, I>> df2 = directlyFollows(second);

        Set<Pair<I, I>> pairs = new LinkedHashSet<>(df1.keySet());
        pairs.addAll(df2.keySet());

        // summed in ascending order so that swapping the arguments yields the identical value
        double[] terms = new double[pairs.size()];
        int i = 0;
        for (Pair<I, I> pair : pairs) {
            double diff = Math.abs(df1.getProbability(pair) - df2.getProbability(pair));
            terms[i++] = norm == Norm.L1 ? diff : diff * diff;
        }
        Arrays.sort(terms);

        double sum = 0;
        for (double t : terms) {
            sum += t;
        }
        return norm == Norm.L1 ? sum : Math.sqrt(sum);
    }

    private FrequencyTable<Pair<I, I>> directlyFollows(Corpus<I> corpus) {
        if (corpus == null || corpus.isEmpty()) {
            throw new EmptyCorpusException("Cannot compute the directly-follows distribution of an empty corpus");
        }
        if (alphabet != null) {
            for (Word<I> seq : corpus) {
                for (I sym : seq) {
                    if (!alphabet.containsSymbol(sym)) {
                        throw new UnknownSymbolException("Symbol '" + sym + "' is not part of the alphabet " +
                                                         alphabet);
                    }
                }
            }
        }
        return DirectlyFollows.of(corpus);
    }
}
