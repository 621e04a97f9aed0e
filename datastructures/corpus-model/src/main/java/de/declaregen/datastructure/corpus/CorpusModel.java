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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import de.declaregen.exception.EmptyCorpusException;
import de.declaregen.exception.InvalidArgumentException;
import de.declaregen.exception.UnknownSymbolException;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;

/**
 * Frequency statistics of a corpus for a k-order Markov view of it.
 * <p>
 * The context of a prefix is its trailing window of at most k symbols. Prefixes shorter than k yield shorter
 * contexts, which plays the role of start padding: the empty word is the context of the empty prefix.
 * <p>
 * A model is immutable once created and holds no reference to the corpus it was computed from.
 *
 * @param <I>
 *         symbol type
 */
public final class CorpusModel<I> {

    private final Alphabet<I> alphabet;
    private final int order;
    private final int sequenceCount;
    private final FrequencyTable<I> unigrams;
    private final Map<Word<I>, FrequencyTable<I>> successors;
    private final FrequencyTable<Word<I>> ends;

    private CorpusModel(Alphabet<I> alphabet,
                        int order,
                        int sequenceCount,
                        FrequencyTable<I> unigrams,
                        Map<Word<I>, FrequencyTable<I>> successors,
                        FrequencyTable<Word<I>> ends) {
        this.alphabet = alphabet;
        this.order = order;
        this.sequenceCount = sequenceCount;
        this.unigrams = unigrams;
        this.successors = successors;
        this.ends = ends;
    }

    /**
     * Computes the model of a corpus over the alphabet of that corpus.
     *
     * @throws EmptyCorpusException
     *         if the corpus contains no sequence
     * @throws InvalidArgumentException
     *         if {@code order < 1}
     */
    public static <I> CorpusModel<I> of(Corpus<I> corpus, int order) {
        checkCorpus(corpus);
        return of(corpus, order, alphabetOf(Collections.singletonList(corpus)));
    }

    /**
     * Computes the model of a corpus over a previously fixed alphabet.
     *
     * @throws EmptyCorpusException
     *         if the corpus contains no sequence
     * @throws InvalidArgumentException
     *         if {@code order < 1}
     * @throws UnknownSymbolException
     *         if the corpus contains a symbol outside the alphabet
     */
    public static <I> CorpusModel<I> of(Corpus<I> corpus, int order, Alphabet<I> alphabet) {
        checkCorpus(corpus);
        if (order < 1) {
            throw new InvalidArgumentException("Order must be at least 1, got " + order);
        }

        FrequencyTable.Counter<I> unigramCounter = new FrequencyTable.Counter<>();
        Map<Word<I>, FrequencyTable.Counter<I>> successorCounters = new LinkedHashMap<>();
        FrequencyTable.Counter<Word<I>> endCounter = new FrequencyTable.Counter<>();

        for (Word<I> seq : corpus) {
            for (int i = 0; i < seq.length(); i++) {
                I sym = seq.getSymbol(i);
                checkSymbol(alphabet, sym);
                unigramCounter.count(sym);
                successorCounters.computeIfAbsent(contextOf(seq.prefix(i), order), c -> new FrequencyTable.Counter<>())
                                 .count(sym);
            }
            endCounter.count(contextOf(seq, order));
        }

        Map<Word<I>, FrequencyTable<I>> successors = new LinkedHashMap<>();
        successorCounters.forEach((ctx, counter) -> successors.put(ctx, counter.toTable()));

        return new CorpusModel<>(alphabet,
                                 order,
                                 corpus.size(),
                                 unigramCounter.toTable(),
                                 Collections.unmodifiableMap(successors),
                                 endCounter.toTable());
    }

    /**
     * Computes the alphabet shared by several corpora. Symbols are ordered by first occurrence, scanning the corpora
     * in the given order.
     *
     * @throws EmptyCorpusException
     *         if no corpus contains a sequence
     */
    public static <I> Alphabet<I> alphabetOf(List<? extends Corpus<? extends I>> corpora) {
        Set<I> symbols = new LinkedHashSet<>();
        boolean anySequence = false;
        for (Corpus<? extends I> corpus : corpora) {
            for (Word<? extends I> seq : corpus) {
                anySequence = true;
                for (I sym : seq) {
                    symbols.add(sym);
                }
            }
        }
        if (!anySequence) {
            throw new EmptyCorpusException("Cannot derive an alphabet from empty corpora");
        }
        return Alphabets.fromCollection(symbols);
    }

    /**
     * Returns the context of the given prefix: its trailing window of at most {@code order} symbols.
     */
    public static <I> Word<I> contextOf(Word<I> prefix, int order) {
        return prefix.length() <= order ? prefix : prefix.suffix(order);
    }

    private static void checkCorpus(Corpus<?> corpus) {
        if (corpus == null || corpus.isEmpty()) {
            throw new EmptyCorpusException("Corpus contains no sequences");
        }
    }

    private static <I> void checkSymbol(Alphabet<I> alphabet, I symbol) {
        if (!alphabet.containsSymbol(symbol)) {
            throw new UnknownSymbolException("Symbol '" + symbol + "' is not part of the alphabet " + alphabet);
        }
    }

    /**
     * Checks that the given symbol belongs to the alphabet of this model.
     *
     * @throws UnknownSymbolException
     *         if it does not
     */
    public I requireSymbol(I symbol) {
        checkSymbol(alphabet, symbol);
        return symbol;
    }

    public Alphabet<I> getAlphabet() {
        return alphabet;
    }

    public int getOrder() {
        return order;
    }

    public int getSequenceCount() {
        return sequenceCount;
    }

    public FrequencyTable<I> getUnigrams() {
        return unigrams;
    }

    /**
     * Returns all contexts that were followed by at least one further symbol, in order of first appearance.
     */
    public Set<Word<I>> getContexts() {
        return successors.keySet();
    }

    /**
     * Returns how often each symbol followed the given context.
     */
    public FrequencyTable<I> getSuccessorCounts(Word<I> context) {
        FrequencyTable<I> table = successors.get(context);
        return table == null ? FrequencyTable.empty() : table;
    }

    /**
     * Returns how often a sequence ended with the given context.
     */
    public long getEndCount(Word<I> context) {
        return ends.get(context);
    }

    public FrequencyTable<Word<I>> getEndCounts() {
        return ends;
    }
}
