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
package de.declaregen.datastructure.ts;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import de.declaregen.datastructure.corpus.Corpus;
import de.declaregen.datastructure.corpus.CorpusModel;
import de.declaregen.datastructure.corpus.FrequencyTable;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link TransitionSystem} of a {@link CorpusModel}.
 * <p>
 * Nodes are discovered breadth-first from the empty context, following edges in alphabet order, so the numbering
 * only depends on the model and repeated builds are structurally identical.
 */
public final class TransitionSystemBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransitionSystemBuilder.class);

    private TransitionSystemBuilder() {
        // prevent instantiation
    }

    public static <I> TransitionSystem<I> build(Corpus<I> corpus, int order) {
        return build(CorpusModel.of(corpus, order));
    }

    public static <I> TransitionSystem<I> build(CorpusModel<I> model) {
        final Alphabet<I> alphabet = model.getAlphabet();
        final int order = model.getOrder();

        List<Word<I>> contexts = new ArrayList<>();
        Map<Word<I>, Integer> nodeIds = new HashMap<>();
        List<int[]> symbols = new ArrayList<>();
        List<int[]> targets = new ArrayList<>();
        List<long[]> weights = new ArrayList<>();

        Deque<Word<I>> queue = new ArrayDeque<>();
        addNode(Word.epsilon(), contexts, nodeIds, queue);

        while (!queue.isEmpty()) {
            Word<I> ctx = queue.poll();
            FrequencyTable<I> next = model.getSuccessorCounts(ctx);

            int[] syms = new int[next.size()];
            int[] tgts = new int[next.size()];
            long[] wgts = new long[next.size()];

            int i = 0;
            for (int symIdx = 0; symIdx < alphabet.size(); symIdx++) {
                I sym = alphabet.getSymbol(symIdx);
                long weight = next.get(sym);
                if (weight == 0) {
                    continue;
                }
                Word<I> succ = CorpusModel.contextOf(ctx.append(sym), order);
                Integer succId = nodeIds.get(succ);
                if (succId == null) {
                    succId = addNode(succ, contexts, nodeIds, queue);
                }
                syms[i] = symIdx;
                tgts[i] = succId;
                wgts[i] = weight;
                i++;
            }

            symbols.add(syms);
            targets.add(tgts);
            weights.add(wgts);
        }

        int size = contexts.size();
        long[] endWeights = new long[size];
        for (int n = 0; n < size; n++) {
            endWeights[n] = model.getEndCount(contexts.get(n));
        }

        TransitionSystem<I> ts = new TransitionSystem<>(alphabet,
                                                        order,
                                                        contexts,
                                                        nodeIds,
                                                        symbols.toArray(new int[0][]),
                                                        targets.toArray(new int[0][]),
                                                        weights.toArray(new long[0][]),
                                                        endWeights);
        LOGGER.debug("Built {} from {} sequence(s)", ts, model.getSequenceCount());
        return ts;
    }

    private static <I> int addNode(Word<I> context,
                                   List<Word<I>> contexts,
                                   Map<Word<I>, Integer> nodeIds,
                                   Deque<Word<I>> queue) {
        int id = contexts.size();
        contexts.add(context);
        nodeIds.put(context, id);
        queue.add(context);
        return id;
    }
}
