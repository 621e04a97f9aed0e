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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;

/**
 * The empirical k-order transition system of a corpus.
 * <p>
 * Nodes are integer ids over k-gram contexts; node {@link #START} is the empty context. Each node has its outgoing
 * edges sorted by alphabet index, every edge weighted with how often the corpus followed the context with the edge's
 * symbol. Sequence ends are edges into the absorbing node {@link #END}, stored as a per-node end weight.
 * <p>
 * Instances are immutable and may be shared between threads.
 *
 * @param <I>
 *         symbol type
 */
public final class TransitionSystem<I> {

    public static final int START = 0;
    public static final int END = -1;

    private final Alphabet<I> alphabet;
    private final int order;
    private final List<Word<I>> contexts;
    private final Map<Word<I>, Integer> nodeIds;
    private final int[][] edgeSymbols;
    private final int[][] edgeTargets;
    private final long[][] edgeWeights;
    private final long[] endWeights;

    TransitionSystem(Alphabet<I> alphabet,
                     int order,
                     List<Word<I>> contexts,
                     Map<Word<I>, Integer> nodeIds,
                     int[][] edgeSymbols,
                     int[][] edgeTargets,
                     long[][] edgeWeights,
                     long[] endWeights) {
        this.alphabet = alphabet;
        this.order = order;
        this.contexts = Collections.unmodifiableList(contexts);
        this.nodeIds = Collections.unmodifiableMap(nodeIds);
        this.edgeSymbols = edgeSymbols;
        this.edgeTargets = edgeTargets;
        this.edgeWeights = edgeWeights;
        this.endWeights = endWeights;
    }

    public Alphabet<I> getAlphabet() {
        return alphabet;
    }

    public int getOrder() {
        return order;
    }

    /**
     * Returns the number of context nodes, not counting {@link #END}.
     */
    public int size() {
        return contexts.size();
    }

    public Word<I> getContext(int node) {
        return contexts.get(node);
    }

    /**
     * Returns the node of the given context, or {@link #END} if the context never occurred.
     */
    public int getNode(Word<I> context) {
        Integer id = nodeIds.get(context);
        return id == null ? END : id;
    }

    public int getOutDegree(int node) {
        return edgeSymbols[node].length;
    }

    public int getEdgeSymbolIndex(int node, int edge) {
        return edgeSymbols[node][edge];
    }

    public I getEdgeSymbol(int node, int edge) {
        return alphabet.getSymbol(edgeSymbols[node][edge]);
    }

    public int getEdgeTarget(int node, int edge) {
        return edgeTargets[node][edge];
    }

    public long getEdgeWeight(int node, int edge) {
        return edgeWeights[node][edge];
    }

    /**
     * Returns the target of the edge leaving {@code node} with the given symbol, or {@link #END} if there is none.
     */
    public int getSuccessor(int node, I symbol) {
        int[] syms = edgeSymbols[node];
        for (int i = 0; i < syms.length; i++) {
            if (alphabet.getSymbol(syms[i]).equals(symbol)) {
                return edgeTargets[node][i];
            }
        }
        return END;
    }

    /**
     * Returns the sum of the weights of all symbol edges leaving the node, i.e. how often the context was followed
     * by a further symbol.
     */
    public long getOutgoingWeight(int node) {
        long sum = 0;
        for (long w : edgeWeights[node]) {
            sum += w;
        }
        return sum;
    }

    /**
     * Returns the weight of the edge from the node into {@link #END}, i.e. how often a sequence ended with the
     * node's context.
     */
    public long getEndWeight(int node) {
        return endWeights[node];
    }

    public int getEdgeCount() {
        int n = 0;
        for (int[] syms : edgeSymbols) {
            n += syms.length;
        }
        return n;
    }

    @Override
    public String toString() {
        return "TransitionSystem[order=" + order + ", nodes=" + size() + ", edges=" + getEdgeCount() + ']';
    }
}
