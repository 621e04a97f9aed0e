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
package de.declaregen.algorithm.product;

import java.util.List;

import de.declaregen.algorithm.constraint.ConstraintAutomaton;
import de.declaregen.datastructure.ts.TransitionSystem;
import net.automatalib.words.Alphabet;

/**
 * The pruned synchronized product of a {@link TransitionSystem} with a list of {@link ConstraintAutomaton constraint
 * automata}.
 * <p>
 * Nodes are integer ids, {@link #INITIAL} being the start node. Every node lies on a path from the start node to an
 * accepting node, i.e. a node whose automaton components all accept. Edge weights are the weights of the underlying
 * transition system edges.
 * <p>
 * Instances are immutable and may be shared between any number of sampling threads.
 *
 * @param <I>
 *         symbol type
 */
public final class ProductGraph<I> {

    public static final int INITIAL = 0;

    private final TransitionSystem<I> transitionSystem;
    private final List<ConstraintAutomaton<I>> automata;
    private final ProductState[] states;
    private final int[][] edgeSymbols;
    private final int[][] edgeTargets;
    private final long[][] edgeWeights;
    private final boolean[] accepting;
    private final int exploredSize;

    ProductGraph(TransitionSystem<I> transitionSystem,
                 List<ConstraintAutomaton<I>> automata,
                 ProductState[] states,
                 int[][] edgeSymbols,
                 int[][] edgeTargets,
                 long[][] edgeWeights,
                 boolean[] accepting,
                 int exploredSize) {
        this.transitionSystem = transitionSystem;
        this.automata = List.copyOf(automata);
        this.states = states;
        this.edgeSymbols = edgeSymbols;
        this.edgeTargets = edgeTargets;
        this.edgeWeights = edgeWeights;
        this.accepting = accepting;
        this.exploredSize = exploredSize;
    }

    public TransitionSystem<I> getTransitionSystem() {
        return transitionSystem;
    }

    public List<ConstraintAutomaton<I>> getAutomata() {
        return automata;
    }

    public Alphabet<I> getAlphabet() {
        return transitionSystem.getAlphabet();
    }

    public int size() {
        return states.length;
    }

    /**
     * Returns the number of product states explored before pruning.
     */
    public int getExploredSize() {
        return exploredSize;
    }

    public int getInitialNode() {
        return INITIAL;
    }

    public ProductState getState(int node) {
        return states[node];
    }

    public int getOutDegree(int node) {
        return edgeSymbols[node].length;
    }

    public int getEdgeSymbolIndex(int node, int edge) {
        return edgeSymbols[node][edge];
    }

    public I getEdgeSymbol(int node, int edge) {
        return getAlphabet().getSymbol(edgeSymbols[node][edge]);
    }

    public int getEdgeTarget(int node, int edge) {
        return edgeTargets[node][edge];
    }

    public long getEdgeWeight(int node, int edge) {
        return edgeWeights[node][edge];
    }

    /**
     * Returns whether every automaton component of the node is accepting.
     */
    public boolean isAccepting(int node) {
        return accepting[node];
    }

    /**
     * Returns the end weight of the node's transition system context, i.e. how often the corpus ended there.
     */
    public long getEndWeight(int node) {
        return transitionSystem.getEndWeight(states[node].getTransitionSystemNode());
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
        return "ProductGraph[automata=" + automata + ", nodes=" + size() + ", edges=" + getEdgeCount() + ']';
    }
}
