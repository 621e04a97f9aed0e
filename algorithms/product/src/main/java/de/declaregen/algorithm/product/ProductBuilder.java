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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import de.declaregen.algorithm.constraint.ConstraintAutomaton;
import de.declaregen.datastructure.ts.TransitionSystem;
import de.declaregen.exception.InvalidArgumentException;
import de.declaregen.exception.LimitException;
import de.declaregen.exception.UnknownSymbolException;
import de.declaregen.exception.UnsatisfiableConstraintSetException;
import net.automatalib.words.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link ProductGraph} of a transition system and a list of constraint automata.
 * <p>
 * The product is explored forward from (start context, initial automaton states). An edge exists wherever the
 * transition system has an edge on some symbol and every automaton has a transition on that symbol; for
 * non-deterministic automata every combination of successor states becomes its own product node. Afterwards all
 * nodes from which no accepting node is reachable are pruned. End weights play no part in pruning; they only steer
 * when a sampler stops.
 * <p>
 * The product has at most {@code |TS nodes| * prod |automaton states|} nodes. Since every compiled constraint has a
 * small constant number of states, the number of constraints is the dominant cost driver; exploration stops with a
 * {@link LimitException} once the configured state limit is exceeded.
 *
 * @param <I>
 *         symbol type
 */
public class ProductBuilder<I> {

    public static final int DEFAULT_STATE_LIMIT = 1_000_000;

    private static final Logger LOGGER = LoggerFactory.getLogger(ProductBuilder.class);

    private final TransitionSystem<I> ts;
    private final List<ConstraintAutomaton<I>> automata;
    private final int stateLimit;

    // per automaton: TS alphabet index -> automaton alphabet index
    private final int[][] symbolMaps;
    private final boolean[][] dead;

    public ProductBuilder(TransitionSystem<I> ts, List<ConstraintAutomaton<I>> automata) {
        this(ts, automata, DEFAULT_STATE_LIMIT);
    }

    /**
     * Constructor.
     *
     * @throws UnknownSymbolException
     *         if an automaton does not know a symbol of the transition system
     * @throws InvalidArgumentException
     *         if the state limit is not positive
     */
    public ProductBuilder(TransitionSystem<I> ts, List<ConstraintAutomaton<I>> automata, int stateLimit) {
        if (stateLimit < 1) {
            throw new InvalidArgumentException("State limit must be positive, got " + stateLimit);
        }
        this.ts = ts;
        this.automata = List.copyOf(automata);
        this.stateLimit = stateLimit;

        Alphabet<I> alphabet = ts.getAlphabet();
        this.symbolMaps = new int[this.automata.size()][alphabet.size()];
        this.dead = new boolean[this.automata.size()][];
        for (int k = 0; k < this.automata.size(); k++) {
            ConstraintAutomaton<I> automaton = this.automata.get(k);
            for (int i = 0; i < alphabet.size(); i++) {
                symbolMaps[k][i] = automaton.indexOf(alphabet.getSymbol(i));
            }
            dead[k] = new boolean[automaton.size()];
            for (int s : automaton.getDeadStates()) {
                dead[k][s] = true;
            }
        }
    }

    /**
     * Explores and prunes the product.
     *
     * @throws UnsatisfiableConstraintSetException
     *         if no sequence of the transition system satisfies all constraints
     * @throws LimitException
     *         if more than the configured number of states would be explored
     */
    public ProductGraph<I> build() {
        final int n = automata.size();

        List<ProductState> states = new ArrayList<>();
        Map<ProductState, Integer> ids = new HashMap<>();
        List<int[]> symbols = new ArrayList<>();
        List<int[]> targets = new ArrayList<>();
        List<long[]> weights = new ArrayList<>();

        int[] init = new int[n];
        for (int k = 0; k < n; k++) {
            init[k] = automata.get(k).getInitialState();
        }
        addState(new ProductState(TransitionSystem.START, init), states, ids);

        // FIRST PASS: forward exploration, nodes are processed in id order
        for (int node = 0; node < states.size(); node++) {
            ProductState state = states.get(node);
            int tsNode = state.getTransitionSystemNode();

            List<int[]> out = new ArrayList<>();
            for (int e = 0; e < ts.getOutDegree(tsNode); e++) {
                int symIdx = ts.getEdgeSymbolIndex(tsNode, e);
                int[][] choices = successorChoices(state, symIdx);
                if (choices == null) {
                    continue;
                }
                int tsTarget = ts.getEdgeTarget(tsNode, e);
                for (int[] combination : combinations(choices)) {
                    ProductState succ = new ProductState(tsTarget, combination);
                    Integer succId = ids.get(succ);
                    if (succId == null) {
                        succId = addState(succ, states, ids);
                    }
                    out.add(new int[] {symIdx, succId, e});
                }
            }

            int[] syms = new int[out.size()];
            int[] tgts = new int[out.size()];
            long[] wgts = new long[out.size()];
            for (int i = 0; i < out.size(); i++) {
                int[] edge = out.get(i);
                syms[i] = edge[0];
                tgts[i] = edge[1];
                wgts[i] = ts.getEdgeWeight(tsNode, edge[2]);
            }
            symbols.add(syms);
            targets.add(tgts);
            weights.add(wgts);
        }

        final int explored = states.size();
        boolean[] accepting = new boolean[explored];
        for (int node = 0; node < explored; node++) {
            accepting[node] = allAccepting(states.get(node));
        }

        // SECOND PASS: backward reachability from accepting nodes
        boolean[] alive = backwardReachable(targets, accepting);
        if (!alive[ProductGraph.INITIAL]) {
            throw new UnsatisfiableConstraintSetException("No sequence of " + ts + " satisfies all of " + automata);
        }

        // THIRD PASS: renumber the surviving nodes, keeping their relative order
        int[] newIds = new int[explored];
        int size = 0;
        for (int node = 0; node < explored; node++) {
            newIds[node] = alive[node] ? size++ : -1;
        }

        ProductState[] prunedStates = new ProductState[size];
        int[][] prunedSymbols = new int[size][];
        int[][] prunedTargets = new int[size][];
        long[][] prunedWeights = new long[size][];
        boolean[] prunedAccepting = new boolean[size];

        for (int node = 0; node < explored; node++) {
            int id = newIds[node];
            if (id < 0) {
                continue;
            }
            int[] tgts = targets.get(node);
            int kept = 0;
            for (int t : tgts) {
                if (alive[t]) {
                    kept++;
                }
            }
            int[] syms = new int[kept];
            int[] newTgts = new int[kept];
            long[] wgts = new long[kept];
            int j = 0;
            for (int i = 0; i < tgts.length; i++) {
                if (alive[tgts[i]]) {
                    syms[j] = symbols.get(node)[i];
                    newTgts[j] = newIds[tgts[i]];
                    wgts[j] = weights.get(node)[i];
                    j++;
                }
            }
            prunedStates[id] = states.get(node);
            prunedSymbols[id] = syms;
            prunedTargets[id] = newTgts;
            prunedWeights[id] = wgts;
            prunedAccepting[id] = accepting[node];
        }

        ProductGraph<I> product = new ProductGraph<>(ts,
                                                     automata,
                                                     prunedStates,
                                                     prunedSymbols,
                                                     prunedTargets,
                                                     prunedWeights,
                                                     prunedAccepting,
                                                     explored);
        LOGGER.debug("Explored {} product state(s), kept {}", explored, size);
        return product;
    }

    private int addState(ProductState state, List<ProductState> states, Map<ProductState, Integer> ids) {
        if (states.size() >= stateLimit) {
            throw new LimitException("Product of " + ts + " and " + automata + " exceeds " + stateLimit +
                                     " states");
        }
        int id = states.size();
        states.add(state);
        ids.put(state, id);
        return id;
    }

    /**
     * Returns, per automaton, the live successor states on the given symbol, or {@code null} if some automaton has
     * none.
     */
    private int[][] successorChoices(ProductState state, int symIdx) {
        int[][] choices = new int[automata.size()][];
        for (int k = 0; k < automata.size(); k++) {
            ConstraintAutomaton<I> automaton = automata.get(k);
            int q = state.getAutomatonState(k);
            int aSym = symbolMaps[k][symIdx];
            int count = automaton.getSuccessorCount(q, aSym);

            int[] live = new int[count];
            int m = 0;
            for (int i = 0; i < count; i++) {
                int t = automaton.getSuccessor(q, aSym, i);
                if (!dead[k][t]) {
                    live[m++] = t;
                }
            }
            if (m == 0) {
                return null;
            }
            choices[k] = m == count ? live : Arrays.copyOf(live, m);
        }
        return choices;
    }

    // lexicographic enumeration of all successor combinations
    private static List<int[]> combinations(int[][] choices) {
        List<int[]> result = new ArrayList<>();
        int[] cursor = new int[choices.length];
        while (true) {
            int[] combination = new int[choices.length];
            for (int k = 0; k < choices.length; k++) {
                combination[k] = choices[k][cursor[k]];
            }
            result.add(combination);

            int k = choices.length - 1;
            while (k >= 0 && cursor[k] == choices[k].length - 1) {
                cursor[k] = 0;
                k--;
            }
            if (k < 0) {
                return result;
            }
            cursor[k]++;
        }
    }

    private boolean allAccepting(ProductState state) {
        for (int k = 0; k < automata.size(); k++) {
            if (!automata.get(k).isAccepting(state.getAutomatonState(k))) {
                return false;
            }
        }
        return true;
    }

    private boolean[] backwardReachable(List<int[]> targets, boolean[] accepting) {
        int size = accepting.length;

        int[] inDegree = new int[size];
        for (int[] tgts : targets) {
            for (int t : tgts) {
                inDegree[t]++;
            }
        }
        int[][] predecessors = new int[size][];
        for (int node = 0; node < size; node++) {
            predecessors[node] = new int[inDegree[node]];
        }
        int[] fill = new int[size];
        for (int node = 0; node < size; node++) {
            for (int t : targets.get(node)) {
                predecessors[t][fill[t]++] = node;
            }
        }

        boolean[] alive = new boolean[size];
        Deque<Integer> queue = new ArrayDeque<>();
        for (int node = 0; node < size; node++) {
            if (accepting[node]) {
                alive[node] = true;
                queue.add(node);
            }
        }
        while (!queue.isEmpty()) {
            int node = queue.poll();
            for (int p : predecessors[node]) {
                if (!alive[p]) {
                    alive[p] = true;
                    queue.add(p);
                }
            }
        }
        return alive;
    }
}
