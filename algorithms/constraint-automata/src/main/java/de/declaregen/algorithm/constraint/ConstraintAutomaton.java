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
package de.declaregen.algorithm.constraint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import de.declaregen.api.constraint.ConstraintSpec;
import de.declaregen.exception.InvalidArgumentException;
import de.declaregen.exception.UnknownSymbolException;
import net.automatalib.automata.fsa.impl.compact.CompactNFA;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable finite automaton over the full alphabet, compiled from a single constraint.
 * <p>
 * Transitions are kept as a table {@code state -> symbol index -> sorted successor states}. The automaton may be
 * non-deterministic; an empty successor set means the symbol is rejected from that state. Automata produced by
 * {@link ConstraintCompiler} are deterministic and total.
 *
 * @param <I>
 *         symbol type
 */
public final class ConstraintAutomaton<I> {

    private static final int[] NO_SUCCESSORS = new int[0];

    private final String name;
    private final @Nullable ConstraintSpec<I> spec;
    private final Alphabet<I> alphabet;
    private final int initialState;
    private final int[][][] successors;
    private final boolean[] accepting;

    private ConstraintAutomaton(String name,
                                @Nullable ConstraintSpec<I> spec,
                                Alphabet<I> alphabet,
                                int initialState,
                                int[][][] successors,
                                boolean[] accepting) {
        this.name = name;
        this.spec = spec;
        this.alphabet = alphabet;
        this.initialState = initialState;
        this.successors = successors;
        this.accepting = accepting;
    }

    static <I> ConstraintAutomaton<I> of(ConstraintSpec<I> spec, CompactNFA<I> nfa) {
        return copyOf(spec.toString(), spec, nfa);
    }

    /**
     * Wraps an arbitrary NFA as a constraint automaton. The NFA is copied, later changes to it are not reflected.
     *
     * @param name
     *         a name used in diagnostics
     * @param nfa
     *         the automaton, which must have exactly one initial state
     *
     * @throws InvalidArgumentException
     *         if the NFA does not have exactly one initial state
     */
    public static <I> ConstraintAutomaton<I> fromNFA(String name, CompactNFA<I> nfa) {
        return copyOf(name, null, nfa);
    }

    private static <I> ConstraintAutomaton<I> copyOf(String name,
                                                     @Nullable ConstraintSpec<I> spec,
                                                     CompactNFA<I> nfa) {
        Set<Integer> inits = nfa.getInitialStates();
        if (inits.size() != 1) {
            throw new InvalidArgumentException(name + ": expected exactly one initial state, got " + inits.size());
        }

        Alphabet<I> alphabet = nfa.getInputAlphabet();
        int size = nfa.size();
        int[][][] succs = new int[size][alphabet.size()][];
        boolean[] acc = new boolean[size];

        for (int s = 0; s < size; s++) {
            acc[s] = nfa.isAccepting(s);
            for (int i = 0; i < alphabet.size(); i++) {
                Collection<Integer> targets = nfa.getSuccessors(s, alphabet.getSymbol(i));
                if (targets.isEmpty()) {
                    succs[s][i] = NO_SUCCESSORS;
                } else {
                    int[] arr = targets.stream().mapToInt(Integer::intValue).distinct().toArray();
                    Arrays.sort(arr);
                    succs[s][i] = arr;
                }
            }
        }

        return new ConstraintAutomaton<>(name, spec, alphabet, inits.iterator().next(), succs, acc);
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the constraint this automaton was compiled from, or {@code null} for automata wrapped via
     * {@link #fromNFA(String, CompactNFA)}.
     */
    public @Nullable ConstraintSpec<I> getSpec() {
        return spec;
    }

    public Alphabet<I> getAlphabet() {
        return alphabet;
    }

    public int size() {
        return accepting.length;
    }

    public int getInitialState() {
        return initialState;
    }

    public boolean isAccepting(int state) {
        return accepting[state];
    }

    public int getSuccessorCount(int state, int symbolIndex) {
        return successors[state][symbolIndex].length;
    }

    public int getSuccessor(int state, int symbolIndex, int i) {
        return successors[state][symbolIndex][i];
    }

    public boolean isDeterministic() {
        for (int[][] row : successors) {
            for (int[] targets : row) {
                if (targets.length > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns the index of the given symbol in the alphabet of this automaton.
     *
     * @throws UnknownSymbolException
     *         if the symbol is not part of the alphabet
     */
    public int indexOf(I symbol) {
        if (!alphabet.containsSymbol(symbol)) {
            throw new UnknownSymbolException("Symbol '" + symbol + "' is unknown to " + name);
        }
        return alphabet.getSymbolIndex(symbol);
    }

    /**
     * Simulates the automaton on the given sequence.
     *
     * @return {@code true} if some run on the sequence ends in an accepting state
     *
     * @throws UnknownSymbolException
     *         if the sequence contains a symbol outside the alphabet
     */
    public boolean accepts(Word<? extends I> sequence) {
        BitSet current = new BitSet(size());
        current.set(initialState);

        for (I sym : sequence) {
            int idx = indexOf(sym);
            BitSet next = new BitSet(size());
            for (int s = current.nextSetBit(0); s >= 0; s = current.nextSetBit(s + 1)) {
                for (int t : successors[s][idx]) {
                    next.set(t);
                }
            }
            if (next.isEmpty()) {
                return false;
            }
            current = next;
        }

        for (int s = current.nextSetBit(0); s >= 0; s = current.nextSetBit(s + 1)) {
            if (accepting[s]) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the states from which no accepting state can be reached.
     */
    public List<Integer> getDeadStates() {
        boolean[] live = accepting.clone();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int s = 0; s < size(); s++) {
                if (live[s]) {
                    continue;
                }
                for (int[] targets : successors[s]) {
                    for (int t : targets) {
                        if (live[t]) {
                            live[s] = true;
                            changed = true;
                            break;
                        }
                    }
                    if (live[s]) {
                        break;
                    }
                }
            }
        }

        List<Integer> dead = new ArrayList<>();
        for (int s = 0; s < size(); s++) {
            if (!live[s]) {
                dead.add(s);
            }
        }
        return dead;
    }

    @Override
    public String toString() {
        return name;
    }
}
