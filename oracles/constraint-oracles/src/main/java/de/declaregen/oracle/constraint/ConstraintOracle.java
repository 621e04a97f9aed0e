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
package de.declaregen.oracle.constraint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import de.declaregen.algorithm.constraint.ConstraintAutomaton;
import net.automatalib.words.Word;

/**
 * Answers whether sequences satisfy a set of constraints, by simulating each compiled constraint automaton
 * independently on the sequence.
 * <p>
 * The oracle holds no mutable state and is thread-safe.
 *
 * @param <I>
 *         symbol type
 */
public class ConstraintOracle<I> {

    private final List<ConstraintAutomaton<I>> automata;

    public ConstraintOracle(Collection<? extends ConstraintAutomaton<I>> automata) {
        this.automata = List.copyOf(automata);
    }

    public List<ConstraintAutomaton<I>> getAutomata() {
        return automata;
    }

    /**
     * Returns {@code true} if every constraint accepts the sequence.
     */
    public boolean answerQuery(Word<I> sequence) {
        for (ConstraintAutomaton<I> automaton : automata) {
            if (!automaton.accepts(sequence)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the constraints that reject the sequence, in the order the oracle was given them.
     */
    public List<ConstraintAutomaton<I>> violatedBy(Word<I> sequence) {
        List<ConstraintAutomaton<I>> violated = new ArrayList<>();
        for (ConstraintAutomaton<I> automaton : automata) {
            if (!automaton.accepts(sequence)) {
                violated.add(automaton);
            }
        }
        return violated;
    }

    /**
     * Returns, per constraint, the fraction of the given sequences it accepts.
     */
    public double[] satisfactionRates(Collection<? extends Word<I>> sequences) {
        double[] rates = new double[automata.size()];
        if (sequences.isEmpty()) {
            return rates;
        }
        for (Word<I> seq : sequences) {
            for (int i = 0; i < automata.size(); i++) {
                if (automata.get(i).accepts(seq)) {
                    rates[i]++;
                }
            }
        }
        for (int i = 0; i < rates.length; i++) {
            rates[i] /= sequences.size();
        }
        return rates;
    }
}
