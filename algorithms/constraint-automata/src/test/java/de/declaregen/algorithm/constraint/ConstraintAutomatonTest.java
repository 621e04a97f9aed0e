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

import java.util.List;

import de.declaregen.exception.InvalidArgumentException;
import de.declaregen.exception.UnknownSymbolException;
import net.automatalib.automata.fsa.impl.compact.CompactNFA;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ConstraintAutomatonTest {

    private static final Character A = 'a';
    private static final Character B = 'b';
    private static final Alphabet<Character> ALPHABET = Alphabets.characters('a', 'b');

    /**
     * Accepts the sequences that end with {@code a}, guessing non-deterministically which {@code a} is the last one.
     */
    private static CompactNFA<Character> endsWithA() {
        CompactNFA<Character> nfa = new CompactNFA<>(ALPHABET);
        Integer q0 = nfa.addInitialState(false);
        Integer q1 = nfa.addState(true);
        nfa.addTransition(q0, A, q0);
        nfa.addTransition(q0, A, q1);
        nfa.addTransition(q0, B, q0);
        return nfa;
    }

    @Test
    public void testNondeterministicAutomaton() {
        ConstraintAutomaton<Character> automaton = ConstraintAutomaton.fromNFA("endsWithA", endsWithA());

        Assert.assertFalse(automaton.isDeterministic());
        Assert.assertNull(automaton.getSpec());
        Assert.assertEquals(automaton.getName(), "endsWithA");
        Assert.assertEquals(automaton.size(), 2);
        Assert.assertEquals(automaton.getSuccessorCount(0, ALPHABET.getSymbolIndex(A)), 2);
        Assert.assertEquals(automaton.getSuccessorCount(1, ALPHABET.getSymbolIndex(B)), 0);

        Assert.assertTrue(automaton.accepts(Word.fromString("bba")));
        Assert.assertTrue(automaton.accepts(Word.fromString("aba")));
        Assert.assertFalse(automaton.accepts(Word.fromString("ab")));
        Assert.assertFalse(automaton.accepts(Word.epsilon()));
        Assert.assertTrue(automaton.getDeadStates().isEmpty());
    }

    @Test
    public void testCopyIsDetached() {
        CompactNFA<Character> nfa = endsWithA();
        ConstraintAutomaton<Character> automaton = ConstraintAutomaton.fromNFA("endsWithA", nfa);
        Integer q1 = 1;
        nfa.addTransition(q1, B, q1);

        Assert.assertFalse(automaton.accepts(Word.fromString("ab")));
    }

    @Test
    public void testPartialAutomatonHasDeadStates() {
        CompactNFA<Character> nfa = new CompactNFA<>(ALPHABET);
        Integer q0 = nfa.addInitialState(true);
        Integer q1 = nfa.addState(false);
        nfa.addTransition(q0, A, q0);
        nfa.addTransition(q0, B, q1);
        nfa.addTransition(q1, A, q1);
        ConstraintAutomaton<Character> automaton = ConstraintAutomaton.fromNFA("noB", nfa);

        Assert.assertEquals(automaton.getDeadStates(), List.of(q1));
        Assert.assertFalse(automaton.accepts(Word.fromString("ab")));
        Assert.assertFalse(automaton.accepts(Word.fromString("bb")));
        Assert.assertTrue(automaton.accepts(Word.fromString("aa")));
    }

    @Test(expectedExceptions = InvalidArgumentException.class)
    public void testTwoInitialStates() {
        CompactNFA<Character> nfa = new CompactNFA<>(ALPHABET);
        nfa.addInitialState(true);
        nfa.addInitialState(false);
        ConstraintAutomaton.fromNFA("twoInits", nfa);
    }

    @Test(expectedExceptions = InvalidArgumentException.class)
    public void testNoInitialState() {
        CompactNFA<Character> nfa = new CompactNFA<>(ALPHABET);
        nfa.addState(true);
        ConstraintAutomaton.fromNFA("noInit", nfa);
    }

    @Test(expectedExceptions = UnknownSymbolException.class)
    public void testUnknownSymbol() {
        ConstraintAutomaton<Character> automaton = ConstraintAutomaton.fromNFA("endsWithA", endsWithA());
        automaton.accepts(Word.fromString("abc"));
    }
}
