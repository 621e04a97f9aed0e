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
import java.util.List;
import java.util.Objects;

import de.declaregen.api.constraint.ConstraintSpec;
import de.declaregen.api.constraint.ConstraintTemplate;
import de.declaregen.exception.InvalidArgumentException;
import net.automatalib.automata.fsa.impl.compact.CompactNFA;
import net.automatalib.words.Alphabet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles {@link ConstraintSpec constraints} into {@link ConstraintAutomaton automata} over a fixed alphabet.
 * <p>
 * Every template is described by a small transition table whose columns are the symbol classes "first argument",
 * "second argument" and "any other symbol". The table is expanded over the whole alphabet, so the resulting automaton
 * is total and its size does not depend on the alphabet. State 0 is always the initial state.
 *
 * @param <I>
 *         symbol type
 */
public class ConstraintCompiler<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintCompiler.class);

    private static final int A = 0;
    private static final int B = 1;
    private static final int OTHER = 2;

    private final Alphabet<I> alphabet;

    public ConstraintCompiler(Alphabet<I> alphabet) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
    }

    public Alphabet<I> getAlphabet() {
        return alphabet;
    }

    public ConstraintAutomaton<I> compile(String templateName, List<? extends I> arguments) {
        return compile(ConstraintSpec.of(templateName, arguments));
    }

    public ConstraintAutomaton<I> compile(String templateName, List<? extends I> arguments, int bound) {
        return compile(ConstraintSpec.of(templateName, arguments, bound));
    }

    public List<ConstraintAutomaton<I>> compileAll(List<ConstraintSpec<I>> specs) {
        List<ConstraintAutomaton<I>> result = new ArrayList<>(specs.size());
        for (ConstraintSpec<I> spec : specs) {
            result.add(compile(spec));
        }
        return result;
    }

    /**
     * Compiles a single constraint.
     *
     * @throws InvalidArgumentException
     *         if an argument of the constraint is not part of the alphabet
     */
    public ConstraintAutomaton<I> compile(ConstraintSpec<I> spec) {
        for (I arg : spec.getArguments()) {
            if (!alphabet.containsSymbol(arg)) {
                throw new InvalidArgumentException(spec + ": '" + arg + "' is not part of the alphabet " + alphabet);
            }
        }

        final Table table = tableFor(spec.getTemplate(), spec.getBound());
        final I a = spec.getArgument(0);
        final I b = spec.getTemplate().getArity() > 1 ? spec.getArgument(1) : null;

        CompactNFA<I> nfa = new CompactNFA<>(alphabet);
        nfa.addInitialState(table.accepting[0]);
        for (int s = 1; s < table.size(); s++) {
            nfa.addState(table.accepting[s]);
        }
        for (int s = 0; s < table.size(); s++) {
            for (I sym : alphabet) {
                nfa.addTransition(s, sym, table.delta[s][classOf(sym, a, b)]);
            }
        }

        ConstraintAutomaton<I> automaton = ConstraintAutomaton.of(spec, nfa);
        LOGGER.debug("Compiled {} into {} state(s)", spec, automaton.size());
        return automaton;
    }

    private int classOf(I sym, I a, @Nullable I b) {
        if (sym.equals(a)) {
            return A;
        }
        return sym.equals(b) ? B : OTHER;
    }

    // rows: states; columns: A, B, OTHER. A sink state loops on every class.
    private static Table tableFor(ConstraintTemplate template, int n) {
        switch (template) {
            case EXISTENCE:
                return counting(n, false);
            case EXACTLY:
                return counting(n, true);
            case ABSENCE:
                return new Table(new int[][] {{1, 0, 0}, {1, 1, 1}}, true, false);
            case INIT:
                return new Table(new int[][] {{1, 2, 2}, {1, 1, 1}, {2, 2, 2}}, false, true, false);
            case LAST:
                return new Table(new int[][] {{1, 0, 0}, {1, 0, 0}}, false, true);
            case PRECEDENCE:
                return new Table(new int[][] {{1, 2, 0}, {1, 1, 1}, {2, 2, 2}}, true, true, false);
            case RESPONSE:
                return new Table(new int[][] {{1, 0, 0}, {1, 0, 1}}, true, false);
            case RESPONDED_EXISTENCE:
                return new Table(new int[][] {{1, 2, 0}, {1, 2, 1}, {2, 2, 2}}, true, false, true);
            case SUCCESSION:
                return new Table(new int[][] {{1, 3, 0}, {1, 2, 1}, {1, 2, 2}, {3, 3, 3}}, true, false, true, false);
            case CHAIN_PRECEDENCE:
                return new Table(new int[][] {{1, 2, 0}, {1, 0, 0}, {2, 2, 2}}, true, true, false);
            case CHAIN_RESPONSE:
                return new Table(new int[][] {{1, 0, 0}, {2, 0, 2}, {2, 2, 2}}, true, false, false);
            case CHAIN_SUCCESSION:
                return new Table(new int[][] {{1, 2, 0}, {2, 0, 2}, {2, 2, 2}}, true, false, false);
            case ALTERNATE_PRECEDENCE:
                return new Table(new int[][] {{1, 2, 0}, {1, 0, 1}, {2, 2, 2}}, true, true, false);
            case ALTERNATE_RESPONSE:
                return new Table(new int[][] {{1, 0, 0}, {2, 0, 1}, {2, 2, 2}}, true, false, false);
            case COEXISTENCE:
                return new Table(new int[][] {{1, 2, 0}, {1, 3, 1}, {3, 2, 2}, {3, 3, 3}}, true, false, false, true);
            case CHOICE:
                return new Table(new int[][] {{1, 1, 0}, {1, 1, 1}}, false, true);
            case EXCLUSIVE_CHOICE:
                return new Table(new int[][] {{1, 2, 0}, {1, 3, 1}, {3, 2, 2}, {3, 3, 3}}, false, true, true, false);
            case NOT_COEXISTENCE:
                return new Table(new int[][] {{1, 2, 0}, {1, 3, 1}, {3, 2, 2}, {3, 3, 3}}, true, true, true, false);
            case NOT_SUCCESSION:
                return new Table(new int[][] {{1, 0, 0}, {1, 2, 1}, {2, 2, 2}}, true, true, false);
            case NOT_CHAIN_SUCCESSION:
                return new Table(new int[][] {{1, 0, 0}, {1, 2, 0}, {2, 2, 2}}, true, true, false);
            default:
                throw new IllegalStateException("No automaton for template " + template);
        }
    }

    /**
     * Counts occurrences of the first argument up to {@code n}. With {@code exact} an additional sink state is
     * entered on the (n+1)-th occurrence, otherwise the counter saturates.
     */
    private static Table counting(int n, boolean exact) {
        int size = exact ? n + 2 : n + 1;
        int[][] delta = new int[size][];
        boolean[] accepting = new boolean[size];
        for (int s = 0; s < size; s++) {
            int next = exact ? Math.min(s + 1, size - 1) : Math.min(s + 1, n);
            delta[s] = new int[] {next, s, s};
            accepting[s] = s == n;
        }
        return new Table(delta, accepting);
    }

    private static final class Table {

        private final int[][] delta;
        private final boolean[] accepting;

        Table(int[][] delta, boolean... accepting) {
            if (delta.length != accepting.length) {
                throw new IllegalArgumentException("Table has " + delta.length + " rows but " + accepting.length +
                                                   " acceptance flags");
            }
            this.delta = delta;
            this.accepting = accepting;
        }

        int size() {
            return delta.length;
        }
    }
}
