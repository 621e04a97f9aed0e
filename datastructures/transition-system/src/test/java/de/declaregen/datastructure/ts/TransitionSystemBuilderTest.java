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

import java.util.List;

import de.declaregen.datastructure.corpus.Corpus;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class TransitionSystemBuilderTest {

    private static final Corpus<String> CORPUS =
            Corpus.fromLists(List.of(List.of("A", "B", "C"), List.of("A", "C", "B")));

    @Test
    public void testFirstOrder() {
        TransitionSystem<String> ts = TransitionSystemBuilder.build(CORPUS, 1);

        Assert.assertEquals(ts.size(), 4);
        Assert.assertEquals(ts.getContext(TransitionSystem.START), Word.epsilon());
        Assert.assertEquals(ts.getContext(1), Word.fromSymbols("A"));
        Assert.assertEquals(ts.getContext(2), Word.fromSymbols("B"));
        Assert.assertEquals(ts.getContext(3), Word.fromSymbols("C"));

        Assert.assertEquals(ts.getOutDegree(TransitionSystem.START), 1);
        Assert.assertEquals(ts.getEdgeSymbol(TransitionSystem.START, 0), "A");
        Assert.assertEquals(ts.getEdgeWeight(TransitionSystem.START, 0), 2);

        Assert.assertEquals(ts.getOutDegree(1), 2);
        Assert.assertEquals(ts.getEdgeSymbol(1, 0), "B");
        Assert.assertEquals(ts.getEdgeWeight(1, 0), 1);
        Assert.assertEquals(ts.getEdgeSymbol(1, 1), "C");
        Assert.assertEquals(ts.getEdgeWeight(1, 1), 1);

        Assert.assertEquals(ts.getSuccessor(2, "C"), 3);
        Assert.assertEquals(ts.getSuccessor(3, "B"), 2);
        Assert.assertEquals(ts.getSuccessor(2, "A"), TransitionSystem.END);

        Assert.assertEquals(ts.getEndWeight(TransitionSystem.START), 0);
        Assert.assertEquals(ts.getEndWeight(1), 0);
        Assert.assertEquals(ts.getEndWeight(2), 1);
        Assert.assertEquals(ts.getEndWeight(3), 1);
        Assert.assertEquals(ts.getEdgeCount(), 5);
    }

    @Test
    public void testWeightsAreConserved() {
        Corpus<String> corpus = Corpus.fromLists(List.of(List.of("A", "B", "A", "C"),
                                                         List.of("B", "B"),
                                                         List.of("A", "C", "A")));
        for (int order = 1; order <= 3; order++) {
            TransitionSystem<String> ts = TransitionSystemBuilder.build(corpus, order);

            // every occurrence of a context is either continued or ends its sequence
            long[] incoming = new long[ts.size()];
            incoming[TransitionSystem.START] = corpus.size();
            for (int n = 0; n < ts.size(); n++) {
                for (int e = 0; e < ts.getOutDegree(n); e++) {
                    incoming[ts.getEdgeTarget(n, e)] += ts.getEdgeWeight(n, e);
                }
            }
            long ends = 0;
            for (int n = 0; n < ts.size(); n++) {
                ends += ts.getEndWeight(n);
                Assert.assertEquals(ts.getOutgoingWeight(n) + ts.getEndWeight(n), incoming[n]);
            }
            Assert.assertEquals(ends, corpus.size());
        }
    }

    @Test
    public void testPaddedContexts() {
        TransitionSystem<String> ts = TransitionSystemBuilder.build(CORPUS, 3);

        Assert.assertEquals(ts.size(), 6);
        Assert.assertNotEquals(ts.getNode(Word.fromSymbols("A", "B")), TransitionSystem.END);
        Assert.assertNotEquals(ts.getNode(Word.fromSymbols("A", "C", "B")), TransitionSystem.END);
        Assert.assertEquals(ts.getNode(Word.fromSymbols("B", "C")), TransitionSystem.END);
        Assert.assertEquals(ts.getEndWeight(ts.getNode(Word.fromSymbols("A", "B", "C"))), 1);
        Assert.assertEquals(ts.getOutDegree(ts.getNode(Word.fromSymbols("A", "B", "C"))), 0);
    }

    @Test
    public void testDeterministicNumbering() {
        TransitionSystem<String> ts1 = TransitionSystemBuilder.build(CORPUS, 2);
        TransitionSystem<String> ts2 = TransitionSystemBuilder.build(CORPUS, 2);

        Assert.assertEquals(ts1.size(), ts2.size());
        for (int n = 0; n < ts1.size(); n++) {
            Assert.assertEquals(ts1.getContext(n), ts2.getContext(n));
            Assert.assertEquals(ts1.getOutDegree(n), ts2.getOutDegree(n));
            for (int e = 0; e < ts1.getOutDegree(n); e++) {
                Assert.assertEquals(ts1.getEdgeTarget(n, e), ts2.getEdgeTarget(n, e));
                Assert.assertEquals(ts1.getEdgeWeight(n, e), ts2.getEdgeWeight(n, e));
            }
        }
    }
}
