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

import java.util.List;

import de.declaregen.exception.EmptyCorpusException;
import de.declaregen.exception.InvalidArgumentException;
import de.declaregen.exception.UnknownSymbolException;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;
import org.testng.Assert;
import org.testng.annotations.Test;

public class CorpusModelTest {

    private static final Corpus<String> CORPUS =
            Corpus.fromLists(List.of(List.of("A", "B", "C"), List.of("A", "C", "B"), List.of("D")));

    @Test
    public void testAlphabetByFirstOccurrence() {
        CorpusModel<String> model = CorpusModel.of(CORPUS, 1);
        Alphabet<String> alphabet = model.getAlphabet();

        Assert.assertEquals(alphabet.size(), 4);
        Assert.assertEquals(alphabet.getSymbol(0), "A");
        Assert.assertEquals(alphabet.getSymbol(1), "B");
        Assert.assertEquals(alphabet.getSymbol(2), "C");
        Assert.assertEquals(alphabet.getSymbol(3), "D");
    }

    @Test
    public void testSharedAlphabet() {
        Corpus<String> other = Corpus.fromLists(List.of(List.of("E", "A")));
        Alphabet<String> alphabet = CorpusModel.alphabetOf(List.of(other, CORPUS));

        Assert.assertEquals(alphabet.size(), 5);
        Assert.assertEquals(alphabet.getSymbol(0), "E");
        Assert.assertEquals(alphabet.getSymbol(1), "A");
        Assert.assertEquals(alphabet.getSymbol(4), "D");
    }

    @Test
    public void testFirstOrderCounts() {
        CorpusModel<String> model = CorpusModel.of(CORPUS, 1);

        Assert.assertEquals(model.getSequenceCount(), 3);
        Assert.assertEquals(model.getUnigrams().get("A"), 2);
        Assert.assertEquals(model.getUnigrams().get("D"), 1);
        Assert.assertEquals(model.getUnigrams().getTotal(), 7);

        FrequencyTable<String> start = model.getSuccessorCounts(Word.epsilon());
        Assert.assertEquals(start.get("A"), 2);
        Assert.assertEquals(start.get("D"), 1);
        Assert.assertEquals(start.getTotal(), 3);

        FrequencyTable<String> afterA = model.getSuccessorCounts(Word.fromSymbols("A"));
        Assert.assertEquals(afterA.get("B"), 1);
        Assert.assertEquals(afterA.get("C"), 1);

        Assert.assertEquals(model.getEndCount(Word.fromSymbols("C")), 1);
        Assert.assertEquals(model.getEndCount(Word.fromSymbols("B")), 1);
        Assert.assertEquals(model.getEndCount(Word.fromSymbols("D")), 1);
        Assert.assertEquals(model.getEndCount(Word.fromSymbols("A")), 0);
        Assert.assertTrue(model.getSuccessorCounts(Word.fromSymbols("D")).isEmpty());
    }

    @Test
    public void testHigherOrderContexts() {
        CorpusModel<String> model = CorpusModel.of(CORPUS, 2);

        Assert.assertEquals(model.getSuccessorCounts(Word.fromSymbols("A")).getTotal(), 2);
        Assert.assertEquals(model.getSuccessorCounts(Word.fromSymbols("A", "B")).get("C"), 1);
        Assert.assertEquals(model.getSuccessorCounts(Word.fromSymbols("A", "C")).get("B"), 1);
        Assert.assertEquals(model.getEndCount(Word.fromSymbols("B", "C")), 1);
        Assert.assertEquals(model.getEndCount(Word.fromSymbols("D")), 1);
    }

    @Test
    public void testOrderLargerThanSequences() {
        CorpusModel<String> model = CorpusModel.of(CORPUS, 10);

        Assert.assertEquals(model.getEndCount(Word.fromSymbols("A", "B", "C")), 1);
        Assert.assertEquals(model.getSuccessorCounts(Word.fromSymbols("A", "B")).get("C"), 1);
    }

    @Test
    public void testContextOf() {
        Word<String> prefix = Word.fromSymbols("A", "B", "C");
        Assert.assertEquals(CorpusModel.contextOf(prefix, 2), Word.fromSymbols("B", "C"));
        Assert.assertEquals(CorpusModel.contextOf(prefix, 3), prefix);
        Assert.assertEquals(CorpusModel.contextOf(Word.<String>epsilon(), 2), Word.epsilon());
    }

    @Test(expectedExceptions = EmptyCorpusException.class)
    public void testEmptyCorpus() {
        CorpusModel.of(Corpus.<String>empty(), 1);
    }

    @Test(expectedExceptions = InvalidArgumentException.class)
    public void testInvalidOrder() {
        CorpusModel.of(CORPUS, 0);
    }

    @Test(expectedExceptions = UnknownSymbolException.class)
    public void testFixedAlphabet() {
        Alphabet<String> alphabet = Alphabets.fromCollection(List.of("A", "B", "C"));
        CorpusModel.of(CORPUS, 1, alphabet);
    }

    @Test(expectedExceptions = UnknownSymbolException.class)
    public void testRequireSymbol() {
        CorpusModel<String> model = CorpusModel.of(CORPUS, 1);
        Assert.assertEquals(model.requireSymbol("A"), "A");
        model.requireSymbol("Z");
    }
}
