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

import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class CorpusTest {

    @Test
    public void testFromLists() {
        Corpus<String> corpus = Corpus.fromLists(List.of(List.of("a", "b"), List.of(), List.of("c")));

        Assert.assertEquals(corpus.size(), 3);
        Assert.assertEquals(corpus.get(0), Word.fromSymbols("a", "b"));
        Assert.assertTrue(corpus.get(1).isEmpty());
        Assert.assertEquals(corpus.countSymbols(), 3);
    }

    @Test
    public void testFilter() {
        Corpus<String> corpus = Corpus.of(Word.fromSymbols("a", "b"), Word.fromSymbols("c"));
        Corpus<String> filtered = corpus.filter(w -> w.length() > 1);

        Assert.assertEquals(filtered.size(), 1);
        Assert.assertEquals(filtered.get(0), Word.fromSymbols("a", "b"));
        Assert.assertEquals(corpus.size(), 2);
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testImmutable() {
        Corpus.of(Word.fromSymbols("a")).getSequences().add(Word.fromSymbols("b"));
    }
}
