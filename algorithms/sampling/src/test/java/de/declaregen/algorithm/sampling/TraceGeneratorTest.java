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
package de.declaregen.algorithm.sampling;

import java.util.List;
import java.util.Map.Entry;

import de.declaregen.algorithm.constraint.ConstraintCompiler;
import de.declaregen.api.constraint.ConstraintSpec;
import de.declaregen.api.constraint.ConstraintTemplate;
import de.declaregen.datastructure.corpus.Corpus;
import de.declaregen.datastructure.corpus.CorpusModel;
import de.declaregen.exception.InvalidArgumentException;
import de.declaregen.exception.LimitException;
import de.declaregen.exception.SamplingExhaustedException;
import de.declaregen.exception.UnsatisfiableConstraintSetException;
import de.declaregen.oracle.constraint.ConstraintOracle;
import net.automatalib.words.Word;
import org.testng.Assert;
import org.testng.annotations.Test;

public class TraceGeneratorTest {

    private static final Corpus<String> CORPUS = Corpus.fromLists(List.of(List.of("register", "check", "pay", "ship"),
                                                                          List.of("register", "pay", "check", "ship"),
                                                                          List.of("register", "check", "reject"),
                                                                          List.of("register", "pay", "refund")));

    private static final List<ConstraintSpec<String>> CONSTRAINTS =
            List.of(ConstraintSpec.of(ConstraintTemplate.PRECEDENCE, "check", "ship"),
                    ConstraintSpec.of(ConstraintTemplate.NOT_COEXISTENCE, "ship", "refund"),
                    ConstraintSpec.existence("pay", 1));

    private static GenerationConfig config(int parallelism) {
        return GenerationConfig.builder()
                               .withOrder(2)
                               .withMaxLength(30)
                               .withMaxAttempts(100)
                               .withParallelism(parallelism)
                               .withSeed(1234)
                               .create();
    }

    @Test
    public void testAllTracesSatisfyConstraints() {
        GenerationRequest<String> request = new GenerationRequest<>(CORPUS, CONSTRAINTS, 200);
        GenerationResult<String> result = TraceGenerator.run(request, config(4));

        Assert.assertTrue(result.isComplete(), result.getFailures().toString());
        Assert.assertEquals(result.getRequested(), 200);

        ConstraintOracle<String> oracle = new ConstraintOracle<>(
                new ConstraintCompiler<String>(CorpusModel.of(CORPUS, 2).getAlphabet()).compileAll(CONSTRAINTS));
        for (Word<String> trace : result.getTracesOrThrow()) {
            Assert.assertTrue(oracle.answerQuery(trace), trace.toString());
            Assert.assertEquals(trace.firstSymbol(), "register");
            Assert.assertTrue(trace.length() <= 30);
        }
        Assert.assertEquals(result.toCorpus().size(), 200);
    }

    @Test
    public void testResultIndependentOfParallelism() {
        GenerationRequest<String> request = new GenerationRequest<>(CORPUS, CONSTRAINTS, 64);

        GenerationResult<String> sequential = TraceGenerator.run(request, config(1));
        GenerationResult<String> parallel = TraceGenerator.run(request, config(8));

        Assert.assertEquals(parallel.getTraces(), sequential.getTraces());
    }

    @Test
    public void testSeedChangesResult() {
        TraceGenerator<String> generator =
                TraceGenerator.forRequest(new GenerationRequest<>(CORPUS, CONSTRAINTS, 0), config(2));

        Assert.assertEquals(generator.generate(32, 1).getTraces(), generator.generate(32, 1).getTraces());
        Assert.assertNotEquals(generator.generate(32, 1).getTraces(), generator.generate(32, 2).getTraces());
    }

    @Test
    public void testNothingRequested() {
        GenerationRequest<String> request = new GenerationRequest<>(CORPUS, CONSTRAINTS, 0);
        GenerationResult<String> result = TraceGenerator.run(request, config(2));

        Assert.assertEquals(result.getRequested(), 0);
        Assert.assertTrue(result.getTraces().isEmpty());
        Assert.assertTrue(result.isComplete());
    }

    @Test
    public void testFailuresAreIsolated() {
        Corpus<String> corpus = Corpus.fromLists(List.of(List.of("B"), List.of("A", "A", "A", "A", "A", "B")));
        GenerationRequest<String> request =
                new GenerationRequest<>(corpus, List.of(ConstraintSpec.of(ConstraintTemplate.LAST, "B")), 40);
        GenerationConfig config = GenerationConfig.builder()
                                                  .withMaxLength(3)
                                                  .withMaxAttempts(1)
                                                  .withParallelism(4)
                                                  .withSeed(99)
                                                  .create();

        GenerationResult<String> result = TraceGenerator.run(request, config);

        Assert.assertFalse(result.isComplete());
        Assert.assertFalse(result.getTraces().isEmpty());
        Assert.assertEquals(result.getTraces().size() + result.getFailures().size(), 40);
        for (Entry<Integer, RuntimeException> failure : result.getFailures().entrySet()) {
            Assert.assertNull(result.get(failure.getKey()));
            Assert.assertTrue(failure.getValue() instanceof SamplingExhaustedException);
        }
        for (Word<String> trace : result.getTraces()) {
            Assert.assertEquals(trace.lastSymbol(), "B");
        }
    }

    @Test(expectedExceptions = SamplingExhaustedException.class)
    public void testFirstFailureIsRethrown() {
        Corpus<String> corpus = Corpus.fromLists(List.of(List.of("A", "A", "A", "B")));
        GenerationRequest<String> request =
                new GenerationRequest<>(corpus, List.of(ConstraintSpec.existence("A", 5)), 3);
        GenerationConfig config = GenerationConfig.builder().withMaxLength(3).withMaxAttempts(2).create();

        TraceGenerator.run(request, config).getTracesOrThrow();
    }

    @Test(expectedExceptions = UnsatisfiableConstraintSetException.class)
    public void testUnsatisfiableRequest() {
        GenerationRequest<String> request =
                new GenerationRequest<>(CORPUS, List.of(ConstraintSpec.of(ConstraintTemplate.INIT, "pay")), 5);
        TraceGenerator.forRequest(request, config(1));
    }

    @Test(expectedExceptions = LimitException.class)
    public void testProductStateLimit() {
        GenerationRequest<String> request = new GenerationRequest<>(CORPUS, CONSTRAINTS, 5);
        TraceGenerator.forRequest(request, GenerationConfig.builder().withMaxProductStates(3).create());
    }

    @Test(expectedExceptions = InvalidArgumentException.class)
    public void testNegativeCount() {
        TraceGenerator.forRequest(new GenerationRequest<>(CORPUS, CONSTRAINTS, 0), config(1)).generate(-1);
    }

    @Test(expectedExceptions = InvalidArgumentException.class)
    public void testNegativeRequest() {
        new GenerationRequest<>(CORPUS, CONSTRAINTS, -1);
    }
}
