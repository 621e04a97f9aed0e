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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import de.declaregen.algorithm.constraint.ConstraintAutomaton;
import de.declaregen.algorithm.constraint.ConstraintCompiler;
import de.declaregen.algorithm.product.ProductBuilder;
import de.declaregen.algorithm.product.ProductGraph;
import de.declaregen.api.TraceSampler;
import de.declaregen.datastructure.corpus.CorpusModel;
import de.declaregen.datastructure.ts.TransitionSystem;
import de.declaregen.datastructure.ts.TransitionSystemBuilder;
import de.declaregen.exception.DeclareGenException;
import de.declaregen.exception.InvalidArgumentException;
import de.declaregen.oracle.constraint.ConstraintOracle;
import net.automatalib.words.Word;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates batches of constraint-satisfying sequences from a shared, read-only {@link ProductGraph}.
 * <p>
 * Each sequence of a batch is an independent job on a fixed-size worker pool with its own {@link Random} derived from
 * the batch seed and the sequence index, so results do not depend on the degree of parallelism. A job that fails
 * (typically with a {@link de.declaregen.exception.SamplingExhaustedException}) is recorded in the
 * {@link GenerationResult} and does not affect the other jobs.
 *
 * @param <I>
 *         symbol type
 */
public class TraceGenerator<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TraceGenerator.class);

    private static final long SEED_SPREAD = 0x9E3779B97F4A7C15L;

    private final TraceSampler<I> sampler;
    private final ConstraintOracle<I> oracle;
    private final GenerationConfig config;

    public TraceGenerator(ProductGraph<I> product, GenerationConfig config) {
        this.sampler = new ProductTraceSampler<>(product, config.getMaxLength(), config.getMaxAttempts());
        this.oracle = new ConstraintOracle<>(product.getAutomata());
        this.config = config;
    }

    /**
     * Runs the construction chain of a request once: corpus model, transition system, constraint automata and
     * product. Construction errors are thrown immediately.
     */
    public static <I> TraceGenerator<I> forRequest(GenerationRequest<I> request, GenerationConfig config) {
        CorpusModel<I> model = CorpusModel.of(request.getCorpus(), config.getOrder());
        TransitionSystem<I> ts = TransitionSystemBuilder.build(model);
        List<ConstraintAutomaton<I>> automata =
                new ConstraintCompiler<>(model.getAlphabet()).compileAll(request.getConstraints());
        ProductGraph<I> product = new ProductBuilder<>(ts, automata, config.getMaxProductStates()).build();
        LOGGER.info("Prepared {} for {}", product, request);
        return new TraceGenerator<>(product, config);
    }

    /**
     * Builds the generator for a request and generates the requested number of sequences with the configured seed.
     */
    public static <I> GenerationResult<I> run(GenerationRequest<I> request, GenerationConfig config) {
        return forRequest(request, config).generate(request.getCount());
    }

    public GenerationConfig getConfig() {
        return config;
    }

    /**
     * Samples one sequence and checks it against every constraint.
     */
    public Word<I> generateOne(Random random) {
        Word<I> trace = sampler.sample(random);
        if (!oracle.answerQuery(trace)) {
            throw new IllegalStateException("Sampled " + trace + " violates " + oracle.violatedBy(trace));
        }
        return trace;
    }

    public GenerationResult<I> generate(int count) {
        return generate(count, config.getSeed());
    }

    /**
     * Generates {@code count} sequences.
     *
     * @throws CancellationException
     *         if the calling thread is interrupted while waiting for the workers
     */
    public GenerationResult<I> generate(int count, long seed) {
        if (count < 0) {
            throw new InvalidArgumentException("Cannot generate a negative number of sequences: " + count);
        }

        List<@Nullable Word<I>> slots = new ArrayList<>(Collections.nCopies(count, null));
        SortedMap<Integer, RuntimeException> failures = new TreeMap<>();
        if (count == 0) {
            return new GenerationResult<>(slots, failures);
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.getParallelism(), count));
        try {
            List<Future<Word<I>>> futures = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                final Random random = new Random(seed ^ (i * SEED_SPREAD));
                futures.add(pool.submit(() -> generateOne(random)));
            }

            for (int i = 0; i < count; i++) {
                try {
                    slots.set(i, futures.get(i).get());
                } catch (ExecutionException ex) {
                    RuntimeException failure = unwrap(ex);
                    LOGGER.warn("Sequence {} of {} failed: {}", i, count, failure.getMessage());
                    failures.put(i, failure);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Generation interrupted");
        } finally {
            pool.shutdownNow();
        }

        LOGGER.debug("Generated {} of {} sequence(s)", count - failures.size(), count);
        return new GenerationResult<>(slots, failures);
    }

    private static RuntimeException unwrap(ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new DeclareGenException(cause);
    }
}
