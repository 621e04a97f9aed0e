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
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

import de.declaregen.algorithm.product.ProductGraph;
import de.declaregen.api.TraceSampler;
import de.declaregen.exception.InvalidArgumentException;
import de.declaregen.exception.SamplingExhaustedException;
import net.automatalib.words.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples sequences by weighted random walks over a pruned {@link ProductGraph}.
 * <p>
 * At every node the walk chooses a symbol proportionally to the weight of the transition system edge carrying it.
 * Edges that a non-deterministic automaton split into several product edges are counted once; one of their targets
 * is then picked uniformly. At an accepting node the end weight of the node's context competes with the symbols as
 * the option to stop. An accepting node without end weight and without outgoing edges stops the walk as well.
 * Reaching the maximum length stops the walk, which is kept only if the node is accepting.
 * <p>
 * A walk is never rewound. A rejected walk is discarded and a new one starts from the initial node, up to the
 * configured number of attempts.
 *
 * @param <I>
 *         symbol type
 */
public class ProductTraceSampler<I> implements TraceSampler<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProductTraceSampler.class);

    enum WalkState {
        WALKING,
        ACCEPTED,
        STUCK
    }

    private final ProductGraph<I> product;
    private final int maxLength;
    private final int maxAttempts;

    public ProductTraceSampler(ProductGraph<I> product, int maxLength, int maxAttempts) {
        if (maxLength < 0) {
            throw new InvalidArgumentException("Maximum length must not be negative, got " + maxLength);
        }
        if (maxAttempts < 1) {
            throw new InvalidArgumentException("Maximum attempts must be positive, got " + maxAttempts);
        }
        this.product = product;
        this.maxLength = maxLength;
        this.maxAttempts = maxAttempts;
    }

    public ProductGraph<I> getProduct() {
        return product;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * {@inheritDoc}
     *
     * @throws CancellationException
     *         if the calling thread has been interrupted between two attempts
     */
    @Override
    public Word<I> sample(Random random) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Sampling interrupted after " + (attempt - 1) + " attempt(s)");
            }
            List<I> trace = new ArrayList<>();
            if (walk(random, trace) == WalkState.ACCEPTED) {
                return Word.fromList(trace);
            }
            LOGGER.trace("Attempt {} got stuck after {} symbol(s)", attempt, trace.size());
        }
        throw new SamplingExhaustedException("No accepting walk of length <= " + maxLength + " found in " +
                                             maxAttempts + " attempt(s)");
    }

    WalkState walk(Random random, List<I> trace) {
        int node = product.getInitialNode();
        WalkState state = WalkState.WALKING;

        while (state == WalkState.WALKING) {
            boolean accepting = product.isAccepting(node);
            if (trace.size() == maxLength) {
                state = accepting ? WalkState.ACCEPTED : WalkState.STUCK;
                continue;
            }

            long endWeight = accepting ? product.getEndWeight(node) : 0;
            long total = endWeight + symbolWeight(node);
            if (total == 0) {
                state = accepting ? WalkState.ACCEPTED : WalkState.STUCK;
                continue;
            }

            double roll = random.nextDouble() * total;
            if (roll < endWeight) {
                state = WalkState.ACCEPTED;
                continue;
            }
            roll -= endWeight;

            int edge = pickEdge(node, roll, random);
            trace.add(product.getEdgeSymbol(node, edge));
            node = product.getEdgeTarget(node, edge);
        }
        return state;
    }

    // edges are sorted by symbol, all edges of one symbol carry the same weight
    private long symbolWeight(int node) {
        long sum = 0;
        int prev = -1;
        for (int e = 0; e < product.getOutDegree(node); e++) {
            int sym = product.getEdgeSymbolIndex(node, e);
            if (sym != prev) {
                sum += product.getEdgeWeight(node, e);
                prev = sym;
            }
        }
        return sum;
    }

    private int pickEdge(int node, double roll, Random random) {
        int degree = product.getOutDegree(node);
        int e = 0;
        while (e < degree) {
            int sym = product.getEdgeSymbolIndex(node, e);
            int end = e + 1;
            while (end < degree && product.getEdgeSymbolIndex(node, end) == sym) {
                end++;
            }
            long weight = product.getEdgeWeight(node, e);
            if (roll < weight || end == degree) {
                return e + random.nextInt(end - e);
            }
            roll -= weight;
            e = end;
        }
        throw new IllegalStateException("Node " + node + " has no outgoing edges");
    }
}
