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
package de.declaregen.algorithm.conformance;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import de.declaregen.datastructure.corpus.Corpus;
import net.automatalib.commons.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a {@link ConformanceMetric} for many independent scenarios, e.g. one (generated, held-out) pair per case
 * study and constraint set. Scenarios are evaluated in parallel; the corpora are only read.
 *
 * @param <I>
 *         symbol type
 */
public class ConformanceEvaluator<I> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConformanceEvaluator.class);

    private final ConformanceMetric<I> metric;

    public ConformanceEvaluator(ConformanceMetric<I> metric) {
        this.metric = metric;
    }

    public double evaluate(Corpus<I> generated, Corpus<I> reference) {
        return metric.distance(generated, reference);
    }

    /**
     * Evaluates every scenario. The first failing scenario's exception is propagated.
     *
     * @param scenarios
     *         (generated, reference) pairs keyed by scenario name
     *
     * @return the distance per scenario, in the iteration order of {@code scenarios}
     */
    public Map<String, Double> evaluateAll(Map<String, Pair<Corpus<I>, Corpus<I>>> scenarios) {
        List<Map.Entry<String, Pair<Corpus<I>, Corpus<I>>>> entries = List.copyOf(scenarios.entrySet());
        List<Double> distances = entries.stream()
                                        .parallel()
                                        .map(e -> evaluate(e.getValue().getFirst(), e.getValue().getSecond()))
                                        .collect(Collectors.toList());

        Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            result.put(entries.get(i).getKey(), distances.get(i));
            LOGGER.debug("Scenario {}: distance {}", entries.get(i).getKey(), distances.get(i));
        }
        return result;
    }
}
