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
package de.declaregen.api;

import java.util.Random;

import de.declaregen.exception.SamplingExhaustedException;
import net.automatalib.words.Word;

/**
 * Produces one synthetic sequence per invocation.
 * <p>
 * Implementations hold only read-only model data, so a single sampler may be shared by any number of threads as long
 * as every thread passes its own source of randomness.
 *
 * @param <I>
 *         symbol type
 */
@FunctionalInterface
public interface TraceSampler<I> {

    /**
     * Samples a sequence.
     *
     * @param random
     *         the source of randomness used for this sequence only
     *
     * @return the sampled sequence
     *
     * @throws SamplingExhaustedException
     *         if the sampler gave up after its attempt budget
     */
    Word<I> sample(Random random);
}
