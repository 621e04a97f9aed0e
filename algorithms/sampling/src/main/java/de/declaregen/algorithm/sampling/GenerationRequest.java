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
import java.util.Objects;

import de.declaregen.api.constraint.ConstraintSpec;
import de.declaregen.datastructure.corpus.Corpus;
import de.declaregen.exception.InvalidArgumentException;

/**
 * What to generate: {@code count} sequences resembling {@code corpus} that each satisfy every constraint.
 *
 * @param <I>
 *         symbol type
 */
public final class GenerationRequest<I> {

    private final Corpus<I> corpus;
    private final List<ConstraintSpec<I>> constraints;
    private final int count;

    public GenerationRequest(Corpus<I> corpus, List<ConstraintSpec<I>> constraints, int count) {
        if (count < 0) {
            throw new InvalidArgumentException("Cannot generate a negative number of sequences: " + count);
        }
        this.corpus = Objects.requireNonNull(corpus, "corpus");
        this.constraints = List.copyOf(constraints);
        this.count = count;
    }

    public Corpus<I> getCorpus() {
        return corpus;
    }

    public List<ConstraintSpec<I>> getConstraints() {
        return constraints;
    }

    public int getCount() {
        return count;
    }

    @Override
    public String toString() {
        return "GenerationRequest[sequences=" + corpus.size() + ", constraints=" + constraints + ", count=" +
               count + ']';
    }
}
