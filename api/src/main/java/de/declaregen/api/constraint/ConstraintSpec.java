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
package de.declaregen.api.constraint;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import de.declaregen.exception.InvalidArgumentException;

/**
 * A constraint instantiation: a template, its ordered activity arguments, and an occurrence bound for the counting
 * templates. Instances are immutable and checked for well-formedness on creation; whether the arguments belong to an
 * alphabet is checked only when the constraint gets compiled.
 *
 * @param <I>
 *         symbol type
 */
public final class ConstraintSpec<I> {

    /**
     * The largest occurrence bound accepted for counting templates. A bound of {@code n} compiles into an automaton
     * with {@code n + 2} states.
     */
    public static final int MAX_BOUND = 10_000;

    private final ConstraintTemplate template;
    private final List<I> arguments;
    private final int bound;

    private ConstraintSpec(ConstraintTemplate template, List<I> arguments, int bound) {
        this.template = template;
        this.arguments = arguments;
        this.bound = bound;
    }

    /**
     * Creates a constraint. Counting templates use an occurrence bound of 1.
     */
    @SafeVarargs
    public static <I> ConstraintSpec<I> of(ConstraintTemplate template, I... arguments) {
        return of(template, Arrays.asList(arguments), 1);
    }

    public static <I> ConstraintSpec<I> of(String templateName, List<? extends I> arguments) {
        return of(ConstraintTemplate.forName(templateName), arguments, 1);
    }

    public static <I> ConstraintSpec<I> of(String templateName, List<? extends I> arguments, int bound) {
        return of(ConstraintTemplate.forName(templateName), arguments, bound);
    }

    public static <I> ConstraintSpec<I> of(ConstraintTemplate template, List<? extends I> arguments, int bound) {
        Objects.requireNonNull(template, "template");
        if (arguments == null || arguments.size() != template.getArity()) {
            throw new InvalidArgumentException(template + " expects " + template.getArity() + " argument(s), got " +
                                               (arguments == null ? 0 : arguments.size()));
        }
        for (I arg : arguments) {
            if (arg == null) {
                throw new InvalidArgumentException(template + " does not accept null arguments");
            }
        }
        if (template.getArity() == 2 && arguments.get(0).equals(arguments.get(1))) {
            throw new InvalidArgumentException(template + " needs two distinct activities, got " + arguments);
        }
        if (template.isCounting() && bound < 0) {
            throw new InvalidArgumentException(template + " needs a non-negative bound, got " + bound);
        }
        if (template.isCounting() && bound > MAX_BOUND) {
            throw new InvalidArgumentException(template + " bound " + bound + " exceeds the maximum of " + MAX_BOUND);
        }
        return new ConstraintSpec<>(template, List.copyOf(arguments), template.isCounting() ? bound : 1);
    }

    public static <I> ConstraintSpec<I> existence(I activity, int atLeast) {
        return of(ConstraintTemplate.EXISTENCE, Collections.singletonList(activity), atLeast);
    }

    public static <I> ConstraintSpec<I> exactly(I activity, int times) {
        return of(ConstraintTemplate.EXACTLY, Collections.singletonList(activity), times);
    }

    public ConstraintTemplate getTemplate() {
        return template;
    }

    public List<I> getArguments() {
        return arguments;
    }

    public I getArgument(int index) {
        return arguments.get(index);
    }

    /**
     * Returns the occurrence bound. Only meaningful for {@link ConstraintTemplate#isCounting() counting} templates.
     */
    public int getBound() {
        return bound;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstraintSpec<?> that = (ConstraintSpec<?>) o;
        return bound == that.bound && template == that.template && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(template, arguments, bound);
    }

    @Override
    public String toString() {
        String args = arguments.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return template.isCounting() ? template + "(" + args + ", " + bound + ")" : template + "(" + args + ")";
    }
}
