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

import com.github.misberner.buildergen.annotations.GenerateBuilder;
import de.declaregen.algorithm.product.ProductBuilder;
import de.declaregen.exception.InvalidArgumentException;
import de.declaregen.setting.DeclareGenProperty;
import de.declaregen.setting.DeclareGenSettings;

/**
 * Tuning parameters of a generation run. Instances are usually obtained from the generated
 * {@link GenerationConfigBuilder}, whose unset values default to {@link DeclareGenSettings}, and to built-in defaults
 * where no setting is present.
 */
public final class GenerationConfig {

    public static final int DEFAULT_ORDER = 1;
    public static final int DEFAULT_MAX_LENGTH = 200;
    public static final int DEFAULT_MAX_ATTEMPTS = 1000;
    public static final long DEFAULT_SEED = 42L;

    private final int order;
    private final int maxLength;
    private final int maxAttempts;
    private final int maxProductStates;
    private final int parallelism;
    private final long seed;

    /**
     * Constructor.
     *
     * @param order
     *         the order k of the transition model, at least 1
     * @param maxLength
     *         the maximum length of a generated sequence, not negative
     * @param maxAttempts
     *         the number of random walks tried per sequence, at least 1
     * @param maxProductStates
     *         the number of product nodes after which exploration gives up, at least 1
     * @param parallelism
     *         the number of sampling threads, at least 1
     * @param seed
     *         the base seed from which every sequence derives its own random source
     *
     * @throws InvalidArgumentException
     *         if a value is out of range
     */
    @GenerateBuilder(defaults = BuilderDefaults.class)
    public GenerationConfig(int order,
                            int maxLength,
                            int maxAttempts,
                            int maxProductStates,
                            int parallelism,
                            long seed) {
        check(order >= 1, "order", order);
        check(maxLength >= 0, "maxLength", maxLength);
        check(maxAttempts >= 1, "maxAttempts", maxAttempts);
        check(maxProductStates >= 1, "maxProductStates", maxProductStates);
        check(parallelism >= 1, "parallelism", parallelism);
        this.order = order;
        this.maxLength = maxLength;
        this.maxAttempts = maxAttempts;
        this.maxProductStates = maxProductStates;
        this.parallelism = parallelism;
        this.seed = seed;
    }

    private static void check(boolean valid, String name, long value) {
        if (!valid) {
            throw new InvalidArgumentException("Invalid value for " + name + ": " + value);
        }
    }

    public static GenerationConfigBuilder builder() {
        return new GenerationConfigBuilder();
    }

    public static GenerationConfig defaults() {
        return builder().create();
    }

    /**
     * Returns the order k of the transition model.
     */
    public int getOrder() {
        return order;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public int getMaxProductStates() {
        return maxProductStates;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return "GenerationConfig[order=" + order + ", maxLength=" + maxLength + ", maxAttempts=" + maxAttempts +
               ", maxProductStates=" + maxProductStates + ", parallelism=" + parallelism + ", seed=" + seed + ']';
    }

    /**
     * Default values of a {@link GenerationConfigBuilder}. They are looked up whenever a builder gets created.
     */
    public static final class BuilderDefaults {

        private BuilderDefaults() {
            // prevent instantiation
        }

        public static int order() {
            return DeclareGenSettings.getInstance().getInt(DeclareGenProperty.ORDER, DEFAULT_ORDER);
        }

        public static int maxLength() {
            return DeclareGenSettings.getInstance().getInt(DeclareGenProperty.MAX_LENGTH, DEFAULT_MAX_LENGTH);
        }

        public static int maxAttempts() {
            return DeclareGenSettings.getInstance().getInt(DeclareGenProperty.MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS);
        }

        public static int maxProductStates() {
            return DeclareGenSettings.getInstance()
                                     .getInt(DeclareGenProperty.MAX_PRODUCT_STATES, ProductBuilder.DEFAULT_STATE_LIMIT);
        }

        public static int parallelism() {
            int processors = Runtime.getRuntime().availableProcessors();
            return DeclareGenSettings.getInstance().getInt(DeclareGenProperty.PARALLELISM, processors);
        }

        public static long seed() {
            return DeclareGenSettings.getInstance().getLong(DeclareGenProperty.SEED, DEFAULT_SEED);
        }
    }
}
