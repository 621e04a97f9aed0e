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
package de.declaregen.setting;

/**
 * Keys understood by {@link DeclareGenSettings}.
 */
public enum DeclareGenProperty {

    /** Order k of the transition model. */
    ORDER("order"),

    /** Maximum length of a generated sequence. */
    MAX_LENGTH("maxLength"),

    /** Number of walks a sampler tries per sequence before giving up. */
    MAX_ATTEMPTS("maxAttempts"),

    /** Upper bound on the number of explored product states. */
    MAX_PRODUCT_STATES("maxProductStates"),

    /** Number of worker threads used for batch generation and evaluation. */
    PARALLELISM("parallelism"),

    /** Base seed for batch generation. */
    SEED("seed");

    private final String key;

    DeclareGenProperty(String key) {
        this.key = "declaregen." + key;
    }

    public String getPropertyKey() {
        return key;
    }
}
