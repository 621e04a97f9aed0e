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
package de.declaregen.exception;

/**
 * Thrown when a sampler did not find an accepting walk of bounded length within its attempt budget.
 */
public class SamplingExhaustedException extends DeclareGenException {

    public SamplingExhaustedException(String message) {
        super(message);
    }

    public SamplingExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }

}
