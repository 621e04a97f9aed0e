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
 * Thrown at product-build time when no sequence of the transition model satisfies all constraints at once, i.e. the
 * start node of the product has been pruned.
 */
public class UnsatisfiableConstraintSetException extends DeclareGenException {

    public UnsatisfiableConstraintSetException(String message) {
        super(message);
    }

    public UnsatisfiableConstraintSetException(String message, Throwable cause) {
        super(message, cause);
    }

}
