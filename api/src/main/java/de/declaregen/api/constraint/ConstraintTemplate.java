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

import java.util.Locale;

import de.declaregen.exception.UnsupportedTemplateException;

/**
 * The catalog of declarative constraint templates. Each template is parameterized by one or two activities and,
 * for the counting templates, a non-negative occurrence bound.
 */
public enum ConstraintTemplate {

    // unary
    EXISTENCE("Existence", 1, true),
    EXACTLY("Exactly", 1, true),
    ABSENCE("Absence", 1, false),
    INIT("Init", 1, false),
    LAST("Last", 1, false),

    // binary
    PRECEDENCE("Precedence", 2, false),
    RESPONSE("Response", 2, false),
    RESPONDED_EXISTENCE("RespondedExistence", 2, false),
    SUCCESSION("Succession", 2, false),
    CHAIN_PRECEDENCE("ChainPrecedence", 2, false),
    CHAIN_RESPONSE("ChainResponse", 2, false),
    CHAIN_SUCCESSION("ChainSuccession", 2, false),
    ALTERNATE_PRECEDENCE("AlternatePrecedence", 2, false),
    ALTERNATE_RESPONSE("AlternateResponse", 2, false),
    COEXISTENCE("Coexistence", 2, false),
    CHOICE("Choice", 2, false),
    EXCLUSIVE_CHOICE("ExclusiveChoice", 2, false),
    NOT_COEXISTENCE("NotCoexistence", 2, false),
    NOT_SUCCESSION("NotSuccession", 2, false),
    NOT_CHAIN_SUCCESSION("NotChainSuccession", 2, false);

    private final String displayName;
    private final int arity;
    private final boolean counting;

    ConstraintTemplate(String displayName, int arity, boolean counting) {
        this.displayName = displayName;
        this.arity = arity;
        this.counting = counting;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns the number of activity arguments the template takes.
     */
    public int getArity() {
        return arity;
    }

    /**
     * Returns whether the template takes an occurrence bound in addition to its activity.
     */
    public boolean isCounting() {
        return counting;
    }

    /**
     * Looks up a template by name. Case, blanks, dashes and underscores are ignored, so {@code "ChainResponse"},
     * {@code "chain_response"} and {@code "chain response"} all denote {@link #CHAIN_RESPONSE}.
     *
     * @throws UnsupportedTemplateException
     *         if no template has the given name
     */
    public static ConstraintTemplate forName(String name) {
        if (name != null) {
            String key = normalize(name);
            for (ConstraintTemplate t : values()) {
                if (normalize(t.displayName).equals(key)) {
                    return t;
                }
            }
        }
        throw new UnsupportedTemplateException("Unknown constraint template '" + name + "'");
    }

    private static String normalize(String name) {
        return name.replaceAll("[\\s_\\-]", "").toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
