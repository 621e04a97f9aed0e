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
package de.declaregen.algorithm.product;

import java.util.Arrays;

/**
 * A composite state of a product graph: a transition system node together with one state per constraint automaton.
 */
public final class ProductState {

    private final int tsNode;
    private final int[] automatonStates;
    private final int hash;

    public ProductState(int tsNode, int... automatonStates) {
        this.tsNode = tsNode;
        this.automatonStates = automatonStates.clone();
        this.hash = 31 * tsNode + Arrays.hashCode(automatonStates);
    }

    public int getTransitionSystemNode() {
        return tsNode;
    }

    public int getAutomatonState(int automaton) {
        return automatonStates[automaton];
    }

    public int getAutomatonCount() {
        return automatonStates.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProductState that = (ProductState) o;
        return tsNode == that.tsNode && Arrays.equals(automatonStates, that.automatonStates);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append('(').append(tsNode);
        for (int i = 0; i < automatonStates.length; i++) {
            sb.append(i == 0 ? " | " : ", ").append(automatonStates[i]);
        }
        return sb.append(')').toString();
    }
}
