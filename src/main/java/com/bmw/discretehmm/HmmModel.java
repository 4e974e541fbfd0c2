/**
 * Copyright (C) 2016, BMW AG
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.bmw.discretehmm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parameters of a discrete-output HMM with K hidden states and M observation symbols:
 * the initial state distribution pi, the K x K transition matrix A and the K x M emission
 * matrix B. States and symbols are identified by their zero-based index, labels are only used
 * for display.
 *
 * <p>Instances are immutable. All distributions are validated at construction; an invalid
 * distribution causes a {@link ModelValidationException} and is never renormalized.
 */
public final class HmmModel {

    private final List<String> stateLabels;
    private final List<String> symbolLabels;
    private final double[] initialProbabilities;
    private final double[][] transitionProbabilities;
    private final double[][] emissionProbabilities;

    /**
     * Creates a model with default labels S0..S(K-1) and O0..O(M-1).
     *
     * @throws ModelValidationException if dimensions do not match K and M or if any
     * distribution is invalid
     */
    public HmmModel(int numberOfStates, int numberOfSymbols, double[] initialProbabilities,
            double[][] transitionProbabilities, double[][] emissionProbabilities) {
        this(defaultLabels("S", "states", numberOfStates),
                defaultLabels("O", "symbols", numberOfSymbols),
                initialProbabilities, transitionProbabilities, emissionProbabilities);
    }

    /**
     * @param stateLabels distinct display labels, one per state
     * @param symbolLabels distinct display labels, one per observation symbol
     *
     * @throws ModelValidationException if dimensions do not match the number of labels or if
     * any distribution is invalid
     */
    public HmmModel(List<String> stateLabels, List<String> symbolLabels,
            double[] initialProbabilities, double[][] transitionProbabilities,
            double[][] emissionProbabilities) {
        Objects.requireNonNull(stateLabels, "stateLabels must not be null.");
        Objects.requireNonNull(symbolLabels, "symbolLabels must not be null.");
        Objects.requireNonNull(initialProbabilities, "initialProbabilities must not be null.");
        Objects.requireNonNull(transitionProbabilities,
                "transitionProbabilities must not be null.");
        Objects.requireNonNull(emissionProbabilities, "emissionProbabilities must not be null.");

        final int k = stateLabels.size();
        final int m = symbolLabels.size();
        if (k < 1) {
            throw new ModelValidationException("states", "At least one state is required.");
        }
        if (m < 1) {
            throw new ModelValidationException("symbols",
                    "At least one observation symbol is required.");
        }
        checkDistinct("state labels", stateLabels);
        checkDistinct("symbol labels", symbolLabels);

        checkDistribution("initial probabilities", initialProbabilities, k);
        checkMatrix("transition", transitionProbabilities, k, k);
        checkMatrix("emission", emissionProbabilities, k, m);

        this.stateLabels = Collections.unmodifiableList(new ArrayList<>(stateLabels));
        this.symbolLabels = Collections.unmodifiableList(new ArrayList<>(symbolLabels));
        this.initialProbabilities = Arrays.copyOf(initialProbabilities, k);
        this.transitionProbabilities = Utils.copy(transitionProbabilities);
        this.emissionProbabilities = Utils.copy(emissionProbabilities);
    }

    /**
     * Returns a model with the same labels and the specified parameters.
     */
    public HmmModel withParameters(double[] initialProbabilities,
            double[][] transitionProbabilities, double[][] emissionProbabilities) {
        return new HmmModel(stateLabels, symbolLabels, initialProbabilities,
                transitionProbabilities, emissionProbabilities);
    }

    public int numberOfStates() {
        return initialProbabilities.length;
    }

    public int numberOfSymbols() {
        return symbolLabels.size();
    }

    public double initialProbability(int state) {
        return initialProbabilities[state];
    }

    public double transitionProbability(int fromState, int toState) {
        return transitionProbabilities[fromState][toState];
    }

    public double emissionProbability(int state, int symbol) {
        return emissionProbabilities[state][symbol];
    }

    public double[] getInitialProbabilities() {
        return Arrays.copyOf(initialProbabilities, initialProbabilities.length);
    }

    public double[][] getTransitionProbabilities() {
        return Utils.copy(transitionProbabilities);
    }

    public double[][] getEmissionProbabilities() {
        return Utils.copy(emissionProbabilities);
    }

    public List<String> getStateLabels() {
        return stateLabels;
    }

    public List<String> getSymbolLabels() {
        return symbolLabels;
    }

    public String stateLabel(int state) {
        return stateLabels.get(state);
    }

    public String symbolLabel(int symbol) {
        return symbolLabels.get(symbol);
    }

    /**
     * @throws InvalidIndexException if the state index is outside of [0, K)
     */
    public void checkStateIndex(int state) {
        if (state < 0 || state >= numberOfStates()) {
            throw new InvalidIndexException("State", state, -1, numberOfStates());
        }
    }

    /**
     * @throws InvalidIndexException if any symbol index is outside of [0, M)
     */
    public void checkObservations(int[] observations) {
        Objects.requireNonNull(observations, "observations must not be null.");
        for (int t = 0; t < observations.length; t++) {
            if (observations[t] < 0 || observations[t] >= numberOfSymbols()) {
                throw new InvalidIndexException("Observation", observations[t], t,
                        numberOfSymbols());
            }
        }
    }

    /**
     * @throws InvalidIndexException if any state index is outside of [0, K)
     */
    public void checkStates(int[] states) {
        Objects.requireNonNull(states, "states must not be null.");
        for (int t = 0; t < states.length; t++) {
            if (states[t] < 0 || states[t] >= numberOfStates()) {
                throw new InvalidIndexException("State", states[t], t, numberOfStates());
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final HmmModel other = (HmmModel) o;
        return stateLabels.equals(other.stateLabels)
                && symbolLabels.equals(other.symbolLabels)
                && Arrays.equals(initialProbabilities, other.initialProbabilities)
                && Arrays.deepEquals(transitionProbabilities, other.transitionProbabilities)
                && Arrays.deepEquals(emissionProbabilities, other.emissionProbabilities);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(stateLabels, symbolLabels);
        result = 31 * result + Arrays.hashCode(initialProbabilities);
        result = 31 * result + Arrays.deepHashCode(transitionProbabilities);
        result = 31 * result + Arrays.deepHashCode(emissionProbabilities);
        return result;
    }

    @Override
    public String toString() {
        return "HmmModel [states=" + stateLabels + ", symbols=" + symbolLabels
                + ", initialProbabilities=" + Arrays.toString(initialProbabilities)
                + ", transitionProbabilities=" + Arrays.deepToString(transitionProbabilities)
                + ", emissionProbabilities=" + Arrays.deepToString(emissionProbabilities) + "]";
    }

    private static List<String> defaultLabels(String prefix, String name, int count) {
        if (count < 0) {
            throw new ModelValidationException(name, "Negative number of " + name + ": " + count);
        }
        final List<String> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(prefix + i);
        }
        return result;
    }

    private static void checkDistinct(String name, List<String> labels) {
        final Set<String> seen = new HashSet<>();
        for (String label : labels) {
            if (label == null) {
                throw new ModelValidationException(name, "Null entry in " + name + ".");
            }
            if (!seen.add(label)) {
                throw new ModelValidationException(name, "Duplicate " + name + ": " + label);
            }
        }
    }

    private static void checkMatrix(String name, double[][] matrix, int rows, int columns) {
        if (matrix.length != rows) {
            throw new ModelValidationException(name + " matrix", "Expected " + rows + " "
                    + name + " rows but got " + matrix.length + ".");
        }
        for (int i = 0; i < rows; i++) {
            if (matrix[i] == null) {
                throw new ModelValidationException(name + " row " + i,
                        name + " row " + i + " must not be null.");
            }
            checkDistribution(name + " row " + i, matrix[i], columns);
        }
    }

    private static void checkDistribution(String name, double[] probabilities, int length) {
        if (probabilities.length != length) {
            throw new ModelValidationException(name, "Expected " + length + " entries in "
                    + name + " but got " + probabilities.length + ".");
        }
        for (int i = 0; i < length; i++) {
            final double probability = probabilities[i];
            // Written so that NaN fails the check as well.
            if (!(probability >= 0.0 && probability <= 1.0)) {
                throw new ModelValidationException(name, "Entry " + i + " of " + name
                        + " is not a probability: " + probability);
            }
        }
        final double sum = Utils.sum(probabilities);
        if (Math.abs(sum - 1.0) > Utils.DELTA) {
            throw new ModelValidationException(name, sum, name + " must sum to 1 but sum to "
                    + sum + " (deviation " + (sum - 1.0) + ").");
        }
    }

}
