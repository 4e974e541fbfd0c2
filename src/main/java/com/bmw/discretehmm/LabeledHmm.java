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
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps arbitrary state and observation objects to the dense indices of an {@link HmmModel}.
 * The mapping is computed once at construction so that the algorithms only work on indexed
 * arrays.
 *
 * <p>Probabilities are passed as maps keyed by state, observation or {@link Transition}.
 * A probability of zero is assumed for every missing transition and for every missing
 * observation of an emission distribution.
 *
 * <p>Model labels are the string representations of the states and observations. Distinct
 * elements with equal string representations get their index appended to stay unique.
 *
 * @param <S> the state type
 * @param <O> the observation type
 */
public final class LabeledHmm<S, O> {

    private final List<S> states;
    private final List<O> observations;
    private final Map<S, Integer> stateIndices;
    private final Map<O, Integer> observationIndices;
    private final HmmModel model;

    /**
     * @param states Pass a collection with predictable iteration order such as
     * {@link ArrayList} since the iteration order defines the state indices.
     *
     * @param observations Possible observations in index order.
     *
     * @param initialProbabilities Initial probability for each state.
     *
     * @param transitionProbabilities Transition probabilities between pairs of states.
     *
     * @param emissionProbabilities Emission distribution of each state.
     *
     * @throws NullPointerException if any initial probability or emission distribution is
     * missing
     *
     * @throws IllegalArgumentException if a map refers to an unknown state or observation
     *
     * @throws ModelValidationException if the resulting model is invalid
     */
    public LabeledHmm(Collection<S> states, Collection<O> observations,
            Map<S, Double> initialProbabilities,
            Map<Transition<S>, Double> transitionProbabilities,
            Map<S, Map<O, Double>> emissionProbabilities) {
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
        this.observations = Collections.unmodifiableList(new ArrayList<>(observations));
        this.stateIndices = indexMap(this.states, "state");
        this.observationIndices = indexMap(this.observations, "observation");

        final int k = this.states.size();
        final int m = this.observations.size();

        final double[] pi = new double[k];
        for (S state : initialProbabilities.keySet()) {
            stateIndex(state);
        }
        for (int i = 0; i < k; i++) {
            final Double probability = initialProbabilities.get(this.states.get(i));
            if (probability == null) {
                throw new NullPointerException("No initial probability for "
                        + this.states.get(i));
            }
            pi[i] = probability;
        }

        final double[][] a = new double[k][k];
        for (Map.Entry<Transition<S>, Double> entry : transitionProbabilities.entrySet()) {
            final Transition<S> transition = entry.getKey();
            a[stateIndex(transition.fromState)][stateIndex(transition.toState)] =
                    entry.getValue();
        }

        final double[][] b = new double[k][m];
        for (S state : emissionProbabilities.keySet()) {
            stateIndex(state);
        }
        for (int i = 0; i < k; i++) {
            final Map<O, Double> emissions = emissionProbabilities.get(this.states.get(i));
            if (emissions == null) {
                throw new NullPointerException("No emission probabilities for "
                        + this.states.get(i));
            }
            for (Map.Entry<O, Double> entry : emissions.entrySet()) {
                b[i][observationIndex(entry.getKey())] = entry.getValue();
            }
        }

        this.model = new HmmModel(labels(this.states), labels(this.observations), pi, a, b);
    }

    private LabeledHmm(LabeledHmm<S, O> template, HmmModel model) {
        this.states = template.states;
        this.observations = template.observations;
        this.stateIndices = template.stateIndices;
        this.observationIndices = template.observationIndices;
        this.model = model;
    }

    /**
     * Returns an instance with the same state and observation mapping for the specified model,
     * e.g. a model estimated with {@link BaumWelchAlgorithm}.
     *
     * @throws IllegalArgumentException if the model has a different number of states or symbols
     */
    public LabeledHmm<S, O> withModel(HmmModel model) {
        Objects.requireNonNull(model, "model must not be null.");
        if (model.numberOfStates() != states.size()
                || model.numberOfSymbols() != observations.size()) {
            throw new IllegalArgumentException("Model has " + model.numberOfStates()
                    + " states and " + model.numberOfSymbols() + " symbols but expected "
                    + states.size() + " states and " + observations.size() + " symbols.");
        }
        return new LabeledHmm<>(this, model);
    }

    public HmmModel model() {
        return model;
    }

    public List<S> states() {
        return states;
    }

    public List<O> observations() {
        return observations;
    }

    public int stateIndex(S state) {
        final Integer index = stateIndices.get(state);
        if (index == null) {
            throw new IllegalArgumentException("Unknown state " + state);
        }
        return index;
    }

    public int observationIndex(O observation) {
        final Integer index = observationIndices.get(observation);
        if (index == null) {
            throw new IllegalArgumentException("Unknown observation " + observation);
        }
        return index;
    }

    public S state(int index) {
        if (index < 0 || index >= states.size()) {
            throw new InvalidIndexException("State", index, -1, states.size());
        }
        return states.get(index);
    }

    public O observation(int index) {
        if (index < 0 || index >= observations.size()) {
            throw new InvalidIndexException("Observation", index, -1, observations.size());
        }
        return observations.get(index);
    }

    /**
     * Converts an observation sequence to symbol indices.
     */
    public int[] encode(List<O> observationSequence) {
        final int[] result = new int[observationSequence.size()];
        int t = 0;
        for (O observation : observationSequence) {
            result[t++] = observationIndex(observation);
        }
        return result;
    }

    /**
     * Converts a state path, e.g. {@link MostLikelySequence#path()}, to states.
     */
    public List<S> decodeStates(int[] path) {
        final List<S> result = new ArrayList<>(path.length);
        for (int index : path) {
            result.add(state(index));
        }
        return result;
    }

    public List<O> decodeObservations(int[] symbols) {
        final List<O> result = new ArrayList<>(symbols.length);
        for (int index : symbols) {
            result.add(observation(index));
        }
        return result;
    }

    private static <T> Map<T, Integer> indexMap(List<T> elements, String kind) {
        final Map<T, Integer> result =
                new LinkedHashMap<>(Utils.initialHashMapCapacity(elements.size()));
        for (T element : elements) {
            if (result.put(element, result.size()) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " " + element);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Display labels from {@link String#valueOf(Object)}. Distinct elements with the same string
     * representation get their index appended, e.g. "1#1".
     */
    static List<String> labels(List<?> elements) {
        final Set<String> used = new HashSet<>();
        for (Object element : elements) {
            used.add(String.valueOf(element));
        }
        final Set<String> assigned = new HashSet<>();
        final List<String> result = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            String label = String.valueOf(elements.get(i));
            if (!assigned.add(label)) {
                int suffix = i;
                while (used.contains(label + "#" + suffix)
                        || !assigned.add(label + "#" + suffix)) {
                    suffix++;
                }
                label = label + "#" + suffix;
            }
            result.add(label);
        }
        return result;
    }

}
