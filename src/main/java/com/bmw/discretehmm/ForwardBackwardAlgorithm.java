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

import java.util.Arrays;
import java.util.Objects;

/**
 * Computes the forward-backward algorithm, also known as smoothing.
 * This algorithm computes the probability of each state at each time step given the
 * entire observation sequence.
 *
 * <p>Forward probabilities are normalized to sum to 1 at each time step. Backward probabilities
 * are divided by the scaling divisors of the following time steps, which eliminates the need to
 * normalize the smoothing probabilities,
 * see also https://en.wikipedia.org/wiki/Forward%E2%80%93backward_algorithm.
 */
public class ForwardBackwardAlgorithm {

    private static final double DELTA = 1e-8;

    private final HmmModel model;
    private final int[] observations;
    private final double[][] forwardProbabilities;
    private final double[] scalingDivisors; // Normalizes sum of forward probabilities to 1.
    private final double[][] backwardProbabilities;

    /**
     * Number of time steps with non-zero probability. Less than the sequence length after an
     * HMM break.
     */
    private final int computedSteps;

    private ForwardBackwardAlgorithm(HmmModel model, int[] observations) {
        this.model = model;
        this.observations = observations;
        final int steps = observations.length;
        final int k = model.numberOfStates();
        this.forwardProbabilities = new double[steps][];
        this.scalingDivisors = new double[steps];

        int t = 0;
        for (; t < steps; t++) {
            final double[] curForwardProbabilities = new double[k];
            final double[] prevForwardProbabilities = t == 0 ? null : forwardProbabilities[t - 1];
            final double sum = computeForwardStep(model, prevForwardProbabilities,
                    observations[t], curForwardProbabilities);
            if (sum == 0.0) {
                break;
            }
            Utils.normalize(curForwardProbabilities, sum);
            forwardProbabilities[t] = curForwardProbabilities;
            scalingDivisors[t] = sum;
        }
        this.computedSteps = t;
        this.backwardProbabilities = isBroken() ? null : computeBackwardProbabilities();
    }

    /**
     * Runs the forward and the backward pass for the specified observation sequence.
     *
     * @throws IllegalArgumentException if the observation sequence is empty
     *
     * @throws InvalidIndexException if any observation is outside of [0, M)
     */
    public static ForwardBackwardAlgorithm compute(HmmModel model, int[] observations) {
        Objects.requireNonNull(model, "model must not be null.");
        model.checkObservations(observations);
        if (observations.length == 0) {
            throw new IllegalArgumentException("Observation sequence must not be empty.");
        }
        return new ForwardBackwardAlgorithm(model,
                Arrays.copyOf(observations, observations.length));
    }

    public int numberOfSteps() {
        return observations.length;
    }

    /**
     * Returns whether the observation sequence has zero probability, i.e. whether all forward
     * probabilities of some time step are zero. Only forward probabilities up to the time step
     * before the break are available in this case.
     */
    public boolean isBroken() {
        return computedSteps < observations.length;
    }

    /**
     * Returns the probability of each state at the specified zero-based time step given the
     * observations up to t. The returned probabilities sum to 1.
     */
    public double[] forwardProbabilities(int t) {
        checkComputed(t);
        return Arrays.copyOf(forwardProbabilities[t], forwardProbabilities[t].length);
    }

    /**
     * Returns the backward probabilities at the specified time step divided by the scaling
     * divisors of all following time steps. Before the last time step, the backward probability
     * of a state with zero forward probability is reported as 0.
     */
    public double[] backwardProbabilities(int t) {
        checkNotBroken();
        return Arrays.copyOf(backwardProbabilities[t], backwardProbabilities[t].length);
    }

    /**
     * Returns the sum of the unnormalized forward probabilities at time step t.
     */
    public double scalingDivisor(int t) {
        checkComputed(t);
        return scalingDivisors[t];
    }

    /**
     * Returns the log probability of the entire observation sequence or
     * {@link Double#NEGATIVE_INFINITY} if the HMM is broken.
     * The log is returned to prevent arithmetic underflows for very small probabilities.
     */
    public double observationLogProbability() {
        if (isBroken()) {
            return Double.NEGATIVE_INFINITY;
        }
        double result = 0.0;
        for (double scalingDivisor : scalingDivisors) {
            result += Math.log(scalingDivisor);
        }
        return result;
    }

    /**
     * Returns the probability of each state at each time step given all observations.
     * result[t][i] is the probability of state i at time step t.
     *
     * @throws IllegalStateException if the HMM is broken
     */
    public double[][] computeSmoothingProbabilities() {
        checkNotBroken();
        final int k = model.numberOfStates();
        final double[][] result = new double[observations.length][k];
        for (int t = 0; t < observations.length; t++) {
            double sum = 0.0;
            for (int i = 0; i < k; i++) {
                final double probability =
                        forwardProbabilities[t][i] * backwardProbabilities[t][i];
                assert Utils.probabilityInRange(probability, DELTA);
                result[t][i] = probability;
                sum += probability;
            }
            assert Math.abs(sum - 1.0) <= DELTA;
            Utils.normalize(result[t], sum);
        }
        return result;
    }

    /**
     * Returns the probability of each transition between time step t and t+1 given all
     * observations. result[t][i][j] is the probability of being in state i at time step t and
     * in state j at time step t+1. Contains one matrix less than there are time steps.
     *
     * @throws IllegalStateException if the HMM is broken
     */
    public double[][][] computeTransitionPosteriors() {
        checkNotBroken();
        final int k = model.numberOfStates();
        final double[][][] result = new double[Math.max(observations.length - 1, 0)][k][k];
        for (int t = 0; t < observations.length - 1; t++) {
            final int nextObservation = observations[t + 1];
            double sum = 0.0;
            for (int i = 0; i < k; i++) {
                for (int j = 0; j < k; j++) {
                    final double probability = forwardProbabilities[t][i]
                            * model.transitionProbability(i, j)
                            * model.emissionProbability(j, nextObservation)
                            * backwardProbabilities[t + 1][j] / scalingDivisors[t + 1];
                    result[t][i][j] = probability;
                    sum += probability;
                }
            }
            assert Math.abs(sum - 1.0) <= DELTA;
            for (int i = 0; i < k; i++) {
                Utils.normalize(result[t][i], sum);
            }
        }
        return result;
    }

    private double[][] computeBackwardProbabilities() {
        final int k = model.numberOfStates();
        final int steps = observations.length;
        final double[][] result = new double[steps][];

        // Initial step
        result[steps - 1] = new double[k];
        Arrays.fill(result[steps - 1], 1.0);

        // Remaining steps
        for (int t = steps - 2; t >= 0; t--) {
            result[t] = new double[k];
            for (int i = 0; i < k; i++) {
                // Unreachable state, the scaled backward probability would grow without bound.
                if (forwardProbabilities[t][i] == 0.0) {
                    continue;
                }
                result[t][i] = computeUnscaledBackwardProbability(i, result[t + 1],
                        observations[t + 1]) / scalingDivisors[t + 1];
            }
        }
        return result;
    }

    /**
     * Computes the non-normalized forward probabilities of one time step and returns their sum,
     * which is zero if the observations up to this time step have zero probability.
     *
     * @param prevForwardProbabilities Normalized forward probabilities of the previous time
     * step or null for the first time step.
     */
    static double computeForwardStep(HmmModel model, double[] prevForwardProbabilities,
            int observation, double[] outForwardProbabilities) {
        double sum = 0.0;
        for (int curState = 0; curState < outForwardProbabilities.length; curState++) {
            double result;
            if (prevForwardProbabilities == null) {
                result = model.initialProbability(curState);
            } else {
                result = 0.0;
                for (int prevState = 0; prevState < prevForwardProbabilities.length;
                        prevState++) {
                    result += prevForwardProbabilities[prevState]
                            * model.transitionProbability(prevState, curState);
                }
            }
            result *= model.emissionProbability(curState, observation);
            outForwardProbabilities[curState] = result;
            sum += result;
        }
        return sum;
    }

    private double computeUnscaledBackwardProbability(int state,
            double[] nextBackwardProbabilities, int nextObservation) {
        double result = 0.0;
        for (int nextState = 0; nextState < nextBackwardProbabilities.length; nextState++) {
            result += model.emissionProbability(nextState, nextObservation)
                    * nextBackwardProbabilities[nextState]
                    * model.transitionProbability(state, nextState);
        }
        return result;
    }

    private void checkComputed(int t) {
        if (t < 0 || t >= computedSteps) {
            throw new IllegalStateException("No forward probabilities for time step " + t
                    + ", computed " + computedSteps + " of " + observations.length + " steps.");
        }
    }

    private void checkNotBroken() {
        if (isBroken()) {
            throw new IllegalStateException("Observation sequence has zero probability, "
                    + "HMM break at time step " + computedSteps + ".");
        }
    }

}
