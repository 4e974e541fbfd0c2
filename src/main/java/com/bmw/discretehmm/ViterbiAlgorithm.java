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
import java.util.List;
import java.util.Objects;

/**
 * Implementation of the Viterbi algorithm for discrete-output HMMs.
 * Uses logarithmic probabilities to prevent arithmetic underflows for small probability values.
 * The plain Viterbi algorithm for stationary Markov processes is described e.g. in
 * Rabiner, Juang, An introduction to Hidden Markov Models, IEEE ASSP Mag., pp 4-16, June 1986.
 *
 * <p>Zero probabilities become {@link Double#NEGATIVE_INFINITY}. If several states have the
 * same maximum log probability, the state with the lowest index is chosen, both for back
 * pointers and for the last state of the most likely sequence.
 */
public final class ViterbiAlgorithm {

    private ViterbiAlgorithm() {
    }

    /**
     * @see #compute(HmmModel, int[], ViterbiAlgorithmParams)
     */
    public static MostLikelySequence compute(HmmModel model, int[] observations) {
        return compute(model, observations, new ViterbiAlgorithmParams());
    }

    /**
     * Computes the most likely sequence of states for the specified observations.
     * Formally, this is argmax p(s_0, ..., s_{T-1} | o_0, ..., o_{T-1}) with respect to
     * s_0, ..., s_{T-1}, where s_t is the state at time step t and o_t is the observation at
     * time step t.
     *
     * @throws IllegalArgumentException if the observation sequence is empty
     *
     * @throws InvalidIndexException if any observation is outside of [0, M)
     */
    public static MostLikelySequence compute(HmmModel model, int[] observations,
            ViterbiAlgorithmParams params) {
        Objects.requireNonNull(model, "model must not be null.");
        Objects.requireNonNull(params, "params must not be null.");
        model.checkObservations(observations);
        if (observations.length == 0) {
            throw new IllegalArgumentException(
                    "Most likely sequence is undefined for an empty observation sequence.");
        }

        final int k = model.numberOfStates();
        final double[] initialLogProbabilities =
                Utils.logProbabilities(model.getInitialProbabilities());
        final double[][] transitionLogProbabilities =
                Utils.logProbabilities(model.getTransitionProbabilities());
        final double[][] emissionLogProbabilities =
                Utils.logProbabilities(model.getEmissionProbabilities());

        final List<double[]> messageHistory =
                params.isKeepMessageHistory() ? new ArrayList<>() : null;

        // backPointers[t][s] is the previous state of the most likely sequence passing at
        // time step t through state s. There are no back pointers for t = 0.
        final int[][] backPointers = new int[observations.length][];

        double[] message = new double[k];
        for (int i = 0; i < k; i++) {
            message[i] = initialLogProbabilities[i] + emissionLogProbabilities[i][observations[0]];
        }
        if (messageHistory != null) {
            messageHistory.add(message);
        }

        // Forward pass
        for (int t = 1; t < observations.length; t++) {
            final double[] curMessage = new double[k];
            backPointers[t] = new int[k];
            forwardStep(message, transitionLogProbabilities, emissionLogProbabilities,
                    observations[t], curMessage, backPointers[t]);
            message = curMessage;
            if (messageHistory != null) {
                messageHistory.add(message);
            }
        }

        final int lastState = mostLikelyState(message);
        final int[] path = retrieveMostLikelySequence(backPointers, lastState);
        final double logProbability = message[lastState];

        double[] smoothingProbabilities = null;
        if (params.isComputeSmoothingProbabilities()
                && logProbability != Double.NEGATIVE_INFINITY) {
            final double[][] allSmoothingProbabilities =
                    ForwardBackwardAlgorithm.compute(model, observations)
                            .computeSmoothingProbabilities();
            smoothingProbabilities = new double[path.length];
            for (int t = 0; t < path.length; t++) {
                smoothingProbabilities[t] = allSmoothingProbabilities[t][path[t]];
            }
        }

        return new MostLikelySequence(path, logProbability, messageHistory,
                smoothingProbabilities, model);
    }

    /**
     * Computes the new forward message and the back pointers to the previous states.
     */
    private static void forwardStep(double[] message, double[][] transitionLogProbabilities,
            double[][] emissionLogProbabilities, int observation, double[] outMessage,
            int[] outBackPointers) {
        for (int curState = 0; curState < outMessage.length; curState++) {
            // Set first state as most likely previous state.
            double maxLogProbability = message[0] + transitionLogProbabilities[0][curState];
            int maxPrevState = 0;
            for (int prevState = 1; prevState < message.length; prevState++) {
                final double logProbability =
                        message[prevState] + transitionLogProbabilities[prevState][curState];
                if (logProbability > maxLogProbability) {
                    maxLogProbability = logProbability;
                    maxPrevState = prevState;
                }
            }
            outMessage[curState] =
                    maxLogProbability + emissionLogProbabilities[curState][observation];
            outBackPointers[curState] = maxPrevState;
        }
    }

    /**
     * Retrieves a state with maximum probability.
     */
    private static int mostLikelyState(double[] message) {
        int result = 0;
        double maxLogProbability = message[0];
        for (int state = 1; state < message.length; state++) {
            if (message[state] > maxLogProbability) {
                maxLogProbability = message[state];
                result = state;
            }
        }
        return result;
    }

    /**
     * Retrieves the most likely sequence from the back pointers ending in the specified last
     * state.
     */
    private static int[] retrieveMostLikelySequence(int[][] backPointers, int lastState) {
        final int[] result = new int[backPointers.length];
        int state = lastState;
        result[result.length - 1] = state;
        for (int t = result.length - 1; t > 0; t--) {
            state = backPointers[t][state];
            result[t - 1] = state;
        }
        return result;
    }

}
