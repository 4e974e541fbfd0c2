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
import java.util.List;

/**
 * Contains the most likely sequence and additional results of the Viterbi algorithm.
 */
public class MostLikelySequence {

    private final int[] path;
    private final double logProbability;
    private final List<double[]> messageHistory;
    private final double[] smoothingProbabilities;
    private final HmmModel model;

    MostLikelySequence(int[] path, double logProbability, List<double[]> messageHistory,
            double[] smoothingProbabilities, HmmModel model) {
        this.path = path;
        this.logProbability = logProbability;
        this.messageHistory = messageHistory;
        this.smoothingProbabilities = smoothingProbabilities;
        this.model = model;
    }

    /**
     * Most likely state index for each time step.
     */
    public int[] path() {
        return Arrays.copyOf(path, path.length);
    }

    /**
     * Joint log probability of the most likely path and the observations,
     * i.e. max log p(s_0, ..., s_{T-1}, o_0, ..., o_{T-1}).
     */
    public double logProbability() {
        return logProbability;
    }

    /**
     * Returns whether an HMM break occurred, i.e. whether every path has zero probability.
     * The path is still complete in this case but arbitrary: ties between zero probabilities
     * are resolved in favor of the lowest state index.
     */
    public boolean isBroken() {
        return logProbability == Double.NEGATIVE_INFINITY;
    }

    /**
     *  Sequence of computed messages for each time step. Is null if message history
     *  is not kept (see {@link ViterbiAlgorithmParams#setKeepMessageHistory(boolean)}).
     *
     *  For each state s_t of the time step t, messageHistory().get(t)[s_t] contains the log
     *  probability of the most likely sequence ending in state s_t with given observations
     *  o_0, ..., o_t.
     *
     *  The returned list is an unmodifiable copy.
     */
    public List<double[]> messageHistory() {
        if (messageHistory == null) {
            return null;
        }
        final List<double[]> result = new ArrayList<>(messageHistory.size());
        for (double[] message : messageHistory) {
            result.add(Arrays.copyOf(message, message.length));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Probability of the state of the most likely sequence at each time step given all
     * observations. Is null if smoothing probabilities are not computed (see
     * {@link ViterbiAlgorithmParams#setComputeSmoothingProbabilities(boolean)}) or if the HMM
     * is broken.
     */
    public double[] smoothingProbabilities() {
        return smoothingProbabilities == null ? null
                : Arrays.copyOf(smoothingProbabilities, smoothingProbabilities.length);
    }

    /**
     * Returns the number of time steps at which the most likely sequence agrees with the
     * specified state sequence, e.g. the states of a {@link SampledSequence}.
     *
     * @throws IllegalArgumentException if the sequences have different lengths
     * @throws InvalidIndexException if a state index is outside of the model's state space
     */
    public int countMatches(int[] states) {
        model.checkStates(states);
        if (states.length != path.length) {
            throw new IllegalArgumentException("Expected " + path.length + " states but got "
                    + states.length + ".");
        }
        int result = 0;
        for (int t = 0; t < path.length; t++) {
            if (path[t] == states[t]) {
                result++;
            }
        }
        return result;
    }

    public String messageHistoryString() {
        if (messageHistory == null) {
            return "No message history kept.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Message history with log probabilies\n\n");
        int t = 0;
        for (double[] message : messageHistory) {
            sb.append("Time step " + t + "\n");
            t++;
            for (int state = 0; state < message.length; state++) {
                sb.append(model.stateLabel(state) + ": " + message[state] + "\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "MostLikelySequence [path=" + Arrays.toString(path) + ", logProbability="
                + logProbability + "]";
    }

}
