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

import java.util.Objects;

/**
 * Computes the log probability of an observation sequence with the forward algorithm.
 * Forward probabilities are normalized at each time step and the logs of the scaling divisors
 * are accumulated, which prevents arithmetic underflows for long sequences.
 */
public final class LikelihoodScorer {

    private LikelihoodScorer() {
    }

    /**
     * Returns the natural log probability of the specified observation sequence,
     * i.e. log p(o_0, ..., o_{T-1}).
     *
     * <p>The empty sequence has log probability 0. If the sequence has zero probability under
     * the model, {@link Double#NEGATIVE_INFINITY} is returned, see {@link #isDegenerate(double)}.
     *
     * @throws InvalidIndexException if any observation is outside of [0, M)
     */
    public static double logLikelihood(HmmModel model, int[] observations) {
        Objects.requireNonNull(model, "model must not be null.");
        model.checkObservations(observations);
        if (observations.length == 0) {
            return 0.0;
        }

        final int k = model.numberOfStates();
        double[] forwardProbabilities = null;
        double result = 0.0;
        for (int observation : observations) {
            final double[] curForwardProbabilities = new double[k];
            final double sum = ForwardBackwardAlgorithm.computeForwardStep(model,
                    forwardProbabilities, observation, curForwardProbabilities);
            if (sum == 0.0) {
                return Double.NEGATIVE_INFINITY;
            }
            Utils.normalize(curForwardProbabilities, sum);
            forwardProbabilities = curForwardProbabilities;
            result += Math.log(sum);
        }
        return result;
    }

    /**
     * Returns the probability of the specified observation sequence in linear scale.
     * Underflows to 0 for long sequences, use {@link #logLikelihood(HmmModel, int[])} instead.
     */
    public static double likelihood(HmmModel model, int[] observations) {
        return Math.exp(logLikelihood(model, observations));
    }

    /**
     * Returns whether the specified log likelihood stands for a sequence with zero probability.
     */
    public static boolean isDegenerate(double logLikelihood) {
        return logLikelihood == Double.NEGATIVE_INFINITY;
    }

}
