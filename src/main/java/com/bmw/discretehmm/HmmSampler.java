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
import java.util.Random;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draws joint sequences of hidden states and observations from an {@link HmmModel}.
 *
 * <p>At each time step t the state is drawn first (from the initial distribution for t = 0,
 * otherwise from the transition distribution of the previous state), then the observation from
 * the emission distribution of that state. Each draw consumes exactly one
 * {@link RandomGenerator#nextDouble()} value, hence the same generator state and model always
 * produce the same sequence.
 */
public final class HmmSampler {

    private static final Logger logger = LoggerFactory.getLogger(HmmSampler.class);

    private HmmSampler() {
    }

    /**
     * Draws a sequence of the specified length.
     *
     * @param rng consumed by this method, is not reset
     *
     * @throws IllegalArgumentException if length is negative
     */
    public static SampledSequence sample(HmmModel model, int length, RandomGenerator rng) {
        Objects.requireNonNull(model, "model must not be null.");
        Objects.requireNonNull(rng, "rng must not be null.");
        if (length < 0) {
            throw new IllegalArgumentException("Sequence length must not be negative: " + length);
        }

        final int k = model.numberOfStates();
        final int m = model.numberOfSymbols();
        final int[] states = new int[length];
        final int[] observations = new int[length];
        final double[] stateProbabilities = new double[k];
        final double[] emissionProbabilities = new double[m];
        for (int t = 0; t < length; t++) {
            for (int i = 0; i < k; i++) {
                stateProbabilities[i] = t == 0 ? model.initialProbability(i)
                        : model.transitionProbability(states[t - 1], i);
            }
            states[t] = drawIndex(stateProbabilities, rng);

            for (int o = 0; o < m; o++) {
                emissionProbabilities[o] = model.emissionProbability(states[t], o);
            }
            observations[t] = drawIndex(emissionProbabilities, rng);
        }

        final double logLikelihood = LikelihoodScorer.logLikelihood(model, observations);
        logger.debug("Sampled {} observations with log likelihood {}", length, logLikelihood);
        return new SampledSequence(observations, states, logLikelihood);
    }

    /**
     * Draws a sequence using a {@link Random} with the specified seed, which gives the same
     * result on every platform.
     */
    public static SampledSequence sample(HmmModel model, int length, long seed) {
        return sample(model, length, createRandomGenerator(seed));
    }

    public static RandomGenerator createRandomGenerator(long seed) {
        return RandomGeneratorFactory.createRandomGenerator(new Random(seed));
    }

    /**
     * Returns the lowest index whose cumulative probability exceeds a uniform draw from [0, 1).
     * Falls back to the highest index with non-zero probability if rounding leaves the
     * cumulative sum below the draw.
     */
    static int drawIndex(double[] probabilities, RandomGenerator rng) {
        final double u = rng.nextDouble();
        double cumulative = 0.0;
        int lastPossible = -1;
        for (int i = 0; i < probabilities.length; i++) {
            cumulative += probabilities[i];
            if (probabilities[i] > 0.0) {
                lastPossible = i;
            }
            if (u < cumulative) {
                return i;
            }
        }
        assert lastPossible >= 0 : "Distribution without positive probability";
        return lastPossible;
    }

}
