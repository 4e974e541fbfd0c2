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

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Discrete-output HMM with fixed parameters. Bundles sampling, scoring, decoding and
 * parameter estimation for one {@link HmmModel}.
 *
 * <p>Instances are immutable and hold no state between calls, so they can be shared between
 * threads as long as each thread passes its own {@link RandomGenerator} to
 * {@link #sample(int, RandomGenerator)}.
 */
public class Hmm {

    private final HmmModel model;

    public Hmm(HmmModel model) {
        if (model == null) {
            throw new NullPointerException("model must not be null.");
        }

        this.model = model;
    }

    public HmmModel model() {
        return model;
    }

    /**
     * @see HmmSampler#sample(HmmModel, int, RandomGenerator)
     */
    public SampledSequence sample(int length, RandomGenerator rng) {
        return HmmSampler.sample(model, length, rng);
    }

    /**
     * @see LikelihoodScorer#logLikelihood(HmmModel, int[])
     */
    public double logLikelihood(int[] observations) {
        return LikelihoodScorer.logLikelihood(model, observations);
    }

    /**
     * Computes the most likely sequence of states given the specified observations.
     *
     * @see ViterbiAlgorithm#compute(HmmModel, int[], ViterbiAlgorithmParams)
     */
    public MostLikelySequence computeMostLikelySequence(int[] observations) {
        return ViterbiAlgorithm.compute(model, observations);
    }

    public MostLikelySequence computeMostLikelySequence(int[] observations,
            ViterbiAlgorithmParams params) {
        return ViterbiAlgorithm.compute(model, observations, params);
    }

    /**
     * Estimates new parameters from the specified observations, starting from the parameters
     * of this HMM. This HMM is not modified; use {@link BaumWelchResult#model()} to create a
     * new one.
     *
     * @see BaumWelchAlgorithm#fit(HmmModel, int[], BaumWelchParams)
     */
    public BaumWelchResult fit(int[] observations, BaumWelchParams params) {
        Objects.requireNonNull(params, "params must not be null.");
        return BaumWelchAlgorithm.fit(model, observations, params);
    }

}
