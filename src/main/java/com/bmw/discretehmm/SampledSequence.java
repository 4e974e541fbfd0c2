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

/**
 * Observation sequence drawn from an {@link HmmModel} together with the hidden states that
 * generated it.
 */
public final class SampledSequence {

    private final int[] observations;
    private final int[] states;
    private final double logLikelihood;

    SampledSequence(int[] observations, int[] states, double logLikelihood) {
        assert observations.length == states.length;
        this.observations = observations;
        this.states = states;
        this.logLikelihood = logLikelihood;
    }

    public int[] observations() {
        return Arrays.copyOf(observations, observations.length);
    }

    public int[] states() {
        return Arrays.copyOf(states, states.length);
    }

    public int length() {
        return observations.length;
    }

    /**
     * Log probability of the sampled observations under the model they were drawn from.
     */
    public double logLikelihood() {
        return logLikelihood;
    }

    @Override
    public String toString() {
        return "SampledSequence [observations=" + Arrays.toString(observations) + ", states="
                + Arrays.toString(states) + ", logLikelihood=" + logLikelihood + "]";
    }

}
