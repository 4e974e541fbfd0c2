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

/**
 * Parameters for {@link ViterbiAlgorithm}.
 */
public class ViterbiAlgorithmParams {

    private boolean keepMessageHistory = false;
    private boolean computeSmoothingProbabilities = false;

    /**
     * Whether to store intermediate forward messages
     * (log probabilities of intermediate most likely paths) for debugging.
     */
    public ViterbiAlgorithmParams setKeepMessageHistory(boolean value) {
        this.keepMessageHistory = value;
        return this;
    }

    /**
     * Whether to compute smoothing probabilities using the {@link ForwardBackwardAlgorithm}
     * for the states of the most likely sequence. Note that this roughly doubles
     * computation time and memory footprint.
     */
    public ViterbiAlgorithmParams setComputeSmoothingProbabilities(boolean value) {
        this.computeSmoothingProbabilities = value;
        return this;
    }

    public boolean isKeepMessageHistory() {
        return keepMessageHistory;
    }

    public boolean isComputeSmoothingProbabilities() {
        return computeSmoothingProbabilities;
    }

}
