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

import java.util.List;

/**
 * Outcome of {@link BaumWelchAlgorithm#fit(HmmModel, int[], BaumWelchParams)}.
 */
public final class BaumWelchResult {

    private final HmmModel model;
    private final int iterations;
    private final boolean converged;
    private final List<Double> logLikelihoodHistory;
    private final double logLikelihood;

    BaumWelchResult(HmmModel model, int iterations, boolean converged,
            List<Double> logLikelihoodHistory, double logLikelihood) {
        this.model = model;
        this.iterations = iterations;
        this.converged = converged;
        this.logLikelihoodHistory = logLikelihoodHistory;
        this.logLikelihood = logLikelihood;
    }

    /**
     * The estimated model. This is a new instance, the initial model is not modified.
     */
    public HmmModel model() {
        return model;
    }

    /**
     * Number of re-estimation steps that were performed.
     */
    public int iterations() {
        return iterations;
    }

    /**
     * Whether the tolerance was met before the maximum number of iterations was reached.
     */
    public boolean isConverged() {
        return converged;
    }

    /**
     * Log probability of the observations under the model of each iteration before its
     * re-estimation step. Does not decrease from one iteration to the next.
     */
    public List<Double> logLikelihoodHistory() {
        return logLikelihoodHistory;
    }

    /**
     * Log probability of the observations under {@link #model()}.
     */
    public double logLikelihood() {
        return logLikelihood;
    }

    @Override
    public String toString() {
        return "BaumWelchResult [iterations=" + iterations + ", converged=" + converged
                + ", logLikelihood=" + logLikelihood + ", model=" + model + "]";
    }

}
