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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-estimates the parameters of an {@link HmmModel} from one observation sequence with the
 * Baum-Welch algorithm, i.e. expectation-maximization based on the
 * {@link ForwardBackwardAlgorithm}.
 *
 * <p>Each iteration computes the smoothing probabilities gamma_t(i) and the transition
 * posteriors xi_t(i, j) under the current model (E-step) and sets
 * <pre>
 * pi'(i)   = gamma_0(i)
 * A'(i, j) = sum_t xi_t(i, j) / sum_t sum_j xi_t(i, j)       (t = 0, ..., T-2)
 * B'(i, k) = sum_{t: o_t = k} gamma_t(i) / sum_t gamma_t(i)  (t = 0, ..., T-1)
 * </pre>
 * (M-step). A row whose denominator is zero is kept from the previous model.
 * The log probability of the observations does not decrease from one iteration to the next.
 */
public final class BaumWelchAlgorithm {

    private static final Logger logger = LoggerFactory.getLogger(BaumWelchAlgorithm.class);

    /**
     * Rows of states with a lower expected number of visits are not re-estimated.
     */
    private static final double MIN_OCCUPANCY = 1e-300;

    /**
     * Relative rounding tolerance for the log likelihood between iterations.
     */
    private static final double MONOTONICITY_DELTA = 1e-9;

    private BaumWelchAlgorithm() {
    }

    /**
     * @see #fit(HmmModel, int[], BaumWelchParams)
     */
    public static BaumWelchResult fit(HmmModel initialModel, int[] observations,
            int maxIterations, double tolerance) {
        return fit(initialModel, observations,
                new BaumWelchParams().setMaxIterations(maxIterations).setTolerance(tolerance));
    }

    /**
     * Iterates until the log probability of the observations changes by less than
     * {@link BaumWelchParams#getTolerance()} or until {@link BaumWelchParams#getMaxIterations()}
     * is reached. The latter is reported by {@link BaumWelchResult#isConverged()}.
     *
     * <p>If the observations have zero probability under the initial model, the initial model
     * is returned without iterations.
     *
     * @param initialModel Starting point of the estimation, also defines the number of states
     * and symbols. Is not modified.
     *
     * @throws IllegalArgumentException if the observation sequence is empty
     *
     * @throws InvalidIndexException if any observation is outside of [0, M)
     */
    public static BaumWelchResult fit(HmmModel initialModel, int[] observations,
            BaumWelchParams params) {
        Objects.requireNonNull(initialModel, "initialModel must not be null.");
        Objects.requireNonNull(params, "params must not be null.");
        initialModel.checkObservations(observations);
        if (observations.length == 0) {
            throw new IllegalArgumentException("Cannot estimate from an empty observation "
                    + "sequence.");
        }

        final List<Double> logLikelihoodHistory = new ArrayList<>();
        HmmModel model = initialModel;
        boolean converged = false;
        int iterations = 0;
        while (iterations < params.getMaxIterations()) {
            final ForwardBackwardAlgorithm fb = ForwardBackwardAlgorithm.compute(model,
                    observations);
            if (fb.isBroken()) {
                logger.warn("Observations have zero probability under the model of "
                        + "iteration {}, stopping estimation.", iterations);
                break;
            }

            final double logLikelihood = fb.observationLogProbability();
            logger.debug("Iteration {}: log likelihood {}", iterations + 1, logLikelihood);
            if (!logLikelihoodHistory.isEmpty()) {
                final double previous = logLikelihoodHistory.get(logLikelihoodHistory.size() - 1);
                assert logLikelihood - previous >= -MONOTONICITY_DELTA * Math.max(1.0,
                        Math.abs(previous)) : "Log likelihood decreased from " + previous
                        + " to " + logLikelihood;
                converged = Math.abs(logLikelihood - previous) < params.getTolerance();
            }
            logLikelihoodHistory.add(logLikelihood);

            model = reestimate(model, observations, fb);
            iterations++;
            if (converged) {
                break;
            }
        }

        final double logLikelihood = LikelihoodScorer.logLikelihood(model, observations);
        if (converged) {
            logger.info("Baum-Welch converged after {} iterations with log likelihood {}",
                    iterations, logLikelihood);
        } else {
            logger.warn("Baum-Welch did not converge after {} iterations, log likelihood {}",
                    iterations, logLikelihood);
        }
        return new BaumWelchResult(model, iterations, converged,
                Collections.unmodifiableList(logLikelihoodHistory), logLikelihood);
    }

    /**
     * M-step.
     */
    private static HmmModel reestimate(HmmModel model, int[] observations,
            ForwardBackwardAlgorithm fb) {
        final int k = model.numberOfStates();
        final int m = model.numberOfSymbols();
        final double[][] gamma = fb.computeSmoothingProbabilities();
        final double[][][] xi = fb.computeTransitionPosteriors();

        final double[] initialProbabilities = gamma[0].clone();

        final double[][] transitionProbabilities = model.getTransitionProbabilities();
        for (int i = 0; i < k; i++) {
            final double[] expectedTransitions = new double[k];
            double denominator = 0.0;
            for (double[][] xiT : xi) {
                for (int j = 0; j < k; j++) {
                    expectedTransitions[j] += xiT[i][j];
                    denominator += xiT[i][j];
                }
            }
            if (denominator < MIN_OCCUPANCY) {
                continue; // Keep the row of the previous model.
            }
            for (int j = 0; j < k; j++) {
                transitionProbabilities[i][j] =
                        Math.min(1.0, expectedTransitions[j] / denominator);
            }
        }

        final double[][] emissionProbabilities = model.getEmissionProbabilities();
        for (int i = 0; i < k; i++) {
            final double[] expectedEmissions = new double[m];
            double denominator = 0.0;
            for (int t = 0; t < observations.length; t++) {
                expectedEmissions[observations[t]] += gamma[t][i];
                denominator += gamma[t][i];
            }
            if (denominator < MIN_OCCUPANCY) {
                continue; // Keep the row of the previous model.
            }
            for (int o = 0; o < m; o++) {
                emissionProbabilities[i][o] = Math.min(1.0, expectedEmissions[o] / denominator);
            }
        }

        return model.withParameters(initialProbabilities, transitionProbabilities,
                emissionProbabilities);
    }

}
