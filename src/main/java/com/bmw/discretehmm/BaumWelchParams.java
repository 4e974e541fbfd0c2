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
 * Parameters for {@link BaumWelchAlgorithm}.
 */
public class BaumWelchParams {

    private int maxIterations = 100;
    private double tolerance = 1e-6;

    /**
     * Maximum number of EM iterations. Zero returns the initial model unchanged.
     *
     * @throws IllegalArgumentException if value is negative
     */
    public BaumWelchParams setMaxIterations(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("maxIterations must not be negative: " + value);
        }
        this.maxIterations = value;
        return this;
    }

    /**
     * Estimation stops as soon as the log probability of the observations changes by less
     * than this value between two iterations.
     *
     * @throws IllegalArgumentException if value is negative or NaN
     */
    public BaumWelchParams setTolerance(double value) {
        if (!(value >= 0.0)) {
            throw new IllegalArgumentException("tolerance must not be negative: " + value);
        }
        this.tolerance = value;
        return this;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }

}
