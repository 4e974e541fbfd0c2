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
 * Implementation utilities.
 */
class Utils {

    /**
     * Tolerance for probability vectors that must sum to one.
     */
    static final double DELTA = 1e-6;

    static int initialHashMapCapacity(int maxElements) {
        // Default load factor of HashMaps is 0.75
        return (int)(maxElements / 0.75) + 1;
    }

    /**
     * Note that this check must not be used for probability densities.
     */
    static boolean probabilityInRange(double probability, double delta) {
        return probability >= -delta && probability <= 1.0 + delta;
    }

    static double sum(double[] probabilities) {
        double result = 0.0;
        for (double probability : probabilities) {
            result += probability;
        }
        return result;
    }

    /**
     * Returns the natural logarithm of each entry. Zero probabilities become
     * {@link Double#NEGATIVE_INFINITY}.
     */
    static double[] logProbabilities(double[] probabilities) {
        final double[] result = new double[probabilities.length];
        for (int i = 0; i < probabilities.length; i++) {
            result[i] = Math.log(probabilities[i]);
        }
        return result;
    }

    static double[][] logProbabilities(double[][] probabilities) {
        final double[][] result = new double[probabilities.length][];
        for (int i = 0; i < probabilities.length; i++) {
            result[i] = logProbabilities(probabilities[i]);
        }
        return result;
    }

    static double[][] copy(double[][] matrix) {
        final double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = Arrays.copyOf(matrix[i], matrix[i].length);
        }
        return result;
    }

    static void normalize(double[] values, double sum) {
        for (int i = 0; i < values.length; i++) {
            values[i] /= sum;
        }
    }

}
