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
 * Thrown when HMM parameters violate the dimensions or the probability constraints of an
 * {@link HmmModel}. Parameters are never clamped or renormalized; the caller has to fix them.
 */
public class ModelValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String rowName;
    private final double sum;

    public ModelValidationException(String rowName, String message) {
        this(rowName, Double.NaN, message);
    }

    public ModelValidationException(String rowName, double sum, String message) {
        super(message);
        this.rowName = rowName;
        this.sum = sum;
    }

    /**
     * Name of the offending vector or row, e.g. "transition row 1".
     */
    public String getRowName() {
        return rowName;
    }

    /**
     * Sum of the offending row or {@link Double#NaN} if the problem is not a sum violation.
     */
    public double getSum() {
        return sum;
    }

    /**
     * Deviation of the row sum from 1.
     */
    public double getDeviation() {
        return sum - 1.0;
    }

}
