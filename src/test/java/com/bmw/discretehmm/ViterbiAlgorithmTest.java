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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

public class ViterbiAlgorithmTest {

    private static final double DELTA = 1e-9;

    /**
     * Example taken from https://en.wikipedia.org/wiki/Viterbi_algorithm.
     */
    @Test
    public void testComputeMostLikelySequence() {
        final HmmModel model = new HmmModel(Arrays.asList("Healthy", "Fever"),
                Arrays.asList("normal", "cold", "dizzy"),
                new double[] {0.6, 0.4},
                new double[][] {{0.7, 0.3}, {0.4, 0.6}},
                new double[][] {{0.5, 0.4, 0.1}, {0.1, 0.3, 0.6}});

        final MostLikelySequence result = ViterbiAlgorithm.compute(model, new int[] {0, 1, 2});
        assertArrayEquals(new int[] {0, 0, 1}, result.path());
        assertEquals(Math.log(0.01512), result.logProbability(), DELTA);
        assertFalse(result.isBroken());
        assertNull(result.messageHistory());
        assertNull(result.smoothingProbabilities());
    }

    @Test
    public void testSampledSequence() {
        final HmmModel model = HmmFixtures.rainSun();
        final SampledSequence sample = HmmSampler.sample(model, 10, 42);
        final MostLikelySequence result = ViterbiAlgorithm.compute(model, sample.observations());
        assertArrayEquals(new int[] {0, 0, 0, 0, 0, 1, 1, 0, 0, 0}, result.path());
        assertEquals(-12.518223793318642, result.logProbability(), DELTA);
        assertEquals(9, result.countMatches(sample.states()));
    }

    @Test
    public void testLogProbabilityBoundedByLikelihood() {
        final HmmModel model = HmmFixtures.rainSun();
        for (long seed = 0; seed < 20; seed++) {
            final int[] observations = HmmSampler.sample(model, 50, seed).observations();
            final MostLikelySequence result = ViterbiAlgorithm.compute(model, observations);
            assertTrue(result.logProbability()
                    < LikelihoodScorer.logLikelihood(model, observations));
        }
    }

    @Test
    public void testSinglePathModel() {
        // Only one state path has non-zero probability, hence both values agree.
        final HmmModel model = new HmmModel(2, 2, new double[] {1.0, 0.0},
                new double[][] {{0.0, 1.0}, {1.0, 0.0}},
                new double[][] {{0.3, 0.7}, {0.6, 0.4}});
        final int[] observations = {1, 0, 0, 1};
        final MostLikelySequence result = ViterbiAlgorithm.compute(model, observations);
        assertArrayEquals(new int[] {0, 1, 0, 1}, result.path());
        assertEquals(LikelihoodScorer.logLikelihood(model, observations),
                result.logProbability(), DELTA);
    }

    @Test
    public void testTieBreakPrefersLowestIndex() {
        final HmmModel model = new HmmModel(3, 2, new double[] {1.0 / 3, 1.0 / 3, 1.0 / 3},
                new double[][] {{0.5, 0.25, 0.25}, {0.25, 0.5, 0.25}, {0.25, 0.25, 0.5}},
                new double[][] {{0.5, 0.5}, {0.5, 0.5}, {0.5, 0.5}});
        final MostLikelySequence result = ViterbiAlgorithm.compute(model, new int[] {0, 1, 1});
        assertArrayEquals(new int[] {0, 0, 0}, result.path());

        final HmmModel uniform = new HmmModel(2, 1, new double[] {0.5, 0.5},
                new double[][] {{0.5, 0.5}, {0.5, 0.5}}, new double[][] {{1.0}, {1.0}});
        assertArrayEquals(new int[] {0, 0, 0, 0},
                ViterbiAlgorithm.compute(uniform, new int[] {0, 0, 0, 0}).path());
    }

    @Test
    public void testZeroProbabilitiesAreAvoided() {
        // State 0 cannot emit symbol 1.
        final HmmModel model = new HmmModel(2, 2, new double[] {0.9, 0.1},
                new double[][] {{0.9, 0.1}, {0.1, 0.9}},
                new double[][] {{1.0, 0.0}, {0.5, 0.5}});
        final MostLikelySequence result = ViterbiAlgorithm.compute(model, new int[] {0, 1, 0});
        assertEquals(1, result.path()[1]);
        assertFalse(result.isBroken());
    }

    @Test
    public void testBroken() {
        final HmmModel model = new HmmModel(2, 2, new double[] {1.0, 0.0},
                new double[][] {{1.0, 0.0}, {0.5, 0.5}},
                new double[][] {{1.0, 0.0}, {0.0, 1.0}});
        final MostLikelySequence result = ViterbiAlgorithm.compute(model, new int[] {0, 1, 0},
                new ViterbiAlgorithmParams().setComputeSmoothingProbabilities(true));
        assertTrue(result.isBroken());
        assertEquals(Double.NEGATIVE_INFINITY, result.logProbability(), 0.0);
        assertEquals(3, result.path().length);
        assertNull(result.smoothingProbabilities());
    }

    @Test
    public void testMessageHistory() {
        final HmmModel model = HmmFixtures.rainSun();
        final MostLikelySequence result = ViterbiAlgorithm.compute(model, new int[] {0, 2},
                new ViterbiAlgorithmParams().setKeepMessageHistory(true));
        assertEquals(2, result.messageHistory().size());
        assertEquals(Math.log(0.06), result.messageHistory().get(0)[0], DELTA);
        assertEquals(Math.log(0.24), result.messageHistory().get(0)[1], DELTA);
        // max(0.06 * 0.7, 0.24 * 0.4) * 0.5
        assertEquals(Math.log(0.048), result.messageHistory().get(1)[0], DELTA);
        assertTrue(result.messageHistoryString().contains("Time step 1\nRain: "));
    }

    @Test
    public void testMessageHistoryCannotBeModified() {
        final MostLikelySequence result = ViterbiAlgorithm.compute(HmmFixtures.rainSun(),
                new int[] {0, 2}, new ViterbiAlgorithmParams().setKeepMessageHistory(true));
        result.messageHistory().get(0)[0] = 0.0;
        assertEquals(Math.log(0.06), result.messageHistory().get(0)[0], DELTA);
        try {
            result.messageHistory().clear();
            fail();
        } catch (UnsupportedOperationException e) {
            // expected
        }
        assertEquals(2, result.messageHistory().size());
        assertTrue(result.messageHistoryString().contains("Time step 0\nRain: "));
    }

    @Test
    public void testSmoothingProbabilities() {
        final HmmModel model = HmmFixtures.umbrella();
        final MostLikelySequence result = ViterbiAlgorithm.compute(model,
                new int[] {0, 0, 1, 0, 0},
                new ViterbiAlgorithmParams().setComputeSmoothingProbabilities(true));
        assertArrayEquals(new int[] {0, 0, 1, 0, 0}, result.path());
        assertArrayEquals(new double[] {0.8673, 0.8204, 0.6925, 0.8204, 0.8673},
                result.smoothingProbabilities(), 1e-4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptySequence() {
        ViterbiAlgorithm.compute(HmmFixtures.rainSun(), new int[0]);
    }

    @Test(expected = InvalidIndexException.class)
    public void testInvalidObservation() {
        ViterbiAlgorithm.compute(HmmFixtures.rainSun(), new int[] {0, -1});
    }

    @Test(expected = InvalidIndexException.class)
    public void testCountMatchesInvalidState() {
        ViterbiAlgorithm.compute(HmmFixtures.rainSun(), new int[] {0, 1}).countMatches(
                new int[] {0, 2});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCountMatchesLengthMismatch() {
        ViterbiAlgorithm.compute(HmmFixtures.rainSun(), new int[] {0, 1}).countMatches(
                new int[] {0});
    }

}
