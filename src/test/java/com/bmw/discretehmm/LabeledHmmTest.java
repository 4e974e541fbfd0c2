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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class LabeledHmmTest {

    private enum Weather {
        RAIN, SUN
    }

    private enum Activity {
        WALK, SHOP, CLEAN
    }

    private static final double DELTA = 1e-12;

    private static LabeledHmm<Weather, Activity> weatherHmm(
            Map<Transition<Weather>, Double> transitionProbabilities) {
        final List<Weather> states = Arrays.asList(Weather.RAIN, Weather.SUN);
        final List<Activity> observations =
                Arrays.asList(Activity.WALK, Activity.SHOP, Activity.CLEAN);

        final Map<Weather, Double> initialProbabilities = new LinkedHashMap<>();
        initialProbabilities.put(Weather.RAIN, 0.6);
        initialProbabilities.put(Weather.SUN, 0.4);

        final Map<Activity, Double> rainEmissions = new LinkedHashMap<>();
        rainEmissions.put(Activity.WALK, 0.1);
        rainEmissions.put(Activity.SHOP, 0.4);
        rainEmissions.put(Activity.CLEAN, 0.5);
        final Map<Activity, Double> sunEmissions = new LinkedHashMap<>();
        sunEmissions.put(Activity.WALK, 0.6);
        sunEmissions.put(Activity.SHOP, 0.3);
        sunEmissions.put(Activity.CLEAN, 0.1);
        final Map<Weather, Map<Activity, Double>> emissionProbabilities = new LinkedHashMap<>();
        emissionProbabilities.put(Weather.RAIN, rainEmissions);
        emissionProbabilities.put(Weather.SUN, sunEmissions);

        return new LabeledHmm<>(states, observations, initialProbabilities,
                transitionProbabilities, emissionProbabilities);
    }

    private static Map<Transition<Weather>, Double> weatherTransitions() {
        final Map<Transition<Weather>, Double> result = new LinkedHashMap<>();
        result.put(new Transition<>(Weather.RAIN, Weather.RAIN), 0.7);
        result.put(new Transition<>(Weather.RAIN, Weather.SUN), 0.3);
        result.put(new Transition<>(Weather.SUN, Weather.RAIN), 0.4);
        result.put(new Transition<>(Weather.SUN, Weather.SUN), 0.6);
        return result;
    }

    @Test
    public void testMapsParametersToDenseModel() {
        final LabeledHmm<Weather, Activity> hmm = weatherHmm(weatherTransitions());
        final HmmModel model = hmm.model();
        final HmmModel expected = HmmFixtures.rainSun();

        assertArrayEquals(expected.getInitialProbabilities(), model.getInitialProbabilities(),
                DELTA);
        for (int i = 0; i < 2; i++) {
            assertArrayEquals(expected.getTransitionProbabilities()[i],
                    model.getTransitionProbabilities()[i], DELTA);
            assertArrayEquals(expected.getEmissionProbabilities()[i],
                    model.getEmissionProbabilities()[i], DELTA);
        }
        assertEquals(Arrays.asList("RAIN", "SUN"), model.getStateLabels());
        assertEquals(Arrays.asList("WALK", "SHOP", "CLEAN"), model.getSymbolLabels());
    }

    @Test
    public void testEncodeAndDecode() {
        final LabeledHmm<Weather, Activity> hmm = weatherHmm(weatherTransitions());
        final int[] symbols = hmm.encode(Arrays.asList(Activity.CLEAN, Activity.WALK));
        assertArrayEquals(new int[] {2, 0}, symbols);
        assertEquals(Arrays.asList(Activity.CLEAN, Activity.WALK),
                hmm.decodeObservations(symbols));
        assertEquals(Arrays.asList(Weather.SUN, Weather.RAIN, Weather.SUN),
                hmm.decodeStates(new int[] {1, 0, 1}));
        assertEquals(Weather.SUN, hmm.state(1));
        assertEquals(1, hmm.stateIndex(Weather.SUN));
    }

    @Test
    public void testTransitionEquality() {
        assertEquals(new Transition<>(Weather.RAIN, Weather.SUN),
                new Transition<>(Weather.RAIN, Weather.SUN));
        assertEquals(new Transition<>(Weather.RAIN, Weather.SUN).hashCode(),
                new Transition<>(Weather.RAIN, Weather.SUN).hashCode());
        assertNotEquals(new Transition<>(Weather.RAIN, Weather.SUN),
                new Transition<>(Weather.SUN, Weather.RAIN));
        assertNotEquals(new Transition<>(Weather.RAIN, Weather.SUN),
                new Transition<>("RAIN", "SUN"));
        assertNotEquals(new Transition<>(Weather.RAIN, null),
                new Transition<>(Weather.RAIN, Weather.SUN));
    }

    @Test
    public void testStatesWithEqualStringRepresentations() {
        final List<Object> states = Arrays.<Object>asList(1, "1");
        final Map<Object, Double> initialProbabilities = new LinkedHashMap<>();
        initialProbabilities.put(1, 0.5);
        initialProbabilities.put("1", 0.5);
        final Map<Transition<Object>, Double> transitionProbabilities = new LinkedHashMap<>();
        transitionProbabilities.put(new Transition<Object>(1, "1"), 1.0);
        transitionProbabilities.put(new Transition<Object>("1", 1), 1.0);
        final Map<Object, Map<String, Double>> emissionProbabilities = new LinkedHashMap<>();
        emissionProbabilities.put(1, singleton("x", 1.0));
        emissionProbabilities.put("1", singleton("x", 1.0));

        final LabeledHmm<Object, String> hmm = new LabeledHmm<>(states, Arrays.asList("x"),
                initialProbabilities, transitionProbabilities, emissionProbabilities);
        assertEquals(Arrays.asList("1", "1#1"), hmm.model().getStateLabels());
        assertEquals(0, hmm.stateIndex(1));
        assertEquals(1, hmm.stateIndex("1"));
        assertEquals(1.0, hmm.model().transitionProbability(0, 1), DELTA);
    }

    @Test
    public void testDisplayLabelsAreUnique() {
        assertEquals(Arrays.asList("1", "1#2", "1#1"),
                LabeledHmm.labels(Arrays.<Object>asList(1, "1", "1#1")));
        assertEquals(Arrays.asList("a", "b"), LabeledHmm.labels(Arrays.asList("a", "b")));
    }

    @Test
    public void testMissingTransitionIsZero() {
        final Map<Transition<Weather>, Double> transitions = new LinkedHashMap<>();
        transitions.put(new Transition<>(Weather.RAIN, Weather.RAIN), 1.0);
        transitions.put(new Transition<>(Weather.SUN, Weather.SUN), 1.0);
        final HmmModel model = weatherHmm(transitions).model();
        assertEquals(0.0, model.transitionProbability(0, 1), DELTA);
        assertEquals(0.0, model.transitionProbability(1, 0), DELTA);
    }

    @Test
    public void testIncompleteTransitionRowIsRejected() {
        final Map<Transition<Weather>, Double> transitions = weatherTransitions();
        transitions.remove(new Transition<>(Weather.SUN, Weather.SUN));
        try {
            weatherHmm(transitions);
            fail();
        } catch (ModelValidationException e) {
            assertEquals("transition row 1", e.getRowName());
            assertEquals(0.4, e.getSum(), DELTA);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownObservation() {
        final LabeledHmm<String, String> hmm = new LabeledHmm<>(Arrays.asList("a"),
                Arrays.asList("x"), singleton("a", 1.0),
                singleton(new Transition<>("a", "a"), 1.0),
                singleton("a", singleton("x", 1.0)));
        hmm.encode(Arrays.asList("x", "y"));
    }

    @Test(expected = NullPointerException.class)
    public void testMissingInitialProbability() {
        new LabeledHmm<>(Arrays.asList("a", "b"), Arrays.asList("x"), singleton("a", 1.0),
                singleton(new Transition<>("a", "a"), 1.0),
                singleton("a", singleton("x", 1.0)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateState() {
        new LabeledHmm<>(Arrays.asList("a", "a"), Arrays.asList("x"), singleton("a", 1.0),
                singleton(new Transition<>("a", "a"), 1.0),
                singleton("a", singleton("x", 1.0)));
    }

    @Test
    public void testWithFittedModel() {
        final LabeledHmm<Weather, Activity> hmm = weatherHmm(weatherTransitions());
        final List<Activity> activities = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            activities.add(Activity.WALK);
            activities.add(Activity.CLEAN);
        }
        final BaumWelchResult result = BaumWelchAlgorithm.fit(hmm.model(),
                hmm.encode(activities), 50, 1e-6);
        final LabeledHmm<Weather, Activity> fitted = hmm.withModel(result.model());
        assertEquals(hmm.states(), fitted.states());
        assertEquals(result.model(), fitted.model());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWithModelOfOtherShape() {
        weatherHmm(weatherTransitions()).withModel(new HmmModel(1, 3, new double[] {1.0},
                new double[][] {{1.0}}, new double[][] {{0.2, 0.3, 0.5}}));
    }

    private static <K, V> Map<K, V> singleton(K key, V value) {
        final Map<K, V> result = new LinkedHashMap<>();
        result.put(key, value);
        return result;
    }

}
