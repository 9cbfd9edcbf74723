/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package com.onlineviterbi.hmm;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class OnlineViterbiTest {

    private static final double DELTA = 1e-12;

    private static TransitionGraph<String> twoStateGraph() {
        return TransitionGraph.<String>builder().
                addTransition("A", "A", 0.9).addTransition("A", "B", 0.1).
                addTransition("B", "A", 0.1).addTransition("B", "B", 0.9).
                build();
    }

    private static final EmissionProbability<String, String> FAVOR_B = (state, observation) -> state.equals("A") ? 0.1 : 0.9;

    /**
     * s1 -> s2 -> s3 -> s4 where observation "i" is only explained by state "si".
     */
    private static TransitionGraph<String> chainGraph() {
        return TransitionGraph.<String>builder().
                addTransition("s1", "s2", 1).addTransition("s2", "s3", 1).addTransition("s3", "s4", 1).
                addState("s4").
                build();
    }

    private static final EmissionProbability<String, String> CHAIN_EMISSION = (state, observation) -> state.equals("s" + observation) ? 1 : 0;

    private static <S> Map<S, List<S>> paths(Object... keysAndPaths) {
        Map<S, List<S>> result = new LinkedHashMap<>();
        for (int i = 0; i < keysAndPaths.length; i += 2) {
            @SuppressWarnings("unchecked")
            S key = (S) keysAndPaths[i];
            @SuppressWarnings("unchecked")
            List<S> path = (List<S>) keysAndPaths[i + 1];
            result.put(key, path);
        }
        return result;
    }

    @Test
    public void testFirstStepFavorsStateWithHigherEmission() {
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(twoStateGraph(), FAVOR_B);
        ViterbiStep<String> step = viterbi.step("x", null, new HashMap<>());

        Map<String, Double> v = step.getDistribution();
        assertTrue(v.get("B") > v.get("A"));
        assertEquals(0.1, v.get("A"), DELTA);
        assertEquals(0.9, v.get("B"), DELTA);
        assertEquals(Arrays.asList("B"), step.getPathTable().get("B"));
        assertEquals(Arrays.asList("A"), step.getPathTable().get("A"));
        assertFalse(step.isPriorReset());
        assertEquals("B", step.mostLikelyState());
    }

    @Test
    public void testWindowKeepsMostRecentStates() {
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(chainGraph(), CHAIN_EMISSION,
                new OnlineViterbiParams<String, String>().setConstraintLength(2));
        ViterbiStep<String> step = viterbi.step("2", null);
        assertEquals(Arrays.asList("s2"), step.getPathTable().get("s2"));
        step = viterbi.step("3", step);
        assertEquals(Arrays.asList("s2", "s3"), step.getPathTable().get("s3"));
        step = viterbi.step("4", step);
        assertEquals(Arrays.asList("s3", "s4"), step.getPathTable().get("s4"));
        assertEquals(Collections.singleton("s4"), step.getDistribution().keySet());
        assertEquals(1.0, step.getDistribution().get("s4"), DELTA);
    }

    @Test
    public void testWindowWhenStayingInSameState() {
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(twoStateGraph(), FAVOR_B,
                new OnlineViterbiParams<String, String>().setConstraintLength(2));
        ViterbiStep<String> step = null;
        for (int i = 0; i < 3; i++) {
            step = viterbi.step("x", step);
        }
        assertEquals(Arrays.asList("B", "B"), step.getPathTable().get("B"));
        for (List<String> path : step.getPathTable().values()) {
            assertTrue(path.size() <= 2);
        }
    }

    @Test
    public void testZeroConstraintLengthKeepsEmptyPaths() {
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(twoStateGraph(), FAVOR_B,
                new OnlineViterbiParams<String, String>().setConstraintLength(0));
        ViterbiStep<String> step = viterbi.step("x", viterbi.step("x", null));
        assertEquals(step.getDistribution().keySet(), step.getPathTable().keySet());
        for (List<String> path : step.getPathTable().values()) {
            assertTrue(path.isEmpty());
        }
    }

    @Test
    public void testEmptyCandidatesResetToPriors() {
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(twoStateGraph(), FAVOR_B,
                new OnlineViterbiParams<String, String>().setCandidateStates(observation -> Collections.emptyList()));
        ViterbiStep<String> previous = new OnlineViterbi<>(twoStateGraph(), FAVOR_B).step("x", null);
        ViterbiStep<String> step = viterbi.step("x", previous);

        assertEquals(viterbi.getPriors().asMap(), step.getDistribution());
        assertEquals(paths("A", Collections.emptyList(), "B", Collections.emptyList()), step.getPathTable());
        assertTrue(step.isPriorReset());
    }

    @Test
    public void testZeroEmissionsResetToPriors() {
        Map<String, Double> priors = new LinkedHashMap<>();
        priors.put("A", 0.25);
        priors.put("B", 0.75);
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(twoStateGraph(), (state, observation) -> 0.0,
                new OnlineViterbiParams<String, String>().setPriors(priors));
        ViterbiStep<String> step = viterbi.step("x", null);

        assertEquals(priors, step.getDistribution());
        assertEquals(step.getDistribution().keySet(), step.getPathTable().keySet());
        assertTrue(step.isPriorReset());
    }

    @Test
    public void testCandidateWithoutPredecessorsGetsNoScore() {
        TransitionGraph<String> graph = TransitionGraph.<String>builder().
                addTransition("A", "A", 1).addState("orphan").build();
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(graph, (state, observation) -> 1.0);
        ViterbiStep<String> step = viterbi.step("x", null);
        assertEquals(Collections.singleton("A"), step.getDistribution().keySet());
        assertEquals(1.0, step.getDistribution().get("A"), DELTA);

        // unknown candidates behave like states without predecessors
        viterbi = new OnlineViterbi<>(graph, (state, observation) -> 1.0,
                new OnlineViterbiParams<String, String>().setCandidateStates(observation -> Arrays.asList("unknown")));
        assertTrue(viterbi.step("x", null).isPriorReset());
    }

    @Test
    public void testPruningFloor() {
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(twoStateGraph(), FAVOR_B,
                new OnlineViterbiParams<String, String>().setSmallProbabilityFloor(0.2));
        ViterbiStep<String> step = viterbi.step("x", null);

        assertEquals(Collections.singleton("B"), step.getDistribution().keySet());
        assertEquals(Collections.singleton("B"), step.getPathTable().keySet());
        // pruned mass is not redistributed
        assertEquals(0.9, step.getDistribution().get("B"), DELTA);
    }

    @Test
    public void testSharedPredecessorExtendsPathFromBeforeTheStep() {
        TransitionGraph<String> graph = TransitionGraph.<String>builder().
                addTransition("P", "X", 0.5).addTransition("P", "Y", 0.5).
                addTransition("Q", "X", 0.1).addTransition("Q", "Y", 0.1).
                addState("X").addState("Y").build();
        EmissionProbability<String, String> emission = (state, observation) -> state.equals("X") || state.equals("Y") ? 1 : 0;
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(graph, emission,
                new OnlineViterbiParams<String, String>().setConstraintLength(3));

        Map<String, Double> distribution = new LinkedHashMap<>();
        distribution.put("P", 0.6);
        distribution.put("Q", 0.4);
        Map<String, List<String>> pathTable = paths("P", Arrays.asList("Q", "Q", "P"), "Q", Arrays.asList("Q", "Q", "Q"));
        Map<String, Double> distributionCopy = new LinkedHashMap<>(distribution);
        Map<String, List<String>> pathTableCopy = new LinkedHashMap<>(pathTable);

        ViterbiStep<String> step = viterbi.step("o", Collections.unmodifiableMap(distribution), Collections.unmodifiableMap(pathTable));
        assertEquals(Arrays.asList("Q", "P", "X"), step.getPathTable().get("X"));
        assertEquals(Arrays.asList("Q", "P", "Y"), step.getPathTable().get("Y"));
        assertEquals(0.5, step.getDistribution().get("X"), DELTA);
        assertEquals(0.5, step.getDistribution().get("Y"), DELTA);

        // the snapshot of the caller is untouched
        assertEquals(distributionCopy, distribution);
        assertEquals(pathTableCopy, pathTable);
        assertEquals(Arrays.asList("Q", "Q", "P"), pathTable.get("P"));
    }

    @Test
    public void testTieGoesToFirstPredecessorInIterationOrder() {
        TransitionGraph<String> graph = TransitionGraph.<String>builder().
                addTransition("A", "C", 0.5).addTransition("B", "C", 0.5).
                addState("C").addState("D").build();
        EmissionProbability<String, String> emission = (state, observation) -> state.equals("C") ? 1 : 0;
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(graph, emission,
                new OnlineViterbiParams<String, String>().setConstraintLength(3));
        Map<String, List<String>> pathTable = paths("A", Arrays.asList("A"), "B", Arrays.asList("B"), "D", Arrays.asList("D"));

        // predecessors and distribution have the same size: the distribution is iterated
        Map<String, Double> distribution = new LinkedHashMap<>();
        distribution.put("B", 0.5);
        distribution.put("A", 0.5);
        assertEquals(Arrays.asList("B", "C"), viterbi.step("o", distribution, pathTable).getPathTable().get("C"));

        distribution = new LinkedHashMap<>();
        distribution.put("A", 0.5);
        distribution.put("B", 0.5);
        assertEquals(Arrays.asList("A", "C"), viterbi.step("o", distribution, pathTable).getPathTable().get("C"));

        // fewer predecessors than states in the distribution: predecessors are iterated in graph order
        distribution = new LinkedHashMap<>();
        distribution.put("B", 0.4);
        distribution.put("D", 0.2);
        distribution.put("A", 0.4);
        assertEquals(Arrays.asList("A", "C"), viterbi.step("o", distribution, pathTable).getPathTable().get("C"));
    }

    @Test
    public void testPredecessorsWithoutMassAreIgnored() {
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(twoStateGraph(), FAVOR_B);
        Map<String, Double> distribution = new LinkedHashMap<>();
        distribution.put("A", 1.0);
        distribution.put("B", 0.0);
        ViterbiStep<String> step = viterbi.step("x", distribution, null);
        assertEquals(Arrays.asList("A", "B"), new ArrayList<>(step.getPathTable().keySet()));
        // both states are reached from A
        assertEquals(Arrays.asList("B"), step.getPathTable().get("B"));
        assertEquals(0.09 / 0.18, step.getDistribution().get("B"), DELTA);
    }

    @Test
    public void testDistributionAndPathTableHaveSameStates() {
        // a distribution entry without a path entry starts a new path
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(twoStateGraph(), FAVOR_B);
        Map<String, Double> distribution = new LinkedHashMap<>();
        distribution.put("A", 0.5);
        distribution.put("B", 0.5);
        ViterbiStep<String> step = viterbi.step("x", distribution, paths("A", Arrays.asList("A")));
        assertEquals(step.getDistribution().keySet(), step.getPathTable().keySet());
        assertEquals(Arrays.asList("A", "A"), step.getPathTable().get("A"));
        assertEquals(Arrays.asList("B"), step.getPathTable().get("B"));
    }

    @Test
    public void testInvariantsAndDeterminismOnRandomGraph() {
        TransitionGraph<Integer> graph = randomGraph(new Random(42), 40);
        EmissionProbability<Integer, Integer> emission = (state, observation) -> ((state * 31 + observation) % 7) / 7.0;
        CandidateStates<Integer, Integer> candidates = observation -> {
            List<Integer> list = new ArrayList<>();
            for (int i = observation % 5; i < 40; i += 3) {
                list.add(i);
            }
            return list;
        };
        OnlineViterbiParams<Integer, Integer> params = new OnlineViterbiParams<Integer, Integer>().
                setConstraintLength(4).setSmallProbabilityFloor(1e-3).setCandidateStates(candidates);
        OnlineViterbi<Integer, Integer> viterbi1 = new OnlineViterbi<>(graph, emission, params);
        OnlineViterbi<Integer, Integer> viterbi2 = new OnlineViterbi<>(graph, emission, params);

        Random observations = new Random(7);
        ViterbiStep<Integer> step1 = null;
        ViterbiStep<Integer> step2 = null;
        for (int i = 0; i < 100; i++) {
            int observation = observations.nextInt(50);
            step1 = viterbi1.step(observation, step1);
            step2 = viterbi2.step(observation, step2);

            assertEquals(step1.getDistribution(), step2.getDistribution());
            assertEquals(step1.getPathTable(), step2.getPathTable());
            assertEquals(step1.getDistribution().keySet(), step1.getPathTable().keySet());
            double sum = 0;
            for (Map.Entry<Integer, Double> entry : step1.getDistribution().entrySet()) {
                assertTrue(entry.getValue() >= 1e-3, "pruned state " + entry);
                sum += entry.getValue();
            }
            assertTrue(sum <= 1 + 1e-9);
            for (Map.Entry<Integer, List<Integer>> entry : step1.getPathTable().entrySet()) {
                List<Integer> path = entry.getValue();
                assertTrue(path.size() <= 4);
                if (!step1.isPriorReset())
                    assertEquals(entry.getKey(), path.get(path.size() - 1));
            }
        }
    }

    private static TransitionGraph<Integer> randomGraph(Random random, int states) {
        TransitionGraph.Builder<Integer> builder = TransitionGraph.builder();
        for (int i = 0; i < states; i++) {
            builder.addState(i);
        }
        for (int from = 0; from < states; from++) {
            Set<Integer> targets = new LinkedHashSet<>();
            targets.add(from);
            for (int j = 0; j < 3; j++) {
                targets.add(random.nextInt(states));
            }
            for (int to : targets) {
                builder.addTransition(from, to, 1.0 / targets.size());
            }
        }
        return builder.build();
    }

    @Test
    public void testInvalidEmissionProbability() {
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(twoStateGraph(), (state, observation) -> 1.5);
        assertThrows(IllegalStateException.class, () -> viterbi.step("x", null));

        OnlineViterbi<String, String> nanViterbi = new OnlineViterbi<>(twoStateGraph(), (state, observation) -> Double.NaN);
        assertThrows(IllegalStateException.class, () -> nanViterbi.step("x", null));

        OnlineViterbi<String, String> negativeViterbi = new OnlineViterbi<>(twoStateGraph(), (state, observation) -> -0.1);
        assertThrows(IllegalStateException.class, () -> negativeViterbi.step("x", null));
    }

    @Test
    public void testInvalidCandidates() {
        OnlineViterbi<String, String> nullViterbi = new OnlineViterbi<>(twoStateGraph(), FAVOR_B,
                new OnlineViterbiParams<String, String>().setCandidateStates(observation -> null));
        assertThrows(IllegalStateException.class, () -> nullViterbi.step("x", null));

        OnlineViterbi<String, String> nullStateViterbi = new OnlineViterbi<>(twoStateGraph(), FAVOR_B,
                new OnlineViterbiParams<String, String>().setCandidateStates(observation -> Arrays.asList("A", null)));
        assertThrows(IllegalStateException.class, () -> nullStateViterbi.step("x", null));
    }

    @Test
    public void testDuplicateCandidatesAreScoredOnce() {
        List<String> calls = new ArrayList<>();
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(twoStateGraph(), (state, observation) -> {
            calls.add(state);
            return 0.5;
        }, new OnlineViterbiParams<String, String>().setCandidateStates(observation -> Arrays.asList("B", "A", "B")));
        ViterbiStep<String> step = viterbi.step("x", null);
        assertEquals(Arrays.asList("B", "A"), calls);
        assertEquals(Arrays.asList("B", "A"), new ArrayList<>(step.getDistribution().keySet()));
    }

    @Test
    public void testNullObservation() {
        OnlineViterbi<String, String> viterbi = new OnlineViterbi<>(twoStateGraph(), FAVOR_B);
        assertThrows(NullPointerException.class, () -> viterbi.step(null, null));
    }

    @Test
    public void testResultIsUnmodifiable() {
        ViterbiStep<String> step = new OnlineViterbi<>(twoStateGraph(), FAVOR_B).step("x", null);
        assertThrows(UnsupportedOperationException.class, () -> step.getDistribution().put("A", 1.0));
        assertThrows(UnsupportedOperationException.class, () -> step.getPathTable().get("A").add("B"));
    }

    @Test
    public void testPriorsMustFitToGraph() {
        Map<String, Double> priors = new HashMap<>();
        priors.put("unknown", 1.0);
        assertThrows(ConfigurationException.class, () -> new OnlineViterbi<>(twoStateGraph(), FAVOR_B,
                new OnlineViterbiParams<String, String>().setPriors(priors)));
    }
}
