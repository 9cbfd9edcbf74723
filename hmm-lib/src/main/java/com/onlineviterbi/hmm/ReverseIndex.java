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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The inverted adjacency list of a {@link TransitionGraph}: for every state the predecessors and
 * the probability of the transition from the predecessor, i.e.
 * {@code predecessors(to).get(from) == graph.getProbability(from, to)}.
 * <p>
 * The index is built in a single pass and never modified afterwards. Iteration order of the
 * predecessors follows the declaration order of the source states in the graph, which keeps the
 * tie-break of {@link OnlineViterbi} deterministic.
 *
 * @param <S> the state type
 */
public class ReverseIndex<S> {
    private final Map<S, Map<S, Double>> incoming;

    private ReverseIndex(Map<S, Map<S, Double>> incoming) {
        this.incoming = incoming;
    }

    static <S> ReverseIndex<S> of(TransitionGraph<S> graph) {
        Map<S, Map<S, Double>> tmp = new LinkedHashMap<>(Utils.initialHashMapCapacity(graph.getStateCount()));
        for (S fromState : graph.getStates()) {
            for (Transition<S> transition : graph.getTransitions(fromState)) {
                tmp.computeIfAbsent(transition.toState, k -> new LinkedHashMap<>()).put(fromState, transition.probability);
            }
        }

        Map<S, Map<S, Double>> result = new LinkedHashMap<>(Utils.initialHashMapCapacity(tmp.size()));
        for (Map.Entry<S, Map<S, Double>> entry : tmp.entrySet()) {
            result.put(entry.getKey(), Collections.unmodifiableMap(entry.getValue()));
        }
        return new ReverseIndex<>(Collections.unmodifiableMap(result));
    }

    /**
     * Returns the predecessors of the specified state mapped to the transition probability or an
     * empty map if the state has no incoming transitions or is unknown.
     */
    public Map<S, Double> predecessors(S toState) {
        Map<S, Double> map = incoming.get(toState);
        return map == null ? Collections.emptyMap() : map;
    }

    /**
     * @return the number of states with at least one incoming transition
     */
    public int size() {
        return incoming.size();
    }
}
