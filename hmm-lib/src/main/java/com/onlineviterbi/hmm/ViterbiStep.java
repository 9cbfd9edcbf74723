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

import java.util.*;

/**
 * Result of one {@link OnlineViterbi#step(Object, Map, Map)}: the normalized probability of the
 * most likely path ending in each live state and the most recent tail of that path.
 * <p>
 * Both maps are unmodifiable and have the same key set. Pass them to the next step as they are.
 *
 * @param <S> the state type
 */
public class ViterbiStep<S> {
    private final Map<S, Double> distribution;
    private final Map<S, List<S>> pathTable;
    private final boolean priorReset;

    ViterbiStep(Map<S, Double> distribution, Map<S, List<S>> pathTable, boolean priorReset) {
        this.distribution = Collections.unmodifiableMap(distribution);
        this.pathTable = Collections.unmodifiableMap(pathTable);
        this.priorReset = priorReset;
    }

    public Map<S, Double> getDistribution() {
        return distribution;
    }

    /**
     * Each path is ordered from the oldest to the newest state, i.e. its last element is the key.
     * Paths of states reseeded from the priors are empty.
     */
    public Map<S, List<S>> getPathTable() {
        return pathTable;
    }

    /**
     * Returns true if no state could explain the observation and the distribution was reset to
     * the priors.
     */
    public boolean isPriorReset() {
        return priorReset;
    }

    public boolean isEmpty() {
        return distribution.isEmpty();
    }

    /**
     * Retrieves a state with maximum probability or null if the distribution is empty. On ties
     * the first state in iteration order wins.
     */
    public S mostLikelyState() {
        final Iterator<Map.Entry<S, Double>> entryIter = distribution.entrySet().iterator();
        if (!entryIter.hasNext())
            return null;

        final Map.Entry<S, Double> firstEntry = entryIter.next();
        S result = firstEntry.getKey();
        double maxProbability = firstEntry.getValue();
        while (entryIter.hasNext()) {
            final Map.Entry<S, Double> entry = entryIter.next();
            if (entry.getValue() > maxProbability) {
                maxProbability = entry.getValue();
                result = entry.getKey();
            }
        }
        return result;
    }

    /**
     * Returns the path tail of the {@link #mostLikelyState()} or an empty list.
     */
    public List<S> mostLikelyPath() {
        S state = mostLikelyState();
        if (state == null)
            return Collections.emptyList();
        return pathTable.get(state);
    }

    @Override
    public String toString() {
        return "ViterbiStep [distribution=" + distribution + ", pathTable=" + pathTable
                + ", priorReset=" + priorReset + "]";
    }
}
