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
 * The initial probability of every state. Seeds the first step and is the fallback of the
 * {@link Normalizer} when all probability mass vanished.
 *
 * @param <S> the state type
 */
public class PriorDistribution<S> {
    private static final double SUM_DELTA = 1e-6;
    private final Map<S, Double> probabilities;

    private PriorDistribution(Map<S, Double> probabilities) {
        this.probabilities = Collections.unmodifiableMap(probabilities);
    }

    /**
     * Assigns 1/n to each of the n states of the graph.
     */
    public static <S> PriorDistribution<S> uniform(TransitionGraph<S> graph) {
        double probability = 1.0 / graph.getStateCount();
        Map<S, Double> map = new LinkedHashMap<>(Utils.initialHashMapCapacity(graph.getStateCount()));
        for (S state : graph.getStates()) {
            map.put(state, probability);
        }
        return new PriorDistribution<>(map);
    }

    /**
     * Creates priors from the specified probabilities. States of the graph that are missing in the
     * map have a prior probability of 0 and are not part of the distribution.
     *
     * @throws ConfigurationException if a state is not part of the graph, if a probability is
     *                                not within [0,1] or if the probabilities do not sum to 1
     */
    public static <S> PriorDistribution<S> of(TransitionGraph<S> graph, Map<S, Double> priors) {
        if (priors == null || priors.isEmpty())
            throw new ConfigurationException("Priors must not be empty, use uniform priors instead");

        Map<S, Double> map = new LinkedHashMap<>(Utils.initialHashMapCapacity(priors.size()));
        for (Map.Entry<S, Double> entry : priors.entrySet()) {
            if (!graph.containsState(entry.getKey()))
                throw new ConfigurationException("Prior for state " + entry.getKey() + " which is missing in the graph");
            Double probability = entry.getValue();
            if (probability == null || !Utils.probabilityInRange(probability))
                throw new ConfigurationException("Prior of " + entry.getKey() + " must be in [0,1] but was " + probability);
            map.put(entry.getKey(), probability);
        }
        if (!Utils.sumsToOne(map.values(), SUM_DELTA))
            throw new ConfigurationException("Prior probabilities must sum to 1 but sum to " + Utils.sum(map.values()));
        return new PriorDistribution<>(map);
    }

    public double getProbability(S state) {
        Double probability = probabilities.get(state);
        return probability == null ? 0 : probability;
    }

    /**
     * @return an unmodifiable view, iteration follows the order of creation
     */
    public Map<S, Double> asMap() {
        return probabilities;
    }

    /**
     * @return a new mutable copy of the priors
     */
    public Map<S, Double> copy() {
        return new LinkedHashMap<>(probabilities);
    }

    public int size() {
        return probabilities.size();
    }

    @Override
    public String toString() {
        return probabilities.toString();
    }
}
