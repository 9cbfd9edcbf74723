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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scales a distribution so that its probabilities sum to 1. If there is no probability mass left
 * the {@link PriorDistribution} is returned instead so that decoding never gets stuck.
 *
 * @param <S> the state type
 */
public class Normalizer<S> {
    private final PriorDistribution<S> priors;

    public Normalizer(PriorDistribution<S> priors) {
        this.priors = priors;
    }

    /**
     * Returns true if the specified distribution has a total mass of exactly 0. This includes the
     * empty distribution.
     */
    public boolean isDegenerate(Map<S, Double> distribution) {
        return Utils.sum(distribution.values()) == 0;
    }

    /**
     * Returns a new map with the probabilities of the specified distribution divided by their
     * sum. The input is not modified.
     */
    public Map<S, Double> normalize(Map<S, Double> distribution) {
        double sum = Utils.sum(distribution.values());
        if (sum == 0)
            return priors.copy();

        Map<S, Double> result = new LinkedHashMap<>(Utils.initialHashMapCapacity(distribution.size()));
        for (Map.Entry<S, Double> entry : distribution.entrySet()) {
            result.put(entry.getKey(), entry.getValue() / sum);
        }
        return result;
    }
}
