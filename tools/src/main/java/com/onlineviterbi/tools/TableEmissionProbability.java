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

package com.onlineviterbi.tools;

import com.onlineviterbi.hmm.EmissionProbability;

import java.util.Collections;
import java.util.Map;

/**
 * Looks up p(observation|state) in a table. Observations without an entry have a probability of 0.
 */
public class TableEmissionProbability implements EmissionProbability<String, String> {
    private final Map<String, Map<String, Double>> table;

    public TableEmissionProbability(Map<String, Map<String, Double>> table) {
        this.table = table;
    }

    @Override
    public double emissionProbability(String state, String observation) {
        Double probability = table.getOrDefault(state, Collections.emptyMap()).get(observation);
        return probability == null ? 0 : probability;
    }
}
