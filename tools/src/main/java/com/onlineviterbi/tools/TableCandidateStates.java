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

import com.onlineviterbi.hmm.CandidateStates;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Looks up the candidate states of an observation in a table and falls back to the specified
 * default states for observations without an entry.
 */
public class TableCandidateStates implements CandidateStates<String, String> {
    private final Map<String, List<String>> table;
    private final Collection<String> defaultStates;

    public TableCandidateStates(Map<String, List<String>> table, Collection<String> defaultStates) {
        this.table = table;
        this.defaultStates = defaultStates;
    }

    @Override
    public Collection<String> candidates(String observation) {
        List<String> states = table.get(observation);
        return states == null ? defaultStates : states;
    }
}
