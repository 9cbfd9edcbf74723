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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The content of a model file. Keys are snake_case, e.g.
 * <pre>
 * states: [rain, sun]
 * transitions:
 *   rain: [{to: rain, probability: 0.7}, {to: sun, probability: 0.3}]
 *   sun: [{to: rain, probability: 0.3}, {to: sun, probability: 0.7}]
 * emissions:
 *   rain: {umbrella: 0.9, no_umbrella: 0.1}
 *   sun: {umbrella: 0.2, no_umbrella: 0.8}
 * constraint_length: 5
 * </pre>
 * All entries except transitions and emissions are optional.
 */
public class HmmModel {

    public static class TransitionEntry {
        private String to;
        private double probability;

        public TransitionEntry() {
        }

        public TransitionEntry(String to, double probability) {
            this.to = to;
            this.probability = probability;
        }

        public String getTo() {
            return to;
        }

        public void setTo(String to) {
            this.to = to;
        }

        public double getProbability() {
            return probability;
        }

        public void setProbability(double probability) {
            this.probability = probability;
        }
    }

    private List<String> states = new ArrayList<>();
    private Map<String, List<TransitionEntry>> transitions = new LinkedHashMap<>();
    private Map<String, Double> priors;
    private Map<String, Map<String, Double>> emissions = new LinkedHashMap<>();
    private Map<String, List<String>> candidates;
    private Integer constraintLength;
    private Double smallProbabilityFloor;

    /**
     * States in declaration order. States that only appear as a key of the transitions do not
     * need to be listed.
     */
    public List<String> getStates() {
        return states;
    }

    public HmmModel setStates(List<String> states) {
        this.states = states;
        return this;
    }

    public Map<String, List<TransitionEntry>> getTransitions() {
        return transitions;
    }

    public HmmModel setTransitions(Map<String, List<TransitionEntry>> transitions) {
        this.transitions = transitions;
        return this;
    }

    /**
     * Null for uniform priors.
     */
    public Map<String, Double> getPriors() {
        return priors;
    }

    public HmmModel setPriors(Map<String, Double> priors) {
        this.priors = priors;
        return this;
    }

    /**
     * state to observation to probability, missing entries have a probability of 0
     */
    public Map<String, Map<String, Double>> getEmissions() {
        return emissions;
    }

    public HmmModel setEmissions(Map<String, Map<String, Double>> emissions) {
        this.emissions = emissions;
        return this;
    }

    /**
     * observation to candidate states, null to consider all states for every observation
     */
    public Map<String, List<String>> getCandidates() {
        return candidates;
    }

    public HmmModel setCandidates(Map<String, List<String>> candidates) {
        this.candidates = candidates;
        return this;
    }

    public Integer getConstraintLength() {
        return constraintLength;
    }

    public HmmModel setConstraintLength(Integer constraintLength) {
        this.constraintLength = constraintLength;
        return this;
    }

    public Double getSmallProbabilityFloor() {
        return smallProbabilityFloor;
    }

    public HmmModel setSmallProbabilityFloor(Double smallProbabilityFloor) {
        this.smallProbabilityFloor = smallProbabilityFloor;
        return this;
    }
}
