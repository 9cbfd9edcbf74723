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

import com.onlineviterbi.util.PMap;

import java.util.Map;

/**
 * Parameters for {@link OnlineViterbi} and {@link ViterbiSession}.
 *
 * @param <S> the state type
 * @param <O> the observation type
 */
public class OnlineViterbiParams<S, O> {
    public static final String CONSTRAINT_LENGTH = "constraint_length";
    public static final String SMALL_PROBABILITY_FLOOR = "small_probability_floor";
    public static final String KEEP_MESSAGE_HISTORY = "keep_message_history";

    public static final int DEFAULT_CONSTRAINT_LENGTH = 10;
    public static final double DEFAULT_SMALL_PROBABILITY_FLOOR = 1e-11;

    private int constraintLength = DEFAULT_CONSTRAINT_LENGTH;
    private double smallProbabilityFloor = DEFAULT_SMALL_PROBABILITY_FLOOR;
    private Map<S, Double> priors;
    private CandidateStates<S, O> candidateStates;
    private boolean keepMessageHistory = false;

    /**
     * Reads the window length, the pruning floor and the message history flag from the specified
     * map, missing keys keep their defaults.
     */
    public static <S, O> OnlineViterbiParams<S, O> fromPMap(PMap pMap) {
        return new OnlineViterbiParams<S, O>().
                setConstraintLength(pMap.getInt(CONSTRAINT_LENGTH, DEFAULT_CONSTRAINT_LENGTH)).
                setSmallProbabilityFloor(pMap.getDouble(SMALL_PROBABILITY_FLOOR, DEFAULT_SMALL_PROBABILITY_FLOOR)).
                setKeepMessageHistory(pMap.getBool(KEEP_MESSAGE_HISTORY, false));
    }

    /**
     * Maximum number of states retained in the path of each live state.
     */
    public OnlineViterbiParams<S, O> setConstraintLength(int constraintLength) {
        if (constraintLength < 0)
            throw new ConfigurationException(CONSTRAINT_LENGTH + " must not be negative but was " + constraintLength);
        this.constraintLength = constraintLength;
        return this;
    }

    /**
     * States with a normalized probability below this value are pruned after each step.
     */
    public OnlineViterbiParams<S, O> setSmallProbabilityFloor(double smallProbabilityFloor) {
        if (!Double.isFinite(smallProbabilityFloor) || smallProbabilityFloor < 0)
            throw new ConfigurationException(SMALL_PROBABILITY_FLOOR + " must be a finite, non-negative number but was "
                    + smallProbabilityFloor);
        this.smallProbabilityFloor = smallProbabilityFloor;
        return this;
    }

    /**
     * Initial state probabilities. Uniform priors over all states are used if not set.
     */
    public OnlineViterbiParams<S, O> setPriors(Map<S, Double> priors) {
        this.priors = priors;
        return this;
    }

    /**
     * Restricts the states considered for an observation. All states of the graph are
     * considered if not set.
     */
    public OnlineViterbiParams<S, O> setCandidateStates(CandidateStates<S, O> candidateStates) {
        this.candidateStates = candidateStates;
        return this;
    }

    /**
     * Whether {@link ViterbiSession} stores the distribution of every step for debugging.
     */
    public OnlineViterbiParams<S, O> setKeepMessageHistory(boolean keepMessageHistory) {
        this.keepMessageHistory = keepMessageHistory;
        return this;
    }

    public int getConstraintLength() {
        return constraintLength;
    }

    public double getSmallProbabilityFloor() {
        return smallProbabilityFloor;
    }

    public Map<S, Double> getPriors() {
        return priors;
    }

    public CandidateStates<S, O> getCandidateStates() {
        return candidateStates;
    }

    public boolean isKeepMessageHistory() {
        return keepMessageHistory;
    }

    @Override
    public String toString() {
        return CONSTRAINT_LENGTH + "=" + constraintLength + ", " + SMALL_PROBABILITY_FLOOR + "=" + smallProbabilityFloor
                + ", priors=" + (priors == null ? "uniform" : "custom")
                + ", candidates=" + (candidateStates == null ? "all" : "custom");
    }
}
