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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Decodes one observation stream with an {@link OnlineViterbi} and keeps the current
 * {@link ViterbiStep} so that the caller does not need to pass it around. Need to construct a new
 * instance for each stream. Not thread-safe.
 *
 * @param <S> the state type
 * @param <O> the observation type
 */
public class ViterbiSession<S, O> {
    private static final Logger logger = LoggerFactory.getLogger(ViterbiSession.class);

    private final OnlineViterbi<S, O> viterbi;
    private ViterbiStep<S> currentStep;
    private int stepCount;
    private int priorResets;
    private List<Map<S, Double>> messageHistory;

    /**
     * Keeps the message history if {@link OnlineViterbiParams#setKeepMessageHistory(boolean)} was
     * enabled for the specified instance.
     */
    public ViterbiSession(OnlineViterbi<S, O> viterbi) {
        this(viterbi, viterbi != null && viterbi.isKeepMessageHistory());
    }

    /**
     * @param keepMessageHistory Whether to store the distribution after every step for debugging.
     */
    public ViterbiSession(OnlineViterbi<S, O> viterbi, boolean keepMessageHistory) {
        if (viterbi == null)
            throw new NullPointerException("viterbi must not be null.");
        this.viterbi = viterbi;
        if (keepMessageHistory)
            messageHistory = new ArrayList<>();
    }

    /**
     * Processes the next observation of the stream and returns the new current step.
     */
    public ViterbiStep<S> nextStep(O observation) {
        currentStep = viterbi.step(observation, currentStep);
        stepCount++;
        if (currentStep.isPriorReset())
            priorResets++;
        if (messageHistory != null)
            messageHistory.add(currentStep.getDistribution());

        if (logger.isTraceEnabled())
            logger.trace("step {}, observation {}, live states {}, prior reset {}", stepCount, observation,
                    currentStep.getDistribution().size(), currentStep.isPriorReset());
        return currentStep;
    }

    /**
     * Processes all observations in iteration order and returns the last step.
     */
    public ViterbiStep<S> nextSteps(Iterable<O> observations) {
        for (O observation : observations) {
            nextStep(observation);
        }
        return currentStep;
    }

    /**
     * @return null if no observation was processed yet
     */
    public ViterbiStep<S> getCurrentStep() {
        return currentStep;
    }

    public int getStepCount() {
        return stepCount;
    }

    /**
     * Number of steps in which no state could explain the observation and the priors were used.
     */
    public int getPriorResets() {
        return priorResets;
    }

    /**
     * Returns the most likely current state or null if no observation was processed yet.
     */
    public S mostLikelyState() {
        return currentStep == null ? null : currentStep.mostLikelyState();
    }

    /**
     * Returns the most recent states of the most likely path, oldest first.
     */
    public List<S> mostLikelyPath() {
        return currentStep == null ? Collections.emptyList() : currentStep.mostLikelyPath();
    }

    /**
     * Distribution after each step, null if the message history is not kept.
     */
    public List<Map<S, Double>> getMessageHistory() {
        return messageHistory;
    }

    public String messageHistoryString() {
        if (messageHistory == null)
            throw new IllegalStateException("Message history is not kept");

        StringBuilder sb = new StringBuilder();
        sb.append("Message history with probabilities\n\n");
        int i = 0;
        for (Map<S, Double> message : messageHistory) {
            sb.append("Time step ").append(i).append("\n");
            i++;
            for (Map.Entry<S, Double> entry : message.entrySet()) {
                sb.append(entry.getKey()).append(": ").append(entry.getValue()).append("\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
