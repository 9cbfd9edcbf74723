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
 * The static hidden-state transition graph: every state maps to its ordered outgoing transitions.
 * Instances are created with {@link #builder()} and are immutable afterwards, the
 * {@link ReverseIndex} is derived once in the constructor.
 * <p>
 * Since nothing changes after construction a single graph may be shared by several
 * {@link OnlineViterbi} instances running in different threads.
 *
 * @param <S> the state type, must implement equals and hashCode
 */
public class TransitionGraph<S> {
    private final Map<S, List<Transition<S>>> outgoing;
    private final ReverseIndex<S> reverseIndex;
    private final int transitionCount;

    private TransitionGraph(Map<S, List<Transition<S>>> outgoing, int transitionCount) {
        this.outgoing = outgoing;
        this.transitionCount = transitionCount;
        this.reverseIndex = ReverseIndex.of(this);
    }

    public static <S> Builder<S> builder() {
        return new Builder<>();
    }

    /**
     * @return all declared states in declaration order
     */
    public Set<S> getStates() {
        return outgoing.keySet();
    }

    public boolean containsState(S state) {
        return outgoing.containsKey(state);
    }

    public int getStateCount() {
        return outgoing.size();
    }

    public int getTransitionCount() {
        return transitionCount;
    }

    /**
     * Returns the outgoing transitions of the specified state in the order they were added or an
     * empty list if the state is unknown or has no successors.
     */
    public List<Transition<S>> getTransitions(S fromState) {
        List<Transition<S>> list = outgoing.get(fromState);
        return list == null ? Collections.emptyList() : list;
    }

    /**
     * Returns p(toState|fromState) or 0 if there is no such edge.
     */
    public double getProbability(S fromState, S toState) {
        for (Transition<S> transition : getTransitions(fromState)) {
            if (transition.toState.equals(toState))
                return transition.probability;
        }
        return 0;
    }

    public ReverseIndex<S> getReverseIndex() {
        return reverseIndex;
    }

    @Override
    public String toString() {
        return "states:" + getStateCount() + ", transitions:" + transitionCount;
    }

    public static class Builder<S> {
        private final Map<S, Map<S, Transition<S>>> outgoing = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        /**
         * Declares a state. Declaring a state twice has no effect. States without outgoing
         * transitions have to be declared explicitly if they are the target of a transition.
         */
        public Builder<S> addState(S state) {
            checkNotBuilt();
            if (state == null)
                throw new ConfigurationException("State must not be null");
            outgoing.computeIfAbsent(state, k -> new LinkedHashMap<>());
            return this;
        }

        /**
         * Adds an edge and implicitly declares the source state.
         *
         * @throws ConfigurationException if a state is null, the probability is not in (0,1]
         *                                or the edge already exists
         */
        public Builder<S> addTransition(S fromState, S toState, double probability) {
            checkNotBuilt();
            if (fromState == null || toState == null)
                throw new ConfigurationException("States of a transition must not be null, from:"
                        + fromState + ", to:" + toState);
            if (!Double.isFinite(probability) || probability <= 0 || probability > 1)
                throw new ConfigurationException("Transition probability must be in (0,1] but was "
                        + probability + " for " + fromState + "->" + toState);

            Map<S, Transition<S>> edges = outgoing.computeIfAbsent(fromState, k -> new LinkedHashMap<>());
            Transition<S> old = edges.putIfAbsent(toState, new Transition<>(fromState, toState, probability));
            if (old != null)
                throw new ConfigurationException("Duplicate transition " + fromState + "->" + toState
                        + ", existing probability " + old.probability + ", new " + probability);
            return this;
        }

        /**
         * @throws ConfigurationException if the graph is empty or a transition points to a state
         *                                that was never declared
         */
        public TransitionGraph<S> build() {
            checkNotBuilt();
            if (outgoing.isEmpty())
                throw new ConfigurationException("Transition graph must contain at least one state");

            Map<S, List<Transition<S>>> result = new LinkedHashMap<>(Utils.initialHashMapCapacity(outgoing.size()));
            int count = 0;
            for (Map.Entry<S, Map<S, Transition<S>>> entry : outgoing.entrySet()) {
                for (S toState : entry.getValue().keySet()) {
                    if (!outgoing.containsKey(toState))
                        throw new ConfigurationException("State " + toState + " is the target of a transition from "
                                + entry.getKey() + " but is missing in the graph");
                }
                count += entry.getValue().size();
                result.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue().values())));
            }
            built = true;
            return new TransitionGraph<>(Collections.unmodifiableMap(result), count);
        }

        private void checkNotBuilt() {
            if (built)
                throw new IllegalStateException("TransitionGraph was already built");
        }
    }
}
