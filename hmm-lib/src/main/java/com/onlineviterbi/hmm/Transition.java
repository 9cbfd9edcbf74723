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

import java.util.Objects;

/**
 * A directed edge of the {@link TransitionGraph} together with its transition probability
 * p(toState|fromState).
 *
 * @param <S> the state type
 */
public class Transition<S> {
    public final S fromState;
    public final S toState;
    public final double probability;

    public Transition(S fromState, S toState, double probability) {
        this.fromState = fromState;
        this.toState = toState;
        this.probability = probability;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromState, toState, probability);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        @SuppressWarnings("unchecked")
        Transition<S> other = (Transition<S>) obj;
        return Objects.equals(fromState, other.fromState) && Objects.equals(toState, other.toState)
                && Double.compare(probability, other.probability) == 0;
    }

    @Override
    public String toString() {
        return "Transition [fromState=" + fromState + ", toState=" + toState
                + ", probability=" + probability + "]";
    }
}
