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

/**
 * This interface needs to be implemented and passed to {@link OnlineViterbi} to specify the
 * emission probabilities. Implementations must be pure functions of their arguments.
 *
 * @param <S> state class/interface
 * @param <O> observation class/interface
 */
@FunctionalInterface
public interface EmissionProbability<S, O> {

    /**
     * Returns the probability of making the specified observation in the specified state, i.e.
     * p(observation|state). Must be within [0,1], a value of 0 means the observation cannot be
     * explained by the state.
     */
    double emissionProbability(S state, O observation);
}
