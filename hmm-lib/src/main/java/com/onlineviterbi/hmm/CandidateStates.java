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

import java.util.Collection;

/**
 * Restricts the states that are scored for an observation. Called once per step.
 *
 * @param <S> state class/interface
 * @param <O> observation class/interface
 */
@FunctionalInterface
public interface CandidateStates<S, O> {

    /**
     * Returns the states that could plausibly explain the specified observation. Pass a
     * collection with predictable iteration order such as {@link java.util.ArrayList} to ensure
     * deterministic results. Must not return null.
     */
    Collection<S> candidates(O observation);
}
