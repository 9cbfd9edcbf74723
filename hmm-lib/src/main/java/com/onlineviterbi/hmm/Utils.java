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
 * Implementation utilities.
 */
class Utils {

    private Utils() {
    }

    static int initialHashMapCapacity(int maxElements) {
        // Default load factor of HashMaps is 0.75
        return (int) (maxElements / 0.75) + 1;
    }

    /**
     * Note that this check must not be used for probability densities.
     */
    static boolean probabilityInRange(double probability) {
        return probability >= 0 && probability <= 1.0;
    }

    static double sum(Collection<Double> probabilities) {
        double sum = 0.0;
        for (double probability : probabilities) {
            sum += probability;
        }
        return sum;
    }

    static boolean sumsToOne(Collection<Double> probabilities, double delta) {
        return Math.abs(sum(probabilities) - 1.0) <= delta;
    }
}
