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

import java.util.*;

/**
 * Online, memory-bounded variant of the Viterbi algorithm over a sparse {@link TransitionGraph}.
 * The plain Viterbi algorithm is described e.g. in Rabiner, Juang, An introduction to Hidden
 * Markov Models, IEEE ASSP Mag., pp 4-16, June 1986.
 * <p>
 * Observations are processed one at a time. Instead of the full trellis only the normalized
 * probability of the most likely path ending in each live state and a window of the last
 * {@link OnlineViterbiParams#getConstraintLength()} states of that path are kept. States whose
 * normalized probability drops below {@link OnlineViterbiParams#getSmallProbabilityFloor()} are
 * pruned. Hence the result is an approximation of the globally most likely sequence, similar to a
 * beam search.
 * <p>
 * The caller owns the {@link ViterbiStep} and passes it to the next call, see
 * {@link ViterbiSession} for a wrapper that does this. Instances are immutable, so one instance
 * can decode several observation streams concurrently as long as the collaborators are
 * thread-safe and nobody modifies the maps passed to {@link #step(Object, Map, Map)}.
 *
 * @param <S> the state type
 * @param <O> the observation type
 */
public class OnlineViterbi<S, O> {
    private static final Logger logger = LoggerFactory.getLogger(OnlineViterbi.class);

    /**
     * Predecessor with the highest score seen so far. The first of equal scores is kept.
     */
    private static class Best<S> {
        S state;
        double score;

        void offer(S candidate, double candidateScore) {
            if (state == null || candidateScore > score) {
                state = candidate;
                score = candidateScore;
            }
        }
    }

    private final TransitionGraph<S> graph;
    private final ReverseIndex<S> reverseIndex;
    private final EmissionProbability<S, O> emissionProbability;
    private final CandidateStates<S, O> candidateStates;
    private final PriorDistribution<S> priors;
    private final Normalizer<S> normalizer;
    private final int constraintLength;
    private final double smallProbabilityFloor;
    private final boolean keepMessageHistory;

    public OnlineViterbi(TransitionGraph<S> graph, EmissionProbability<S, O> emissionProbability) {
        this(graph, emissionProbability, new OnlineViterbiParams<>());
    }

    /**
     * @throws ConfigurationException if the priors do not fit to the graph
     */
    public OnlineViterbi(TransitionGraph<S> graph, EmissionProbability<S, O> emissionProbability,
                         OnlineViterbiParams<S, O> params) {
        if (graph == null)
            throw new NullPointerException("graph must not be null.");
        if (emissionProbability == null)
            throw new NullPointerException("emissionProbability must not be null.");
        if (params == null)
            throw new NullPointerException("params must not be null.");

        this.graph = graph;
        this.reverseIndex = graph.getReverseIndex();
        this.emissionProbability = emissionProbability;
        this.candidateStates = params.getCandidateStates();
        this.priors = params.getPriors() == null
                ? PriorDistribution.uniform(graph)
                : PriorDistribution.of(graph, params.getPriors());
        this.normalizer = new Normalizer<>(priors);
        this.constraintLength = params.getConstraintLength();
        this.smallProbabilityFloor = params.getSmallProbabilityFloor();
        this.keepMessageHistory = params.isKeepMessageHistory();
        logger.debug("created decoder for graph with {}, {}", graph, params);
    }

    /**
     * Processes the next observation.
     *
     * @param distribution the distribution returned by the previous step or null for the first
     *                     step, in which case the priors are used
     * @param pathTable    the path table returned by the previous step, may be null or empty
     * @return a new distribution and path table, the arguments are not modified
     * @throws IllegalStateException if a collaborator returns an invalid result
     */
    public ViterbiStep<S> step(O observation, Map<S, Double> distribution, Map<S, ? extends List<S>> pathTable) {
        if (observation == null)
            throw new NullPointerException("observation must not be null.");
        if (distribution == null)
            distribution = priors.asMap();
        if (pathTable == null)
            pathTable = Collections.emptyMap();

        final Map<S, Double> emissions = emissionProbabilities(observation);
        final Map<S, Double> scores = new LinkedHashMap<>(Utils.initialHashMapCapacity(emissions.size()));
        final Map<S, List<S>> paths = new LinkedHashMap<>(Utils.initialHashMapCapacity(emissions.size()));
        for (Map.Entry<S, Double> entry : emissions.entrySet()) {
            final S toState = entry.getKey();
            final Best<S> best = bestPredecessor(reverseIndex.predecessors(toState), distribution, entry.getValue());
            if (best.state == null)
                continue;

            scores.put(toState, best.score);
            paths.put(toState, extend(pathTable.get(best.state), toState));
        }

        final boolean priorReset = normalizer.isDegenerate(scores);
        final Map<S, Double> result = normalizer.normalize(scores);
        final Map<S, List<S>> resultPaths;
        if (priorReset) {
            logger.debug("no state explains observation {}, resetting to priors", observation);
            resultPaths = new LinkedHashMap<>(Utils.initialHashMapCapacity(result.size()));
            for (S state : result.keySet()) {
                resultPaths.put(state, Collections.emptyList());
            }
        } else {
            resultPaths = paths;
        }

        final Iterator<Map.Entry<S, Double>> iter = result.entrySet().iterator();
        while (iter.hasNext()) {
            final Map.Entry<S, Double> entry = iter.next();
            if (entry.getValue() < smallProbabilityFloor) {
                iter.remove();
                resultPaths.remove(entry.getKey());
            }
        }
        assert result.keySet().equals(resultPaths.keySet()) : "distribution and path table must have the same states";
        return new ViterbiStep<>(result, resultPaths, priorReset);
    }

    /**
     * Processes the next observation based on the result of the previous step.
     *
     * @param previous null for the first step
     */
    public ViterbiStep<S> step(O observation, ViterbiStep<S> previous) {
        if (previous == null)
            return step(observation, null, null);
        return step(observation, previous.getDistribution(), previous.getPathTable());
    }

    /**
     * Returns the emission probability of every distinct candidate state for which it is
     * positive, in candidate order.
     */
    private Map<S, Double> emissionProbabilities(O observation) {
        final Collection<S> candidates;
        if (candidateStates == null) {
            candidates = graph.getStates();
        } else {
            Collection<S> tmp = candidateStates.candidates(observation);
            if (tmp == null)
                throw new IllegalStateException("Candidate states for observation " + observation + " must not be null");
            candidates = new LinkedHashSet<>(tmp);
        }

        final Map<S, Double> result = new LinkedHashMap<>(Utils.initialHashMapCapacity(candidates.size()));
        for (S candidate : candidates) {
            if (candidate == null)
                throw new IllegalStateException("Candidate states for observation " + observation + " contain null");
            final double emission = emissionProbability.emissionProbability(candidate, observation);
            if (!Utils.probabilityInRange(emission))
                throw new IllegalStateException("Emission probability must be in [0,1] but was " + emission
                        + " for state " + candidate + " and observation " + observation);
            if (emission > 0)
                result.put(candidate, emission);
        }
        return result;
    }

    /**
     * Scores every predecessor that has a positive probability in the distribution. The smaller
     * of the two maps is iterated, both lead to the same set of predecessors.
     */
    private Best<S> bestPredecessor(Map<S, Double> predecessors, Map<S, Double> distribution, double emission) {
        final Best<S> best = new Best<>();
        if (predecessors.size() < distribution.size()) {
            for (Map.Entry<S, Double> entry : predecessors.entrySet()) {
                final Double probability = distribution.get(entry.getKey());
                if (probability != null && probability > 0)
                    best.offer(entry.getKey(), probability * emission * entry.getValue());
            }
        } else {
            for (Map.Entry<S, Double> entry : distribution.entrySet()) {
                final Double transitionProbability = predecessors.get(entry.getKey());
                final Double probability = entry.getValue();
                if (transitionProbability != null && probability != null && probability > 0)
                    best.offer(entry.getKey(), probability * emission * transitionProbability);
            }
        }
        return best;
    }

    /**
     * Appends the state to a copy of the previous path and drops the oldest states so that the
     * result has at most constraintLength elements.
     */
    private List<S> extend(List<S> previous, S state) {
        if (constraintLength == 0)
            return Collections.emptyList();

        final int previousSize = previous == null ? 0 : previous.size();
        final int keep = Math.min(previousSize, constraintLength - 1);
        final List<S> result = new ArrayList<>(keep + 1);
        if (keep > 0)
            result.addAll(previous.subList(previousSize - keep, previousSize));
        result.add(state);
        return Collections.unmodifiableList(result);
    }

    public TransitionGraph<S> getGraph() {
        return graph;
    }

    public PriorDistribution<S> getPriors() {
        return priors;
    }

    public int getConstraintLength() {
        return constraintLength;
    }

    public double getSmallProbabilityFloor() {
        return smallProbabilityFloor;
    }

    /**
     * Default for {@link ViterbiSession}s created for this instance.
     */
    public boolean isKeepMessageHistory() {
        return keepMessageHistory;
    }
}
