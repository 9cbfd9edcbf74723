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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.onlineviterbi.hmm.*;
import com.onlineviterbi.util.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link HmmModel}s from YAML or JSON files and creates the {@link OnlineViterbi} for them.
 */
public class ModelLoader {
    private static final Logger logger = LoggerFactory.getLogger(ModelLoader.class);
    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public ModelLoader() {
        yamlMapper = new ObjectMapper(new YAMLFactory());
        yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        jsonMapper = new ObjectMapper();
        jsonMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    /**
     * Reads the model from a .yml or .yaml file, every other extension is read as JSON.
     *
     * @throws ConfigurationException if the file content is not a valid model
     * @throws UncheckedIOException   if the file cannot be read
     */
    public HmmModel read(File file) {
        String name = file.getName().toLowerCase();
        boolean yaml = name.endsWith(".yml") || name.endsWith(".yaml");
        try (InputStream is = new FileInputStream(file)) {
            return read(is, yaml);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read model file " + file, ex);
        }
    }

    public HmmModel read(InputStream is, boolean yaml) throws IOException {
        try {
            HmmModel model = (yaml ? yamlMapper : jsonMapper).readValue(is, HmmModel.class);
            if (model == null)
                throw new ConfigurationException("Model file is empty");
            return model;
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Cannot parse model: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Creates the graph of the specified model. The explicitly listed states come first, then the
     * sources of the transitions in file order.
     */
    public TransitionGraph<String> createGraph(HmmModel model) {
        if (model.getTransitions() == null)
            throw new ConfigurationException("Model has no transitions");

        TransitionGraph.Builder<String> builder = TransitionGraph.builder();
        if (model.getStates() != null) {
            for (String state : model.getStates()) {
                builder.addState(state);
            }
        }
        for (Map.Entry<String, List<HmmModel.TransitionEntry>> entry : model.getTransitions().entrySet()) {
            builder.addState(entry.getKey());
            if (entry.getValue() == null)
                continue;
            for (HmmModel.TransitionEntry transition : entry.getValue()) {
                builder.addTransition(entry.getKey(), transition.getTo(), transition.getProbability());
            }
        }
        return builder.build();
    }

    /**
     * Creates the decoder for the specified model. Entries in args override constraint_length
     * and small_probability_floor of the model.
     */
    public OnlineViterbi<String, String> createViterbi(HmmModel model, PMap args) {
        TransitionGraph<String> graph = createGraph(model);
        if (model.getEmissions() == null || model.getEmissions().isEmpty())
            throw new ConfigurationException("Model has no emissions");
        for (Map.Entry<String, Map<String, Double>> entry : model.getEmissions().entrySet()) {
            if (!graph.containsState(entry.getKey()))
                throw new ConfigurationException("Emissions for state " + entry.getKey() + " which is missing in the graph");
            if (entry.getValue() == null)
                throw new ConfigurationException("Emissions for state " + entry.getKey() + " must not be empty");
            for (Map.Entry<String, Double> emission : entry.getValue().entrySet()) {
                Double p = emission.getValue();
                if (p == null || !(p >= 0 && p <= 1))
                    throw new ConfigurationException("Emission probability of " + entry.getKey() + " for "
                            + emission.getKey() + " must be in [0,1] but was " + p);
            }
        }

        PMap pMap = new PMap();
        if (model.getConstraintLength() != null)
            pMap.putObject(OnlineViterbiParams.CONSTRAINT_LENGTH, model.getConstraintLength());
        if (model.getSmallProbabilityFloor() != null)
            pMap.putObject(OnlineViterbiParams.SMALL_PROBABILITY_FLOOR, model.getSmallProbabilityFloor());
        pMap.putAll(args);

        OnlineViterbiParams<String, String> params = OnlineViterbiParams.<String, String>fromPMap(pMap).
                setPriors(model.getPriors());
        if (model.getCandidates() != null) {
            for (Map.Entry<String, List<String>> entry : model.getCandidates().entrySet()) {
                if (entry.getValue() == null)
                    throw new ConfigurationException("Candidates for observation " + entry.getKey() + " must be a list");
                for (String state : entry.getValue()) {
                    if (!graph.containsState(state))
                        throw new ConfigurationException("Candidate " + state + " of observation " + entry.getKey()
                                + " is missing in the graph");
                }
            }
            params.setCandidateStates(new TableCandidateStates(model.getCandidates(), graph.getStates()));
        }

        logger.info("loaded model with " + graph + ", " + params);
        return new OnlineViterbi<>(graph, new TableEmissionProbability(model.getEmissions()), params);
    }
}
