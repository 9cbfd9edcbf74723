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

import com.onlineviterbi.hmm.OnlineViterbi;
import com.onlineviterbi.hmm.OnlineViterbiParams;
import com.onlineviterbi.hmm.ViterbiSession;
import com.onlineviterbi.hmm.ViterbiStep;
import com.onlineviterbi.util.Helper;
import com.onlineviterbi.util.PMap;
import com.onlineviterbi.util.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes observation files with a model file:
 * <pre>
 * decode model=model.yml observations=a.txt,b.txt [constraint_length=10] [small_probability_floor=1e-11]
 * </pre>
 * Observation files contain one observation per line, blank lines and lines starting with '#'
 * are skipped.
 */
public class DecodeMain {
    private static final Logger logger = LoggerFactory.getLogger(DecodeMain.class);

    public static void main(String[] args) {
        int failed = new DecodeMain().start(PMap.read(args), System.out);
        if (failed > 0)
            System.exit(1);
    }

    /**
     * @return the number of observation files that could not be decoded
     */
    int start(PMap args, PrintStream out) {
        String modelLocation = args.getString("model", "");
        String observationLocations = args.getString("observations", "");
        if (Helper.isEmpty(modelLocation) || Helper.isEmpty(observationLocations)) {
            out.println("Usage: decode model=<model.yml|model.json> observations=<file>[,<file>...]\n"
                    + "  [" + OnlineViterbiParams.CONSTRAINT_LENGTH + "=" + OnlineViterbiParams.DEFAULT_CONSTRAINT_LENGTH + "]"
                    + " [" + OnlineViterbiParams.SMALL_PROBABILITY_FLOOR + "=" + OnlineViterbiParams.DEFAULT_SMALL_PROBABILITY_FLOOR + "]"
                    + " [" + OnlineViterbiParams.KEEP_MESSAGE_HISTORY + "=false]");
            return 0;
        }

        PMap overrides = new PMap(args);
        overrides.remove("model");
        overrides.remove("observations");
        logger.info("Configuration: " + args);

        ModelLoader loader = new ModelLoader();
        OnlineViterbi<String, String> viterbi = loader.createViterbi(loader.read(new File(modelLocation)), overrides);

        StopWatch readSW = new StopWatch("read");
        StopWatch decodeSW = new StopWatch("decode");
        int failed = 0;
        for (String location : observationLocations.split(",")) {
            File file = new File(location.trim());
            try {
                readSW.start();
                List<String> observations = readObservations(file);
                readSW.stop();

                decodeSW.start();
                ViterbiSession<String, String> session = new ViterbiSession<>(viterbi);
                out.println(file);
                for (String observation : observations) {
                    ViterbiStep<String> step = session.nextStep(observation);
                    String state = step.mostLikelyState();
                    out.println("\t" + observation + "\t" + state + "\t"
                            + (state == null ? "" : (float) step.getDistribution().get(state).doubleValue())
                            + "\t" + step.mostLikelyPath() + (step.isPriorReset() ? "\t(priors)" : ""));
                }
                decodeSW.stop();
                out.println("\tobservations:\t" + session.getStepCount() + ", prior resets:" + session.getPriorResets());
                if (viterbi.isKeepMessageHistory())
                    out.println(session.messageHistoryString());
            } catch (Exception ex) {
                readSW.stop();
                decodeSW.stop();
                failed++;
                logger.error("Problem with file " + file + " Error: " + ex.getMessage(), ex);
            }
        }
        logger.info(readSW + ", " + decodeSW);
        return failed;
    }

    static List<String> readObservations(File file) throws IOException {
        List<String> result = new ArrayList<>();
        for (String line : Helper.readFile(file.getAbsolutePath())) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#"))
                continue;
            result.add(line);
        }
        return result;
    }
}
