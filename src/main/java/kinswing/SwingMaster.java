/*
 * Copyright 2016-2019 The Hong Kong University of Science and Technology
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package kinswing;

import kinswing.Exceptions.KinSwingException;
import kinswing.PWM.BuildPwm;
import kinswing.Parameter.SwingParameters;
import kinswing.Score.ScoreSequences;
import kinswing.Swing.Swing;
import kinswing.Types.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the three stages in fixed order: PWM building, PWM scoring of the peptides and swing scoring. Each stage can
 * also be called alone; their outputs are plain immutable values.
 */
public class SwingMaster {

    private static final Logger logger = LoggerFactory.getLogger(SwingMaster.class);

    public static PwmSet buildPwm(List<KinaseTableRow> kinaseTable, SwingParameters parameters) throws KinSwingException {
        return new BuildPwm(kinaseTable, parameters.alphabet(), parameters.substrateLength, parameters.removeCenter, parameters.pwmPseudo, parameters.forceTrim).returnPwmSet();
    }

    public static List<MatchScore> scoreSequences(List<PeptideRecord> inputData, PwmSet pwmSet, SwingParameters parameters) throws KinSwingException {
        return new ScoreSequences(inputData, pwmSet, parameters.background, parameters.n, parameters.forceTrim, parameters.seed, parameters.threads).getMatchScoreList();
    }

    public static List<SwingResult> swing(List<PeptideRecord> inputData, PwmSet pwmSet, List<MatchScore> pwmScores, SwingParameters parameters) throws KinSwingException {
        return new Swing(inputData, pwmSet, pwmScores, parameters.pseudoCount, parameters.pCutPwm, parameters.pCutFc, parameters.permutations, parameters.seed, parameters.threads).getSwingResultList();
    }

    public static List<SwingResult> run(List<PeptideRecord> inputData, List<KinaseTableRow> kinaseTable, SwingParameters parameters) throws KinSwingException {
        step(parameters.verbose, "[Step1/3] : Building PWMs");
        PwmSet pwmSet = buildPwm(kinaseTable, parameters);

        step(parameters.verbose, "[Step2/3] : Scoring PWM matches to peptide sequences");
        List<MatchScore> scoreList = scoreSequences(inputData, pwmSet, parameters);

        step(parameters.verbose, "[Step3/3] : Computing Swing scores");
        List<SwingResult> swingResultList = swing(inputData, pwmSet, scoreList, parameters);

        step(parameters.verbose, "[COMPLETE]");
        return swingResultList;
    }

    private static void step(boolean verbose, String marker) {
        if (verbose) {
            logger.info(marker);
        } else {
            logger.debug(marker);
        }
    }
}
