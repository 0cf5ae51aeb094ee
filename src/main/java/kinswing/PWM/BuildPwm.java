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

package kinswing.PWM;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import kinswing.Background.BackgroundModel;
import kinswing.Exceptions.EmptyKinaseGroupException;
import kinswing.Exceptions.KinSwingException;
import kinswing.Exceptions.MalformedInputException;
import kinswing.Exceptions.SequenceLengthException;
import kinswing.Types.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds one position weight matrix per kinase from a kinase table. All rows are validated before any matrix is
 * built, so a failure never leaves a partial PWM set.
 */
public class BuildPwm {

    private static final Logger logger = LoggerFactory.getLogger(BuildPwm.class);

    private final List<SubstrateRecord> substrateList;
    private final PwmSet pwmSet;

    /**
     * @param kinaseTable rows of (kinase, centered substrate sequence)
     * @param alphabet amino acids and the wild card
     * @param substrateLength full length of a substrate; longer sequences are trimmed around the center
     * @param removeCenter drop the substrates whose center residue is this letter; {@code null} keeps all
     * @param pseudoCount added to the position frequencies before the log transformation
     * @param forceTrim not supported yet; ignored with a warning
     */
    public BuildPwm(List<KinaseTableRow> kinaseTable, Alphabet alphabet, int substrateLength, Character removeCenter, double pseudoCount, boolean forceTrim) throws KinSwingException {
        if (substrateLength < 1) {
            throw new IllegalArgumentException(String.format(Locale.US, "Substrate length must be positive (%d).", substrateLength));
        }
        if (!(pseudoCount > 0)) {
            throw new IllegalArgumentException(String.format(Locale.US, "PWM pseudo count must be positive (%f).", pseudoCount));
        }
        if (forceTrim) {
            logger.warn("force_trim is not supported in this version. Sequences are used as they are.");
        }
        if (kinaseTable.isEmpty()) {
            throw new MalformedInputException("kinase_table", "kinase", "there is no substrate.");
        }

        Set<String> kinaseSet = new TreeSet<>();
        ListMultimap<String, SubstrateRecord> kinaseSubstrateMap = ArrayListMultimap.create();
        List<String> validSequenceList = new ArrayList<>(kinaseTable.size());
        List<SubstrateRecord> tempSubstrateList = new ArrayList<>(kinaseTable.size());
        int centerPosition = substrateLength / 2;
        int removedNum = 0;
        for (KinaseTableRow row : kinaseTable) {
            kinaseSet.add(row.kinaseId);
            String rawSequence = row.sequence == null ? "" : row.sequence.trim();
            if (rawSequence.isEmpty()) {
                logger.warn("Kinase {} has an empty substrate sequence. Skipped.", row.kinaseId);
                continue;
            }
            String sequence = alphabet.normalize(row.kinaseId, rawSequence);
            if (sequence.length() < substrateLength) {
                throw new SequenceLengthException(row.kinaseId, sequence, substrateLength);
            }
            sequence = AlignTool.trimToCenter(sequence, substrateLength);
            validSequenceList.add(sequence);

            SubstrateRecord substrate = new SubstrateRecord(row.kinaseId, sequence, centerPosition);
            if (removeCenter != null && substrate.centerResidue() == Character.toUpperCase(removeCenter)) {
                ++removedNum;
                continue;
            }
            kinaseSubstrateMap.put(row.kinaseId, substrate);
            tempSubstrateList.add(substrate);
        }
        if (removeCenter != null) {
            logger.debug("Removed {} substrates with center residue {}.", removedNum, removeCenter);
        }

        for (String kinaseId : kinaseSet) {
            if (!kinaseSubstrateMap.containsKey(kinaseId)) {
                throw new EmptyKinaseGroupException(kinaseId);
            }
        }

        BackgroundModel backgroundModel = BackgroundModel.fromSequences(validSequenceList);

        Map<String, PositionWeightMatrix> pwmMap = new TreeMap<>();
        for (String kinaseId : kinaseSet) {
            List<SubstrateRecord> group = kinaseSubstrateMap.get(kinaseId);
            PositionWeightMatrix pwm = buildMatrix(kinaseId, group, backgroundModel, alphabet.wildCard, substrateLength, pseudoCount);
            if (pwm.isLowConfidence()) {
                logger.debug("Kinase {} has only {} substrate(s). Its PWM has low confidence.", kinaseId, group.size());
            }
            pwmMap.put(kinaseId, pwm);
        }

        substrateList = ImmutableList.copyOf(tempSubstrateList);
        pwmSet = new PwmSet(pwmMap, backgroundModel, alphabet, substrateLength);
    }

    static PositionWeightMatrix buildMatrix(String kinaseId, List<SubstrateRecord> group, BackgroundModel backgroundModel, char wildCard, int substrateLength, double pseudoCount) {
        int[][] countMatrix = new int[substrateLength][Alphabet.SIZE];
        int[] definedNumArray = new int[substrateLength];
        for (SubstrateRecord substrate : group) {
            for (int i = 0; i < substrateLength; ++i) {
                int idx = Alphabet.index(substrate.sequence.charAt(i));
                if (idx >= 0) {
                    ++countMatrix[i][idx];
                    ++definedNumArray[i];
                }
            }
        }

        double[][] frequencyMatrix = new double[substrateLength][Alphabet.SIZE];
        double[][] weightMatrix = new double[substrateLength][Alphabet.SIZE];
        for (int i = 0; i < substrateLength; ++i) {
            if (definedNumArray[i] == 0) {
                // only wild cards in this column: neutral
                continue;
            }
            for (int j = 0; j < Alphabet.SIZE; ++j) {
                double frequency = (double) countMatrix[i][j] / definedNumArray[i];
                frequencyMatrix[i][j] = frequency;
                weightMatrix[i][j] = Math.log((frequency + pseudoCount) / backgroundModel.frequency(j));
            }
        }

        return new PositionWeightMatrix(kinaseId, group.size(), pseudoCount, wildCard, frequencyMatrix, weightMatrix);
    }

    public PwmSet returnPwmSet() {
        return pwmSet;
    }

    public List<SubstrateRecord> returnSubstrateList() {
        return substrateList;
    }
}
