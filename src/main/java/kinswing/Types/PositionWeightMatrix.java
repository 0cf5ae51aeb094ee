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

package kinswing.Types;

/**
 * Log-odds weights of one kinase, {@code [substrate length][Alphabet.SIZE]}, together with the position frequencies
 * they were derived from.
 */
public class PositionWeightMatrix {

    public static final int MIN_CONFIDENT_SUBSTRATES = 2;

    public final String kinaseId;
    public final int nSubstratesUsed;
    public final double pseudoCount;
    public final char wildCard;
    private final double[][] frequencyMatrix;
    private final double[][] weightMatrix;

    public PositionWeightMatrix(String kinaseId, int nSubstratesUsed, double pseudoCount, char wildCard, double[][] frequencyMatrix, double[][] weightMatrix) {
        if (frequencyMatrix.length != weightMatrix.length) {
            throw new IllegalArgumentException("Frequency and weight matrices differ in length.");
        }
        this.kinaseId = kinaseId;
        this.nSubstratesUsed = nSubstratesUsed;
        this.pseudoCount = pseudoCount;
        this.wildCard = wildCard;
        this.frequencyMatrix = copy(frequencyMatrix);
        this.weightMatrix = copy(weightMatrix);
    }

    public int length() {
        return weightMatrix.length;
    }

    public boolean isLowConfidence() {
        return nSubstratesUsed < MIN_CONFIDENT_SUBSTRATES;
    }

    public double getWeight(int position, char residue) {
        int idx = Alphabet.index(residue);
        if (idx < 0) {
            return 0;
        }
        return weightMatrix[position][idx];
    }

    public double getFrequency(int position, char residue) {
        int idx = Alphabet.index(residue);
        if (idx < 0) {
            return 0;
        }
        return frequencyMatrix[position][idx];
    }

    public double[][] getWeightMatrix() {
        return copy(weightMatrix);
    }

    public double[][] getFrequencyMatrix() {
        return copy(frequencyMatrix);
    }

    /**
     * Sum of the log-odds weights over the defined positions of an encoded, aligned sequence.
     */
    public double calLogOddsScore(int[] code) {
        double score = 0;
        for (int i = 0; i < code.length; ++i) {
            if (code[i] >= 0) {
                score += weightMatrix[i][code[i]];
            }
        }
        return score;
    }

    /**
     * Sum of the observed position frequencies over the defined positions of an encoded, aligned sequence.
     */
    public double calRawScore(int[] code) {
        double score = 0;
        for (int i = 0; i < code.length; ++i) {
            if (code[i] >= 0) {
                score += frequencyMatrix[i][code[i]];
            }
        }
        return score;
    }

    private static double[][] copy(double[][] matrix) {
        double[][] output = new double[matrix.length][];
        for (int i = 0; i < matrix.length; ++i) {
            output[i] = matrix[i].clone();
        }
        return output;
    }
}
