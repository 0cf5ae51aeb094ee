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

package kinswing.Swing;

import kinswing.Types.SwingResult;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.concurrent.Callable;

/**
 * Swing statistic of one kinase network. Under the null, the (fold change, p-value) pairs of the whole peptide
 * population are shuffled as units while the kinase-peptide edges stay fixed.
 */
public class SwingWrap implements Callable<SwingResult> {

    private final String kinaseId;
    private final int[] networkIdxArray; // distinct peptide indices passing the PWM cutoff
    private final double[] foldChangeArray;
    private final double[] pValueArray;
    private final double pCutFc;
    private final double pseudoCount;
    private final int permutations;
    private final RandomGenerator randomGenerator;

    public SwingWrap(String kinaseId, int[] networkIdxArray, double[] foldChangeArray, double[] pValueArray, double pCutFc, double pseudoCount, int permutations, RandomGenerator randomGenerator) {
        this.kinaseId = kinaseId;
        this.networkIdxArray = networkIdxArray;
        this.foldChangeArray = foldChangeArray;
        this.pValueArray = pValueArray;
        this.pCutFc = pCutFc;
        this.pseudoCount = pseudoCount;
        this.permutations = permutations;
        this.randomGenerator = randomGenerator;
    }

    @Override
    public SwingResult call() {
        int networkSize = networkIdxArray.length;
        if (networkSize == 0) {
            return new SwingResult(kinaseId, 0, 0, 0, 0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0);
        }

        int nPositive = 0;
        int nNegative = 0;
        int nSignificant = 0;
        for (int idx : networkIdxArray) {
            if (pValueArray[idx] <= pCutFc) {
                ++nSignificant;
                if (foldChangeArray[idx] > 0) {
                    ++nPositive;
                } else if (foldChangeArray[idx] < 0) {
                    ++nNegative;
                }
            }
        }
        double swingScore = (double) (nPositive - nNegative) / networkSize;
        double pk = (nPositive + pseudoCount) / (networkSize + pseudoCount);
        double nk = (nNegative + pseudoCount) / (networkSize + pseudoCount);

        double pGreater = Double.NaN;
        double pLess = Double.NaN;
        int permutationsRun = 0;
        if (permutations > 1) {
            double[] nullScoreArray = generateNullScores();
            permutationsRun = permutations;
            if (!isDegenerate(nullScoreArray)) {
                int greaterEqualNum = 0;
                int lessEqualNum = 0;
                for (double nullScore : nullScoreArray) {
                    if (nullScore >= swingScore) {
                        ++greaterEqualNum;
                    }
                    if (nullScore <= swingScore) {
                        ++lessEqualNum;
                    }
                }
                pGreater = (1.0 + greaterEqualNum) / (permutations + 1.0);
                pLess = (1.0 + lessEqualNum) / (permutations + 1.0);
            }
        }

        return new SwingResult(kinaseId, nPositive, nNegative, networkSize, nSignificant, pk, nk, swingScore, Double.NaN, pGreater, pLess, permutationsRun);
    }

    double[] generateNullScores() {
        int populationSize = foldChangeArray.length;
        int networkSize = networkIdxArray.length;
        int[] labelIdxArray = new int[populationSize];
        for (int i = 0; i < populationSize; ++i) {
            labelIdxArray[i] = i;
        }

        double[] nullScoreArray = new double[permutations];
        for (int t = 0; t < permutations; ++t) {
            // partial Fisher-Yates: the first networkSize slots get distinct random labels
            int score = 0;
            for (int k = 0; k < networkSize; ++k) {
                int j = k + randomGenerator.nextInt(populationSize - k);
                int temp = labelIdxArray[k];
                labelIdxArray[k] = labelIdxArray[j];
                labelIdxArray[j] = temp;

                int labelIdx = labelIdxArray[k];
                if (pValueArray[labelIdx] <= pCutFc) {
                    if (foldChangeArray[labelIdx] > 0) {
                        ++score;
                    } else if (foldChangeArray[labelIdx] < 0) {
                        --score;
                    }
                }
            }
            nullScoreArray[t] = (double) score / networkSize;
        }
        return nullScoreArray;
    }

    private static boolean isDegenerate(double[] nullScoreArray) {
        for (int i = 1; i < nullScoreArray.length; ++i) {
            if (nullScoreArray[i] != nullScoreArray[0]) {
                return false;
            }
        }
        return true;
    }
}
