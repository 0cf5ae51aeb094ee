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

package kinswing.Score;

import kinswing.Background.BackgroundModel;
import kinswing.Types.MatchScore;
import kinswing.Types.PositionWeightMatrix;
import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Scores all peptides against the PWM of one kinase and derives their p-values from a random background sample.
 */
public class ScoreSequencesWrap implements Callable<List<MatchScore>> {

    private final PositionWeightMatrix pwm;
    private final BackgroundModel backgroundModel;
    private final String[] peptideIdArray;
    private final int[][] peptideCodeArray;
    private final int n;
    private final RandomGenerator randomGenerator;

    public ScoreSequencesWrap(PositionWeightMatrix pwm, BackgroundModel backgroundModel, String[] peptideIdArray, int[][] peptideCodeArray, int n, RandomGenerator randomGenerator) {
        this.pwm = pwm;
        this.backgroundModel = backgroundModel;
        this.peptideIdArray = peptideIdArray;
        this.peptideCodeArray = peptideCodeArray;
        this.n = n;
        this.randomGenerator = randomGenerator;
    }

    @Override
    public List<MatchScore> call() {
        double[] nullScoreArray = generateNullScores();
        List<MatchScore> matchScoreList = new ArrayList<>(peptideIdArray.length);
        for (int i = 0; i < peptideIdArray.length; ++i) {
            double logOddsScore = pwm.calLogOddsScore(peptideCodeArray[i]);
            double rawScore = pwm.calRawScore(peptideCodeArray[i]);
            matchScoreList.add(new MatchScore(pwm.kinaseId, peptideIdArray[i], rawScore, logOddsScore, calEmpiricalP(nullScoreArray, logOddsScore)));
        }
        return matchScoreList;
    }

    /**
     * Sorted log-odds scores of {@code n} random peptides drawn from the background.
     */
    double[] generateNullScores() {
        EnumeratedIntegerDistribution sampler = backgroundModel.sampler(randomGenerator);
        double[] nullScoreArray = new double[n];
        for (int i = 0; i < n; ++i) {
            nullScoreArray[i] = pwm.calLogOddsScore(sampler.sample(pwm.length()));
        }
        Arrays.sort(nullScoreArray);
        return nullScoreArray;
    }

    /**
     * (1 + number of null scores >= observed) / (null size + 1).
     *
     * @param sortedNullScoreArray ascending
     */
    static double calEmpiricalP(double[] sortedNullScoreArray, double observed) {
        int left = 0;
        int right = sortedNullScoreArray.length;
        while (left < right) {
            int mid = (left + right) >>> 1;
            if (sortedNullScoreArray[mid] < observed) {
                left = mid + 1;
            } else {
                right = mid;
            }
        }
        int greaterEqualNum = sortedNullScoreArray.length - left;
        return (1.0 + greaterEqualNum) / (sortedNullScoreArray.length + 1.0);
    }
}
