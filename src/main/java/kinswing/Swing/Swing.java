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

import com.google.common.collect.ImmutableList;
import kinswing.Background.RandomSource;
import kinswing.Exceptions.KinSwingException;
import kinswing.Exceptions.MalformedInputException;
import kinswing.Types.*;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * Integrates PWM match significance with fold change direction and significance into one swing score per kinase.
 * Kinases without any significant match are kept in the table with undefined (NaN) scores.
 */
public class Swing {

    private static final Logger logger = LoggerFactory.getLogger(Swing.class);

    private final List<SwingResult> swingResultList;

    /**
     * @param peptideList the same peptides that were scored; their (fold change, p-value) pairs are the permuted labels
     * @param pwmSet the kinases to report
     * @param matchScoreList output of the sequence scoring
     * @param pseudoCount added to the positive and negative counts for pk and nk
     * @param pCutPwm an edge exists if the PWM match p-value is at most this value
     * @param pCutFc a peptide counts toward the direction if its p-value is at most this value
     * @param permutations number of label permutations; 0 or 1 disables the permutation test
     * @param seed global seed, {@code null} for unseeded generators
     * @param threadNum worker number, 0 for the number of processors
     */
    public Swing(List<PeptideRecord> peptideList, PwmSet pwmSet, List<MatchScore> matchScoreList, double pseudoCount, double pCutPwm, double pCutFc, int permutations, Long seed, int threadNum) throws KinSwingException {
        if (pCutPwm < 0 || pCutPwm > 1 || pCutFc < 0 || pCutFc > 1) {
            throw new IllegalArgumentException(String.format(Locale.US, "p-value cutoffs must be within [0, 1] (p_cut_pwm = %f, p_cut_fc = %f).", pCutPwm, pCutFc));
        }
        if (!(pseudoCount > 0)) {
            throw new IllegalArgumentException(String.format(Locale.US, "Pseudo count must be positive (%f).", pseudoCount));
        }

        Map<String, Integer> peptideIdxMap = new HashMap<>(peptideList.size() * 2);
        double[] foldChangeArray = new double[peptideList.size()];
        double[] pValueArray = new double[peptideList.size()];
        for (int i = 0; i < peptideList.size(); ++i) {
            PeptideRecord peptide = peptideList.get(i);
            if (peptideIdxMap.put(peptide.annotation, i) != null) {
                throw new MalformedInputException("input_data", "annotation", String.format(Locale.US, "duplicate annotation %s.", peptide.annotation));
            }
            foldChangeArray[i] = peptide.foldChange;
            pValueArray[i] = peptide.pValue;
        }

        Set<String> kinaseSet = new TreeSet<>(pwmSet.kinaseSet());
        Map<String, Set<Integer>> kinaseNetworkMap = new HashMap<>();
        for (MatchScore matchScore : matchScoreList) {
            kinaseSet.add(matchScore.kinaseId);
            Integer peptideIdx = peptideIdxMap.get(matchScore.peptideId);
            if (peptideIdx == null) {
                throw new MalformedInputException("pwm_scores", "peptide", String.format(Locale.US, "peptide %s is not in the input data.", matchScore.peptideId));
            }
            if (matchScore.empiricalP <= pCutPwm) {
                kinaseNetworkMap.computeIfAbsent(matchScore.kinaseId, k -> new TreeSet<>()).add(peptideIdx);
            }
        }

        if (permutations <= 1) {
            logger.debug("permutations = {}. Skip the permutation test.", permutations);
        }

        if (threadNum == 0) {
            threadNum = Runtime.getRuntime().availableProcessors();
        }
        ExecutorService threadPool = Executors.newFixedThreadPool(threadNum);
        List<Future<SwingResult>> taskList = new ArrayList<>(kinaseSet.size());
        List<SwingResult> rawResultList = new ArrayList<>(kinaseSet.size());
        try {
            for (String kinaseId : kinaseSet) {
                Set<Integer> network = kinaseNetworkMap.getOrDefault(kinaseId, Collections.emptySet());
                int[] networkIdxArray = new int[network.size()];
                int i = 0;
                for (int idx : network) {
                    networkIdxArray[i++] = idx;
                }
                taskList.add(threadPool.submit(new SwingWrap(kinaseId, networkIdxArray, foldChangeArray, pValueArray, pCutFc, pseudoCount, permutations, RandomSource.create(seed, RandomSource.SWING_STAGE, kinaseId))));
            }
            for (Future<SwingResult> task : taskList) {
                rawResultList.add(task.get());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new KinSwingException("Swing computation was interrupted.", ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof KinSwingException) {
                throw (KinSwingException) ex.getCause();
            }
            throw new KinSwingException("Swing computation failed: " + ex.getCause(), ex.getCause());
        } finally {
            threadPool.shutdown();
        }

        swingResultList = standardize(rawResultList);
    }

    /**
     * Adds the swing score standardized over all kinases with a defined score.
     */
    static List<SwingResult> standardize(List<SwingResult> rawResultList) {
        DescriptiveStatistics statistics = new DescriptiveStatistics();
        for (SwingResult result : rawResultList) {
            if (result.hasSwingScore()) {
                statistics.addValue(result.swingScore);
            }
        }
        double mean = statistics.getMean();
        double sd = statistics.getStandardDeviation();
        boolean canStandardize = statistics.getN() > 1 && sd > 0;
        if (!canStandardize) {
            logger.debug("Cannot standardize swing scores ({} defined scores, sd = {}).", statistics.getN(), sd);
        }

        ImmutableList.Builder<SwingResult> builder = ImmutableList.builder();
        for (SwingResult result : rawResultList) {
            if (canStandardize && result.hasSwingScore()) {
                builder.add(result.withSwingZ((result.swingScore - mean) / sd));
            } else {
                builder.add(result);
            }
        }
        return builder.build();
    }

    public List<SwingResult> getSwingResultList() {
        return swingResultList;
    }
}
