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

import com.google.common.collect.ImmutableList;
import kinswing.Background.RandomSource;
import kinswing.Exceptions.KinSwingException;
import kinswing.PWM.AlignTool;
import kinswing.Types.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * Scores every peptide against every kinase PWM. Each kinase is one task on a fixed thread pool with its own random
 * stream; the merged table is sorted by kinase id then peptide id.
 */
public class ScoreSequences {

    private static final Logger logger = LoggerFactory.getLogger(ScoreSequences.class);

    public static final String RANDOM_BACKGROUND = "random";

    private final List<MatchScore> matchScoreList;

    /**
     * @param peptideList phosphopeptides after annotation cleaning
     * @param pwmSet PWMs and the background they were built against
     * @param background only "random" is supported
     * @param n number of random background peptides per kinase
     * @param forceTrim not supported yet; ignored with a warning
     * @param seed global seed, {@code null} for unseeded generators
     * @param threadNum worker number, 0 for the number of processors
     */
    public ScoreSequences(List<PeptideRecord> peptideList, PwmSet pwmSet, String background, int n, boolean forceTrim, Long seed, int threadNum) throws KinSwingException {
        if (background == null || !RANDOM_BACKGROUND.contentEquals(background)) {
            throw new IllegalArgumentException(String.format(Locale.US, "Unsupported background %s. Only \"%s\" is available.", background, RANDOM_BACKGROUND));
        }
        if (n < 1) {
            throw new IllegalArgumentException(String.format(Locale.US, "The number of background peptides must be positive (%d).", n));
        }
        if (forceTrim) {
            logger.warn("force_trim is not supported in this version. Peptides are centered on the PWM instead.");
        }

        // align all peptides once; they are shared read-only by the tasks
        Alphabet alphabet = pwmSet.getAlphabet();
        int substrateLength = pwmSet.getSubstrateLength();
        List<String> peptideIdList = new ArrayList<>(peptideList.size());
        List<int[]> peptideCodeList = new ArrayList<>(peptideList.size());
        int skippedNum = 0;
        for (PeptideRecord peptide : peptideList) {
            String sequence = alphabet.normalize(peptide.annotation, peptide.sequence.trim());
            String aligned = AlignTool.centerOnPwm(sequence, substrateLength, alphabet.wildCard);
            if (aligned == null) {
                logger.debug("Peptide {} ({}) cannot be centered on a PWM of length {}. Skipped.", peptide.annotation, sequence, substrateLength);
                ++skippedNum;
                continue;
            }
            peptideIdList.add(peptide.annotation);
            peptideCodeList.add(alphabet.encode(aligned));
        }
        if (skippedNum > 0) {
            logger.warn("{} peptides cannot be centered and are not scored.", skippedNum);
        }
        String[] peptideIdArray = peptideIdList.toArray(new String[0]);
        int[][] peptideCodeArray = peptideCodeList.toArray(new int[0][]);

        if (threadNum == 0) {
            threadNum = Runtime.getRuntime().availableProcessors();
        }
        ExecutorService threadPool = Executors.newFixedThreadPool(threadNum);
        List<Future<List<MatchScore>>> taskList = new ArrayList<>(pwmSet.size());
        List<MatchScore> tempList = new ArrayList<>(pwmSet.size() * peptideIdArray.length);
        try {
            for (PositionWeightMatrix pwm : pwmSet.getPwmMap().values()) {
                taskList.add(threadPool.submit(new ScoreSequencesWrap(pwm, pwmSet.getBackgroundModel(), peptideIdArray, peptideCodeArray, n, RandomSource.create(seed, RandomSource.SCORE_STAGE, pwm.kinaseId))));
            }
            int lastProgress = 0;
            int count = 0;
            for (Future<List<MatchScore>> task : taskList) {
                tempList.addAll(task.get());
                ++count;
                int progress = count * 20 / taskList.size();
                if (progress != lastProgress) {
                    logger.debug("Scoring {}%...", progress * 5);
                    lastProgress = progress;
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new KinSwingException("Scoring was interrupted.", ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof KinSwingException) {
                throw (KinSwingException) ex.getCause();
            }
            throw new KinSwingException("Scoring failed: " + ex.getCause(), ex.getCause());
        } finally {
            threadPool.shutdown();
        }

        Collections.sort(tempList);
        matchScoreList = ImmutableList.copyOf(tempList);
    }

    public List<MatchScore> getMatchScoreList() {
        return matchScoreList;
    }
}
