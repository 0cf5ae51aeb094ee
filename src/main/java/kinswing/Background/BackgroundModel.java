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

package kinswing.Background;

import com.google.common.collect.ImmutableMap;
import kinswing.Types.Alphabet;
import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Random background: expected amino acid frequencies taken from the aggregate composition of the substrate sequences.
 * Every residue gets one pseudo observation so that no frequency is zero.
 */
public class BackgroundModel {

    private static final Logger logger = LoggerFactory.getLogger(BackgroundModel.class);

    private final double[] frequencyArray = new double[Alphabet.SIZE];
    private final int[] residueIdxArray = new int[Alphabet.SIZE];
    private final boolean isUniform;

    private BackgroundModel(long[] countArray) {
        long totalCount = 0;
        for (long count : countArray) {
            totalCount += count;
        }
        isUniform = totalCount < Alphabet.SIZE;
        for (int i = 0; i < Alphabet.SIZE; ++i) {
            residueIdxArray[i] = i;
            if (isUniform) {
                frequencyArray[i] = 1.0 / Alphabet.SIZE;
            } else {
                frequencyArray[i] = (countArray[i] + 1.0) / (totalCount + Alphabet.SIZE);
            }
        }
    }

    /**
     * Builds the background from sequences which have already been validated against the alphabet. Wild cards are not
     * counted.
     */
    public static BackgroundModel fromSequences(Collection<String> sequences) {
        long[] countArray = new long[Alphabet.SIZE];
        for (String sequence : sequences) {
            for (int i = 0; i < sequence.length(); ++i) {
                int idx = Alphabet.index(sequence.charAt(i));
                if (idx >= 0) {
                    ++countArray[idx];
                }
            }
        }
        BackgroundModel backgroundModel = new BackgroundModel(countArray);
        if (backgroundModel.isUniform) {
            logger.warn("Too few residues to estimate the background. Use uniform amino acid frequencies.");
        }
        return backgroundModel;
    }

    public static BackgroundModel uniform() {
        return new BackgroundModel(new long[Alphabet.SIZE]);
    }

    public ImmutableMap<Character, Double> frequencies() {
        ImmutableMap.Builder<Character, Double> builder = ImmutableMap.builder();
        for (int i = 0; i < Alphabet.SIZE; ++i) {
            builder.put(Alphabet.residue(i), frequencyArray[i]);
        }
        return builder.build();
    }

    public double frequency(int residueIdx) {
        return frequencyArray[residueIdx];
    }

    public boolean isUniform() {
        return isUniform;
    }

    /**
     * A sampler of residue indices following the background. The sampler owns the generator; do not share it
     * between threads.
     */
    public EnumeratedIntegerDistribution sampler(RandomGenerator randomGenerator) {
        return new EnumeratedIntegerDistribution(randomGenerator, residueIdxArray, frequencyArray);
    }
}
