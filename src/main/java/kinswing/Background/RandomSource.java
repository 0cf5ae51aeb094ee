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

import com.google.common.hash.Hashing;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

import java.nio.charset.StandardCharsets;

/**
 * Independent random streams, one per stage and kinase, so that the result does not depend on the thread count.
 */
public class RandomSource {

    public static final String SCORE_STAGE = "score";
    public static final String SWING_STAGE = "swing";

    public static long deriveSeed(long seed, String stage, String kinaseId) {
        return Hashing.murmur3_128().newHasher()
                .putLong(seed)
                .putString(stage, StandardCharsets.UTF_8)
                .putString(kinaseId, StandardCharsets.UTF_8)
                .hash()
                .asLong();
    }

    /**
     * @param seed global seed, {@code null} for a fresh unseeded generator
     */
    public static RandomGenerator create(Long seed, String stage, String kinaseId) {
        if (seed == null) {
            return new MersenneTwister();
        } else {
            return new MersenneTwister(deriveSeed(seed, stage, kinaseId));
        }
    }
}
