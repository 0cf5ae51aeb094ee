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

import java.util.Arrays;

/**
 * Centering of sequences on the phosphosite, which is at {@code length / 2}.
 */
public class AlignTool {

    /**
     * Trims a sequence symmetrically around its center. The sequence must not be shorter than {@code length}.
     */
    public static String trimToCenter(String sequence, int length) {
        int start = sequence.length() / 2 - length / 2;
        return sequence.substring(start, start + length);
    }

    /**
     * Aligns a peptide on a PWM of the given length: longer peptides are trimmed, shorter ones padded with the wild
     * card on both sides.
     *
     * @return the aligned sequence, or {@code null} if the peptide cannot be padded symmetrically
     */
    public static String centerOnPwm(String sequence, int length, char wildCard) {
        if (sequence.length() >= length) {
            return trimToCenter(sequence, length);
        }
        int padNum = length - sequence.length();
        if (padNum % 2 != 0) {
            return null;
        }
        char[] pad = new char[padNum / 2];
        Arrays.fill(pad, wildCard);
        String padStr = new String(pad);
        return padStr + sequence + padStr;
    }
}
