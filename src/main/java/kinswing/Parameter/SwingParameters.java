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

package kinswing.Parameter;

import com.google.common.collect.ImmutableMap;
import kinswing.Score.ScoreSequences;
import kinswing.Types.Alphabet;

import java.util.*;

/**
 * Typed and validated view of the parameter map. Missing keys take their defaults.
 */
public class SwingParameters {

    public static final Map<String, String> DEFAULTS = ImmutableMap.<String, String>builder()
            .put("wild_card", "_")
            .put("substrate_length", "15")
            .put("remove_center", "0")
            .put("background", ScoreSequences.RANDOM_BACKGROUND)
            .put("n", "1000")
            .put("force_trim", "0")
            .put("seed", "1234")
            .put("pwm_pseudo", "0.01")
            .put("pseudo_count", "1")
            .put("p_cut_pwm", "0.05")
            .put("p_cut_fc", "0.05")
            .put("permutations", "100")
            .put("verbose", "0")
            .put("threads", "1")
            .put("clean_annotation", "1")
            .build();

    public final char wildCard;
    public final int substrateLength;
    public final Character removeCenter;
    public final String background;
    public final int n;
    public final boolean forceTrim;
    public final Long seed;
    public final double pwmPseudo;
    public final double pseudoCount;
    public final double pCutPwm;
    public final double pCutFc;
    public final int permutations;
    public final boolean verbose;
    public final int threads;
    public final boolean cleanAnnotation;

    public SwingParameters(Map<String, String> parameterMap) {
        Map<String, String> map = new HashMap<>(DEFAULTS);
        map.putAll(parameterMap);

        String wildCardStr = map.get("wild_card").trim();
        if (wildCardStr.length() != 1) {
            throw new IllegalArgumentException(String.format(Locale.US, "wild_card must be a single character (%s).", wildCardStr));
        }
        wildCard = wildCardStr.charAt(0);
        new Alphabet(wildCard); // rejects an amino acid as the wild card

        substrateLength = Integer.valueOf(map.get("substrate_length").trim());
        if (substrateLength < 1) {
            throw new IllegalArgumentException(String.format(Locale.US, "substrate_length must be positive (%d).", substrateLength));
        }

        String removeCenterStr = map.get("remove_center").trim();
        if (isFalse(removeCenterStr)) {
            removeCenter = null;
        } else if (removeCenterStr.length() == 1 && Alphabet.index(Character.toUpperCase(removeCenterStr.charAt(0))) >= 0) {
            removeCenter = removeCenterStr.charAt(0);
        } else {
            throw new IllegalArgumentException(String.format(Locale.US, "remove_center must be 0 or an amino acid letter (%s).", removeCenterStr));
        }

        background = map.get("background").trim();
        if (!background.contentEquals(ScoreSequences.RANDOM_BACKGROUND)) {
            throw new IllegalArgumentException(String.format(Locale.US, "Unsupported background %s. Only \"%s\" is available.", background, ScoreSequences.RANDOM_BACKGROUND));
        }

        n = Integer.valueOf(map.get("n").trim());
        if (n < 1) {
            throw new IllegalArgumentException(String.format(Locale.US, "n must be positive (%d).", n));
        }

        forceTrim = isTrue(map.get("force_trim").trim());

        String seedStr = map.get("seed").trim();
        if (seedStr.equalsIgnoreCase("NULL")) {
            seed = null;
        } else {
            seed = Long.valueOf(seedStr);
        }

        pwmPseudo = Double.valueOf(map.get("pwm_pseudo").trim());
        if (!(pwmPseudo > 0)) {
            throw new IllegalArgumentException(String.format(Locale.US, "pwm_pseudo must be positive (%s).", map.get("pwm_pseudo")));
        }
        pseudoCount = Double.valueOf(map.get("pseudo_count").trim());
        if (!(pseudoCount > 0)) {
            throw new IllegalArgumentException(String.format(Locale.US, "pseudo_count must be positive (%s).", map.get("pseudo_count")));
        }

        pCutPwm = parseProbability(map, "p_cut_pwm");
        pCutFc = parseProbability(map, "p_cut_fc");

        String permutationsStr = map.get("permutations").trim();
        if (isFalse(permutationsStr)) {
            permutations = 0;
        } else {
            permutations = Integer.valueOf(permutationsStr);
        }

        verbose = isTrue(map.get("verbose").trim());

        threads = Integer.valueOf(map.get("threads").trim());
        if (threads < 0) {
            throw new IllegalArgumentException(String.format(Locale.US, "threads cannot be negative (%d).", threads));
        }

        cleanAnnotation = isTrue(map.get("clean_annotation").trim());
    }

    public static SwingParameters defaults() {
        return new SwingParameters(Collections.<String, String>emptyMap());
    }

    public Alphabet alphabet() {
        return new Alphabet(wildCard);
    }

    private static double parseProbability(Map<String, String> map, String key) {
        double value = Double.valueOf(map.get(key).trim());
        if (!(value >= 0 && value <= 1)) {
            throw new IllegalArgumentException(String.format(Locale.US, "%s must be within [0, 1] (%s).", key, map.get(key)));
        }
        return value;
    }

    private static boolean isTrue(String value) {
        return value.contentEquals("1") || value.equalsIgnoreCase("true");
    }

    private static boolean isFalse(String value) {
        return value.contentEquals("0") || value.equalsIgnoreCase("false");
    }
}
