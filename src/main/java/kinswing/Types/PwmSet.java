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

import com.google.common.collect.ImmutableSortedMap;
import kinswing.Background.BackgroundModel;

import java.util.Map;
import java.util.Set;

/**
 * All kinase PWMs of one run, sorted by kinase id, and the background they were built against.
 */
public class PwmSet {

    private final ImmutableSortedMap<String, PositionWeightMatrix> pwmMap;
    private final BackgroundModel backgroundModel;
    private final Alphabet alphabet;
    private final int substrateLength;

    public PwmSet(Map<String, PositionWeightMatrix> pwmMap, BackgroundModel backgroundModel, Alphabet alphabet, int substrateLength) {
        this.pwmMap = ImmutableSortedMap.copyOf(pwmMap);
        this.backgroundModel = backgroundModel;
        this.alphabet = alphabet;
        this.substrateLength = substrateLength;
    }

    public ImmutableSortedMap<String, PositionWeightMatrix> getPwmMap() {
        return pwmMap;
    }

    public PositionWeightMatrix get(String kinaseId) {
        return pwmMap.get(kinaseId);
    }

    public Set<String> kinaseSet() {
        return pwmMap.keySet();
    }

    public int size() {
        return pwmMap.size();
    }

    public BackgroundModel getBackgroundModel() {
        return backgroundModel;
    }

    public Alphabet getAlphabet() {
        return alphabet;
    }

    public int getSubstrateLength() {
        return substrateLength;
    }
}
