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

import java.util.Objects;

public class MatchScore implements Comparable<MatchScore> {

    public final String kinaseId;
    public final String peptideId;
    public final double rawScore;
    public final double logOddsScore;
    public final double empiricalP;

    public MatchScore(String kinaseId, String peptideId, double rawScore, double logOddsScore, double empiricalP) {
        this.kinaseId = kinaseId;
        this.peptideId = peptideId;
        this.rawScore = rawScore;
        this.logOddsScore = logOddsScore;
        this.empiricalP = empiricalP;
    }

    @Override
    public int compareTo(MatchScore other) {
        int result = kinaseId.compareTo(other.kinaseId);
        if (result != 0) {
            return result;
        }
        return peptideId.compareTo(other.peptideId);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof MatchScore) {
            MatchScore temp = (MatchScore) other;
            return kinaseId.contentEquals(temp.kinaseId) && peptideId.contentEquals(temp.peptideId) && Double.compare(rawScore, temp.rawScore) == 0 && Double.compare(logOddsScore, temp.logOddsScore) == 0 && Double.compare(empiricalP, temp.empiricalP) == 0;
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(kinaseId, peptideId, rawScore, logOddsScore, empiricalP);
    }

    @Override
    public String toString() {
        return kinaseId + "-" + peptideId + "-" + logOddsScore + "-" + empiricalP;
    }
}
