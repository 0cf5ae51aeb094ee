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

/**
 * Swing statistic of one kinase. Undefined values (empty network, no permutation, degenerate null) are NaN.
 */
public class SwingResult {

    public final String kinaseId;
    public final int nPositive;
    public final int nNegative;
    public final int networkSize;
    public final int nSubstratesSignificant;
    public final double pk;
    public final double nk;
    public final double swingScore;
    public final double swingZ;
    public final double empiricalP;
    public final double pLess;
    public final int nPermutationsRun;

    public SwingResult(String kinaseId, int nPositive, int nNegative, int networkSize, int nSubstratesSignificant, double pk, double nk, double swingScore, double swingZ, double empiricalP, double pLess, int nPermutationsRun) {
        this.kinaseId = kinaseId;
        this.nPositive = nPositive;
        this.nNegative = nNegative;
        this.networkSize = networkSize;
        this.nSubstratesSignificant = nSubstratesSignificant;
        this.pk = pk;
        this.nk = nk;
        this.swingScore = swingScore;
        this.swingZ = swingZ;
        this.empiricalP = empiricalP;
        this.pLess = pLess;
        this.nPermutationsRun = nPermutationsRun;
    }

    public SwingResult withSwingZ(double swingZ) {
        return new SwingResult(kinaseId, nPositive, nNegative, networkSize, nSubstratesSignificant, pk, nk, swingScore, swingZ, empiricalP, pLess, nPermutationsRun);
    }

    public boolean hasSwingScore() {
        return !Double.isNaN(swingScore);
    }

    public boolean hasEmpiricalP() {
        return !Double.isNaN(empiricalP);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof SwingResult) {
            SwingResult temp = (SwingResult) other;
            return kinaseId.contentEquals(temp.kinaseId)
                    && nPositive == temp.nPositive
                    && nNegative == temp.nNegative
                    && networkSize == temp.networkSize
                    && nSubstratesSignificant == temp.nSubstratesSignificant
                    && Double.compare(pk, temp.pk) == 0
                    && Double.compare(nk, temp.nk) == 0
                    && Double.compare(swingScore, temp.swingScore) == 0
                    && Double.compare(swingZ, temp.swingZ) == 0
                    && Double.compare(empiricalP, temp.empiricalP) == 0
                    && Double.compare(pLess, temp.pLess) == 0
                    && nPermutationsRun == temp.nPermutationsRun;
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(kinaseId, networkSize, swingScore, empiricalP, pLess);
    }

    @Override
    public String toString() {
        return kinaseId + "-" + swingScore + "-" + empiricalP;
    }
}
