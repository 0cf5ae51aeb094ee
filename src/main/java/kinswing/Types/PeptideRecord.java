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

public class PeptideRecord {

    public final String annotation;
    public final String sequence;
    public final double foldChange;
    public final double pValue;

    public PeptideRecord(String annotation, String sequence, double foldChange, double pValue) {
        this.annotation = annotation;
        this.sequence = sequence;
        this.foldChange = foldChange;
        this.pValue = pValue;
    }

    public PeptideRecord withAnnotation(String annotation) {
        return new PeptideRecord(annotation, sequence, foldChange, pValue);
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof PeptideRecord) {
            PeptideRecord temp = (PeptideRecord) other;
            return annotation.contentEquals(temp.annotation) && sequence.contentEquals(temp.sequence) && Double.compare(foldChange, temp.foldChange) == 0 && Double.compare(pValue, temp.pValue) == 0;
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(annotation, sequence, foldChange, pValue);
    }

    @Override
    public String toString() {
        return annotation + "-" + sequence + "-" + foldChange + "-" + pValue;
    }
}
