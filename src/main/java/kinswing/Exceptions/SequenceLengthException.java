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

package kinswing.Exceptions;

import java.util.Locale;

public class SequenceLengthException extends KinSwingException {

    private final String recordId;
    private final int length;

    public SequenceLengthException(String recordId, String sequence, int requiredLength) {
        super(String.format(Locale.US, "Sequence %s of record %s has length %d, but at least %d residues are required.", sequence, recordId, sequence.length(), requiredLength));
        this.recordId = recordId;
        this.length = sequence.length();
    }

    public String getRecordId() {
        return recordId;
    }

    public int getLength() {
        return length;
    }
}
