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

/**
 * A residue outside of the amino acid alphabet (and not the wild card) was found in an input sequence.
 */
public class InvalidAlphabetException extends KinSwingException {

    private final char symbol;
    private final String recordId;

    public InvalidAlphabetException(char symbol, String recordId, String sequence) {
        super(String.format(Locale.US, "Invalid residue '%c' in sequence %s of record %s.", symbol, sequence, recordId));
        this.symbol = symbol;
        this.recordId = recordId;
    }

    public char getSymbol() {
        return symbol;
    }

    public String getRecordId() {
        return recordId;
    }
}
