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
 * Wrong column count or column type in a kinase table or in the phosphopeptide input data.
 */
public class MalformedInputException extends KinSwingException {

    private final String source;
    private final int lineNum;
    private final String column;

    public MalformedInputException(String source, int lineNum, String column, String reason) {
        super(String.format(Locale.US, "Malformed input in %s (line %d, column %s): %s", source, lineNum, column, reason));
        this.source = source;
        this.lineNum = lineNum;
        this.column = column;
    }

    public MalformedInputException(String source, String column, String reason) {
        super(String.format(Locale.US, "Malformed input in %s (column %s): %s", source, column, reason));
        this.source = source;
        this.lineNum = -1;
        this.column = column;
    }

    public String getSource() {
        return source;
    }

    public int getLineNum() {
        return lineNum;
    }

    public String getColumn() {
        return column;
    }
}
