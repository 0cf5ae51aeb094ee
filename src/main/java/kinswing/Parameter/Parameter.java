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

import kinswing.KinSwing;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.*;

/**
 * Reads a parameter file: a version line {@code # <version>} followed by {@code name = value # comment} lines.
 */
public class Parameter {

    private static final Pattern commentLinePattern = Pattern.compile("^#.*");
    private static final Pattern linePattern = Pattern.compile("([^#]+)=([^#]+)#*.*");

    private Map<String, String> parameterMap = new LinkedHashMap<>();

    public Parameter(String parameterFile) throws IOException {
        try (BufferedReader parameterReader = new BufferedReader(new InputStreamReader(new FileInputStream(parameterFile), StandardCharsets.UTF_8))) {
            read(parameterReader);
        }
    }

    public Parameter(BufferedReader parameterReader) throws IOException {
        read(parameterReader);
    }

    private void read(BufferedReader parameterReader) throws IOException {
        String line = parameterReader.readLine();
        if (line == null) {
            throw new IOException("The parameter file is empty.");
        }
        line = line.trim();
        if (!line.contentEquals("# " + KinSwing.versionStr)) {
            throw new IOException(String.format(Locale.US, "The parameter file version (%s) is not compatible with current KinSwing version (%s).", line.startsWith("# ") ? line.substring(2) : line, KinSwing.versionStr));
        }
        while ((line = parameterReader.readLine()) != null) {
            line = line.trim();
            Matcher commentLineMatcher = commentLinePattern.matcher(line);
            if (!commentLineMatcher.matches()) {
                // This is not a comment line
                Matcher lineMatcher = linePattern.matcher(line);
                if (lineMatcher.matches()) {
                    String parameterName = lineMatcher.group(1).trim();
                    String parameterValue = lineMatcher.group(2).trim();
                    parameterMap.put(parameterName, parameterValue);
                }
            }
        }
    }

    public Map<String, String> returnParameterMap() {
        return parameterMap;
    }
}
