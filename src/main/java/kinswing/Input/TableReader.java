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

package kinswing.Input;

import kinswing.Exceptions.MalformedInputException;
import kinswing.Types.KinaseTableRow;
import kinswing.Types.PeptideRecord;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Reads the tab-separated kinase table and phosphopeptide data. The first line of both files is a header.
 */
public class TableReader {

    public static final String[] kinaseTableColumns = new String[]{"kinase", "sequence"};
    public static final String[] inputDataColumns = new String[]{"annotation", "sequence", "fold_change", "p_value"};

    public static List<KinaseTableRow> readKinaseTable(String path) throws IOException, MalformedInputException {
        try (BufferedReader reader = open(path)) {
            return readKinaseTable(reader, path);
        }
    }

    public static List<KinaseTableRow> readKinaseTable(BufferedReader reader, String source) throws IOException, MalformedInputException {
        List<KinaseTableRow> output = new ArrayList<>();
        String line = reader.readLine(); // header
        int lineNum = 1;
        while ((line = reader.readLine()) != null) {
            ++lineNum;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] parts = split(line, kinaseTableColumns, source, lineNum);
            if (parts[0].isEmpty()) {
                throw new MalformedInputException(source, lineNum, kinaseTableColumns[0], "empty kinase name.");
            }
            output.add(new KinaseTableRow(parts[0], parts[1]));
        }
        return output;
    }

    public static List<PeptideRecord> readInputData(String path) throws IOException, MalformedInputException {
        try (BufferedReader reader = open(path)) {
            return readInputData(reader, path);
        }
    }

    public static List<PeptideRecord> readInputData(BufferedReader reader, String source) throws IOException, MalformedInputException {
        List<PeptideRecord> output = new ArrayList<>();
        String line = reader.readLine(); // header
        int lineNum = 1;
        while ((line = reader.readLine()) != null) {
            ++lineNum;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] parts = split(line, inputDataColumns, source, lineNum);
            if (parts[0].isEmpty()) {
                throw new MalformedInputException(source, lineNum, inputDataColumns[0], "empty annotation.");
            }
            if (parts[1].isEmpty()) {
                throw new MalformedInputException(source, lineNum, inputDataColumns[1], "empty sequence.");
            }
            double foldChange = parseDouble(parts[2], source, lineNum, inputDataColumns[2]);
            double pValue = parseDouble(parts[3], source, lineNum, inputDataColumns[3]);
            if (pValue < 0 || pValue > 1) {
                throw new MalformedInputException(source, lineNum, inputDataColumns[3], String.format(Locale.US, "p-value %s is not within [0, 1].", parts[3]));
            }
            output.add(new PeptideRecord(parts[0], parts[1], foldChange, pValue));
        }
        return output;
    }

    private static BufferedReader open(String path) throws FileNotFoundException {
        File file = new File(path);
        if (!file.exists() || file.isDirectory()) {
            throw new FileNotFoundException(String.format(Locale.US, "Cannot find %s.", path));
        }
        return new BufferedReader(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8));
    }

    private static String[] split(String line, String[] columns, String source, int lineNum) throws MalformedInputException {
        String[] parts = line.split("\t", -1);
        if (parts.length != columns.length) {
            throw new MalformedInputException(source, lineNum, columns[Math.min(parts.length, columns.length - 1)], String.format(Locale.US, "expected %d columns (%s) but found %d.", columns.length, String.join(", ", columns), parts.length));
        }
        for (int i = 0; i < parts.length; ++i) {
            parts[i] = parts[i].trim();
        }
        return parts;
    }

    private static double parseDouble(String value, String source, int lineNum, String column) throws MalformedInputException {
        double output;
        try {
            output = Double.valueOf(value);
        } catch (NumberFormatException ex) {
            throw new MalformedInputException(source, lineNum, column, String.format(Locale.US, "%s is not a number.", value));
        }
        if (Double.isNaN(output) || Double.isInfinite(output)) {
            throw new MalformedInputException(source, lineNum, column, String.format(Locale.US, "%s is not a finite number.", value));
        }
        return output;
    }
}
