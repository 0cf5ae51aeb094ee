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

package kinswing.Output;

import kinswing.Types.SwingResult;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Writes the swing table as tab-separated text. Undefined values are written as NA.
 */
public class WriteSwingTable {

    public static final String header = "kinase\tpos\tneg\tall\tsignificant\tpk\tnk\tswing_score\tswing_z\tp_greater\tp_less\tpermutations\n";

    public WriteSwingTable(String outputPath, List<SwingResult> swingResultList) throws IOException {
        try (Writer writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(outputPath), StandardCharsets.UTF_8))) {
            write(writer, swingResultList);
        }
    }

    public static void write(Writer writer, List<SwingResult> swingResultList) throws IOException {
        writer.write(header);
        for (SwingResult result : swingResultList) {
            writer.write(String.format(Locale.US, "%s\t%d\t%d\t%d\t%d\t%s\t%s\t%s\t%s\t%s\t%s\t%d\n", result.kinaseId, result.nPositive, result.nNegative, result.networkSize, result.nSubstratesSignificant, format(result.pk), format(result.nk), format(result.swingScore), format(result.swingZ), format(result.empiricalP), format(result.pLess), result.nPermutationsRun));
        }
    }

    static String format(double value) {
        if (Double.isNaN(value)) {
            return "NA";
        }
        return String.format(Locale.US, "%.6f", value);
    }
}
