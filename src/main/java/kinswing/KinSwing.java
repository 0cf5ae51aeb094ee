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

package kinswing;

import kinswing.Input.CleanAnnotation;
import kinswing.Input.TableReader;
import kinswing.Output.WriteSwingTable;
import kinswing.Parameter.Parameter;
import kinswing.Parameter.SwingParameters;
import kinswing.Types.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

public class KinSwing {

    private static final Logger logger = LoggerFactory.getLogger(KinSwing.class);
    public static final String versionStr = "1.0.0";

    public static void main(String[] args) {
        long startTime = System.nanoTime();

        if (args.length != 4) {
            help();
        }

        String parameterPath = args[0].trim();
        String kinaseTablePath = args[1].trim();
        String inputDataPath = args[2].trim();
        String outputPath = args[3].trim();

        logger.info("Running KinSwing version {}.", versionStr);

        int exitCode = 0;
        try {
            logger.info("Kinase table: {}, input data: {}, parameter: {}.", kinaseTablePath, inputDataPath, parameterPath);
            run(parameterPath, kinaseTablePath, inputDataPath, outputPath);
        } catch (Exception ex) {
            logger.error("KinSwing failed.", ex);
            exitCode = 1;
        }

        double totalMinute = (double) (System.nanoTime() - startTime) * 1e-9 / 60;
        logger.info("Running time: {} minutes.", totalMinute);
        if (exitCode == 0) {
            logger.info("Done!");
        }
        System.exit(exitCode);
    }

    static void run(String parameterPath, String kinaseTablePath, String inputDataPath, String outputPath) throws Exception {
        Map<String, String> parameterMap = new Parameter(parameterPath).returnParameterMap();
        SwingParameters parameters = new SwingParameters(parameterMap);

        // print all the parameters
        logger.info("Parameters:");
        for (String k : parameterMap.keySet()) {
            logger.info("{} = {}", k, parameterMap.get(k));
        }

        logger.info("Reading kinase table...");
        List<KinaseTableRow> kinaseTable = TableReader.readKinaseTable(kinaseTablePath);
        logger.info("Reading phosphopeptides...");
        List<PeptideRecord> inputData = TableReader.readInputData(inputDataPath);
        if (parameters.cleanAnnotation) {
            inputData = new CleanAnnotation(inputData).returnCleanedList();
        }
        logger.info("{} substrates, {} phosphopeptides.", kinaseTable.size(), inputData.size());

        List<SwingResult> swingResultList = SwingMaster.run(inputData, kinaseTable, parameters);

        logger.info("Saving results...");
        new WriteSwingTable(outputPath, swingResultList);
    }

    private static void help() {
        String helpStr = "KinSwing version " + versionStr + "\r\n"
                + "Predicts kinase activity from phosphoproteomics data.\r\n"
                + "Usage: java -jar /path/to/KinSwing.jar <parameter_file> <kinase_table> <input_data> <output_file>\r\n"
                + "\t<parameter_file>: parameter file.\r\n"
                + "\t<kinase_table>: tab-separated kinase, centered substrate sequence.\r\n"
                + "\t<input_data>: tab-separated annotation, centered peptide sequence, fold change, p-value.\r\n"
                + "\t<output_file>: swing table to write.\r\n"
                + "\texample: java -Xmx4g -jar KinSwing.jar parameter.def kinases.tsv phospho.tsv swing.tsv\r\n";
        System.out.print(helpStr);
        System.exit(1);
    }
}
