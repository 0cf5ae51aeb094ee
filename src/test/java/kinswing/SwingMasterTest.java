package kinswing;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableMap;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import kinswing.Exceptions.EmptyKinaseGroupException;
import kinswing.Input.CleanAnnotation;
import kinswing.Input.TableReader;
import kinswing.Parameter.Parameter;
import kinswing.Parameter.SwingParameters;
import kinswing.Types.KinaseTableRow;
import kinswing.Types.MatchScore;
import kinswing.Types.PeptideRecord;
import kinswing.Types.PwmSet;
import kinswing.Types.SwingResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SwingMasterTest {

  private static SwingParameters parameters;
  private static List<KinaseTableRow> kinaseTable;
  private static List<PeptideRecord> inputData;

  private static String resourcePath(String name) throws Exception {
    return Paths.get(SwingMasterTest.class.getClassLoader().getResource(name).toURI()).toString();
  }

  @BeforeAll
  static void setUp() throws Exception {
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(SwingMasterTest.class.getClassLoader().getResourceAsStream("parameter.def"), StandardCharsets.UTF_8))) {
      parameters = new SwingParameters(new Parameter(reader).returnParameterMap());
    }
    kinaseTable = TableReader.readKinaseTable(resourcePath("kinase_table.tsv"));
    inputData = new CleanAnnotation(TableReader.readInputData(resourcePath("input_data.tsv"))).returnCleanedList();
  }

  @Test
  void testRun() throws Exception {
    assertEquals(4, inputData.size());
    List<SwingResult> swingResultList = SwingMaster.run(inputData, kinaseTable, parameters);
    assertEquals(2, swingResultList.size());

    SwingResult k1 = swingResultList.get(0);
    assertEquals("K1", k1.kinaseId);
    assertEquals(1, k1.networkSize);
    assertEquals(1.0, k1.swingScore);
    assertTrue(k1.swingZ > 0);

    SwingResult k2 = swingResultList.get(1);
    assertEquals("K2", k2.kinaseId);
    assertEquals(2, k2.networkSize);
    assertEquals(2, k2.nNegative);
    assertEquals(-1.0, k2.swingScore);
    assertTrue(k2.swingZ < 0);

    for (SwingResult result : swingResultList) {
      assertEquals(10, result.nPermutationsRun);
      if (result.hasEmpiricalP()) {
        assertTrue(result.empiricalP >= 1.0 / 11 && result.empiricalP <= 1);
      }
    }

    assertEquals(swingResultList, SwingMaster.run(inputData, kinaseTable, parameters));
  }

  @Test
  void testStagesSeparately() throws Exception {
    PwmSet pwmSet = SwingMaster.buildPwm(kinaseTable, parameters);
    assertEquals(2, pwmSet.size());
    List<MatchScore> scoreList = SwingMaster.scoreSequences(inputData, pwmSet, parameters);
    assertEquals(2 * inputData.size(), scoreList.size());
    assertThrows(UnsupportedOperationException.class, () -> scoreList.add(scoreList.get(0)));
    List<SwingResult> swingResultList = SwingMaster.swing(inputData, pwmSet, scoreList, parameters);
    assertEquals(SwingMaster.run(inputData, kinaseTable, parameters), swingResultList);
  }

  @Test
  void testThreadCountDoesNotChangeResult() throws Exception {
    Map<String, String> parameterMap = ImmutableMap.of("n", "200", "permutations", "10", "threads", "1");
    List<SwingResult> a = SwingMaster.run(inputData, kinaseTable, new SwingParameters(parameterMap));
    List<SwingResult> b = SwingMaster.run(inputData, kinaseTable, new SwingParameters(ImmutableMap.of("n", "200", "permutations", "10", "threads", "4")));
    assertEquals(a, b);
  }

  @Test
  void testEmptyKinaseGroupStopsTheRun() {
    List<KinaseTableRow> table = new ArrayList<>(kinaseTable);
    table.add(new KinaseTableRow("K3", ""));
    EmptyKinaseGroupException ex = assertThrows(EmptyKinaseGroupException.class, () -> SwingMaster.run(inputData, table, parameters));
    assertEquals("K3", ex.getKinaseId());
  }

  @Test
  void testCommandLineRun(@TempDir Path tempDir) throws Exception {
    Path outputPath = tempDir.resolve("swing.tsv");
    KinSwing.run(resourcePath("parameter.def"), resourcePath("kinase_table.tsv"), resourcePath("input_data.tsv"), outputPath.toString());
    List<String> lines = Files.readAllLines(outputPath, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).startsWith("kinase\tpos\tneg\tall"));
    assertTrue(lines.get(1).startsWith("K1\t1\t0\t1\t1\t"));
    assertTrue(lines.get(2).startsWith("K2\t0\t2\t2\t2\t"));
    assertTrue(lines.get(1).endsWith("\t10"));
  }
}
