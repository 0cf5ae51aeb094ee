package kinswing.Swing;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import kinswing.Exceptions.MalformedInputException;
import kinswing.PWM.BuildPwm;
import kinswing.Score.ScoreSequences;
import kinswing.Types.Alphabet;
import kinswing.Types.KinaseTableRow;
import kinswing.Types.MatchScore;
import kinswing.Types.PeptideRecord;
import kinswing.Types.PwmSet;
import kinswing.Types.SwingResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class SwingTest {

  private static PwmSet pwmSet;
  private static List<PeptideRecord> peptideList;
  private static List<MatchScore> matchScoreList;

  @BeforeAll
  static void setUp() throws Exception {
    List<KinaseTableRow> kinaseTable = new ArrayList<>();
    for (String kinaseId : new String[]{"K1", "K2", "K3"}) {
      kinaseTable.add(new KinaseTableRow(kinaseId, "AAAMAAAAAAAAAAA"));
    }
    pwmSet = new BuildPwm(kinaseTable, new Alphabet('_'), 15, null, 0.01, false).returnPwmSet();

    peptideList = Arrays.asList(
        new PeptideRecord("P1", "AAAAAAASAAAAAAA", 2, 0.01),
        new PeptideRecord("P2", "AAAAAAASAAAAAAA", -1, 0.01),
        new PeptideRecord("P3", "AAAAAAASAAAAAAA", 3, 0.5),
        new PeptideRecord("P4", "AAAAAAASAAAAAAA", -2, 0.03),
        new PeptideRecord("P5", "AAAAAAASAAAAAAA", 0.5, 0.2));

    // K1: network P1, P2, P3. K2: nothing passes the PWM cutoff. K3: no match at all.
    matchScoreList = Arrays.asList(
        new MatchScore("K1", "P1", 0, 0, 0.001),
        new MatchScore("K1", "P2", 0, 0, 0.01),
        new MatchScore("K1", "P3", 0, 0, 0.02),
        new MatchScore("K1", "P4", 0, 0, 0.9),
        new MatchScore("K2", "P1", 0, 0, 0.2),
        new MatchScore("K2", "P4", 0, 0, 0.06));
  }

  private static List<SwingResult> swing(List<MatchScore> scores, int permutations, Long seed, int threadNum) throws Exception {
    return new Swing(peptideList, pwmSet, scores, 1, 0.05, 0.05, permutations, seed, threadNum).getSwingResultList();
  }

  @Test
  void testSwingScore() throws Exception {
    List<SwingResult> swingResultList = swing(matchScoreList, 0, 1234L, 1);
    assertEquals(3, swingResultList.size());

    SwingResult k1 = swingResultList.get(0);
    assertEquals("K1", k1.kinaseId);
    assertEquals(3, k1.networkSize);
    assertEquals(1, k1.nPositive);
    assertEquals(1, k1.nNegative);
    assertEquals(2, k1.nSubstratesSignificant);
    assertEquals(0, k1.swingScore, 1e-12);
    assertEquals(0.5, k1.pk, 1e-12);
    assertEquals(0.5, k1.nk, 1e-12);
    assertTrue(Double.isNaN(k1.empiricalP));
    assertTrue(Double.isNaN(k1.pLess));
    assertEquals(0, k1.nPermutationsRun);

    // kinases without a significant match stay in the table
    for (SwingResult result : swingResultList.subList(1, 3)) {
      assertEquals(0, result.networkSize);
      assertFalse(result.hasSwingScore());
      assertFalse(result.hasEmpiricalP());
    }
    assertEquals("K2", swingResultList.get(1).kinaseId);
    assertEquals("K3", swingResultList.get(2).kinaseId);
  }

  @Test
  void testSinglePositiveSubstrate() throws Exception {
    List<MatchScore> scores = Collections.singletonList(new MatchScore("K1", "P1", 0, 0, 0.01));
    SwingResult k1 = swing(scores, 0, 1234L, 1).get(0);
    assertEquals(1.0, k1.swingScore);
    assertTrue(Double.isNaN(k1.empiricalP));
    assertEquals(1, k1.nSubstratesSignificant);
  }

  @Test
  void testPermutationOneIsSkipped() throws Exception {
    SwingResult k1 = swing(matchScoreList, 1, 1234L, 1).get(0);
    assertFalse(k1.hasEmpiricalP());
    assertEquals(0, k1.nPermutationsRun);
  }

  @Test
  void testPermutationReproducible() throws Exception {
    List<SwingResult> a = swing(matchScoreList, 10, 1234L, 1);
    List<SwingResult> b = swing(matchScoreList, 10, 1234L, 1);
    List<SwingResult> c = swing(matchScoreList, 10, 1234L, 3);
    assertEquals(a, b);
    assertEquals(a, c);
    assertEquals(10, a.get(0).nPermutationsRun);
    if (a.get(0).hasEmpiricalP()) {
      assertTrue(a.get(0).empiricalP >= 1.0 / 11 && a.get(0).empiricalP <= 1);
      assertTrue(a.get(0).pLess >= 1.0 / 11 && a.get(0).pLess <= 1);
    }
  }

  @Test
  void testPermutationPValue() throws Exception {
    // one significant up-regulated label out of four; the network holds only that peptide
    List<PeptideRecord> population = Arrays.asList(
        new PeptideRecord("P1", "AAAAAAASAAAAAAA", 2, 0.01),
        new PeptideRecord("P2", "AAAAAAASAAAAAAA", 1, 0.5),
        new PeptideRecord("P3", "AAAAAAASAAAAAAA", -1, 0.5),
        new PeptideRecord("P4", "AAAAAAASAAAAAAA", 0.5, 0.5));
    List<MatchScore> scores = Collections.singletonList(new MatchScore("K1", "P1", 0, 0, 0.01));
    SwingResult k1 = new Swing(population, pwmSet, scores, 1, 0.05, 0.05, 1000, 1234L, 1).getSwingResultList().get(0);
    assertEquals(1.0, k1.swingScore);
    assertEquals(1000, k1.nPermutationsRun);
    assertTrue(k1.hasEmpiricalP());
    // the null swing is 1 with probability 1/4 and 0 otherwise
    assertEquals(0.25, k1.empiricalP, 0.06);
    assertEquals(1.0, k1.pLess, 1e-12);
  }

  @Test
  void testDegenerateNull() throws Exception {
    List<PeptideRecord> insignificantList = new ArrayList<>();
    for (PeptideRecord peptide : peptideList) {
      insignificantList.add(new PeptideRecord(peptide.annotation, peptide.sequence, peptide.foldChange, 0.5));
    }
    SwingResult k1 = new Swing(insignificantList, pwmSet, matchScoreList, 1, 0.05, 0.05, 20, 1234L, 1).getSwingResultList().get(0);
    assertEquals(0, k1.swingScore);
    assertFalse(k1.hasEmpiricalP());
    assertEquals(20, k1.nPermutationsRun);
  }

  @Test
  void testBoundsOnRandomData() throws Exception {
    Random random = new Random(7);
    List<PeptideRecord> randomPeptideList = new ArrayList<>();
    List<MatchScore> randomScoreList = new ArrayList<>();
    for (int i = 0; i < 60; ++i) {
      String id = "P" + i;
      randomPeptideList.add(new PeptideRecord(id, "AAAAAAASAAAAAAA", random.nextGaussian(), random.nextDouble() * 0.2));
      for (String kinaseId : new String[]{"K1", "K2", "K3"}) {
        randomScoreList.add(new MatchScore(kinaseId, id, 0, 0, random.nextDouble() * 0.3));
      }
    }
    int permutations = 50;
    List<SwingResult> swingResultList = new Swing(randomPeptideList, pwmSet, randomScoreList, 1, 0.05, 0.05, permutations, 1234L, 2).getSwingResultList();
    for (SwingResult result : swingResultList) {
      assertTrue(result.networkSize > 0);
      assertTrue(result.swingScore >= -1 && result.swingScore <= 1);
      if (result.hasEmpiricalP()) {
        assertTrue(result.empiricalP >= 1.0 / (permutations + 1) && result.empiricalP <= 1);
      }
    }
  }

  @Test
  void testUnknownPeptide() {
    List<MatchScore> scores = Collections.singletonList(new MatchScore("K1", "P99", 0, 0, 0.01));
    MalformedInputException ex = assertThrows(MalformedInputException.class, () -> swing(scores, 0, 1234L, 1));
    assertTrue(ex.getMessage().contains("P99"));
  }

  @Test
  void testDuplicateAnnotation() {
    List<PeptideRecord> duplicateList = new ArrayList<>(peptideList);
    duplicateList.add(new PeptideRecord("P1", "AAAAAAASAAAAAAA", 1, 0.01));
    assertThrows(MalformedInputException.class, () -> new Swing(duplicateList, pwmSet, matchScoreList, 1, 0.05, 0.05, 0, 1234L, 1));
  }

  @Test
  void testStandardize() {
    List<SwingResult> rawList = Arrays.asList(
        new SwingResult("K1", 1, 0, 1, 1, 1, 0.5, 1, Double.NaN, Double.NaN, Double.NaN, 0),
        new SwingResult("K2", 0, 0, 1, 0, 0.5, 0.5, 0, Double.NaN, Double.NaN, Double.NaN, 0),
        new SwingResult("K3", 0, 1, 1, 1, 0.5, 1, -1, Double.NaN, Double.NaN, Double.NaN, 0),
        new SwingResult("K4", 0, 0, 0, 0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0));
    List<SwingResult> resultList = Swing.standardize(rawList);
    assertEquals(1, resultList.get(0).swingZ, 1e-12);
    assertEquals(0, resultList.get(1).swingZ, 1e-12);
    assertEquals(-1, resultList.get(2).swingZ, 1e-12);
    assertTrue(Double.isNaN(resultList.get(3).swingZ));
  }

  @Test
  void testEndToEndScenario() throws Exception {
    List<KinaseTableRow> kinaseTable = new ArrayList<>(Collections.nCopies(5, new KinaseTableRow("K1", "AAAMAAAAAAAAAAA")));
    PwmSet k1Set = new BuildPwm(kinaseTable, new Alphabet('_'), 15, null, 0.01, false).returnPwmSet();
    List<PeptideRecord> inputData = Collections.singletonList(new PeptideRecord("P1", "AAAMAAAAAAAAAAA", 2, 0.01));
    List<MatchScore> scores = new ScoreSequences(inputData, k1Set, "random", 1000, false, 1234L, 1).getMatchScoreList();
    List<SwingResult> swingResultList = new Swing(inputData, k1Set, scores, 1, 0.05, 0.05, 0, 1234L, 1).getSwingResultList();
    assertEquals(1, swingResultList.size());
    assertEquals(1.0, swingResultList.get(0).swingScore);
    assertTrue(Double.isNaN(swingResultList.get(0).empiricalP));
  }
}
