package kinswing.Input;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.StringReader;
import java.nio.file.Paths;
import java.util.List;
import kinswing.Exceptions.MalformedInputException;
import kinswing.Types.KinaseTableRow;
import kinswing.Types.PeptideRecord;
import org.junit.jupiter.api.Test;

class TableReaderTest {

  private static BufferedReader reader(String content) {
    return new BufferedReader(new StringReader(content));
  }

  @Test
  void testReadFixtures() throws Exception {
    String kinaseTablePath = Paths.get(getClass().getClassLoader().getResource("kinase_table.tsv").toURI()).toString();
    List<KinaseTableRow> kinaseTable = TableReader.readKinaseTable(kinaseTablePath);
    assertEquals(5, kinaseTable.size());
    assertEquals("K2", kinaseTable.get(4).kinaseId);
    assertEquals("GGRRRRRSPRRRRGG", kinaseTable.get(4).sequence);

    String inputDataPath = Paths.get(getClass().getClassLoader().getResource("input_data.tsv").toURI()).toString();
    List<PeptideRecord> inputData = TableReader.readInputData(inputDataPath);
    assertEquals(3, inputData.size());
    assertEquals("P2|GeneB;GeneC|S10;S12", inputData.get(1).annotation);
    assertEquals(-1.5, inputData.get(1).foldChange);
    assertEquals(0.02, inputData.get(1).pValue);
  }

  @Test
  void testBlankLinesAndEmptySequence() throws Exception {
    List<KinaseTableRow> kinaseTable = TableReader.readKinaseTable(reader("kinase\tsequence\nK1\tAAAMAAAAAAAAAAA\n\nK2\t\n"), "kinase_table");
    assertEquals(2, kinaseTable.size());
    assertEquals("", kinaseTable.get(1).sequence);
  }

  @Test
  void testWrongColumnCount() {
    MalformedInputException ex = assertThrows(MalformedInputException.class, () -> TableReader.readKinaseTable(reader("kinase\tsequence\nK1\tAAAMAAAAAAAAAAA\textra\n"), "kinase_table"));
    assertEquals(2, ex.getLineNum());
    assertEquals("kinase_table", ex.getSource());

    ex = assertThrows(MalformedInputException.class, () -> TableReader.readInputData(reader("h\nP1\tAAAMAAAAAAAAAAA\t2\n"), "input_data"));
    assertEquals("p_value", ex.getColumn());
  }

  @Test
  void testWrongTypes() {
    MalformedInputException ex = assertThrows(MalformedInputException.class, () -> TableReader.readInputData(reader("h\nP1\tAAAMAAAAAAAAAAA\tup\t0.01\n"), "input_data"));
    assertEquals("fold_change", ex.getColumn());

    ex = assertThrows(MalformedInputException.class, () -> TableReader.readInputData(reader("h\nP1\tAAAMAAAAAAAAAAA\t1\t1.5\n"), "input_data"));
    assertEquals("p_value", ex.getColumn());

    ex = assertThrows(MalformedInputException.class, () -> TableReader.readInputData(reader("h\nP1\tAAAMAAAAAAAAAAA\tNaN\t0.5\n"), "input_data"));
    assertEquals("fold_change", ex.getColumn());

    ex = assertThrows(MalformedInputException.class, () -> TableReader.readInputData(reader("h\n\tAAAMAAAAAAAAAAA\t1\t0.5\n"), "input_data"));
    assertEquals("annotation", ex.getColumn());
  }
}
