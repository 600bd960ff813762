package fts.calibration.output;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import fts.calibration.input.Line;
import fts.calibration.input.LineList;
import fts.calibration.input.LineListParser;
import fts.calibration.input.LineListParser.LineListFormatException;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class LineListWriterTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static List<String> resourceRows(String name) throws IOException {
    List<String> rows = new ArrayList<>();
    try (BufferedReader br = new BufferedReader(new InputStreamReader(
        LineListWriterTest.class.getResourceAsStream("/" + name), StandardCharsets.UTF_8))) {
      String row;
      while ((row = br.readLine()) != null) {
        rows.add(row);
      }
    }
    return rows;
  }

  private static LineList readResource(String name) throws IOException, LineListFormatException {
    return LineListParser.read(new InputStreamReader(
        LineListWriterTest.class.getResourceAsStream("/" + name), StandardCharsets.UTF_8), name);
  }

  @Test
  public void rewritesFileUnchanged() throws IOException, LineListFormatException {
    StringWriter writer = new StringWriter();
    LineListWriter.write(readResource("standards.cln"), writer);

    List<String> written = new ArrayList<>();
    BufferedReader br = new BufferedReader(new StringReader(writer.toString()));
    String row;
    while ((row = br.readLine()) != null) {
      written.add(row);
    }
    assertEquals(resourceRows("standards.cln"), written);
  }

  @Test
  public void formatLineLayout() {
    Line line = Line.builder().index(12).wavenumber(15000.25).peak(250.).width(42.)
        .damping(0.0125).eqWidth(1.5E-2).iterations(7).hold(1).tags("W")
        .residuals(1.2E-3, 4.0E-4, -2.5E-4, 3.0E-4).identification("Fe II").wavelength(6666.555)
        .build();
    String expected = "    12  15000.250000 2.500e+02    42.00   0.0125 1.5000e-02     7   1    W"
        + " 1.2000e-03 4.0000e-04-2.5000e-04 3.0000e-04 " + String.format("%-30s", "Fe II")
        + "6666.555000";
    assertEquals(expected, LineListWriter.formatLine(line));
  }

  @Test
  public void calibratedListRoundTrips() throws IOException, LineListFormatException {
    LineList calibrated = readResource("lines.cln").applyCorrection(1.0E-5);
    File file = folder.newFile("calibrated.cln");
    LineListWriter.write(calibrated, file);

    List<String> rows = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    assertTrue(rows.get(0).startsWith("  WAVENUMBER CORRECTION APPLIED: wavcorr =   "));
    assertEquals(4 + calibrated.size(), rows.size());

    LineList reread = LineListParser.read(file);
    assertEquals(calibrated.size(), reread.size());
    assertEquals(calibrated.getHeader().getWavenumberCorrection(),
        reread.getHeader().getWavenumberCorrection(), 0.);
    for (int i = 0; i < calibrated.size(); ++i) {
      Line expected = calibrated.get(i);
      Line actual = reread.get(i);
      assertEquals(expected.getIndex(), actual.getIndex());
      assertEquals(expected.getWavenumber(), actual.getWavenumber(), 1E-6);
      assertEquals(expected.getWidth(), actual.getWidth(), 1E-2);
      assertEquals(expected.getWavelength(), actual.getWavelength(), 1E-6);
      assertEquals(expected.getIdentification(), actual.getIdentification());
      assertEquals(expected.getCorrection(), actual.getCorrection(), 1E-15);
    }
    assertEquals(10000., reread.get(1).getWavenumber(), 1E-5);
  }
}
