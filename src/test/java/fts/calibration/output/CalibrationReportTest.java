package fts.calibration.output;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import fts.calibration.fit.CalibrationParameters;
import fts.calibration.fit.CalibrationSession;
import fts.calibration.input.LineListParser;
import fts.calibration.input.LineListParser.LineListFormatException;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CalibrationReportTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private CalibrationSession session;

  @Before
  public void runCalibration() throws IOException, LineListFormatException {
    CalibrationParameters params = CalibrationParameters.builder().discriminator(0.5)
        .amplitudeThreshold(50.).discardLimit(2.0).pointSpacing(0.03).build();
    session = new CalibrationSession(
        LineListParser.read(new InputStreamReader(
            getClass().getResourceAsStream("/lines.cln"), StandardCharsets.UTF_8), "lines.cln"),
        LineListParser.read(new InputStreamReader(
            getClass().getResourceAsStream("/standards.cln"), StandardCharsets.UTF_8),
            "standards.cln"),
        params);
    session.run();
  }

  @Test
  public void headerDescribesSettingsAndFit() {
    String header = CalibrationReport.getHeaderString(session);
    String[] rows = header.split("\n");
    assertEquals(10, rows.length);
    assertEquals("# Fitted lines from lines.cln against standards in standards.cln", rows[0]);
    assertEquals("# Discriminator / K : 0.500000", rows[1]);
    assertEquals("# Peak Amp Threshold: 50.000000", rows[2]);
    assertEquals("# Discard Limit     : 2.000000", rows[3]);
    assertEquals("# Point Spacing     : 0.030000", rows[4]);
    assertEquals("#", rows[5]);
    assertTrue(rows[6], rows[6].startsWith("# Correction factor : "));
    String[] correction = rows[6].substring("# Correction factor : ".length()).split(" \\+/- ");
    assertEquals(2, correction.length);
    assertEquals(1.0E-5, Double.parseDouble(correction[0]), 1E-9);
    assertTrue(rows[7].startsWith("# Mean fit residual : "));
    assertTrue(rows[8].startsWith("# Residual std dev  : "));
    assertEquals("#", rows[9]);
  }

  @Test
  public void oneRowPerLine() throws IOException {
    StringWriter writer = new StringWriter();
    CalibrationReport.write(session, writer);
    String[] rows = writer.toString().split("\\r?\\n");

    assertEquals(10 + 1 + session.getLineList().size(), rows.length);
    assertEquals("#  n  Wavenumber    Scale Error   StdDev Error  Brault Error  Full Error",
        rows[10]);
    String[] fields = rows[12].trim().split("\\s+");
    assertEquals(6, fields.length);
    assertEquals("2", fields[0]);
    assertEquals(10000., Double.parseDouble(fields[1]), 1E-5);
    double scaleError = Double.parseDouble(fields[2]);
    double braultError = Double.parseDouble(fields[4]);
    double finalError = Double.parseDouble(fields[5]);
    assertTrue(finalError >= Math.sqrt(scaleError * scaleError + braultError * braultError)
        * (1. - 1E-5));
  }

  @Test
  public void writesFile() throws IOException {
    File file = folder.newFile("results.cal");
    CalibrationReport.write(session, file);
    List<String> rows = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    assertEquals(18, rows.size());
    assertTrue(rows.get(0).startsWith("# Fitted lines from lines.cln"));
  }

  @Test
  public void summaryCountsLines() {
    String summary = CalibrationReport.getSummaryString(session);
    assertTrue(summary.contains("Common lines     : 6"));
    assertTrue(summary.contains("Lines fitted     : 5"));
    assertTrue(summary.contains("Lines discarded  : 0"));
    assertTrue(summary.contains("Optimal dSig/Sig : "));
  }
}
