package fts.calibration.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;

public class LineListTest {

  @Test
  public void composeCorrections() {
    assertEquals(0.3 + 0.2 + 0.06, LineList.composeCorrections(0.3, 0.2), 1E-15);
    assertEquals(0., LineList.composeCorrections(0., 0.), 0.);
  }

  @Test
  public void applyCorrectionComposesWithExisting() {
    Line first = Line.builder().index(1).wavenumber(10000.).correction(1.0E-4).build();
    Line second = Line.builder().index(2).wavenumber(20000.).build();
    LineList list = new LineList("test", Arrays.asList(first, second));

    LineList calibrated = list.applyCorrection(2.0E-4);

    assertEquals(2, calibrated.size());
    assertEquals(1.0E-4 + 2.0E-4 + 2.0E-8, calibrated.get(0).getCorrection(), 1E-18);
    assertEquals(first.getWavenumber() * 1.0002, calibrated.get(0).getWavenumber(), 1E-8);
    assertEquals(20000. * 1.0002, calibrated.get(1).getWavenumber(), 1E-8);
    assertEquals(2.0E-4, calibrated.getHeader().getWavenumberCorrection(), 1E-18);
    assertTrue(calibrated.getHeader().getWavenumberCorrectionRow()
        .startsWith(LineListHeader.CORRECTION_APPLIED_PREFIX));
    // the source list is unchanged
    assertEquals(10000. * 1.0001, list.get(0).getWavenumber(), 1E-9);
  }

  @Test
  public void zeroCorrectionKeepsNoCorrectionHeader() {
    LineList list = new LineList("test", Arrays.asList(Line.of(100., 1., 1.)));
    LineList calibrated = list.applyCorrection(0.);
    assertEquals(LineListHeader.NO_CORRECTION_ROW,
        calibrated.getHeader().getWavenumberCorrectionRow());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void linesAreUnmodifiable() {
    LineList list = new LineList("test", Arrays.asList(Line.of(100., 1., 1.)));
    list.getLines().add(Line.of(200., 1., 1.));
  }
}
