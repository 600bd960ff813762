package fts.calibration.fit;

import static fts.calibration.fit.FitTestUtils.listOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import fts.calibration.InsufficientLinesException;
import fts.calibration.InvalidStateException;
import fts.calibration.input.LineList;
import fts.calibration.input.LineListParser;
import fts.calibration.input.LineListParser.LineListFormatException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;

public class CalibrationSessionTest {

  public static LineList readResource(String name) throws IOException, LineListFormatException {
    return LineListParser.read(new InputStreamReader(
        CalibrationSessionTest.class.getResourceAsStream("/" + name), StandardCharsets.UTF_8),
        name);
  }

  /**
   * Session over the test line lists, whose lines are offset from the standards by a
   * correction of 1e-5
   */
  public static CalibrationSession fixtureSession() throws IOException, LineListFormatException {
    CalibrationParameters params = CalibrationParameters.builder().discriminator(0.5)
        .amplitudeThreshold(50.).discardLimit(2.0).pointSpacing(0.03).build();
    return new CalibrationSession(readResource("lines.cln"), readResource("standards.cln"),
        params);
  }

  private static CalibrationSession threeLineSession() {
    CalibrationParameters params = CalibrationParameters.builder().discriminator(3.0)
        .amplitudeThreshold(0.).discardLimit(1.0).build();
    return new CalibrationSession(listOf("list", 100., 100., 200., 300.),
        listOf("standard", 100., 101., 202., 300.), params);
  }

  @Test
  public void calibratesFixtureLists() throws IOException, LineListFormatException {
    CalibrationSession session = fixtureSession();
    FitState fit = session.run();

    assertTrue(session.isConverged());
    assertEquals(SessionState.CONVERGED, session.getState());
    // 9000 has no standard; the 17500 line is too weak to fit
    assertEquals(6, session.getCommonPairs().size());
    assertEquals(5, session.getFitSet().size());
    assertEquals(0, session.getDiscardedSet().size());
    assertEquals(1, fit.getFitRounds());
    assertEquals(1.0E-5, fit.getCorrection(), 1E-9);
    assertTrue(fit.getCorrectionError() < 1E-9);
  }

  @Test
  public void stagesRunInOrder() throws IOException, LineListFormatException {
    CalibrationSession session = fixtureSession();
    assertEquals(SessionState.CREATED, session.getState());
    assertEquals(6, session.match().size());
    assertEquals(SessionState.MATCHED, session.getState());
    assertEquals(5, session.selectFitSet().size());
    assertEquals(SessionState.FIT_SET_SELECTED, session.getState());
    assertEquals(0, session.fit());
    assertTrue(session.isConverged());
  }

  @Test
  public void exactlyScaledListsFitWithoutDiscards() {
    CalibrationParameters params = CalibrationParameters.builder().discriminator(3.0)
        .amplitudeThreshold(0.).discardLimit(0.).build();
    CalibrationSession session = new CalibrationSession(listOf("list", 100., 100., 200.),
        listOf("standard", 100., 101., 202.), params);
    FitState fit = session.run();

    assertEquals(0.01, fit.getCorrection(), 1E-12);
    assertEquals(0., fit.getResidualMean(), 1E-6);
    assertEquals(0., fit.getResidualStdDev(), 1E-6);
    assertEquals(0, session.getDiscardedSet().size());
    assertEquals(1, fit.getFitRounds());
  }

  @Test
  public void discardedLinesAreRefitted() {
    CalibrationSession session = threeLineSession();
    FitState fit = session.run();

    assertEquals(2, fit.getFitRounds());
    assertEquals(0.01, fit.getCorrection(), 1E-12);
    assertEquals(2, session.getFitSet().size());
    assertEquals(1, session.getDiscardedSet().size());
    assertEquals(300., session.getListLine(session.getDiscardedSet().get(0)).getWavenumber(),
        0.);
    assertEquals(300.,
        session.getStandardLine(session.getDiscardedSet().get(0)).getWavenumber(), 0.);
  }

  @Test
  public void fitSetShrinksAndDiscardedSetGrows() {
    CalibrationSession session = threeLineSession();
    session.match();
    session.selectFitSet();
    List<LinePair> before = new ArrayList<>(session.getFitSet());

    assertEquals(1, session.fit());
    assertTrue(before.containsAll(session.getFitSet()));
    assertEquals(before.size() - 1, session.getFitSet().size());
    assertFalse(session.isConverged());

    List<LinePair> discarded = new ArrayList<>(session.getDiscardedSet());
    assertEquals(0, session.fit());
    assertTrue(session.getDiscardedSet().containsAll(discarded));
    assertTrue(session.isConverged());
  }

  @Test
  public void rejectingAgainAfterConvergenceChangesNothing()
      throws IOException, LineListFormatException {
    CalibrationSession session = threeLineSession();
    session.run();
    FitState before = session.getFitState().copy();
    List<LinePair> fitSet = new ArrayList<>(session.getFitSet());

    assertEquals(0, session.rejectOutliers());
    assertEquals(before, session.getFitState());
    assertEquals(fitSet, session.getFitSet());
    assertTrue(session.isConverged());
  }

  @Test(expected = InvalidStateException.class)
  public void fitBeforeMatch() {
    threeLineSession().fit();
  }

  @Test(expected = InvalidStateException.class)
  public void selectBeforeMatch() {
    threeLineSession().selectFitSet();
  }

  @Test(expected = InvalidStateException.class)
  public void matchTwice() {
    CalibrationSession session = threeLineSession();
    session.match();
    session.match();
  }

  @Test(expected = InvalidStateException.class)
  public void rejectBeforeFit() {
    CalibrationSession session = threeLineSession();
    session.match();
    session.selectFitSet();
    session.rejectOutliers();
  }

  @Test(expected = InvalidStateException.class)
  public void fitAfterConvergence() {
    CalibrationSession session = threeLineSession();
    session.run();
    session.fit();
  }

  @Test(expected = InvalidStateException.class)
  public void calibratedListBeforeFit() {
    CalibrationSession session = threeLineSession();
    session.match();
    session.getCalibratedList();
  }

  @Test(expected = InsufficientLinesException.class)
  public void tooFewStrongLines() {
    CalibrationParameters params = CalibrationParameters.builder().discriminator(3.0)
        .amplitudeThreshold(500.).build();
    LineList list = listOf("list", 100., 100., 200., 300.);
    new CalibrationSession(list, listOf("standard", 100., 101., 202., 300.), params).run();
  }

  @Test
  public void calibratedListComposesCorrection() throws IOException, LineListFormatException {
    CalibrationSession session = fixtureSession();
    session.run();
    LineList calibrated = session.getCalibratedList();

    assertEquals(session.getLineList().size(), calibrated.size());
    assertEquals(10000., calibrated.get(1).getWavenumber(), 1E-5);
    assertEquals(25000., calibrated.get(6).getWavenumber(), 1E-5);
    assertEquals(session.getFitState().getCorrection(),
        calibrated.getHeader().getWavenumberCorrection(), 0.);

    // every line gets an error; the fit set errors are a subset of those
    List<LineError> errors = session.getLineErrors();
    assertEquals(calibrated.size(), errors.size());
    assertEquals(5, session.getFitSetErrors().size());
    for (LineError error : errors) {
      assertTrue(error.getFinalError() > 0.);
    }
  }

  @Test
  public void residualPointsUseStandardWavenumbers() {
    CalibrationSession session = threeLineSession();
    session.run();

    List<Pair<Double, Double>> fitted = session.getFitSetResiduals();
    assertEquals(2, fitted.size());
    assertEquals(101., fitted.get(0).getFirst(), 0.);
    assertEquals(0., fitted.get(0).getSecond(), 1E-6);

    List<Pair<Double, Double>> discarded = session.getDiscardedResiduals();
    assertEquals(1, discarded.size());
    assertEquals(300., discarded.get(0).getFirst(), 0.);
    assertEquals(1.0E4, discarded.get(0).getSecond(), 1E-6);
  }

  @Test
  public void listenersSeeEachStatus() throws IOException, LineListFormatException {
    final CalibrationSession session = fixtureSession();
    final List<String> statuses = new ArrayList<>();
    session.addChangeListener(new ChangeListener() {
      @Override
      public void stateChanged(ChangeEvent e) {
        assertTrue(e.getSource() == session);
        statuses.add(session.getStatus());
      }
    });
    session.run();

    assertTrue(statuses.size() >= 4);
    assertTrue(statuses.get(0).startsWith("Finding lines common to"));
    assertTrue(statuses.get(statuses.size() - 1).endsWith("Calibration complete."));
  }
}
