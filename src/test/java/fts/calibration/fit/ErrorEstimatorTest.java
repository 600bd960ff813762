package fts.calibration.fit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import fts.calibration.input.Line;
import org.junit.Before;
import org.junit.Test;

public class ErrorEstimatorTest {

  private FitState state;

  @Before
  public void setUp() {
    state = new FitState(0.);
    state.setCorrectionError(1.0E-7);
    // 2 ppm scatter
    state.setResidualStatistics(0., 2.0, 1.0);
  }

  @Test
  public void globalErrorDominatesForStrongLine() {
    LineError error = ErrorEstimator.estimate(Line.of(1000., 50., 30.), state, 0.03);

    assertEquals(1000., error.getWavenumber(), 0.);
    assertEquals(1.0E-4, error.getScaleError(), 1E-15);
    assertEquals(2.0E-3, error.getStdDevError(), 1E-15);
    assertEquals(6.0E-4, error.getBraultError(), 1E-15);
    assertEquals(Math.sqrt(4.01E-6), error.getGlobalError(), 1E-12);
    assertEquals(Math.sqrt(3.7E-7), error.getCentroidError(), 1E-12);
    assertEquals(error.getGlobalError(), error.getFinalError(), 0.);
  }

  @Test
  public void centroidErrorDominatesForWeakLine() {
    LineError error = ErrorEstimator.estimate(Line.of(1000., 5., 30.), state, 0.03);

    assertEquals(6.0E-3, error.getBraultError(), 1E-15);
    assertEquals(Math.sqrt(1.0E-8 + 3.6E-5), error.getCentroidError(), 1E-12);
    assertEquals(error.getCentroidError(), error.getFinalError(), 0.);
  }

  @Test
  public void finalErrorIsNeverBelowEitherEstimate() {
    double[] peaks = {1., 5., 20., 50., 500.};
    double[] widths = {10., 30., 90.};
    for (double peak : peaks) {
      for (double width : widths) {
        LineError error = ErrorEstimator.estimate(Line.of(20000., peak, width), state, 0.03);
        assertTrue(error.getFinalError() >= error.getGlobalError());
        assertTrue(error.getFinalError() >= error.getCentroidError());
      }
    }
  }

  @Test
  public void usesCalibratedWavenumber() {
    Line line = Line.builder().index(4).wavenumber(1000.).peak(50.).width(30.)
        .correction(1.0E-3).build();
    LineError error = ErrorEstimator.estimate(line, state, 0.03);
    assertEquals(4, error.getIndex());
    assertEquals(1001., error.getWavenumber(), 1E-9);
    assertEquals(1001. * 1.0E-7, error.getScaleError(), 1E-15);
  }

  @Test
  public void zeroPeakLineHasUnboundedError() {
    LineError error = ErrorEstimator.estimate(Line.of(1000., 0., 30.), state, 0.03);
    assertEquals(Double.POSITIVE_INFINITY, error.getBraultError(), 0.);
    assertEquals(Double.POSITIVE_INFINITY, error.getFinalError(), 0.);
    assertEquals(Math.sqrt(4.01E-6), error.getGlobalError(), 1E-12);
  }

  @Test
  public void zeroWidthLineFallsBackToScaleError() {
    LineError error = ErrorEstimator.estimate(Line.of(1000., 50., 0.), state, 0.03);
    assertEquals(0., error.getBraultError(), 0.);
    assertEquals(1.0E-4, error.getCentroidError(), 1E-15);
    assertFalse(Double.isNaN(error.getFinalError()));
  }
}
