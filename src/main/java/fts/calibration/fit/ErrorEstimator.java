package fts.calibration.fit;

import fts.calibration.input.Line;
import org.apache.log4j.Logger;

/**
 * Estimates the uncertainty of a calibrated line's wavenumber in two independent ways and takes
 * the larger (more conservative) one.
 *
 * The first estimate uses only the global fit statistics, the uncertainty of the correction factor
 * combined with the scatter of the fit residuals. The second combines the uncertainty of the
 * correction factor with the line's own centroid uncertainty, which depends on its width and
 * peak amplitude relative to the spectrum point spacing (Brault).
 */
public class ErrorEstimator {

  private static final Logger logger = Logger.getLogger(ErrorEstimator.class);

  private ErrorEstimator() {
  }

  /**
   * Get the wavenumber uncertainty of a calibrated line
   *
   * @param line Line with the calibration already applied to it
   * @param state Fit state of the calibration
   * @param pointSpacing Separation between spectrum data points (cm^-1)
   * @return Error components and final uncertainty of the line
   */
  public static LineError estimate(Line line, FitState state, double pointSpacing) {
    double wavenumber = line.getWavenumber();
    double correctionError = state.getCorrectionError();
    double stdDev = state.getResidualStdDev() / RobustFitter.RESIDUAL_SCALE;

    double globalRelative =
        Math.sqrt(correctionError * correctionError + stdDev * stdDev);
    double globalError = wavenumber * globalRelative;

    double scaleError = wavenumber * correctionError;
    double braultError = line.getCentroidError(pointSpacing);
    if (Double.isInfinite(braultError)) {
      logger.warn("Line " + line.getIndex() + " at " + wavenumber
          + " cm^-1 has zero peak amplitude; its wavenumber error is unbounded");
    }
    double centroidError = Math.sqrt(scaleError * scaleError + braultError * braultError);

    return new LineError(line.getIndex(), wavenumber, scaleError, wavenumber * stdDev,
        braultError, globalError, centroidError);
  }
}
