package fts.calibration.fit;

/**
 * Wavenumber uncertainty of one calibrated line, with the components it was built from.
 * All values are in cm^-1.
 */
public class LineError {

  private final int index;
  private final double wavenumber;
  private final double scaleError;
  private final double stdDevError;
  private final double braultError;
  private final double globalError;
  private final double centroidError;

  LineError(int index, double wavenumber, double scaleError, double stdDevError,
      double braultError, double globalError, double centroidError) {
    this.index = index;
    this.wavenumber = wavenumber;
    this.scaleError = scaleError;
    this.stdDevError = stdDevError;
    this.braultError = braultError;
    this.globalError = globalError;
    this.centroidError = centroidError;
  }

  /**
   * @return Index of the line in its line list file
   */
  public int getIndex() {
    return index;
  }

  /**
   * @return Calibrated wavenumber of the line
   */
  public double getWavenumber() {
    return wavenumber;
  }

  /**
   * @return Wavenumber times the uncertainty of the correction factor
   */
  public double getScaleError() {
    return scaleError;
  }

  /**
   * @return Wavenumber times the (unscaled) standard deviation of the fit residuals
   */
  public double getStdDevError() {
    return stdDevError;
  }

  /**
   * @return Brault estimate of the line centroid uncertainty
   */
  public double getBraultError() {
    return braultError;
  }

  /**
   * @return Error from the global fit statistics: correction factor error and residual scatter
   */
  public double getGlobalError() {
    return globalError;
  }

  /**
   * @return Error from the line's own centroid uncertainty combined with the scale error
   */
  public double getCentroidError() {
    return centroidError;
  }

  /**
   * @return The larger of the global and centroid error estimates
   */
  public double getFinalError() {
    return Math.max(globalError, centroidError);
  }
}
