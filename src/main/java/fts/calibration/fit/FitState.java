package fts.calibration.fit;

/**
 * Result of the most recent fit of a calibration session: the wavenumber correction factor, its
 * uncertainty, and statistics on the scaled residuals of the lines fitted.
 * Residual statistics are in units of dSig/Sig multiplied by {@link RobustFitter#RESIDUAL_SCALE}.
 */
public class FitState {

  private double correction;
  private double correctionError;
  private double residualMean;
  private double residualStdDev;
  private double residualStdErr;
  private double reducedChiSquare;
  private int iterations;
  private int fitRounds;

  /**
   * @param initialCorrection Starting point of the correction factor for the first fit
   */
  public FitState(double initialCorrection) {
    correction = initialCorrection;
  }

  FitState(FitState other) {
    correction = other.correction;
    correctionError = other.correctionError;
    residualMean = other.residualMean;
    residualStdDev = other.residualStdDev;
    residualStdErr = other.residualStdErr;
    reducedChiSquare = other.reducedChiSquare;
    iterations = other.iterations;
    fitRounds = other.fitRounds;
  }

  /**
   * @return Copy of this state, unaffected by later fits
   */
  public FitState copy() {
    return new FitState(this);
  }

  /**
   * @return Wavenumber correction factor (dSig/Sig) found by the last fit
   */
  public double getCorrection() {
    return correction;
  }

  /**
   * @return 1-sigma uncertainty of the correction factor
   */
  public double getCorrectionError() {
    return correctionError;
  }

  public double getResidualMean() {
    return residualMean;
  }

  /**
   * @return Population standard deviation of the scaled residuals
   */
  public double getResidualStdDev() {
    return residualStdDev;
  }

  public double getResidualStdErr() {
    return residualStdErr;
  }

  public double getReducedChiSquare() {
    return reducedChiSquare;
  }

  /**
   * @return Solver iterations taken by the last fit
   */
  public int getIterations() {
    return iterations;
  }

  /**
   * @return Number of fit and reject rounds run so far
   */
  public int getFitRounds() {
    return fitRounds;
  }

  void setCorrection(double correction) {
    this.correction = correction;
  }

  void setCorrectionError(double correctionError) {
    this.correctionError = correctionError;
  }

  void setResidualStatistics(double mean, double stdDev, double stdErr) {
    residualMean = mean;
    residualStdDev = stdDev;
    residualStdErr = stdErr;
  }

  void setReducedChiSquare(double reducedChiSquare) {
    this.reducedChiSquare = reducedChiSquare;
  }

  void setIterations(int iterations) {
    this.iterations = iterations;
  }

  void incrementFitRounds() {
    ++fitRounds;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof FitState)) {
      return false;
    }
    FitState state = (FitState) other;
    return Double.compare(correction, state.correction) == 0
        && Double.compare(correctionError, state.correctionError) == 0
        && Double.compare(residualMean, state.residualMean) == 0
        && Double.compare(residualStdDev, state.residualStdDev) == 0
        && Double.compare(residualStdErr, state.residualStdErr) == 0
        && Double.compare(reducedChiSquare, state.reducedChiSquare) == 0
        && iterations == state.iterations
        && fitRounds == state.fitRounds;
  }

  @Override
  public int hashCode() {
    long bits = Double.doubleToLongBits(correction);
    bits = 31 * bits + Double.doubleToLongBits(correctionError);
    bits = 31 * bits + Double.doubleToLongBits(residualStdDev);
    return (int) (bits ^ (bits >>> 32)) + 31 * fitRounds;
  }

  @Override
  public String toString() {
    return "Correction factor: " + correction + " +/- " + correctionError
        + " (reduced chi^2 = " + reducedChiSquare + ", rounds = " + fitRounds + ")";
  }
}
