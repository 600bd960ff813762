package fts.calibration;

/**
 * Thrown when the least-squares solver exceeds its iteration limit without reaching the
 * requested tolerance. The best correction factor found so far is kept so that a caller can
 * choose to carry on with it (with a warning) instead of aborting.
 */
public class SolverDivergenceException extends CalibrationException {

  private static final long serialVersionUID = -7716282180011342687L;

  private final double bestCorrection;
  private final int iterations;

  public SolverDivergenceException(double bestCorrection, int iterations, Throwable cause) {
    super("Solver did not converge within " + iterations + " iterations (best correction "
        + bestCorrection + ")", cause);
    this.bestCorrection = bestCorrection;
    this.iterations = iterations;
  }

  /**
   * @return Correction factor of the last point evaluated before the solver gave up
   */
  public double getBestCorrection() {
    return bestCorrection;
  }

  public int getIterations() {
    return iterations;
  }
}
