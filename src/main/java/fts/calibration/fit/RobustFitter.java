package fts.calibration.fit;

import fts.calibration.InsufficientLinesException;
import fts.calibration.SolverDivergenceException;
import fts.calibration.input.Line;
import fts.calibration.input.LineList;
import java.util.Iterator;
import java.util.List;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.optim.ConvergenceChecker;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;

/**
 * Fits the wavenumber correction factor of an uncalibrated line list to a standard list and
 * rejects the fitted lines that disagree with the fit.
 *
 * The correction factor e is the value minimising the sum of squared normalised residuals
 * r_i(e) = (L_i * (1 + e) - S_i) / S_i over the fitted pairs, where L_i and S_i are the
 * wavenumbers of the uncalibrated and standard lines of each pair. This is solved with a
 * Levenberg-Marquardt least-squares solver. The residual is linear in e, so the solver reaches the
 * closed-form optimum sum((L/S)((S-L)/S)) / sum((L/S)^2) in a few iterations. The uncertainty of
 * the correction factor comes from the solver's parameter covariance scaled by the reduced
 * chi-square of the fit.
 *
 * Residuals are reported multiplied by {@link #RESIDUAL_SCALE}, so that statistics are in parts
 * per million. A fitted line is an outlier if the magnitude of its scaled residual is beyond the
 * magnitude of the mean residual plus the discard limit times the residual standard deviation.
 * Fitting and rejection are repeated by the caller until a round rejects nothing; since each
 * round that rejects anything shrinks the set of lines fitted, this always ends, at worst when
 * too few lines remain to fit (which raises an {@link InsufficientLinesException}).
 */
public class RobustFitter {

  private static final Logger logger = Logger.getLogger(RobustFitter.class);

  /**
   * Scaling applied to dSig/Sig residuals when computing and reporting their statistics
   */
  public static final double RESIDUAL_SCALE = 1.0E6;

  /**
   * Fewest lines that can be fitted: one for the correction factor and one degree of freedom for
   * its uncertainty
   */
  public static final int MIN_FIT_LINES = 2;

  private static final double COVARIANCE_THRESHOLD = 1.0E-14;

  private final LineList list;
  private final LineList standard;
  private final double tolerance;
  private final int maxIterations;

  /**
   * @param list Uncalibrated lines, referred to by the first index of each pair
   * @param standard Standard lines, referred to by the second index of each pair
   * @param tolerance Absolute and relative tolerance on the change in the correction factor
   * @param maxIterations Maximum number of solver iterations
   */
  public RobustFitter(LineList list, LineList standard, double tolerance, int maxIterations) {
    this.list = list;
    this.standard = standard;
    this.tolerance = tolerance;
    this.maxIterations = maxIterations;
  }

  /**
   * Normalised wavenumber difference between a line and its standard after applying a
   * correction factor to the line: (L * (1 + e) - S) / S
   *
   * @param listLine Line from the uncalibrated list
   * @param standardLine Matching line from the standard list
   * @param correction Correction factor e to apply to the uncalibrated line
   * @return dSig/Sig residual (unscaled)
   */
  public static double residual(Line listLine, Line standardLine, double correction) {
    // computed through the ratio so that lines with equal ratios get identical residuals
    double ratio = listLine.getWavenumber() / standardLine.getWavenumber();
    return ratio * (1. + correction) - 1.;
  }

  /**
   * @param pair Matched line pair
   * @param correction Correction factor to apply to the uncalibrated line
   * @return Residual of the pair multiplied by {@link #RESIDUAL_SCALE}
   */
  public double scaledResidual(LinePair pair, double correction) {
    return residual(list.get(pair.getListIndex()), standard.get(pair.getStandardIndex()),
        correction) * RESIDUAL_SCALE;
  }

  /**
   * Fit the correction factor to the given pairs, starting from the correction currently held in
   * the fit state. The state is updated with the new correction factor, its error, the reduced
   * chi-square and iteration count, and with the residual statistics at the new correction.
   *
   * @param fitSet Pairs to fit
   * @param state Fit state to start from and update
   * @throws InsufficientLinesException If there are fewer than {@link #MIN_FIT_LINES} pairs
   * @throws SolverDivergenceException If the solver runs out of iterations
   */
  public void fit(List<LinePair> fitSet, FitState state) {
    final int numLines = fitSet.size();
    if (numLines < MIN_FIT_LINES) {
      throw new InsufficientLinesException(numLines, MIN_FIT_LINES);
    }

    final double[] ratios = new double[numLines];
    for (int i = 0; i < numLines; ++i) {
      LinePair pair = fitSet.get(i);
      ratios[i] = list.get(pair.getListIndex()).getWavenumber()
          / standard.get(pair.getStandardIndex()).getWavenumber();
    }

    MultivariateJacobianFunction jacobian = new MultivariateJacobianFunction() {
      @Override
      public Pair<RealVector, RealMatrix> value(RealVector point) {
        double step = point.getEntry(0);
        RealVector residuals = new ArrayRealVector(numLines);
        RealMatrix derivatives = new Array2DRowRealMatrix(numLines, 1);
        for (int i = 0; i < numLines; ++i) {
          residuals.setEntry(i, ratios[i] * (1. + step) - 1.);
          derivatives.setEntry(i, 0, ratios[i]);
        }
        return new Pair<>(residuals, derivatives);
      }
    };

    StepSizeChecker checker = new StepSizeChecker(tolerance, state.getCorrection());

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(new double[]{state.getCorrection()}).
        model(jacobian).
        target(new double[numLines]).
        checker(checker).
        lazyEvaluation(false).
        maxEvaluations(Integer.MAX_VALUE).
        maxIterations(maxIterations).
        build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer();

    LeastSquaresOptimizer.Optimum optimum;
    try {
      optimum = optimizer.optimize(lsp);
    } catch (TooManyIterationsException e) {
      logger.warn("Solver did not converge after " + maxIterations + " iterations; best"
          + " correction factor so far is " + checker.getLatestCorrection());
      throw new SolverDivergenceException(checker.getLatestCorrection(), maxIterations, e);
    }

    double correction = optimum.getPoint().getEntry(0);
    double variance = optimum.getCovariances(COVARIANCE_THRESHOLD).getEntry(0, 0);
    double chi = optimum.getCost(); // norm of residual vector
    double dof = numLines - 1.;
    double c = chi / Math.sqrt(dof);

    state.setCorrection(correction);
    state.setCorrectionError(c * Math.sqrt(variance));
    state.setReducedChiSquare(chi * chi / dof);
    state.setIterations(optimum.getIterations());

    logger.info("Correction factor: " + correction + " +/- " + state.getCorrectionError()
        + " (reduced chi^2 = " + state.getReducedChiSquare() + ", lines fitted = " + numLines
        + ", c = " + c + ")");

    computeStatistics(fitSet, state);
  }

  /**
   * Compute the mean, population standard deviation and standard error of the scaled residuals
   * of the given pairs at the correction factor held in the fit state, and store them there.
   *
   * @param fitSet Pairs to get statistics for
   * @param state Fit state holding the correction factor, to be updated
   */
  public void computeStatistics(List<LinePair> fitSet, FitState state) {
    int size = fitSet.size();
    if (size == 0) {
      state.setResidualStatistics(0., 0., 0.);
      return;
    }
    double[] scaled = new double[size];
    for (int i = 0; i < size; ++i) {
      scaled[i] = scaledResidual(fitSet.get(i), state.getCorrection());
    }
    double mean = new Mean().evaluate(scaled);
    double stdDev = new StandardDeviation(false).evaluate(scaled, mean);
    state.setResidualStatistics(mean, stdDev, stdDev / Math.sqrt(size));

    logger.info("dSig/Sig Mean Residual: " + mean / RESIDUAL_SCALE
        + ", StdDev: " + stdDev / RESIDUAL_SCALE
        + ", StdErr: " + state.getResidualStdErr() / RESIDUAL_SCALE);
  }

  /**
   * Move every pair whose scaled residual magnitude exceeds |mean| + discardLimit * stdDev from
   * the fit set to the discarded set, using the correction and statistics in the fit state
   *
   * @param fitSet Pairs currently fitted; outliers are removed from this list
   * @param discarded Pairs rejected so far; outliers are appended to this list
   * @param state Fit state from the latest fit of the fit set
   * @param discardLimit Number of standard deviations beyond which lines are rejected
   * @return Number of pairs removed
   */
  public int rejectOutliers(List<LinePair> fitSet, List<LinePair> discarded, FitState state,
      double discardLimit) {
    double limit = Math.abs(state.getResidualMean()) + discardLimit * state.getResidualStdDev();
    int removed = 0;
    Iterator<LinePair> iterator = fitSet.iterator();
    while (iterator.hasNext()) {
      LinePair pair = iterator.next();
      double difference = scaledResidual(pair, state.getCorrection());
      if (Math.abs(difference) > limit) {
        Line line = list.get(pair.getListIndex());
        logger.info("Removing line " + line.getIndex() + ": " + line.getWavenumber()
            + "K\t(residual dSig/Sig = " + difference / RESIDUAL_SCALE + ", limit = +/-"
            + limit / RESIDUAL_SCALE + ")");
        iterator.remove();
        discarded.add(pair);
        ++removed;
      }
    }
    return removed;
  }

  /**
   * Declares convergence once the absolute change of the correction factor between iterations is
   * below tol + tol * |correction|, and remembers the latest correction factor reached.
   */
  private static class StepSizeChecker
      implements ConvergenceChecker<LeastSquaresProblem.Evaluation> {

    private final double tolerance;
    private double latestCorrection;

    StepSizeChecker(double tolerance, double start) {
      this.tolerance = tolerance;
      latestCorrection = start;
    }

    @Override
    public boolean converged(int iteration, LeastSquaresProblem.Evaluation previous,
        LeastSquaresProblem.Evaluation current) {
      double before = previous.getPoint().getEntry(0);
      double after = current.getPoint().getEntry(0);
      latestCorrection = after;
      return Math.abs(after - before) < tolerance + tolerance * Math.abs(after);
    }

    double getLatestCorrection() {
      return latestCorrection;
    }
  }
}
