package fts.calibration.fit;

import fts.calibration.InsufficientLinesException;
import fts.calibration.InvalidStateException;
import fts.calibration.NoLineDataException;
import fts.calibration.NoOverlapException;
import fts.calibration.SolverDivergenceException;
import fts.calibration.input.Line;
import fts.calibration.input.LineList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;

/**
 * Calibrates the wavenumbers of one line list against one standard line list.
 *
 * A session is used for exactly one calibration run and works through its stages in order:
 * <ol>
 * <li>{@link #match()} finds the lines common to both lists,</li>
 * <li>{@link #selectFitSet()} keeps the common lines strong enough to be fitted,</li>
 * <li>{@link #fit()} fits the correction factor and discards outliers; this is called again until
 * it discards nothing, at which point the session has converged.</li>
 * </ol>
 * {@link #run()} does all of this in one call. Calling a stage out of order raises an
 * {@link InvalidStateException}; in particular the session cannot be matched twice.
 *
 * The set of fitted lines only ever shrinks and the set of discarded lines only ever grows.
 * Once converged, the fit state, the final fitted and discarded lines and the calibrated line
 * list with its per-line errors can be read out for reporting.
 */
public class CalibrationSession {

  private static final Logger logger = Logger.getLogger(CalibrationSession.class);

  private final LineList lineList;
  private final LineList standardList;
  private final CalibrationParameters parameters;
  private final RobustFitter fitter;
  private final FitState fitState;
  private final EventListenerList eventHelper;

  private List<LinePair> commonPairs;
  private final List<LinePair> fitSet;
  private final List<LinePair> discardedSet;

  private SessionState state;
  private String status;

  /**
   * @param lineList Uncalibrated lines, ascending in wavenumber
   * @param standardList Standard lines, ascending in wavenumber
   * @param parameters Settings of this calibration
   */
  public CalibrationSession(LineList lineList, LineList standardList,
      CalibrationParameters parameters) {
    this.lineList = lineList;
    this.standardList = standardList;
    this.parameters = parameters;
    fitter = new RobustFitter(lineList, standardList, parameters.getSolverTolerance(),
        parameters.getSolverMaxIterations());
    fitState = new FitState(parameters.getInitialCorrection());
    eventHelper = new EventListenerList();
    commonPairs = Collections.emptyList();
    fitSet = new ArrayList<>();
    discardedSet = new ArrayList<>();
    state = SessionState.CREATED;
    status = "";
  }

  /**
   * Run the whole calibration: match, select the fit set, and fit until no more lines are
   * discarded
   *
   * @return Final fit state
   * @throws NoLineDataException If either list is empty
   * @throws NoOverlapException If the lists have no lines in common
   * @throws InsufficientLinesException If too few lines are left to fit
   * @throws SolverDivergenceException If a fit does not converge
   */
  public FitState run() {
    match();
    selectFitSet();
    int removed;
    do {
      removed = fit();
      if (removed > 0) {
        fireStateChange("Removed " + removed + " bad line" + (removed > 1 ? "s" : "")
            + " from the fit. Refining the calibration...");
      }
    } while (removed > 0);
    fireStateChange("All lines are within " + parameters.getDiscardLimit()
        + " standard deviations of the mean. Calibration complete.");
    return fitState;
  }

  /**
   * Find the lines common to the uncalibrated and standard lists
   *
   * @return Matched pairs
   * @throws NoLineDataException If either list is empty
   * @throws NoOverlapException If no pairs were found
   */
  public List<LinePair> match() {
    requireState("match", SessionState.CREATED);
    fireStateChange("Finding lines common to " + lineList.getName() + " and "
        + standardList.getName() + "...");
    commonPairs = Collections.unmodifiableList(
        LineMatcher.match(lineList, standardList, parameters.getDiscriminator()));
    state = SessionState.MATCHED;
    return commonPairs;
  }

  /**
   * Select the common lines whose peak amplitude in the uncalibrated list is at least the
   * amplitude threshold; these make up the initial fit set
   *
   * @return Pairs selected for fitting
   */
  public List<LinePair> selectFitSet() {
    requireState("selectFitSet", SessionState.MATCHED);
    for (LinePair pair : commonPairs) {
      if (getListLine(pair).getPeak() >= parameters.getAmplitudeThreshold()) {
        fitSet.add(pair);
      }
    }
    state = SessionState.FIT_SET_SELECTED;
    fireStateChange(fitSet.size() + " common lines of amplitude "
        + parameters.getAmplitudeThreshold() + " or greater selected for fitting");
    return getFitSet();
  }

  /**
   * Run one round of the calibration: fit the correction factor to the fit set, compute the
   * residual statistics, and discard the outliers. When a round discards nothing the session
   * has converged.
   *
   * @return Number of lines discarded in this round
   * @throws InsufficientLinesException If too few lines are left to fit
   * @throws SolverDivergenceException If the fit does not converge
   */
  public int fit() {
    requireState("fit", SessionState.FIT_SET_SELECTED, SessionState.FITTING);
    fireStateChange("Fitting " + fitSet.size() + " lines (round "
        + (fitState.getFitRounds() + 1) + ")...");
    fitter.fit(fitSet, fitState);
    fitState.incrementFitRounds();
    state = SessionState.FITTING;
    return rejectOutliers();
  }

  /**
   * Discard the fitted lines that are outliers with respect to the latest fit. This is done as
   * part of every {@link #fit()}; calling it again afterwards (in particular once converged)
   * finds nothing further to discard and leaves the fit state unchanged.
   *
   * @return Number of lines discarded
   */
  public int rejectOutliers() {
    requireState("rejectOutliers", SessionState.FITTING, SessionState.CONVERGED);
    int removed = fitter.rejectOutliers(fitSet, discardedSet, fitState,
        parameters.getDiscardLimit());
    if (removed == 0) {
      state = SessionState.CONVERGED;
    }
    return removed;
  }

  /**
   * @return True once a round of fitting has discarded no lines
   */
  public boolean isConverged() {
    return state == SessionState.CONVERGED;
  }

  /**
   * Get the uncalibrated list with the fitted correction factor applied on top of any correction
   * it already carried
   *
   * @return Calibrated copy of the line list
   */
  public LineList getCalibratedList() {
    requireFitted("getCalibratedList");
    return lineList.applyCorrection(fitState.getCorrection());
  }

  /**
   * Get the wavenumber errors of every line in the calibrated list
   *
   * @return Errors of each line, in list order
   */
  public List<LineError> getLineErrors() {
    LineList calibrated = getCalibratedList();
    List<LineError> errors = new ArrayList<>(calibrated.size());
    for (Line line : calibrated) {
      errors.add(ErrorEstimator.estimate(line, fitState, parameters.getPointSpacing()));
    }
    return errors;
  }

  /**
   * Get the wavenumber errors of the calibrated lines still in the fit set
   *
   * @return Errors of each fitted line, in ascending wavenumber order
   */
  public List<LineError> getFitSetErrors() {
    LineList calibrated = getCalibratedList();
    List<LineError> errors = new ArrayList<>(fitSet.size());
    for (LinePair pair : fitSet) {
      Line line = calibrated.get(pair.getListIndex());
      errors.add(ErrorEstimator.estimate(line, fitState, parameters.getPointSpacing()));
    }
    return errors;
  }

  /**
   * @return (standard wavenumber, scaled residual) of each fitted line, at the fitted correction
   */
  public List<Pair<Double, Double>> getFitSetResiduals() {
    return residualPoints(fitSet);
  }

  /**
   * @return (standard wavenumber, scaled residual) of each discarded line, at the fitted
   * correction
   */
  public List<Pair<Double, Double>> getDiscardedResiduals() {
    return residualPoints(discardedSet);
  }

  private List<Pair<Double, Double>> residualPoints(List<LinePair> pairs) {
    requireFitted("residual data");
    List<Pair<Double, Double>> points = new ArrayList<>(pairs.size());
    for (LinePair pair : pairs) {
      double x = getStandardLine(pair).getWavenumber();
      double y = fitter.scaledResidual(pair, fitState.getCorrection());
      points.add(new Pair<>(x, y));
    }
    return points;
  }

  /**
   * @return Half-width of the band of scaled residuals outside which lines are discarded
   * (discard limit times residual standard deviation)
   */
  public double getRejectionBand() {
    return parameters.getDiscardLimit() * fitState.getResidualStdDev();
  }

  /**
   * @param pair Pair from this session
   * @return The pair's line from the uncalibrated list
   */
  public Line getListLine(LinePair pair) {
    return lineList.get(pair.getListIndex());
  }

  /**
   * @param pair Pair from this session
   * @return The pair's line from the standard list
   */
  public Line getStandardLine(LinePair pair) {
    return standardList.get(pair.getStandardIndex());
  }

  public List<LinePair> getCommonPairs() {
    return commonPairs;
  }

  public List<LinePair> getFitSet() {
    return Collections.unmodifiableList(fitSet);
  }

  public List<LinePair> getDiscardedSet() {
    return Collections.unmodifiableList(discardedSet);
  }

  public FitState getFitState() {
    return fitState;
  }

  public SessionState getState() {
    return state;
  }

  public CalibrationParameters getParameters() {
    return parameters;
  }

  public LineList getLineList() {
    return lineList;
  }

  public LineList getStandardList() {
    return standardList;
  }

  /**
   * Return newest status message produced by this session
   *
   * @return String representing status of the calibration
   */
  public String getStatus() {
    return status;
  }

  /**
   * Add an object to the list of objects to be notified when the session's status changes
   *
   * @param listener ChangeListener to be notified
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  /**
   * Update processing status and notify listeners of change
   *
   * @param newStatus Status change message to notify listeners of
   */
  private void fireStateChange(String newStatus) {
    status = newStatus;
    logger.debug(newStatus);
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  private void requireState(String operation, SessionState... allowed) {
    for (SessionState candidate : allowed) {
      if (state == candidate) {
        return;
      }
    }
    throw new InvalidStateException("Cannot call " + operation + " while the session is at stage '"
        + state.getName() + "' (requires " + Arrays.toString(allowed) + ")");
  }

  private void requireFitted(String operation) {
    requireState(operation, SessionState.FITTING, SessionState.CONVERGED);
  }
}
