package fts.calibration;

/**
 * Thrown when a line list given to the calibration is empty, or when there are no lines left to
 * work on at some later stage of the calibration.
 */
public class NoLineDataException extends CalibrationException {

  private static final long serialVersionUID = 6016361911520845176L;

  public NoLineDataException(String message) {
    super(message);
  }
}
