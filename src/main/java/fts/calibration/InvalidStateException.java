package fts.calibration;

/**
 * Thrown when a calibration session step is called out of its required order, e.g. fitting
 * before the fit set has been selected, or matching a session a second time.
 */
public class InvalidStateException extends CalibrationException {

  private static final long serialVersionUID = 8902356331408214052L;

  public InvalidStateException(String message) {
    super(message);
  }
}
