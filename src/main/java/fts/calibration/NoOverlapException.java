package fts.calibration;

/**
 * Thrown when no line of the uncalibrated list lies within the discriminator of any line in the
 * standard list.
 */
public class NoOverlapException extends CalibrationException {

  private static final long serialVersionUID = -1183530416716904613L;

  public NoOverlapException(String message) {
    super(message);
  }
}
