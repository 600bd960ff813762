package fts.calibration;

/**
 * Base type of every failure raised by the calibration engine. These are unchecked: they are raised
 * synchronously where the problem is detected and are fatal to the current calibration session.
 * The caller decides whether to abort or to adjust the calibration parameters and run again.
 */
public class CalibrationException extends RuntimeException {

  private static final long serialVersionUID = 3481742096527761520L;

  public CalibrationException(String message) {
    super(message);
  }

  public CalibrationException(String message, Throwable cause) {
    super(message, cause);
  }

}
