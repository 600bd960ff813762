package fts.calibration;

/**
 * Thrown when a line property or a calibration parameter that must be non-negative is given a
 * negative value.
 */
public class NegativeValueException extends CalibrationException {

  private static final long serialVersionUID = -5932043360186911409L;

  private final String field;
  private final double value;

  /**
   * @param field Name of the rejected field (e.g., "peak")
   * @param value The negative value that was rejected
   */
  public NegativeValueException(String field, double value) {
    super("Cannot set " + field + " to " + value + ". The " + field + " must not be negative.");
    this.field = field;
    this.value = value;
  }

  /**
   * @return Name of the field whose value was rejected
   */
  public String getField() {
    return field;
  }

  public double getValue() {
    return value;
  }
}
