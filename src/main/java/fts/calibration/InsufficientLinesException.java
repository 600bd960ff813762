package fts.calibration;

/**
 * Thrown when the set of lines to be fitted is too small to constrain the correction factor and
 * its uncertainty. Outlier rejection can shrink the fitted set down to this point.
 */
public class InsufficientLinesException extends NoLineDataException {

  private static final long serialVersionUID = 2475328305771498390L;

  private final int lineCount;
  private final int required;

  public InsufficientLinesException(int lineCount, int required) {
    super("Only " + lineCount + " line(s) available to fit, at least " + required
        + " are needed");
    this.lineCount = lineCount;
    this.required = required;
  }

  public int getLineCount() {
    return lineCount;
  }

  public int getRequired() {
    return required;
  }
}
