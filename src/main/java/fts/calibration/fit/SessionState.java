package fts.calibration.fit;

/**
 * Stages of a calibration session, in the order they are passed through.
 */
public enum SessionState {

  CREATED("Created"),
  MATCHED("Common lines found"),
  FIT_SET_SELECTED("Fit lines selected"),
  FITTING("Fitting"),
  CONVERGED("Converged");

  private final String name;

  SessionState(String name) {
    this.name = name;
  }

  /**
   * @return Human-readable name of the stage
   */
  public String getName() {
    return name;
  }
}
