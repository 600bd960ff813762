package fts.calibration.fit;

import fts.calibration.NegativeValueException;
import fts.calibration.input.Configuration;

/**
 * Settings of a calibration run. Values not set explicitly are taken from the program
 * {@link Configuration}.
 */
public class CalibrationParameters {

  private final double discriminator;
  private final double amplitudeThreshold;
  private final double discardLimit;
  private final double pointSpacing;
  private final double initialCorrection;
  private final double solverTolerance;
  private final int solverMaxIterations;

  private CalibrationParameters(Builder builder) {
    // defaults from the configuration file have not been through the builder's setters
    discriminator = Builder.requireNonNegative("discriminator", builder.discriminator);
    amplitudeThreshold =
        Builder.requireNonNegative("peak amplitude threshold", builder.amplitudeThreshold);
    discardLimit = Builder.requireNonNegative("discard limit", builder.discardLimit);
    pointSpacing = Builder.requireNonNegative("point spacing", builder.pointSpacing);
    initialCorrection = builder.initialCorrection;
    solverTolerance = Builder.requireNonNegative("solver tolerance", builder.solverTolerance);
    solverMaxIterations = builder.solverMaxIterations;
  }

  /**
   * @return Parameters using the configured defaults throughout
   */
  public static CalibrationParameters defaults() {
    return builder().build();
  }

  /**
   * @return Builder initialised with the configured defaults
   */
  public static Builder builder() {
    return new Builder(Configuration.getInstance());
  }

  /**
   * @return Maximum wavenumber difference (cm^-1) allowed between matched lines
   */
  public double getDiscriminator() {
    return discriminator;
  }

  /**
   * @return Minimum peak amplitude for a matched line to be fitted
   */
  public double getAmplitudeThreshold() {
    return amplitudeThreshold;
  }

  /**
   * @return Number of residual standard deviations beyond which a fitted line is discarded
   */
  public double getDiscardLimit() {
    return discardLimit;
  }

  /**
   * @return Separation between spectrum data points (cm^-1), used for centroid errors
   */
  public double getPointSpacing() {
    return pointSpacing;
  }

  public double getInitialCorrection() {
    return initialCorrection;
  }

  public double getSolverTolerance() {
    return solverTolerance;
  }

  public int getSolverMaxIterations() {
    return solverMaxIterations;
  }

  @Override
  public String toString() {
    return "Discriminator             : " + discriminator + '\n'
        + "Minimum line amplitude    : " + amplitudeThreshold + '\n'
        + "Discard beyond x Std Dev  : " + discardLimit + '\n'
        + "Point spacing             : " + pointSpacing;
  }

  public static class Builder {

    private double discriminator;
    private double amplitudeThreshold;
    private double discardLimit;
    private double pointSpacing;
    private double initialCorrection;
    private double solverTolerance;
    private int solverMaxIterations;

    private Builder(Configuration config) {
      discriminator = config.getDiscriminator();
      amplitudeThreshold = config.getPeakThreshold();
      discardLimit = config.getDiscardLimit();
      pointSpacing = config.getPointSpacing();
      initialCorrection = 0.;
      solverTolerance = config.getSolverTolerance();
      solverMaxIterations = config.getSolverMaxIterations();
    }

    public Builder discriminator(double discriminator) {
      this.discriminator = requireNonNegative("discriminator", discriminator);
      return this;
    }

    public Builder amplitudeThreshold(double amplitudeThreshold) {
      this.amplitudeThreshold = requireNonNegative("peak amplitude threshold", amplitudeThreshold);
      return this;
    }

    public Builder discardLimit(double discardLimit) {
      this.discardLimit = requireNonNegative("discard limit", discardLimit);
      return this;
    }

    public Builder pointSpacing(double pointSpacing) {
      this.pointSpacing = requireNonNegative("point spacing", pointSpacing);
      return this;
    }

    /**
     * @param initialCorrection Starting correction factor for the solver (may be negative)
     * @return This builder
     */
    public Builder initialCorrection(double initialCorrection) {
      this.initialCorrection = initialCorrection;
      return this;
    }

    public Builder solverTolerance(double solverTolerance) {
      this.solverTolerance = requireNonNegative("solver tolerance", solverTolerance);
      return this;
    }

    public Builder solverMaxIterations(int solverMaxIterations) {
      if (solverMaxIterations < 1) {
        throw new IllegalArgumentException("Solver needs at least one iteration");
      }
      this.solverMaxIterations = solverMaxIterations;
      return this;
    }

    /**
     * @return Parameters with the values set in this builder
     * @throws NegativeValueException If a value taken from the configuration is negative
     */
    public CalibrationParameters build() {
      return new CalibrationParameters(this);
    }

    private static double requireNonNegative(String field, double value) {
      if (value < 0.) {
        throw new NegativeValueException(field, value);
      }
      return value;
    }
  }
}
