package fts.calibration.input;

import fts.calibration.NegativeValueException;

/**
 * A single spectral line as measured by a Fourier transform spectrometer, holding the fields of
 * one record of an XGremlin writelines line list.
 *
 * Lines are immutable. The wavenumber, width and wavelength are stored uncorrected; the
 * wavenumber correction factor carried by the line is applied whenever those values are read, so
 * that getWavenumber() returns raw * (1 + correction). Width scales with the same factor since it
 * is measured on the same frequency axis, while the wavelength scales inversely. The peak amplitude
 * is never corrected. To calibrate a line, use {@link #withCorrection(double)} to get a copy of
 * it with a different correction factor over the same raw values.
 *
 * Wavenumbers are in cm^-1, widths in mK (1000 * cm^-1), wavelengths in Angstroms.
 */
public class Line {

  private final int index;
  private final double wavenumber;
  private final double peak;
  private final double width;
  private final double damping;
  private final double eqWidth;
  private final int iterations;
  private final int hold;
  private final String tags;
  private final double epsTotal;
  private final double epsEven;
  private final double epsOdd;
  private final double epsRandom;
  private final String identification;
  private final double wavelength;
  private final double correction;

  private Line(Builder builder) {
    index = builder.index;
    wavenumber = requireNonNegative("wavenumber", builder.wavenumber);
    peak = requireNonNegative("peak", builder.peak);
    width = requireNonNegative("width", builder.width);
    damping = builder.damping;
    eqWidth = requireNonNegative("eqwidth", builder.eqWidth);
    iterations = builder.iterations;
    hold = builder.hold;
    tags = builder.tags;
    epsTotal = builder.epsTotal;
    epsEven = builder.epsEven;
    epsOdd = builder.epsOdd;
    epsRandom = builder.epsRandom;
    identification = stripTrailingBlanks(builder.identification);
    wavelength = requireNonNegative("wavelength", builder.wavelength);
    correction = builder.correction;
  }

  private static double requireNonNegative(String field, double value) {
    if (value < 0.) {
      throw new NegativeValueException(field, value);
    }
    return value;
  }

  private static String stripTrailingBlanks(String text) {
    if (text == null) {
      return "";
    }
    int end = text.length();
    while (end > 0 && text.charAt(end - 1) == ' ') {
      --end;
    }
    return text.substring(0, end);
  }

  /**
   * Start building a line. All numeric fields default to zero, tags to "." and the
   * identification to an empty string.
   *
   * @return New line builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Shorthand for a line with only the values used by the calibration set
   *
   * @param wavenumber Uncorrected wavenumber (cm^-1)
   * @param peak Peak amplitude
   * @param width Uncorrected line width (mK)
   * @return Line with the given values and no correction applied
   */
  public static Line of(double wavenumber, double peak, double width) {
    return builder().wavenumber(wavenumber).peak(peak).width(width).build();
  }

  /**
   * Get a copy of this line using a new wavenumber correction factor. The raw values of the
   * line are unchanged, so the correction replaces (rather than adds to) the current one.
   *
   * @param newCorrection Wavenumber correction factor to apply to the copy
   * @return Copy of this line with the given correction
   */
  public Line withCorrection(double newCorrection) {
    return toBuilder().correction(newCorrection).build();
  }

  /**
   * @return Builder pre-populated with every field of this line, including raw values
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.index = index;
    builder.wavenumber = wavenumber;
    builder.peak = peak;
    builder.width = width;
    builder.damping = damping;
    builder.eqWidth = eqWidth;
    builder.iterations = iterations;
    builder.hold = hold;
    builder.tags = tags;
    builder.epsTotal = epsTotal;
    builder.epsEven = epsEven;
    builder.epsOdd = epsOdd;
    builder.epsRandom = epsRandom;
    builder.identification = identification;
    builder.wavelength = wavelength;
    builder.correction = correction;
    return builder;
  }

  /**
   * Expected uncertainty in the position of the line centroid (Brault), from the line's own
   * width and peak amplitude, independent of any calibration fit. This is
   * width / (1000 * sqrt(points in FWHM) * peak), evaluated as sqrt(width * spacing / 1000) / peak
   * so that a zero-width line gives zero rather than NaN. A line with zero peak amplitude (such as
   * an overloaded field read as zero) has an unconstrained centroid, and the error is infinite.
   *
   * @param pointSpacing Separation between spectrum data points (cm^-1)
   * @return Centroid uncertainty (cm^-1), positive infinity if the peak amplitude is zero
   */
  public double getCentroidError(double pointSpacing) {
    if (peak == 0.) {
      return Double.POSITIVE_INFINITY;
    }
    return Math.sqrt(getWidth() * pointSpacing / 1000.) / peak;
  }

  public int getIndex() {
    return index;
  }

  /**
   * @return Wavenumber with this line's correction factor applied (cm^-1)
   */
  public double getWavenumber() {
    return wavenumber * (1. + correction);
  }

  /**
   * @return Wavenumber as stored, before the correction factor is applied (cm^-1)
   */
  public double getRawWavenumber() {
    return wavenumber;
  }

  public double getPeak() {
    return peak;
  }

  /**
   * @return Line width with this line's correction factor applied (mK)
   */
  public double getWidth() {
    return width * (1. + correction);
  }

  public double getRawWidth() {
    return width;
  }

  public double getDamping() {
    return damping;
  }

  public double getEqWidth() {
    return eqWidth;
  }

  public int getIterations() {
    return iterations;
  }

  public int getHold() {
    return hold;
  }

  public String getTags() {
    return tags;
  }

  public double getEpsTotal() {
    return epsTotal;
  }

  public double getEpsEven() {
    return epsEven;
  }

  public double getEpsOdd() {
    return epsOdd;
  }

  public double getEpsRandom() {
    return epsRandom;
  }

  public String getIdentification() {
    return identification;
  }

  /**
   * @return Wavelength with this line's correction factor applied (nm)
   */
  public double getWavelength() {
    return wavelength / (1. + correction);
  }

  public double getRawWavelength() {
    return wavelength;
  }

  public double getCorrection() {
    return correction;
  }

  @Override
  public String toString() {
    return "Line " + index + " (" + identification + "): " + getWavenumber() + " K, peak " + peak;
  }

  /**
   * Builder for line objects; validation of non-negative fields happens in {@link #build()}.
   */
  public static class Builder {

    private int index = 0;
    private double wavenumber = 0.;
    private double peak = 0.;
    private double width = 0.;
    private double damping = 0.;
    private double eqWidth = 0.;
    private int iterations = 0;
    private int hold = 0;
    private String tags = ".";
    private double epsTotal = 0.;
    private double epsEven = 0.;
    private double epsOdd = 0.;
    private double epsRandom = 0.;
    private String identification = "";
    private double wavelength = 0.;
    private double correction = 0.;

    private Builder() {
    }

    public Builder index(int index) {
      this.index = index;
      return this;
    }

    public Builder wavenumber(double wavenumber) {
      this.wavenumber = wavenumber;
      return this;
    }

    public Builder peak(double peak) {
      this.peak = peak;
      return this;
    }

    public Builder width(double width) {
      this.width = width;
      return this;
    }

    public Builder damping(double damping) {
      this.damping = damping;
      return this;
    }

    public Builder eqWidth(double eqWidth) {
      this.eqWidth = eqWidth;
      return this;
    }

    public Builder iterations(int iterations) {
      this.iterations = iterations;
      return this;
    }

    public Builder hold(int hold) {
      this.hold = hold;
      return this;
    }

    public Builder tags(String tags) {
      this.tags = tags;
      return this;
    }

    /**
     * Set the four fit residual components of the line, as reported by XGremlin
     *
     * @param total Total residual
     * @param even Even residual component
     * @param odd Odd residual component
     * @param random Random residual component
     * @return This builder
     */
    public Builder residuals(double total, double even, double odd, double random) {
      this.epsTotal = total;
      this.epsEven = even;
      this.epsOdd = odd;
      this.epsRandom = random;
      return this;
    }

    public Builder identification(String identification) {
      this.identification = identification;
      return this;
    }

    public Builder wavelength(double wavelength) {
      this.wavelength = wavelength;
      return this;
    }

    public Builder correction(double correction) {
      this.correction = correction;
      return this;
    }

    /**
     * @return New line from the values set in this builder
     * @throws NegativeValueException if the wavenumber, peak, width, equivalent width or
     * wavelength is negative
     */
    public Line build() {
      return new Line(this);
    }
  }
}
