package fts.calibration.input;

/**
 * The four header rows of an XGremlin writelines line list, carried alongside the lines read from
 * that file so that they can be written back out unchanged (apart from the wavenumber correction
 * row, which records the correction applied to the lines).
 *
 * The wavenumber correction previously applied to the list is parsed out of the first row when the
 * file is read, see {@link LineListParser}.
 */
public class LineListHeader {

  static final String CORRECTION_APPLIED_PREFIX = "  WAVENUMBER CORRECTION APPLIED: wavcorr =   ";
  static final String NO_CORRECTION_ROW = "  NO WAVENUMBER CORRECTION APPLIED";
  static final String NO_AIR_CORRECTION_ROW = "  NO AIR CORRECTION APPLIED";
  static final String NO_INTENSITY_CALIBRATION_ROW = "  NO INTENSITY CALIBRATION APPLIED";
  static final String COLUMN_TITLES_ROW =
      "  line    wavenumber      peak    width      dmp   eq width   itn   H tags"
          + "     epstot     epsevn     epsodd     epsran  identification"
          + "                   wavelength";

  private final String wavenumberCorrectionRow;
  private final String airCorrectionRow;
  private final String intensityCalibrationRow;
  private final String columnTitlesRow;
  private final double wavenumberCorrection;

  /**
   * @param wavenumberCorrectionRow First header row, text as read
   * @param airCorrectionRow Second header row
   * @param intensityCalibrationRow Third header row
   * @param columnTitlesRow Fourth header row, the column titles
   * @param wavenumberCorrection Correction factor described by the first row
   */
  public LineListHeader(String wavenumberCorrectionRow, String airCorrectionRow,
      String intensityCalibrationRow, String columnTitlesRow, double wavenumberCorrection) {
    this.wavenumberCorrectionRow = wavenumberCorrectionRow;
    this.airCorrectionRow = airCorrectionRow;
    this.intensityCalibrationRow = intensityCalibrationRow;
    this.columnTitlesRow = columnTitlesRow;
    this.wavenumberCorrection = wavenumberCorrection;
  }

  /**
   * Header for a list that did not come from a file (no corrections of any kind applied)
   *
   * @return Header with XGremlin's default rows
   */
  public static LineListHeader blank() {
    return new LineListHeader(NO_CORRECTION_ROW, NO_AIR_CORRECTION_ROW,
        NO_INTENSITY_CALIBRATION_ROW, COLUMN_TITLES_ROW, 0.);
  }

  /**
   * Get a copy of this header describing a different wavenumber correction. Other rows are kept.
   *
   * @param correction New wavenumber correction factor
   * @return Header whose first row records the given correction
   */
  public LineListHeader withWavenumberCorrection(double correction) {
    String row = correction == 0. ? NO_CORRECTION_ROW : CORRECTION_APPLIED_PREFIX + correction;
    return new LineListHeader(row, airCorrectionRow, intensityCalibrationRow, columnTitlesRow,
        correction);
  }

  public String getWavenumberCorrectionRow() {
    return wavenumberCorrectionRow;
  }

  public String getAirCorrectionRow() {
    return airCorrectionRow;
  }

  public String getIntensityCalibrationRow() {
    return intensityCalibrationRow;
  }

  public String getColumnTitlesRow() {
    return columnTitlesRow;
  }

  public double getWavenumberCorrection() {
    return wavenumberCorrection;
  }

  /**
   * @return The four header rows in file order
   */
  public String[] getRows() {
    return new String[]{wavenumberCorrectionRow, airCorrectionRow, intensityCalibrationRow,
        columnTitlesRow};
  }
}
