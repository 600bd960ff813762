package fts.calibration.input;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Reads line lists written by XGremlin's "writelines" command. These consist of four header rows
 * (wavenumber correction, air correction, intensity calibration, column titles) followed by one
 * row per line with whitespace-delimited fields: index, wavenumber, peak, width, damping,
 * equivalent width, iteration count, hold flag, tags, four residual components, the line
 * identification (free text, may contain blanks) and the wavelength.
 *
 * If the header records a wavenumber correction, that correction has already been applied to the
 * values in the file. The lines are stored with the correction removed from their raw values and
 * set as their correction factor, so that the corrected values seen by the rest of the program
 * are the ones in the file.
 */
public class LineListParser {

  private static final Logger logger = Logger.getLogger(LineListParser.class);

  /**
   * Field content XGremlin writes when a value overflows its column
   */
  static final String OVERLOAD = "**********";
  static final int HEADER_ROWS = 4;

  private static final String[] HEADER_ROW_NAMES =
      {"wavenumber correction", "air correction", "intensity calibration", "column headers"};

  private LineListParser() {
  }

  /**
   * Read a line list from a file
   *
   * @param file Writelines-format file to read
   * @return Line list named after the file, with its header
   * @throws IOException If the file cannot be read
   * @throws LineListFormatException If the header or a line record cannot be parsed
   */
  public static LineList read(File file) throws IOException, LineListFormatException {
    logger.info("Reading line list from " + file.getPath());
    try (BufferedReader br = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return read(br, file.getPath());
    }
  }

  /**
   * Read a line list from a stream of text
   *
   * @param reader Source of writelines-format text
   * @param name Name to give the list (used in error messages and reports)
   * @return Line list with its header
   * @throws IOException If the stream cannot be read
   * @throws LineListFormatException If the header or a line record cannot be parsed
   */
  public static LineList read(Reader reader, String name)
      throws IOException, LineListFormatException {
    BufferedReader br =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

    String[] headerRows = new String[HEADER_ROWS];
    for (int i = 0; i < HEADER_ROWS; ++i) {
      headerRows[i] = br.readLine();
      if (headerRows[i] == null) {
        throw new LineListFormatException("Error reading " + HEADER_ROW_NAMES[i] + " from the "
            + name + " header. Check the file was written with XGremlin's 'writelines' command."
            + " (A dummy header can be made by inserting 4 blank lines at the top of the file.)");
      }
    }
    double correction = parseWavenumberCorrection(headerRows[0]);
    LineListHeader header = new LineListHeader(
        headerRows[0], headerRows[1], headerRows[2], headerRows[3], correction);

    List<Line> lines = new ArrayList<>();
    int rowNumber = HEADER_ROWS;
    String row;
    while ((row = br.readLine()) != null) {
      ++rowNumber;
      if (row.trim().isEmpty()) {
        continue;
      }
      try {
        lines.add(parseLine(row, correction));
      } catch (LineListFormatException e) {
        throw new LineListFormatException(
            "Error reading " + e.getMessage() + " from line " + rowNumber + " in " + name
                + ". File loading aborted.");
      }
    }
    logger.info("Read " + lines.size() + " lines from " + name
        + " (wavenumber correction " + correction + ")");
    return new LineList(name, header, lines);
  }

  /**
   * Get the wavenumber correction described by the first row of a writelines header. This is
   * either "NO WAVENUMBER CORRECTION..." or "WAVENUMBER CORRECTION APPLIED: wavcorr = [value]".
   *
   * @param row First header row
   * @return Wavenumber correction factor (zero if none applied)
   * @throws LineListFormatException If the row has neither form
   */
  public static double parseWavenumberCorrection(String row) throws LineListFormatException {
    String text = row.trim();
    if (text.isEmpty() || text.startsWith("NO")) {
      return 0.;
    }
    int equals = text.indexOf('=');
    if (text.startsWith("WAVENUMBER") && equals >= 0) {
      String[] tokens = text.substring(equals + 1).trim().split("\\s+");
      try {
        return Double.parseDouble(tokens[0]);
      } catch (NumberFormatException e) {
        // fall through to the error below
        logger.debug("Unparseable wavenumber correction value " + tokens[0]);
      }
    }
    throw new LineListFormatException(
        "Unable to read the wavenumber correction from the line list header: " + row);
  }

  /**
   * Parse one writelines line record
   *
   * @param row Text of the record
   * @param correction Wavenumber correction already applied to the values in the record
   * @return Line with raw values and the given correction
   * @throws LineListFormatException If a field cannot be read; the message names the field
   */
  static Line parseLine(String row, double correction) throws LineListFormatException {
    FieldReader fields = new FieldReader(row);
    Line.Builder builder = Line.builder();
    builder.index((int) fields.nextNumber("index"));
    double wavenumber = fields.nextNumber("wavenumber");
    builder.peak(fields.nextNumber("peak height"));
    double width = fields.nextNumber("width");
    builder.damping(fields.nextNumber("dmp"));
    builder.eqWidth(fields.nextNumber("eqwidth"));
    builder.iterations((int) fields.nextNumber("itn"));
    builder.hold((int) fields.nextNumber("h"));
    builder.tags(fields.nextToken("tags"));
    double epsTotal = fields.nextNumber("epstot");
    double epsEven = fields.nextNumber("epsevn");
    double epsOdd = fields.nextNumber("epsodd");
    double epsRandom = fields.nextNumber("epsran");
    builder.residuals(epsTotal, epsEven, epsOdd, epsRandom);

    // identification may contain blanks; the wavelength is always the last field of the row
    String remainder = fields.remainder();
    int lastBlank = Math.max(remainder.lastIndexOf(' '), remainder.lastIndexOf('\t'));
    String identification = lastBlank < 0 ? "" : remainder.substring(0, lastBlank).trim();
    String wavelengthText = remainder.substring(lastBlank + 1);
    double wavelength = toNumber(wavelengthText, "wavelength");

    return builder.identification(identification)
        .wavenumber(wavenumber / (1. + correction))
        .width(width / (1. + correction))
        .wavelength(wavelength * (1. + correction))
        .correction(correction)
        .build();
  }

  private static double toNumber(String token, String field) throws LineListFormatException {
    if (token.isEmpty()) {
      throw new LineListFormatException(field);
    }
    try {
      return Double.parseDouble(token);
    } catch (NumberFormatException e) {
      if (token.equals(OVERLOAD)) {
        logger.warn(OVERLOAD + " has been found in the " + field
            + " column. A value of zero has been taken instead.");
        return 0.;
      }
      throw new LineListFormatException(field);
    }
  }

  /**
   * Sequential reader over the whitespace-delimited fields of one record
   */
  private static class FieldReader {

    private final String row;
    private int position;

    FieldReader(String row) {
      this.row = row;
      position = 0;
    }

    String nextToken(String field) throws LineListFormatException {
      while (position < row.length() && Character.isWhitespace(row.charAt(position))) {
        ++position;
      }
      int start = position;
      while (position < row.length() && !Character.isWhitespace(row.charAt(position))) {
        ++position;
      }
      if (start == position) {
        throw new LineListFormatException(field);
      }
      return row.substring(start, position);
    }

    /**
     * Read a numeric field. Fixed-width numbers are not always separated by blanks: a negative
     * number filling its field follows the previous one directly, so a sign that is neither
     * leading nor part of an exponent starts the next field.
     */
    double nextNumber(String field) throws LineListFormatException {
      while (position < row.length() && Character.isWhitespace(row.charAt(position))) {
        ++position;
      }
      int start = position;
      while (position < row.length() && !Character.isWhitespace(row.charAt(position))) {
        char c = row.charAt(position);
        if ((c == '-' || c == '+') && position > start) {
          char previous = row.charAt(position - 1);
          if (previous != 'e' && previous != 'E') {
            break;
          }
        }
        ++position;
      }
      if (start == position) {
        throw new LineListFormatException(field);
      }
      return toNumber(row.substring(start, position), field);
    }

    String remainder() {
      return row.substring(position).trim();
    }
  }

  /**
   * Line list exception thrown when the header or a record does not have the data expected.
   */
  public static class LineListFormatException extends Exception {

    private static final long serialVersionUID = -3071502717064208339L;

    public LineListFormatException(String s) {
      super(s);
    }
  }
}
