package fts.calibration.output;

import fts.calibration.input.Line;
import fts.calibration.input.LineList;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;
import org.apache.log4j.Logger;

/**
 * Writes line lists in XGremlin's writelines format: the four header rows of the list followed by
 * one fixed-layout row per line. Corrected values (wavenumber, width, wavelength) are written, so
 * a list written here and read back with the parser has the same corrected values.
 */
public class LineListWriter {

  private static final Logger logger = Logger.getLogger(LineListWriter.class);

  static final int ID_FIELD_WIDTH = 30;

  private LineListWriter() {
  }

  /**
   * Write a line list to a file, replacing any existing content
   *
   * @param lineList List to write
   * @param file Destination
   * @throws IOException If the file cannot be written
   */
  public static void write(LineList lineList, File file) throws IOException {
    logger.info("Writing " + lineList.size() + " lines to " + file.getPath());
    try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
      write(lineList, writer);
    }
  }

  /**
   * Write a line list to a stream of text. The writer is flushed but not closed.
   *
   * @param lineList List to write
   * @param writer Destination
   * @throws IOException If writing fails
   */
  public static void write(LineList lineList, Writer writer) throws IOException {
    PrintWriter out = new PrintWriter(writer);
    for (String row : lineList.getHeader().getRows()) {
      out.println(row);
    }
    for (Line line : lineList) {
      out.println(formatLine(line));
    }
    out.flush();
    if (out.checkError()) {
      throw new IOException("Error writing line list " + lineList.getName());
    }
  }

  /**
   * Format a line as one writelines record
   *
   * @param line Line to format
   * @return Text of the record (no line terminator)
   */
  public static String formatLine(Line line) {
    StringBuilder id = new StringBuilder(line.getIdentification());
    while (id.length() < ID_FIELD_WIDTH) {
      id.append(' ');
    }
    return String.format(Locale.ROOT,
        "%6d  %12.6f%10.3e%9.2f%9.4f%11.4e%6d%4d%5s%11.4e%11.4e%11.4e%11.4e %s%11.6f",
        line.getIndex(), line.getWavenumber(), line.getPeak(), line.getWidth(),
        line.getDamping(), line.getEqWidth(), line.getIterations(), line.getHold(),
        line.getTags(), line.getEpsTotal(), line.getEpsEven(), line.getEpsOdd(),
        line.getEpsRandom(), id, line.getWavelength());
  }
}
