package fts.calibration.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, unmodifiable list of lines together with the header of the file they came from.
 * Lines are expected in ascending order of (corrected) wavenumber; this is the responsibility of
 * whatever produced the list and is not checked or fixed here. Other classes refer to the lines of
 * a list by their position in it.
 */
public class LineList implements Iterable<Line> {

  private final String name;
  private final LineListHeader header;
  private final List<Line> lines;

  /**
   * @param name Name of the list (usually the file it was read from), used in reports
   * @param header Header rows to write back out with the list
   * @param lines Lines of the list, ascending in wavenumber
   */
  public LineList(String name, LineListHeader header, List<Line> lines) {
    this.name = name;
    this.header = header;
    this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
  }

  /**
   * Create a list without a source file, using the blank XGremlin header
   *
   * @param name Name of the list
   * @param lines Lines of the list, ascending in wavenumber
   */
  public LineList(String name, List<Line> lines) {
    this(name, LineListHeader.blank(), lines);
  }

  /**
   * Get a copy of this list calibrated by a further wavenumber correction factor. The factor is
   * composed with the correction each line already carries, so a line's corrected wavenumber is
   * multiplied by (1 + factor). The header is updated to record the combined correction.
   *
   * @param factor Wavenumber correction factor found against the current corrected values
   * @return Calibrated copy of this list
   */
  public LineList applyCorrection(double factor) {
    List<Line> corrected = new ArrayList<>(lines.size());
    for (Line line : lines) {
      corrected.add(line.withCorrection(composeCorrections(line.getCorrection(), factor)));
    }
    double headerCorrection = composeCorrections(header.getWavenumberCorrection(), factor);
    return new LineList(name, header.withWavenumberCorrection(headerCorrection), corrected);
  }

  /**
   * Combine two multiplicative wavenumber corrections, (1 + a)(1 + b) = 1 + result
   *
   * @param first Correction applied first
   * @param second Correction applied on top of the first
   * @return Single correction equivalent to applying both
   */
  public static double composeCorrections(double first, double second) {
    return first + second + first * second;
  }

  public Line get(int index) {
    return lines.get(index);
  }

  public int size() {
    return lines.size();
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  public List<Line> getLines() {
    return lines;
  }

  public String getName() {
    return name;
  }

  public LineListHeader getHeader() {
    return header;
  }

  @Override
  public Iterator<Line> iterator() {
    return lines.iterator();
  }
}
