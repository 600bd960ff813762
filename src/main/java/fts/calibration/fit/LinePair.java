package fts.calibration.fit;

/**
 * A line of the uncalibrated list matched to a line of the standard list. The pair holds only the
 * positions of the two lines within their lists; the lists themselves are owned by the
 * calibration session.
 */
public final class LinePair {

  private final int listIndex;
  private final int standardIndex;

  LinePair(int listIndex, int standardIndex) {
    this.listIndex = listIndex;
    this.standardIndex = standardIndex;
  }

  /**
   * @return Position of the line in the uncalibrated list
   */
  public int getListIndex() {
    return listIndex;
  }

  /**
   * @return Position of the line in the standard list
   */
  public int getStandardIndex() {
    return standardIndex;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof LinePair)) {
      return false;
    }
    LinePair pair = (LinePair) other;
    return listIndex == pair.listIndex && standardIndex == pair.standardIndex;
  }

  @Override
  public int hashCode() {
    return 31 * listIndex + standardIndex;
  }

  @Override
  public String toString() {
    return "(" + listIndex + ", " + standardIndex + ")";
  }
}
