package fts.calibration.fit;

import fts.calibration.NoLineDataException;
import fts.calibration.NoOverlapException;
import fts.calibration.input.Line;
import fts.calibration.input.LineList;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Finds the lines common to an uncalibrated line list and a standard line list.
 *
 * Both lists must already be sorted by ascending wavenumber. They are walked through together,
 * one cursor per list: when the current lines of the two lists are closer than the discriminator
 * they are paired and both cursors advance, otherwise the cursor on the lower-wavenumber line
 * advances, as that line can have no partner further along the other list. Each line is used in
 * at most one pair, and a list line is paired with the first standard line within tolerance.
 */
public class LineMatcher {

  private static final Logger logger = Logger.getLogger(LineMatcher.class);

  private LineMatcher() {
  }

  /**
   * Match lines of the uncalibrated list to lines of the standard list
   *
   * @param list Uncalibrated lines, ascending in wavenumber
   * @param standard Standard lines, ascending in wavenumber
   * @param discriminator Maximum wavenumber difference (cm^-1) between matched lines (exclusive)
   * @return Matched pairs, in ascending wavenumber order
   * @throws NoLineDataException If either list is empty
   * @throws NoOverlapException If no pairs were found
   */
  public static List<LinePair> match(LineList list, LineList standard, double discriminator) {
    if (list.isEmpty() || standard.isEmpty()) {
      throw new NoLineDataException("Cannot match lines: the "
          + (list.isEmpty() ? "uncalibrated" : "standard") + " line list is empty");
    }

    List<LinePair> pairs = new ArrayList<>();
    int listIndex = 0;
    int stdIndex = 0;
    while (listIndex < list.size() && stdIndex < standard.size()) {
      Line listLine = list.get(listIndex);
      Line stdLine = standard.get(stdIndex);
      double difference = stdLine.getWavenumber() - listLine.getWavenumber();
      if (Math.abs(difference) < discriminator) {
        pairs.add(new LinePair(listIndex, stdIndex));
        ++listIndex;
        ++stdIndex;
      } else if (stdLine.getWavenumber() < listLine.getWavenumber()) {
        logger.debug("Reference line " + stdLine.getIndex() + " (" + stdLine.getWavenumber()
            + "K) is absent from the experiment.");
        ++stdIndex;
      } else {
        logger.debug("Line " + listLine.getIndex() + " (" + listLine.getWavenumber()
            + "K) has no partner in the standard list.");
        ++listIndex;
      }
    }

    if (pairs.isEmpty()) {
      throw new NoOverlapException("No common lines were found between " + list.getName()
          + " and " + standard.getName() + " within " + discriminator + " K");
    }
    logger.info("Found " + pairs.size() + " lines common to " + list.getName() + " and "
        + standard.getName());
    return pairs;
  }
}
