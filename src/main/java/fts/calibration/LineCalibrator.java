package fts.calibration;

import fts.calibration.fit.CalibrationParameters;
import fts.calibration.fit.CalibrationSession;
import fts.calibration.fit.FitState;
import fts.calibration.input.Configuration;
import fts.calibration.input.LineList;
import fts.calibration.input.LineListParser;
import fts.calibration.input.LineListParser.LineListFormatException;
import fts.calibration.output.CalibrationReport;
import fts.calibration.output.LineListWriter;
import fts.calibration.output.ResidualPlot;
import fts.calibration.utils.ReportingUtils;
import java.io.File;
import java.io.IOException;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import org.apache.log4j.Logger;
import org.jfree.chart.JFreeChart;

/**
 * Command line entry point. Calibrates the wavenumbers of a line list against a list of standard
 * lines and writes the calibrated list (.cln), the per-line calibration results (.cal) and a PDF
 * report with the residual plot (.pdf).
 *
 * Settings not given on the command line come from {@link Configuration}.
 */
public class LineCalibrator {

  private static final Logger logger = Logger.getLogger(LineCalibrator.class);

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_READ_ERROR = 2;
  static final int EXIT_FORMAT_ERROR = 3;
  static final int EXIT_WRITE_ERROR = 4;
  static final int EXIT_NEGATIVE_VALUE = 5;
  static final int EXIT_NO_LINE_DATA = 6;
  static final int EXIT_NO_OVERLAP = 7;
  static final int EXIT_INSUFFICIENT_LINES = 8;
  static final int EXIT_SOLVER_DIVERGENCE = 9;
  static final int EXIT_CALIBRATION_ERROR = 10;

  static final String USAGE = "Usage: LineCalibrator <line list> <standard list> "
      + "[<discriminator> <min S/N> <discard limit> <point spacing>] <output>\n"
      + "  <line list>      writelines file of the lines to calibrate\n"
      + "  <standard list>  writelines file of the standard lines\n"
      + "  <discriminator>  max wavenumber difference of matched lines / cm^-1\n"
      + "  <min S/N>        min peak amplitude of fitted lines\n"
      + "  <discard limit>  residual std devs beyond which lines are discarded\n"
      + "  <point spacing>  spectrum point spacing / cm^-1\n"
      + "  <output>         output file prefix (.cln, .cal and .pdf are added)";

  public static void main(String[] args) {
    System.exit(calibrate(args));
  }

  /**
   * Run a calibration from command line arguments
   *
   * @param args Command line arguments, either 3 or 7 of them
   * @return Exit status: 0 on success, otherwise a code specific to the failure
   */
  static int calibrate(String[] args) {
    if (args.length != 3 && args.length != 7) {
      System.err.println(USAGE);
      return EXIT_USAGE;
    }

    File listFile = new File(args[0]);
    File standardFile = new File(args[1]);
    String outputPrefix = args[args.length - 1];

    CalibrationParameters parameters;
    try {
      parameters = parseParameters(args);
    } catch (NumberFormatException e) {
      logger.error("Calibration settings must be numbers: " + e.getMessage());
      System.err.println(USAGE);
      return EXIT_USAGE;
    } catch (NegativeValueException e) {
      logger.error(e.getMessage());
      return EXIT_NEGATIVE_VALUE;
    }

    LineList lineList;
    LineList standardList;
    try {
      lineList = LineListParser.read(listFile);
      standardList = LineListParser.read(standardFile);
    } catch (LineListFormatException e) {
      logger.error(e.getMessage());
      return EXIT_FORMAT_ERROR;
    } catch (NegativeValueException e) {
      logger.error(e.getMessage());
      return EXIT_NEGATIVE_VALUE;
    } catch (IOException e) {
      logger.error("Error reading line lists", e);
      return EXIT_READ_ERROR;
    }
    logger.info("Read " + lineList.size() + " lines from " + lineList.getName() + " and "
        + standardList.size() + " standard lines from " + standardList.getName());

    final CalibrationSession session =
        new CalibrationSession(lineList, standardList, parameters);
    session.addChangeListener(new ChangeListener() {
      @Override
      public void stateChanged(ChangeEvent e) {
        logger.info(session.getStatus());
      }
    });

    try {
      session.run();
    } catch (InsufficientLinesException e) {
      logger.error(e.getMessage());
      return EXIT_INSUFFICIENT_LINES;
    } catch (NoLineDataException e) {
      logger.error(e.getMessage());
      return EXIT_NO_LINE_DATA;
    } catch (NoOverlapException e) {
      logger.error(e.getMessage());
      return EXIT_NO_OVERLAP;
    } catch (SolverDivergenceException e) {
      logger.warn(e.getMessage());
      return EXIT_SOLVER_DIVERGENCE;
    } catch (CalibrationException e) {
      logger.error("Calibration failed", e);
      return EXIT_CALIBRATION_ERROR;
    }

    try {
      writeOutputs(session, outputPrefix);
    } catch (IOException e) {
      logger.error("Error writing results to " + outputPrefix, e);
      return EXIT_WRITE_ERROR;
    }

    FitState fit = session.getFitState();
    logger.info("Wavenumber correction factor: " + fit.getCorrection() + " +/- "
        + fit.getCorrectionError() + " from " + session.getFitSet().size() + " lines ("
        + session.getDiscardedSet().size() + " discarded)");
    return EXIT_OK;
  }

  /**
   * Get the calibration settings, using the configured defaults where the arguments give none
   *
   * @param args Command line arguments, either 3 or 7 of them
   * @return Calibration settings
   * @throws NumberFormatException If a setting is not a number
   * @throws NegativeValueException If a setting is negative
   */
  static CalibrationParameters parseParameters(String[] args) {
    CalibrationParameters.Builder builder = CalibrationParameters.builder();
    if (args.length == 7) {
      builder.discriminator(Double.parseDouble(args[2]))
          .amplitudeThreshold(Double.parseDouble(args[3]))
          .discardLimit(Double.parseDouble(args[4]))
          .pointSpacing(Double.parseDouble(args[5]));
    }
    return builder.build();
  }

  /**
   * Write the calibrated list, the calibration results and the PDF report of a converged session
   *
   * @param session Converged calibration session
   * @param outputPrefix Path of the output files without extension
   * @throws IOException If any file cannot be written
   */
  static void writeOutputs(CalibrationSession session, String outputPrefix) throws IOException {
    LineListWriter.write(session.getCalibratedList(), new File(outputPrefix + ".cln"));
    CalibrationReport.write(session, new File(outputPrefix + ".cal"));

    Configuration config = Configuration.getInstance();
    JFreeChart chart = ResidualPlot.createChart(session);
    ReportingUtils.writeReport(new File(outputPrefix + ".pdf"), config.getPlotWidth(),
        config.getPlotHeight(), CalibrationReport.getSummaryString(session), chart);
  }
}
