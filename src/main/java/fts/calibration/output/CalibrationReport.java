package fts.calibration.output;

import fts.calibration.fit.CalibrationParameters;
import fts.calibration.fit.CalibrationSession;
import fts.calibration.fit.FitState;
import fts.calibration.fit.LineError;
import fts.calibration.fit.RobustFitter;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;

/**
 * Produces the results of a calibration as text: the calibration settings and fit results,
 * followed by the calibrated wavenumber of every line of the list with its error components
 * (scale error, residual std dev error, Brault centroid error, and the final error).
 * All wavenumbers and errors are in cm^-1.
 */
public class CalibrationReport {

  private CalibrationReport() {
  }

  /**
   * Write the calibration results file
   *
   * @param session Calibration session that has been fitted
   * @param file Destination file
   * @throws IOException If the file cannot be written
   */
  public static void write(CalibrationSession session, File file) throws IOException {
    try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
      write(session, writer);
    }
  }

  /**
   * Write the calibration results to a stream of text. The writer is flushed but not closed.
   *
   * @param session Calibration session that has been fitted
   * @param writer Destination
   * @throws IOException If writing fails
   */
  public static void write(CalibrationSession session, Writer writer) throws IOException {
    PrintWriter out = new PrintWriter(writer);
    out.print(getHeaderString(session));
    out.println("#  n  Wavenumber    Scale Error   StdDev Error  Brault Error  Full Error");
    for (LineError error : session.getLineErrors()) {
      out.println(formatError(error));
    }
    out.flush();
    if (out.checkError()) {
      throw new IOException("Error writing calibration report");
    }
  }

  /**
   * Get the commented header of the report: input lists, settings, and fit results
   *
   * @param session Calibration session that has been fitted
   * @return Header rows, each starting with '#'
   */
  public static String getHeaderString(CalibrationSession session) {
    CalibrationParameters params = session.getParameters();
    FitState fit = session.getFitState();
    StringBuilder sb = new StringBuilder();
    sb.append(String.format(Locale.ROOT, "# Fitted lines from %s against standards in %s%n",
        session.getLineList().getName(), session.getStandardList().getName()));
    sb.append(String.format(Locale.ROOT, "# Discriminator / K : %f%n", params.getDiscriminator()));
    sb.append(String.format(Locale.ROOT, "# Peak Amp Threshold: %f%n",
        params.getAmplitudeThreshold()));
    sb.append(String.format(Locale.ROOT, "# Discard Limit     : %f%n", params.getDiscardLimit()));
    sb.append(String.format(Locale.ROOT, "# Point Spacing     : %f%n#%n",
        params.getPointSpacing()));
    sb.append(String.format(Locale.ROOT, "# Correction factor : %e +/- %e%n",
        fit.getCorrection(), fit.getCorrectionError()));
    sb.append(String.format(Locale.ROOT, "# Mean fit residual : %e%n",
        fit.getResidualMean() / RobustFitter.RESIDUAL_SCALE));
    sb.append(String.format(Locale.ROOT, "# Residual std dev  : %e%n#%n",
        fit.getResidualStdDev() / RobustFitter.RESIDUAL_SCALE));
    return sb.toString();
  }

  /**
   * Get a plain summary of the fit, as shown on the console and in the PDF report
   *
   * @param session Calibration session that has been fitted
   * @return Multi-line summary text
   */
  public static String getSummaryString(CalibrationSession session) {
    FitState fit = session.getFitState();
    double scale = RobustFitter.RESIDUAL_SCALE;
    StringBuilder sb = new StringBuilder();
    sb.append("Line list        : ").append(session.getLineList().getName()).append('\n');
    sb.append("Standard list    : ").append(session.getStandardList().getName()).append('\n');
    sb.append(session.getParameters()).append('\n');
    sb.append("Common lines     : ").append(session.getCommonPairs().size()).append('\n');
    sb.append("Lines fitted     : ").append(session.getFitSet().size()).append('\n');
    sb.append("Lines discarded  : ").append(session.getDiscardedSet().size()).append('\n');
    sb.append("Fit rounds       : ").append(fit.getFitRounds()).append('\n');
    sb.append("Residual Mean dSig/Sig   : ").append(fit.getResidualMean() / scale).append('\n');
    sb.append("Residual StdDev dSig/Sig : ").append(fit.getResidualStdDev() / scale).append('\n');
    sb.append("Residual StdErr dSig/Sig : ").append(fit.getResidualStdErr() / scale).append('\n');
    sb.append("Optimal dSig/Sig : ").append(fit.getCorrection()).append(" +/- ")
        .append(fit.getCorrectionError());
    return sb.toString();
  }

  /**
   * Format one row of the per-line error table
   *
   * @param error Errors of a line
   * @return Row text: index, wavenumber, scale, std dev, Brault and final errors
   */
  public static String formatError(LineError error) {
    return String.format(Locale.ROOT, "%4d  %11.6f  %11.6e  %11.6e  %11.6e  %11.6e",
        error.getIndex(), error.getWavenumber(), error.getScaleError(), error.getStdDevError(),
        error.getBraultError(), error.getFinalError());
  }
}
