package fts.calibration.output;

import fts.calibration.fit.CalibrationSession;
import java.awt.BasicStroke;
import java.awt.Color;
import java.util.List;
import java.util.Locale;
import org.apache.commons.math3.util.Pair;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.ValueMarker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYItemRenderer;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Plot of the scaled residual of each fitted and discarded line against its standard
 * wavenumber, with markers at the edges of the band outside of which lines are discarded.
 */
public class ResidualPlot {

  static final String X_AXIS_TITLE = "Line Wavenumber / cm^-1";
  static final String Y_AXIS_TITLE = "dSig/Sig x 1e6";

  private static final Color FITTED_COLOR = new Color(0x00, 0x00, 0xFF);
  private static final Color DISCARDED_COLOR = new Color(0xFF, 0x00, 0x00);
  private static final Color BAND_COLOR = new Color(0x90, 0x90, 0x90);

  private ResidualPlot() {
  }

  /**
   * Get the plottable residuals of a session: series 0 is the fitted lines and series 1 the
   * discarded lines. The series names include the number of lines in each.
   *
   * @param session Calibration session that has been fitted
   * @return Dataset of (standard wavenumber, scaled residual) points
   */
  public static XYSeriesCollection createDataset(CalibrationSession session) {
    List<Pair<Double, Double>> fitted = session.getFitSetResiduals();
    List<Pair<Double, Double>> discarded = session.getDiscardedResiduals();

    XYSeries fittedSeries = new XYSeries("Fitted Lines (" + fitted.size() + ")");
    for (Pair<Double, Double> point : fitted) {
      fittedSeries.add(point.getFirst(), point.getSecond());
    }
    XYSeries discardedSeries = new XYSeries("Discarded Lines (" + discarded.size() + ")");
    for (Pair<Double, Double> point : discarded) {
      discardedSeries.add(point.getFirst(), point.getSecond());
    }

    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(fittedSeries);
    xysc.addSeries(discardedSeries);
    return xysc;
  }

  /**
   * Create the residual chart for a session
   *
   * @param session Calibration session that has been fitted
   * @return Scatter chart of residuals with the rejection band marked
   */
  public static JFreeChart createChart(CalibrationSession session) {
    XYSeriesCollection xysc = createDataset(session);
    String title = String.format(Locale.ROOT, "Wavenumber correction = %1.3e ± %1.3e",
        session.getFitState().getCorrection(), session.getFitState().getCorrectionError());
    JFreeChart chart = ChartFactory.createScatterPlot(title, X_AXIS_TITLE, Y_AXIS_TITLE, xysc,
        PlotOrientation.VERTICAL, true, false, false);

    XYPlot plot = chart.getXYPlot();
    XYItemRenderer renderer = plot.getRenderer();
    renderer.setSeriesPaint(0, FITTED_COLOR);
    renderer.setSeriesPaint(1, DISCARDED_COLOR);
    plot.getRangeAxis().setAutoRange(true);

    double band = session.getRejectionBand();
    BasicStroke dashed = new BasicStroke(0.5f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER,
        1.0f, new float[]{4.0f, 4.0f}, 0.0f);
    for (double edge : new double[]{band, -band}) {
      ValueMarker marker = new ValueMarker(edge);
      marker.setPaint(BAND_COLOR);
      marker.setStroke(dashed);
      plot.addRangeMarker(marker);
    }
    return chart;
  }
}
