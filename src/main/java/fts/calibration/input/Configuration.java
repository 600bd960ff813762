package fts.calibration.input;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file holding the default calibration parameters used when they are not given on
 * the command line (discriminator, minimum line amplitude, discard limit, spectrum point spacing),
 * the settings of the least-squares solver, and the size of the residual plot in reports.
 *
 * The configuration is read from line-calibrator-config.xml in the working directory if present,
 * and otherwise from the copy embedded in the jar. If neither can be read, built-in defaults
 * (which match the embedded file) are used.
 */
public class Configuration {

  private static Configuration instance;

  static final String DEFAULT_CONFIG_PATH = "line-calibrator-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = "";

  private double discriminator = 0.1; // cm^-1
  private double peakThreshold = 50.; // equivalent to S/N if the spectrum is normalised
  private double discardLimit = 2.0; // times the residual std dev
  private double pointSpacing = 0.03; // cm^-1

  private double solverTolerance = 1.0E-12;
  private int solverMaxIterations = 500;

  private int plotWidth = 1280;
  private int plotHeight = 640;

  private Configuration(URL configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      discriminator = config.getDouble("Defaults.Discriminator", discriminator);
      peakThreshold = config.getDouble("Defaults.PeakThreshold", peakThreshold);
      discardLimit = config.getDouble("Defaults.DiscardLimit", discardLimit);
      pointSpacing = config.getDouble("Defaults.PointSpacing", pointSpacing);

      solverTolerance = config.getDouble("Solver.Tolerance", solverTolerance);
      solverMaxIterations = config.getInt("Solver.MaxIterations", solverMaxIterations);

      plotWidth = config.getInt("Report.PlotWidth", plotWidth);
      plotHeight = config.getInt("Report.PlotHeight", plotHeight);

      loadedConfigPath = configLocation.toString();
      logger.info("Succesfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   *
   * @return the current configuration instance
   */
  public static Configuration getInstance() {
    if (instance == null) {
      File local = new File(DEFAULT_CONFIG_PATH);
      URL location = null;
      if (local.isFile()) {
        try {
          location = local.getCanonicalFile().toURI().toURL();
        } catch (IOException e) {
          logger.warn("Could not read local config file " + local.getPath()
              + ", will use the embedded one.", e);
        }
      }
      if (location == null) {
        location = Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
      }
      if (location == null) {
        logger.error("Major error: config XML file not part of resources!!");
        instance = new Configuration();
      } else {
        instance = new Configuration(location);
      }
    }
    return instance;
  }

  /**
   * Replace the current configuration with one loaded from the given file
   *
   * @param configFile XML configuration file to read
   * @return the new configuration instance
   * @throws IOException If the file path cannot be resolved
   */
  public static Configuration loadFrom(File configFile) throws IOException {
    instance = new Configuration(configFile.getCanonicalFile().toURI().toURL());
    return instance;
  }

  /**
   * Forget the current configuration so that the next {@link #getInstance()} reloads it
   */
  static void reset() {
    instance = null;
  }

  /**
   * Built-in defaults only; used when no configuration file can be found at all
   */
  private Configuration() {
  }

  public double getDiscriminator() {
    return discriminator;
  }

  public double getPeakThreshold() {
    return peakThreshold;
  }

  public double getDiscardLimit() {
    return discardLimit;
  }

  public double getPointSpacing() {
    return pointSpacing;
  }

  public double getSolverTolerance() {
    return solverTolerance;
  }

  public int getSolverMaxIterations() {
    return solverMaxIterations;
  }

  public int getPlotWidth() {
    return plotWidth;
  }

  public int getPlotHeight() {
    return plotHeight;
  }

  /**
   * @return Location the configuration was read from, or an empty string if defaults are in use
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }
}
