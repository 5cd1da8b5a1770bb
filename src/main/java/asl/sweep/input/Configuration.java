package asl.sweep.input;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file holding the defaults used when processing sweep data. These include the
 * sweep bandwidth to assume when none is given, the degree of the per-sweep polynomial baseline,
 * which baseline corrections to run by default, the prefix used to name output data,
 * and the tuning values of the adaptive spline baseline fit.
 */
public class Configuration {

  private static Configuration instance;

  private static final String DEFAULT_CONFIG_PATH = "sweep-pulse-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private double defaultBandwidth = 1.0;
  private int polynomialDegree = 1;
  private BaselineMode baselineMode = BaselineMode.POLYNOMIAL;
  private String outputPrefix = "SPlot_";

  private double splineUpperThreshold = 0.9;
  private double splineLowerThreshold = 0.1;
  private double splineSmoothing = 10.;
  private int splinePointsPerKnot = 8;

  private Configuration() {
    // built-in defaults only
  }

  private Configuration(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      defaultBandwidth = config.getDouble("Defaults.Bandwidth", defaultBandwidth);
      polynomialDegree = config.getInt("Defaults.PolynomialDegree", polynomialDegree);
      String modeParam = config.getString("Defaults.BaselineMode");
      if (modeParam != null) {
        try {
          baselineMode = BaselineMode.valueOf(modeParam.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
          logger.warn("Unknown baseline mode " + modeParam + ", using " + baselineMode);
        }
      }
      String prefixParam = config.getString("Defaults.OutputPrefix");
      if (prefixParam != null) {
        outputPrefix = prefixParam;
      }

      splineUpperThreshold = config.getDouble("Spline.UpperThreshold", splineUpperThreshold);
      splineLowerThreshold = config.getDouble("Spline.LowerThreshold", splineLowerThreshold);
      splineSmoothing = config.getDouble("Spline.Smoothing", splineSmoothing);
      splinePointsPerKnot = config.getInt("Spline.PointsPerKnot", splinePointsPerKnot);

      try {
        loadedConfigPath = config.getFile().getCanonicalPath();
        logger.info("Succesfully loaded in configuration: " + loadedConfigPath);
      } catch (IOException e) {
        logger.warn("Could not resolve path of loaded configuration", e);
      }
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  private static boolean copyEmbedXML(String pathToPlaceFile) {
    File fileOut = new File(pathToPlaceFile);
    try (InputStream stream =
        Configuration.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_PATH)) {
      if (stream == null) {
        logger.error("Major error: config XML file not part of resources!!");
        return false;
      }
      logger.info("Copying over embedded jar file to absolute path " + fileOut.getAbsolutePath());
      Files.copy(stream, fileOut.toPath());
      return true;
    } catch (IOException e) {
      logger.warn("Could not copy over the file...", e);
    }
    return false;
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists.
   * @param configLocation New configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      File config = new File(configLocation);
      if (!config.exists()) {
        boolean success = copyEmbedXML(configLocation);
        if (!success) {
          logger.warn("Could not find or write to specified config location: " + configLocation);
          logger.warn("Will attempt to initialize config file at user home directory.");
          configLocation = System.getProperty("user.home") + File.separator + DEFAULT_CONFIG_PATH;
          config = new File(configLocation);
          if (!config.exists()) {
            success = copyEmbedXML(configLocation);
            if (!success) {
              logger.warn("Could not find or write to user home directory either!");
            }
          }
        }
      }
      instance = new Configuration(configLocation);
    }
    return instance;
  }

  /**
   * Read a configuration from the given file without touching the shared instance. Missing keys
   * (or a missing file) leave the built-in defaults in place.
   * @param configLocation Configuration file to read
   * @return New configuration object
   */
  public static Configuration load(String configLocation) {
    return new Configuration(configLocation);
  }

  /**
   * Get a configuration with the built-in defaults and no backing file.
   * @return New configuration object
   */
  public static Configuration defaults() {
    return new Configuration();
  }

  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Gets the full sweep bandwidth used when none is given and it can't be derived from a list of
   * center frequencies. Defaults to 1.0.
   *
   * The property is defined from Configuration.Defaults.Bandwidth
   * @return Default bandwidth (in the same units as the center frequency, usually MHz)
   */
  public double getDefaultBandwidth() {
    return defaultBandwidth;
  }

  /**
   * Gets the degree of the polynomial fit to each sweep for baseline removal. Defaults to 1.
   *
   * The property is defined from Configuration.Defaults.PolynomialDegree
   * @return Polynomial degree
   */
  public int getPolynomialDegree() {
    return polynomialDegree;
  }

  /**
   * Gets which baseline corrections are run when none are requested.
   *
   * The property is defined from Configuration.Defaults.BaselineMode
   * @return Default baseline mode
   */
  public BaselineMode getBaselineMode() {
    return baselineMode;
  }

  /**
   * Gets the prefix added to an input name to get the default output name. Defaults to "SPlot_".
   *
   * The property is defined from Configuration.Defaults.OutputPrefix
   * @return Output name prefix
   */
  public String getOutputPrefix() {
    return outputPrefix;
  }

  /**
   * Rescaled-value cutoff above which the data is considered to sit on a flat top, with a
   * downward peak to be excluded from the spline fit. Defaults to 0.9.
   *
   * The property is defined from Configuration.Spline.UpperThreshold
   * @return Upper weighting threshold
   */
  public double getSplineUpperThreshold() {
    return splineUpperThreshold;
  }

  /**
   * Rescaled-value cutoff below which the data is considered to sit on a flat bottom, with an
   * upward peak to be excluded from the spline fit. Defaults to 0.1.
   *
   * The property is defined from Configuration.Spline.LowerThreshold
   * @return Lower weighting threshold
   */
  public double getSplineLowerThreshold() {
    return splineLowerThreshold;
  }

  /**
   * Weight of the roughness penalty in the spline fit; larger values give a stiffer baseline.
   *
   * The property is defined from Configuration.Spline.Smoothing
   * @return Spline smoothing weight
   */
  public double getSplineSmoothing() {
    return splineSmoothing;
  }

  /**
   * Number of samples between spline knots.
   *
   * The property is defined from Configuration.Spline.PointsPerKnot
   * @return Samples per knot interval
   */
  public int getSplinePointsPerKnot() {
    return splinePointsPerKnot;
  }

}
