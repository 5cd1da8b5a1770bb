package asl.sweep.input;

import asl.sweep.processing.SweepProcessingException;
import asl.sweep.processing.SweepProcessingException.ErrorType;
import java.util.Arrays;

/**
 * Settings for one run of sweep processing, as already parsed from whatever front end collected
 * them. Use {@link Builder} to create; anything not set falls back to the values in the
 * {@link Configuration} given to the builder.
 */
public class SweepParameters {

  private final int foreground;
  private final Integer background;
  private final double[] centerFrequencies;
  private final Double bandwidth;
  private final Integer boxcarWindow;
  private final int delay;
  private final BaselineMode baselineMode;
  private final int polynomialDegree;
  private final boolean differentiate;
  private final String outputName;
  private final Configuration configuration;

  private SweepParameters(Builder builder) {
    foreground = builder.foreground;
    background = builder.background;
    centerFrequencies = builder.centerFrequencies.clone();
    bandwidth = builder.bandwidth;
    boxcarWindow = builder.boxcarWindow;
    delay = builder.delay;
    baselineMode = builder.baselineMode;
    polynomialDegree = builder.polynomialDegree;
    differentiate = builder.differentiate;
    outputName = builder.outputName;
    configuration = builder.configuration;
  }

  public static Builder builder() {
    return new Builder(Configuration.getInstance());
  }

  public static Builder builder(Configuration configuration) {
    return new Builder(configuration);
  }

  /**
   * Get the 1-based ordinal of the sweep used as signal
   * @return Foreground sweep ordinal
   */
  public int getForeground() {
    return foreground;
  }

  /**
   * Get the 1-based ordinal of the sweep used as background, or null if all sweeps matching the
   * foreground's direction should be averaged instead
   * @return Background sweep ordinal, possibly null
   */
  public Integer getBackground() {
    return background;
  }

  public boolean hasBackground() {
    return background != null;
  }

  public double[] getCenterFrequencies() {
    return centerFrequencies.clone();
  }

  public int getBandCount() {
    return centerFrequencies.length;
  }

  /**
   * Get the full sweep bandwidth. If none was given, this is the spacing between the first two
   * center frequencies when several bands were recorded (assuming the bands are evenly spaced and
   * each sweep just covers the gap to the next), and otherwise the configured default.
   * @return Sweep bandwidth
   */
  public double getBandwidth() {
    if (bandwidth != null) {
      return bandwidth;
    }
    if (centerFrequencies.length > 1) {
      double spacing = Math.abs(centerFrequencies[1] - centerFrequencies[0]);
      if (spacing <= 0) {
        throw new SweepProcessingException(ErrorType.INVALID_BANDWIDTH, spacing);
      }
      return spacing;
    }
    return configuration.getDefaultBandwidth();
  }

  /**
   * Get the requested boxcar smoothing window, or null if no smoothing should be done
   * @return Boxcar window, possibly null
   */
  public Integer getBoxcarWindow() {
    return boxcarWindow;
  }

  public int getDelay() {
    return delay;
  }

  public BaselineMode getBaselineMode() {
    return baselineMode;
  }

  public int getPolynomialDegree() {
    return polynomialDegree;
  }

  public boolean isDifferentiate() {
    return differentiate;
  }

  public Configuration getConfiguration() {
    return configuration;
  }

  /**
   * Get the name to give the processed output. If none was set, this is the input's name with
   * the configured prefix in front of it.
   * @param inputName Name of the intensity data that was processed
   * @return Output name
   */
  public String getOutputName(String inputName) {
    if (outputName != null) {
      return outputName;
    }
    return configuration.getOutputPrefix() + inputName;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Foreground sweep: ").append(foreground).append('\n');
    sb.append("Background sweep: ");
    sb.append(hasBackground() ? background.toString() : "none (averaged)").append('\n');
    sb.append("Center frequencies: ").append(Arrays.toString(centerFrequencies)).append('\n');
    sb.append("Baseline: ").append(baselineMode.getName());
    return sb.toString();
  }

  /**
   * Collects run settings; {@link #build()} checks the ones that can be checked without data.
   */
  public static class Builder {

    private final Configuration configuration;
    private int foreground = 1;
    private Integer background;
    private double[] centerFrequencies = {0.};
    private Double bandwidth;
    private Integer boxcarWindow;
    private int delay = 0;
    private BaselineMode baselineMode;
    private int polynomialDegree;
    private boolean differentiate = false;
    private String outputName;

    private Builder(Configuration configuration) {
      this.configuration = configuration;
      baselineMode = configuration.getBaselineMode();
      polynomialDegree = configuration.getPolynomialDegree();
    }

    public Builder foreground(int foreground) {
      this.foreground = foreground;
      return this;
    }

    public Builder background(Integer background) {
      this.background = background;
      return this;
    }

    public Builder centerFrequency(double centerFrequency) {
      this.centerFrequencies = new double[]{centerFrequency};
      return this;
    }

    public Builder centerFrequencies(double[] centerFrequencies) {
      this.centerFrequencies = centerFrequencies.clone();
      return this;
    }

    public Builder bandwidth(Double bandwidth) {
      this.bandwidth = bandwidth;
      return this;
    }

    public Builder boxcarWindow(Integer boxcarWindow) {
      this.boxcarWindow = boxcarWindow;
      return this;
    }

    public Builder delay(int delay) {
      this.delay = delay;
      return this;
    }

    public Builder baselineMode(BaselineMode baselineMode) {
      this.baselineMode = baselineMode;
      return this;
    }

    public Builder polynomialDegree(int polynomialDegree) {
      this.polynomialDegree = polynomialDegree;
      return this;
    }

    public Builder differentiate(boolean differentiate) {
      this.differentiate = differentiate;
      return this;
    }

    public Builder outputName(String outputName) {
      this.outputName = outputName;
      return this;
    }

    public SweepParameters build() {
      if (foreground < 1) {
        throw new SweepProcessingException(ErrorType.NON_POSITIVE_ORDINAL,
            "Foreground", foreground);
      }
      if (background != null && background < 1) {
        throw new SweepProcessingException(ErrorType.NON_POSITIVE_ORDINAL,
            "Background", background);
      }
      if (centerFrequencies.length == 0) {
        throw new SweepProcessingException(ErrorType.NO_CENTER_FREQUENCY);
      }
      if (bandwidth != null && !(bandwidth > 0)) {
        throw new SweepProcessingException(ErrorType.INVALID_BANDWIDTH, bandwidth);
      }
      if (delay < 0) {
        throw new SweepProcessingException(ErrorType.NEGATIVE_DELAY, delay);
      }
      if (polynomialDegree < 0) {
        throw new SweepProcessingException(ErrorType.INVALID_POLYNOMIAL_DEGREE, polynomialDegree);
      }
      return new SweepParameters(this);
    }
  }
}
