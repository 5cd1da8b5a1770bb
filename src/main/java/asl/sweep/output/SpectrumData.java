package asl.sweep.output;

import asl.sweep.input.SweepGeometry;
import java.util.Arrays;

/**
 * Final reconstructed spectrum: the frequency axis and intensity at each frequency, along with
 * the number of bands stitched together and the sweep geometry of the record it came from.
 */
public class SpectrumData {

  private final double[] frequency;
  private final double[] intensity;
  private final int bandCount;
  private final SweepGeometry geometry;

  public SpectrumData(double[] frequency, double[] intensity, int bandCount,
      SweepGeometry geometry) {
    if (frequency.length != intensity.length) {
      throw new IllegalArgumentException("Frequency and intensity lengths differ: "
          + frequency.length + " vs. " + intensity.length);
    }
    this.frequency = frequency.clone();
    this.intensity = intensity.clone();
    this.bandCount = bandCount;
    this.geometry = geometry;
  }

  public double[] getFrequency() {
    return frequency.clone();
  }

  public double[] getIntensity() {
    return intensity.clone();
  }

  public int size() {
    return frequency.length;
  }

  public int getBandCount() {
    return bandCount;
  }

  public SweepGeometry getGeometry() {
    return geometry;
  }

  /**
   * Lowest frequency in the spectrum, or NaN if the spectrum is empty
   */
  public double getMinFrequency() {
    return Arrays.stream(frequency).min().orElse(Double.NaN);
  }

  /**
   * Highest frequency in the spectrum, or NaN if the spectrum is empty
   */
  public double getMaxFrequency() {
    return Arrays.stream(frequency).max().orElse(Double.NaN);
  }

  @Override
  public String toString() {
    return "SpectrumData[points=" + size() + ", bands=" + bandCount + ", geometry=" + geometry
        + "]";
  }
}
