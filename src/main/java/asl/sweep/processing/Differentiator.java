package asl.sweep.processing;

import asl.sweep.processing.SweepProcessingException.ErrorType;
import org.apache.commons.math3.util.Pair;

/**
 * First-difference derivative of a spectrum, which takes out any slowly varying baseline at the
 * cost of turning each line into a dispersion-shaped feature.
 */
public class Differentiator {

  /**
   * Take the difference between each pair of neighboring intensity samples, placed at the
   * frequency halfway between the two samples.
   *
   * @param frequency Frequency axis
   * @param intensity Intensity, same length as the frequency axis
   * @return Midpoint frequencies and intensity differences (each one shorter than the input)
   */
  public static Pair<double[], double[]> differentiate(double[] frequency, double[] intensity) {
    if (frequency.length != intensity.length) {
      throw new SweepProcessingException(ErrorType.MISMATCHED_SHAPE,
          "Frequency", frequency.length, 1, "Intensity", intensity.length, 1);
    }
    if (intensity.length < 2) {
      throw new SweepProcessingException(ErrorType.TOO_SHORT,
          "Derivative", 2, intensity.length);
    }
    double[] midpoints = new double[frequency.length - 1];
    double[] differences = new double[intensity.length - 1];
    for (int i = 0; i < differences.length; ++i) {
      midpoints[i] = frequency[i] + (frequency[i + 1] - frequency[i]) / 2;
      differences[i] = intensity[i + 1] - intensity[i];
    }
    return new Pair<>(midpoints, differences);
  }

}
