package asl.sweep.processing;

import asl.sweep.input.SweepMatrix;
import asl.sweep.processing.SweepProcessingException.ErrorType;

/**
 * Builds the frequency axis of a linear sweep. Each sweep covers one full bandwidth centered on
 * its band's center frequency, with samples evenly spaced from one band edge to the other.
 */
public class FrequencyReconstructor {

  /**
   * Get the normalized sweep ramp, going from -0.5 to 0.5 in evenly-spaced steps:
   * r[i] = i / (n - 1) - 0.5
   *
   * @param pointsPerSweep Number of samples in a sweep, at least 2
   * @return Normalized ramp
   */
  public static double[] ramp(int pointsPerSweep) {
    if (pointsPerSweep < 2) {
      throw new SweepProcessingException(ErrorType.INVALID_POINTS_PER_SWEEP, pointsPerSweep);
    }
    double[] ramp = new double[pointsPerSweep];
    for (int i = 0; i < pointsPerSweep; ++i) {
      ramp[i] = (double) i / (pointsPerSweep - 1) - 0.5;
    }
    return ramp;
  }

  /**
   * Get the frequency of each sample in a sweep of a single band.
   *
   * @param centerFrequency Center frequency of the sweep
   * @param pointsPerSweep Number of samples in a sweep, at least 2
   * @param sweepUp True if the sweep starts at the low band edge
   * @param bandwidth Full width of the sweep, must be positive
   * @return Frequency of each sample
   */
  public static double[] reconstruct(double centerFrequency, int pointsPerSweep, boolean sweepUp,
      double bandwidth) {
    return reconstruct(new double[]{centerFrequency}, pointsPerSweep, sweepUp, bandwidth)
        .getColumn(0);
  }

  /**
   * Get the frequency of each sample in a sweep over several bands. All bands are swept in the
   * same direction, each over the same bandwidth, so each column is the same ramp offset by that
   * band's center frequency.
   *
   * @param centerFrequencies Center frequency of each band, in the order the bands were recorded
   * @param pointsPerSweep Number of samples in a sweep, at least 2
   * @param sweepUp True if the sweep starts at the low band edge
   * @param bandwidth Full width of the sweep, must be positive
   * @return Matrix of frequencies, one row per sample and one column per band
   */
  public static SweepMatrix reconstruct(double[] centerFrequencies, int pointsPerSweep,
      boolean sweepUp, double bandwidth) {
    if (!(bandwidth > 0) || Double.isInfinite(bandwidth)) {
      throw new SweepProcessingException(ErrorType.INVALID_BANDWIDTH, bandwidth);
    }
    if (centerFrequencies.length == 0) {
      throw new SweepProcessingException(ErrorType.NO_CENTER_FREQUENCY);
    }
    double[] ramp = ramp(pointsPerSweep);
    double direction = sweepUp ? 1. : -1.;

    double[][] columns = new double[centerFrequencies.length][pointsPerSweep];
    for (int band = 0; band < centerFrequencies.length; ++band) {
      for (int i = 0; i < pointsPerSweep; ++i) {
        columns[band][i] = bandwidth * direction * ramp[i] + centerFrequencies[band];
      }
    }
    return SweepMatrix.ofComputed(columns);
  }

}
