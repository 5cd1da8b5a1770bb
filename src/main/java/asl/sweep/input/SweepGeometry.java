package asl.sweep.input;

import asl.sweep.processing.SweepProcessingException;
import asl.sweep.processing.SweepProcessingException.ErrorType;

/**
 * How the raw intensity data is divided into sweeps: the number of sweeps recorded, whether the
 * first of them runs up in frequency, and the number of samples each sweep takes.
 */
public class SweepGeometry {

  private final int sweepCount;
  private final boolean sweepUp;
  private final int pointsPerSweep;

  /**
   * Divide a run of samples into the given number of sweeps. The run must consist of complete
   * sweeps only.
   *
   * @param totalSamples Number of samples (rows) in the raw intensity data
   * @param sweepCount Number of sweeps the data covers
   * @param sweepUp True if the first sweep goes from low to high frequency
   * @return Geometry of the data
   */
  public static SweepGeometry forSamples(int totalSamples, int sweepCount, boolean sweepUp) {
    if (sweepCount <= 0) {
      throw new SweepProcessingException(ErrorType.INVALID_SWEEP_COUNT, sweepCount);
    }
    if (totalSamples % sweepCount != 0) {
      throw new SweepProcessingException(ErrorType.INCOMPLETE_SWEEPS, totalSamples, sweepCount);
    }
    return new SweepGeometry(sweepCount, sweepUp, totalSamples / sweepCount);
  }

  public SweepGeometry(int sweepCount, boolean sweepUp, int pointsPerSweep) {
    if (sweepCount <= 0) {
      throw new SweepProcessingException(ErrorType.INVALID_SWEEP_COUNT, sweepCount);
    }
    this.sweepCount = sweepCount;
    this.sweepUp = sweepUp;
    this.pointsPerSweep = pointsPerSweep;
  }

  public int getSweepCount() {
    return sweepCount;
  }

  /**
   * Direction of the first sweep in the data
   *
   * @return true if the first sweep increases in frequency
   */
  public boolean isSweepUp() {
    return sweepUp;
  }

  public int getPointsPerSweep() {
    return pointsPerSweep;
  }

  @Override
  public String toString() {
    return sweepCount + " sweeps of " + pointsPerSweep + " points, first sweep "
        + (sweepUp ? "up" : "down");
  }
}
