package asl.sweep.processing;

import asl.sweep.input.SweepMatrix;
import asl.sweep.processing.SweepProcessingException.ErrorType;

/**
 * Pulls individual sweeps out of the raw intensity record. The record holds every sweep back to
 * back, and the sweep direction alternates from one sweep to the next: sweeps whose ordinals have
 * the same parity run in the same direction, while sweeps of opposite parity run the other way
 * and have to be reversed before they can be compared sample for sample.
 */
public class SweepExtractor {

  /**
   * Get the number of complete sweeps in a record
   *
   * @param intensity Raw intensity record
   * @param pointsPerSweep Number of samples per sweep
   * @return Number of sweeps in the record
   */
  public static int countSweeps(SweepMatrix intensity, int pointsPerSweep) {
    if (pointsPerSweep < 2) {
      throw new SweepProcessingException(ErrorType.INVALID_POINTS_PER_SWEEP, pointsPerSweep);
    }
    if (intensity.getRows() % pointsPerSweep != 0) {
      throw new SweepProcessingException(ErrorType.INCOMPLETE_SWEEP_LENGTH,
          intensity.getRows(), pointsPerSweep);
    }
    return intensity.getRows() / pointsPerSweep;
  }

  /**
   * Get a single sweep out of the record, as it was recorded (not reversed)
   *
   * @param intensity Raw intensity record
   * @param pointsPerSweep Number of samples per sweep
   * @param ordinal 1-based position of the sweep in the record
   * @return That sweep's samples for every band
   */
  public static SweepMatrix getSweep(SweepMatrix intensity, int pointsPerSweep, int ordinal) {
    int sweepCount = countSweeps(intensity, pointsPerSweep);
    checkOrdinal("Requested", ordinal, sweepCount);
    return intensity.sliceRows((ordinal - 1) * pointsPerSweep, ordinal * pointsPerSweep);
  }

  /**
   * Check if a background sweep runs in the opposite direction to the foreground sweep.
   * This is the case when (foreground - background + 1) is even, i.e., the ordinals have
   * different parity.
   *
   * @param foreground 1-based ordinal of the signal sweep
   * @param background 1-based ordinal of the background sweep
   * @return True if the background sweep must be reversed to line up with the foreground
   */
  public static boolean needsReversal(int foreground, int background) {
    return Math.floorMod(foreground - background + 1, 2) == 0;
  }

  /**
   * Get the signal sweep data from a record. How it is produced depends on the background:
   * <ul>
   *   <li>No background: every sweep going the same direction as the foreground is averaged.</li>
   *   <li>Background same as foreground: the foreground sweep is returned as-is.</li>
   *   <li>Otherwise the background sweep, reversed if it goes the other way, is subtracted from
   *   the foreground sweep.</li>
   * </ul>
   *
   * @param intensity Raw intensity record (all sweeps, one column per band)
   * @param pointsPerSweep Number of samples per sweep
   * @param foreground 1-based ordinal of the signal sweep
   * @param background 1-based ordinal of the background sweep, or null to average instead
   * @return Signal data with one sweep's worth of rows and one column per band
   */
  public static SweepMatrix extractOrAverage(SweepMatrix intensity, int pointsPerSweep,
      int foreground, Integer background) {
    int sweepCount = countSweeps(intensity, pointsPerSweep);
    checkOrdinal("Foreground", foreground, sweepCount);
    if (background != null) {
      checkOrdinal("Background", background, sweepCount);
    }

    if (background == null) {
      return averageMatchingSweeps(intensity, pointsPerSweep, foreground, sweepCount);
    }

    SweepMatrix signal = getSweep(intensity, pointsPerSweep, foreground);
    if (background == foreground) {
      return signal;
    }

    SweepMatrix reference = getSweep(intensity, pointsPerSweep, background);
    if (needsReversal(foreground, background)) {
      reference = reference.reverseRows();
    }

    double[][] difference = signal.getColumns();
    for (int band = 0; band < difference.length; ++band) {
      for (int i = 0; i < pointsPerSweep; ++i) {
        difference[band][i] -= reference.get(i, band);
      }
    }
    return SweepMatrix.ofComputed(difference);
  }

  /**
   * Average together every sweep whose ordinal has the same parity as the given one.
   */
  private static SweepMatrix averageMatchingSweeps(SweepMatrix intensity, int pointsPerSweep,
      int foreground, int sweepCount) {
    double[][] sum = new double[intensity.getBands()][pointsPerSweep];
    int selected = 0;
    for (int ordinal = 1; ordinal <= sweepCount; ++ordinal) {
      if ((ordinal % 2) != (foreground % 2)) {
        continue;
      }
      ++selected;
      int offset = (ordinal - 1) * pointsPerSweep;
      for (int band = 0; band < sum.length; ++band) {
        for (int i = 0; i < pointsPerSweep; ++i) {
          sum[band][i] += intensity.get(offset + i, band);
        }
      }
    }
    for (double[] column : sum) {
      for (int i = 0; i < column.length; ++i) {
        column[i] /= selected;
      }
    }
    return SweepMatrix.ofComputed(sum);
  }

  private static void checkOrdinal(String name, int ordinal, int sweepCount) {
    if (ordinal < 1 || ordinal > sweepCount) {
      throw new SweepProcessingException(ErrorType.INVALID_ORDINAL, name, ordinal, sweepCount);
    }
  }

}
