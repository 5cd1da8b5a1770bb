package asl.sweep.processing;

import asl.sweep.input.SweepMatrix;
import asl.sweep.processing.SweepProcessingException.ErrorType;
import org.apache.commons.math3.util.Pair;

/**
 * Compensates for the detector answering a fixed number of samples after the stimulus. The first
 * samples of the intensity belong to no stimulus point (detector dead time), so the intensity is
 * shifted back by the delay and the trailing samples that no longer have a partner are dropped
 * from both frequency and intensity.
 */
public class DelayCorrector {

  /**
   * Cyclically shift data back by the delay, so that the first delay samples of each band end up
   * at the end. A delay of 0 gives the data back unchanged.
   *
   * @param data Data to shift
   * @param delay Number of samples to shift by, non-negative and less than the data length
   * @return Shifted data
   */
  public static SweepMatrix roll(SweepMatrix data, int delay) {
    checkDelay(delay, data.getRows());
    if (delay == 0) {
      return data;
    }
    int rows = data.getRows();
    double[][] columns = data.getColumns();
    double[][] shifted = new double[columns.length][rows];
    for (int band = 0; band < columns.length; ++band) {
      System.arraycopy(columns[band], delay, shifted[band], 0, rows - delay);
      System.arraycopy(columns[band], 0, shifted[band], rows - delay, delay);
    }
    return SweepMatrix.ofComputed(shifted);
  }

  /**
   * Drop the last delay samples from both frequency and intensity so the two stay aligned.
   *
   * @param frequency Frequency axis
   * @param intensity Intensity data of the same shape as the frequency axis
   * @param delay Number of samples to drop
   * @return Truncated frequency and intensity, in that order
   */
  public static Pair<SweepMatrix, SweepMatrix> truncate(SweepMatrix frequency,
      SweepMatrix intensity, int delay) {
    frequency.requireSameShape(intensity, "Frequency", "Intensity");
    checkDelay(delay, frequency.getRows());
    if (delay == 0) {
      return new Pair<>(frequency, intensity);
    }
    int keep = frequency.getRows() - delay;
    return new Pair<>(frequency.sliceRows(0, keep), intensity.sliceRows(0, keep));
  }

  /**
   * Drop the first delay samples from both frequency and intensity. This is the counterpart of
   * {@link #truncate(SweepMatrix, SweepMatrix, int)} for when the samples that wrapped around in
   * the roll have been reversed onto the start of the sweep.
   *
   * @param frequency Frequency axis
   * @param intensity Intensity data of the same shape as the frequency axis
   * @param delay Number of samples to drop
   * @return Truncated frequency and intensity, in that order
   */
  public static Pair<SweepMatrix, SweepMatrix> truncateLeading(SweepMatrix frequency,
      SweepMatrix intensity, int delay) {
    frequency.requireSameShape(intensity, "Frequency", "Intensity");
    checkDelay(delay, frequency.getRows());
    if (delay == 0) {
      return new Pair<>(frequency, intensity);
    }
    int rows = frequency.getRows();
    return new Pair<>(frequency.sliceRows(delay, rows), intensity.sliceRows(delay, rows));
  }

  /**
   * Check if the wrapped samples of a rolled record end up at the start of the extracted sweep.
   * The roll moves the dead-time samples of the first sweep onto the end of the last one, so
   * this happens only when the last sweep is the background and runs against the foreground.
   *
   * @param sweepCount Number of sweeps in the record
   * @param foreground 1-based ordinal of the signal sweep
   * @param background 1-based ordinal of the background sweep, or null if sweeps are averaged
   * @return True if the leading samples must be dropped instead of the trailing ones
   */
  public static boolean wrapsToStart(int sweepCount, int foreground, Integer background) {
    return background != null && background == sweepCount
        && SweepExtractor.needsReversal(foreground, background);
  }

  /**
   * Correct a single sweep for detector delay: roll the intensity back by the delay, then drop the
   * last delay samples of frequency and intensity alike.
   *
   * @param frequency Frequency axis of the sweep
   * @param intensity Intensity of the sweep, same shape as the frequency axis
   * @param delay Detector delay in samples, in [0, points per sweep)
   * @return Corrected frequency and intensity, in that order
   */
  public static Pair<SweepMatrix, SweepMatrix> apply(SweepMatrix frequency,
      SweepMatrix intensity, int delay) {
    frequency.requireSameShape(intensity, "Frequency", "Intensity");
    return truncate(frequency, roll(intensity, delay), delay);
  }

  /**
   * Check that a delay fits within a sweep
   *
   * @param delay Detector delay in samples
   * @param pointsPerSweep Samples per sweep
   */
  public static void checkDelay(int delay, int pointsPerSweep) {
    if (delay < 0 || delay >= pointsPerSweep) {
      throw new SweepProcessingException(ErrorType.INVALID_DELAY, pointsPerSweep, delay);
    }
  }
}
