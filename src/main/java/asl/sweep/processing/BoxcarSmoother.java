package asl.sweep.processing;

import asl.sweep.input.SweepMatrix;
import asl.sweep.processing.SweepProcessingException.ErrorType;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.util.Pair;

/**
 * Moving-average (boxcar) smoothing. Only points where the whole window fits over the data are
 * kept, so the output is shorter than the input by one less than the window size, and the
 * frequency axis is cropped by half a window at each end to stay aligned with it.
 */
public class BoxcarSmoother {

  /**
   * Turn any integer into a usable boxcar window: the sign is dropped, 0 becomes 1, and even
   * values are bumped up to the next odd value.
   *
   * @param window Requested window
   * @return Odd window size of at least 1
   */
  public static int verifyWindow(int window) {
    int verified = Math.abs(window);
    if (verified == 0) {
      return 1;
    }
    if (verified % 2 == 0) {
      return verified + 1;
    }
    return verified;
  }

  /**
   * Moving average over a window of (verified) odd size. The result has
   * data.length - window + 1 points.
   *
   * @param data Data to smooth
   * @param window Window size, already verified
   * @return Smoothed data
   */
  public static double[] smooth(double[] data, int window) {
    if (window == 1) {
      return data.clone();
    }
    if (window >= data.length) {
      throw new SweepProcessingException(ErrorType.WINDOW_TOO_LARGE, window, data.length);
    }
    DescriptiveStatistics windowStats = new DescriptiveStatistics(window);
    double[] out = new double[data.length - window + 1];
    for (int i = 0; i < data.length; ++i) {
      windowStats.addValue(data[i]);
      if (i >= window - 1) {
        out[i - window + 1] = windowStats.getMean();
      }
    }
    return out;
  }

  /**
   * Smooth a waveform and crop its frequency axis to match.
   *
   * @param frequency Frequency axis
   * @param intensity Intensity, same length as the frequency axis
   * @param window Requested window; verified with {@link #verifyWindow(int)}
   * @return Cropped frequency and smoothed intensity, in that order
   */
  public static Pair<double[], double[]> boxcar(double[] frequency, double[] intensity,
      int window) {
    Pair<SweepMatrix, SweepMatrix> result =
        boxcar(SweepMatrix.fromVector(frequency), SweepMatrix.fromVector(intensity), window);
    return new Pair<>(result.getFirst().getColumn(0), result.getSecond().getColumn(0));
  }

  /**
   * Smooth each band of sweep data on its own and crop the frequency axis to match.
   *
   * @param frequency Frequency axis, one column per band
   * @param intensity Intensity of the same shape
   * @param window Requested window; verified with {@link #verifyWindow(int)}
   * @return Cropped frequency and smoothed intensity, in that order
   */
  public static Pair<SweepMatrix, SweepMatrix> boxcar(SweepMatrix frequency,
      SweepMatrix intensity, int window) {
    frequency.requireSameShape(intensity, "Frequency", "Intensity");
    int verified = verifyWindow(window);
    if (verified == 1) {
      return new Pair<>(frequency, intensity);
    }
    double[][] columns = intensity.getColumns();
    for (int band = 0; band < columns.length; ++band) {
      columns[band] = smooth(columns[band], verified);
    }
    int half = verified / 2;
    SweepMatrix cropped = frequency.sliceRows(half, frequency.getRows() - half);
    return new Pair<>(cropped, SweepMatrix.ofComputed(columns));
  }

}
