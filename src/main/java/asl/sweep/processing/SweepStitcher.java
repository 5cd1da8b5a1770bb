package asl.sweep.processing;

import asl.sweep.input.SweepMatrix;
import java.util.Arrays;
import java.util.Comparator;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;

/**
 * Joins the sweeps of each band into a single spectrum ordered by frequency. Because the
 * detector baseline drifts between passes, neighboring bands usually don't meet at the same
 * intensity; the continuity correction ("glue") offsets each band so that it starts where the
 * previous one ended, leaving the shape within each band alone.
 */
public class SweepStitcher {

  private static final Logger logger = Logger.getLogger(SweepStitcher.class);

  /**
   * Put frequency and intensity in increasing-frequency order: if the sweeps go down in frequency
   * both are flipped along the sample axis, and bands are put in order of frequency.
   *
   * @param frequency Frequency axis, one column per band
   * @param intensity Intensity of the same shape
   * @return Reordered frequency and intensity, in that order
   */
  public static Pair<SweepMatrix, SweepMatrix> orient(SweepMatrix frequency,
      SweepMatrix intensity) {
    frequency.requireSameShape(intensity, "Frequency", "Intensity");
    int last = frequency.getRows() - 1;
    if (frequency.get(0, 0) > frequency.get(last, 0)) {
      frequency = frequency.reverseRows();
      intensity = intensity.reverseRows();
    }

    final SweepMatrix freq = frequency;
    Integer[] order = new Integer[freq.getBands()];
    for (int i = 0; i < order.length; ++i) {
      order[i] = i;
    }
    Arrays.sort(order, Comparator.comparingDouble(band -> freq.get(0, band)));

    boolean inOrder = true;
    for (int i = 0; i < order.length; ++i) {
      inOrder &= (order[i] == i);
    }
    if (inOrder) {
      return new Pair<>(frequency, intensity);
    }
    logger.debug("Reordering bands by frequency: " + Arrays.toString(order));
    double[][] freqColumns = new double[order.length][];
    double[][] intenColumns = new double[order.length][];
    for (int i = 0; i < order.length; ++i) {
      freqColumns[i] = frequency.getColumn(order[i]);
      intenColumns[i] = intensity.getColumn(order[i]);
    }
    return new Pair<>(SweepMatrix.ofComputed(freqColumns), SweepMatrix.ofComputed(intenColumns));
  }

  /**
   * Shift each column so that its first sample equals the last sample of the column before it.
   * The shift for column c is the accumulated sum of the jumps at every boundary up to c; the
   * first column is not moved.
   *
   * @param intensity Intensity, one column per band, in frequency order
   * @return Continuous intensity of the same shape
   */
  public static SweepMatrix glue(SweepMatrix intensity) {
    double[][] columns = intensity.getColumns();
    int last = intensity.getRows() - 1;
    double accumulated = 0.;
    for (int band = 1; band < columns.length; ++band) {
      // jump is measured on the original data; earlier shifts are carried in the running sum
      accumulated += intensity.get(last, band - 1) - intensity.get(0, band);
      for (int i = 0; i < columns[band].length; ++i) {
        columns[band][i] += accumulated;
      }
    }
    return SweepMatrix.ofComputed(columns);
  }

  /**
   * Flatten sweep data into a single frequency-ordered waveform. Single-band data is one
   * continuous sweep already and is only put in increasing-frequency order; multi-band data is
   * ordered, optionally glued, and then laid out band after band.
   *
   * @param frequency Frequency axis, one column per band
   * @param intensity Intensity of the same shape
   * @param continuityCorrection True if jumps between bands should be removed
   * @return Flattened frequency and intensity, in that order
   */
  public static Pair<double[], double[]> stitch(SweepMatrix frequency, SweepMatrix intensity,
      boolean continuityCorrection) {
    Pair<SweepMatrix, SweepMatrix> oriented = orient(frequency, intensity);
    SweepMatrix freq = oriented.getFirst();
    SweepMatrix inten = oriented.getSecond();
    if (freq.isSingleBand()) {
      return new Pair<>(freq.getColumn(0), inten.getColumn(0));
    }
    if (continuityCorrection) {
      inten = glue(inten);
    }
    return new Pair<>(freq.flatten(), inten.flatten());
  }

}
