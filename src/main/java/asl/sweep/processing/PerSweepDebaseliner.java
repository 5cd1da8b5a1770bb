package asl.sweep.processing;

import asl.sweep.input.Configuration;
import asl.sweep.input.SweepMatrix;

/**
 * Removes baseline distortion from each band's sweep on its own, before the bands are stitched
 * together. Each column is corrected independently of the others.
 */
public class PerSweepDebaseliner {

  /**
   * Remove a polynomial baseline, and optionally an adaptive spline baseline after it, from each
   * column of the sweep data.
   *
   * @param intensity Sweep intensity, one column per band
   * @param degree Degree of the polynomial fit to each column
   * @param useSpline True if a spline baseline should also be removed
   * @param config Spline fit settings (unused if no spline is fit)
   * @return Corrected intensity, same shape as the input
   */
  public static SweepMatrix debaseline(SweepMatrix intensity, int degree, boolean useSpline,
      Configuration config) {
    double[][] columns = intensity.getColumns();
    for (int band = 0; band < columns.length; ++band) {
      columns[band] = BaselineFits.removePolynomial(columns[band], degree);
      if (useSpline) {
        columns[band] = BaselineFits.removeSpline(columns[band], config);
      }
    }
    return SweepMatrix.ofComputed(columns);
  }

  /**
   * Remove only a polynomial baseline from each column
   *
   * @param intensity Sweep intensity, one column per band
   * @param degree Degree of the polynomial fit to each column
   * @return Corrected intensity, same shape as the input
   */
  public static SweepMatrix removePolynomial(SweepMatrix intensity, int degree) {
    return debaseline(intensity, degree, false, null);
  }

  /**
   * Remove only an adaptive spline baseline from each column
   *
   * @param intensity Sweep intensity, one column per band
   * @param config Spline fit settings
   * @return Corrected intensity, same shape as the input
   */
  public static SweepMatrix removeSpline(SweepMatrix intensity, Configuration config) {
    double[][] columns = intensity.getColumns();
    for (int band = 0; band < columns.length; ++band) {
      columns[band] = BaselineFits.removeSpline(columns[band], config);
    }
    return SweepMatrix.ofComputed(columns);
  }

}
