package asl.sweep.processing;

import asl.sweep.input.Configuration;

/**
 * Removes the broad curvature still left in a spectrum after each sweep has been corrected and
 * the sweeps have been stitched together.
 */
public class WidebandDebaseliner {

  /**
   * Remove a straight-line baseline from the whole spectrum, then optionally an adaptive spline
   * baseline.
   *
   * @param intensity Stitched intensity
   * @param useSpline True if a spline baseline should also be removed
   * @param config Spline fit settings (unused if no spline is fit)
   * @return Corrected intensity
   */
  public static double[] debaseline(double[] intensity, boolean useSpline, Configuration config) {
    double[] corrected = BaselineFits.removePolynomial(intensity, 1);
    if (useSpline) {
      corrected = BaselineFits.removeSpline(corrected, config);
    }
    return corrected;
  }

}
