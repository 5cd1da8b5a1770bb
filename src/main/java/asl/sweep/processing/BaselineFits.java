package asl.sweep.processing;

import asl.sweep.input.Configuration;
import asl.sweep.utils.NumericUtils;
import asl.sweep.utils.PenalizedSpline;
import java.util.Arrays;

/**
 * The two baseline removal strategies shared by per-sweep and wideband correction: subtraction of
 * a least-squares polynomial, and subtraction of a smoothing spline fit only to the part of the
 * data that isn't a dominant peak.
 */
public class BaselineFits {

  /**
   * Degree of the smoothing spline used for adaptive baseline removal
   */
  public static final int SPLINE_DEGREE = 5;

  /**
   * Subtract the best-fit polynomial (over the normalized sample index) from the data.
   *
   * @param y Data to correct
   * @param degree Degree of polynomial
   * @return Data with polynomial baseline removed
   */
  public static double[] removePolynomial(double[] y, int degree) {
    double[] fit = NumericUtils.polynomialFit(y, degree);
    double[] out = new double[y.length];
    for (int i = 0; i < y.length; ++i) {
      out[i] = y[i] - fit[i];
    }
    return out;
  }

  /**
   * Get the spline fit weights for the data. The data is rescaled onto [0, 1]; if its median is
   * above the upper threshold, most of the data sits near the top and anything below the
   * threshold is a downward peak, so it gets weight 0. The lower threshold works the same way for
   * an upward peak. Data with no dominant peak, flat data included, is weighted evenly.
   *
   * @param y Data to be fit
   * @param upperThreshold Cutoff used when the bulk of the data sits near its maximum
   * @param lowerThreshold Cutoff used when the bulk of the data sits near its minimum
   * @return Weight of each sample, either 0 or 1
   */
  public static double[] splineWeights(double[] y, double upperThreshold, double lowerThreshold) {
    double[] weights = new double[y.length];
    Arrays.fill(weights, 1.);
    double[] scaled = NumericUtils.rescale(y);
    boolean flat = true;
    for (double value : scaled) {
      if (value != 0.) {
        flat = false;
        break;
      }
    }
    if (flat) {
      return weights;
    }
    double median = NumericUtils.median(scaled);
    if (median > upperThreshold) {
      for (int i = 0; i < y.length; ++i) {
        if (scaled[i] < upperThreshold) {
          weights[i] = 0.;
        }
      }
    } else if (median < lowerThreshold) {
      for (int i = 0; i < y.length; ++i) {
        if (scaled[i] > lowerThreshold) {
          weights[i] = 0.;
        }
      }
    }
    return weights;
  }

  /**
   * Subtract an adaptive spline baseline from the data. A smoothing spline is fit with the weights
   * from {@link #splineWeights(double[], double, double)} and subtracted; any straight-line tilt
   * left over in the weighted samples is then removed as well.
   *
   * @param y Data to correct
   * @param config Spline smoothing, knot spacing and weighting thresholds
   * @return Data with spline baseline removed
   */
  public static double[] removeSpline(double[] y, Configuration config) {
    double[] weights = splineWeights(y,
        config.getSplineUpperThreshold(), config.getSplineLowerThreshold());
    PenalizedSpline spline = new PenalizedSpline(SPLINE_DEGREE,
        config.getSplineSmoothing(), config.getSplinePointsPerKnot());
    double[] fit = spline.fit(y, weights);

    double[] residual = new double[y.length];
    for (int i = 0; i < y.length; ++i) {
      residual[i] = y[i] - fit[i];
    }
    double[] tilt = NumericUtils.weightedLinearTrend(residual, weights);
    for (int i = 0; i < y.length; ++i) {
      residual[i] -= tilt[i];
    }
    return residual;
  }
}
