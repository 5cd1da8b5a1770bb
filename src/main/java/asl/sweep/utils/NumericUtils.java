package asl.sweep.utils;

import asl.sweep.processing.SweepProcessingException;
import asl.sweep.processing.SweepProcessingException.ErrorType;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Arrays;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Class containing methods to serve as math functions for sweep processing, mainly curve fits
 * over a sweep's samples and simple statistics.
 */
public class NumericUtils {

  /**
   * Get the sample positions of a series scaled onto [0, 1], that is, i / (n - 1).
   * A single sample sits at 0.
   *
   * @param length Number of samples
   * @return Normalized position of each sample
   */
  public static double[] normalizedIndex(int length) {
    double[] x = new double[length];
    if (length < 2) {
      return x;
    }
    for (int i = 0; i < length; ++i) {
      x[i] = (double) i / (length - 1);
    }
    return x;
  }

  /**
   * Least-squares fit of a polynomial to data over its normalized index (see
   * {@link #normalizedIndex(int)}), returning the fitted curve at each sample.
   *
   * @param y Data to fit
   * @param degree Degree of polynomial
   * @return Value of best-fit polynomial at each sample
   */
  public static double[] polynomialFit(double[] y, int degree) {
    if (degree < 0) {
      throw new SweepProcessingException(ErrorType.INVALID_POLYNOMIAL_DEGREE, degree);
    }
    if (y.length < degree + 1) {
      throw new SweepProcessingException(ErrorType.TOO_FEW_POINTS, degree, degree + 1, y.length);
    }
    double[] x = normalizedIndex(y.length);
    WeightedObservedPoints observations = new WeightedObservedPoints();
    for (int i = 0; i < y.length; ++i) {
      observations.add(x[i], y[i]);
    }
    PolynomialCurveFitter fitter = PolynomialCurveFitter.create(degree);
    PolynomialFunction polynomial = new PolynomialFunction(fitter.fit(observations.toList()));
    double[] fit = new double[y.length];
    for (int i = 0; i < y.length; ++i) {
      fit[i] = polynomial.value(x[i]);
    }
    return fit;
  }

  /**
   * Fit a line through the points with non-zero weight only and return that line evaluated over
   * every sample (including the zero-weight ones).
   *
   * @param y Data to fit
   * @param weights Per-sample weights; only whether a weight is zero matters
   * @return Value of the best-fit line at each sample
   */
  public static double[] weightedLinearTrend(double[] y, double[] weights) {
    double[] x = normalizedIndex(y.length);
    SimpleRegression regression = new SimpleRegression();
    Mean level = new Mean();
    for (int i = 0; i < y.length; ++i) {
      if (weights[i] != 0.) {
        regression.addData(x[i], y[i]);
        level.increment(y[i]);
      }
    }
    double[] trend = new double[y.length];
    if (regression.getN() < 2) {
      // one point (or none) only has a level, not a slope
      Arrays.fill(trend, regression.getN() == 0 ? 0. : level.getResult());
      return trend;
    }
    double slope = regression.getSlope();
    double intercept = regression.getIntercept();
    for (int i = 0; i < y.length; ++i) {
      trend[i] = slope * x[i] + intercept;
    }
    return trend;
  }

  /**
   * Scale data linearly so its minimum is 0 and its maximum is 1. Flat data has no range to
   * scale over and comes back as all zeros.
   *
   * @param y Data to rescale
   * @return Rescaled copy of data
   */
  public static double[] rescale(double[] y) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double value : y) {
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
    double[] out = new double[y.length];
    double range = max - min;
    if (!(range > 0)) {
      return out;
    }
    for (int i = 0; i < y.length; ++i) {
      out[i] = (y[i] - min) / range;
    }
    return out;
  }

  /**
   * Get the median of a series (average of the two middle values if the length is even)
   *
   * @param y Data to get the median of
   * @return Median value
   */
  public static double median(double[] y) {
    return new Median().evaluate(y);
  }

  /**
   * Sets decimalformat object so that infinity can be printed in a report
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }
}
