package asl.sweep.utils;

import asl.sweep.processing.SweepProcessingException;
import asl.sweep.processing.SweepProcessingException.ErrorType;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Weighted smoothing spline over evenly spaced samples. The curve is a sum of B-splines of the
 * given degree on uniform knots, fit by weighted least squares with a penalty on the second
 * differences of neighboring coefficients (the P-spline approach of Eilers and Marx).
 *
 * The penalty vanishes for straight lines, so a linear trend in the weighted samples is
 * reproduced exactly, and stretches of zero weight are bridged by the smoothest curve that
 * joins the data on either side.
 */
public class PenalizedSpline {

  private final int degree;
  private final double smoothing;
  private final int pointsPerKnot;

  /**
   * @param degree Degree of the B-spline pieces (5 for a quintic spline)
   * @param smoothing Weight of the roughness penalty; 0 gives a plain least-squares spline
   * @param pointsPerKnot Number of samples per knot interval
   */
  public PenalizedSpline(int degree, double smoothing, int pointsPerKnot) {
    this.degree = degree;
    this.smoothing = smoothing;
    this.pointsPerKnot = Math.max(1, pointsPerKnot);
  }

  /**
   * Fit the spline to data and evaluate it at each sample.
   *
   * @param y Data to fit, taken to be evenly spaced
   * @param weights Per-sample weights, same length as y
   * @return Value of the fit spline at each sample
   */
  public double[] fit(double[] y, double[] weights) {
    int n = y.length;
    if (n < 2) {
      throw new SweepProcessingException(ErrorType.TOO_FEW_POINTS, degree, 2, n);
    }

    int intervals = Math.max(1, (int) Math.round((n - 1) / (double) pointsPerKnot));
    int basisCount = intervals + degree;
    double spacing = 1. / intervals;
    double[] x = NumericUtils.normalizedIndex(n);

    // only degree + 1 basis functions are non-zero at any sample
    int[] firstBasis = new int[n];
    double[][] basis = new double[n][];
    for (int i = 0; i < n; ++i) {
      int interval = Math.min((int) Math.floor(x[i] / spacing), intervals - 1);
      firstBasis[i] = interval;
      basis[i] = basisFunctions(interval, x[i], spacing);
    }

    // normal equations (B'WB + lambda D'D) a = B'Wy
    double[][] lhs = new double[basisCount][basisCount];
    double[] rhs = new double[basisCount];
    for (int i = 0; i < n; ++i) {
      double w = weights[i];
      if (w == 0.) {
        continue;
      }
      for (int j = 0; j <= degree; ++j) {
        int row = firstBasis[i] + j;
        rhs[row] += w * basis[i][j] * y[i];
        for (int k = 0; k <= degree; ++k) {
          lhs[row][firstBasis[i] + k] += w * basis[i][j] * basis[i][k];
        }
      }
    }
    // second-difference penalty; D'D is banded with rows (1, -2, 1)
    double[] diff = {1., -2., 1.};
    for (int d = 0; d + 2 < basisCount; ++d) {
      for (int j = 0; j < 3; ++j) {
        for (int k = 0; k < 3; ++k) {
          lhs[d + j][d + k] += smoothing * diff[j] * diff[k];
        }
      }
    }

    RealVector coefficients;
    try {
      RealMatrix matrix = MatrixUtils.createRealMatrix(lhs);
      DecompositionSolver solver = new LUDecomposition(matrix).getSolver();
      coefficients = solver.solve(MatrixUtils.createRealVector(rhs));
    } catch (SingularMatrixException e) {
      throw new SweepProcessingException(ErrorType.SINGULAR_FIT, n);
    }

    double[] fit = new double[n];
    for (int i = 0; i < n; ++i) {
      double value = 0.;
      for (int j = 0; j <= degree; ++j) {
        value += basis[i][j] * coefficients.getEntry(firstBasis[i] + j);
      }
      fit[i] = value;
    }
    return fit;
  }

  /**
   * Evaluate the degree + 1 B-splines that are non-zero over the given knot interval
   * (Cox-de Boor recursion, as in Piegl and Tiller's BasisFuns). Knots are evenly spaced and
   * extend past both ends of [0, 1]: knot j sits at (j - degree) * spacing.
   *
   * @param interval Index of the knot interval containing x, starting from 0 at x = 0
   * @param x Position to evaluate at
   * @param spacing Distance between knots
   * @return Values of basis functions interval through interval + degree at x
   */
  private double[] basisFunctions(int interval, double x, double spacing) {
    int span = interval + degree;
    double[] values = new double[degree + 1];
    double[] left = new double[degree + 1];
    double[] right = new double[degree + 1];
    values[0] = 1.;
    for (int j = 1; j <= degree; ++j) {
      left[j] = x - knot(span + 1 - j, spacing);
      right[j] = knot(span + j, spacing) - x;
      double saved = 0.;
      for (int r = 0; r < j; ++r) {
        double temp = values[r] / (right[r + 1] + left[j - r]);
        values[r] = saved + right[r + 1] * temp;
        saved = left[j - r] * temp;
      }
      values[j] = saved;
    }
    return values;
  }

  private double knot(int index, double spacing) {
    return (index - degree) * spacing;
  }
}
