package asl.sweep.processing;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import asl.sweep.processing.SweepProcessingException.ErrorType;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;

public class DifferentiatorTest {

  @Test
  public void differentiate_midpointsAndDifferences() {
    double[] freq = {0., 1., 3., 6.};
    double[] inten = {1., 4., 9., 16.};
    Pair<double[], double[]> out = Differentiator.differentiate(freq, inten);
    assertArrayEquals(new double[]{0.5, 2., 4.5}, out.getFirst(), 1E-12);
    assertArrayEquals(new double[]{3., 5., 7.}, out.getSecond(), 1E-12);
  }

  @Test
  public void differentiate_twoPoints() {
    Pair<double[], double[]> out =
        Differentiator.differentiate(new double[]{2., 4.}, new double[]{10., 7.});
    assertArrayEquals(new double[]{3.}, out.getFirst(), 0.);
    assertArrayEquals(new double[]{-3.}, out.getSecond(), 0.);
  }

  @Test
  public void differentiate_singlePoint_throws() {
    try {
      Differentiator.differentiate(new double[]{1.}, new double[]{1.});
      fail();
    } catch (SweepProcessingException e) {
      assertEquals(ErrorType.TOO_SHORT, e.getType());
    }
  }

  @Test(expected = SweepProcessingException.class)
  public void differentiate_lengthMismatch_throws() {
    Differentiator.differentiate(new double[3], new double[4]);
  }
}
