package asl.sweep.input;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class BaselineModeTest {

  @Test
  public void flags() {
    assertFalse(BaselineMode.NONE.removesBaseline());
    assertFalse(BaselineMode.NONE.usesSpline());
    assertTrue(BaselineMode.POLYNOMIAL.removesBaseline());
    assertFalse(BaselineMode.POLYNOMIAL.usesSpline());
    assertTrue(BaselineMode.POLYNOMIAL_AND_SPLINE.removesBaseline());
    assertTrue(BaselineMode.POLYNOMIAL_AND_SPLINE.usesSpline());
  }
}
