package asl.sweep.processing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import asl.sweep.processing.SweepProcessingException.Category;
import asl.sweep.processing.SweepProcessingException.ErrorType;
import org.junit.Test;

public class SweepProcessingExceptionTest {

  @Test
  public void message_usesTemplate() {
    SweepProcessingException e =
        new SweepProcessingException(ErrorType.INVALID_ORDINAL, "Foreground", 9, 4);
    assertEquals("Foreground sweep ordinal 9 is outside of the range [1, 4]", e.getMessage());
    assertSame(ErrorType.INVALID_ORDINAL, e.getType());
    assertEquals(Category.CONFIGURATION, e.getCategory());
  }

  @Test
  public void categories() {
    assertEquals(Category.SHAPE, ErrorType.INCOMPLETE_SWEEPS.getCategory());
    assertEquals(Category.NUMERICAL, ErrorType.WINDOW_TOO_LARGE.getCategory());
    assertEquals(Category.CONFIGURATION, ErrorType.NO_LO_CROSSINGS.getCategory());
  }
}
