package asl.sweep.processing;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import asl.sweep.input.SweepMatrix;
import asl.sweep.processing.SweepProcessingException.ErrorType;
import org.junit.Test;

public class FrequencyReconstructorTest {

  @Test
  public void ramp_spansHalfBandEachSide() {
    double[] ramp = FrequencyReconstructor.ramp(5);
    assertArrayEquals(new double[]{-0.5, -0.25, 0., 0.25, 0.5}, ramp, 1E-15);
  }

  @Test
  public void reconstruct_upSweep() {
    double[] freq = FrequencyReconstructor.reconstruct(100., 5, true, 4.);
    assertArrayEquals(new double[]{98., 99., 100., 101., 102.}, freq, 1E-12);
  }

  @Test
  public void reconstruct_downSweep() {
    double[] freq = FrequencyReconstructor.reconstruct(100., 5, false, 4.);
    assertArrayEquals(new double[]{102., 101., 100., 99., 98.}, freq, 1E-12);
  }

  @Test
  public void reconstruct_multiBand_offsetsEachColumn() {
    SweepMatrix freq =
        FrequencyReconstructor.reconstruct(new double[]{10., 20., 30.}, 3, true, 10.);
    assertEquals(3, freq.getRows());
    assertEquals(3, freq.getBands());
    assertArrayEquals(new double[]{5., 10., 15.}, freq.getColumn(0), 1E-12);
    assertArrayEquals(new double[]{15., 20., 25.}, freq.getColumn(1), 1E-12);
    assertArrayEquals(new double[]{25., 30., 35.}, freq.getColumn(2), 1E-12);
  }

  @Test
  public void reconstruct_tooFewPoints_throws() {
    try {
      FrequencyReconstructor.reconstruct(0., 1, true, 1.);
    } catch (SweepProcessingException e) {
      assertEquals(ErrorType.INVALID_POINTS_PER_SWEEP, e.getType());
      return;
    }
    throw new AssertionError("Expected an exception for a one-point sweep");
  }

  @Test(expected = SweepProcessingException.class)
  public void reconstruct_zeroBandwidth_throws() {
    FrequencyReconstructor.reconstruct(0., 10, true, 0.);
  }
}
