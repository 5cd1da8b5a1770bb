package asl.sweep.processing;

import static asl.sweep.test.TestUtils.ramp;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import asl.sweep.input.SweepMatrix;
import asl.sweep.processing.SweepProcessingException.ErrorType;
import java.util.Arrays;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;

public class DelayCorrectorTest {

  @Test
  public void roll_movesLeadingSamplesToEnd() {
    SweepMatrix data = SweepMatrix.fromVector(ramp(0., 1., 100));
    double[] rolled = DelayCorrector.roll(data, 5).getColumn(0);
    assertEquals(100, rolled.length);
    assertEquals(5., rolled[0], 0.);
    assertEquals(99., rolled[94], 0.);
    assertArrayEquals(new double[]{0., 1., 2., 3., 4.},
        Arrays.copyOfRange(rolled, 95, 100), 0.);
  }

  @Test
  public void roll_zeroDelay_unchanged() {
    SweepMatrix data = SweepMatrix.fromVector(ramp(0., 1., 10));
    assertSame(data, DelayCorrector.roll(data, 0));
  }

  @Test
  public void apply_keepsFrequencyAndIntensityAligned() {
    SweepMatrix freq = SweepMatrix.fromVector(ramp(100., 1., 10));
    SweepMatrix inten = SweepMatrix.fromVector(ramp(0., 1., 10));
    Pair<SweepMatrix, SweepMatrix> corrected = DelayCorrector.apply(freq, inten, 3);
    assertArrayEquals(ramp(100., 1., 7), corrected.getFirst().getColumn(0), 0.);
    assertArrayEquals(ramp(3., 1., 7), corrected.getSecond().getColumn(0), 0.);
  }

  @Test
  public void truncate_multiBand() {
    SweepMatrix freq = SweepMatrix.fromColumns(ramp(0., 1., 4), ramp(10., 1., 4));
    SweepMatrix inten = SweepMatrix.fromColumns(ramp(0., 2., 4), ramp(1., 2., 4));
    Pair<SweepMatrix, SweepMatrix> out = DelayCorrector.truncate(freq, inten, 1);
    assertEquals(3, out.getFirst().getRows());
    assertEquals(2, out.getSecond().getBands());
    assertArrayEquals(new double[]{1., 3., 5.}, out.getSecond().getColumn(1), 0.);
  }

  @Test
  public void truncateLeading_dropsFirstSamples() {
    SweepMatrix freq = SweepMatrix.fromVector(ramp(100., 1., 6));
    SweepMatrix inten = SweepMatrix.fromVector(ramp(0., 1., 6));
    Pair<SweepMatrix, SweepMatrix> out = DelayCorrector.truncateLeading(freq, inten, 2);
    assertArrayEquals(ramp(102., 1., 4), out.getFirst().getColumn(0), 0.);
    assertArrayEquals(ramp(2., 1., 4), out.getSecond().getColumn(0), 0.);
  }

  @Test
  public void wrapsToStart_onlyForReversedLastBackground() {
    assertTrue(DelayCorrector.wrapsToStart(4, 1, 4));
    assertFalse(DelayCorrector.wrapsToStart(4, 2, 4));
    assertFalse(DelayCorrector.wrapsToStart(4, 1, 2));
    assertFalse(DelayCorrector.wrapsToStart(4, 1, null));
    assertTrue(DelayCorrector.wrapsToStart(3, 2, 3));
  }

  @Test
  public void checkDelay_delayCoversSweep_throws() {
    try {
      DelayCorrector.checkDelay(10, 10);
    } catch (SweepProcessingException e) {
      assertEquals(ErrorType.INVALID_DELAY, e.getType());
      return;
    }
    throw new AssertionError("Expected delay of a full sweep to be rejected");
  }

  @Test(expected = SweepProcessingException.class)
  public void truncate_mismatchedShapes_throws() {
    DelayCorrector.truncate(SweepMatrix.fromVector(new double[4]),
        SweepMatrix.fromVector(new double[5]), 1);
  }
}
