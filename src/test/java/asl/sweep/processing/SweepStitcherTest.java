package asl.sweep.processing;

import static org.junit.Assert.assertArrayEquals;

import asl.sweep.input.SweepMatrix;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;

public class SweepStitcherTest {

  @Test
  public void glue_firstSampleMeetsPreviousLast() {
    SweepMatrix intensity = SweepMatrix.fromColumns(
        new double[]{0., 1.}, new double[]{5., 6.}, new double[]{2., 3.});
    SweepMatrix glued = SweepStitcher.glue(intensity);
    assertArrayEquals(new double[]{0., 1.}, glued.getColumn(0), 0.);
    assertArrayEquals(new double[]{1., 2.}, glued.getColumn(1), 0.);
    assertArrayEquals(new double[]{2., 3.}, glued.getColumn(2), 0.);
  }

  @Test
  public void stitch_ordersBandsByFrequency() {
    // bands recorded high band first
    SweepMatrix freq = SweepMatrix.fromColumns(
        new double[]{9., 10., 11.}, new double[]{-1., 0., 1.});
    SweepMatrix inten = SweepMatrix.fromColumns(
        new double[]{5., 6., 7.}, new double[]{1., 2., 3.});
    Pair<double[], double[]> out = SweepStitcher.stitch(freq, inten, true);
    assertArrayEquals(new double[]{-1., 0., 1., 9., 10., 11.}, out.getFirst(), 0.);
    assertArrayEquals(new double[]{1., 2., 3., 3., 4., 5.}, out.getSecond(), 0.);
  }

  @Test
  public void stitch_downSweep_flipsToIncreasingFrequency() {
    SweepMatrix freq = SweepMatrix.fromColumns(
        new double[]{1., 0., -1.}, new double[]{11., 10., 9.});
    SweepMatrix inten = SweepMatrix.fromColumns(
        new double[]{3., 2., 1.}, new double[]{7., 6., 5.});
    Pair<double[], double[]> out = SweepStitcher.stitch(freq, inten, true);
    assertArrayEquals(new double[]{-1., 0., 1., 9., 10., 11.}, out.getFirst(), 0.);
    assertArrayEquals(new double[]{1., 2., 3., 3., 4., 5.}, out.getSecond(), 0.);
  }

  @Test
  public void stitch_withoutCorrection_keepsJumps() {
    SweepMatrix freq = SweepMatrix.fromColumns(
        new double[]{-1., 0., 1.}, new double[]{9., 10., 11.});
    SweepMatrix inten = SweepMatrix.fromColumns(
        new double[]{1., 2., 3.}, new double[]{5., 6., 7.});
    Pair<double[], double[]> out = SweepStitcher.stitch(freq, inten, false);
    assertArrayEquals(new double[]{1., 2., 3., 5., 6., 7.}, out.getSecond(), 0.);
  }

  @Test
  public void stitch_singleBand_onlyOrients() {
    SweepMatrix freq = SweepMatrix.fromVector(new double[]{3., 2., 1.});
    SweepMatrix inten = SweepMatrix.fromVector(new double[]{10., 20., 30.});
    Pair<double[], double[]> out = SweepStitcher.stitch(freq, inten, true);
    assertArrayEquals(new double[]{1., 2., 3.}, out.getFirst(), 0.);
    assertArrayEquals(new double[]{30., 20., 10.}, out.getSecond(), 0.);
  }

  @Test(expected = SweepProcessingException.class)
  public void stitch_mismatchedShapes_throws() {
    SweepStitcher.stitch(SweepMatrix.fromVector(new double[3]),
        SweepMatrix.fromVector(new double[4]), true);
  }
}
