package asl.sweep.test;

import asl.sweep.input.SweepMatrix;

public class TestUtils {

  public static final String TEST_DATA_LOCATION = "src/test/resources/";

  /**
   * Lay sweeps end to end in a single band, as they would come off the detector
   */
  public static SweepMatrix concatenate(double[]... sweeps) {
    int total = 0;
    for (double[] sweep : sweeps) {
      total += sweep.length;
    }
    double[] record = new double[total];
    int offset = 0;
    for (double[] sweep : sweeps) {
      System.arraycopy(sweep, 0, record, offset, sweep.length);
      offset += sweep.length;
    }
    return SweepMatrix.fromVector(record);
  }

  /**
   * start, start + step, ... for the given number of points
   */
  public static double[] ramp(double start, double step, int points) {
    double[] out = new double[points];
    for (int i = 0; i < points; ++i) {
      out[i] = start + i * step;
    }
    return out;
  }

}
