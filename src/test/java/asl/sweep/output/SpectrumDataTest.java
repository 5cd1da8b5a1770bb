package asl.sweep.output;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import asl.sweep.input.SweepGeometry;
import org.junit.Test;

public class SpectrumDataTest {

  @Test
  public void frequencyRange() {
    SpectrumData data = new SpectrumData(new double[]{3., -1., 7.}, new double[]{0., 1., 2.}, 1,
        new SweepGeometry(2, true, 3));
    assertEquals(3, data.size());
    assertEquals(-1., data.getMinFrequency(), 0.);
    assertEquals(7., data.getMaxFrequency(), 0.);
    assertEquals(2, data.getGeometry().getSweepCount());
  }

  @Test
  public void copiesArrays() {
    double[] freq = {1., 2.};
    SpectrumData data = new SpectrumData(freq, new double[]{5., 6.}, 1, null);
    freq[0] = 100.;
    data.getIntensity()[0] = 100.;
    assertArrayEquals(new double[]{1., 2.}, data.getFrequency(), 0.);
    assertArrayEquals(new double[]{5., 6.}, data.getIntensity(), 0.);
  }

  @Test
  public void emptySpectrum_rangeIsNaN() {
    SpectrumData data = new SpectrumData(new double[0], new double[0], 1, null);
    assertTrue(Double.isNaN(data.getMinFrequency()));
  }

  @Test(expected = IllegalArgumentException.class)
  public void mismatchedLengths_throws() {
    new SpectrumData(new double[2], new double[3], 1, null);
  }
}
