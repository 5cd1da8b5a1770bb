package asl.sweep.input;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import asl.sweep.processing.SweepProcessingException;
import asl.sweep.processing.SweepProcessingException.ErrorType;
import org.junit.Test;

public class SweepMatrixTest {

  @Test
  public void fromVector_isSingleBand() {
    SweepMatrix matrix = SweepMatrix.fromVector(new double[]{1., 2., 3.});
    assertEquals(3, matrix.getRows());
    assertEquals(1, matrix.getBands());
    assertTrue(matrix.isSingleBand());
    assertEquals(2., matrix.get(1, 0), 0.);
  }

  @Test
  public void fromRows_matchesFromColumns() {
    double[][] rows = {{1., 10.}, {2., 20.}, {3., 30.}};
    SweepMatrix byRow = SweepMatrix.fromRows(rows);
    SweepMatrix byColumn = SweepMatrix.fromColumns(new double[]{1., 2., 3.},
        new double[]{10., 20., 30.});
    assertEquals(byColumn, byRow);
    assertEquals(byColumn.hashCode(), byRow.hashCode());
    assertFalse(byRow.isSingleBand());
  }

  @Test
  public void fromVector_copiesInput() {
    double[] data = {1., 2., 3.};
    SweepMatrix matrix = SweepMatrix.fromVector(data);
    data[0] = 100.;
    assertEquals(1., matrix.get(0, 0), 0.);
    matrix.getColumn(0)[1] = 100.;
    assertEquals(2., matrix.get(1, 0), 0.);
  }

  @Test
  public void fromRows_raggedInput_throwsShapeError() {
    double[][] rows = {{1., 2.}, {3.}};
    try {
      SweepMatrix.fromRows(rows);
      fail();
    } catch (SweepProcessingException e) {
      assertEquals(ErrorType.RAGGED_MATRIX, e.getType());
      assertEquals(SweepProcessingException.Category.SHAPE, e.getCategory());
    }
  }

  @Test
  public void flatten_isColumnMajor() {
    SweepMatrix matrix = SweepMatrix.fromColumns(new double[]{1., 2.}, new double[]{3., 4.});
    assertArrayEquals(new double[]{1., 2., 3., 4.}, matrix.flatten(), 0.);
  }

  @Test
  public void reverseRows_reversesEachBand() {
    SweepMatrix matrix = SweepMatrix.fromColumns(new double[]{1., 2., 3.},
        new double[]{4., 5., 6.});
    SweepMatrix reversed = matrix.reverseRows();
    assertArrayEquals(new double[]{3., 2., 1.}, reversed.getColumn(0), 0.);
    assertArrayEquals(new double[]{6., 5., 4.}, reversed.getColumn(1), 0.);
    // original untouched
    assertArrayEquals(new double[]{1., 2., 3.}, matrix.getColumn(0), 0.);
  }

  @Test
  public void sliceRows_keepsRange() {
    SweepMatrix matrix = SweepMatrix.fromVector(new double[]{0., 1., 2., 3., 4.});
    SweepMatrix slice = matrix.sliceRows(1, 4);
    assertEquals(3, slice.getRows());
    assertArrayEquals(new double[]{1., 2., 3.}, slice.getColumn(0), 0.);
  }

  @Test(expected = SweepProcessingException.class)
  public void requireSameShape_differentRows_throws() {
    SweepMatrix a = SweepMatrix.fromVector(new double[]{1., 2.});
    SweepMatrix b = SweepMatrix.fromVector(new double[]{1., 2., 3.});
    a.requireSameShape(b, "A", "B");
  }

}
