package asl.sweep.input;

import asl.sweep.processing.SweepProcessingException;
import asl.sweep.processing.SweepProcessingException.ErrorType;
import java.util.Arrays;

/**
 * Immutable matrix of samples, where each row is one sample position in a sweep and each column
 * is one frequency band. Data from a single band is a matrix with one column, so the processing
 * code never has to check whether it was handed a vector or a matrix.
 *
 * Data is kept column by column (that is, column-major), since nearly every operation done on
 * sweep data works along a column.
 */
public class SweepMatrix {

  private final double[][] columns;
  private final int rows;

  private SweepMatrix(double[][] columns, int rows) {
    this.columns = columns;
    this.rows = rows;
  }

  /**
   * Create a single-band matrix from a vector of samples. The input is copied.
   *
   * @param data Samples of a single band
   * @return Matrix with one column holding the given data
   */
  public static SweepMatrix fromVector(double[] data) {
    return new SweepMatrix(new double[][]{data.clone()}, data.length);
  }

  /**
   * Create a matrix from a list of columns. The input is copied.
   *
   * @param columns Columns of data; each must be the same length
   * @return Matrix holding the given columns
   */
  public static SweepMatrix fromColumns(double[]... columns) {
    if (columns.length == 0) {
      throw new SweepProcessingException(ErrorType.EMPTY_DATA, "Column list");
    }
    int rows = columns[0].length;
    double[][] copy = new double[columns.length][];
    for (int i = 0; i < columns.length; ++i) {
      if (columns[i].length != rows) {
        throw new SweepProcessingException(ErrorType.RAGGED_MATRIX, i, columns[i].length, rows);
      }
      copy[i] = columns[i].clone();
    }
    return new SweepMatrix(copy, rows);
  }

  /**
   * Create a matrix from row-ordered data, as it would be read in from a delimited text file
   * where each line is one sample and each field is one band.
   *
   * @param rowData Row-major data; each row must have the same number of entries
   * @return Matrix holding the given data
   */
  public static SweepMatrix fromRows(double[][] rowData) {
    if (rowData.length == 0) {
      throw new SweepProcessingException(ErrorType.EMPTY_DATA, "Row list");
    }
    int bands = rowData[0].length;
    double[][] cols = new double[bands][rowData.length];
    for (int i = 0; i < rowData.length; ++i) {
      if (rowData[i].length != bands) {
        throw new SweepProcessingException(ErrorType.RAGGED_MATRIX, i, rowData[i].length, bands);
      }
      for (int j = 0; j < bands; ++j) {
        cols[j][i] = rowData[i][j];
      }
    }
    return new SweepMatrix(cols, rowData.length);
  }

  private static SweepMatrix wrap(double[][] columns) {
    return new SweepMatrix(columns, columns.length == 0 ? 0 : columns[0].length);
  }

  /**
   * Build a new matrix from freshly computed column data. The arrays are not copied, so callers
   * must not keep references to them.
   *
   * @param columns Computed column data, all the same length
   * @return Matrix over the given data
   */
  public static SweepMatrix ofComputed(double[][] columns) {
    if (columns.length == 0) {
      throw new SweepProcessingException(ErrorType.EMPTY_DATA, "Column list");
    }
    int rows = columns[0].length;
    for (int i = 1; i < columns.length; ++i) {
      if (columns[i].length != rows) {
        throw new SweepProcessingException(ErrorType.RAGGED_MATRIX, i, columns[i].length, rows);
      }
    }
    return wrap(columns);
  }

  public int getRows() {
    return rows;
  }

  /**
   * Get the number of frequency bands (columns)
   *
   * @return Column count
   */
  public int getBands() {
    return columns.length;
  }

  public boolean isSingleBand() {
    return columns.length == 1;
  }

  public double get(int row, int band) {
    return columns[band][row];
  }

  /**
   * Get a copy of a single column
   *
   * @param band Index of the column
   * @return Copy of the column's data
   */
  public double[] getColumn(int band) {
    return columns[band].clone();
  }

  /**
   * Get a copy of all columns as a nested array, indexed [band][row]
   *
   * @return Column-major copy of the data
   */
  public double[][] getColumns() {
    double[][] out = new double[columns.length][];
    for (int i = 0; i < columns.length; ++i) {
      out[i] = columns[i].clone();
    }
    return out;
  }

  /**
   * Get the rows in [from, to) for every band
   *
   * @param from First row to include
   * @param to Row after the last row to include
   * @return New matrix with the given range of rows
   */
  public SweepMatrix sliceRows(int from, int to) {
    double[][] out = new double[columns.length][];
    for (int i = 0; i < columns.length; ++i) {
      out[i] = Arrays.copyOfRange(columns[i], from, to);
    }
    return wrap(out);
  }

  /**
   * Reverse the order of rows in every band, as needed when data was taken in the opposite sweep
   * direction.
   *
   * @return New matrix with reversed rows
   */
  public SweepMatrix reverseRows() {
    double[][] out = new double[columns.length][rows];
    for (int i = 0; i < columns.length; ++i) {
      for (int j = 0; j < rows; ++j) {
        out[i][j] = columns[i][rows - 1 - j];
      }
    }
    return wrap(out);
  }

  /**
   * Flatten into a single vector, column after column
   *
   * @return All data in column-major order
   */
  public double[] flatten() {
    double[] out = new double[rows * columns.length];
    for (int i = 0; i < columns.length; ++i) {
      System.arraycopy(columns[i], 0, out, i * rows, rows);
    }
    return out;
  }

  /**
   * Check that another matrix has the same dimensions as this one.
   *
   * @param other Matrix to compare against
   * @param thisName Name of this matrix, used in the error message
   * @param otherName Name of the other matrix, used in the error message
   */
  public void requireSameShape(SweepMatrix other, String thisName, String otherName) {
    if (other.rows != rows || other.columns.length != columns.length) {
      throw new SweepProcessingException(ErrorType.MISMATCHED_SHAPE,
          thisName, rows, columns.length, otherName, other.rows, other.columns.length);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SweepMatrix)) {
      return false;
    }
    SweepMatrix that = (SweepMatrix) o;
    return rows == that.rows && Arrays.deepEquals(columns, that.columns);
  }

  @Override
  public int hashCode() {
    return 31 * rows + Arrays.deepHashCode(columns);
  }

  @Override
  public String toString() {
    return "SweepMatrix[" + rows + " x " + columns.length + "]";
  }
}
