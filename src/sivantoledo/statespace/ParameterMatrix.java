package sivantoledo.statespace;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * An immutable, possibly time-varying, coefficient matrix.
 * 
 * A time-invariant matrix has a single slice. A time-varying matrix has a 
 * stack of slices and a selector tau such that the matrix used in period t 
 * is slice tau[t] (both zero based).
 * 
 * @author Sivan Toledo
 */
public final class ParameterMatrix {
  
  private final double[][][] slices; // [slice][row][column]
  private final int[]        tau;    // null when time invariant
  private final int          rows;
  private final int          columns;
  
  private ParameterMatrix(double[][][] slices, int[] tau, int rows, int columns) {
    this.slices  = slices;
    this.tau     = tau;
    this.rows    = rows;
    this.columns = columns;
  }
  
  /**
   * A time-invariant matrix.
   * 
   * @param A a rectangular array, copied
   * @return the matrix
   */
  public static ParameterMatrix of(double[][] A) {
    int columns = A.length == 0 ? 0 : A[0].length;
    return new ParameterMatrix(new double[][][] { copy(A, columns) }, null, A.length, columns);
  }
  
  /**
   * A time-invariant column vector.
   * 
   * @param v the entries, copied
   * @return a v.length-by-1 matrix
   */
  public static ParameterMatrix column(double[] v) {
    double[][] A = new double[v.length][1];
    for (int i=0; i<v.length; i++) A[i][0] = v[i];
    return new ParameterMatrix(new double[][][] { A }, null, v.length, 1);
  }
  
  /**
   * An empty (rows-by-0) matrix, used for the loadings of absent exogenous series.
   */
  public static ParameterMatrix empty(int rows) {
    return new ParameterMatrix(new double[][][] { new double[rows][0] }, null, rows, 0);
  }
  
  public static ParameterMatrix filled(int rows, int columns, double value) {
    double[][] A = new double[rows][columns];
    for (double[] row: A) Arrays.fill(row, value);
    return new ParameterMatrix(new double[][][] { A }, null, rows, columns);
  }

  /**
   * A time-varying matrix.
   * 
   * @param slices the distinct slices, all of the same shape, copied
   * @param tau    the slice used in each period, copied
   * @return the matrix
   */
  public static ParameterMatrix varying(double[][][] slices, int[] tau) {
    if (slices.length == 0) throw new IllegalArgumentException("a time-varying matrix needs at least one slice");
    int rows    = slices[0].length;
    int columns = rows == 0 ? 0 : slices[0][0].length;
    double[][][] copy = new double[slices.length][][];
    for (int s=0; s<slices.length; s++) {
      if (slices[s].length != rows) throw new DimensionMismatchException(slices[s].length, rows);
      copy[s] = copy(slices[s], columns);
    }
    for (int t=0; t<tau.length; t++) 
      if (tau[t] < 0 || tau[t] >= slices.length) throw new OutOfRangeException(tau[t], 0, slices.length-1);
    return new ParameterMatrix(copy, tau.clone(), rows, columns);
  }
  
  private static double[][] copy(double[][] A, int columns) {
    double[][] B = new double[A.length][];
    for (int i=0; i<A.length; i++) {
      if (A[i].length != columns) throw new DimensionMismatchException(A[i].length, columns);
      B[i] = A[i].clone();
    }
    return B;
  }

  public int rows()    { return rows; }
  public int columns() { return columns; }
  public int slices()  { return slices.length; }
  public int size()    { return slices.length * rows * columns; }
  
  public boolean isTimeVarying() { return tau != null; }

  /**
   * @return the number of periods covered by the selector, or 0 for time-invariant matrices
   */
  public int periods() { return tau == null ? 0 : tau.length; }
  
  public int[] tau() { return tau == null ? null : tau.clone(); }
  
  public double get(int slice, int row, int column) { 
    return slices[slice][row][column]; 
  }

  public double get(int row, int column) { 
    return slices[0][row][column]; 
  }
  
  public double[][] slice(int s) { return copy(slices[s], columns); }

  public double[][][] toArray() {
    double[][][] copy = new double[slices.length][][];
    for (int s=0; s<slices.length; s++) copy[s] = copy(slices[s], columns);
    return copy;
  }
  
  /**
   * The matrix in effect in period t.
   * 
   * @param t period (zero based)
   * @return the slice selected for period t
   */
  public RealMatrix at(int t) {
    int s = tau == null ? 0 : tau[t];
    if (rows == 0 || columns == 0) throw new IllegalStateException("an empty matrix has no RealMatrix representation");
    return MatrixUtils.createRealMatrix(slices[s]);
  }
  
  /**
   * Returns a matrix with the same shape and selector whose entries are 
   * computed from the entries of this one.
   */
  public ParameterMatrix map(DoubleUnaryOperator f) {
    double[][][] mapped = toArray();
    for (double[][] slice: mapped)
      for (double[] row: slice)
        for (int j=0; j<row.length; j++) row[j] = f.applyAsDouble(row[j]);
    return new ParameterMatrix(mapped, tau, rows, columns);
  }
  
  /**
   * Returns a matrix with the same shape and selector as this one but with
   * the given slices.
   */
  public ParameterMatrix withSlices(double[][][] newSlices) {
    if (newSlices.length != slices.length) throw new DimensionMismatchException(newSlices.length, slices.length);
    if (tau == null) {
      ParameterMatrix m = of(newSlices[0]);
      if (m.rows != rows || m.columns != columns) throw new DimensionMismatchException(m.rows*m.columns, rows*columns);
      return m;
    }
    ParameterMatrix m = varying(newSlices, tau);
    if (m.rows != rows || m.columns != columns) throw new DimensionMismatchException(m.rows*m.columns, rows*columns);
    return m;
  }
  
  /**
   * @return true if other has the same shape, number of slices and selector
   */
  public boolean conformsTo(ParameterMatrix other) {
    return other != null
        && rows == other.rows 
        && columns == other.columns 
        && slices.length == other.slices.length 
        && Arrays.equals(tau, other.tau);
  }
  
  public boolean isSymmetric() {
    if (rows != columns) return false;
    for (double[][] slice: slices)
      for (int i=0; i<rows; i++)
        for (int j=0; j<i; j++)
          if (Double.compare(slice[i][j], slice[j][i]) != 0) return false;
    return true;
  }
  
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ParameterMatrix)) return false;
    ParameterMatrix other = (ParameterMatrix) o;
    return conformsTo(other) && Arrays.deepEquals(slices, other.slices);
  }
  
  @Override
  public int hashCode() { 
    return 31 * Arrays.deepHashCode(slices) + Arrays.hashCode(tau); 
  }

  @Override
  public String toString() {
    StringBuilder s = new StringBuilder();
    for (int k=0; k<slices.length; k++) s.append(Matrix.toString(slices[k], "%.3e "));
    if (tau != null) s.append(" tau=").append(Arrays.toString(tau));
    return s.toString();
  }
}
