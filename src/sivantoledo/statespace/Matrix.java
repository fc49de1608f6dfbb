package sivantoledo.statespace;

/**
 * Formatting and comparison helpers for plain arrays.
 */
public class Matrix {
  
  private Matrix() {}

  /**
   * @return the largest absolute entry, NaN if any entry is NaN
   */
  public static double normMax(double[] input) {
    double max = 0;
    for (int i=0; i<input.length; i++) {
      double a = Math.abs(input[i]);
      if (a > max || Double.isNaN(a)) max = a;
    }
    return max;
  }
  
  public static String toString(double[][] A, String format) {
    StringBuilder s = new StringBuilder();
    s.append('[');
    for (int d=0; d<A.length; d++) {
      s.append('[');
      for (int i=0; i<A[d].length; i++) {
        s.append(String.format(format, A[d][i]));
      }
      s.append(']');
    }
    s.append(']');
    return s.toString();
  }

  public static String toString(int[][] A) {
    StringBuilder s = new StringBuilder();
    s.append('[');
    for (int d=0; d<A.length; d++) {
      s.append('[');
      for (int i=0; i<A[d].length; i++) {
        if (i > 0) s.append(' ');
        s.append(A[d][i]);
      }
      s.append(']');
    }
    s.append(']');
    return s.toString();
  }
}
