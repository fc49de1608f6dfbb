package sivantoledo.statespace.theta;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import sivantoledo.statespace.Matrix;
import sivantoledo.statespace.Parameter;
import sivantoledo.statespace.ParameterMatrix;
import sivantoledo.statespace.StateSpace;

/**
 * Integer indexes with the shape of a state space: one int per coefficient 
 * in every slice of every parameter. Zero marks a fixed coefficient.
 * 
 * Instances handed out by a ThetaMap are never modified; the package-private
 * setters are only used on fresh copies while a map is being built.
 * 
 * @author Sivan Toledo
 */
public final class IndexStateSpace {
  
  private final EnumMap<Parameter, int[][][]> indexes;
  
  public IndexStateSpace(Map<Parameter, int[][][]> indexes) {
    this.indexes = new EnumMap<>(Parameter.class);
    for (Map.Entry<Parameter, int[][][]> e: indexes.entrySet()) this.indexes.put(e.getKey(), copy(e.getValue()));
  }
  
  /**
   * @return all-zero indexes with the shape of every parameter present in system
   */
  public static IndexStateSpace zeros(StateSpace system) {
    EnumMap<Parameter, int[][][]> indexes = new EnumMap<>(Parameter.class);
    for (Map.Entry<Parameter, ParameterMatrix> e: system.parameters().entrySet()) {
      ParameterMatrix matrix = e.getValue();
      indexes.put(e.getKey(), new int[matrix.slices()][matrix.rows()][matrix.columns()]);
    }
    return new IndexStateSpace(indexes);
  }
  
  private static int[][][] copy(int[][][] a) {
    int[][][] b = new int[a.length][][];
    for (int s=0; s<a.length; s++) {
      b[s] = new int[a[s].length][];
      for (int i=0; i<a[s].length; i++) b[s][i] = a[s][i].clone();
    }
    return b;
  }
  
  public IndexStateSpace copy() { return new IndexStateSpace(indexes); }
  
  public boolean has(Parameter param) { return indexes.containsKey(param); }
  
  public Set<Parameter> parameters() { return Collections.unmodifiableSet(indexes.keySet()); }
  
  public int get(Parameter param, int slice, int row, int column) {
    return indexes.get(param)[slice][row][column];
  }
  
  public int[][][] toArray(Parameter param) { return copy(indexes.get(param)); }
  
  void set(Parameter param, int slice, int row, int column, int value) {
    indexes.get(param)[slice][row][column] = value;
  }
  
  void put(Parameter param, int[][][] values) { indexes.put(param, copy(values)); }
  
  void remove(Parameter param) { indexes.remove(param); }
  
  /**
   * @return the largest index in the given parameters, 0 if all are fixed
   */
  public int max(Iterable<Parameter> params) {
    int max = 0;
    for (Parameter param: params) 
      for (int[][] slice: indexes.get(param))
        for (int[] row: slice)
          for (int v: row) max = Math.max(max, v);
    return max;
  }
  
  /**
   * @return true if the shapes match those of the corresponding parameters of system
   */
  public boolean conformsTo(StateSpace system, Iterable<Parameter> params) {
    for (Parameter param: params) {
      int[][][]       mine   = indexes.get(param);
      ParameterMatrix theirs = system.get(param);
      if (mine == null || theirs == null) return false;
      if (mine.length != theirs.slices()) return false;
      for (int[][] slice: mine) {
        if (slice.length != theirs.rows()) return false;
        for (int[] row: slice) if (row.length != theirs.columns()) return false;
      }
    }
    return true;
  }
  
  public boolean isSymmetric(Parameter param) {
    for (int[][] slice: indexes.get(param))
      for (int i=0; i<slice.length; i++)
        for (int j=0; j<i; j++)
          if (slice[i][j] != slice[j][i]) return false;
    return true;
  }
  
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof IndexStateSpace)) return false;
    IndexStateSpace other = (IndexStateSpace) o;
    if (!indexes.keySet().equals(other.indexes.keySet())) return false;
    for (Parameter param: indexes.keySet()) 
      if (!Arrays.deepEquals(indexes.get(param), other.indexes.get(param))) return false;
    return true;
  }
  
  @Override
  public int hashCode() {
    int h = 0;
    for (Map.Entry<Parameter, int[][][]> e: indexes.entrySet()) 
      h = 31 * h + e.getKey().hashCode() + Arrays.deepHashCode(e.getValue());
    return h;
  }
  
  @Override
  public String toString() {
    StringBuilder s = new StringBuilder();
    for (Map.Entry<Parameter, int[][][]> e: indexes.entrySet()) {
      s.append(e.getKey()).append('=');
      for (int[][] slice: e.getValue()) s.append(Matrix.toString(slice));
      s.append(' ');
    }
    return s.toString().trim();
  }
}
