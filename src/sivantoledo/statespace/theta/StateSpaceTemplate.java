package sivantoledo.statespace.theta;

import java.util.EnumMap;

import sivantoledo.statespace.Parameter;
import sivantoledo.statespace.ParameterMatrix;
import sivantoledo.statespace.StateSpace;

/**
 * A partially specified state space: the shape and period selectors of a 
 * system together with an entry definition for every coefficient.
 * 
 * A template is usually created from a StateSpace whose free entries are NaN
 * and then refined by naming variables or attaching expressions to entries.
 * 
 * @author Sivan Toledo
 */
public class StateSpaceTemplate {
  
  private final StateSpace                  shape;
  private final EnumMap<Parameter, Entry[][][]> entries = new EnumMap<>(Parameter.class);
  
  /**
   * @param system a system whose NaN entries are free; its initial values, if 
   *   present, become explicit initial values of the estimated system
   */
  public StateSpaceTemplate(StateSpace system) {
    this.shape = system;
    for (Parameter param: Parameter.SYSTEM) {
      ParameterMatrix matrix = system.get(param);
      Entry[][][] defs = new Entry[matrix.slices()][matrix.rows()][matrix.columns()];
      for (int s=0; s<matrix.slices(); s++)
        for (int i=0; i<matrix.rows(); i++)
          for (int j=0; j<matrix.columns(); j++)
            defs[s][i][j] = Entry.literal(matrix.get(s, i, j));
      entries.put(param, defs);
    }
  }
  
  public static StateSpaceTemplate from(StateSpace system) {
    return new StateSpaceTemplate(system);
  }
  
  /**
   * Defines an entry of a system parameter. Entries of H and Q are set 
   * together with their mirror image across the diagonal.
   * 
   * @return this template
   */
  public StateSpaceTemplate set(Parameter param, int slice, int row, int column, Entry entry) {
    if (param.isInitial()) throw new IllegalArgumentException("initial values are defined through the state space");
    Entry[][][] defs = entries.get(param);
    defs[slice][row][column] = entry;
    if (param.isSymmetric()) defs[slice][column][row] = entry;
    return this;
  }

  public StateSpaceTemplate set(Parameter param, int row, int column, Entry entry) {
    return set(param, 0, row, column, entry);
  }
  
  public Entry get(Parameter param, int slice, int row, int column) {
    return entries.get(param)[slice][row][column];
  }
  
  /**
   * @return the system this template was created from
   */
  public StateSpace shape() { return shape; }
  
  /**
   * @return the explicit initial mean with NaN for free entries, or null
   */
  public double[] a0() {
    ParameterMatrix a0 = shape.get(Parameter.A0);
    if (a0 == null) return null;
    double[] v = new double[a0.rows()];
    for (int i=0; i<v.length; i++) v[i] = a0.get(i, 0);
    return v;
  }

  /**
   * @return the explicit initial covariance with NaN for free entries, or null
   */
  public double[][] P0() {
    ParameterMatrix P0 = shape.get(Parameter.P0);
    return P0 == null ? null : P0.slice(0);
  }
}
