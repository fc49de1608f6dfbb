package sivantoledo.statespace;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * An immutable set of named coefficient matrices of a linear state-space model.
 * 
 * The nine system parameters are always present (beta and gamma may have zero 
 * columns). The initial state mean a0 and covariance P0 are optional; when 
 * absent they are left for the filter to derive (e.g. from the stationary 
 * distribution).
 * 
 * Entries are plain doubles. Estimation inputs use NaN to mark free entries, 
 * and bound systems use infinities for missing bounds. 
 * 
 * @author Sivan Toledo
 */
public final class StateSpace {
  
  private final EnumMap<Parameter, ParameterMatrix> parameters;
  
  private final int p; // observation series
  private final int m; // states
  private final int g; // shocks
  private final int k; // exogenous observation regressors
  private final int l; // exogenous state regressors
  private final int n; // periods covered by time-varying parameters, 0 if none
  
  /**
   * Builds a system from a map of parameters. 
   * 
   * @param parameters must contain every system parameter, may contain a0 and P0
   * @throws IllegalArgumentException if a system parameter is missing or the 
   *   dimensions are inconsistent
   */
  public StateSpace(Map<Parameter, ParameterMatrix> parameters) {
    this.parameters = new EnumMap<>(Parameter.class);
    for (Parameter param: Parameter.SYSTEM) {
      ParameterMatrix matrix = parameters.get(param);
      if (matrix == null) throw new IllegalArgumentException("state space parameter "+param+" is missing");
      this.parameters.put(param, matrix);
    }
    if (parameters.get(Parameter.A0) != null) this.parameters.put(Parameter.A0, parameters.get(Parameter.A0));
    if (parameters.get(Parameter.P0) != null) this.parameters.put(Parameter.P0, parameters.get(Parameter.P0));
    
    ParameterMatrix Z = this.parameters.get(Parameter.Z);
    ParameterMatrix R = this.parameters.get(Parameter.R);
    p = Z.rows();
    m = Z.columns();
    g = R.columns();
    k = this.parameters.get(Parameter.BETA).columns();
    l = this.parameters.get(Parameter.GAMMA).columns();
    
    checkShape(Parameter.D,     p, 1);
    checkShape(Parameter.BETA,  p, k);
    checkShape(Parameter.H,     p, p);
    checkShape(Parameter.T,     m, m);
    checkShape(Parameter.C,     m, 1);
    checkShape(Parameter.GAMMA, m, l);
    checkShape(Parameter.R,     m, g);
    checkShape(Parameter.Q,     g, g);
    
    if (this.parameters.containsKey(Parameter.A0)) {
      checkShape(Parameter.A0, m, 1);
      if (this.parameters.get(Parameter.A0).isTimeVarying()) throw new IllegalArgumentException("a0 cannot be time varying");
    }
    if (this.parameters.containsKey(Parameter.P0)) {
      checkShape(Parameter.P0, m, m);
      if (this.parameters.get(Parameter.P0).isTimeVarying()) throw new IllegalArgumentException("P0 cannot be time varying");
    }
    
    int periods = 0;
    for (ParameterMatrix matrix: this.parameters.values()) {
      if (!matrix.isTimeVarying()) continue;
      if (periods != 0 && matrix.periods() != periods) 
        throw new IllegalArgumentException("time-varying parameters must cover the same number of periods");
      periods = matrix.periods();
    }
    n = periods;
  }
  
  /**
   * A time-invariant system without exogenous regressors or explicit initial values.
   */
  public static StateSpace of(double[][] Z, double[] d, double[][] H, double[][] T, double[] c, double[][] R, double[][] Q) {
    Map<Parameter, ParameterMatrix> params = new EnumMap<>(Parameter.class);
    params.put(Parameter.Z,     ParameterMatrix.of(Z));
    params.put(Parameter.D,     ParameterMatrix.column(d));
    params.put(Parameter.BETA,  ParameterMatrix.empty(Z.length));
    params.put(Parameter.H,     ParameterMatrix.of(H));
    params.put(Parameter.T,     ParameterMatrix.of(T));
    params.put(Parameter.C,     ParameterMatrix.column(c));
    params.put(Parameter.GAMMA, ParameterMatrix.empty(T.length));
    params.put(Parameter.R,     ParameterMatrix.of(R));
    params.put(Parameter.Q,     ParameterMatrix.of(Q));
    return new StateSpace(params);
  }
  
  private void checkShape(Parameter param, int rows, int columns) {
    ParameterMatrix matrix = parameters.get(param);
    if (matrix.rows() != rows || matrix.columns() != columns) {
      throw new IllegalArgumentException(String.format("%s must be %d-by-%d but is %d-by-%d", 
          param, rows, columns, matrix.rows(), matrix.columns()));
    }
  }
  
  public int observations()         { return p; }
  public int states()               { return m; }
  public int shocks()               { return g; }
  public int observationExogenous() { return k; }
  public int stateExogenous()       { return l; }
  public int periods()              { return n; }
  
  public boolean has(Parameter param) { return parameters.containsKey(param); }
  
  /**
   * @return the parameter, or null for an absent initial condition
   */
  public ParameterMatrix get(Parameter param) { return parameters.get(param); }
  
  public Map<Parameter, ParameterMatrix> parameters() { return Collections.unmodifiableMap(parameters); }
  
  public boolean isTimeInvariant() { return n == 0; }
  
  /**
   * @return a copy of this system with one parameter replaced; null removes an initial condition
   */
  public StateSpace with(Parameter param, ParameterMatrix matrix) {
    EnumMap<Parameter, ParameterMatrix> copy = new EnumMap<>(parameters);
    if (matrix == null) copy.remove(param);
    else                copy.put(param, matrix);
    return new StateSpace(copy);
  }
  
  /**
   * @param a0 initial state mean, or null for an implicit one
   * @param P0 initial state covariance, or null for an implicit one
   * @return a copy of this system with the given initial values
   */
  public StateSpace withInitial(double[] a0, double[][] P0) {
    EnumMap<Parameter, ParameterMatrix> copy = new EnumMap<>(parameters);
    copy.remove(Parameter.A0);
    copy.remove(Parameter.P0);
    if (a0 != null) copy.put(Parameter.A0, ParameterMatrix.column(a0));
    if (P0 != null) copy.put(Parameter.P0, ParameterMatrix.of(P0));
    return new StateSpace(copy);
  }
  
  /**
   * @return a system with the shape of this one where every entry equals value 
   */
  public StateSpace fill(double value) {
    EnumMap<Parameter, ParameterMatrix> copy = new EnumMap<>(Parameter.class);
    for (Map.Entry<Parameter, ParameterMatrix> e: parameters.entrySet()) 
      copy.put(e.getKey(), e.getValue().map( (x) -> value ));
    return new StateSpace(copy);
  }
  
  /**
   * Checks that another system has the same parameters, shapes and period selectors.
   * 
   * @param other the system to compare to
   * @param includeInitial whether a0 and P0 must conform as well
   * @throws IllegalArgumentException naming the first parameter that does not conform
   */
  public void checkConforming(StateSpace other, boolean includeInitial) {
    if (other.p != p) throw new DimensionMismatchException(other.p, p);
    if (other.m != m) throw new DimensionMismatchException(other.m, m);
    for (Parameter param: Parameter.values()) {
      if (param.isInitial() && !includeInitial) continue;
      ParameterMatrix mine   = parameters.get(param);
      ParameterMatrix theirs = other.parameters.get(param);
      if (mine == null && theirs == null) continue;
      if (mine == null || !mine.conformsTo(theirs)) 
        throw new IllegalArgumentException("state space parameter "+param+" does not conform");
    }
  }
  
  /**
   * @return true if H and Q are exactly symmetric in every slice
   */
  public boolean isSymmetric() {
    return parameters.get(Parameter.H).isSymmetric() && parameters.get(Parameter.Q).isSymmetric();
  }
  
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StateSpace)) return false;
    return parameters.equals(((StateSpace) o).parameters);
  }
  
  @Override
  public int hashCode() { return parameters.hashCode(); }

  @Override
  public String toString() {
    StringBuilder s = new StringBuilder();
    s.append(String.format("StateSpace(p=%d, m=%d, g=%d)", p, m, g));
    for (Map.Entry<Parameter, ParameterMatrix> e: parameters.entrySet()) 
      s.append(' ').append(e.getKey()).append('=').append(e.getValue());
    return s.toString();
  }
}
