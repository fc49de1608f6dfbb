package sivantoledo.statespace.theta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import sivantoledo.statespace.Parameter;
import sivantoledo.statespace.ParameterMatrix;
import sivantoledo.statespace.StateSpace;

/**
 * The structure that tells, for every coefficient of a state space, whether
 * it is a known literal or driven by psi, and through which transform.
 * 
 *   fixed               - literal values, zero where the coefficient is driven by psi
 *   index               - the (one-based) element of psi driving each coefficient, 0 if fixed
 *   transformationIndex - the (one-based) transform applied to psi, 0 if fixed
 *   
 * The initial covariance P0 is described in one of two ways. When its index
 * structure is symmetric, the P0 entries of the three structures refer to P0
 * itself. When free entries appear only on and below the diagonal, they refer
 * to a lower-triangular root factor L0, and the covariance is L0*L0'.
 * 
 * @author Sivan Toledo
 */
public final class IndexSystem {
  
  private final StateSpace      fixed;
  private final IndexStateSpace index;
  private final IndexStateSpace transformationIndex;
  
  public IndexSystem(StateSpace fixed, IndexStateSpace index, IndexStateSpace transformationIndex) {
    this.fixed               = fixed;
    this.index               = index;
    this.transformationIndex = transformationIndex;
  }
  
  public StateSpace      fixed()               { return fixed; }
  public IndexStateSpace index()               { return index; }
  public IndexStateSpace transformationIndex() { return transformationIndex; }
  
  public boolean explicitA0() { return fixed.has(Parameter.A0); }
  public boolean explicitP0() { return fixed.has(Parameter.P0); }
  
  /**
   * @return true if the P0 entries describe the root factor of P0 rather than P0
   */
  public boolean factoredP0() { 
    return explicitP0() && index.has(Parameter.P0) && !index.isSymmetric(Parameter.P0); 
  }
  
  /**
   * @return the system parameters followed by the explicit initial conditions
   */
  public List<Parameter> parameters() {
    List<Parameter> params = new ArrayList<>(Parameter.SYSTEM);
    if (explicitA0()) params.add(Parameter.A0);
    if (explicitP0()) params.add(Parameter.P0);
    return Collections.unmodifiableList(params);
  }
  
  /**
   * @return the number of elements of psi, the largest index
   */
  public int psiCount() { return index.max(parameters()); }
  
  /**
   * Checks the structural invariants.
   * 
   * @param transformCount the number of registered transforms
   * @throws IllegalArgumentException describing the first violation found
   */
  public void validate(int transformCount) {
    List<Parameter> params = parameters();
    for (Parameter param: params) {
      if (!index.has(param)) throw new IllegalArgumentException("index has no "+param);
      if (!transformationIndex.has(param)) throw new IllegalArgumentException("transformationIndex has no "+param);
    }
    if (!index.conformsTo(fixed, params)) 
      throw new IllegalArgumentException("index does not conform to the fixed system");
    if (!transformationIndex.conformsTo(fixed, params)) 
      throw new IllegalArgumentException("transformationIndex does not conform to the fixed system");
    
    for (Parameter param: params) {
      ParameterMatrix values = fixed.get(param);
      for (int s=0; s<values.slices(); s++)
        for (int i=0; i<values.rows(); i++)
          for (int j=0; j<values.columns(); j++) {
            double v = values.get(s, i, j);
            int    x = index.get(param, s, i, j);
            int    t = transformationIndex.get(param, s, i, j);
            String where = String.format("%s(%d,%d) in slice %d", param, i+1, j+1, s+1);
            if (Double.isNaN(v)) 
              throw new IllegalArgumentException("fixed value of "+where+" is NaN");
            if (x < 0 || t < 0) 
              throw new IllegalArgumentException("negative index at "+where);
            if (x != 0 && v != 0) 
              throw new IllegalArgumentException("coefficients determined by theta must be zero in fixed: "+where);
            if (x != 0 && t == 0) 
              throw new IllegalArgumentException("coefficient "+where+" has an index but no transformation");
            if (t > transformCount) 
              throw new IllegalArgumentException("insufficient transformations provided for "+where);
            if (param == Parameter.P0 && factoredP0() && j > i && (x != 0 || v != 0)) 
              throw new IllegalArgumentException("the root factor of P0 is lower triangular: "+where);
          }
      boolean symmetric = param.isSymmetric() || (param == Parameter.P0 && !factoredP0());
      if (symmetric && !(index.isSymmetric(param) && values.isSymmetric())) 
        throw new IllegalArgumentException(param+" must have a symmetric structure");
    }
  }
  
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof IndexSystem)) return false;
    IndexSystem other = (IndexSystem) o;
    return fixed.equals(other.fixed) 
        && index.equals(other.index) 
        && transformationIndex.equals(other.transformationIndex);
  }
  
  @Override
  public int hashCode() {
    return 31 * (31 * fixed.hashCode() + index.hashCode()) + transformationIndex.hashCode();
  }
  
  @Override
  public String toString() {
    return "index: "+index+"\ntransformationIndex: "+transformationIndex;
  }
}
