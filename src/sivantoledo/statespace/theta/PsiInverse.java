package sivantoledo.statespace.theta;

import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * A closed-form inverse that recovers one element of theta from one element of psi.
 * 
 * Elements of theta without a closed-form inverse are recovered numerically.
 * 
 * @author Sivan Toledo
 */
public final class PsiInverse {
  
  private final int                psiIndex; // zero based
  private final UnivariateFunction function;
  
  public PsiInverse(int psiIndex, UnivariateFunction function) {
    this.psiIndex = psiIndex;
    this.function = function;
  }
  
  /**
   * theta = psi[psiIndex]
   */
  public static PsiInverse identity(int psiIndex) {
    return new PsiInverse(psiIndex, (x) -> x);
  }
  
  public int psiIndex() { return psiIndex; }
  
  public UnivariateFunction function() { return function; }
  
  public double value(double[] psi) {
    return function.value(psi[psiIndex]);
  }
  
  PsiInverse relabel(int newPsiIndex) {
    return new PsiInverse(newPsiIndex, function);
  }
  
  @Override
  public String toString() { return "psi["+psiIndex+"]"; }
}
