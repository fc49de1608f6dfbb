package sivantoledo.statespace.theta;

import java.util.Arrays;

import org.apache.commons.math3.analysis.MultivariateFunction;

/**
 * Defines one element of psi as a function of some elements of theta. 
 * 
 * @author Sivan Toledo
 */
public final class PsiTransformation {
  
  private final int[]                thetaIndexes; // zero based
  private final MultivariateFunction function;
  private final String               label;
  
  /**
   * @param thetaIndexes zero-based indexes of the theta elements the function reads, in order
   * @param function evaluated on theta[thetaIndexes]
   * @param label a description for reports
   */
  public PsiTransformation(int[] thetaIndexes, MultivariateFunction function, String label) {
    if (thetaIndexes.length == 0) throw new IllegalArgumentException("psi must depend on at least one element of theta");
    this.thetaIndexes = thetaIndexes.clone();
    this.function     = function;
    this.label        = label;
  }
  
  /**
   * psi = theta[thetaIndex]
   */
  public static PsiTransformation identity(int thetaIndex) {
    return new PsiTransformation(new int[] { thetaIndex }, (x) -> x[0], null);
  }
  
  public int[] thetaIndexes() { return thetaIndexes.clone(); }
  
  public boolean reads(int thetaIndex) {
    for (int i: thetaIndexes) if (i == thetaIndex) return true;
    return false;
  }
  
  public MultivariateFunction function() { return function; }
  
  public boolean isIdentity() { return label == null && thetaIndexes.length == 1; }
  
  public String label() { return label; }
  
  public double value(double[] theta) {
    double[] arguments = new double[thetaIndexes.length];
    for (int i=0; i<thetaIndexes.length; i++) arguments[i] = theta[thetaIndexes[i]];
    return function.value(arguments);
  }
  
  /**
   * @param relabel new zero-based index of every old theta element
   * @return the same function reading the relabeled theta elements
   */
  PsiTransformation relabel(int[] relabel) {
    int[] relabeled = new int[thetaIndexes.length];
    for (int i=0; i<thetaIndexes.length; i++) relabeled[i] = relabel[thetaIndexes[i]];
    return new PsiTransformation(relabeled, function, label);
  }
  
  @Override
  public String toString() {
    return (label == null ? "theta" : label) + Arrays.toString(thetaIndexes);
  }
}
