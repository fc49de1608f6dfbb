package sivantoledo.statespace.theta;

/**
 * Coefficients that share an element of psi imply different values for it.
 * 
 * @author Sivan Toledo
 */
public class InconsistentSystemException extends ThetaMapException {
  
  private static final long serialVersionUID = 1L;

  private final int psiIndex;
  
  public InconsistentSystemException(int psiIndex, double first, double other) {
    super(String.format("Transformation inverses result in differing values of psi(%d): %.6e and %.6e.", 
        psiIndex+1, first, other));
    this.psiIndex = psiIndex;
  }
  
  /**
   * @return the zero-based index of the psi element
   */
  public int psiIndex() { return psiIndex; }
}
