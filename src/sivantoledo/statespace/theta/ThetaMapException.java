package sivantoledo.statespace.theta;

/**
 * Base class of the errors raised when a state space and a ThetaMap disagree.
 * 
 * @author Sivan Toledo
 */
public class ThetaMapException extends RuntimeException {
  
  private static final long serialVersionUID = 1L;

  public ThetaMapException(String message) {
    super(message);
  }
}
