package sivantoledo.statespace.theta;

import java.util.Collections;
import java.util.List;

/**
 * A value lies outside the bounds recorded for it.
 * 
 * @author Sivan Toledo
 */
public class BoundViolationException extends ThetaMapException {
  
  private static final long serialVersionUID = 1L;
  
  public static enum Side { LOWER, UPPER }

  private final Side         side;
  private final List<String> offenders;
  
  /**
   * @param side which bound was violated
   * @param offenders names of the parameters or theta elements that violate it
   */
  public BoundViolationException(Side side, List<String> offenders) {
    super(String.format("Parameter(s) in %s violate %s bound.", String.join(", ", offenders), 
        side == Side.LOWER ? "lower" : "upper"));
    this.side      = side;
    this.offenders = Collections.unmodifiableList(offenders);
  }
  
  public Side side() { return side; }
  
  public List<String> offenders() { return offenders; }
}
