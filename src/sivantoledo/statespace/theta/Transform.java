package sivantoledo.statespace.theta;

/**
 * A monotonic scalar transformation from an unconstrained value to an 
 * interval, together with its inverse and derivative.
 * 
 * Transforms are values: two transforms are equal if they are of the same 
 * kind and have the same bounds, which is what allows the registry to merge
 * duplicates.
 * 
 * @author Sivan Toledo
 */
public final class Transform {
  
  public static enum Kind {
    IDENTITY, // x
    EXP,      // exp(x) + lower
    NEG_EXP,  // upper - exp(x)
    LOGISTIC  // lower + (upper-lower) / (1 + exp(-x))
  }
  
  public static final Transform IDENTITY = new Transform(Kind.IDENTITY, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
  
  private final Kind   kind;
  private final double lower;
  private final double upper;
  
  private Transform(Kind kind, double lower, double upper) {
    this.kind  = kind;
    this.lower = lower;
    this.upper = upper;
  }
  
  /**
   * The transformation that maps the real line onto (lowerBound, upperBound).
   * 
   * @param lowerBound lower bound, may be -Infinity
   * @param upperBound upper bound, may be +Infinity
   * @return a logistic, exponential, negative exponential or identity transform
   */
  public static Transform bounded(double lowerBound, double upperBound) {
    if (Double.isNaN(lowerBound) || Double.isNaN(upperBound)) 
      throw new IllegalArgumentException("bounds cannot be NaN");
    if (lowerBound >= upperBound) 
      throw new IllegalArgumentException(String.format("lower bound %.3e must be below upper bound %.3e", lowerBound, upperBound));
    
    boolean finiteLower = !Double.isInfinite(lowerBound);
    boolean finiteUpper = !Double.isInfinite(upperBound);
    
    if (finiteLower && finiteUpper) return new Transform(Kind.LOGISTIC, lowerBound, upperBound);
    if (finiteLower)                return new Transform(Kind.EXP,      lowerBound, Double.POSITIVE_INFINITY);
    if (finiteUpper)                return new Transform(Kind.NEG_EXP,  Double.NEGATIVE_INFINITY, upperBound);
    return IDENTITY;
  }
  
  public Kind   kind()  { return kind; }
  public double lower() { return lower; }
  public double upper() { return upper; }
  
  public double apply(double x) {
    switch (kind) {
    case EXP:      return Math.exp(x) + lower;
    case NEG_EXP:  return upper - Math.exp(x);
    case LOGISTIC: return lower + (upper - lower) / (1 + Math.exp(-x));
    case IDENTITY:
    default:       return x;
    }
  }
  
  public double inverse(double y) {
    switch (kind) {
    case EXP:      return Math.log(y - lower);
    case NEG_EXP:  return Math.log(upper - y);
    case LOGISTIC: return -Math.log((upper - lower) / (y - lower) - 1);
    case IDENTITY:
    default:       return y;
    }
  }
  
  public double derivative(double x) {
    switch (kind) {
    case EXP:      return Math.exp(x);
    case NEG_EXP:  return -Math.exp(x);
    case LOGISTIC: 
      // written in terms of exp(-|x|) so that it does not overflow
      double e = Math.exp(-Math.abs(x));
      return (upper - lower) * e / ((1 + e) * (1 + e));
    case IDENTITY:
    default:       return 1;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Transform)) return false;
    Transform other = (Transform) o;
    return kind == other.kind 
        && Double.compare(lower, other.lower) == 0 
        && Double.compare(upper, other.upper) == 0;
  }
  
  @Override
  public int hashCode() {
    return 31 * (31 * kind.hashCode() + Double.hashCode(lower)) + Double.hashCode(upper);
  }
  
  @Override
  public String toString() {
    switch (kind) {
    case EXP:      return String.format("exp(x)+%.3g", lower);
    case NEG_EXP:  return String.format("%.3g-exp(x)", upper);
    case LOGISTIC: return String.format("logistic(x,%.3g,%.3g)", lower, upper);
    case IDENTITY:
    default:       return "x";
    }
  }
}
