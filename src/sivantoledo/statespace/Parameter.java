package sivantoledo.statespace;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The named coefficient matrices of a linear state-space model
 * 
 *   y_t = Z*a_t + d + beta*x_t + e_t,       e_t ~ N(0, H)
 *   a_t = T*a_{t-1} + c + gamma*w_t + R*u_t, u_t ~ N(0, Q)
 *   
 * together with the (optional) initial state mean a0 and covariance P0.
 * 
 * @author Sivan Toledo
 */
public enum Parameter {
  Z    ("Z",     false, false),
  D    ("d",     false, false),
  BETA ("beta",  false, false),
  H    ("H",     true,  false),
  T    ("T",     false, false),
  C    ("c",     false, false),
  GAMMA("gamma", false, false),
  R    ("R",     false, false),
  Q    ("Q",     true,  false),
  A0   ("a0",    false, true),
  P0   ("P0",    false, true);
  
  /**
   * The nine system parameters, in their canonical order.
   */
  public static final List<Parameter> SYSTEM = 
      Collections.unmodifiableList(Arrays.asList(Z, D, BETA, H, T, C, GAMMA, R, Q));

  private final String  label;
  private final boolean symmetric;
  private final boolean initial;
  
  private Parameter(String label, boolean symmetric, boolean initial) {
    this.label     = label;
    this.symmetric = symmetric;
    this.initial   = initial;
  }
  
  public String label() { return label; }

  /**
   * Symmetric covariance parameters are parameterized on and below the 
   * diagonal only; entries above the diagonal mirror them.
   * 
   * @return true for H and Q
   */
  public boolean isSymmetric() { return symmetric; }
  
  public boolean isInitial() { return initial; }
  
  /**
   * Covariance-typed parameters have their free diagonal entries 
   * restricted to be positive.
   * 
   * @return true for H, Q and P0
   */
  public boolean isCovariance() { return symmetric || this == P0; }
  
  @Override
  public String toString() { return label; }
}
