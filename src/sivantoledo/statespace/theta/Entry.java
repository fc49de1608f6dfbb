package sivantoledo.statespace.theta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * The definition of one entry of a coefficient matrix that is being estimated:
 * a known literal, a free variable, or an expression in several named free 
 * variables.
 * 
 * Unnamed free entries are each estimated independently. Entries that refer 
 * to the same named variable, or to equal expressions (same label and 
 * variables), share the value that drives them.
 * 
 * @author Sivan Toledo
 */
public final class Entry {
  
  public static enum Kind {
    LITERAL,
    FREE,
    EXPRESSION
  }
  
  private final Kind                 kind;
  private final double               value;     // LITERAL
  private final String               name;      // FREE (null if unnamed), EXPRESSION label
  private final List<String>         variables; // EXPRESSION
  private final MultivariateFunction evaluator; // EXPRESSION
  private final UnivariateFunction   inverse;   // EXPRESSION, optional
  
  private Entry(Kind kind, double value, String name, List<String> variables, 
      MultivariateFunction evaluator, UnivariateFunction inverse) {
    this.kind      = kind;
    this.value     = value;
    this.name      = name;
    this.variables = variables;
    this.evaluator = evaluator;
    this.inverse   = inverse;
  }
  
  public static Entry literal(double value) {
    if (Double.isNaN(value)) return free();
    return new Entry(Kind.LITERAL, value, null, Collections.emptyList(), null, null);
  }
  
  /**
   * @return an unnamed free entry, estimated on its own
   */
  public static Entry free() {
    return new Entry(Kind.FREE, Double.NaN, null, Collections.emptyList(), null, null);
  }
  
  /**
   * @param name the name of the free variable; entries with the same name share it
   */
  public static Entry free(String name) {
    if (name == null || name.isEmpty()) throw new IllegalArgumentException("free variables need a name");
    return new Entry(Kind.FREE, Double.NaN, name, Collections.singletonList(name), null, null);
  }
  
  /**
   * An expression in named free variables. 
   * 
   * @param label identifies the expression; entries with equal labels and variables share a value
   * @param variables the names of the free variables, in the order the evaluator expects them
   * @param evaluator computes the entry from the values of the variables
   * @param inverse the closed-form inverse of a single-variable expression, or null
   */
  public static Entry expression(String label, List<String> variables, MultivariateFunction evaluator, UnivariateFunction inverse) {
    if (variables.isEmpty()) throw new IllegalArgumentException("expression "+label+" has no free variables");
    if (inverse != null && variables.size() != 1) 
      throw new IllegalArgumentException("only single-variable expressions can have a closed-form inverse");
    return new Entry(Kind.EXPRESSION, Double.NaN, label, 
        Collections.unmodifiableList(new ArrayList<>(variables)), evaluator, inverse);
  }

  public static Entry expression(String label, List<String> variables, MultivariateFunction evaluator) {
    return expression(label, variables, evaluator, null);
  }

  public Kind kind() { return kind; }
  
  public boolean isLiteral()  { return kind == Kind.LITERAL; }
  
  public boolean isUnnamedFree() { return kind == Kind.FREE && name == null; }
  
  public double value() { return value; }
  
  public String name() { return name; }
  
  public List<String> variables() { return variables; }
  
  public MultivariateFunction evaluator() { return evaluator; }
  
  public UnivariateFunction inverse() { return inverse; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Entry)) return false;
    Entry other = (Entry) o;
    if (kind != other.kind) return false;
    switch (kind) {
    case LITERAL:    return Double.compare(value, other.value) == 0;
    case FREE:       return name != null && name.equals(other.name);
    case EXPRESSION: 
    default:         return name.equals(other.name) && variables.equals(other.variables);
    }
  }
  
  @Override
  public int hashCode() {
    switch (kind) {
    case LITERAL:    return Double.hashCode(value);
    case FREE:       return name == null ? System.identityHashCode(this) : name.hashCode();
    case EXPRESSION: 
    default:         return 31 * name.hashCode() + variables.hashCode();
    }
  }
  
  @Override
  public String toString() {
    switch (kind) {
    case LITERAL:    return Double.toString(value);
    case FREE:       return name == null ? "?" : name;
    case EXPRESSION: 
    default:         return name + variables;
    }
  }
}
