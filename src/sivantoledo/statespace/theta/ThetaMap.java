package sivantoledo.statespace.theta;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import sivantoledo.statespace.CovarianceFactor;
import sivantoledo.statespace.Parameter;
import sivantoledo.statespace.ParameterMatrix;
import sivantoledo.statespace.StateSpace;
import sivantoledo.statespace.theta.BoundViolationException.Side;

/**
 * Mapping from a vector of parameters theta to a StateSpace.
 *
 * A vector psi is defined element-wise as a function of theta. Each coefficient
 * of the state space that is not fixed is a transformation of one element of
 * psi; many coefficients may share an element of psi, and an element of psi
 * may depend on several elements of theta:
 *
 *   psi[i]      = PsiTransformation[i]( theta[PsiIndexes[i]] )
 *   coefficient = transform[transformationIndex(coefficient)]( psi[index(coefficient)] )
 *
 * The two main operations are theta2system, which builds a StateSpace from
 * theta, and system2theta, which recovers theta from a StateSpace. The
 * coefficients can be bounded with addRestrictions; the bounds are enforced
 * by the transforms.
 *
 * A ThetaMap is never modified after construction: addRestrictions,
 * updateInitial and the other edits return a new map.
 *
 * @author Sivan Toledo
 */
public final class ThetaMap {

  private final static Logger log = LogManager.getLogger();

  public static final double EPS            = Math.ulp(1.0);
  public static final double VARIANCE_FLOOR = 10 * EPS;
  public static final double PSI_TOLERANCE  = 1e4 * EPS;

  private StateSpace                      shape;       // shapes and period selectors
  private EnumMap<Parameter, double[][][]> fixed;
  private IndexStateSpace                 index;
  private IndexStateSpace                 transformationIndex;
  private TransformRegistry               transformations;

  private List<PsiTransformation> psiTransformations;
  private List<PsiInverse>        psiInverses;        // per theta, null if recovered numerically
  private List<String>            thetaNames;
  private double[]                thetaLowerBound;
  private double[]                thetaUpperBound;

  private EnumMap<Parameter, double[][][]> lowerBound;
  private EnumMap<Parameter, double[][][]> upperBound;

  private InverseSettings inverseSettings = InverseSettings.DEFAULT;

  private int nTheta;
  private int nPsi;

  private boolean factoredP0; // P0 entries hold its lower-triangular root factor

  private ThetaMap() {}

  /**
   * Builds a map from a custom structure.
   *
   * @param structure fixed values, psi indexes and transformation indexes
   * @param transformations the transforms referenced by the transformation indexes
   * @param psiTransformations definition of each element of psi, or null for psi = theta
   * @param psiInverses closed-form inverse for each element of theta (elements may be null),
   *   or null for theta = psi
   * @param names names of the elements of theta, or null for theta_1, theta_2, ...
   * @throws IllegalArgumentException if the structure is malformed
   */
  public ThetaMap(IndexSystem structure, TransformRegistry transformations,
      List<PsiTransformation> psiTransformations, List<PsiInverse> psiInverses, List<String> names) {
    structure.validate(transformations.size());

    int psiCount = structure.psiCount();
    if (psiTransformations == null) {
      psiTransformations = new ArrayList<>();
      for (int i=0; i<psiCount; i++) psiTransformations.add(PsiTransformation.identity(i));
    }
    if (psiTransformations.size() < psiCount)
      throw new IllegalArgumentException("index refers to "+psiCount+" elements of psi but "+psiTransformations.size()+" are defined");

    int thetaCount = 0;
    for (PsiTransformation pt: psiTransformations)
      for (int i: pt.thetaIndexes()) {
        if (i < 0) throw new IllegalArgumentException("negative theta index in "+pt);
        thetaCount = Math.max(thetaCount, i+1);
      }

    if (psiInverses == null) {
      psiInverses = new ArrayList<>();
      for (int i=0; i<thetaCount; i++) psiInverses.add(PsiInverse.identity(i));
    }
    if (psiInverses.size() != thetaCount)
      throw new IllegalArgumentException("theta has "+thetaCount+" elements but "+psiInverses.size()+" inverses are given");
    for (PsiInverse inverse: psiInverses)
      if (inverse != null && (inverse.psiIndex() < 0 || inverse.psiIndex() >= psiTransformations.size()))
        throw new IllegalArgumentException("inverse refers to a nonexistent element of psi: "+inverse);

    if (names == null) names = defaultNames(thetaCount);
    if (names.size() != thetaCount)
      throw new IllegalArgumentException("theta has "+thetaCount+" elements but "+names.size()+" names are given");

    this.shape               = structure.fixed();
    this.fixed               = arrays(structure.fixed());
    this.index               = structure.index().copy();
    this.transformationIndex = structure.transformationIndex().copy();
    this.transformations     = transformations;
    this.psiTransformations  = new ArrayList<>(psiTransformations);
    this.psiInverses         = new ArrayList<>(psiInverses);
    this.thetaNames          = new ArrayList<>(names);
    this.nTheta              = thetaCount;
    this.factoredP0          = structure.factoredP0();
    this.nPsi                = psiTransformations.size();

    this.thetaLowerBound = new double[nTheta];
    this.thetaUpperBound = new double[nTheta];
    Arrays.fill(thetaLowerBound, Double.NEGATIVE_INFINITY);
    Arrays.fill(thetaUpperBound, Double.POSITIVE_INFINITY);

    // free coefficients are unbounded, fixed ones are pinned to their value
    this.lowerBound = new EnumMap<>(Parameter.class);
    this.upperBound = new EnumMap<>(Parameter.class);
    for (Parameter param: parameters()) {
      double[][][] lb = copy(fixed.get(param));
      double[][][] ub = copy(fixed.get(param));
      for (int s=0; s<lb.length; s++)
        for (int i=0; i<lb[s].length; i++)
          for (int j=0; j<lb[s][i].length; j++)
            if (index.get(param, s, i, j) != 0) {
              lb[s][i][j] = Double.NEGATIVE_INFINITY;
              ub[s][i][j] = Double.POSITIVE_INFINITY;
            }
      lowerBound.put(param, lb);
      upperBound.put(param, ub);
    }

    // variances must be positive
    restrict(null, null);
    compress();
  }

  /*
   * Alternate constructors
   */

  /**
   * Builds a map where every free coefficient is an independent element of
   * theta, except in the variance matrices H and Q, where the coefficients
   * above the diagonal mirror those below it. Coefficients that refer to the
   * same named variable or to equal expressions share an element of psi.
   *
   * The elements of theta are ordered by name for the named variables,
   * followed by one element per unnamed free coefficient.
   *
   * @param template the system to estimate
   * @return the map
   */
  public static ThetaMap estimation(StateSpaceTemplate template) {
    StateSpace system = template.shape();

    TreeSet<String> variables = new TreeSet<>();
    for (Parameter param: Parameter.SYSTEM) {
      ParameterMatrix matrix = system.get(param);
      for (int s=0; s<matrix.slices(); s++)
        for (int i=0; i<matrix.rows(); i++)
          for (int j=0; j<matrix.columns(); j++)
            variables.addAll(template.get(param, s, i, j).variables());
    }
    List<String> names = new ArrayList<>(variables);
    Map<String, Integer> thetaOf = new HashMap<>();
    for (String name: names) thetaOf.put(name, thetaOf.size());

    List<PsiTransformation> psiTransformations = new ArrayList<>();
    Map<Integer, PsiInverse> unnamedInverses   = new HashMap<>();
    Map<Entry, Integer>      psiOf             = new LinkedHashMap<>();

    StateSpace      zeros               = system.fill(0.0).with(Parameter.A0, null).with(Parameter.P0, null);
    IndexStateSpace index               = IndexStateSpace.zeros(zeros);
    IndexStateSpace transformationIndex = IndexStateSpace.zeros(zeros);
    Map<Parameter, ParameterMatrix> fixedParams = new EnumMap<>(Parameter.class);

    for (Parameter param: Parameter.SYSTEM) {
      ParameterMatrix matrix = system.get(param);
      double[][][] fixedValues = new double[matrix.slices()][matrix.rows()][matrix.columns()];
      for (int s=0; s<matrix.slices(); s++)
        for (int i=0; i<matrix.rows(); i++)
          for (int j=0; j<matrix.columns(); j++) {
            if (param.isSymmetric() && j > i) continue;
            Entry entry = template.get(param, s, i, j);
            if (param.isSymmetric() && i != j) checkMirror(param, s, i, j, entry, template.get(param, s, j, i));

            int psi;
            switch (entry.kind()) {
            case LITERAL:
              fixedValues[s][i][j] = entry.value();
              if (param.isSymmetric()) fixedValues[s][j][i] = entry.value();
              continue;
            case FREE:
              if (entry.isUnnamedFree()) {
                int theta = names.size();
                names.add(null);
                psiTransformations.add(PsiTransformation.identity(theta));
                psi = psiTransformations.size();
                unnamedInverses.put(theta, PsiInverse.identity(psi-1));
                break;
              }
              // fall through: a named variable is an expression in itself
            case EXPRESSION:
            default:
              Integer shared = psiOf.get(entry);
              if (shared == null) {
                psiTransformations.add(psiTransformation(entry, thetaOf));
                shared = psiTransformations.size();
                psiOf.put(entry, shared);
              }
              psi = shared;
              break;
            }
            index.set(param, s, i, j, psi);
            transformationIndex.set(param, s, i, j, 1);
            if (param.isSymmetric()) {
              index.set(param, s, j, i, psi);
              transformationIndex.set(param, s, j, i, 1);
            }
          }
      fixedParams.put(param, matrix.withSlices(fixedValues));
    }

    List<PsiInverse> psiInverses = new ArrayList<>();
    for (int theta=0; theta<names.size(); theta++) {
      if (theta < variables.size()) psiInverses.add(namedInverse(names.get(theta), psiOf));
      else                          psiInverses.add(unnamedInverses.get(theta));
    }
    for (int theta=variables.size(); theta<names.size(); theta++) names.set(theta, "theta_"+(theta+1));

    IndexSystem structure = new IndexSystem(new StateSpace(fixedParams), index, transformationIndex);
    ThetaMap map = new ThetaMap(structure, TransformRegistry.identity(), psiTransformations, psiInverses, names);

    double[]   a0 = template.a0();
    double[][] P0 = template.P0();
    if (a0 != null || P0 != null) map = map.updateInitial(a0, P0);
    return map;
  }

  /**
   * Builds a map where every coefficient of the system is free, including
   * the initial values when the system has them.
   */
  public static ThetaMap all(StateSpace system) {
    return estimation(StateSpaceTemplate.from(system.fill(Double.NaN)));
  }

  private static void checkMirror(Parameter param, int s, int i, int j, Entry lower, Entry upper) {
    boolean ok = lower.isLiteral() ? lower.equals(upper) : !upper.isLiteral();
    if (!ok) {
      throw new IllegalArgumentException(String.format("%s must be symmetric: entries (%d,%d) and (%d,%d) of slice %d differ",
          param, i+1, j+1, j+1, i+1, s+1));
    }
  }

  private static PsiTransformation psiTransformation(Entry entry, Map<String, Integer> thetaOf) {
    List<String> vars = entry.variables();
    int[] thetaIndexes = new int[vars.size()];
    for (int k=0; k<thetaIndexes.length; k++) thetaIndexes[k] = thetaOf.get(vars.get(k));
    if (entry.kind() == Entry.Kind.FREE) return PsiTransformation.identity(thetaIndexes[0]);
    return new PsiTransformation(thetaIndexes, entry.evaluator(), entry.name());
  }

  private static PsiInverse namedInverse(String name, Map<Entry, Integer> psiOf) {
    PsiInverse closedForm = null;
    for (Map.Entry<Entry, Integer> e: psiOf.entrySet()) {
      Entry entry = e.getKey();
      if (!entry.variables().equals(Collections.singletonList(name))) continue;
      if (entry.kind() == Entry.Kind.FREE) return PsiInverse.identity(e.getValue()-1);
      if (entry.inverse() != null && closedForm == null) closedForm = new PsiInverse(e.getValue()-1, entry.inverse());
    }
    return closedForm;
  }

  /*
   * Conversion functions
   */

  /**
   * Generates a StateSpace from a vector theta.
   *
   * @param theta vector of parameters
   * @return a StateSpace with every coefficient determined
   */
  public StateSpace theta2system(double[] theta) {
    if (theta.length != nTheta) throw new DimensionMismatchException(theta.length, nTheta);
    for (int i=0; i<nTheta; i++)
      if (Double.isNaN(theta[i])) throw new IllegalArgumentException("Theta must be non-nan: "+thetaNames.get(i));

    double[] psi = constructPsi(theta);

    Map<Parameter, ParameterMatrix> params = new EnumMap<>(Parameter.class);
    for (Parameter param: parameters()) {
      double[][][] constructed = constructParamMat(psi, param);
      if (param == Parameter.P0 && factoredP0) {
        RealMatrix P0 = CovarianceFactor.product(MatrixUtils.createRealMatrix(constructed[0]));
        params.put(param, ParameterMatrix.of(P0.getData()));
      } else {
        params.put(param, shape.get(param).withSlices(constructed));
      }
    }
    return new StateSpace(params);
  }

  /**
   * Computes the theta vector that determines a system.
   *
   * @param system a system conforming to this map
   * @return theta
   * @throws BoundViolationException if a coefficient lies outside its bounds
   * @throws InconsistentSystemException if coefficients sharing an element of psi disagree
   */
  public double[] system2theta(StateSpace system) {
    shape.checkConforming(system, false);
    EnumMap<Parameter, double[][][]> values = new EnumMap<>(Parameter.class);
    for (Parameter param: parameters()) {
      if (!system.has(param)) throw new IllegalArgumentException("the system has no "+param+" but the map estimates it");
      if (!system.get(param).conformsTo(shape.get(param)))
        throw new IllegalArgumentException("state space parameter "+param+" does not conform");
      values.put(param, system.get(param).toArray());
    }
    if (factoredP0 && isFree(Parameter.P0)) {
      try {
        RealMatrix L = CovarianceFactor.cholesky(MatrixUtils.createRealMatrix(values.get(Parameter.P0)[0]));
        values.put(Parameter.P0, new double[][][] { L.getData() });
      } catch (NonPositiveDefiniteMatrixException npdme) {
        throw new BoundViolationException(Side.LOWER, Collections.singletonList(Parameter.P0.label()));
      }
    }

    checkBounds(values);

    // Loop over psi, recovering it from each coefficient it determines
    double[] psi = new double[nPsi];
    Arrays.fill(psi, Double.NaN);
    for (Parameter param: parameters()) {
      double[][][] v = values.get(param);
      for (int s=0; s<v.length; s++)
        for (int i=0; i<v[s].length; i++)
          for (int j=0; j<v[s][i].length; j++) {
            int k = index.get(param, s, i, j);
            if (k == 0) continue;
            double value = transformations.get(transformationIndex.get(param, s, i, j)).inverse(v[s][i][j]);
            if (Double.isNaN(psi[k-1])) {
              psi[k-1] = value;
            } else if (Math.abs(value - psi[k-1]) > PSI_TOLERANCE * Math.max(1.0, Math.abs(psi[k-1]))) {
              throw new InconsistentSystemException(k-1, psi[k-1], value);
            }
          }
    }

    // Explicit inverses
    double[] theta = new double[nTheta];
    Arrays.fill(theta, Double.NaN);
    boolean numeric = false;
    for (int i=0; i<nTheta; i++) {
      PsiInverse inverse = psiInverses.get(i);
      if (inverse != null) theta[i] = inverse.value(psi);
      else                 numeric = true;
    }

    // Numeric inverses for those not specified
    if (numeric) {
      new NumericInverse(psiTransformations, thetaLowerBound, thetaUpperBound, inverseSettings).recover(theta, psi);
    }
    return theta;
  }

  private void checkBounds(EnumMap<Parameter, double[][][]> values) {
    List<String> lowerViolations = new ArrayList<>();
    List<String> upperViolations = new ArrayList<>();
    for (Parameter param: parameters()) {
      double[][][] v  = values.get(param);
      double[][][] lb = lowerBound.get(param);
      double[][][] ub = upperBound.get(param);
      boolean lower = false, upper = false;
      for (int s=0; s<v.length; s++)
        for (int i=0; i<v[s].length; i++)
          for (int j=0; j<v[s][i].length; j++) {
            if (index.get(param, s, i, j) == 0) continue;
            if (!(v[s][i][j] > lb[s][i][j])) lower = true;
            if (!(v[s][i][j] < ub[s][i][j])) upper = true;
          }
      if (lower) lowerViolations.add(param.label());
      if (upper) upperViolations.add(param.label());
    }
    if (!lowerViolations.isEmpty()) throw new BoundViolationException(Side.LOWER, lowerViolations);
    if (!upperViolations.isEmpty()) throw new BoundViolationException(Side.UPPER, upperViolations);
  }

  /*
   * Theta restrictions
   */

  /**
   * Maps an unrestricted theta to the bounded theta.
   *
   * @param thetaU unrestricted theta vector
   * @return theta, within its bounds
   */
  public double[] restrictTheta(double[] thetaU) {
    if (thetaU.length != nTheta) throw new DimensionMismatchException(thetaU.length, nTheta);
    double[] theta = new double[nTheta];
    for (int i=0; i<nTheta; i++) theta[i] = thetaTransform(i).apply(thetaU[i]);
    return theta;
  }

  /**
   * Maps a bounded theta to the unrestricted space.
   *
   * @param theta restricted theta
   * @return the unrestricted theta vector
   * @throws BoundViolationException if theta is outside its bounds
   */
  public double[] unrestrictTheta(double[] theta) {
    if (theta.length != nTheta) throw new DimensionMismatchException(theta.length, nTheta);
    List<String> lower = new ArrayList<>();
    List<String> upper = new ArrayList<>();
    for (int i=0; i<nTheta; i++) {
      if (!(theta[i] + EPS > thetaLowerBound[i])) lower.add(thetaNames.get(i));
      if (!(theta[i] - EPS < thetaUpperBound[i])) upper.add(thetaNames.get(i));
    }
    if (!lower.isEmpty()) throw new BoundViolationException(Side.LOWER, lower);
    if (!upper.isEmpty()) throw new BoundViolationException(Side.UPPER, upper);

    double[] thetaU = new double[nTheta];
    for (int i=0; i<nTheta; i++) {
      // a value within EPS outside its bounds is taken to be on the bound
      double clamped = Math.min(Math.max(theta[i], thetaLowerBound[i]), thetaUpperBound[i]);
      thetaU[i] = thetaTransform(i).inverse(clamped);
    }
    return thetaU;
  }

  /**
   * The Jacobian of restrictTheta, which is diagonal.
   *
   * @param thetaU unrestricted theta vector
   * @return d theta / d thetaU
   */
  public DiagonalMatrix thetaUthetaGrad(double[] thetaU) {
    if (thetaU.length != nTheta) throw new DimensionMismatchException(thetaU.length, nTheta);
    double[] d = new double[nTheta];
    for (int i=0; i<nTheta; i++) d[i] = thetaTransform(i).derivative(thetaU[i]);
    return new DiagonalMatrix(d);
  }

  private Transform thetaTransform(int i) {
    return Transform.bounded(thetaLowerBound[i], thetaUpperBound[i]);
  }

  /*
   * Structural edits
   */

  /**
   * Restricts the systems that can be created by tightening the bounds of
   * the free coefficients.
   *
   * The new bound of every free coefficient is the intersection of its
   * current bounds with the given ones; coefficients whose bounds change get
   * the transform of their new bounds, and coefficients whose bounds shrink
   * to a single point become fixed. The free diagonal coefficients of H, Q
   * and P0 (or of its root factor) are kept positive. Fixed coefficients are
   * not affected.
   *
   * @param lower lower bounds, or null to leave them unchanged
   * @param upper upper bounds, or null to leave them unchanged
   * @return the restricted map
   */
  public ThetaMap addRestrictions(StateSpace lower, StateSpace upper) {
    ThetaMap restricted = copy();
    restricted.restrict(restricted.boundArrays(lower), restricted.boundArrays(upper));
    restricted.compress();
    return restricted;
  }

  private EnumMap<Parameter, double[][][]> boundArrays(StateSpace bounds) {
    if (bounds == null) return null;
    shape.checkConforming(bounds, false);
    EnumMap<Parameter, double[][][]> arrays = new EnumMap<>(Parameter.class);
    for (Parameter param: parameters()) {
      if (!bounds.has(param)) continue;
      if (!bounds.get(param).conformsTo(shape.get(param)))
        throw new IllegalArgumentException("bounds of "+param+" do not conform");
      arrays.put(param, bounds.get(param).toArray());
    }
    return arrays;
  }

  /*
   * Intersects the bounds of the free coefficients with the passed ones (a
   * missing parameter is unbounded) and updates their transforms.
   */
  private void restrict(EnumMap<Parameter, double[][][]> passedLower, EnumMap<Parameter, double[][][]> passedUpper) {
    int changed = 0, collapsed = 0;
    for (Parameter param: parameters()) {
      double[][][] pl = passedLower == null ? null : passedLower.get(param);
      double[][][] pu = passedUpper == null ? null : passedUpper.get(param);
      double[][][] lb = lowerBound.get(param);
      double[][][] ub = upperBound.get(param);

      for (int s=0; s<lb.length; s++)
        for (int i=0; i<lb[s].length; i++)
          for (int j=0; j<lb[s][i].length; j++) {
            if (index.get(param, s, i, j) == 0) continue;
            // mirrored coefficients take the bound of the one below the diagonal
            int bi = mirrored(param) ? Math.max(i, j) : i;
            int bj = mirrored(param) ? Math.min(i, j) : j;

            double newLower = pl == null ? Double.NEGATIVE_INFINITY : pl[s][bi][bj];
            double newUpper = pu == null ? Double.POSITIVE_INFINITY : pu[s][bi][bj];
            if (param.isCovariance() && i == j) newLower = Math.max(newLower, VARIANCE_FLOOR);
            newLower = Math.max(newLower, lb[s][i][j]);
            newUpper = Math.min(newUpper, ub[s][i][j]);
            if (newLower == lb[s][i][j] && newUpper == ub[s][i][j]) continue;

            lb[s][i][j] = newLower;
            ub[s][i][j] = newUpper;
            changed++;
            if (newLower == newUpper) {
              fixed.get(param)[s][i][j] = newLower;
              index.set(param, s, i, j, 0);
              transformationIndex.set(param, s, i, j, 0);
              collapsed++;
            } else if (newLower < newUpper) {
              Transform t = Transform.bounded(newLower, newUpper);
              transformations = transformations.with(t);
              transformationIndex.set(param, s, i, j, transformations.indexOf(t));
            }
            // crossed bounds are reported by compress()
          }
    }
    if (changed > 0) log.debug("restricted {} coefficients, {} of them now fixed", changed, collapsed);
  }

  private boolean mirrored(Parameter param) {
    return param.isSymmetric() || (param == Parameter.P0 && !factoredP0);
  }

  /**
   * Sets the bounds of one element of theta.
   *
   * @param name the name of the element
   * @param lower new lower bound, or null to keep the current one
   * @param upper new upper bound, or null to keep the current one
   * @return the map with the new bounds
   */
  public ThetaMap addStructuralRestriction(String name, Double lower, Double upper) {
    int i = thetaNames.indexOf(name);
    if (i < 0) throw new IllegalArgumentException("no element of theta is named "+name);
    return addStructuralRestriction(i, lower, upper);
  }

  /**
   * Sets the bounds of one element of theta.
   *
   * @param thetaIndex zero-based index of the element
   * @param lower new lower bound, or null to keep the current one
   * @param upper new upper bound, or null to keep the current one
   * @return the map with the new bounds
   */
  public ThetaMap addStructuralRestriction(int thetaIndex, Double lower, Double upper) {
    if (thetaIndex < 0 || thetaIndex >= nTheta)
      throw new IllegalArgumentException("theta has no element "+thetaIndex);
    ThetaMap restricted = copy();
    if (lower != null) restricted.thetaLowerBound[thetaIndex] = lower;
    if (upper != null) restricted.thetaUpperBound[thetaIndex] = upper;
    if (!(restricted.thetaLowerBound[thetaIndex] < restricted.thetaUpperBound[thetaIndex])) {
      throw new IllegalArgumentException(String.format("bounds of %s are empty: [%g, %g]", thetaNames.get(thetaIndex),
          restricted.thetaLowerBound[thetaIndex], restricted.thetaUpperBound[thetaIndex]));
    }
    return restricted;
  }

  /**
   * Sets the initial values a0 and P0.
   *
   * NaN entries are estimated: each NaN entry of a0 becomes a new element of
   * theta. A fully unknown P0 of two or more states is parameterized by its
   * lower-triangular root factor, so that every P0 the map generates is
   * positive semi-definite. Any other P0 is parameterized directly: its known
   * entries are fixed literals, and each unknown entry on or below the
   * diagonal becomes a new element of theta shared with its mirror entry.
   * The NaN pattern and the known values of P0 must be symmetric, and a fully
   * known P0 must be positive semi-definite.
   *
   * @param a0 initial state mean, or null to leave it to the filter
   * @param P0 initial state covariance, or null to leave it to the filter
   * @return the updated map
   */
  public ThetaMap updateInitial(double[] a0, double[][] P0) {
    ThetaMap updated = copy();
    updated.setInitial(a0, P0);
    updated.restrict(null, null);
    updated.compress();
    return updated;
  }

  private void setInitial(double[] a0, double[][] P0) {
    int m = shape.states();
    factoredP0 = false;

    for (Parameter param: new Parameter[] { Parameter.A0, Parameter.P0 }) {
      fixed.remove(param);
      lowerBound.remove(param);
      upperBound.remove(param);
      index.remove(param);
      transformationIndex.remove(param);
    }

    double[][] a0Fixed = null;
    int[][]    a0Index = null;
    if (a0 != null) {
      if (a0.length != m) throw new DimensionMismatchException(a0.length, m);
      a0Fixed = new double[m][1];
      a0Index = new int[m][1];
      for (int i=0; i<m; i++) {
        if (Double.isNaN(a0[i])) a0Index[i][0] = addFreeTheta();
        else                     a0Fixed[i][0] = a0[i];
      }
    }

    double[][] P0Fixed = null;
    int[][]    P0Index = null;
    if (P0 != null) {
      if (P0.length != m) throw new DimensionMismatchException(P0.length, m);
      P0Fixed = new double[m][m];
      P0Index = new int[m][m];

      boolean allKnown = true, allUnknown = true;
      for (int i=0; i<m; i++) {
        if (P0[i].length != m) throw new DimensionMismatchException(P0[i].length, m);
        for (int j=0; j<m; j++) {
          boolean unknown = Double.isNaN(P0[i][j]);
          allKnown   &= !unknown;
          allUnknown &= unknown;
        }
      }

      factoredP0 = allUnknown && m > 1;
      if (factoredP0) {
        for (int i=0; i<m; i++)
          for (int j=0; j<=i; j++) P0Index[i][j] = addFreeTheta();
      } else {
        if (allKnown) {
          // rejects an asymmetric or indefinite covariance
          new CovarianceFactor(MatrixUtils.createRealMatrix(P0), CovarianceFactor.Representation.COVARIANCE_MATRIX);
        }
        for (int i=0; i<m; i++) {
          if (P0[i][i] < 0) throw new IllegalArgumentException("P0 has a negative variance at "+(i+1));
          for (int j=0; j<=i; j++) {
            if (Double.compare(P0[i][j], P0[j][i]) != 0)
              throw new IllegalArgumentException(String.format("P0 is not symmetric at (%d,%d)", i+1, j+1));
            if (Double.isNaN(P0[i][j])) {
              P0Index[i][j] = addFreeTheta();
              P0Index[j][i] = P0Index[i][j];
            } else {
              P0Fixed[i][j] = P0[i][j];
              P0Fixed[j][i] = P0[i][j];
            }
          }
        }
      }
    }

    shape = shape.withInitial(a0 == null ? null : new double[m], P0 == null ? null : new double[m][m]);
    int identity = registerIdentity();
    if (a0Fixed != null) putInitial(Parameter.A0, a0Fixed, a0Index, identity);
    if (P0Fixed != null) putInitial(Parameter.P0, P0Fixed, P0Index, identity);
  }

  private int registerIdentity() {
    transformations = transformations.with(Transform.IDENTITY);
    return transformations.indexOf(Transform.IDENTITY);
  }

  private void putInitial(Parameter param, double[][] values, int[][] psiIndex, int identity) {
    int rows = values.length, columns = values[0].length;
    int[][] transIndex = new int[rows][columns];
    double[][] lb = new double[rows][], ub = new double[rows][];
    for (int i=0; i<rows; i++) {
      lb[i] = values[i].clone();
      ub[i] = values[i].clone();
      for (int j=0; j<columns; j++) {
        if (psiIndex[i][j] == 0) continue;
        transIndex[i][j] = identity;
        lb[i][j] = Double.NEGATIVE_INFINITY;
        ub[i][j] = Double.POSITIVE_INFINITY;
      }
    }
    fixed.put(param, new double[][][] { values });
    lowerBound.put(param, new double[][][] { lb });
    upperBound.put(param, new double[][][] { ub });
    index.put(param, new int[][][] { psiIndex });
    transformationIndex.put(param, new int[][][] { transIndex });
  }

  /*
   * Adds a new element of theta and a new element of psi equal to it.
   * Returns the one-based index of the new element of psi.
   */
  private int addFreeTheta() {
    int theta = nTheta++;
    psiTransformations.add(PsiTransformation.identity(theta));
    int psi = ++nPsi;
    psiInverses.add(PsiInverse.identity(psi-1));
    thetaNames.add(uniqueName());
    return psi;
  }

  private String uniqueName() {
    int k = nTheta;
    while (thetaNames.contains("theta_"+k)) k++;
    return "theta_"+k;
  }

  /**
   * Validates the map after structural edits and reduces it to its minimal
   * form: unused elements of psi and theta are removed and the remaining ones
   * renumbered, the theta bounds cover every element of theta, and unused or
   * duplicate transforms are removed. Running it on a valid map changes
   * nothing.
   *
   * @return the validated map
   * @throws IllegalStateException if a lower bound exceeds its upper bound
   */
  public ThetaMap validate() {
    ThetaMap validated = copy();
    validated.compress();
    return validated;
  }

  private void compress() {
    List<Parameter> params = parameters();

    // fixed coefficients carry no transformation
    for (Parameter param: params) {
      double[][][] f = fixed.get(param);
      for (int s=0; s<f.length; s++)
        for (int i=0; i<f[s].length; i++)
          for (int j=0; j<f[s][i].length; j++) {
            if (index.get(param, s, i, j) == 0) transformationIndex.set(param, s, i, j, 0);
            else                                f[s][i][j] = 0;
          }
    }

    // theta bounds must cover theta
    if (thetaLowerBound.length > nTheta || thetaUpperBound.length > nTheta)
      throw new IllegalStateException("theta bounds have more elements than theta");
    if (psiInverses.size() != nTheta || thetaNames.size() != nTheta)
      throw new IllegalStateException("theta inverses or names do not match theta");
    thetaLowerBound = grow(thetaLowerBound, nTheta, Double.NEGATIVE_INFINITY);
    thetaUpperBound = grow(thetaUpperBound, nTheta, Double.POSITIVE_INFINITY);

    // remove unused elements of psi
    boolean[] psiUsed = new boolean[nPsi];
    forEachIndex(index, params, (k) -> psiUsed[k-1] = true);
    int[] psiRelabel = relabel(psiUsed);
    rewrite(index, params, psiRelabel);
    List<PsiTransformation> keptPsi = new ArrayList<>();
    for (int k=0; k<nPsi; k++) if (psiUsed[k]) keptPsi.add(psiTransformations.get(k));

    // remove elements of theta no element of psi depends on
    boolean[] thetaUsed = new boolean[nTheta];
    for (PsiTransformation pt: keptPsi)
      for (int i: pt.thetaIndexes()) thetaUsed[i] = true;
    int[] thetaRelabel = relabel(thetaUsed);

    List<PsiTransformation> newPsi      = new ArrayList<>();
    List<PsiInverse>        newInverses = new ArrayList<>();
    List<String>            newNames    = new ArrayList<>();
    int[] zeroBased = new int[nTheta];
    for (int i=0; i<nTheta; i++) zeroBased[i] = thetaRelabel[i+1]-1;
    for (PsiTransformation pt: keptPsi) newPsi.add(pt.relabel(zeroBased));

    int newTheta = 0;
    for (int i=0; i<nTheta; i++) if (thetaUsed[i]) newTheta++;
    double[] newLower = new double[newTheta];
    double[] newUpper = new double[newTheta];
    for (int i=0; i<nTheta; i++) {
      if (!thetaUsed[i]) continue;
      int t = zeroBased[i];
      PsiInverse inverse = psiInverses.get(i);
      if (inverse != null) {
        int k = psiRelabel[inverse.psiIndex()+1];
        inverse = k == 0 ? null : inverse.relabel(k-1);
      }
      newInverses.add(inverse);
      newNames.add(thetaNames.get(i));
      newLower[t] = thetaLowerBound[i];
      newUpper[t] = thetaUpperBound[i];
    }

    if (newPsi.size() != nPsi || newTheta != nTheta) {
      log.debug("compressed psi from {} to {} and theta from {} to {} elements", nPsi, newPsi.size(), nTheta, newTheta);
    }
    psiTransformations = newPsi;
    psiInverses        = newInverses;
    thetaNames         = newNames;
    thetaLowerBound    = newLower;
    thetaUpperBound    = newUpper;
    nPsi               = newPsi.size();
    nTheta             = newTheta;

    // remove unused transformations, merge duplicates onto the lowest index
    boolean[] transformUsed = new boolean[transformations.size()];
    forEachIndex(transformationIndex, params, (t) -> transformUsed[t-1] = true);
    int[] transformRelabel = new int[transformations.size()+1];
    transformations = transformations.compress(transformUsed, transformRelabel);
    rewrite(transformationIndex, params, transformRelabel);

    // make sure the lower bound is actually below the upper bound
    for (Parameter param: params) {
      double[][][] lb = lowerBound.get(param);
      double[][][] ub = upperBound.get(param);
      for (int s=0; s<lb.length; s++)
        for (int i=0; i<lb[s].length; i++)
          for (int j=0; j<lb[s][i].length; j++)
            if (lb[s][i][j] > ub[s][i][j]) {
              throw new IllegalStateException(String.format("Elements of LowerBound are greater than UpperBound: %s(%d,%d)",
                  param, i+1, j+1));
            }
    }
    for (int i=0; i<nTheta; i++)
      if (thetaLowerBound[i] > thetaUpperBound[i])
        throw new IllegalStateException("lower bound of "+thetaNames.get(i)+" is greater than its upper bound");
  }

  private static interface IndexVisitor {
    void visit(int value);
  }

  private static void forEachIndex(IndexStateSpace indexes, List<Parameter> params, IndexVisitor visitor) {
    for (Parameter param: params)
      for (int[][] slice: indexes.toArray(param))
        for (int[] row: slice)
          for (int v: row) if (v != 0) visitor.visit(v);
  }

  /*
   * New one-based label of every used one-based label; relabel[0] is 0.
   */
  private static int[] relabel(boolean[] used) {
    int[] relabel = new int[used.length+1];
    int next = 0;
    for (int k=0; k<used.length; k++) relabel[k+1] = used[k] ? ++next : 0;
    return relabel;
  }

  private static void rewrite(IndexStateSpace indexes, List<Parameter> params, int[] relabel) {
    for (Parameter param: params) {
      int[][][] values = indexes.toArray(param);
      for (int s=0; s<values.length; s++)
        for (int i=0; i<values[s].length; i++)
          for (int j=0; j<values[s][i].length; j++)
            indexes.set(param, s, i, j, relabel[values[s][i][j]]);
    }
  }

  private static double[] grow(double[] v, int length, double fill) {
    if (v.length >= length) return v;
    double[] grown = Arrays.copyOf(v, length);
    Arrays.fill(grown, v.length, length, fill);
    return grown;
  }

  /**
   * Describes which parameters each element of theta influences.
   *
   * @return for every element of theta, a comma-separated list of parameter names
   */
  public List<String> paramString() {
    List<String> descriptions = new ArrayList<>();
    for (int t=0; t<nTheta; t++) {
      List<String> influenced = new ArrayList<>();
      for (Parameter param: parameters()) {
        boolean found = false;
        for (int[][] slice: index.toArray(param)) {
          for (int[] row: slice)
            for (int k: row)
              if (k != 0 && psiTransformations.get(k-1).reads(t)) found = true;
        }
        if (found) influenced.add(param.label());
      }
      descriptions.add(String.join(", ", influenced));
    }
    return descriptions;
  }

  /*
   * Helpers
   */

  double[] constructPsi(double[] theta) {
    double[] psi = new double[nPsi];
    for (int k=0; k<nPsi; k++) psi[k] = psiTransformations.get(k).value(theta);
    return psi;
  }

  /*
   * Fixed values, with the free coefficients replaced by transformations of psi.
   */
  private double[][][] constructParamMat(double[] psi, Parameter param) {
    double[][][] constructed = copy(fixed.get(param));
    for (int s=0; s<constructed.length; s++)
      for (int i=0; i<constructed[s].length; i++)
        for (int j=0; j<constructed[s][i].length; j++) {
          int k = index.get(param, s, i, j);
          if (k == 0) continue;
          constructed[s][i][j] = transformations.get(transformationIndex.get(param, s, i, j)).apply(psi[k-1]);
        }
    return constructed;
  }

  private boolean isFree(Parameter param) {
    int[] probe = { 0 };
    forEachIndex(index, Collections.singletonList(param), (k) -> probe[0]++);
    return probe[0] > 0;
  }

  private List<Parameter> parameters() {
    List<Parameter> params = new ArrayList<>(Parameter.SYSTEM);
    if (explicitA0()) params.add(Parameter.A0);
    if (explicitP0()) params.add(Parameter.P0);
    return params;
  }

  private static List<String> defaultNames(int count) {
    List<String> names = new ArrayList<>();
    for (int i=1; i<=count; i++) names.add("theta_"+i);
    return names;
  }

  private static EnumMap<Parameter, double[][][]> arrays(StateSpace system) {
    EnumMap<Parameter, double[][][]> arrays = new EnumMap<>(Parameter.class);
    for (Map.Entry<Parameter, ParameterMatrix> e: system.parameters().entrySet()) arrays.put(e.getKey(), e.getValue().toArray());
    return arrays;
  }

  private static EnumMap<Parameter, double[][][]> copy(EnumMap<Parameter, double[][][]> arrays) {
    EnumMap<Parameter, double[][][]> copy = new EnumMap<>(Parameter.class);
    for (Map.Entry<Parameter, double[][][]> e: arrays.entrySet()) copy.put(e.getKey(), copy(e.getValue()));
    return copy;
  }

  private static double[][][] copy(double[][][] a) {
    double[][][] b = new double[a.length][][];
    for (int s=0; s<a.length; s++) {
      b[s] = new double[a[s].length][];
      for (int i=0; i<a[s].length; i++) b[s][i] = a[s][i].clone();
    }
    return b;
  }

  private StateSpace toStateSpace(EnumMap<Parameter, double[][][]> values) {
    Map<Parameter, ParameterMatrix> params = new EnumMap<>(Parameter.class);
    for (Map.Entry<Parameter, double[][][]> e: values.entrySet())
      params.put(e.getKey(), shape.get(e.getKey()).withSlices(e.getValue()));
    return new StateSpace(params);
  }

  private ThetaMap copy() {
    ThetaMap copy = new ThetaMap();
    copy.shape               = shape;
    copy.fixed               = copy(fixed);
    copy.index               = index.copy();
    copy.transformationIndex = transformationIndex.copy();
    copy.transformations     = transformations;
    copy.psiTransformations  = new ArrayList<>(psiTransformations);
    copy.psiInverses         = new ArrayList<>(psiInverses);
    copy.thetaNames          = new ArrayList<>(thetaNames);
    copy.thetaLowerBound     = thetaLowerBound.clone();
    copy.thetaUpperBound     = thetaUpperBound.clone();
    copy.lowerBound          = copy(lowerBound);
    copy.upperBound          = copy(upperBound);
    copy.inverseSettings     = inverseSettings;
    copy.nTheta              = nTheta;
    copy.nPsi                = nPsi;
    copy.factoredP0          = factoredP0;
    return copy;
  }

  /*
   * Accessors
   */

  /**
   * @return a copy of this map that recovers theta numerically with the given settings
   */
  public ThetaMap withInverseSettings(InverseSettings settings) {
    ThetaMap copy = copy();
    copy.inverseSettings = settings;
    return copy;
  }

  public InverseSettings inverseSettings() { return inverseSettings; }

  public int nTheta() { return nTheta; }

  public int nPsi() { return nPsi; }

  public boolean explicitA0() { return fixed.containsKey(Parameter.A0); }

  public boolean explicitP0() { return fixed.containsKey(Parameter.P0); }

  public List<String> thetaNames() { return Collections.unmodifiableList(thetaNames); }

  public double[] thetaLowerBound() { return thetaLowerBound.clone(); }

  public double[] thetaUpperBound() { return thetaUpperBound.clone(); }

  /**
   * @return lower bounds of every coefficient; for a factored P0 they bound its root factor
   */
  public StateSpace lowerBound() { return toStateSpace(lowerBound); }

  /**
   * @return upper bounds of every coefficient; for a factored P0 they bound its root factor
   */
  public StateSpace upperBound() { return toStateSpace(upperBound); }

  public IndexSystem indexSystem() {
    return new IndexSystem(toStateSpace(fixed), index.copy(), transformationIndex.copy());
  }

  public TransformRegistry transformations() { return transformations; }

  public List<PsiTransformation> psiTransformations() { return Collections.unmodifiableList(psiTransformations); }

  public List<PsiInverse> psiInverses() { return Collections.unmodifiableList(psiInverses); }

  @Override
  public String toString() {
    StringBuilder s = new StringBuilder();
    s.append(String.format("ThetaMap(nTheta=%d, nPsi=%d, transforms=%s)", nTheta, nPsi, transformations));
    List<String> influenced = paramString();
    for (int i=0; i<nTheta; i++) {
      s.append(String.format("%n  %-10s [%g, %g] %s", thetaNames.get(i), thetaLowerBound[i], thetaUpperBound[i], influenced.get(i)));
    }
    return s.toString();
  }
}
