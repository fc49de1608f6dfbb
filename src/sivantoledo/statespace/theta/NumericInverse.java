package sivantoledo.statespace.theta;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import sivantoledo.statespace.Matrix;

/**
 * Recovers the elements of theta that have no closed-form inverse from psi.
 * 
 * Elements of theta are codetermined when some element of psi reads both; the 
 * transitive closure of this relation splits theta into independent 
 * components. Each component is solved as a bounded nonlinear least-squares 
 * problem, min ||psiTransformation(theta) - psi||^2, by Levenberg-Marquardt in 
 * the unconstrained space of the bounded transforms of theta.
 * 
 * @author Sivan Toledo
 */
public class NumericInverse {
  
  private final static Logger log = LogManager.getLogger();
  
  private final List<PsiTransformation> psiTransformations;
  private final double[]                lowerBound;
  private final double[]                upperBound;
  private final InverseSettings         settings;
  
  public NumericInverse(List<PsiTransformation> psiTransformations, double[] lowerBound, double[] upperBound, InverseSettings settings) {
    this.psiTransformations = psiTransformations;
    this.lowerBound         = lowerBound;
    this.upperBound         = upperBound;
    this.settings           = settings;
  }
  
  /**
   * Groups the elements of theta into codetermined components. 
   * 
   * @param nTheta number of elements of theta
   * @param psiTransformations the definitions of psi
   * @return the components, each sorted, ordered by their smallest element
   */
  public static List<int[]> components(int nTheta, List<PsiTransformation> psiTransformations) {
    int[] parent = new int[nTheta];
    for (int i=0; i<nTheta; i++) parent[i] = i;
    
    for (PsiTransformation pt: psiTransformations) {
      int[] inx = pt.thetaIndexes();
      for (int i=1; i<inx.length; i++) union(parent, inx[0], inx[i]);
    }
    
    List<int[]> components = new ArrayList<>();
    int[] componentOf = new int[nTheta];
    Arrays.fill(componentOf, -1);
    List<List<Integer>> members = new ArrayList<>();
    for (int i=0; i<nTheta; i++) {
      int root = find(parent, i);
      if (componentOf[root] < 0) {
        componentOf[root] = members.size();
        members.add(new ArrayList<>());
      }
      members.get(componentOf[root]).add(i);
    }
    for (List<Integer> m: members) components.add(m.stream().mapToInt(Integer::intValue).toArray());
    return components;
  }
  
  private static int find(int[] parent, int i) {
    while (parent[i] != i) {
      parent[i] = parent[parent[i]];
      i = parent[i];
    }
    return i;
  }
  
  private static void union(int[] parent, int i, int j) {
    int ri = find(parent, i);
    int rj = find(parent, j);
    if (ri < rj) parent[rj] = ri;
    else         parent[ri] = rj;
  }
  
  /**
   * Fills the NaN elements of theta.
   * 
   * @param theta known elements, NaN for the elements to recover; overwritten
   * @param psi the target psi vector
   * @return the largest absolute psi residual over the components that were solved
   */
  public double recover(double[] theta, double[] psi) {
    Random random = new Random(settings.randomSeed());
    double worst  = 0;
    for (int[] component: components(theta.length, psiTransformations)) {
      int[] unknown = Arrays.stream(component).filter( (i) -> Double.isNaN(theta[i]) ).toArray();
      if (unknown.length == 0) continue;
      double residual = solve(theta, psi, component, unknown, random);
      if (residual > settings.tolerance()) {
        log.warn("Bad numeric inverse from psi to theta{}: residual {}", 
            Arrays.toString(Arrays.stream(unknown).map( (i) -> i+1 ).toArray()), residual);
      }
      worst = Math.max(worst, residual);
    }
    return worst;
  }
  
  private double solve(double[] theta, double[] psi, int[] component, int[] unknown, Random random) {
    List<Integer> rows = new ArrayList<>();
    for (int j=0; j<psiTransformations.size(); j++) {
      for (int i: unknown) {
        if (psiTransformations.get(j).reads(i)) { rows.add(j); break; }
      }
    }
    
    Transform[] bounded = new Transform[unknown.length];
    for (int k=0; k<unknown.length; k++) bounded[k] = Transform.bounded(lowerBound[unknown[k]], upperBound[unknown[k]]);
    
    // Levenberg-Marquardt needs at least as many residuals as unknowns; the padding rows are identically zero.
    int nR = Math.max(rows.size(), unknown.length);
    double[] target = new double[nR];
    for (int r=0; r<rows.size(); r++) target[r] = psi[rows.get(r)];
    
    Candidate best = new Candidate();
    MultivariateJacobianFunction model = (point) -> {
      double[] value = evaluate(theta, unknown, bounded, rows, nR, point.toArray());
      best.offer(point.toArray(), value, target);
      return new Pair<RealVector, RealMatrix>(MatrixUtils.createRealVector(value), 
          jacobian(theta, unknown, bounded, rows, nR, point.toArray(), value));
    };
    
    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer();
    
    for (int start=0; start<settings.restarts(); start++) {
      double[] u0 = new double[unknown.length];
      for (int k=0; k<u0.length; k++) u0[k] = random.nextGaussian();
      
      LeastSquaresProblem problem = new LeastSquaresBuilder().
          start(u0).
          target(target).
          model(model).
          lazyEvaluation(false).
          maxEvaluations(settings.maxFunctionEvaluations() * unknown.length).
          maxIterations(settings.maxIterations()).
          build();
      try {
        LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
        double[] u = optimum.getPoint().toArray();
        best.offer(u, evaluate(theta, unknown, bounded, rows, nR, u), target);
      } catch (MathIllegalStateException mise) {
        log.warn("numeric inverse stopped early ({}); keeping the best point found", mise.getMessage());
      }
      if (best.residual <= settings.tolerance()) break;
    }
    
    if (best.point == null) {
      throw new IllegalStateException("numeric inverse did not evaluate any point for theta component "+Arrays.toString(component));
    }
    for (int k=0; k<unknown.length; k++) theta[unknown[k]] = bounded[k].apply(best.point[k]);
    return best.residual;
  }
  
  private double[] evaluate(double[] theta, int[] unknown, Transform[] bounded, List<Integer> rows, int nR, double[] u) {
    double[] candidate = theta.clone();
    for (int k=0; k<unknown.length; k++) candidate[unknown[k]] = bounded[k].apply(u[k]);
    double[] value = new double[nR];
    for (int r=0; r<rows.size(); r++) value[r] = psiTransformations.get(rows.get(r)).value(candidate);
    return value;
  }
  
  /*
   * Forward differences, with a step relative to the magnitude of each variable.
   */
  private RealMatrix jacobian(double[] theta, int[] unknown, Transform[] bounded, List<Integer> rows, int nR, double[] u, double[] value) {
    double[][] J = new double[nR][unknown.length];
    for (int k=0; k<unknown.length; k++) {
      double[] shifted = u.clone();
      double h = 1e-7 * Math.max(1.0, Math.abs(u[k]));
      shifted[k] += h;
      double[] diff = evaluate(theta, unknown, bounded, rows, nR, shifted);
      for (int r=0; r<nR; r++) J[r][k] = (diff[r] - value[r]) / h;
    }
    return MatrixUtils.createRealMatrix(J);
  }
  
  private static class Candidate {
    double[] point    = null;
    double   residual = Double.POSITIVE_INFINITY;
    
    void offer(double[] u, double[] value, double[] target) {
      double[] r = new double[value.length];
      for (int i=0; i<r.length; i++) r[i] = value[i] - target[i];
      double max = Matrix.normMax(r);
      if (max < residual) {
        point    = u.clone();
        residual = max;
      }
    }
  }
}
