package sivantoledo.statespace;

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A root factor F of a covariance matrix C, C = F*F'.
 * 
 * The factor is the lower-triangular Cholesky factor when C is positive 
 * definite. A positive semi-definite C (for example, one with a zero
 * variance) has no Cholesky factor; in that case the factor is the 
 * symmetric square root V*sqrt(D)*V' from the eigendecomposition.
 * 
 * @author Sivan Toledo
 */
public class CovarianceFactor {
  
  private final static Logger log = LogManager.getLogger();

  public static enum Representation {
    COVARIANCE_MATRIX, // C
    FACTOR             // F such that F*F' = C
  }
  
  private final static double SYMMETRY_THRESHOLD   = 1e-10;
  private final static double POSITIVITY_THRESHOLD = 1e-10;

  private final RealMatrix F;
  private final boolean    lowerTriangular;
  
  public CovarianceFactor(RealMatrix v, Representation rep) {
    switch (rep) {
    case FACTOR:
      F = v.copy();
      lowerTriangular = isLowerTriangular(F);
      break;
    case COVARIANCE_MATRIX:
    default:
      RealMatrix factor;
      boolean    triangular;
      try {
        CholeskyDecomposition chol = new CholeskyDecomposition(v, SYMMETRY_THRESHOLD, 0.0);
        factor = chol.getL();
        triangular = true;
      } catch (NonPositiveDefiniteMatrixException npdme) {
        log.debug("covariance matrix is not positive definite, using its symmetric square root");
        factor = symmetricRoot(v);
        triangular = false;
      }
      F = factor;
      lowerTriangular = triangular;
      break;
    }
  }
  
  /**
   * The lower-triangular Cholesky factor of a positive-definite covariance.
   * 
   * @param C a covariance matrix
   * @return L, lower triangular with a positive diagonal, L*L' = C
   * @throws NonPositiveDefiniteMatrixException if C is not positive definite
   */
  public static RealMatrix cholesky(RealMatrix C) {
    return new CholeskyDecomposition(C, SYMMETRY_THRESHOLD, 0.0).getL();
  }
  
  private static RealMatrix symmetricRoot(RealMatrix v) {
    if (!MatrixUtils.isSymmetric(v, SYMMETRY_THRESHOLD)) 
      throw new NonSymmetricMatrixException(0, 1, SYMMETRY_THRESHOLD);
    
    EigenDecomposition eig = new EigenDecomposition(v);
    double[] eigenvalues = eig.getRealEigenvalues();
    double scale = 1.0;
    for (double e: eigenvalues) scale = Math.max(scale, Math.abs(e));
    
    double[] roots = new double[eigenvalues.length];
    for (int i=0; i<eigenvalues.length; i++) {
      if (eigenvalues[i] < -POSITIVITY_THRESHOLD * scale) {
        throw new NonPositiveDefiniteMatrixException(eigenvalues[i], i, POSITIVITY_THRESHOLD * scale);
      }
      roots[i] = Math.sqrt(Math.max(eigenvalues[i], 0.0));
    }
    RealMatrix V = eig.getV();
    return V.multiply(MatrixUtils.createRealDiagonalMatrix(roots)).multiply(V.transpose());
  }
  
  private static boolean isLowerTriangular(RealMatrix A) {
    for (int i=0; i<A.getRowDimension(); i++)
      for (int j=i+1; j<A.getColumnDimension(); j++)
        if (A.getEntry(i, j) != 0) return false;
    return true;
  }
  
  public int dimension() { return F.getColumnDimension(); }
  
  public boolean isLowerTriangular() { return lowerTriangular; }
  
  /**
   * @return a copy of the factor F
   */
  public RealMatrix factor() { return F.copy(); }

  /**
   * @return F*F', exactly symmetric
   */
  public RealMatrix covariance() {
    return product(F);
  }
  
  /**
   * Computes F*F' and copies the lower triangle to the upper one, so that 
   * the result is exactly symmetric. 
   */
  public static RealMatrix product(RealMatrix F) {
    RealMatrix C = F.multiply(F.transpose());
    for (int i=0; i<C.getRowDimension(); i++)
      for (int j=i+1; j<C.getColumnDimension(); j++)
        C.setEntry(i, j, C.getEntry(j, i));
    return C;
  }

  @Override
  public String toString() { return "F="+Matrix.toString(F.getData(),"%.3e "); };
}
