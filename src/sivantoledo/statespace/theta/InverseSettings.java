package sivantoledo.statespace.theta;

/**
 * Settings of the numeric recovery of theta from psi.
 * 
 * The solver is started from a random point drawn from a generator seeded
 * with randomSeed; with restarts larger than one, it is started again from 
 * fresh draws until the residual drops below the tolerance, and the best 
 * solution is kept.
 * 
 * @author Sivan Toledo
 */
public final class InverseSettings {
  
  public static final InverseSettings DEFAULT = new InverseSettings(10000, 10000, 0x5eed1eafL, 1, 1e-4);

  private final int    maxFunctionEvaluations; // per element of theta being solved for
  private final int    maxIterations;
  private final long   randomSeed;
  private final int    restarts;
  private final double tolerance;
  
  public InverseSettings(int maxFunctionEvaluations, int maxIterations, long randomSeed, int restarts, double tolerance) {
    if (maxFunctionEvaluations < 1 || maxIterations < 1) throw new IllegalArgumentException("solver limits must be positive");
    if (restarts < 1) throw new IllegalArgumentException("at least one solver start is required");
    if (!(tolerance > 0)) throw new IllegalArgumentException("tolerance must be positive");
    this.maxFunctionEvaluations = maxFunctionEvaluations;
    this.maxIterations          = maxIterations;
    this.randomSeed             = randomSeed;
    this.restarts               = restarts;
    this.tolerance              = tolerance;
  }
  
  public int    maxFunctionEvaluations() { return maxFunctionEvaluations; }
  public int    maxIterations()          { return maxIterations; }
  public long   randomSeed()             { return randomSeed; }
  public int    restarts()               { return restarts; }
  public double tolerance()              { return tolerance; }
  
  public InverseSettings withRandomSeed(long seed) {
    return new InverseSettings(maxFunctionEvaluations, maxIterations, seed, restarts, tolerance);
  }

  public InverseSettings withRestarts(int count) {
    return new InverseSettings(maxFunctionEvaluations, maxIterations, randomSeed, count, tolerance);
  }

  public InverseSettings withLimits(int functionEvaluations, int iterations) {
    return new InverseSettings(functionEvaluations, iterations, randomSeed, restarts, tolerance);
  }
  
  @Override
  public String toString() {
    return String.format("InverseSettings(maxFunctionEvaluations=%d, maxIterations=%d, randomSeed=%d, restarts=%d, tolerance=%.1e)",
        maxFunctionEvaluations, maxIterations, randomSeed, restarts, tolerance);
  }
}
