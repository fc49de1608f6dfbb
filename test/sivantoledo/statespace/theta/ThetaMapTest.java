package sivantoledo.statespace.theta;

import java.util.Arrays;
import java.util.Collections;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import sivantoledo.statespace.Parameter;
import sivantoledo.statespace.ParameterMatrix;
import sivantoledo.statespace.StateSpace;

class ThetaMapTest {

  static StateSpace localLevel(double H, double T, double Q) {
    return StateSpace.of(new double[][] { { 1 } }, new double[] { 0 }, new double[][] { { H } },
        new double[][] { { T } }, new double[] { 0 }, new double[][] { { 1 } }, new double[][] { { Q } });
  }

  /*
   * Two states observed through their sum, diagonal T.
   */
  static StateSpace twoStates() {
    return StateSpace.of(new double[][] { { 1, 1 } }, new double[] { 0 }, new double[][] { { 1 } },
        new double[2][2], new double[2], new double[][] { { 1, 0 }, { 0, 1 } }, new double[][] { { 1, 0 }, { 0, 1 } });
  }

  static StateSpace diagonalT(double t1, double t2) {
    return twoStates().with(Parameter.T, ParameterMatrix.of(new double[][] { { t1, 0 }, { 0, t2 } }));
  }

  private static double entry(StateSpace ss, Parameter param, int i, int j) {
    return ss.get(param).get(i, j);
  }

  @Test
  void freeEntriesBecomeTheta() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(localLevel(Double.NaN, Double.NaN, Double.NaN)));
    Assertions.assertEquals(3, map.nTheta());
    Assertions.assertEquals(3, map.nPsi());
    Assertions.assertEquals(Arrays.asList("theta_1", "theta_2", "theta_3"), map.thetaNames());
    Assertions.assertEquals(Arrays.asList("H", "T", "Q"), map.paramString());
    Assertions.assertFalse(map.explicitA0());
    Assertions.assertFalse(map.explicitP0());
  }

  @Test
  void variancesArePositive() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(localLevel(Double.NaN, Double.NaN, Double.NaN)));
    IndexSystem structure = map.indexSystem();

    Transform h = map.transformations().get(structure.transformationIndex().get(Parameter.H, 0, 0, 0));
    Transform t = map.transformations().get(structure.transformationIndex().get(Parameter.T, 0, 0, 0));
    Assertions.assertEquals(Transform.Kind.EXP, h.kind());
    Assertions.assertEquals(ThetaMap.VARIANCE_FLOOR, h.lower(), 0.0);
    Assertions.assertSame(Transform.IDENTITY, t);
    Assertions.assertEquals(ThetaMap.VARIANCE_FLOOR, entry(map.lowerBound(), Parameter.Q, 0, 0), 0.0);

    StateSpace ss = map.theta2system(new double[] { -50, 0, -50 });
    Assertions.assertTrue(entry(ss, Parameter.H, 0, 0) > 0);
    Assertions.assertTrue(entry(ss, Parameter.Q, 0, 0) > 0);
  }

  @Test
  void systemRoundTrip() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(localLevel(Double.NaN, Double.NaN, Double.NaN)));
    StateSpace ss = localLevel(2, 0.5, 0.3);

    double[] theta = map.system2theta(ss);
    Assertions.assertEquals(0.5, theta[1], 0.0);

    StateSpace back = map.theta2system(theta);
    Assertions.assertEquals(2,   entry(back, Parameter.H, 0, 0), 1e-12);
    Assertions.assertEquals(0.5, entry(back, Parameter.T, 0, 0), 1e-12);
    Assertions.assertEquals(0.3, entry(back, Parameter.Q, 0, 0), 1e-12);
    Assertions.assertEquals(1,   entry(back, Parameter.Z, 0, 0), 0.0);
  }

  @Test
  void thetaRoundTrip() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(localLevel(Double.NaN, Double.NaN, Double.NaN)));
    double[] theta = { -0.7, 0.95, 1.3 };
    Assertions.assertArrayEquals(theta, map.system2theta(map.theta2system(theta)), 1e-10);
  }

  @Test
  void rejectsBadTheta() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(localLevel(Double.NaN, Double.NaN, 1)));
    Assertions.assertThrows(DimensionMismatchException.class, () -> map.theta2system(new double[] { 1 }));
    Assertions.assertThrows(IllegalArgumentException.class, () -> map.theta2system(new double[] { 1, Double.NaN }));
  }

  @Test
  void reportsBoundViolations() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(localLevel(Double.NaN, Double.NaN, Double.NaN)));

    BoundViolationException e = Assertions.assertThrows(BoundViolationException.class,
        () -> map.system2theta(localLevel(0, 0.5, 1)));
    Assertions.assertEquals(BoundViolationException.Side.LOWER, e.side());
    Assertions.assertEquals(Collections.singletonList("H"), e.offenders());

    e = Assertions.assertThrows(BoundViolationException.class, () -> map.system2theta(localLevel(-1, 0.5, -1)));
    Assertions.assertEquals(Arrays.asList("H", "Q"), e.offenders());
  }

  @Test
  void rejectsNonConformingSystem() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(localLevel(Double.NaN, Double.NaN, Double.NaN)));
    StateSpace varying = localLevel(1, 0.5, 1).with(Parameter.T,
        ParameterMatrix.varying(new double[][][] { { { 0.5 } }, { { 0.6 } } }, new int[] { 0, 1 }));
    Assertions.assertThrows(IllegalArgumentException.class, () -> map.system2theta(varying));
    Assertions.assertThrows(DimensionMismatchException.class, () -> map.system2theta(twoStates()));
  }

  @Test
  void symmetricCovariance() {
    StateSpace shape = StateSpace.of(new double[][] { { 1 }, { 1 } }, new double[2],
        new double[][] { { Double.NaN, Double.NaN }, { Double.NaN, Double.NaN } },
        new double[][] { { 0.9 } }, new double[1], new double[][] { { 1 } }, new double[][] { { 1 } });
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(shape));
    Assertions.assertEquals(3, map.nTheta());

    StateSpace ss = map.theta2system(new double[] { 0.1, 0.2, 0.3 });
    Assertions.assertEquals(0.2, entry(ss, Parameter.H, 1, 0), 0.0);
    Assertions.assertEquals(0.2, entry(ss, Parameter.H, 0, 1), 0.0);
    Assertions.assertEquals(Math.exp(0.1) + ThetaMap.VARIANCE_FLOOR, entry(ss, Parameter.H, 0, 0), 1e-15);
    Assertions.assertTrue(ss.isSymmetric());

    StateSpace target = shape.with(Parameter.H, ParameterMatrix.of(new double[][] { { 2, 0.5 }, { 0.5, 1 } }));
    StateSpace back = map.theta2system(map.system2theta(target));
    Assertions.assertEquals(0.5, entry(back, Parameter.H, 0, 1), 1e-12);
    Assertions.assertEquals(1,   entry(back, Parameter.H, 1, 1), 1e-12);

    StateSpace asymmetric = shape.with(Parameter.H, ParameterMatrix.of(new double[][] { { 2, 0.5 }, { 0.4, 1 } }));
    Assertions.assertThrows(InconsistentSystemException.class, () -> map.system2theta(asymmetric));
  }

  @Test
  void asymmetricTemplateIsRejected() {
    StateSpace shape = StateSpace.of(new double[][] { { 1 }, { 1 } }, new double[2],
        new double[][] { { Double.NaN, 0 }, { Double.NaN, Double.NaN } },
        new double[][] { { 0.9 } }, new double[1], new double[][] { { 1 } }, new double[][] { { 1 } });
    Assertions.assertThrows(IllegalArgumentException.class, () -> ThetaMap.estimation(StateSpaceTemplate.from(shape)));
  }

  @Test
  void namedVariableIsShared() {
    StateSpaceTemplate template = StateSpaceTemplate.from(twoStates())
        .set(Parameter.T, 0, 0, Entry.free("rho"))
        .set(Parameter.T, 1, 1, Entry.free("rho"));
    ThetaMap map = ThetaMap.estimation(template);
    Assertions.assertEquals(1, map.nTheta());
    Assertions.assertEquals(1, map.nPsi());
    Assertions.assertEquals(Collections.singletonList("rho"), map.thetaNames());

    StateSpace ss = map.theta2system(new double[] { 0.8 });
    Assertions.assertEquals(0.8, entry(ss, Parameter.T, 0, 0), 0.0);
    Assertions.assertEquals(0.8, entry(ss, Parameter.T, 1, 1), 0.0);
    Assertions.assertEquals(0.0, entry(ss, Parameter.T, 0, 1), 0.0);

    Assertions.assertArrayEquals(new double[] { 0.5 }, map.system2theta(diagonalT(0.5, 0.5)), 0.0);
    InconsistentSystemException e = Assertions.assertThrows(InconsistentSystemException.class,
        () -> map.system2theta(diagonalT(0.5, 0.6)));
    Assertions.assertEquals(0, e.psiIndex());
  }

  @Test
  void namedVariablesComeFirst() {
    StateSpaceTemplate template = StateSpaceTemplate.from(twoStates()
        .with(Parameter.H, ParameterMatrix.of(new double[][] { { Double.NaN } }))
        .with(Parameter.T, ParameterMatrix.of(new double[][] { { 0, 0 }, { 0, Double.NaN } })))
        .set(Parameter.T, 0, 0, Entry.free("zeta"));
    ThetaMap map = ThetaMap.estimation(template);
    Assertions.assertEquals(Arrays.asList("zeta", "theta_2", "theta_3"), map.thetaNames());
    Assertions.assertEquals(Arrays.asList("T", "H", "T"), map.paramString());

    StateSpace ss = map.theta2system(new double[] { 0.1, 0, 0.3 });
    Assertions.assertEquals(0.1, entry(ss, Parameter.T, 0, 0), 0.0);
    Assertions.assertEquals(0.3, entry(ss, Parameter.T, 1, 1), 0.0);
  }

  @Test
  void expressionWithClosedFormInverse() {
    StateSpaceTemplate template = StateSpaceTemplate.from(twoStates())
        .set(Parameter.T, 0, 0, Entry.expression("2*phi", Collections.singletonList("phi"), (x) -> 2 * x[0], (y) -> y / 2));
    ThetaMap map = ThetaMap.estimation(template);
    Assertions.assertEquals(1, map.nTheta());
    Assertions.assertNotNull(map.psiInverses().get(0));

    Assertions.assertEquals(0.8, entry(map.theta2system(new double[] { 0.4 }), Parameter.T, 0, 0), 0.0);
    Assertions.assertEquals(0.4, map.system2theta(diagonalT(0.8, 0))[0], 1e-15);
  }

  @Test
  void atomicVariablePreferredForInverse() {
    StateSpaceTemplate template = StateSpaceTemplate.from(twoStates())
        .set(Parameter.T, 0, 0, Entry.expression("phi^2", Collections.singletonList("phi"), (x) -> x[0] * x[0]))
        .set(Parameter.T, 1, 1, Entry.free("phi"));
    ThetaMap map = ThetaMap.estimation(template);
    Assertions.assertEquals(2, map.nPsi());

    Assertions.assertEquals(-0.5, map.system2theta(diagonalT(0.25, -0.5))[0], 0.0);
  }

  @Test
  void expressionsWithoutInverseAreSolvedNumerically() {
    StateSpaceTemplate template = StateSpaceTemplate.from(twoStates())
        .set(Parameter.T, 0, 0, Entry.expression("a+b", Arrays.asList("a", "b"), (x) -> x[0] + x[1]))
        .set(Parameter.T, 1, 1, Entry.expression("a-b", Arrays.asList("a", "b"), (x) -> x[0] - x[1]));
    ThetaMap map = ThetaMap.estimation(template);
    Assertions.assertEquals(Arrays.asList("a", "b"), map.thetaNames());
    Assertions.assertNull(map.psiInverses().get(0));
    Assertions.assertNull(map.psiInverses().get(1));

    double[] theta = map.system2theta(diagonalT(0.4, 0.2));
    Assertions.assertArrayEquals(new double[] { 0.3, 0.1 }, theta, 1e-8);

    StateSpace back = map.theta2system(theta);
    Assertions.assertEquals(0.4, entry(back, Parameter.T, 0, 0), 1e-8);
    Assertions.assertEquals(0.2, entry(back, Parameter.T, 1, 1), 1e-8);
  }

  @Test
  void timeVaryingSlicesAreSeparateTheta() {
    StateSpace shape = localLevel(1, 0, 1).with(Parameter.T,
        ParameterMatrix.varying(new double[][][] { { { Double.NaN } }, { { Double.NaN } } }, new int[] { 0, 1, 1 }));
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(shape));
    Assertions.assertEquals(2, map.nTheta());

    StateSpace ss = map.theta2system(new double[] { 0.1, 0.2 });
    Assertions.assertEquals(3, ss.periods());
    Assertions.assertEquals(0.1, ss.get(Parameter.T).at(0).getEntry(0, 0), 0.0);
    Assertions.assertEquals(0.2, ss.get(Parameter.T).at(2).getEntry(0, 0), 0.0);
    Assertions.assertArrayEquals(new double[] { 0.1, 0.2 }, map.system2theta(ss), 0.0);
  }

  @Test
  void allEstimatesEveryCoefficient() {
    ThetaMap map = ThetaMap.all(localLevel(1, 0.5, 1));
    Assertions.assertEquals(7, map.nTheta());
    Assertions.assertEquals(Arrays.asList("Z", "d", "H", "T", "c", "R", "Q"), map.paramString());
  }

  @Test
  void thetaRestrictions() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(localLevel(1, Double.NaN, 1)));
    Assertions.assertArrayEquals(new double[] { 3 }, map.restrictTheta(new double[] { 3 }), 0.0);

    ThetaMap bounded = map.addStructuralRestriction("theta_1", 0.0, 1.0);
    Assertions.assertEquals(Double.NEGATIVE_INFINITY, map.thetaLowerBound()[0], 0.0);
    Assertions.assertEquals(0.0, bounded.thetaLowerBound()[0], 0.0);

    double[] thetaU = bounded.unrestrictTheta(new double[] { 0.3 });
    Assertions.assertEquals(0.3, bounded.restrictTheta(thetaU)[0], 1e-12);
    Assertions.assertEquals(0.5, bounded.restrictTheta(new double[] { 0 })[0], 0.0);
    Assertions.assertEquals(0.25, bounded.thetaUthetaGrad(new double[] { 0 }).getEntry(0, 0), 1e-15);

    BoundViolationException e = Assertions.assertThrows(BoundViolationException.class,
        () -> bounded.unrestrictTheta(new double[] { 1.5 }));
    Assertions.assertEquals(BoundViolationException.Side.UPPER, e.side());
    Assertions.assertEquals(Collections.singletonList("theta_1"), e.offenders());

    ThetaMap upper = bounded.addStructuralRestriction(0, null, 0.5);
    Assertions.assertEquals(0.0, upper.thetaLowerBound()[0], 0.0);
    Assertions.assertEquals(0.5, upper.thetaUpperBound()[0], 0.0);

    Assertions.assertThrows(IllegalArgumentException.class, () -> map.addStructuralRestriction("nope", 0.0, 1.0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> map.addStructuralRestriction(0, 1.0, 0.0));
    Assertions.assertThrows(DimensionMismatchException.class, () -> map.restrictTheta(new double[2]));
  }

  @Test
  void thetaJustOutsideItsBoundMapsOntoTheBound() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(localLevel(1, Double.NaN, 1)));

    ThetaMap positive = map.addStructuralRestriction("theta_1", 0.0, null);
    double thetaU = positive.unrestrictTheta(new double[] { -1e-17 })[0];
    Assertions.assertFalse(Double.isNaN(thetaU));
    Assertions.assertEquals(Double.NEGATIVE_INFINITY, thetaU, 0.0);
    Assertions.assertEquals(0.0, positive.restrictTheta(new double[] { thetaU })[0], 0.0);

    ThetaMap negative = map.addStructuralRestriction("theta_1", null, 0.0);
    Assertions.assertFalse(Double.isNaN(negative.unrestrictTheta(new double[] { 1e-17 })[0]));

    ThetaMap interval = map.addStructuralRestriction("theta_1", 0.0, 1.0);
    Assertions.assertFalse(Double.isNaN(interval.unrestrictTheta(new double[] { -1e-17 })[0]));
  }

  @Test
  void boundedThetaIsUsedByTheNumericInverse() {
    StateSpaceTemplate template = StateSpaceTemplate.from(twoStates())
        .set(Parameter.T, 0, 0, Entry.expression("a^2", Collections.singletonList("a"), (x) -> x[0] * x[0]));
    ThetaMap map = ThetaMap.estimation(template)
        .addStructuralRestriction("a", null, 0.0)
        .withInverseSettings(InverseSettings.DEFAULT.withRestarts(5));
    Assertions.assertEquals(-0.5, map.system2theta(diagonalT(0.25, 0))[0], 1e-6);
  }
}
