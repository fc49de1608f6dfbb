package sivantoledo.statespace.theta;

import java.util.Arrays;
import java.util.Collections;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import sivantoledo.statespace.Parameter;
import sivantoledo.statespace.StateSpace;

class ThetaMapInitialTest {

  private static final double NaN = Double.NaN;

  private static ThetaMap estimateT() {
    return ThetaMap.estimation(StateSpaceTemplate.from(ThetaMapTest.localLevel(1, NaN, 1)));
  }

  @Test
  void freeInitialValues() {
    ThetaMap map = estimateT().updateInitial(new double[] { NaN }, new double[][] { { NaN } });
    Assertions.assertTrue(map.explicitA0());
    Assertions.assertTrue(map.explicitP0());
    Assertions.assertEquals(3, map.nTheta());
    Assertions.assertEquals(Arrays.asList("theta_1", "theta_2", "theta_3"), map.thetaNames());
    Assertions.assertEquals(Arrays.asList("T", "a0", "P0"), map.paramString());

    StateSpace ss = map.theta2system(new double[] { 0.5, 1.5, 0 });
    Assertions.assertEquals(1.5, ss.get(Parameter.A0).get(0, 0), 0.0);
    Assertions.assertEquals(1, ss.get(Parameter.P0).get(0, 0), 1e-14);
  }

  @Test
  void initialValuesRoundTrip() {
    ThetaMap map = estimateT().updateInitial(new double[] { NaN }, new double[][] { { NaN } });
    StateSpace target = ThetaMapTest.localLevel(1, 0.5, 1).withInitial(new double[] { 1.5 }, new double[][] { { 4 } });
    StateSpace back = map.theta2system(map.system2theta(target));
    Assertions.assertEquals(1.5, back.get(Parameter.A0).get(0, 0), 1e-14);
    Assertions.assertEquals(4,   back.get(Parameter.P0).get(0, 0), 1e-12);
  }

  @Test
  void freeCovarianceIsPositiveSemiDefinite() {
    StateSpace shape = ThetaMapTest.twoStates().withInitial(new double[] { NaN, NaN },
        new double[][] { { NaN, NaN }, { NaN, NaN } });
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(shape));
    // a0 has two entries, the lower triangle of the root factor of P0 three
    Assertions.assertEquals(5, map.nTheta());
    Assertions.assertTrue(map.indexSystem().factoredP0());
    Assertions.assertEquals(0, map.indexSystem().index().get(Parameter.P0, 0, 0, 1));

    StateSpace ss = map.theta2system(new double[] { 0, 0, -3, 7, 2 });
    double[][] P0 = ss.get(Parameter.P0).slice(0);
    Assertions.assertEquals(P0[0][1], P0[1][0], 0.0);
    Assertions.assertTrue(P0[0][0] > 0);
    Assertions.assertTrue(P0[0][0] * P0[1][1] - P0[0][1] * P0[1][0] >= 0);

    StateSpace target = ThetaMapTest.twoStates().withInitial(new double[] { 1, 2 }, new double[][] { { 4, 2 }, { 2, 3 } });
    StateSpace back = map.theta2system(map.system2theta(target));
    Assertions.assertArrayEquals(new double[] { 4, 2 }, back.get(Parameter.P0).slice(0)[0], 1e-12);
    Assertions.assertArrayEquals(new double[] { 2, 3 }, back.get(Parameter.P0).slice(0)[1], 1e-12);
  }

  @Test
  void nonPositiveDefiniteCovarianceIsOutOfBounds() {
    ThetaMap map = estimateT().updateInitial(new double[] { 0 }, new double[][] { { NaN } });
    StateSpace target = ThetaMapTest.localLevel(1, 0.5, 1).withInitial(new double[] { 0 }, new double[][] { { -1 } });
    BoundViolationException e = Assertions.assertThrows(BoundViolationException.class, () -> map.system2theta(target));
    Assertions.assertEquals(Collections.singletonList("P0"), e.offenders());
  }

  @Test
  void knownCovarianceIsFixed() {
    StateSpace shape = ThetaMapTest.twoStates();
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(shape))
        .updateInitial(new double[] { 0, 0 }, new double[][] { { 0.7, 0.1 }, { 0.1, 0.3 } });
    Assertions.assertEquals(0, map.nTheta());
    Assertions.assertTrue(map.explicitP0());

    StateSpace ss = map.theta2system(new double[0]);
    Assertions.assertArrayEquals(new double[] { 0.7, 0.1 }, ss.get(Parameter.P0).slice(0)[0], 0.0);
    Assertions.assertArrayEquals(new double[] { 0.1, 0.3 }, ss.get(Parameter.P0).slice(0)[1], 0.0);
  }

  @Test
  void diagonalCovarianceWithUnknownVariances() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(ThetaMapTest.twoStates()))
        .updateInitial(null, new double[][] { { 0.7, 0 }, { 0, NaN } });
    Assertions.assertEquals(1, map.nTheta());
    Assertions.assertFalse(map.explicitA0());
    Assertions.assertEquals(0.7, map.indexSystem().fixed().get(Parameter.P0).get(0, 0), 0.0);

    double[][] P0 = map.theta2system(new double[] { 0 }).get(Parameter.P0).slice(0);
    Assertions.assertEquals(0.7, P0[0][0], 0.0);
    Assertions.assertEquals(0, P0[0][1], 0.0);
    Assertions.assertEquals(1, P0[1][1], 1e-14);
  }

  @Test
  void unknownVariancesWithKnownCovariance() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(ThetaMapTest.twoStates()))
        .updateInitial(null, new double[][] { { NaN, 0.3 }, { 0.3, NaN } });
    Assertions.assertEquals(2, map.nTheta());
    Assertions.assertFalse(map.indexSystem().factoredP0());
    Assertions.assertEquals(0.3, map.indexSystem().fixed().get(Parameter.P0).get(1, 0), 0.0);

    double[][] P0 = map.theta2system(new double[] { 0, 0 }).get(Parameter.P0).slice(0);
    Assertions.assertEquals(1,   P0[0][0], 1e-14);
    Assertions.assertEquals(0.3, P0[0][1], 0.0);
    Assertions.assertEquals(0.3, P0[1][0], 0.0);

    StateSpace target = ThetaMapTest.twoStates().withInitial(null, new double[][] { { 2, 0.3 }, { 0.3, 1.5 } });
    double[][] back = map.theta2system(map.system2theta(target)).get(Parameter.P0).slice(0);
    Assertions.assertArrayEquals(new double[] { 2, 0.3 },   back[0], 1e-12);
    Assertions.assertArrayEquals(new double[] { 0.3, 1.5 }, back[1], 1e-12);
    Assertions.assertEquals(0.3, back[0][1], 0.0);
  }

  @Test
  void unknownCovarianceIsShared() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(ThetaMapTest.twoStates()))
        .updateInitial(null, new double[][] { { 1, NaN }, { NaN, 2 } });
    Assertions.assertEquals(1, map.nTheta());
    Assertions.assertEquals(map.indexSystem().index().get(Parameter.P0, 0, 1, 0),
        map.indexSystem().index().get(Parameter.P0, 0, 0, 1));

    double[][] P0 = map.theta2system(new double[] { 0.4 }).get(Parameter.P0).slice(0);
    Assertions.assertArrayEquals(new double[] { 1, 0.4 }, P0[0], 0.0);
    Assertions.assertArrayEquals(new double[] { 0.4, 2 }, P0[1], 0.0);

    StateSpace target = ThetaMapTest.twoStates().withInitial(null, new double[][] { { 1, -0.2 }, { -0.2, 2 } });
    Assertions.assertArrayEquals(new double[] { -0.2 }, map.system2theta(target), 1e-15);

    StateSpace skewed = ThetaMapTest.twoStates().withInitial(null, new double[][] { { 1, 0.4 }, { 0.5, 2 } });
    Assertions.assertThrows(InconsistentSystemException.class, () -> map.system2theta(skewed));

    StateSpace lower = ThetaMapTest.twoStates().fill(Double.NEGATIVE_INFINITY)
        .withInitial(null, new double[][] { { 0, 100 }, { -0.5, 0 } });
    ThetaMap restricted = map.addRestrictions(lower, null);
    Assertions.assertEquals(-0.5, restricted.lowerBound().get(Parameter.P0).get(0, 1), 0.0);
    Assertions.assertEquals(-0.5, restricted.lowerBound().get(Parameter.P0).get(1, 0), 0.0);
    Assertions.assertTrue(restricted.theta2system(new double[] { 0 }).get(Parameter.P0).isSymmetric());
  }

  @Test
  void malformedInitialValuesAreRejected() {
    ThetaMap map = ThetaMap.estimation(StateSpaceTemplate.from(ThetaMapTest.twoStates()));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> map.updateInitial(null, new double[][] { { 1, NaN }, { 0.2, NaN } }));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> map.updateInitial(null, new double[][] { { 1, 0.1 }, { 0.2, NaN } }));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> map.updateInitial(null, new double[][] { { -1, 0 }, { 0, NaN } }));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> map.updateInitial(null, new double[][] { { 1, 2 }, { 2, 1 } }));
    Assertions.assertThrows(DimensionMismatchException.class,
        () -> map.updateInitial(new double[] { 1 }, null));
    Assertions.assertFalse(map.explicitP0());
  }

  @Test
  void replacingInitialValuesDropsTheirTheta() {
    ThetaMap map = estimateT().updateInitial(new double[] { NaN }, new double[][] { { NaN } });
    ThetaMap implicit = map.updateInitial(null, null);
    Assertions.assertEquals(1, implicit.nTheta());
    Assertions.assertEquals(1, implicit.nPsi());
    Assertions.assertFalse(implicit.explicitA0());
    Assertions.assertFalse(implicit.theta2system(new double[] { 0.5 }).has(Parameter.P0));

    ThetaMap again = implicit.updateInitial(new double[] { NaN }, null);
    Assertions.assertEquals(2, again.nTheta());
    Assertions.assertEquals(Arrays.asList("theta_1", "theta_2"), again.thetaNames());
  }

  @Test
  void systemWithoutInitialValuesDoesNotConform() {
    ThetaMap map = estimateT().updateInitial(new double[] { NaN }, null);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> map.system2theta(ThetaMapTest.localLevel(1, 0.5, 1)));
  }

  @Test
  void allIncludesInitialValues() {
    ThetaMap map = ThetaMap.all(ThetaMapTest.localLevel(1, 0.5, 1).withInitial(new double[] { 0 }, new double[][] { { 1 } }));
    Assertions.assertEquals(9, map.nTheta());
    Assertions.assertTrue(map.explicitA0());
    Assertions.assertTrue(map.explicitP0());
  }
}
