package com.ospicorp.growthcurves.growth.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.growthcurves.growth.model.CurvePoint;
import com.ospicorp.growthcurves.growth.model.FailureReason;
import com.ospicorp.growthcurves.growth.model.FitResult;
import com.ospicorp.growthcurves.growth.model.LogisticParameters;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class CurveSamplerTest {

  private static final LogisticParameters PARAMS = new LogisticParameters(0.5, 0.9, 0.05);

  @Test
  void samplesEvenlySpacedGridIncludingBothEnds() {
    List<CurvePoint> points = collect(CurveSampler.sample(PARAMS, 0, 10, 5));

    assertEquals(5, points.size());
    double[] expected = {0, 2.5, 5, 7.5, 10};
    for (int i = 0; i < expected.length; i++) {
      assertEquals(expected[i], points.get(i).time(), 1e-12);
      assertEquals(PARAMS.valueAt(expected[i]), points.get(i).predictedDensity(), 1e-12);
    }
    assertEquals(0.05, points.get(0).predictedDensity(), 1e-12);
  }

  @Test
  void lastPointLandsExactlyOnEnd() {
    List<CurvePoint> points = collect(CurveSampler.sample(PARAMS, 0.1, 0.7, 7));
    assertEquals(0.7, points.get(points.size() - 1).time());
  }

  @Test
  void singlePointSamplesStart() {
    List<CurvePoint> points = collect(CurveSampler.sample(PARAMS, 3, 8, 1));
    assertEquals(1, points.size());
    assertEquals(3, points.get(0).time());
  }

  @Test
  void curveIsNonDecreasingAndApproachesCapacity() {
    List<CurvePoint> points = collect(CurveSampler.sample(PARAMS, 0, 100, 200));

    for (int i = 1; i < points.size(); i++) {
      assertTrue(points.get(i).predictedDensity() >= points.get(i - 1).predictedDensity());
      assertTrue(points.get(i).predictedDensity() <= PARAMS.carryingCapacity());
    }
    assertEquals(PARAMS.carryingCapacity(),
        points.get(points.size() - 1).predictedDensity(), 1e-9);
  }

  @Test
  void extrapolatesOutsideObservedRange() {
    List<CurvePoint> points = collect(CurveSampler.sample(PARAMS, 50, 60, 3));
    assertEquals(50, points.get(0).time());
    assertEquals(PARAMS.carryingCapacity(), points.get(2).predictedDensity(), 1e-9);
  }

  @Test
  void sequenceCanBeIteratedMoreThanOnce() {
    Iterable<CurvePoint> curve = CurveSampler.sample(PARAMS, 0, 4, 9);
    assertEquals(collect(curve), collect(curve));
  }

  @Test
  void exhaustedIteratorThrows() {
    Iterator<CurvePoint> it = CurveSampler.sample(PARAMS, 0, 1, 1).iterator();
    it.next();
    assertFalse(it.hasNext());
    assertThrows(NoSuchElementException.class, it::next);
  }

  @Test
  void stepModeIncludesEndWhenItFallsOnTheGrid() {
    List<CurvePoint> points = collect(CurveSampler.sampleByStep(PARAMS, 0, 1, 0.1));

    assertEquals(11, points.size());
    assertEquals(0.3, points.get(3).time(), 1e-12);
    assertEquals(1.0, points.get(10).time(), 1e-12);
  }

  @Test
  void stepModeStopsBeforeEndOffTheGrid() {
    List<CurvePoint> points = collect(CurveSampler.sampleByStep(PARAMS, 0, 10, 3));

    assertEquals(4, points.size());
    assertEquals(9, points.get(3).time(), 1e-12);
  }

  @Test
  void samplesConvergedFit() {
    FitResult fit = new FitResult.Converged(PARAMS, null, 0.99, 0.01, 6, 10, 12);
    assertEquals(collect(CurveSampler.sample(PARAMS, 0, 10, 5)),
        collect(CurveSampler.sample(fit, 0, 10, 5)));
  }

  @Test
  void rejectsFailedFit() {
    FitResult failed = new FitResult.Failed(FailureReason.INSUFFICIENT_DATA, "2 observations", 2);
    assertThrows(IllegalArgumentException.class, () -> CurveSampler.sample(failed, 0, 10, 5));
    assertThrows(IllegalArgumentException.class,
        () -> CurveSampler.sampleByStep(failed, 0, 10, 1));
  }

  @Test
  void rejectsInvalidDomainAndResolution() {
    assertThrows(IllegalArgumentException.class, () -> CurveSampler.sample(PARAMS, 5, 1, 3));
    assertThrows(IllegalArgumentException.class, () -> CurveSampler.sample(PARAMS, 0, 1, 0));
    assertThrows(IllegalArgumentException.class,
        () -> CurveSampler.sample(PARAMS, 0, Double.POSITIVE_INFINITY, 3));
    assertThrows(IllegalArgumentException.class,
        () -> CurveSampler.sampleByStep(PARAMS, 0, 1, 0));
    assertThrows(IllegalArgumentException.class,
        () -> CurveSampler.sampleByStep(PARAMS, 0, 1, -0.5));
  }

  private static List<CurvePoint> collect(Iterable<CurvePoint> curve) {
    List<CurvePoint> out = new ArrayList<>();
    curve.forEach(out::add);
    return out;
  }
}
