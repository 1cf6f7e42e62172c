package com.ospicorp.growthcurves.growth.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.growthcurves.growth.model.AnnotatedRow;
import com.ospicorp.growthcurves.growth.model.CurveRow;
import com.ospicorp.growthcurves.growth.model.FailureReason;
import com.ospicorp.growthcurves.growth.model.FitResult;
import com.ospicorp.growthcurves.growth.model.FitRow;
import com.ospicorp.growthcurves.growth.model.FitTableResponse;
import com.ospicorp.growthcurves.growth.model.GroupKey;
import com.ospicorp.growthcurves.growth.model.ObservationRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GrowthAnalysisServiceTest {

  private static final double[] TIMES = {0, 2, 4, 6, 8, 10, 12, 14};
  private static final double[] DENSITIES = {0.05, 0.10, 0.22, 0.45, 0.70, 0.80, 0.60, 0.30};

  private ExecutorService pool;
  private GrowthAnalysisService svc;

  @BeforeEach
  void setUp() {
    pool = Executors.newFixedThreadPool(4);
    svc = new GrowthAnalysisService(new DeathPhaseDetector(), new LogisticFitter(), pool);
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void annotatesDeclineAndFitsGrowthPhase() {
    List<ObservationRow> rows = group("ecoli", "exp1", "A", TIMES, DENSITIES);

    List<AnnotatedRow> annotated = svc.annotate(rows, null);
    List<Boolean> flags = annotated.stream().map(AnnotatedRow::deathPhase).toList();
    assertEquals(List.of(false, false, false, false, false, false, true, true), flags);

    FitResult result = svc.fitAll(rows, null).get(new GroupKey("ecoli", "exp1", "A"));
    assertTrue(result.converged(), () -> "fit failed: " + result);
    var converged = (FitResult.Converged) result;
    assertEquals(6, converged.observations());
    double k = converged.parameters().carryingCapacity();
    assertTrue(k >= 0.8 && k <= 0.95, "K=" + k);
  }

  @Test
  void annotationKeepsInputRowOrder() {
    List<ObservationRow> rows = new ArrayList<>();
    rows.add(row("a", "e", "1", 4, 0.3));
    rows.add(row("b", "e", "1", 0, 0.5));
    rows.add(row("a", "e", "1", 0, 0.1));
    rows.add(row("a", "e", "1", 2, 0.4));
    rows.add(row("b", "e", "1", 2, 0.2));

    List<AnnotatedRow> annotated = svc.annotate(rows, null);

    assertEquals(5, annotated.size());
    for (int i = 0; i < rows.size(); i++) {
      assertEquals(rows.get(i).organismId(), annotated.get(i).organismId());
      assertEquals(rows.get(i).time(), annotated.get(i).time());
    }
    // a sorted by time: 0.1, 0.4, 0.3 -> last sample declines
    assertTrue(annotated.get(0).deathPhase());
    assertFalse(annotated.get(2).deathPhase());
    assertFalse(annotated.get(3).deathPhase());
    assertTrue(annotated.get(4).deathPhase());
    assertFalse(annotated.get(1).deathPhase());
  }

  @Test
  void failingGroupDoesNotAffectOthers() {
    List<ObservationRow> rows = new ArrayList<>(group("ecoli", "exp1", "A", TIMES, DENSITIES));
    rows.add(row("yeast", "exp1", "A", 0, 0.1));
    rows.add(row("yeast", "exp1", "A", 1, 0.2));
    rows.addAll(group("flat", "exp1", "A", new double[] {0, 1, 2, 3},
        new double[] {0.4, 0.4, 0.4, 0.4}));

    Map<GroupKey, FitResult> results = svc.fitAll(rows, null);

    assertEquals(List.of(new GroupKey("ecoli", "exp1", "A"), new GroupKey("yeast", "exp1", "A"),
        new GroupKey("flat", "exp1", "A")), List.copyOf(results.keySet()));
    assertTrue(results.get(new GroupKey("ecoli", "exp1", "A")).converged());
    assertEquals(FailureReason.INSUFFICIENT_DATA,
        ((FitResult.Failed) results.get(new GroupKey("yeast", "exp1", "A"))).reason());
    assertEquals(FailureReason.DEGENERATE_PARAMETERS,
        ((FitResult.Failed) results.get(new GroupKey("flat", "exp1", "A"))).reason());
  }

  @Test
  void parallelAndSequentialRunsAgree() {
    List<ObservationRow> rows = new ArrayList<>();
    for (int g = 0; g < 12; g++) {
      double[] densities = new double[TIMES.length];
      for (int i = 0; i < TIMES.length; i++) {
        densities[i] = DENSITIES[i] * (1d + 0.05 * g);
      }
      rows.addAll(group("org" + g, "exp", "R1", TIMES, densities));
    }
    GrowthAnalysisService sequential =
        new GrowthAnalysisService(new DeathPhaseDetector(), new LogisticFitter(), Runnable::run);

    assertEquals(sequential.fitAll(rows, null), svc.fitAll(rows, null));
  }

  @Test
  void unexpectedErrorsBecomeFailedResults() {
    LogisticFitter broken = new LogisticFitter() {
      @Override
      public FitResult fit(List<com.ospicorp.growthcurves.growth.model.Observation> series) {
        throw new IllegalStateException("boom");
      }
    };
    GrowthAnalysisService failing =
        new GrowthAnalysisService(new DeathPhaseDetector(), broken, Runnable::run);

    FitResult result = failing.fitAll(group("ecoli", "exp1", "A", TIMES, DENSITIES), null)
        .get(new GroupKey("ecoli", "exp1", "A"));

    assertEquals(FailureReason.NON_CONVERGENCE, ((FitResult.Failed) result).reason());
    assertEquals(8, result.observations());
  }

  @Test
  void fitTableScalesRateAndBlanksFailedRows() {
    List<ObservationRow> rows = new ArrayList<>(group("ecoli", "exp1", "A", TIMES, DENSITIES));
    rows.add(row("yeast", "exp1", "A", 0, 0.1));

    FitTableResponse unscaled = svc.fitTable(rows, null, 1d);
    FitTableResponse scaled = svc.fitTable(rows, null, 24d);

    assertEquals(2, scaled.groupCount());
    assertEquals(1, scaled.convergedCount());
    assertEquals(1, scaled.failedCount());

    FitRow base = unscaled.fits().get(0);
    FitRow perDay = scaled.fits().get(0);
    assertEquals("converged", perDay.status());
    assertEquals(base.growthRate() * 24d, perDay.growthRate(), 1e-9);
    assertEquals(base.doublingTime() / 24d, perDay.doublingTime(), 1e-9);
    assertEquals(base.inflectionTime() / 24d, perDay.inflectionTime(), 1e-9);
    assertEquals(base.maxGrowthRate() * 24d, perDay.maxGrowthRate(), 1e-9);
    assertEquals(base.carryingCapacity(), perDay.carryingCapacity(), 1e-12);

    FitRow failed = scaled.fits().get(1);
    assertEquals("failed", failed.status());
    assertEquals("insufficient_data", failed.failureReason());
    assertNull(failed.growthRate());
    assertNull(failed.carryingCapacity());
    assertNull(failed.initialDensity());
    assertEquals(1, failed.observations());
  }

  @Test
  void curvesOmitFailedGroupsAndDefaultToObservedRange() {
    List<ObservationRow> rows = new ArrayList<>(group("ecoli", "exp1", "A", TIMES, DENSITIES));
    rows.add(row("yeast", "exp1", "A", 0, 0.1));

    List<CurveRow> curve = svc.curves(rows, null, null, null, 5, null);

    assertEquals(5, curve.size());
    assertTrue(curve.stream().allMatch(c -> c.organismId().equals("ecoli")));
    assertEquals(0d, curve.get(0).time());
    assertEquals(14d, curve.get(4).time());
    for (int i = 1; i < curve.size(); i++) {
      assertTrue(curve.get(i).predictedDensity() >= curve.get(i - 1).predictedDensity());
    }
  }

  @Test
  void curvesHonourExplicitDomainAndStep() {
    List<ObservationRow> rows = group("ecoli", "exp1", "A", TIMES, DENSITIES);

    List<CurveRow> curve = svc.curves(rows, null, 0d, 10d, null, 2.5);

    assertEquals(List.of(0d, 2.5, 5d, 7.5, 10d),
        curve.stream().map(CurveRow::time).toList());
  }

  @Test
  void startBeyondObservedRangeStillSamples() {
    List<ObservationRow> rows = new ArrayList<>(group("ecoli", "exp1", "A", TIMES, DENSITIES));
    rows.addAll(group("yeast", "exp1", "A", new double[] {0, 10, 20, 30, 40},
        new double[] {0.02, 0.1, 0.4, 0.8, 0.9}));

    List<CurveRow> curve = svc.curves(rows, null, 20d, null, 5, null);

    List<CurveRow> ecoli = curve.stream().filter(c -> c.organismId().equals("ecoli")).toList();
    List<CurveRow> yeast = curve.stream().filter(c -> c.organismId().equals("yeast")).toList();
    assertEquals(5, ecoli.size());
    assertTrue(ecoli.stream().allMatch(c -> c.time() == 20d));
    assertEquals(List.of(20d, 25d, 30d, 35d, 40d), yeast.stream().map(CurveRow::time).toList());
  }

  @Test
  void endBeforeObservedRangeStillSamples() {
    List<ObservationRow> rows = group("ecoli", "exp1", "A", TIMES, DENSITIES);

    List<CurveRow> curve = svc.curves(rows, null, null, -1d, 3, null);

    assertEquals(3, curve.size());
    assertTrue(curve.stream().allMatch(c -> c.time() == -1d));
    assertTrue(curve.get(0).predictedDensity() > 0d);
  }

  @Test
  void curvesRequireExactlyOneResolution() {
    List<ObservationRow> rows = group("ecoli", "exp1", "A", TIMES, DENSITIES);
    assertThrows(IllegalArgumentException.class,
        () -> svc.curves(rows, null, null, null, 5, 1d));
    assertThrows(IllegalArgumentException.class,
        () -> svc.curves(rows, null, null, null, null, null));
  }

  @Test
  void rejectsInvalidRows() {
    assertThrows(IllegalArgumentException.class,
        () -> svc.annotate(List.of(row("", "e", "1", 0, 0.1)), null));
    assertThrows(IllegalArgumentException.class,
        () -> svc.annotate(List.of(row("a", "e", "1", -1, 0.1)), null));
    assertThrows(IllegalArgumentException.class,
        () -> svc.fitAll(List.of(row("a", "e", "1", 0, -0.1)), null));
  }

  private static List<ObservationRow> group(String organism, String experiment, String replicate,
      double[] times, double[] densities) {
    List<ObservationRow> rows = new ArrayList<>(times.length);
    for (int i = 0; i < times.length; i++) {
      rows.add(row(organism, experiment, replicate, times[i], densities[i]));
    }
    return rows;
  }

  private static ObservationRow row(String organism, String experiment, String replicate,
      double time, Double density) {
    return new ObservationRow(organism, experiment, replicate, time, density);
  }
}
