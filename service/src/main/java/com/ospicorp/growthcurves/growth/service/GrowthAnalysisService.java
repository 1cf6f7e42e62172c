package com.ospicorp.growthcurves.growth.service;

import com.ospicorp.growthcurves.growth.model.AnnotatedRow;
import com.ospicorp.growthcurves.growth.model.CurvePoint;
import com.ospicorp.growthcurves.growth.model.CurveRow;
import com.ospicorp.growthcurves.growth.model.FailureReason;
import com.ospicorp.growthcurves.growth.model.FitResult;
import com.ospicorp.growthcurves.growth.model.FitRow;
import com.ospicorp.growthcurves.growth.model.FitTableResponse;
import com.ospicorp.growthcurves.growth.model.GroupKey;
import com.ospicorp.growthcurves.growth.model.LogisticParameters;
import com.ospicorp.growthcurves.growth.model.Observation;
import com.ospicorp.growthcurves.growth.model.ObservationRow;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs death-phase detection and logistic fitting for every group of an observation table
 * and assembles the annotated series, fit table and reconstructed curves.
 *
 * <p>Each group is an independent task on the fit executor. A task only reads its own
 * group's observations and produces its own result; results are collected afterwards in
 * group order.
 */
@Service
public class GrowthAnalysisService {
  private static final Logger log = LoggerFactory.getLogger(GrowthAnalysisService.class);

  private final DeathPhaseDetector detector;
  private final LogisticFitter fitter;
  private final Executor executor;

  public GrowthAnalysisService(DeathPhaseDetector detector, LogisticFitter fitter,
      @Qualifier("growthFitExecutor") Executor executor) {
    this.detector = detector;
    this.fitter = fitter;
    this.executor = executor;
  }

  /**
   * @param tolerance death-phase tolerance for this call, or null for the configured one
   * @return the input rows in their original order, each with its death-phase flag
   */
  public List<AnnotatedRow> annotate(List<ObservationRow> rows, Double tolerance) {
    DeathPhaseDetector effective = detectorFor(tolerance);
    Map<GroupKey, List<Integer>> groups = SeriesAssembler.indexByGroup(rows);
    boolean[] flags = new boolean[rows.size()];
    for (List<Integer> indices : groups.values()) {
      List<Observation> series = new ArrayList<>(indices.size());
      for (int index : indices) {
        series.add(SeriesAssembler.toObservation(rows.get(index)));
      }
      int start = effective.firstDeathIndex(series);
      for (int i = start; i < indices.size(); i++) {
        flags[indices.get(i)] = true;
      }
    }

    List<AnnotatedRow> out = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      ObservationRow row = rows.get(i);
      out.add(new AnnotatedRow(row.organismId(), row.experimentId(), row.replicateId(),
          row.time(), row.density(), flags[i]));
    }
    return out;
  }

  public Map<GroupKey, FitResult> fitAll(List<ObservationRow> rows, Double tolerance) {
    return fitAll(SeriesAssembler.assemble(rows), detectorFor(tolerance));
  }

  /**
   * Fits every group. Always returns exactly one result per group, in the iteration order of
   * {@code groups}.
   */
  public Map<GroupKey, FitResult> fitAll(Map<GroupKey, List<Observation>> groups,
      DeathPhaseDetector groupDetector) {
    long startTime = System.currentTimeMillis();
    List<GroupKey> keys = new ArrayList<>(groups.keySet());
    List<CompletableFuture<FitResult>> pending = new ArrayList<>(keys.size());
    for (GroupKey key : keys) {
      List<Observation> series = groups.get(key);
      pending.add(CompletableFuture
          .supplyAsync(() -> analyzeGroup(series, groupDetector), executor)
          .exceptionally(ex -> unexpectedFailure(key, series, ex)));
    }

    Map<GroupKey, FitResult> results = new LinkedHashMap<>(keys.size());
    int converged = 0;
    for (int i = 0; i < keys.size(); i++) {
      FitResult result = pending.get(i).join();
      if (result.converged()) {
        converged++;
      }
      results.put(keys.get(i), result);
    }
    log.info("Fitted {} groups: {} converged, {} failed ({} ms)",
        keys.size(), converged, keys.size() - converged, System.currentTimeMillis() - startTime);
    return results;
  }

  /**
   * @param rateScale factor applied to {@code r} for reporting in another time unit, e.g. 24
   *     to go from per-hour to per-day
   */
  public FitTableResponse fitTable(List<ObservationRow> rows, Double tolerance,
      double rateScale) {
    Map<GroupKey, FitResult> results = fitAll(rows, tolerance);
    List<FitRow> fits = new ArrayList<>(results.size());
    int converged = 0;
    for (var e : results.entrySet()) {
      if (e.getValue().converged()) {
        converged++;
      }
      fits.add(toFitRow(e.getKey(), e.getValue(), rateScale));
    }
    return new FitTableResponse(fits.size(), converged, fits.size() - converged, fits);
  }

  /**
   * Samples the fitted curve of every converged group. Groups whose fit failed are left
   * out. A null {@code start} or {@code end} falls back to the group's observed time range,
   * widened where needed so that a single given bound outside that range still samples.
   * Exactly one of {@code points} and {@code step} must be given.
   */
  public List<CurveRow> curves(List<ObservationRow> rows, Double tolerance, Double start,
      Double end, Integer points, Double step) {
    if ((points == null) == (step == null)) {
      throw new IllegalArgumentException("exactly one of points and step must be provided");
    }
    Map<GroupKey, List<Observation>> groups = SeriesAssembler.assemble(rows);
    Map<GroupKey, FitResult> results = fitAll(groups, detectorFor(tolerance));

    List<CurveRow> out = new ArrayList<>();
    for (var e : results.entrySet()) {
      if (!(e.getValue() instanceof FitResult.Converged converged)) {
        continue;
      }
      GroupKey key = e.getKey();
      List<Observation> series = groups.get(key);
      double first = series.get(0).time();
      double last = series.get(series.size() - 1).time();
      // a single given bound may lie outside the observed range; widen the other one to it
      double from = start != null ? start : end != null ? Math.min(end, first) : first;
      double to = end != null ? end : Math.max(from, last);
      Iterable<CurvePoint> curve = points != null
          ? CurveSampler.sample(converged, from, to, points)
          : CurveSampler.sampleByStep(converged, from, to, step);
      for (CurvePoint p : curve) {
        out.add(new CurveRow(key.organismId(), key.experimentId(), key.replicateId(),
            p.time(), p.predictedDensity()));
      }
    }
    return out;
  }

  private FitResult analyzeGroup(List<Observation> series, DeathPhaseDetector groupDetector) {
    return fitter.fit(groupDetector.growthPhase(series));
  }

  private FitResult unexpectedFailure(GroupKey key, List<Observation> series, Throwable ex) {
    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
    log.error("Fit of group {} failed unexpectedly: {}", key, cause.getMessage(), cause);
    int usable = (int) series.stream().filter(Observation::hasDensity).count();
    return new FitResult.Failed(FailureReason.NON_CONVERGENCE,
        "unexpected error: " + cause.getClass().getSimpleName(), usable);
  }

  private DeathPhaseDetector detectorFor(Double tolerance) {
    if (tolerance == null || tolerance == detector.getTolerance()) {
      return detector;
    }
    return new DeathPhaseDetector(tolerance);
  }

  private static FitRow toFitRow(GroupKey key, FitResult result, double rateScale) {
    if (result instanceof FitResult.Converged c) {
      LogisticParameters p = c.parameters();
      LogisticParameters se = c.standardErrors();
      return new FitRow(key.organismId(), key.experimentId(), key.replicateId(), "converged",
          p.growthRate() * rateScale,
          p.carryingCapacity(),
          p.initialDensity(),
          se != null ? se.growthRate() * rateScale : null,
          se != null ? se.carryingCapacity() : null,
          se != null ? se.initialDensity() : null,
          p.doublingTime() / rateScale,
          p.inflectionTime() / rateScale,
          p.maxGrowthRate() * rateScale,
          c.rSquared(),
          c.rmse(),
          c.observations(),
          null,
          null);
    }
    FitResult.Failed f = (FitResult.Failed) result;
    return new FitRow(key.organismId(), key.experimentId(), key.replicateId(), "failed",
        null, null, null, null, null, null, null, null, null, null, null,
        f.observations(),
        f.reason().name().toLowerCase(Locale.ROOT),
        f.detail());
  }
}
