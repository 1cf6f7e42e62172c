package com.ospicorp.growthcurves.growth.service;

import com.ospicorp.growthcurves.growth.model.Observation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flags the trailing observations of a growth series that belong to a post-peak decline.
 *
 * <p>The death phase starts at the first index {@code i} such that every measured
 * observation from {@code i} to the end lies below the maximum density seen before
 * {@code i} by more than {@link #getTolerance() tolerance} (relative). A dip that is later
 * recovered to the earlier maximum is therefore never flagged, and the flags always form a
 * run of {@code false} followed by a run of {@code true}.
 *
 * <p>Observations without a density do not move the running maximum; they are flagged
 * according to where they sit in the series.
 */
public class DeathPhaseDetector {

  /** Any strict decrease from the running maximum counts as decline. */
  public static final double DEFAULT_TOLERANCE = 0d;

  private final double tolerance;

  public DeathPhaseDetector() {
    this(DEFAULT_TOLERANCE);
  }

  /**
   * @param tolerance relative drop below the running maximum a point needs to count as a
   *     decline candidate, in {@code [0, 1)}
   */
  public DeathPhaseDetector(double tolerance) {
    if (!Double.isFinite(tolerance) || tolerance < 0d || tolerance >= 1d) {
      throw new IllegalArgumentException("tolerance must be in [0, 1): " + tolerance);
    }
    this.tolerance = tolerance;
  }

  public double getTolerance() {
    return tolerance;
  }

  /**
   * @param series observations of one group, sorted ascending by time
   * @return one flag per observation, in the same order
   */
  public List<Boolean> detect(List<Observation> series) {
    int n = series.size();
    int start = firstDeathIndex(series);
    List<Boolean> flags = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      flags.add(i >= start);
    }
    return flags;
  }

  /**
   * Index of the first death-phase observation, or {@code series.size()} when there is
   * no death phase.
   */
  public int firstDeathIndex(List<Observation> series) {
    requireSorted(series);
    List<Integer> measured = new ArrayList<>(series.size());
    for (int i = 0; i < series.size(); i++) {
      if (series.get(i).hasDensity()) {
        measured.add(i);
      }
    }
    int m = measured.size();
    if (m < 2) {
      return series.size();
    }

    double[] density = new double[m];
    for (int j = 0; j < m; j++) {
      density[j] = series.get(measured.get(j)).density();
    }
    // suffixMax[j] = max(density[j..m-1])
    double[] suffixMax = new double[m];
    suffixMax[m - 1] = density[m - 1];
    for (int j = m - 2; j >= 0; j--) {
      suffixMax[j] = Math.max(density[j], suffixMax[j + 1]);
    }

    double peak = density[0];
    for (int j = 1; j < m; j++) {
      if (suffixMax[j] < peak * (1d - tolerance)) {
        return measured.get(j);
      }
      peak = Math.max(peak, density[j]);
    }
    return series.size();
  }

  /** Convenience for callers that only need the non-flagged prefix. */
  public List<Observation> growthPhase(List<Observation> series) {
    int start = firstDeathIndex(series);
    return Collections.unmodifiableList(new ArrayList<>(series.subList(0, start)));
  }

  private static void requireSorted(List<Observation> series) {
    for (int i = 1; i < series.size(); i++) {
      if (series.get(i).time() < series.get(i - 1).time()) {
        throw new IllegalArgumentException(
            "series must be sorted by time; index " + i + " precedes index " + (i - 1));
      }
    }
  }
}
