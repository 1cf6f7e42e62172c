package com.ospicorp.growthcurves.growth.service;

import com.ospicorp.growthcurves.growth.model.CurvePoint;
import com.ospicorp.growthcurves.growth.model.FitResult;
import com.ospicorp.growthcurves.growth.model.LogisticParameters;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reconstructs a fitted logistic curve on an evenly spaced time grid. The returned sequences
 * are lazy: nothing is evaluated until iterated, and every {@code iterator()} starts over.
 * The domain is not clamped to the observed time range.
 */
public final class CurveSampler {
  private CurveSampler() {
  }

  public static Iterable<CurvePoint> sample(FitResult fit, double start, double end, int points) {
    return sample(parametersOf(fit), start, end, points);
  }

  /**
   * @param points number of samples; the first is at {@code start} and, when more than one,
   *     the last is at {@code end}
   */
  public static Iterable<CurvePoint> sample(LogisticParameters parameters, double start,
      double end, int points) {
    requireDomain(start, end);
    if (points < 1) {
      throw new IllegalArgumentException("points must be positive: " + points);
    }
    double spacing = points == 1 ? 0d : (end - start) / (points - 1);
    return () -> new GridIterator(parameters, start, end, spacing, points, true);
  }

  public static Iterable<CurvePoint> sampleByStep(FitResult fit, double start, double end,
      double step) {
    return sampleByStep(parametersOf(fit), start, end, step);
  }

  /** Samples {@code start, start + step, ...} up to and including {@code end}. */
  public static Iterable<CurvePoint> sampleByStep(LogisticParameters parameters, double start,
      double end, double step) {
    requireDomain(start, end);
    if (!Double.isFinite(step) || step <= 0d) {
      throw new IllegalArgumentException("step must be positive: " + step);
    }
    // tolerate rounding so that an end lying on the grid is included
    long intervals = (long) Math.floor((end - start) / step + 1e-9);
    if (intervals >= Integer.MAX_VALUE) {
      throw new IllegalArgumentException("step " + step + " is too small for the domain");
    }
    int points = (int) intervals + 1;
    return () -> new GridIterator(parameters, start, end, step, points, false);
  }

  private static LogisticParameters parametersOf(FitResult fit) {
    if (fit instanceof FitResult.Converged converged) {
      return converged.parameters();
    }
    throw new IllegalArgumentException("cannot sample a fit that did not converge: " + fit);
  }

  private static void requireDomain(double start, double end) {
    if (!Double.isFinite(start) || !Double.isFinite(end)) {
      throw new IllegalArgumentException("domain bounds must be finite");
    }
    if (start > end) {
      throw new IllegalArgumentException("start must be before or equal to end");
    }
  }

  private static final class GridIterator implements Iterator<CurvePoint> {
    private final LogisticParameters parameters;
    private final double start;
    private final double end;
    private final double spacing;
    private final int points;
    private final boolean endsAtEnd;
    private int index;

    GridIterator(LogisticParameters parameters, double start, double end, double spacing,
        int points, boolean endsAtEnd) {
      this.parameters = parameters;
      this.start = start;
      this.end = end;
      this.spacing = spacing;
      this.points = points;
      this.endsAtEnd = endsAtEnd;
    }

    @Override
    public boolean hasNext() {
      return index < points;
    }

    @Override
    public CurvePoint next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      double time = start + index * spacing;
      if (endsAtEnd && points > 1 && index == points - 1) {
        time = end;
      } else if (time > end) {
        time = end;
      }
      index++;
      return new CurvePoint(time, parameters.valueAt(time));
    }
  }
}
