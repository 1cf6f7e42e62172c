package com.ospicorp.growthcurves.growth.service;

import com.ospicorp.growthcurves.growth.model.FailureReason;
import com.ospicorp.growthcurves.growth.model.FitResult;
import com.ospicorp.growthcurves.growth.model.LogisticParameters;
import com.ospicorp.growthcurves.growth.model.Observation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits the three-parameter logistic growth law to one group's growth-phase observations by
 * Levenberg-Marquardt least squares.
 *
 * <p>The optimizer works on {@code (ln r, ln N0, K)} so that {@code r} and {@code N0} stay
 * positive; {@code K} is clamped to the largest observed density. Every failure mode is
 * returned as a {@link FitResult.Failed} rather than thrown.
 */
public class LogisticFitter {
  private static final Logger log = LoggerFactory.getLogger(LogisticFitter.class);

  public static final int MIN_OBSERVATIONS = 3;
  public static final int DEFAULT_MAX_ITERATIONS = 1000;
  public static final int DEFAULT_MAX_EVALUATIONS = 3000;
  public static final double DEFAULT_COST_TOLERANCE = 1e-10;
  public static final double DEFAULT_PARAMETER_TOLERANCE = 1e-10;
  public static final Duration DEFAULT_TIME_BUDGET = Duration.ofSeconds(5);

  static final double EPSILON = 1e-6;
  static final double CAPACITY_HEADROOM = 1.05;
  private static final double SINGULARITY_THRESHOLD = 1e-12;

  private static final int LOG_RATE = 0;
  private static final int LOG_INITIAL = 1;
  private static final int CAPACITY = 2;

  private final int maxIterations;
  private final int maxEvaluations;
  private final double costTolerance;
  private final double parameterTolerance;
  private final Duration timeBudget;

  public LogisticFitter() {
    this(DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_EVALUATIONS, DEFAULT_COST_TOLERANCE,
        DEFAULT_PARAMETER_TOLERANCE, DEFAULT_TIME_BUDGET);
  }

  public LogisticFitter(int maxIterations, int maxEvaluations, double costTolerance,
      double parameterTolerance, Duration timeBudget) {
    if (maxIterations < 1 || maxEvaluations < 1) {
      throw new IllegalArgumentException("iteration and evaluation budgets must be positive");
    }
    if (!(costTolerance > 0d) || !(parameterTolerance > 0d)) {
      throw new IllegalArgumentException("tolerances must be positive");
    }
    if (timeBudget == null || timeBudget.isNegative() || timeBudget.isZero()) {
      throw new IllegalArgumentException("timeBudget must be positive");
    }
    this.maxIterations = maxIterations;
    this.maxEvaluations = maxEvaluations;
    this.costTolerance = costTolerance;
    this.parameterTolerance = parameterTolerance;
    this.timeBudget = timeBudget;
  }

  /**
   * @param series growth-phase observations of one group; entries without a density are
   *     ignored
   */
  public FitResult fit(List<Observation> series) {
    List<Observation> usable = new ArrayList<>(series.size());
    for (Observation o : series) {
      if (o.hasDensity()) {
        usable.add(o);
      }
    }
    int n = usable.size();
    if (n < MIN_OBSERVATIONS) {
      return failed(FailureReason.INSUFFICIENT_DATA,
          "need at least " + MIN_OBSERVATIONS + " observations, got " + n, n);
    }

    double[] times = new double[n];
    double[] densities = new double[n];
    double maxDensity = Double.NEGATIVE_INFINITY;
    double minDensity = Double.POSITIVE_INFINITY;
    for (int i = 0; i < n; i++) {
      times[i] = usable.get(i).time();
      densities[i] = usable.get(i).density();
      maxDensity = Math.max(maxDensity, densities[i]);
      minDensity = Math.min(minDensity, densities[i]);
    }
    if (maxDensity <= minDensity) {
      return failed(FailureReason.DEGENERATE_PARAMETERS,
          "density is constant at " + maxDensity + "; growth rate is not identifiable", n);
    }

    double[] start = initialGuess(times, densities, maxDensity);
    long deadline = System.nanoTime() + timeBudget.toNanos();
    final double capacityFloor = maxDensity;

    ParameterValidator validator = params -> {
      if (params.getEntry(CAPACITY) >= capacityFloor) {
        return params;
      }
      RealVector clamped = params.copy();
      clamped.setEntry(CAPACITY, capacityFloor);
      return clamped;
    };

    LeastSquaresProblem problem = new LeastSquaresBuilder()
        .start(start)
        .model(model(times, deadline))
        .target(densities)
        .parameterValidator(validator)
        .maxEvaluations(maxEvaluations)
        .maxIterations(maxIterations)
        .build();

    LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
        .withCostRelativeTolerance(costTolerance)
        .withParameterRelativeTolerance(parameterTolerance);

    LeastSquaresOptimizer.Optimum optimum;
    try {
      optimum = optimizer.optimize(problem);
    } catch (TooManyIterationsException | TooManyEvaluationsException ex) {
      return failed(FailureReason.NON_CONVERGENCE,
          "optimizer budget exhausted: " + ex.getMessage(), n);
    } catch (TimeBudgetExceededException ex) {
      return failed(FailureReason.NON_CONVERGENCE,
          "fit exceeded time budget of " + timeBudget.toMillis() + " ms", n);
    } catch (MathIllegalStateException ex) {
      return failed(FailureReason.NON_CONVERGENCE, "optimizer failed: " + ex.getMessage(), n);
    }

    double[] point = optimum.getPoint().toArray();
    double r = Math.exp(point[LOG_RATE]);
    double n0 = Math.exp(point[LOG_INITIAL]);
    double k = point[CAPACITY];
    if (!isPositive(r) || !isPositive(n0) || !isPositive(k)) {
      return failed(FailureReason.DEGENERATE_PARAMETERS,
          "non-finite or non-positive parameters r=" + r + ", K=" + k + ", N0=" + n0, n);
    }
    if (k < maxDensity) {
      return failed(FailureReason.DEGENERATE_PARAMETERS,
          "K=" + k + " is below the observed maximum " + maxDensity, n);
    }

    RealVector sigma;
    try {
      sigma = optimum.getSigma(SINGULARITY_THRESHOLD);
    } catch (SingularMatrixException ex) {
      return failed(FailureReason.DEGENERATE_PARAMETERS,
          "parameters are not identifiable (singular Jacobian)", n);
    }
    // delta method: se(exp(x)) = exp(x) * se(x)
    LogisticParameters errors = new LogisticParameters(
        r * sigma.getEntry(LOG_RATE),
        sigma.getEntry(CAPACITY),
        n0 * sigma.getEntry(LOG_INITIAL));

    LogisticParameters parameters = new LogisticParameters(r, k, n0);
    double rSquared = rSquared(parameters, times, densities);
    FitResult.Converged result = new FitResult.Converged(parameters, errors, rSquared,
        optimum.getRMS(), n, optimum.getIterations(), optimum.getEvaluations());
    log.debug("Logistic fit converged after {} iterations: r={}, K={}, N0={}, R2={}",
        optimum.getIterations(), r, k, n0, rSquared);
    return result;
  }

  /**
   * Starting point in optimizer coordinates: N0 from the first density, K slightly above the
   * maximum, r from a log-linear regression over the points below half of the starting K.
   */
  static double[] initialGuess(double[] times, double[] densities, double maxDensity) {
    double n0 = Math.max(densities[0], EPSILON);
    double k = CAPACITY_HEADROOM * maxDensity;

    SimpleRegression early = new SimpleRegression();
    SimpleRegression positive = new SimpleRegression();
    for (int i = 0; i < times.length; i++) {
      if (densities[i] > 0d) {
        positive.addData(times[i], Math.log(densities[i]));
        if (densities[i] <= k / 2d) {
          early.addData(times[i], Math.log(densities[i]));
        }
      }
    }
    double slope = early.getN() >= 2 ? early.getSlope() : positive.getSlope();
    double r = Double.isFinite(slope) ? Math.max(slope, EPSILON) : EPSILON;

    double[] start = new double[3];
    start[LOG_RATE] = Math.log(r);
    start[LOG_INITIAL] = Math.log(n0);
    start[CAPACITY] = k;
    return start;
  }

  private static MultivariateJacobianFunction model(double[] times, long deadline) {
    return point -> {
      if (System.nanoTime() > deadline) {
        throw new TimeBudgetExceededException();
      }
      double r = Math.exp(point.getEntry(LOG_RATE));
      double n0 = Math.exp(point.getEntry(LOG_INITIAL));
      double k = point.getEntry(CAPACITY);
      double shape = (k - n0) / n0;

      RealVector value = new ArrayRealVector(times.length);
      RealMatrix jacobian = new Array2DRowRealMatrix(times.length, 3);
      for (int i = 0; i < times.length; i++) {
        double t = times[i];
        double q = Math.exp(-r * t);
        double den = 1d + shape * q;
        double den2 = den * den;
        value.setEntry(i, k / den);
        // d/d(ln r) = r * dN/dr, d/d(ln N0) = N0 * dN/dN0
        jacobian.setEntry(i, LOG_RATE, r * k * shape * t * q / den2);
        jacobian.setEntry(i, LOG_INITIAL, k * k * q / (n0 * den2));
        jacobian.setEntry(i, CAPACITY, (1d - q) / den2);
      }
      return new Pair<>(value, jacobian);
    };
  }

  private static double rSquared(LogisticParameters parameters, double[] times,
      double[] densities) {
    double mean = 0d;
    for (double d : densities) {
      mean += d;
    }
    mean /= densities.length;
    double sse = 0d;
    double sst = 0d;
    for (int i = 0; i < times.length; i++) {
      double residual = densities[i] - parameters.valueAt(times[i]);
      sse += residual * residual;
      double deviation = densities[i] - mean;
      sst += deviation * deviation;
    }
    return sst > 0d ? 1d - sse / sst : 0d;
  }

  private static boolean isPositive(double value) {
    return Double.isFinite(value) && value > 0d;
  }

  private static FitResult.Failed failed(FailureReason reason, String detail, int observations) {
    log.debug("Logistic fit failed ({}): {}", reason, detail);
    return new FitResult.Failed(reason, detail, observations);
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public Duration getTimeBudget() {
    return timeBudget;
  }

  // Thrown from the model function to abandon a fit that ran past its wall-clock budget.
  private static final class TimeBudgetExceededException extends RuntimeException {
    TimeBudgetExceededException() {
      super(null, null, false, false);
    }
  }
}
