package com.ospicorp.growthcurves.growth.model;

/**
 * Parameters of the logistic growth law
 * {@code N(t) = K * N0 * exp(r t) / (K + N0 * (exp(r t) - 1))}.
 *
 * @param growthRate intrinsic growth rate {@code r}, in 1/time
 * @param carryingCapacity asymptotic density {@code K}
 * @param initialDensity density at {@code t = 0}, {@code N0}
 */
public record LogisticParameters(double growthRate, double carryingCapacity,
    double initialDensity) {

  /**
   * Evaluates the curve at {@code time}. Uses the equivalent form
   * {@code K / (1 + ((K - N0) / N0) * exp(-r t))}, which does not overflow for large
   * {@code r t}.
   */
  public double valueAt(double time) {
    double shape = (carryingCapacity - initialDensity) / initialDensity;
    if (shape == 0d) {
      return carryingCapacity;
    }
    return carryingCapacity / (1d + shape * Math.exp(-growthRate * time));
  }

  public double doublingTime() {
    return Math.log(2d) / growthRate;
  }

  // time at which N(t) = K / 2; negative when N0 already exceeds half of K
  public double inflectionTime() {
    return Math.log((carryingCapacity - initialDensity) / initialDensity) / growthRate;
  }

  public double maxGrowthRate() {
    return growthRate * carryingCapacity / 4d;
  }
}
