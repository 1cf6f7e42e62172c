package com.ospicorp.growthcurves.growth.model;

import java.util.Objects;

/**
 * Outcome of fitting one group: either {@link Converged} or {@link Failed}. Failures are
 * values, never exceptions, so one group cannot abort a batch.
 */
public interface FitResult {

  boolean converged();

  /** Number of observations the fit was attempted on. */
  int observations();

  /**
   * @param standardErrors asymptotic standard errors of r, K and N0; may be null
   * @param rmse root mean square of the residuals
   */
  record Converged(
      LogisticParameters parameters,
      LogisticParameters standardErrors,
      double rSquared,
      double rmse,
      int observations,
      int iterations,
      int evaluations
  ) implements FitResult {

    public Converged {
      Objects.requireNonNull(parameters, "parameters");
    }

    @Override
    public boolean converged() {
      return true;
    }
  }

  record Failed(FailureReason reason, String detail, int observations) implements FitResult {

    public Failed {
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public boolean converged() {
      return false;
    }
  }
}
