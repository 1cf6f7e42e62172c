package com.ospicorp.growthcurves.growth.model;

public enum FailureReason {
  INSUFFICIENT_DATA,
  NON_CONVERGENCE,
  DEGENERATE_PARAMETERS
}
