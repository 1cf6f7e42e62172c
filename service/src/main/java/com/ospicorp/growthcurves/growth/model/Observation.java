package com.ospicorp.growthcurves.growth.model;

// density is null when the measurement is missing
public record Observation(double time, Double density) {

  public boolean hasDensity() {
    return density != null && Double.isFinite(density);
  }
}
