package com.ospicorp.growthcurves.growth.model;

import java.util.Objects;

/**
 * Identity of one organism / experiment / replicate combination. Groups are analyzed
 * independently of each other.
 */
public record GroupKey(String organismId, String experimentId, String replicateId) {

  public GroupKey {
    Objects.requireNonNull(organismId, "organismId");
    Objects.requireNonNull(experimentId, "experimentId");
    Objects.requireNonNull(replicateId, "replicateId");
  }

  @Override
  public String toString() {
    return organismId + '/' + experimentId + '/' + replicateId;
  }
}
