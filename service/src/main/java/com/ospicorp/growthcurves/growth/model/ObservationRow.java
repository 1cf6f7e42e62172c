package com.ospicorp.growthcurves.growth.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

// One tidy input row: a single observation tagged with its group key
@JsonPropertyOrder({"organism_id", "experiment_id", "replicate_id", "time", "density"})
public record ObservationRow(
    @JsonProperty("organism_id") String organismId,
    @JsonProperty("experiment_id") String experimentId,
    @JsonProperty("replicate_id") String replicateId,
    Double time,
    Double density
) {

  public GroupKey groupKey() {
    return new GroupKey(organismId, experimentId, replicateId);
  }
}
