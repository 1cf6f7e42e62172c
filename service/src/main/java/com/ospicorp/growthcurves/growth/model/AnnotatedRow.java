package com.ospicorp.growthcurves.growth.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"organism_id", "experiment_id", "replicate_id", "time", "density",
    "death_phase"})
public record AnnotatedRow(
    @JsonProperty("organism_id") String organismId,
    @JsonProperty("experiment_id") String experimentId,
    @JsonProperty("replicate_id") String replicateId,
    double time,
    Double density,
    @JsonProperty("death_phase") boolean deathPhase
) {}
