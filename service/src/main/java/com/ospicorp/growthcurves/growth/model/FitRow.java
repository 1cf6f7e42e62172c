package com.ospicorp.growthcurves.growth.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of the fit table. Parameter columns are null when the fit failed, in which case
 * {@code failure_reason} says why.
 */
@JsonPropertyOrder({"organism_id", "experiment_id", "replicate_id", "status", "r", "K", "N0",
    "r_se", "K_se", "N0_se", "doubling_time", "inflection_time", "max_growth_rate", "r_squared",
    "rmse", "observations", "failure_reason", "failure_detail"})
public record FitRow(
    @JsonProperty("organism_id") String organismId,
    @JsonProperty("experiment_id") String experimentId,
    @JsonProperty("replicate_id") String replicateId,
    String status,
    @JsonProperty("r") Double growthRate,
    @JsonProperty("K") Double carryingCapacity,
    @JsonProperty("N0") Double initialDensity,
    @JsonProperty("r_se") Double growthRateError,
    @JsonProperty("K_se") Double carryingCapacityError,
    @JsonProperty("N0_se") Double initialDensityError,
    @JsonProperty("doubling_time") Double doublingTime,
    @JsonProperty("inflection_time") Double inflectionTime,
    @JsonProperty("max_growth_rate") Double maxGrowthRate,
    @JsonProperty("r_squared") Double rSquared,
    Double rmse,
    int observations,
    @JsonProperty("failure_reason") String failureReason,
    @JsonProperty("failure_detail") String failureDetail
) {}
