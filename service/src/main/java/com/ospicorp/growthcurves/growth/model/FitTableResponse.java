package com.ospicorp.growthcurves.growth.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record FitTableResponse(
    @JsonProperty("group_count") int groupCount,
    @JsonProperty("converged_count") int convergedCount,
    @JsonProperty("failed_count") int failedCount,
    List<FitRow> fits
) {}
