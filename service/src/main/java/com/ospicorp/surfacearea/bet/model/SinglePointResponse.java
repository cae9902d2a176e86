package com.ospicorp.surfacearea.bet.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SinglePointResponse(
    @JsonProperty("point_count") int pointCount,
    double[][] nm,
    double[][] ssa
) {}
