package com.ospicorp.surfacearea.bet.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RangeStatistics(
    double min,
    double max,
    double mean,
    double median,
    @JsonProperty("standard_deviation") double standardDeviation
) {}
