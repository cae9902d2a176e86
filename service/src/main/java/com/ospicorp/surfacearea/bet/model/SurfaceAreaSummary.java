package com.ospicorp.surfacearea.bet.model;

// Statistics over the valid ranges only
public record SurfaceAreaSummary(
    int validRanges,
    RangeStatistics ssa,
    RangeStatistics c,
    IntervalCell minSsaCell,
    IntervalCell maxSsaCell,
    IntervalCell minErrorCell,
    IntervalCell maxErrorCell
) {}
