package com.ospicorp.surfacearea.isotherm.model;

public record IsothermQualityReport(
    boolean adsorbedAmountIncreasing,
    int decreasingSteps,
    boolean pressureIncreasing,
    IsothermType type
) {}
