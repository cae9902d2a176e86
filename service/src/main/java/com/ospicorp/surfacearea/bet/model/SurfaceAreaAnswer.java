package com.ospicorp.surfacearea.bet.model;

public record SurfaceAreaAnswer(
    SelectionPolicy policy,
    double specificSurfaceArea,
    IntervalCell cell,
    double startPressure,
    double endPressure
) {}
