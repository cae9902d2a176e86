package com.ospicorp.surfacearea.bet.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AnswerResponse(
    String policy,
    @JsonProperty("specific_surface_area") double specificSurfaceArea,
    @JsonProperty("start_index") int startIndex,
    @JsonProperty("end_index") int endIndex,
    @JsonProperty("start_pressure") double startPressure,
    @JsonProperty("end_pressure") double endPressure,
    @JsonProperty("num_pts") int numPts,
    @JsonProperty("bet_constant") double betConstant,
    @JsonProperty("monolayer_amount") double monolayerAmount,
    double err,
    double r
) {

  public static AnswerResponse from(SurfaceAreaAnswer answer) {
    IntervalCell cell = answer.cell();
    return new AnswerResponse(
        answer.policy().code(),
        answer.specificSurfaceArea(),
        cell.start(),
        cell.end(),
        answer.startPressure(),
        answer.endPressure(),
        cell.numPts(),
        cell.c(),
        cell.nm(),
        cell.err(),
        cell.r());
  }
}
