package com.ospicorp.surfacearea.bet.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.surfacearea.isotherm.model.IsothermDataset;
import com.ospicorp.surfacearea.isotherm.model.IsothermQualityReport;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Grids are indexed [end][start]; invalid_mask is true where a range is rejected
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponse(
    String info,
    @JsonProperty("point_count") int pointCount,
    @JsonProperty("adsorbate_area") double adsorbateArea,
    Quality quality,
    Grids grids,
    @JsonProperty("invalid_mask") boolean[][] invalidMask,
    Map<String, int[][]> checks,
    @JsonProperty("min_points") int minPoints,
    @JsonProperty("valid_count") int validCount,
    AnswerResponse answer,
    Summary summary,
    List<Diagnostic> diagnostics
) {

  public record Quality(
      @JsonProperty("adsorbed_amount_increasing") boolean adsorbedAmountIncreasing,
      @JsonProperty("decreasing_steps") int decreasingSteps,
      @JsonProperty("pressure_increasing") boolean pressureIncreasing,
      @JsonProperty("isotherm_type") String isothermType
  ) {}

  public record Grids(
      double[][] slope,
      double[][] intercept,
      double[][] r,
      double[][] c,
      double[][] nm,
      double[][] ssa,
      double[][] err,
      @JsonProperty("num_pts") int[][] numPts
  ) {}

  public record Summary(
      @JsonProperty("valid_ranges") int validRanges,
      RangeStatistics ssa,
      RangeStatistics c,
      @JsonProperty("min_ssa") AnswerResponse minSsa,
      @JsonProperty("max_ssa") AnswerResponse maxSsa,
      @JsonProperty("min_error") AnswerResponse minError,
      @JsonProperty("max_error") AnswerResponse maxError
  ) {}

  public static AnalysisResponse from(BetAnalysis analysis) {
    IsothermDataset dataset = analysis.dataset();
    IsothermQualityReport report = analysis.quality();
    IntervalResult result = analysis.result();
    ValidityMask mask = analysis.mask();

    Map<String, int[][]> checks = new LinkedHashMap<>();
    mask.criteria().forEach((criterion, grid) -> checks.put(criterion.code(), grid.toIntGrid()));

    Summary summary = null;
    if (analysis.summary() != null) {
      SurfaceAreaSummary s = analysis.summary();
      summary = new Summary(s.validRanges(), s.ssa(), s.c(),
          describe(dataset, s.minSsaCell()), describe(dataset, s.maxSsaCell()),
          describe(dataset, s.minErrorCell()), describe(dataset, s.maxErrorCell()));
    }

    return new AnalysisResponse(
        dataset.label(),
        dataset.size(),
        dataset.adsorbateArea(),
        new Quality(report.adsorbedAmountIncreasing(), report.decreasingSteps(),
            report.pressureIncreasing(), report.type().name()),
        new Grids(result.slopeGrid(), result.interceptGrid(), result.rGrid(), result.cGrid(),
            result.nmGrid(), result.ssaGrid(), result.errGrid(), result.numPtsGrid()),
        mask.toArray(),
        checks,
        mask.configuration().minimumPoints(),
        mask.validCount(),
        analysis.hasAnswer() ? AnswerResponse.from(analysis.answer()) : null,
        summary,
        analysis.diagnostics());
  }

  private static AnswerResponse describe(IsothermDataset dataset, IntervalCell cell) {
    return new AnswerResponse(null, cell.ssa(), cell.start(), cell.end(),
        dataset.relativePressure(cell.start()), dataset.relativePressure(cell.end()),
        cell.numPts(), cell.c(), cell.nm(), cell.err(), cell.r());
  }
}
