package com.ospicorp.surfacearea.bet.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record AnalysisRequest(
    @Schema(description = "Ordered [relative pressure, adsorbed amount in mol/g] pairs",
        example = "[[0.05, 0.0016], [0.1, 0.0019], [0.15, 0.0021]]")
    @NotEmpty List<@NotNull @Size(min = 2, max = 2) List<@NotNull Double>> points,
    @Schema(description = "Adsorbate cross-sectional area in square angstrom", example = "16.2")
    @JsonProperty("adsorbate_area") @NotNull Double adsorbateArea,
    @Schema(description = "Adsorbate-adsorbent description", example = "nitrogen on carbon black")
    String info,
    @Schema(description = "Enabled Rouquerol criteria; all when omitted",
        example = "[\"pressure_consistency\", \"positive_intercept\", \"minimum_points\"]")
    List<String> criteria,
    @Schema(description = "Minimum points per relative pressure range", example = "5")
    @JsonProperty("min_points") Integer minPoints,
    @Schema(description = "Answer selection policy: error, points, min or max", example = "error")
    String policy
) {}
