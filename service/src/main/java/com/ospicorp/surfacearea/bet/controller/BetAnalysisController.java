package com.ospicorp.surfacearea.bet.controller;

import com.ospicorp.surfacearea.bet.model.AnalysisRequest;
import com.ospicorp.surfacearea.bet.model.AnalysisResponse;
import com.ospicorp.surfacearea.bet.model.AnswerResponse;
import com.ospicorp.surfacearea.bet.model.CriteriaConfiguration;
import com.ospicorp.surfacearea.bet.model.Criterion;
import com.ospicorp.surfacearea.bet.model.SelectionPolicy;
import com.ospicorp.surfacearea.bet.model.SinglePointResponse;
import com.ospicorp.surfacearea.bet.model.SinglePointResult;
import com.ospicorp.surfacearea.bet.service.BetAnalysisService;
import com.ospicorp.surfacearea.isotherm.model.IsothermDataset;
import com.ospicorp.surfacearea.isotherm.model.IsothermPoint;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/bet")
@Validated
@Tag(name = "BET")
public class BetAnalysisController {
  private static final String ERROR_DOCS_BASE = "https://docs.surface-area-api.dev/errors/";

  private final BetAnalysisService service;

  public BetAnalysisController(BetAnalysisService service) {
    this.service = service;
  }

  @PostMapping("/analyses")
  @Operation(summary = "Run a BET analysis",
      description = "Fit every relative pressure range, apply the Rouquerol criteria and select a "
          + "specific surface area.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Full analysis, answer omitted when no range is valid",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = AnalysisResponse.class))),
      @ApiResponse(responseCode = "400", description = "Invalid isotherm or parameter",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "409", description = "Points policy tie",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public AnalysisResponse analyze(@Valid @RequestBody AnalysisRequest request) {
    CriteriaConfiguration criteria = parseCriteria(request);
    SelectionPolicy policy = parsePolicy(request.policy());
    return AnalysisResponse.from(service.analyze(toDataset(request), criteria, policy));
  }

  @PostMapping("/answer")
  @Operation(summary = "Select a specific surface area",
      description = "Return only the range chosen by the selection policy.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Selected range",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = AnswerResponse.class))),
      @ApiResponse(responseCode = "400", description = "Invalid isotherm or parameter",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "409", description = "Points policy tie",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "No valid relative pressure range",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public AnswerResponse answer(@Valid @RequestBody AnalysisRequest request) {
    CriteriaConfiguration criteria = parseCriteria(request);
    SelectionPolicy policy = parsePolicy(request.policy());
    return AnswerResponse.from(service.answer(toDataset(request), criteria, policy));
  }

  @PostMapping("/single-point")
  @Operation(summary = "Single-point BET grids",
      description = "Monolayer amount and surface area from one point per range, assuming a large "
          + "BET constant.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Single-point grids",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = SinglePointResponse.class))),
      @ApiResponse(responseCode = "400", description = "Invalid isotherm",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public SinglePointResponse singlePoint(@Valid @RequestBody AnalysisRequest request) {
    IsothermDataset dataset = toDataset(request);
    SinglePointResult result = service.singlePoint(dataset);
    return new SinglePointResponse(dataset.size(), result.nm(), result.ssa());
  }

  private static IsothermDataset toDataset(AnalysisRequest request) {
    List<IsothermPoint> points = new ArrayList<>(request.points().size());
    for (List<Double> pair : request.points()) {
      points.add(new IsothermPoint(pair.get(0), pair.get(1)));
    }
    return IsothermDataset.of(points, request.adsorbateArea(), request.info());
  }

  private CriteriaConfiguration parseCriteria(AnalysisRequest request) {
    int minPoints = request.minPoints() == null
        ? service.defaultMinimumPoints() : request.minPoints();
    if (minPoints < 1) {
      throw invalidParameter("Invalid min_points parameter. Must be greater than or equal to 1.",
          2003);
    }
    if (request.criteria() == null) {
      return CriteriaConfiguration.defaults().withMinimumPoints(minPoints);
    }
    Set<Criterion> enabled = EnumSet.noneOf(Criterion.class);
    for (String code : request.criteria()) {
      try {
        enabled.add(Criterion.fromCode(code));
      } catch (IllegalArgumentException ex) {
        throw invalidParameter("Invalid criterion '" + code + "'. Supported values: "
            + "pressure_consistency,positive_intercept,monolayer_range,"
            + "relative_pressure_consistency,minimum_points.", 2002);
      }
    }
    return CriteriaConfiguration.of(enabled, minPoints);
  }

  private SelectionPolicy parsePolicy(String value) {
    if (value == null) {
      return service.defaultPolicy();
    }
    try {
      return SelectionPolicy.fromCode(value);
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("Invalid selection policy. Supported values: points,error,min,max.",
          2001);
    }
  }

  private static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }
}
