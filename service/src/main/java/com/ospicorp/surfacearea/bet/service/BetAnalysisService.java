package com.ospicorp.surfacearea.bet.service;

import com.ospicorp.surfacearea.bet.model.BetAnalysis;
import com.ospicorp.surfacearea.bet.model.CriteriaConfiguration;
import com.ospicorp.surfacearea.bet.model.CriterionGrid;
import com.ospicorp.surfacearea.bet.model.Diagnostic;
import com.ospicorp.surfacearea.bet.model.IntervalResult;
import com.ospicorp.surfacearea.bet.model.SelectionPolicy;
import com.ospicorp.surfacearea.bet.model.SinglePointResult;
import com.ospicorp.surfacearea.bet.model.SurfaceAreaAnswer;
import com.ospicorp.surfacearea.bet.model.SurfaceAreaSummary;
import com.ospicorp.surfacearea.bet.model.ValidityMask;
import com.ospicorp.surfacearea.isotherm.model.IsothermDataset;
import com.ospicorp.surfacearea.isotherm.model.IsothermQualityReport;
import com.ospicorp.surfacearea.isotherm.model.IsothermType;
import com.ospicorp.surfacearea.isotherm.service.IsothermDiagnostics;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class BetAnalysisService {
  private static final Logger log = LoggerFactory.getLogger(BetAnalysisService.class);

  private final IntervalRegressionEngine engine;
  private final int defaultMinimumPoints;
  private final SelectionPolicy defaultPolicy;

  public BetAnalysisService(IntervalRegressionEngine engine,
      @Value("${analysis.default-min-points:5}") int defaultMinimumPoints,
      @Value("${analysis.default-policy:error}") String defaultPolicy) {
    this.engine = engine;
    this.defaultMinimumPoints = defaultMinimumPoints;
    this.defaultPolicy = SelectionPolicy.fromCode(defaultPolicy);
  }

  public int defaultMinimumPoints() {
    return defaultMinimumPoints;
  }

  public SelectionPolicy defaultPolicy() {
    return defaultPolicy;
  }

  public BetAnalysis analyze(IsothermDataset dataset, CriteriaConfiguration criteria,
      SelectionPolicy policy) {
    List<Diagnostic> diagnostics = new ArrayList<>();

    IsothermQualityReport quality = IsothermDiagnostics.assess(dataset);
    describeQuality(quality, diagnostics);

    IntervalResult result = engine.regress(dataset);
    if (result.degenerateCount() > 0) {
      diagnostics.add(Diagnostic.warning(result.degenerateCount()
          + " relative pressure range(s) had a zero intercept or non-finite BET constant and "
          + "were excluded."));
    }

    ValidityMask mask = MaskCombiner.combine(dataset, result, criteria);
    mask.criteria().forEach((criterion, grid) -> describeCriterion(criterion.code(), grid,
        diagnostics));

    SurfaceAreaAnswer answer = null;
    SurfaceAreaSummary summary = null;
    if (mask.isEntirelyInvalid()) {
      diagnostics.add(Diagnostic.warning(
          "No valid relative pressure ranges. Specific surface area not calculated."));
    } else {
      summary = SummaryStatistics.summarize(result, mask);
      answer = AnswerSelector.select(dataset, result, mask, policy);
      log.info("BET analysis of {} points: {} valid ranges, SSA {} m2/g by {}",
          dataset.size(), mask.validCount(),
          String.format(Locale.ROOT, "%.2f", answer.specificSurfaceArea()), policy.code());
    }
    return new BetAnalysis(dataset, quality, result, mask, answer, summary, diagnostics);
  }

  public SurfaceAreaAnswer answer(IsothermDataset dataset, CriteriaConfiguration criteria,
      SelectionPolicy policy) {
    IntervalResult result = engine.regress(dataset);
    ValidityMask mask = MaskCombiner.combine(dataset, result, criteria);
    return AnswerSelector.select(dataset, result, mask, policy);
  }

  public SinglePointResult singlePoint(IsothermDataset dataset) {
    engine.requireWithinLimit(dataset);
    return SinglePointBet.compute(dataset);
  }

  private static void describeQuality(IsothermQualityReport quality,
      List<Diagnostic> diagnostics) {
    if (quality.adsorbedAmountIncreasing()) {
      diagnostics.add(Diagnostic.info(
          "Adsorbed amounts increase with relative pressure; data quality appears good."));
    } else {
      diagnostics.add(Diagnostic.warning("Isotherm data is suspect: adsorbed amount decreases "
          + quality.decreasingSteps() + " time(s) as relative pressure increases."));
    }
    if (!quality.pressureIncreasing()) {
      diagnostics.add(Diagnostic.warning("Relative pressures are not strictly increasing."));
    }
    if (quality.type() != IsothermType.UNDETERMINED) {
      diagnostics.add(Diagnostic.info("Isotherm is type " + quality.type() + "."));
    }
  }

  private static void describeCriterion(String code, CriterionGrid grid,
      List<Diagnostic> diagnostics) {
    if (grid.failsEverywhere()) {
      diagnostics.add(Diagnostic.info("All relative pressure ranges fail the " + code
          + " check."));
    }
  }
}
