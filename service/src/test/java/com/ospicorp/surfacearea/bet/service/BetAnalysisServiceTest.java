package com.ospicorp.surfacearea.bet.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.surfacearea.IsothermFixtures;
import com.ospicorp.surfacearea.bet.model.BetAnalysis;
import com.ospicorp.surfacearea.bet.model.CriteriaConfiguration;
import com.ospicorp.surfacearea.bet.model.Criterion;
import com.ospicorp.surfacearea.bet.model.Diagnostic;
import com.ospicorp.surfacearea.bet.model.NoValidRangeException;
import com.ospicorp.surfacearea.bet.model.SelectionPolicy;
import com.ospicorp.surfacearea.bet.model.SurfaceAreaAnswer;
import com.ospicorp.surfacearea.isotherm.model.DataException;
import com.ospicorp.surfacearea.isotherm.model.IsothermType;
import org.junit.jupiter.api.Test;

class BetAnalysisServiceTest {

  private final BetAnalysisService service =
      new BetAnalysisService(new IntervalRegressionEngine(400, 64), 5, "error");

  @Test
  void nitrogenIsothermAnswerByError() {
    BetAnalysis analysis = service.analyze(IsothermFixtures.nitrogen(),
        CriteriaConfiguration.defaults(), SelectionPolicy.ERROR);

    assertThat(analysis.hasAnswer()).isTrue();
    assertThat(analysis.mask().validCount()).isEqualTo(22);
    assertThat(analysis.answer().cell().end()).isEqualTo(8);
    assertThat(analysis.answer().cell().start()).isEqualTo(3);
    assertThat(analysis.answer().specificSurfaceArea()).isCloseTo(195.42, within(0.01));
    assertThat(analysis.answer().cell().c()).isCloseTo(98.76, within(0.01));
    assertThat(analysis.answer().startPressure()).isEqualTo(0.08);
    assertThat(analysis.answer().endPressure()).isEqualTo(0.21);
  }

  @Test
  void nitrogenIsothermAnswerByPoints() {
    SurfaceAreaAnswer answer = service.answer(IsothermFixtures.nitrogen(),
        CriteriaConfiguration.defaults(), SelectionPolicy.POINTS);

    assertThat(answer.cell().numPts()).isEqualTo(11);
    assertThat(answer.cell().end()).isEqualTo(10);
    assertThat(answer.cell().start()).isEqualTo(0);
    assertThat(answer.specificSurfaceArea()).isCloseTo(195.265, within(0.01));
  }

  @Test
  void summaryBracketsEverySelectedAnswer() {
    BetAnalysis analysis = service.analyze(IsothermFixtures.nitrogen(),
        CriteriaConfiguration.defaults(), SelectionPolicy.MIN);

    assertThat(analysis.summary().validRanges()).isEqualTo(22);
    assertThat(analysis.summary().ssa().min()).isCloseTo(194.687, within(0.01));
    assertThat(analysis.summary().ssa().max()).isCloseTo(195.558, within(0.01));
    assertThat(analysis.answer().specificSurfaceArea())
        .isEqualTo(analysis.summary().ssa().min());
  }

  @Test
  void diagnosticsDescribeTheIsotherm() {
    BetAnalysis analysis = service.analyze(IsothermFixtures.nitrogen(),
        CriteriaConfiguration.defaults(), SelectionPolicy.ERROR);

    assertThat(analysis.quality().adsorbedAmountIncreasing()).isTrue();
    assertThat(analysis.quality().type()).isNotEqualTo(IsothermType.UNDETERMINED);
    assertThat(analysis.diagnostics())
        .extracting(Diagnostic::message)
        .contains("Adsorbed amounts increase with relative pressure; data quality appears good.",
            "Isotherm is type " + analysis.quality().type() + ".");
    assertThat(analysis.diagnostics())
        .noneMatch(d -> d.level() == Diagnostic.Level.WARNING);
  }

  @Test
  void fixtureAnalysisHasNoAnswerButKeepsGrids() {
    BetAnalysis analysis = service.analyze(IsothermFixtures.small(),
        CriteriaConfiguration.defaults(), SelectionPolicy.ERROR);

    assertThat(analysis.hasAnswer()).isFalse();
    assertThat(analysis.summary()).isNull();
    assertThat(analysis.result().ssa(1, 0)).isCloseTo(283.36, within(0.01));
    assertThat(analysis.diagnostics())
        .extracting(Diagnostic::message)
        .contains("No valid relative pressure ranges. Specific surface area not calculated.");
    assertThat(analysis.mask().criteria()).hasSize(5);
  }

  @Test
  void fixtureAnswerWithoutValidRangeFails() {
    assertThatThrownBy(() -> service.answer(IsothermFixtures.small(),
        CriteriaConfiguration.defaults(), SelectionPolicy.ERROR))
        .isInstanceOf(NoValidRangeException.class);
  }

  @Test
  void relaxedFixtureSelectsByPolicy() {
    var config = CriteriaConfiguration.defaults()
        .without(Criterion.PRESSURE_CONSISTENCY)
        .without(Criterion.RELATIVE_PRESSURE_CONSISTENCY)
        .without(Criterion.MINIMUM_POINTS);

    assertThat(service.answer(IsothermFixtures.small(), config, SelectionPolicy.ERROR)
        .specificSurfaceArea()).isCloseTo(254.265, within(0.001));
    assertThat(service.answer(IsothermFixtures.small(), config, SelectionPolicy.POINTS)
        .specificSurfaceArea()).isCloseTo(314.919, within(0.001));
    assertThat(service.answer(IsothermFixtures.small(), config, SelectionPolicy.MAX)
        .specificSurfaceArea()).isCloseTo(314.919, within(0.001));
  }

  @Test
  void singlePointRespectsPointLimit() {
    var limited = new BetAnalysisService(new IntervalRegressionEngine(3, 0), 5, "points");

    assertThat(limited.defaultPolicy()).isEqualTo(SelectionPolicy.POINTS);
    assertThatThrownBy(() -> limited.singlePoint(IsothermFixtures.small()))
        .isInstanceOf(DataException.class);
  }
}
