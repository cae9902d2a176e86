package com.ospicorp.surfacearea.bet.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.surfacearea.IsothermFixtures;
import com.ospicorp.surfacearea.bet.model.CellStatus;
import com.ospicorp.surfacearea.bet.model.CriteriaConfiguration;
import com.ospicorp.surfacearea.bet.model.IntervalCell;
import com.ospicorp.surfacearea.bet.model.IntervalResult;
import com.ospicorp.surfacearea.bet.model.NoValidRangeException;
import com.ospicorp.surfacearea.bet.model.SurfaceAreaSummary;
import com.ospicorp.surfacearea.bet.model.ValidityMask;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SummaryStatisticsTest {

  @Test
  void summarizesValidRangesOnly() {
    IntervalResult result = IntervalResult.builder(6, 11.11)
        .put(cell(3, 0, 1.0, 310.0, 90.0))
        .put(cell(4, 0, 2.0, 290.0, 100.0))
        .put(cell(5, 0, 3.0, 330.0, 110.0))
        .put(cell(5, 1, 0.5, 9999.0, 1.0))
        .build();
    boolean[][] invalid = new boolean[6][6];
    invalid[5][1] = true;
    ValidityMask mask = ValidityMask.of(invalid, Map.of(),
        CriteriaConfiguration.of(List.of(), 1));

    SurfaceAreaSummary summary = SummaryStatistics.summarize(result, mask);

    assertThat(summary.validRanges()).isEqualTo(3);
    assertThat(summary.ssa().min()).isEqualTo(290.0);
    assertThat(summary.ssa().max()).isEqualTo(330.0);
    assertThat(summary.ssa().mean()).isCloseTo(310.0, within(1e-9));
    assertThat(summary.ssa().median()).isCloseTo(310.0, within(1e-9));
    assertThat(summary.ssa().standardDeviation()).isCloseTo(16.3299, within(1e-4));
    assertThat(summary.c().mean()).isCloseTo(100.0, within(1e-9));
    assertThat(summary.minSsaCell().end()).isEqualTo(4);
    assertThat(summary.maxSsaCell().end()).isEqualTo(5);
    assertThat(summary.minErrorCell().end()).isEqualTo(3);
    assertThat(summary.maxErrorCell().err()).isEqualTo(3.0);
  }

  @Test
  void errorExtremesSkipTwoPointRanges() {
    IntervalResult result = IntervalResult.builder(6, 11.11)
        .put(cell(1, 0, 0.0, 280.0, 95.0))
        .put(cell(4, 0, 2.0, 290.0, 100.0))
        .put(cell(5, 0, 3.0, 330.0, 110.0))
        .build();
    ValidityMask mask = ValidityMask.of(new boolean[6][6], Map.of(),
        CriteriaConfiguration.of(List.of(), 1));

    SurfaceAreaSummary summary = SummaryStatistics.summarize(result, mask);

    assertThat(summary.validRanges()).isEqualTo(3);
    assertThat(summary.minErrorCell().end()).isEqualTo(4);
    assertThat(summary.minErrorCell())
        .isEqualTo(AnswerSelector.select(IsothermFixtures.small(), result, mask, "error").cell());
    assertThat(summary.maxErrorCell().end()).isEqualTo(5);
    assertThat(summary.ssa().min()).isEqualTo(280.0);
  }

  @Test
  void twoPointRangesRankedWhenNothingLongerIsValid() {
    IntervalResult result = IntervalResult.builder(6, 11.11)
        .put(cell(1, 0, 0.0, 280.0, 95.0))
        .put(cell(3, 2, 0.0, 285.0, 96.0))
        .build();
    ValidityMask mask = ValidityMask.of(new boolean[6][6], Map.of(),
        CriteriaConfiguration.of(List.of(), 1));

    SurfaceAreaSummary summary = SummaryStatistics.summarize(result, mask);

    assertThat(summary.minErrorCell().end()).isEqualTo(1);
    assertThat(summary.maxErrorCell().err()).isEqualTo(0.0);
  }

  @Test
  void nothingToSummarizeWithoutValidRange() {
    var dataset = IsothermFixtures.small();
    IntervalResult result = new IntervalRegressionEngine(400, 0).regress(dataset);
    ValidityMask mask = MaskCombiner.combine(dataset, result, CriteriaConfiguration.defaults());

    assertThatThrownBy(() -> SummaryStatistics.summarize(result, mask))
        .isInstanceOf(NoValidRangeException.class);
  }

  private static IntervalCell cell(int end, int start, double err, double ssa, double c) {
    return new IntervalCell(end, start, CellStatus.COMPUTED, 100.0, 1.0, 0.99, c, 0.003, ssa,
        err, end - start + 1);
  }
}
