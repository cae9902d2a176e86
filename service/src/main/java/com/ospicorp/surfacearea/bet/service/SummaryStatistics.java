package com.ospicorp.surfacearea.bet.service;

import com.ospicorp.surfacearea.bet.model.IntervalCell;
import com.ospicorp.surfacearea.bet.model.IntervalResult;
import com.ospicorp.surfacearea.bet.model.RangeStatistics;
import com.ospicorp.surfacearea.bet.model.SelectionPolicy;
import com.ospicorp.surfacearea.bet.model.SurfaceAreaSummary;
import com.ospicorp.surfacearea.bet.model.ValidityMask;
import java.util.List;
import java.util.function.ToDoubleFunction;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

public final class SummaryStatistics {
  private SummaryStatistics() {
  }

  public static SurfaceAreaSummary summarize(IntervalResult result, ValidityMask mask) {
    List<IntervalCell> valid = AnswerSelector.validCells(result, mask);
    List<IntervalCell> ranked = SelectionPolicy.rankableByError(valid);
    return new SurfaceAreaSummary(
        valid.size(),
        statistics(valid, IntervalCell::ssa),
        statistics(valid, IntervalCell::c),
        extreme(valid, IntervalCell::ssa, false),
        extreme(valid, IntervalCell::ssa, true),
        SelectionPolicy.ERROR.choose(valid),
        extreme(ranked, IntervalCell::err, true));
  }

  static RangeStatistics statistics(List<IntervalCell> cells,
      ToDoubleFunction<IntervalCell> field) {
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (IntervalCell cell : cells) {
      stats.addValue(field.applyAsDouble(cell));
    }
    return new RangeStatistics(
        stats.getMin(),
        stats.getMax(),
        stats.getMean(),
        stats.getPercentile(50d),
        Math.sqrt(stats.getPopulationVariance()));
  }

  // First cell in scan order wins ties
  private static IntervalCell extreme(List<IntervalCell> cells,
      ToDoubleFunction<IntervalCell> field, boolean max) {
    IntervalCell best = cells.get(0);
    for (IntervalCell cell : cells) {
      double value = field.applyAsDouble(cell);
      double current = field.applyAsDouble(best);
      if (max ? value > current : value < current) {
        best = cell;
      }
    }
    return best;
  }
}
