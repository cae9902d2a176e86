package com.ospicorp.surfacearea.bet.service;

import com.ospicorp.surfacearea.bet.model.CellStatus;
import com.ospicorp.surfacearea.bet.model.CriteriaConfiguration;
import com.ospicorp.surfacearea.bet.model.Criterion;
import com.ospicorp.surfacearea.bet.model.CriterionGrid;
import com.ospicorp.surfacearea.bet.model.IntervalResult;
import com.ospicorp.surfacearea.bet.model.ValidityMask;
import com.ospicorp.surfacearea.isotherm.model.IsothermDataset;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MaskCombiner {
  private static final Logger log = LoggerFactory.getLogger(MaskCombiner.class);

  private MaskCombiner() {
  }

  public static ValidityMask combine(IsothermDataset dataset, IntervalResult result,
      CriteriaConfiguration configuration) {
    if (dataset.size() != result.size()) {
      throw new IllegalArgumentException("Result grid of size " + result.size()
          + " does not belong to an isotherm of " + dataset.size() + " points");
    }
    Map<Criterion, CriterionGrid> evaluated = new EnumMap<>(Criterion.class);
    for (Criterion criterion : configuration.enabled()) {
      evaluated.put(criterion, RouquerolCriteria.evaluate(criterion, dataset, result,
          configuration.minimumPoints()));
    }
    return combine(result, evaluated, configuration);
  }

  /**
   * Only ranges with end after start and a non-degenerate fit can be valid; every evaluated
   * criterion must pass on top of that. The returned mask is inverted: {@code true} = invalid.
   */
  static ValidityMask combine(IntervalResult result, Map<Criterion, CriterionGrid> evaluated,
      CriteriaConfiguration configuration) {
    int size = result.size();
    boolean[][] invalid = new boolean[size][size];
    for (int i = 0; i < size; i++) {
      for (int j = 0; j < size; j++) {
        boolean valid = i > j && result.status(i, j) == CellStatus.COMPUTED;
        for (CriterionGrid grid : evaluated.values()) {
          valid = valid && grid.passes(i, j);
        }
        invalid[i][j] = !valid;
      }
    }
    ValidityMask mask = ValidityMask.of(invalid, evaluated, configuration);
    if (mask.isEntirelyInvalid()) {
      log.warn("No valid relative pressure ranges with criteria {} and minimum {} points",
          configuration.enabled(), configuration.minimumPoints());
    } else {
      log.debug("{} valid relative pressure ranges", mask.validCount());
    }
    return mask;
  }
}
