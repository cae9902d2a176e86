package com.ospicorp.surfacearea.bet.service;

import com.ospicorp.surfacearea.bet.model.IntervalCell;
import com.ospicorp.surfacearea.bet.model.IntervalResult;
import com.ospicorp.surfacearea.bet.model.NoValidRangeException;
import com.ospicorp.surfacearea.bet.model.SelectionPolicy;
import com.ospicorp.surfacearea.bet.model.SurfaceAreaAnswer;
import com.ospicorp.surfacearea.bet.model.ValidityMask;
import com.ospicorp.surfacearea.isotherm.model.IsothermDataset;
import java.util.ArrayList;
import java.util.List;

public final class AnswerSelector {
  private AnswerSelector() {
  }

  public static SurfaceAreaAnswer select(IsothermDataset dataset, IntervalResult result,
      ValidityMask mask, String policy) {
    return select(dataset, result, mask, SelectionPolicy.fromCode(policy));
  }

  public static SurfaceAreaAnswer select(IsothermDataset dataset, IntervalResult result,
      ValidityMask mask, SelectionPolicy policy) {
    IntervalCell chosen = policy.choose(validCells(result, mask));
    return new SurfaceAreaAnswer(policy, chosen.ssa(), chosen,
        dataset.relativePressure(chosen.start()), dataset.relativePressure(chosen.end()));
  }

  /**
   * Computed cells the mask leaves valid, in scan order. Throws when nothing is left to choose
   * from.
   */
  public static List<IntervalCell> validCells(IntervalResult result, ValidityMask mask) {
    if (mask.size() != result.size()) {
      throw new IllegalArgumentException("Mask of size " + mask.size()
          + " does not match result grid of size " + result.size());
    }
    List<IntervalCell> valid = new ArrayList<>();
    for (IntervalCell cell : result.cells()) {
      if (cell.isComputed() && mask.isValid(cell.end(), cell.start())) {
        valid.add(cell);
      }
    }
    if (valid.isEmpty()) {
      throw new NoValidRangeException();
    }
    return valid;
  }
}
