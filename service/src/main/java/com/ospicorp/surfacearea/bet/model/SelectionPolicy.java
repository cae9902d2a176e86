package com.ospicorp.surfacearea.bet.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * How a single surface area is picked from the valid ranges. Each policy receives the valid
 * cells in scan order (end ascending, then start ascending) and never an empty list.
 */
public enum SelectionPolicy {
  ERROR("error") {
    @Override
    public IntervalCell choose(List<IntervalCell> valid) {
      List<IntervalCell> ranked = rankableByError(valid);
      IntervalCell best = ranked.get(0);
      for (IntervalCell cell : ranked) {
        if (cell.err() < best.err()
            || (cell.err() == best.err() && cell.numPts() > best.numPts())) {
          best = cell;
        }
      }
      return best;
    }
  },
  POINTS("points") {
    @Override
    public IntervalCell choose(List<IntervalCell> valid) {
      IntervalCell best = valid.get(0);
      int ties = 1;
      for (IntervalCell cell : valid.subList(1, valid.size())) {
        if (cell.numPts() > best.numPts()) {
          best = cell;
          ties = 1;
        } else if (cell.numPts() == best.numPts()) {
          ties++;
        }
      }
      if (ties > 1) {
        throw new SelectionAmbiguityException("No single specific surface area answer: " + ties
            + " relative pressure ranges share the maximum of " + best.numPts() + " points.", ties);
      }
      return best;
    }
  },
  MIN("min") {
    @Override
    public IntervalCell choose(List<IntervalCell> valid) {
      IntervalCell best = valid.get(0);
      for (IntervalCell cell : valid) {
        if (cell.ssa() < best.ssa()) {
          best = cell;
        }
      }
      return best;
    }
  },
  MAX("max") {
    @Override
    public IntervalCell choose(List<IntervalCell> valid) {
      IntervalCell best = valid.get(0);
      for (IntervalCell cell : valid) {
        if (cell.ssa() > best.ssa()) {
          best = cell;
        }
      }
      return best;
    }
  };

  private final String code;

  SelectionPolicy(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public abstract IntervalCell choose(List<IntervalCell> valid);

  /**
   * Cells whose error is meaningful for ranking. Two-point fits are exact, so their zero error
   * says nothing about fit quality; they are kept only when no longer range is valid.
   */
  public static List<IntervalCell> rankableByError(List<IntervalCell> valid) {
    List<IntervalCell> ranked = new ArrayList<>();
    for (IntervalCell cell : valid) {
      if (cell.numPts() > 2) {
        ranked.add(cell);
      }
    }
    return ranked.isEmpty() ? valid : ranked;
  }

  public static SelectionPolicy fromCode(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (SelectionPolicy policy : values()) {
        if (policy.code.equals(normalized)) {
          return policy;
        }
      }
    }
    throw new IllegalArgumentException(
        "Invalid selection policy '" + value + "', must be points, error, min, or max.");
  }
}
