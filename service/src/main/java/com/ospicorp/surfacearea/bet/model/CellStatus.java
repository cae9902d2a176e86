package com.ospicorp.surfacearea.bet.model;

public enum CellStatus {
  /** Regression ran and produced finite BET parameters. */
  COMPUTED,
  /** Regression ran but the intercept was zero or the BET parameters were not finite. */
  DEGENERATE,
  /** End index not after start index; no range exists. */
  NOT_COMPUTED
}
