package com.ospicorp.surfacearea.bet.model;

import java.util.Locale;

/** The five Rouquerol consistency criteria for choosing a BET range. */
public enum Criterion {
  /** n(1 - p) keeps increasing with p. */
  PRESSURE_CONSISTENCY("pressure_consistency"),
  /** The BET plot intercept is positive, so C is positive. */
  POSITIVE_INTERCEPT("positive_intercept"),
  /** The monolayer amount lies within the adsorbed amounts of the range. */
  MONOLAYER_RANGE("monolayer_range"),
  /** Interpolated and BET-predicted pressures at monolayer coverage agree within 10%. */
  RELATIVE_PRESSURE_CONSISTENCY("relative_pressure_consistency"),
  /** The range holds at least the configured number of points. */
  MINIMUM_POINTS("minimum_points");

  private final String code;

  Criterion(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static Criterion fromCode(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (Criterion criterion : values()) {
        if (criterion.code.equals(normalized)) {
          return criterion;
        }
      }
    }
    throw new IllegalArgumentException("Unknown criterion: " + value);
  }
}
