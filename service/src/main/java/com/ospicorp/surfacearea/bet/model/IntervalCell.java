package com.ospicorp.surfacearea.bet.model;

public record IntervalCell(
    int end,
    int start,
    CellStatus status,
    double slope,
    double intercept,
    double r,
    double c,
    double nm,
    double ssa,
    double err,
    int numPts
) {

  public static IntervalCell notComputed(int end, int start) {
    return new IntervalCell(end, start, CellStatus.NOT_COMPUTED, 0d, 0d, 0d, 0d, 0d, 0d, 0d, 0);
  }

  public boolean isComputed() {
    return status == CellStatus.COMPUTED;
  }

  // Theoretical BET transform 1/(nm c) + (c - 1) p/(nm c) for this cell's parameters
  public double theoreticalTransform(double relativePressure) {
    double scale = nm * c;
    return 1d / scale + (c - 1d) * relativePressure / scale;
  }
}
