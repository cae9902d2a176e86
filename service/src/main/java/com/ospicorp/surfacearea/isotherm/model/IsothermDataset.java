package com.ospicorp.surfacearea.isotherm.model;

import java.util.List;

/**
 * Validated, ordered isotherm with the adsorbate cross-sectional area it was measured with.
 *
 * <p>Derived columns (BET transform and {@code n(1 - p)}) are computed once on construction.
 * Instances are immutable.
 */
public final class IsothermDataset {

  private final List<IsothermPoint> points;
  private final double adsorbateArea;
  private final String label;
  private final double[] relativePressure;
  private final double[] adsorbedAmount;
  private final double[] betTransform;

  private IsothermDataset(List<IsothermPoint> points, double adsorbateArea, String label) {
    this.points = List.copyOf(points);
    this.adsorbateArea = adsorbateArea;
    this.label = label;
    int size = this.points.size();
    this.relativePressure = new double[size];
    this.adsorbedAmount = new double[size];
    this.betTransform = new double[size];
    for (int k = 0; k < size; k++) {
      IsothermPoint point = this.points.get(k);
      relativePressure[k] = point.relativePressure();
      adsorbedAmount[k] = point.adsorbedAmount();
      betTransform[k] = point.betTransform();
    }
  }

  public static IsothermDataset of(List<IsothermPoint> points, double adsorbateArea) {
    return of(points, adsorbateArea, null);
  }

  public static IsothermDataset of(List<IsothermPoint> points, double adsorbateArea, String label) {
    if (points == null || points.size() < 2) {
      throw new DataException("At least 2 isotherm points are required, got "
          + (points == null ? 0 : points.size()));
    }
    if (!Double.isFinite(adsorbateArea)) {
      throw new DataException("Adsorbate cross-sectional area must be numeric, got " + adsorbateArea);
    }
    for (int k = 0; k < points.size(); k++) {
      IsothermPoint point = points.get(k);
      if (point == null) {
        throw new DataException("Isotherm point " + k + " is missing");
      }
      double p = point.relativePressure();
      double n = point.adsorbedAmount();
      if (!Double.isFinite(p) || !Double.isFinite(n)) {
        throw new DataException("Isotherm point " + k + " is not numeric: (" + p + ", " + n + ")");
      }
      if (n == 0d) {
        throw new DataException("Adsorbed amount at point " + k + " is zero");
      }
      if (p < 0d || p >= 1d) {
        throw new DataException(
            "Relative pressure at point " + k + " must be in [0, 1), got " + p);
      }
    }
    return new IsothermDataset(points, adsorbateArea, label);
  }

  public int size() {
    return points.size();
  }

  public List<IsothermPoint> points() {
    return points;
  }

  public double adsorbateArea() {
    return adsorbateArea;
  }

  public String label() {
    return label;
  }

  public double relativePressure(int index) {
    return relativePressure[index];
  }

  public double adsorbedAmount(int index) {
    return adsorbedAmount[index];
  }

  public double betTransform(int index) {
    return betTransform[index];
  }

  public double pressureConsistencyTerm(int index) {
    return points.get(index).pressureConsistencyTerm();
  }

  public double[] relativePressures() {
    return relativePressure.clone();
  }

  public double[] adsorbedAmounts() {
    return adsorbedAmount.clone();
  }

  public boolean hasIncreasingPressure() {
    for (int k = 1; k < relativePressure.length; k++) {
      if (relativePressure[k] <= relativePressure[k - 1]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Relative pressure at which the adsorbed amount reaches {@code amount}, by linear
   * interpolation between the two bracketing measurements. Amounts outside the measured range
   * are extrapolated along the last segment; amounts below the first point map to its pressure.
   */
  public double relativePressureAt(double amount) {
    int size = adsorbedAmount.length;
    int high = 0;
    for (double n : adsorbedAmount) {
      if (n <= amount) {
        high++;
      }
    }
    if (high == size) {
      high--;
    }
    double slope = 0d;
    if (high > 0) {
      int low = high - 1;
      slope = (relativePressure[high] - relativePressure[low])
          / (adsorbedAmount[high] - adsorbedAmount[low]);
    }
    double offset = relativePressure[high] - adsorbedAmount[high] * slope;
    return slope * amount + offset;
  }
}
