package com.ospicorp.surfacearea.bet.service;

import com.ospicorp.surfacearea.bet.model.CellStatus;
import com.ospicorp.surfacearea.bet.model.Criterion;
import com.ospicorp.surfacearea.bet.model.CriterionGrid;
import com.ospicorp.surfacearea.bet.model.IntervalResult;
import com.ospicorp.surfacearea.isotherm.model.IsothermDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The five Rouquerol checks. Each returns a grid indexed {@code [end][start]} where a cell
 * passes only if the range satisfies that criterion on its own.
 */
public final class RouquerolCriteria {
  private static final Logger log = LoggerFactory.getLogger(RouquerolCriteria.class);

  static final double PRESSURE_TOLERANCE = 0.1d;

  private RouquerolCriteria() {
  }

  public static CriterionGrid evaluate(Criterion criterion, IsothermDataset dataset,
      IntervalResult result, int minimumPoints) {
    CriterionGrid grid = switch (criterion) {
      case PRESSURE_CONSISTENCY -> pressureConsistency(dataset);
      case POSITIVE_INTERCEPT -> positiveIntercept(result);
      case MONOLAYER_RANGE -> monolayerRange(dataset, result);
      case RELATIVE_PRESSURE_CONSISTENCY -> relativePressureConsistency(dataset, result);
      case MINIMUM_POINTS -> minimumPoints(dataset.size(), minimumPoints);
    };
    if (grid.failsEverywhere()) {
      log.info("All relative pressure ranges fail the {} check", criterion.code());
    }
    return grid;
  }

  /**
   * n(1 - p) must not decrease as p increases. A range fails when any step inside it, from
   * point {@code start} to point {@code end}, decreases; ranges that lie wholly before or after
   * a drop are unaffected by it.
   */
  public static CriterionGrid pressureConsistency(IsothermDataset dataset) {
    int size = dataset.size();
    // drops[k]: decreasing steps among 1..k
    int[] drops = new int[size];
    for (int k = 1; k < size; k++) {
      boolean decreasing = dataset.pressureConsistencyTerm(k)
          < dataset.pressureConsistencyTerm(k - 1);
      drops[k] = drops[k - 1] + (decreasing ? 1 : 0);
    }
    boolean[][] passes = new boolean[size][size];
    for (int i = 1; i < size; i++) {
      for (int j = 0; j < i; j++) {
        passes[i][j] = drops[i] == drops[j];
      }
    }
    return CriterionGrid.of(passes);
  }

  public static CriterionGrid positiveIntercept(IntervalResult result) {
    int size = result.size();
    boolean[][] passes = new boolean[size][size];
    for (int i = 0; i < size; i++) {
      for (int j = 0; j < size; j++) {
        passes[i][j] = result.intercept(i, j) > 0d;
      }
    }
    return CriterionGrid.of(passes);
  }

  // n(start) <= nm <= n(end)
  public static CriterionGrid monolayerRange(IsothermDataset dataset, IntervalResult result) {
    int size = result.size();
    boolean[][] passes = new boolean[size][size];
    for (int i = 1; i < size; i++) {
      for (int j = 0; j < i; j++) {
        double nm = result.nm(i, j);
        passes[i][j] = dataset.adsorbedAmount(j) <= nm && nm <= dataset.adsorbedAmount(i);
      }
    }
    return CriterionGrid.of(passes);
  }

  /**
   * The relative pressure at which the measured isotherm reaches nm (linear interpolation) must
   * agree within 10% with the pressure the fitted BET equation predicts for nm. The BET equation
   * solved for p is quadratic; both roots are tried since either may be the physical one.
   */
  public static CriterionGrid relativePressureConsistency(IsothermDataset dataset,
      IntervalResult result) {
    int size = result.size();
    boolean[][] passes = new boolean[size][size];
    for (int i = 1; i < size; i++) {
      for (int j = 0; j < i; j++) {
        double nm = result.nm(i, j);
        if (result.status(i, j) != CellStatus.COMPUTED || nm == 0d) {
          continue;
        }
        double interpolated = dataset.relativePressureAt(nm);
        double slope = result.slope(i, j);
        double intercept = result.intercept(i, j);
        double[] roots = QuadraticRoots.realParts(
            -slope * nm,
            slope * nm - 1d - intercept * nm,
            intercept * nm);
        passes[i][j] = smallestDeviation(roots, interpolated) < PRESSURE_TOLERANCE;
      }
    }
    return CriterionGrid.of(passes);
  }

  public static CriterionGrid minimumPoints(int size, int points) {
    if (points < 1) {
      throw new IllegalArgumentException("points must be at least 1, got " + points);
    }
    boolean[][] passes = new boolean[size][size];
    for (int i = 0; i < size; i++) {
      for (int j = 0; j < size; j++) {
        passes[i][j] = i - j + 1 >= points;
      }
    }
    return CriterionGrid.of(passes);
  }

  private static double smallestDeviation(double[] roots, double interpolated) {
    double smallest = Double.POSITIVE_INFINITY;
    for (double root : roots) {
      double deviation = Math.abs((root - interpolated) / interpolated);
      if (deviation < smallest) {
        smallest = deviation;
      }
    }
    return smallest;
  }
}
