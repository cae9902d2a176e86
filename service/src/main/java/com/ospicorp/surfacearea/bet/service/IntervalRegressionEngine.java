package com.ospicorp.surfacearea.bet.service;

import com.ospicorp.surfacearea.bet.model.CellStatus;
import com.ospicorp.surfacearea.bet.model.IntervalCell;
import com.ospicorp.surfacearea.bet.model.IntervalResult;
import com.ospicorp.surfacearea.isotherm.model.DataException;
import com.ospicorp.surfacearea.isotherm.model.IsothermDataset;
import java.util.stream.IntStream;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits the linearised BET equation to every contiguous range of an isotherm.
 *
 * <p>For each pair {@code start < end} the BET transform is regressed on relative pressure over
 * the closed range, and the BET constant, monolayer amount, specific surface area and average
 * relative deviation from the theoretical isotherm are derived. Cost grows with the cube of the
 * point count, so the number of points is capped; rows are fitted in parallel once the isotherm
 * reaches {@code parallelThreshold} points.
 */
public class IntervalRegressionEngine {
  private static final Logger log = LoggerFactory.getLogger(IntervalRegressionEngine.class);

  public static final double AVOGADRO = 6.022e23;
  // square angstrom to square metre
  static final double SQ_ANGSTROM_TO_SQ_METRE = 1e-20;

  private final int maxPoints;
  private final int parallelThreshold;

  public IntervalRegressionEngine(int maxPoints, int parallelThreshold) {
    if (maxPoints < 2) {
      throw new IllegalArgumentException("maxPoints must be at least 2");
    }
    this.maxPoints = maxPoints;
    this.parallelThreshold = parallelThreshold;
  }

  public int maxPoints() {
    return maxPoints;
  }

  public void requireWithinLimit(IsothermDataset dataset) {
    if (dataset.size() > maxPoints) {
      throw new DataException("Isotherm has " + dataset.size() + " points, more than the "
          + "configured maximum of " + maxPoints);
    }
  }

  public IntervalResult regress(IsothermDataset dataset) {
    requireWithinLimit(dataset);
    int size = dataset.size();
    IntervalResult.Builder builder = IntervalResult.builder(size, dataset.adsorbateArea());

    IntStream rows = IntStream.range(1, size);
    if (parallelThreshold > 0 && size >= parallelThreshold) {
      rows = rows.parallel();
    }
    rows.forEach(end -> {
      for (int start = 0; start < end; start++) {
        builder.put(fit(dataset, end, start));
      }
    });

    IntervalResult result = builder.build();
    int degenerate = result.degenerateCount();
    if (degenerate > 0) {
      log.debug("{} of {} ranges had a degenerate BET fit and were zeroed", degenerate,
          size * (size - 1) / 2);
    }
    log.debug("Regressed {} ranges over {} isotherm points", size * (size - 1) / 2, size);
    return result;
  }

  static IntervalCell fit(IsothermDataset dataset, int end, int start) {
    SimpleRegression regression = new SimpleRegression();
    for (int k = start; k <= end; k++) {
      regression.addData(dataset.relativePressure(k), dataset.betTransform(k));
    }
    double slope = finiteOrZero(regression.getSlope());
    double intercept = finiteOrZero(regression.getIntercept());
    double r = finiteOrZero(regression.getR());
    int numPts = end - start + 1;

    if (intercept == 0d) {
      return degenerate(end, start, slope, r, numPts);
    }
    double c = slope / intercept + 1d;
    double nm = 1d / (intercept * c);
    if (!Double.isFinite(c) || !Double.isFinite(nm)) {
      return degenerate(end, start, slope, r, numPts);
    }
    double ssa = finiteOrZero(
        nm * AVOGADRO * dataset.adsorbateArea() * SQ_ANGSTROM_TO_SQ_METRE);

    IntervalCell cell = new IntervalCell(end, start, CellStatus.COMPUTED, slope, intercept, r, c,
        nm, ssa, 0d, numPts);
    return new IntervalCell(end, start, CellStatus.COMPUTED, slope, intercept, r, c, nm, ssa,
        averageDeviation(dataset, cell), numPts);
  }

  // Mean relative deviation from the theoretical isotherm over the range, in percent
  private static double averageDeviation(IsothermDataset dataset, IntervalCell cell) {
    if (cell.end() - cell.start() == 1) {
      return 0d;
    }
    double sum = 0d;
    for (int k = cell.start(); k <= cell.end(); k++) {
      double theory = cell.theoreticalTransform(dataset.relativePressure(k));
      sum += finiteOrZero(Math.abs(theory - dataset.betTransform(k)) / theory);
    }
    return finiteOrZero(100d * sum / cell.numPts());
  }

  private static IntervalCell degenerate(int end, int start, double slope, double r, int numPts) {
    return new IntervalCell(end, start, CellStatus.DEGENERATE, slope, 0d, r, 0d, 0d, 0d, 0d,
        numPts);
  }

  private static double finiteOrZero(double value) {
    return Double.isFinite(value) ? value : 0d;
  }
}
