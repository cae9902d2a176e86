package com.ospicorp.surfacearea.bet.service;

import com.ospicorp.surfacearea.bet.model.SinglePointResult;
import com.ospicorp.surfacearea.isotherm.model.IsothermDataset;
import java.util.Arrays;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Single-point BET over every range, for comparison with the multi-point fit. The monolayer
 * amount is estimated as {@code n(1 - p)} at the range's median pressure and amount, which
 * assumes a large BET constant.
 */
public final class SinglePointBet {
  private SinglePointBet() {
  }

  public static SinglePointResult compute(IsothermDataset dataset) {
    int size = dataset.size();
    double[] pressures = dataset.relativePressures();
    double[] amounts = dataset.adsorbedAmounts();
    double[][] nm = new double[size][size];
    double[][] ssa = new double[size][size];
    Median median = new Median();
    for (int i = 1; i < size; i++) {
      for (int j = 0; j < i; j++) {
        double n = median.evaluate(Arrays.copyOfRange(amounts, j, i + 1));
        double p = median.evaluate(Arrays.copyOfRange(pressures, j, i + 1));
        nm[i][j] = n * (1d - p);
        ssa[i][j] = nm[i][j] * IntervalRegressionEngine.AVOGADRO * dataset.adsorbateArea()
            * IntervalRegressionEngine.SQ_ANGSTROM_TO_SQ_METRE;
      }
    }
    return new SinglePointResult(nm, ssa);
  }
}
