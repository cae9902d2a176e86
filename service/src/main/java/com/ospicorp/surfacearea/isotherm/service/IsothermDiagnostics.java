package com.ospicorp.surfacearea.isotherm.service;

import com.ospicorp.surfacearea.isotherm.model.IsothermDataset;
import com.ospicorp.surfacearea.isotherm.model.IsothermQualityReport;
import com.ospicorp.surfacearea.isotherm.model.IsothermType;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advisory data-quality checks. Nothing here blocks the BET computation.
 */
public final class IsothermDiagnostics {
  private static final Logger log = LoggerFactory.getLogger(IsothermDiagnostics.class);

  static final int CURVATURE_SAMPLES = 50;

  private IsothermDiagnostics() {
  }

  public static IsothermQualityReport assess(IsothermDataset dataset) {
    int decreasing = countDecreasingSteps(dataset);
    boolean pressureIncreasing = dataset.hasIncreasingPressure();
    IsothermType type = classify(dataset);

    if (decreasing > 0) {
      log.warn("Isotherm data is suspect: adsorbed amount decreases {} time(s) as relative "
          + "pressure increases", decreasing);
    }
    log.debug("Isotherm classified as type {}", type);
    return new IsothermQualityReport(decreasing == 0, decreasing, pressureIncreasing, type);
  }

  static int countDecreasingSteps(IsothermDataset dataset) {
    int count = 0;
    for (int k = 1; k < dataset.size(); k++) {
      if (dataset.adsorbedAmount(k) < dataset.adsorbedAmount(k - 1)) {
        count++;
      }
    }
    return count;
  }

  public static IsothermType classify(IsothermDataset dataset) {
    if (dataset.size() < 3 || !dataset.hasIncreasingPressure()) {
      return IsothermType.UNDETERMINED;
    }
    double[] x = dataset.relativePressures();
    PolynomialSplineFunction spline = new SplineInterpolator().interpolate(x, dataset.adsorbedAmounts());
    PolynomialSplineFunction curvature = spline.polynomialSplineDerivative()
        .polynomialSplineDerivative();

    double from = x[0];
    double to = x[x.length - 1];
    int firstSign = 0;
    int previous = 0;
    int crossings = 0;
    for (int k = 0; k < CURVATURE_SAMPLES; k++) {
      double at = from + (to - from) * (k + 0.5d) / CURVATURE_SAMPLES;
      int sign = (int) Math.signum(curvature.value(at));
      if (sign == 0) {
        continue;
      }
      if (firstSign == 0) {
        firstSign = sign;
      } else if (sign != previous) {
        crossings++;
      }
      previous = sign;
    }
    if (firstSign == 0) {
      return IsothermType.UNDETERMINED;
    }
    return typeFor(crossings, firstSign < 0);
  }

  private static IsothermType typeFor(int inflections, boolean startsConcave) {
    return switch (inflections) {
      case 0 -> startsConcave ? IsothermType.I : IsothermType.III;
      case 1 -> startsConcave ? IsothermType.II : IsothermType.V;
      case 2 -> startsConcave ? IsothermType.IV : IsothermType.VI;
      default -> IsothermType.VI;
    };
  }
}
