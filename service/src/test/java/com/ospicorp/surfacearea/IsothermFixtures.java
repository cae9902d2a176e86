package com.ospicorp.surfacearea;

import com.ospicorp.surfacearea.isotherm.model.IsothermDataset;
import com.ospicorp.surfacearea.isotherm.model.IsothermPoint;
import java.util.ArrayList;
import java.util.List;

public final class IsothermFixtures {

  public static final double[] SMALL_PRESSURES = {0.1, 0.2, 0.21, 0.3, 0.4, 0.5};
  public static final double[] SMALL_AMOUNTS = {0.001, 0.002, 0.004, 0.005, 0.0055, 0.006};
  public static final double SMALL_AREA = 11.11;

  // BET isotherm with nm = 0.002 mol/g and C = 100, lightly perturbed, nitrogen area
  public static final double[] NITROGEN_PRESSURES = {
      0.02, 0.04, 0.06, 0.08, 0.10, 0.12, 0.15, 0.18, 0.21, 0.24, 0.27, 0.30, 0.35, 0.40};
  public static final double[] NITROGEN_AMOUNTS = {
      0.0013697, 0.0016868, 0.001834, 0.0019536, 0.0020367, 0.0021238, 0.0022223, 0.0023351,
      0.0024447, 0.0025432, 0.0026756, 0.0027892, 0.0030208, 0.0032906};
  public static final double NITROGEN_AREA = 16.2;

  private IsothermFixtures() {
  }

  public static IsothermDataset small() {
    return dataset(SMALL_PRESSURES, SMALL_AMOUNTS, SMALL_AREA);
  }

  public static IsothermDataset nitrogen() {
    return dataset(NITROGEN_PRESSURES, NITROGEN_AMOUNTS, NITROGEN_AREA);
  }

  public static IsothermDataset dataset(double[] pressures, double[] amounts, double area) {
    return IsothermDataset.of(points(pressures, amounts), area);
  }

  public static List<IsothermPoint> points(double[] pressures, double[] amounts) {
    List<IsothermPoint> points = new ArrayList<>();
    for (int k = 0; k < pressures.length; k++) {
      points.add(new IsothermPoint(pressures[k], amounts[k]));
    }
    return points;
  }

  public static List<List<Double>> pairs(double[] pressures, double[] amounts) {
    List<List<Double>> pairs = new ArrayList<>();
    for (int k = 0; k < pressures.length; k++) {
      pairs.add(List.of(pressures[k], amounts[k]));
    }
    return pairs;
  }
}
