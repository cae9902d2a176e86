package com.ospicorp.surfacearea.isotherm.model;

// One measured (relative pressure, adsorbed amount) pair; n in mol/g
public record IsothermPoint(double relativePressure, double adsorbedAmount) {

  public double betTransform() {
    return relativePressure / (adsorbedAmount * (1d - relativePressure));
  }

  public double pressureConsistencyTerm() {
    return adsorbedAmount * (1d - relativePressure);
  }

  public static double adsorbedAmountFromTransform(double relativePressure, double betTransform) {
    return relativePressure / (betTransform * (1d - relativePressure));
  }
}
