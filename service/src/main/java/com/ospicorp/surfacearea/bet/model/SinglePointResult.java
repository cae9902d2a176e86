package com.ospicorp.surfacearea.bet.model;

public record SinglePointResult(double[][] nm, double[][] ssa) {

  public double nm(int end, int start) {
    return nm[end][start];
  }

  public double ssa(int end, int start) {
    return ssa[end][start];
  }
}
