package com.ospicorp.surfacearea.bet.service;

final class QuadraticRoots {
  private QuadraticRoots() {
  }

  /**
   * Real parts of the roots of {@code a x^2 + b x + c}. A complex-conjugate pair yields its
   * shared real part twice. A vanishing leading coefficient leaves the single linear root, and
   * an equation with no roots yields an empty array.
   */
  static double[] realParts(double a, double b, double c) {
    if (a == 0d) {
      if (b == 0d) {
        return new double[0];
      }
      return new double[] {-c / b};
    }
    double discriminant = b * b - 4d * a * c;
    if (discriminant < 0d) {
      double real = -b / (2d * a);
      return new double[] {real, real};
    }
    double sqrt = Math.sqrt(discriminant);
    // avoids cancellation when b and sqrt are close in magnitude
    double q = -0.5d * (b + Math.copySign(sqrt, b));
    if (q == 0d) {
      return new double[] {0d, 0d};
    }
    return new double[] {q / a, c / q};
  }
}
