package com.ospicorp.surfacearea.bet.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class QuadraticRootsTest {

  @Test
  void distinctRealRoots() {
    double[] roots = QuadraticRoots.realParts(1, -3, 2);
    Arrays.sort(roots);
    assertArrayEquals(new double[] {1, 2}, roots, 1e-12);
  }

  @Test
  void complexPairYieldsSharedRealPart() {
    assertArrayEquals(new double[] {-1, -1}, QuadraticRoots.realParts(1, 2, 5), 1e-12);
  }

  @Test
  void linearEquationHasSingleRoot() {
    assertArrayEquals(new double[] {2}, QuadraticRoots.realParts(0, 2, -4), 1e-12);
    assertEquals(0, QuadraticRoots.realParts(0, 0, 1).length);
  }
}
