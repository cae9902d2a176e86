package com.ospicorp.surfacearea.bet.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.surfacearea.IsothermFixtures;
import com.ospicorp.surfacearea.bet.model.SinglePointResult;
import org.junit.jupiter.api.Test;

class SinglePointBetTest {

  @Test
  void usesMedianPointOfInclusiveRange() {
    SinglePointResult result = SinglePointBet.compute(IsothermFixtures.small());

    assertEquals(0.0015 * 0.85, result.nm(1, 0), 1e-12);
    assertEquals(0.002 * 0.8, result.nm(2, 0), 1e-12);
    assertEquals(107.047, result.ssa(2, 0), 1e-3);
  }

  @Test
  void lowerTriangleStaysZero() {
    SinglePointResult result = SinglePointBet.compute(IsothermFixtures.small());

    for (int i = 0; i < 6; i++) {
      for (int j = i; j < 6; j++) {
        assertEquals(0.0, result.nm(i, j));
        assertEquals(0.0, result.ssa(i, j));
      }
    }
  }
}
