package com.ospicorp.surfacearea.bet.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class CriteriaConfigurationTest {

  @Test
  void defaultsEnableEveryCriterionWithFivePoints() {
    var defaults = CriteriaConfiguration.defaults();

    assertEquals(EnumSet.allOf(Criterion.class), defaults.enabled());
    assertEquals(5, defaults.minimumPoints());
  }

  @Test
  void withoutDropsOneCriterion() {
    var config = CriteriaConfiguration.defaults().without(Criterion.MONOLAYER_RANGE);

    assertFalse(config.isEnabled(Criterion.MONOLAYER_RANGE));
    assertTrue(config.isEnabled(Criterion.POSITIVE_INTERCEPT));
    assertEquals(4, config.enabled().size());
  }

  @Test
  void rejectsMinimumPointsBelowOne() {
    assertThrows(IllegalArgumentException.class,
        () -> CriteriaConfiguration.of(List.of(Criterion.MINIMUM_POINTS), 0));
  }

  @Test
  void criterionCodesAreCaseInsensitive() {
    assertEquals(Criterion.RELATIVE_PRESSURE_CONSISTENCY,
        Criterion.fromCode(" Relative_Pressure_Consistency "));
    assertThrows(IllegalArgumentException.class, () -> Criterion.fromCode("bet_constant"));
    assertThrows(IllegalArgumentException.class, () -> Criterion.fromCode(null));
  }

  @Test
  void policyCodesAreCaseInsensitive() {
    assertEquals(SelectionPolicy.POINTS, SelectionPolicy.fromCode("Points"));
    assertThrows(IllegalArgumentException.class, () -> SelectionPolicy.fromCode(null));
  }

  @Test
  void resultBuilderRejectsCellsOnDiagonal() {
    var builder = IntervalResult.builder(3, 16.2);

    assertThrows(IllegalArgumentException.class, () -> builder.put(
        new IntervalCell(1, 1, CellStatus.COMPUTED, 1, 1, 1, 2, 0.5, 10, 0, 1)));
    assertThrows(IllegalArgumentException.class,
        () -> builder.put(IntervalCell.notComputed(2, 0)));
  }
}
