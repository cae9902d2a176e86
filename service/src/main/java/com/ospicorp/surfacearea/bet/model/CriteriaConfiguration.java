package com.ospicorp.surfacearea.bet.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public record CriteriaConfiguration(Set<Criterion> enabled, int minimumPoints) {

  public static final int DEFAULT_MINIMUM_POINTS = 5;

  public CriteriaConfiguration {
    if (minimumPoints < 1) {
      throw new IllegalArgumentException("minimum points must be at least 1, got " + minimumPoints);
    }
    EnumSet<Criterion> copy = EnumSet.noneOf(Criterion.class);
    if (enabled != null) {
      copy.addAll(enabled);
    }
    enabled = Collections.unmodifiableSet(copy);
  }

  public static CriteriaConfiguration defaults() {
    return new CriteriaConfiguration(EnumSet.allOf(Criterion.class), DEFAULT_MINIMUM_POINTS);
  }

  public static CriteriaConfiguration of(Collection<Criterion> enabled, int minimumPoints) {
    return new CriteriaConfiguration(
        enabled.isEmpty() ? EnumSet.noneOf(Criterion.class) : EnumSet.copyOf(enabled),
        minimumPoints);
  }

  public boolean isEnabled(Criterion criterion) {
    return enabled.contains(criterion);
  }

  public CriteriaConfiguration without(Criterion criterion) {
    EnumSet<Criterion> next = EnumSet.noneOf(Criterion.class);
    next.addAll(enabled);
    next.remove(criterion);
    return new CriteriaConfiguration(next, minimumPoints);
  }

  public CriteriaConfiguration withMinimumPoints(int points) {
    return new CriteriaConfiguration(enabled, points);
  }
}
