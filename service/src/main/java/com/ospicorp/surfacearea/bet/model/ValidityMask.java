package com.ospicorp.surfacearea.bet.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Combined Rouquerol mask. {@code true} marks an invalid range, matching masked-array
 * convention: consumers mask out whatever this reports as invalid.
 */
public final class ValidityMask {

  private final boolean[][] invalid;
  private final Map<Criterion, CriterionGrid> criteria;
  private final CriteriaConfiguration configuration;

  private ValidityMask(boolean[][] invalid, Map<Criterion, CriterionGrid> criteria,
      CriteriaConfiguration configuration) {
    this.invalid = invalid;
    this.criteria = criteria;
    this.configuration = configuration;
  }

  public static ValidityMask of(boolean[][] invalid, Map<Criterion, CriterionGrid> criteria,
      CriteriaConfiguration configuration) {
    int size = invalid.length;
    boolean[][] copy = new boolean[size][];
    for (int i = 0; i < size; i++) {
      copy[i] = invalid[i].clone();
      for (int j = i; j < size; j++) {
        copy[i][j] = true;
      }
    }
    Map<Criterion, CriterionGrid> grids = new EnumMap<>(Criterion.class);
    grids.putAll(criteria);
    return new ValidityMask(copy, Collections.unmodifiableMap(grids), configuration);
  }

  public int size() {
    return invalid.length;
  }

  public boolean isInvalid(int end, int start) {
    return invalid[end][start];
  }

  public boolean isValid(int end, int start) {
    return !invalid[end][start];
  }

  public int validCount() {
    int count = 0;
    for (boolean[] row : invalid) {
      for (boolean masked : row) {
        if (!masked) {
          count++;
        }
      }
    }
    return count;
  }

  public boolean isEntirelyInvalid() {
    return validCount() == 0;
  }

  public boolean[][] toArray() {
    boolean[][] out = new boolean[invalid.length][];
    for (int i = 0; i < invalid.length; i++) {
      out[i] = invalid[i].clone();
    }
    return out;
  }

  // Only criteria that were evaluated; disabled ones are absent
  public Map<Criterion, CriterionGrid> criteria() {
    return criteria;
  }

  public CriteriaConfiguration configuration() {
    return configuration;
  }
}
