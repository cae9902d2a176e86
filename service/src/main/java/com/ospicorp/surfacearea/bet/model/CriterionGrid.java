package com.ospicorp.surfacearea.bet.model;

import java.util.Arrays;

/** Pass/fail outcome of one criterion for every {@code [end][start]} cell. */
public final class CriterionGrid {

  private final boolean[][] passes;

  private CriterionGrid(boolean[][] passes) {
    this.passes = passes;
  }

  public static CriterionGrid of(boolean[][] passes) {
    boolean[][] copy = new boolean[passes.length][];
    for (int i = 0; i < passes.length; i++) {
      if (passes[i].length != passes.length) {
        throw new IllegalArgumentException("Criterion grid must be square");
      }
      copy[i] = passes[i].clone();
    }
    return new CriterionGrid(copy);
  }

  public static CriterionGrid allPass(int size) {
    boolean[][] passes = new boolean[size][size];
    for (boolean[] row : passes) {
      Arrays.fill(row, true);
    }
    return new CriterionGrid(passes);
  }

  public int size() {
    return passes.length;
  }

  public boolean passes(int end, int start) {
    return passes[end][start];
  }

  public int passCount() {
    int count = 0;
    for (boolean[] row : passes) {
      for (boolean pass : row) {
        if (pass) {
          count++;
        }
      }
    }
    return count;
  }

  public boolean failsEverywhere() {
    return passCount() == 0;
  }

  // 1 = pass, 0 = fail
  public int[][] toIntGrid() {
    int[][] out = new int[passes.length][passes.length];
    for (int i = 0; i < passes.length; i++) {
      for (int j = 0; j < passes.length; j++) {
        out[i][j] = passes[i][j] ? 1 : 0;
      }
    }
    return out;
  }
}
