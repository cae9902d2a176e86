package com.ospicorp.surfacearea.bet.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Square grid of per-range BET fits, indexed {@code [end][start]}. Only cells with
 * {@code end > start} are ever computed. Built once through {@link Builder} and immutable after;
 * grid accessors hand out copies.
 */
public final class IntervalResult {

  private final int size;
  private final double adsorbateArea;
  private final CellStatus[][] status;
  private final double[][] slope;
  private final double[][] intercept;
  private final double[][] r;
  private final double[][] c;
  private final double[][] nm;
  private final double[][] ssa;
  private final double[][] err;
  private final int[][] numPts;

  private IntervalResult(Builder builder) {
    this.size = builder.size;
    this.adsorbateArea = builder.adsorbateArea;
    this.status = new CellStatus[size][];
    this.slope = copy(builder.slope);
    this.intercept = copy(builder.intercept);
    this.r = copy(builder.r);
    this.c = copy(builder.c);
    this.nm = copy(builder.nm);
    this.ssa = copy(builder.ssa);
    this.err = copy(builder.err);
    this.numPts = new int[size][];
    for (int i = 0; i < size; i++) {
      status[i] = builder.status[i].clone();
      numPts[i] = builder.numPts[i].clone();
    }
  }

  public static Builder builder(int size, double adsorbateArea) {
    return new Builder(size, adsorbateArea);
  }

  public int size() {
    return size;
  }

  public double adsorbateArea() {
    return adsorbateArea;
  }

  public CellStatus status(int end, int start) {
    return status[end][start];
  }

  public IntervalCell cell(int end, int start) {
    if (status[end][start] == CellStatus.NOT_COMPUTED) {
      return IntervalCell.notComputed(end, start);
    }
    return new IntervalCell(end, start, status[end][start], slope[end][start],
        intercept[end][start], r[end][start], c[end][start], nm[end][start], ssa[end][start],
        err[end][start], numPts[end][start]);
  }

  public double slope(int end, int start) {
    return slope[end][start];
  }

  public double intercept(int end, int start) {
    return intercept[end][start];
  }

  public double r(int end, int start) {
    return r[end][start];
  }

  public double c(int end, int start) {
    return c[end][start];
  }

  public double nm(int end, int start) {
    return nm[end][start];
  }

  public double ssa(int end, int start) {
    return ssa[end][start];
  }

  public double err(int end, int start) {
    return err[end][start];
  }

  public int numPts(int end, int start) {
    return numPts[end][start];
  }

  public double[][] slopeGrid() {
    return copy(slope);
  }

  public double[][] interceptGrid() {
    return copy(intercept);
  }

  public double[][] rGrid() {
    return copy(r);
  }

  public double[][] cGrid() {
    return copy(c);
  }

  public double[][] nmGrid() {
    return copy(nm);
  }

  public double[][] ssaGrid() {
    return copy(ssa);
  }

  public double[][] errGrid() {
    return copy(err);
  }

  public int[][] numPtsGrid() {
    int[][] out = new int[size][];
    for (int i = 0; i < size; i++) {
      out[i] = numPts[i].clone();
    }
    return out;
  }

  public int degenerateCount() {
    int count = 0;
    for (CellStatus[] row : status) {
      for (CellStatus cellStatus : row) {
        if (cellStatus == CellStatus.DEGENERATE) {
          count++;
        }
      }
    }
    return count;
  }

  // Computed and degenerate cells in scan order: end ascending, then start ascending
  public List<IntervalCell> cells() {
    List<IntervalCell> out = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      for (int j = 0; j < i; j++) {
        out.add(cell(i, j));
      }
    }
    return out;
  }

  private static double[][] copy(double[][] grid) {
    double[][] out = new double[grid.length][];
    for (int i = 0; i < grid.length; i++) {
      out[i] = grid[i].clone();
    }
    return out;
  }

  public static final class Builder {
    private final int size;
    private final double adsorbateArea;
    private final CellStatus[][] status;
    private final double[][] slope;
    private final double[][] intercept;
    private final double[][] r;
    private final double[][] c;
    private final double[][] nm;
    private final double[][] ssa;
    private final double[][] err;
    private final int[][] numPts;

    private Builder(int size, double adsorbateArea) {
      if (size < 0) {
        throw new IllegalArgumentException("size must not be negative");
      }
      this.size = size;
      this.adsorbateArea = adsorbateArea;
      this.status = new CellStatus[size][size];
      this.slope = new double[size][size];
      this.intercept = new double[size][size];
      this.r = new double[size][size];
      this.c = new double[size][size];
      this.nm = new double[size][size];
      this.ssa = new double[size][size];
      this.err = new double[size][size];
      this.numPts = new int[size][size];
      for (CellStatus[] row : status) {
        Arrays.fill(row, CellStatus.NOT_COMPUTED);
      }
    }

    public int size() {
      return size;
    }

    /**
     * Stores a fitted cell. Cells on or below the diagonal are rejected. Safe to call
     * concurrently for distinct cells.
     */
    public Builder put(IntervalCell cell) {
      int i = cell.end();
      int j = cell.start();
      if (i <= j) {
        throw new IllegalArgumentException(
            "Range end " + i + " must be after start " + j);
      }
      if (cell.status() == CellStatus.NOT_COMPUTED) {
        throw new IllegalArgumentException("Cannot store a cell that was not computed");
      }
      status[i][j] = cell.status();
      slope[i][j] = cell.slope();
      intercept[i][j] = cell.intercept();
      r[i][j] = cell.r();
      c[i][j] = cell.c();
      nm[i][j] = cell.nm();
      ssa[i][j] = cell.ssa();
      err[i][j] = cell.err();
      numPts[i][j] = cell.numPts();
      return this;
    }

    public IntervalResult build() {
      return new IntervalResult(this);
    }
  }
}
