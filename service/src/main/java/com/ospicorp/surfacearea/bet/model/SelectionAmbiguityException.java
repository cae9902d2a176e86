package com.ospicorp.surfacearea.bet.model;

public class SelectionAmbiguityException extends RuntimeException {
  private final int candidates;

  public SelectionAmbiguityException(String message, int candidates) {
    super(message);
    this.candidates = candidates;
  }

  public int candidates() {
    return candidates;
  }
}
