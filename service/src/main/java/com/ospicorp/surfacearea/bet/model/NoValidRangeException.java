package com.ospicorp.surfacearea.bet.model;

public class NoValidRangeException extends RuntimeException {

  public NoValidRangeException() {
    super("No valid relative pressure ranges. Specific surface area not calculated.");
  }
}
