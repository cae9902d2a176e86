package com.ospicorp.surfacearea.bet.model;

public record Diagnostic(Level level, String message) {

  public enum Level {
    INFO, WARNING
  }

  public static Diagnostic info(String message) {
    return new Diagnostic(Level.INFO, message);
  }

  public static Diagnostic warning(String message) {
    return new Diagnostic(Level.WARNING, message);
  }
}
