package com.ospicorp.surfacearea.isotherm.model;

public class DataException extends RuntimeException {

  public DataException(String message) {
    super(message);
  }
}
