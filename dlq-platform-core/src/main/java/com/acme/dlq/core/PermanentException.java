package com.acme.dlq.core;

/** Store failure that will not go away on retry (constraint, schema, syntax). */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
