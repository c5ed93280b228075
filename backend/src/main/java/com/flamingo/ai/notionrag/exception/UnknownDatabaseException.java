package com.flamingo.ai.notionrag.exception;

/** Thrown when a database label cannot be resolved against the registry. */
public class UnknownDatabaseException extends RuntimeException {

  private final String label;

  public UnknownDatabaseException(String label, String message) {
    super(message);
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
