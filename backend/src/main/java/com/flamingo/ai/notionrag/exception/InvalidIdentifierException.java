package com.flamingo.ai.notionrag.exception;

/** Thrown when a page or database reference is neither a Notion id nor a Notion URL. */
public class InvalidIdentifierException extends RuntimeException {

  private final String input;

  public InvalidIdentifierException(String input) {
    super("Invalid Notion URL or ID: " + input);
    this.input = input;
  }

  public String getInput() {
    return input;
  }
}
