package com.flamingo.ai.notionrag.exception;

/** Exception thrown when a vision or embedding model call fails. */
public class LlmServiceException extends RuntimeException {

  private final String modelName;
  private final String userMessage;

  public LlmServiceException(String modelName, String message, Throwable cause) {
    super(message, cause);
    this.modelName = modelName;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public String getModelName() {
    return modelName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
