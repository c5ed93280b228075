package com.flamingo.ai.notionrag.exception;

/** Exception thrown when the document store rejects or fails an operation. */
public class StoreOperationException extends RuntimeException {

  private final String storeId;
  private final String userMessage;

  public StoreOperationException(String storeId, String message, Throwable cause) {
    super(message, cause);
    this.storeId = storeId;
    this.userMessage = "Document store is temporarily unavailable. Please try again later.";
  }

  public StoreOperationException(String storeId, String message) {
    this(storeId, message, null);
  }

  public String getStoreId() {
    return storeId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
