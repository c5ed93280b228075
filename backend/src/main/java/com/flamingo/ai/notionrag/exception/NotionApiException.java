package com.flamingo.ai.notionrag.exception;

/** Exception thrown when a call to the Notion API fails. */
public class NotionApiException extends RuntimeException {

  private final int statusCode;

  public NotionApiException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public NotionApiException(String message, Throwable cause) {
    this(message, 0, cause);
  }

  /** HTTP status returned by Notion, or 0 when the request never got a response. */
  public int getStatusCode() {
    return statusCode;
  }

  public boolean isRateLimited() {
    return statusCode == 429;
  }
}
