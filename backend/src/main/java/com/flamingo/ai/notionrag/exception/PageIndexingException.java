package com.flamingo.ai.notionrag.exception;

/** Exception thrown when extracting or uploading a single page fails. */
public class PageIndexingException extends RuntimeException {

  private final String pageId;
  private final String userMessage;

  public PageIndexingException(String pageId, String message, Throwable cause) {
    super(message, cause);
    this.pageId = pageId;
    this.userMessage = "Failed to index page";
  }

  public PageIndexingException(String pageId, String message) {
    this(pageId, message, null);
  }

  public String getPageId() {
    return pageId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
