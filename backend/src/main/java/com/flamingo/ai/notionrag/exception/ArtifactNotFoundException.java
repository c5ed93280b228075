package com.flamingo.ai.notionrag.exception;

/** Exception thrown when a store holds no artifact for a page. */
public class ArtifactNotFoundException extends RuntimeException {

  private final String storeId;
  private final String pageId;

  public ArtifactNotFoundException(String storeId, String pageId) {
    super("No document for page " + pageId + " in store " + storeId);
    this.storeId = storeId;
    this.pageId = pageId;
  }

  public String getStoreId() {
    return storeId;
  }

  public String getPageId() {
    return pageId;
  }
}
