package com.flamingo.ai.notionrag.exception;

/** Exception thrown when the store of a registered database has not been created yet. */
public class StoreNotFoundException extends RuntimeException {

  private final String storeId;

  public StoreNotFoundException(String storeId) {
    super("Store '" + storeId + "' does not exist");
    this.storeId = storeId;
  }

  public String getStoreId() {
    return storeId;
  }
}
