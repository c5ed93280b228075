package com.flamingo.ai.notionrag.sync;

import java.util.List;

/** Summary of an incremental sync run. */
public record SyncResult(
    String label,
    String databaseId,
    String storeId,
    int pagesChecked,
    int pagesUpdated,
    int pagesSkipped,
    List<String> failedPageIds,
    double indexingCost,
    double imageCost,
    boolean force) {

  public SyncResult {
    failedPageIds = failedPageIds == null ? List.of() : List.copyOf(failedPageIds);
  }

  public int pagesFailed() {
    return failedPageIds.size();
  }

  public double totalCost() {
    return indexingCost + imageCost;
  }
}
