package com.flamingo.ai.notionrag.sync;

import java.util.List;

/**
 * Summary of a full index run.
 *
 * @param pagesIndexed pages processed without error, including those already up to date
 * @param pagesSkipped pages that were already up to date
 */
public record InitResult(
    String label,
    String databaseId,
    String storeId,
    int pagesTotal,
    int pagesIndexed,
    int pagesSkipped,
    List<String> failedPageIds,
    double indexingCost,
    double imageCost) {

  public InitResult {
    failedPageIds = failedPageIds == null ? List.of() : List.copyOf(failedPageIds);
  }

  public int pagesFailed() {
    return failedPageIds.size();
  }

  public double totalCost() {
    return indexingCost + imageCost;
  }
}
