package com.flamingo.ai.notionrag.sync;

/**
 * Outcome of processing one page.
 *
 * @param pageId normalized page id
 * @param title page title
 * @param status change classification; {@link ChangeStatus#UNCHANGED} means nothing was uploaded
 * @param embeddingTokens billable tokens of the uploaded text
 * @param indexingCost USD embedding cost
 * @param imageCost USD image-analysis cost
 * @param artifactId id of the new artifact, {@code null} when skipped
 */
public record PageIndexResult(
    String pageId,
    String title,
    ChangeStatus status,
    long embeddingTokens,
    double indexingCost,
    double imageCost,
    String artifactId) {

  static PageIndexResult skipped(String pageId, String title) {
    return new PageIndexResult(pageId, title, ChangeStatus.UNCHANGED, 0, 0.0, 0.0, null);
  }

  public boolean isSkipped() {
    return status == ChangeStatus.UNCHANGED;
  }

  public double totalCost() {
    return indexingCost + imageCost;
  }
}
