package com.flamingo.ai.notionrag.ledger;

import com.flamingo.ai.notionrag.extraction.ImageAnalysisRecord;
import java.util.List;
import lombok.Builder;

/** One line of {@code usage/indexing.jsonl}: the cost of indexing a single page. */
@Builder
public record IndexingEntry(
    String label,
    String pageId,
    String title,
    String embeddingModel,
    long embeddingTokens,
    double embeddingCost,
    String visionModel,
    double visionCost,
    List<ImageAnalysisRecord> images,
    String status,
    String error) {

  public static final String SUCCESS = "success";
  public static final String ERROR = "error";

  public IndexingEntry {
    title = title == null ? "" : title;
    images = images == null ? List.of() : List.copyOf(images);
    status = status == null ? SUCCESS : status;
  }

  public double totalCost() {
    return embeddingCost + visionCost;
  }
}
