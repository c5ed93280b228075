package com.flamingo.ai.notionrag.api.dto.response;

import com.flamingo.ai.notionrag.sync.SyncResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an incremental sync run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResponse {

  private String label;
  private String databaseId;
  private int pagesChecked;
  private int pagesUpdated;
  private int pagesSkipped;
  private int pagesFailed;
  private List<String> failedPageIds;
  private double indexingCost;
  private double imageCost;
  private double totalCost;
  private boolean force;

  public static SyncResponse from(SyncResult result) {
    return SyncResponse.builder()
        .label(result.label())
        .databaseId(result.databaseId())
        .pagesChecked(result.pagesChecked())
        .pagesUpdated(result.pagesUpdated())
        .pagesSkipped(result.pagesSkipped())
        .pagesFailed(result.pagesFailed())
        .failedPageIds(result.failedPageIds())
        .indexingCost(result.indexingCost())
        .imageCost(result.imageCost())
        .totalCost(result.totalCost())
        .force(result.force())
        .build();
  }
}
