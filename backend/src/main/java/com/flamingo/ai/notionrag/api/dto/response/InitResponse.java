package com.flamingo.ai.notionrag.api.dto.response;

import com.flamingo.ai.notionrag.sync.InitResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a full index run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InitResponse {

  private String label;
  private String databaseId;
  private String storeName;
  private int pagesTotal;
  private int pagesIndexed;
  private int pagesSkipped;
  private int pagesFailed;
  private List<String> failedPageIds;
  private double indexingCost;
  private double imageCost;
  private double totalCost;

  public static InitResponse from(InitResult result) {
    return InitResponse.builder()
        .label(result.label())
        .databaseId(result.databaseId())
        .storeName(result.storeId())
        .pagesTotal(result.pagesTotal())
        .pagesIndexed(result.pagesIndexed())
        .pagesSkipped(result.pagesSkipped())
        .pagesFailed(result.pagesFailed())
        .failedPageIds(result.failedPageIds())
        .indexingCost(result.indexingCost())
        .imageCost(result.imageCost())
        .totalCost(result.totalCost())
        .build();
  }
}
