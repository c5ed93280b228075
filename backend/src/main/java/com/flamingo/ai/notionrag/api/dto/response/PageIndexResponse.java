package com.flamingo.ai.notionrag.api.dto.response;

import com.flamingo.ai.notionrag.sync.ChangeStatus;
import com.flamingo.ai.notionrag.sync.PageIndexResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a single-page index. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageIndexResponse {

  private String pageId;
  private String title;
  private ChangeStatus status;
  private boolean updated;
  private long embeddingTokens;
  private double indexingCost;
  private double imageCost;
  private double totalCost;

  public static PageIndexResponse from(PageIndexResult result) {
    return PageIndexResponse.builder()
        .pageId(result.pageId())
        .title(result.title())
        .status(result.status())
        .updated(!result.isSkipped())
        .embeddingTokens(result.embeddingTokens())
        .indexingCost(result.indexingCost())
        .imageCost(result.imageCost())
        .totalCost(result.totalCost())
        .build();
  }
}
