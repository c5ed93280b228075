package com.flamingo.ai.notionrag.api.dto.response;

import com.flamingo.ai.notionrag.store.StoreSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a store. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreResponse {

  private String label;
  private String storeName;
  private long documents;

  public static StoreResponse from(StoreSummary summary) {
    return new StoreResponse(summary.label(), summary.storeId(), summary.documentCount());
  }
}
