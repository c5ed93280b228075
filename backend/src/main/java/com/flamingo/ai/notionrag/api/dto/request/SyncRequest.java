package com.flamingo.ai.notionrag.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for an incremental sync. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

  private String label;

  private boolean force;
}
