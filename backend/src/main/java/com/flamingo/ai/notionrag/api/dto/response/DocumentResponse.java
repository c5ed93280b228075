package com.flamingo.ai.notionrag.api.dto.response;

import com.flamingo.ai.notionrag.store.StoredArtifact;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored page. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private String id;
  private String displayName;
  private String pageId;
  private String lastEdited;

  public static DocumentResponse from(StoredArtifact artifact) {
    return DocumentResponse.builder()
        .id(artifact.id())
        .displayName(artifact.displayLabel())
        .pageId(artifact.pageId())
        .lastEdited(artifact.lastEdited())
        .build();
  }
}
