package com.flamingo.ai.notionrag.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One indexed page as stored in Elasticsearch: the rendered text, its embedding and the
 * change-detection metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArtifactDocument {

  private String artifactId;
  private String content;
  private String displayLabel;

  /** Always carries {@code page_id} and {@code last_edited}. */
  @Builder.Default private Map<String, String> metadata = Map.of();

  private List<Float> embedding;
  private String indexedAt;

  StoredArtifact toArtifact(String id, String storeId) {
    return new StoredArtifact(
        id,
        storeId,
        displayLabel == null ? "" : displayLabel,
        metadata == null ? Map.of() : metadata);
  }
}
