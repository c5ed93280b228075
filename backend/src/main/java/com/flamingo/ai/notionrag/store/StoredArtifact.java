package com.flamingo.ai.notionrag.store;

import java.util.Map;

/**
 * A page as it currently exists in the store.
 *
 * @param id store-assigned artifact id
 * @param storeId store holding the artifact
 * @param displayLabel human-readable label, {@code [pageId] title}
 * @param metadata key/value metadata; always carries {@link #PAGE_ID} and {@link #LAST_EDITED}
 */
public record StoredArtifact(
    String id, String storeId, String displayLabel, Map<String, String> metadata) {

  public static final String PAGE_ID = "page_id";
  public static final String LAST_EDITED = "last_edited";

  public StoredArtifact {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public String pageId() {
    return metadata.getOrDefault(PAGE_ID, "");
  }

  /** Change fingerprint recorded at upload time, empty when missing. */
  public String lastEdited() {
    return metadata.getOrDefault(LAST_EDITED, "");
  }
}
