package com.flamingo.ai.notionrag.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CRUD facade over the searchable document store.
 *
 * <p>A store holds the artifacts of one registered database. Every operation throws {@link
 * com.flamingo.ai.notionrag.exception.StoreOperationException} when the backend fails.
 */
public interface StoreGateway {

  /**
   * Maps a database label to the id of the store that mirrors it. Distinct labels always map to
   * distinct stores.
   */
  String storeIdFor(String label);

  boolean storeExists(String storeId);

  /** Creates the store if it does not exist yet. */
  void ensureStore(String storeId);

  void deleteStore(String storeId);

  long countArtifacts(String storeId);

  /**
   * Looks up the artifact whose metadata carries {@code key=value}.
   *
   * @return the first match, or empty when none exists or the store is missing
   */
  Optional<StoredArtifact> findByMetadataKey(String storeId, String key, String value);

  /** Lists every artifact in the store, or an empty list when the store is missing. */
  List<StoredArtifact> listAll(String storeId);

  /**
   * Stores a text blob. Indexing completes asynchronously; poll the returned handle.
   *
   * @param storeId target store
   * @param text document body
   * @param displayLabel human-readable label
   * @param metadata key/value metadata, must include {@code page_id} and {@code last_edited}
   * @return handle for {@link #pollStatus(UploadHandle)}
   */
  UploadHandle upload(
      String storeId, String text, String displayLabel, Map<String, String> metadata);

  /** Returns {@code true} once the uploaded artifact is searchable. */
  boolean pollStatus(UploadHandle handle);

  void delete(String storeId, String artifactId);
}
