package com.flamingo.ai.notionrag.store;

import com.flamingo.ai.notionrag.exception.ArtifactNotFoundException;
import com.flamingo.ai.notionrag.exception.StoreNotFoundException;
import com.flamingo.ai.notionrag.notion.NotionIds;
import com.flamingo.ai.notionrag.registry.DatabaseEntry;
import com.flamingo.ai.notionrag.registry.DatabaseRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Inspection and removal of stores and their documents. */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoreAdminService {

  private final DatabaseRegistry databaseRegistry;
  private final StoreGateway storeGateway;

  /** Stores of all registered databases that have been created. */
  public List<StoreSummary> listStores() {
    List<StoreSummary> stores = new ArrayList<>();
    for (DatabaseEntry database : databaseRegistry.list()) {
      String storeId = storeGateway.storeIdFor(database.label());
      if (storeGateway.storeExists(storeId)) {
        stores.add(
            new StoreSummary(database.label(), storeId, storeGateway.countArtifacts(storeId)));
      }
    }
    return stores;
  }

  public List<StoredArtifact> listDocuments(String label) {
    return storeGateway.listAll(existingStore(label));
  }

  /**
   * Deletes the artifact of one page.
   *
   * @param pageRef page id or URL
   * @return the deleted artifact
   */
  public StoredArtifact removeDocument(String label, String pageRef) {
    String pageId = NotionIds.parse(pageRef);
    String storeId = existingStore(label);
    Optional<StoredArtifact> artifact =
        storeGateway.findByMetadataKey(storeId, StoredArtifact.PAGE_ID, pageId);
    if (artifact.isEmpty()) {
      throw new ArtifactNotFoundException(storeId, pageId);
    }
    storeGateway.delete(storeId, artifact.get().id());
    log.info("Deleted {} from {}", artifact.get().displayLabel(), storeId);
    return artifact.get();
  }

  /** Deletes a database's store with all its documents; returns how many documents it held. */
  public long deleteStore(String label) {
    String storeId = existingStore(label);
    long documents = storeGateway.countArtifacts(storeId);
    log.info("Deleting store '{}' ({} documents)", storeId, documents);
    storeGateway.deleteStore(storeId);
    return documents;
  }

  private String existingStore(String label) {
    String storeId = storeGateway.storeIdFor(databaseRegistry.resolve(label).label());
    if (!storeGateway.storeExists(storeId)) {
      throw new StoreNotFoundException(storeId);
    }
    return storeId;
  }
}
