package com.flamingo.ai.notionrag.api.rest;

import com.flamingo.ai.notionrag.api.dto.response.DocumentResponse;
import com.flamingo.ai.notionrag.api.dto.response.StoreResponse;
import com.flamingo.ai.notionrag.store.StoreAdminService;
import com.flamingo.ai.notionrag.store.StoredArtifact;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for inspecting and cleaning up stores. */
@RestController
@RequestMapping("/api/stores")
@RequiredArgsConstructor
public class StoreController {

  private final StoreAdminService storeAdminService;

  /** Lists the stores of all registered databases. */
  @GetMapping
  public ResponseEntity<List<StoreResponse>> listStores() {
    return ResponseEntity.ok(
        storeAdminService.listStores().stream().map(StoreResponse::from).toList());
  }

  /** Lists the documents of one store. */
  @GetMapping("/{label}/documents")
  public ResponseEntity<List<DocumentResponse>> listDocuments(@PathVariable String label) {
    return ResponseEntity.ok(
        storeAdminService.listDocuments(label).stream().map(DocumentResponse::from).toList());
  }

  /** Removes one page's document. */
  @DeleteMapping("/{label}/documents/{pageId}")
  public ResponseEntity<DocumentResponse> removeDocument(
      @PathVariable String label, @PathVariable String pageId) {
    StoredArtifact removed = storeAdminService.removeDocument(label, pageId);
    return ResponseEntity.ok(DocumentResponse.from(removed));
  }

  /** Deletes a store and all its documents. */
  @DeleteMapping("/{label}")
  public ResponseEntity<Map<String, Object>> deleteStore(@PathVariable String label) {
    long documents = storeAdminService.deleteStore(label);
    return ResponseEntity.ok(Map.of("label", label, "deletedDocuments", documents));
  }
}
