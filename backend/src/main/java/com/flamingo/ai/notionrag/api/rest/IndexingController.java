package com.flamingo.ai.notionrag.api.rest;

import com.flamingo.ai.notionrag.api.dto.request.IndexPageRequest;
import com.flamingo.ai.notionrag.api.dto.request.InitRequest;
import com.flamingo.ai.notionrag.api.dto.request.SyncRequest;
import com.flamingo.ai.notionrag.api.dto.response.InitResponse;
import com.flamingo.ai.notionrag.api.dto.response.PageIndexResponse;
import com.flamingo.ai.notionrag.api.dto.response.SyncResponse;
import com.flamingo.ai.notionrag.sync.SyncOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for indexing operations. Requests block until the run completes. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class IndexingController {

  private final SyncOrchestrator syncOrchestrator;

  /** Indexes every page of a database, registering it first when a URL is given. */
  @PostMapping("/init")
  public ResponseEntity<InitResponse> init(@Valid @RequestBody InitRequest request) {
    return ResponseEntity.ok(
        InitResponse.from(
            syncOrchestrator.initDatabase(request.getLabel(), request.getDatabaseUrl())));
  }

  /** Re-indexes recently edited pages. */
  @PostMapping("/sync")
  public ResponseEntity<SyncResponse> sync(@RequestBody(required = false) SyncRequest request) {
    SyncRequest body = request == null ? new SyncRequest() : request;
    return ResponseEntity.ok(
        SyncResponse.from(syncOrchestrator.syncDatabase(body.getLabel(), body.isForce())));
  }

  /** Indexes a single page. */
  @PostMapping("/pages")
  public ResponseEntity<PageIndexResponse> indexPage(
      @Valid @RequestBody IndexPageRequest request) {
    return ResponseEntity.ok(
        PageIndexResponse.from(
            syncOrchestrator.indexSinglePage(
                request.getLabel(), request.getPage(), request.isForce())));
  }
}
