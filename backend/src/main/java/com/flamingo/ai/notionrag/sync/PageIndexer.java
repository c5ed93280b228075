package com.flamingo.ai.notionrag.sync;

import com.flamingo.ai.notionrag.config.NotionRagConfig;
import com.flamingo.ai.notionrag.exception.PageIndexingException;
import com.flamingo.ai.notionrag.exception.UploadTimeoutException;
import com.flamingo.ai.notionrag.extraction.BlockTreeExtractor;
import com.flamingo.ai.notionrag.extraction.ExtractedDocument;
import com.flamingo.ai.notionrag.ledger.IndexingEntry;
import com.flamingo.ai.notionrag.ledger.UsageLedger;
import com.flamingo.ai.notionrag.notion.PageSource;
import com.flamingo.ai.notionrag.notion.model.PageProperties;
import com.flamingo.ai.notionrag.pricing.PricingTable;
import com.flamingo.ai.notionrag.store.EmbeddingService;
import com.flamingo.ai.notionrag.store.StoreGateway;
import com.flamingo.ai.notionrag.store.StoredArtifact;
import com.flamingo.ai.notionrag.store.UploadHandle;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Brings a single page's artifact up to date.
 *
 * <p>Re-indexing fetches the page text, counts its billable tokens, deletes the previous artifacts
 * of the page, uploads the new one tagged with {@code page_id} and {@code last_edited}, and waits
 * until the store reports it searchable. Every attempt is written to the usage ledger.
 */
@Service
@Slf4j
public class PageIndexer {

  private final PageSource pageSource;
  private final BlockTreeExtractor blockTreeExtractor;
  private final StoreGateway storeGateway;
  private final EmbeddingService embeddingService;
  private final PricingTable pricingTable;
  private final UsageLedger usageLedger;
  private final String embeddingModel;
  private final String visionModel;
  private final Duration pollInterval;
  private final int pollMaxAttempts;

  public PageIndexer(
      PageSource pageSource,
      BlockTreeExtractor blockTreeExtractor,
      StoreGateway storeGateway,
      EmbeddingService embeddingService,
      PricingTable pricingTable,
      UsageLedger usageLedger,
      NotionRagConfig config) {
    this.pageSource = pageSource;
    this.blockTreeExtractor = blockTreeExtractor;
    this.storeGateway = storeGateway;
    this.embeddingService = embeddingService;
    this.pricingTable = pricingTable;
    this.usageLedger = usageLedger;
    this.embeddingModel = config.getModels().getEmbedding();
    this.visionModel = config.getModels().getImageVision();
    this.pollInterval = config.getSync().getPollInterval();
    this.pollMaxAttempts = config.getSync().getPollMaxAttempts();
  }

  /**
   * Classifies a page against its stored artifacts and re-indexes it when needed.
   *
   * @param label database label, for the ledger
   * @param storeId target store
   * @param pageId normalized page id
   * @param existing artifacts currently stored for the page, usually zero or one
   * @param force re-index even when unchanged
   * @return the outcome; skipped pages carry zero cost
   * @throws PageIndexingException if any step fails
   */
  public PageIndexResult indexPage(
      String label, String storeId, String pageId, List<StoredArtifact> existing, boolean force) {
    PageProperties page;
    try {
      page = pageSource.getPageProperties(pageId);
    } catch (RuntimeException e) {
      recordFailure(label, pageId, "", e);
      throw new PageIndexingException(pageId, e.getMessage(), e);
    }

    String storedEdited = existing.isEmpty() ? "" : existing.get(0).lastEdited();
    ChangeStatus status = ChangeDetector.classify(page.lastEdited(), storedEdited, force);
    switch (status) {
      case UNCHANGED -> {
        log.info("  {} - up to date", page.title());
        return PageIndexResult.skipped(pageId, page.title());
      }
      case NEW -> log.info("  {} - new", page.title());
      case CHANGED -> {
        if (force && storedEdited.equals(page.lastEdited())) {
          log.info("  {} - FORCE reindex", page.title());
        } else {
          log.info("  {} - CHANGED ({} -> {})", page.title(), storedEdited, page.lastEdited());
        }
      }
    }
    return reindex(label, storeId, page, existing, status);
  }

  private PageIndexResult reindex(
      String label,
      String storeId,
      PageProperties page,
      List<StoredArtifact> existing,
      ChangeStatus status) {
    String pageId = page.id();
    try {
      ExtractedDocument document = blockTreeExtractor.extract(pageId);
      String text = PageDocuments.compose(page, document.text());
      int tokens = embeddingService.countTokens(text);
      double indexingCost = pricingTable.cost(embeddingModel, tokens, 0);
      log.debug("  Tokens: {}, cost: ${}", tokens, String.format("%.8f", indexingCost));

      for (StoredArtifact previous : existing) {
        log.debug("  Deleting previous artifact {}", previous.id());
        storeGateway.delete(storeId, previous.id());
      }

      UploadHandle handle =
          storeGateway.upload(
              storeId,
              text,
              PageDocuments.displayLabel(pageId, page.title()),
              Map.of(
                  StoredArtifact.PAGE_ID, pageId,
                  StoredArtifact.LAST_EDITED, page.lastEdited()));
      int polls = awaitIndexed(handle);
      log.debug("  Indexed after {} status poll(s)", polls);

      usageLedger.recordIndexing(
          IndexingEntry.builder()
              .label(label)
              .pageId(pageId)
              .title(page.title())
              .embeddingModel(embeddingModel)
              .embeddingTokens(tokens)
              .embeddingCost(indexingCost)
              .visionModel(visionModel)
              .visionCost(document.imageCost())
              .images(document.images())
              .status(IndexingEntry.SUCCESS)
              .build());
      return new PageIndexResult(
          pageId,
          page.title(),
          status,
          tokens,
          indexingCost,
          document.imageCost(),
          handle.artifactId());
    } catch (RuntimeException e) {
      recordFailure(label, pageId, page.title(), e);
      throw new PageIndexingException(pageId, e.getMessage(), e);
    }
  }

  /** Polls until the upload is searchable; returns the number of polls. */
  private int awaitIndexed(UploadHandle handle) {
    for (int attempt = 1; attempt <= pollMaxAttempts; attempt++) {
      if (storeGateway.pollStatus(handle)) {
        return attempt;
      }
      pause();
    }
    throw new UploadTimeoutException(handle.artifactId(), pollMaxAttempts);
  }

  private void pause() {
    try {
      Thread.sleep(pollInterval.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for the upload to be indexed", e);
    }
  }

  private void recordFailure(String label, String pageId, String title, Exception e) {
    usageLedger.recordIndexing(
        IndexingEntry.builder()
            .label(label)
            .pageId(pageId)
            .title(title)
            .embeddingModel(embeddingModel)
            .status(IndexingEntry.ERROR)
            .error(String.valueOf(e.getMessage()))
            .build());
  }
}
