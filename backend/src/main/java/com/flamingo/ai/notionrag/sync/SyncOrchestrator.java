package com.flamingo.ai.notionrag.sync;

import com.flamingo.ai.notionrag.config.NotionRagConfig;
import com.flamingo.ai.notionrag.exception.PageIndexingException;
import com.flamingo.ai.notionrag.ledger.UsageLedger;
import com.flamingo.ai.notionrag.notion.NotionIds;
import com.flamingo.ai.notionrag.notion.PageSource;
import com.flamingo.ai.notionrag.registry.DatabaseEntry;
import com.flamingo.ai.notionrag.registry.DatabaseRegistry;
import com.flamingo.ai.notionrag.store.StoreGateway;
import com.flamingo.ai.notionrag.store.StoredArtifact;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the database-level workflows: full index, incremental sync and single-page indexing.
 *
 * <p>Pages are processed one at a time. A failing page is logged and counted, and the run moves
 * on to the next page. An interrupt stops the run between pages.
 */
@Service
@Slf4j
public class SyncOrchestrator {

  private final DatabaseRegistry databaseRegistry;
  private final PageSource pageSource;
  private final StoreGateway storeGateway;
  private final PageIndexer pageIndexer;
  private final UsageLedger usageLedger;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final int syncDays;
  private final Duration settleDelay;

  public SyncOrchestrator(
      DatabaseRegistry databaseRegistry,
      PageSource pageSource,
      StoreGateway storeGateway,
      PageIndexer pageIndexer,
      UsageLedger usageLedger,
      MeterRegistry meterRegistry,
      Clock clock,
      NotionRagConfig config) {
    this.databaseRegistry = databaseRegistry;
    this.pageSource = pageSource;
    this.storeGateway = storeGateway;
    this.pageIndexer = pageIndexer;
    this.usageLedger = usageLedger;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.syncDays = config.getSync().getSyncDays();
    this.settleDelay = config.getSync().getSettleDelay();
  }

  /**
   * Indexes every page of a database.
   *
   * @param label database label; required when {@code databaseUrl} is given, otherwise resolved
   *     against the registry
   * @param databaseUrl when non-null, registers {@code label} for this database first
   */
  @Timed(value = "sync.init", description = "Time to index a whole database")
  public InitResult initDatabase(String label, String databaseUrl) {
    DatabaseEntry database;
    if (databaseUrl != null && !databaseUrl.isBlank()) {
      if (label == null || label.isBlank()) {
        throw new IllegalArgumentException("Label is required when providing a database URL");
      }
      database = databaseRegistry.register(label, databaseUrl);
    } else {
      database = databaseRegistry.resolve(label);
    }

    String storeId = prepareStore(database);
    log.info("-- Querying all pages of database {} --", database.databaseId());
    List<String> pageIds = pageSource.listPages(database.databaseId(), null);
    log.info("Found {} pages", pageIds.size());
    ImmutableListMultimap<String, StoredArtifact> existing = existingArtifacts(storeId);

    int indexed = 0;
    int skipped = 0;
    List<String> failed = new ArrayList<>();
    double indexingCost = 0.0;
    double imageCost = 0.0;

    for (int i = 0; i < pageIds.size(); i++) {
      if (Thread.currentThread().isInterrupted()) {
        log.warn("Index run interrupted after {} of {} pages", i, pageIds.size());
        break;
      }
      String pageId = pageIds.get(i);
      log.info("[{}/{}] Page {}", i + 1, pageIds.size(), shortId(pageId));
      Optional<PageIndexResult> result =
          processPage("init", database, storeId, pageId, existing.get(pageId), false);
      if (result.isEmpty()) {
        failed.add(pageId);
        continue;
      }
      indexed++;
      if (result.get().isSkipped()) {
        skipped++;
      }
      indexingCost += result.get().indexingCost();
      imageCost += result.get().imageCost();
    }

    settle();

    InitResult summary =
        new InitResult(
            database.label(),
            database.databaseId(),
            storeId,
            pageIds.size(),
            indexed,
            skipped,
            failed,
            indexingCost,
            imageCost);
    log.info(
        "Init of '{}' done: {} of {} pages indexed ({} up to date, {} failed), total cost ${}",
        summary.label(),
        summary.pagesIndexed(),
        summary.pagesTotal(),
        summary.pagesSkipped(),
        summary.pagesFailed(),
        String.format("%.8f", summary.totalCost()));
    usageLedger.recordInit(
        summary.label(),
        summary.databaseId(),
        storeId,
        summary.pagesTotal(),
        summary.pagesIndexed(),
        summary.pagesFailed(),
        indexingCost,
        imageCost);
    return summary;
  }

  /**
   * Re-indexes the pages of a database edited within the configured trailing window.
   *
   * @param label registered label, or {@code null} to auto-select the only database
   * @param force re-index every page in the window regardless of its stored fingerprint
   */
  @Timed(value = "sync.database", description = "Time to sync recently edited pages")
  public SyncResult syncDatabase(String label, boolean force) {
    DatabaseEntry database = databaseRegistry.resolve(label);
    String storeId = prepareStore(database);

    Instant since = clock.instant().minus(Duration.ofDays(syncDays));
    log.info("-- Querying pages updated in the last {} days --", syncDays);
    List<String> pageIds = pageSource.listPages(database.databaseId(), since);
    log.info("Found {} pages", pageIds.size());
    ImmutableListMultimap<String, StoredArtifact> existing = existingArtifacts(storeId);

    int updated = 0;
    int skipped = 0;
    List<String> failed = new ArrayList<>();
    double indexingCost = 0.0;
    double imageCost = 0.0;

    for (int i = 0; i < pageIds.size(); i++) {
      if (Thread.currentThread().isInterrupted()) {
        log.warn("Sync interrupted after {} of {} pages", i, pageIds.size());
        break;
      }
      String pageId = pageIds.get(i);
      log.info("[{}/{}] Page {}", i + 1, pageIds.size(), shortId(pageId));
      Optional<PageIndexResult> result =
          processPage("sync", database, storeId, pageId, existing.get(pageId), force);
      if (result.isEmpty()) {
        failed.add(pageId);
      } else if (result.get().isSkipped()) {
        skipped++;
      } else {
        updated++;
        indexingCost += result.get().indexingCost();
        imageCost += result.get().imageCost();
      }
    }

    if (updated > 0) {
      settle();
    }

    SyncResult summary =
        new SyncResult(
            database.label(),
            database.databaseId(),
            storeId,
            pageIds.size(),
            updated,
            skipped,
            failed,
            indexingCost,
            imageCost,
            force);
    log.info(
        "Sync of '{}' done: checked {}, updated {}, skipped {}, failed {}, total cost ${}",
        summary.label(),
        summary.pagesChecked(),
        summary.pagesUpdated(),
        summary.pagesSkipped(),
        summary.pagesFailed(),
        String.format("%.8f", summary.totalCost()));
    usageLedger.recordSync(
        summary.label(),
        summary.databaseId(),
        summary.pagesChecked(),
        summary.pagesUpdated(),
        summary.pagesSkipped(),
        summary.pagesFailed(),
        indexingCost,
        imageCost,
        force);
    return summary;
  }

  /**
   * Indexes a single page of a registered database.
   *
   * @param label registered label, or {@code null} to auto-select the only database
   * @param pageRef page id or URL
   * @throws PageIndexingException if the page cannot be indexed
   */
  @Timed(value = "sync.page", description = "Time to index a single page")
  public PageIndexResult indexSinglePage(String label, String pageRef, boolean force) {
    String pageId = NotionIds.parse(pageRef);
    DatabaseEntry database = databaseRegistry.resolve(label);
    String storeId = prepareStore(database);
    List<StoredArtifact> existing =
        storeGateway.findByMetadataKey(storeId, StoredArtifact.PAGE_ID, pageId).stream().toList();

    PageIndexResult result =
        pageIndexer.indexPage(database.label(), storeId, pageId, existing, force);
    countOutcome("page", result);
    return result;
  }

  private Optional<PageIndexResult> processPage(
      String operation,
      DatabaseEntry database,
      String storeId,
      String pageId,
      List<StoredArtifact> existing,
      boolean force) {
    try {
      PageIndexResult result =
          pageIndexer.indexPage(database.label(), storeId, pageId, existing, force);
      countOutcome(operation, result);
      return Optional.of(result);
    } catch (PageIndexingException e) {
      log.error("  ERROR indexing page {}: {}", pageId, e.getMessage());
      meterRegistry.counter("sync.pages.failed", "operation", operation).increment();
      return Optional.empty();
    }
  }

  private void countOutcome(String operation, PageIndexResult result) {
    String name = result.isSkipped() ? "sync.pages.skipped" : "sync.pages.updated";
    meterRegistry.counter(name, "operation", operation).increment();
  }

  private String prepareStore(DatabaseEntry database) {
    String storeId = storeGateway.storeIdFor(database.label());
    boolean created = !storeGateway.storeExists(storeId);
    storeGateway.ensureStore(storeId);
    log.info("{} store: {}", created ? "Created" : "Using", storeId);
    return storeId;
  }

  private ImmutableListMultimap<String, StoredArtifact> existingArtifacts(String storeId) {
    List<StoredArtifact> artifacts = storeGateway.listAll(storeId);
    ImmutableListMultimap<String, StoredArtifact> byPage =
        Multimaps.index(artifacts, StoredArtifact::pageId);
    if (byPage.size() != byPage.keySet().size()) {
      log.warn("Store {} holds duplicate artifacts for some pages; they will be replaced", storeId);
    }
    return byPage;
  }

  private void settle() {
    if (settleDelay.isZero() || settleDelay.isNegative()) {
      return;
    }
    log.info("Waiting {}s for the store index to settle", settleDelay.toSeconds());
    try {
      Thread.sleep(settleDelay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Settle delay interrupted");
    }
  }

  private static String shortId(String pageId) {
    return pageId.length() > 8 ? pageId.substring(0, 8) : pageId;
  }
}
