package com.flamingo.ai.notionrag.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.notionrag.config.NotionRagConfig;
import com.flamingo.ai.notionrag.extraction.ImageAnalysisRecord;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Append-only JSON-lines ledger of costs and API requests.
 *
 * <p>Records go to {@code <base-dir>/YYYY-MM-DD/usage/{indexing,sync,init}.jsonl} and {@code
 * <base-dir>/YYYY-MM-DD/audit/api.jsonl}; the directory date is local, the {@code timestamp} field
 * is UTC. Every record carries {@code total_cost}. A failed write is logged and does not interrupt
 * the operation being recorded.
 */
@Component
@Slf4j
public class UsageLedger {

  static final String USAGE_DIR = "usage";
  static final String AUDIT_DIR = "audit";
  static final String INDEXING_FILE = "indexing.jsonl";
  static final String SYNC_FILE = "sync.jsonl";
  static final String INIT_FILE = "init.jsonl";
  static final String API_FILE = "api.jsonl";

  private final Path baseDir;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public UsageLedger(NotionRagConfig config, ObjectMapper objectMapper, Clock clock) {
    this.baseDir = Paths.get(config.getLedger().getBaseDir());
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public Path getBaseDir() {
    return baseDir;
  }

  public void recordIndexing(IndexingEntry entry) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("label", entry.label());
    data.put("page_id", entry.pageId());
    data.put("title", entry.title());
    data.put("embedding_model", entry.embeddingModel());
    data.put("embedding_tokens", entry.embeddingTokens());
    data.put("embedding_cost", entry.embeddingCost());
    data.put("vision_model", entry.visionModel());
    data.put("vision_cost", entry.visionCost());
    data.put("total_cost", entry.totalCost());
    data.put("status", entry.status());
    if (entry.error() != null) {
      data.put("error", entry.error());
    }
    if (!entry.images().isEmpty()) {
      data.put("images", imagesOf(entry.images()));
    }
    append(USAGE_DIR, INDEXING_FILE, data);
  }

  public void recordSync(
      String label,
      String databaseId,
      int pagesChecked,
      int pagesUpdated,
      int pagesSkipped,
      int pagesFailed,
      double indexingCost,
      double imageCost,
      boolean force) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("label", label);
    data.put("db_id", databaseId);
    data.put("pages_checked", pagesChecked);
    data.put("pages_updated", pagesUpdated);
    data.put("pages_skipped", pagesSkipped);
    data.put("pages_failed", pagesFailed);
    data.put("indexing_cost", indexingCost);
    data.put("image_cost", imageCost);
    data.put("total_cost", indexingCost + imageCost);
    data.put("force", force);
    append(USAGE_DIR, SYNC_FILE, data);
  }

  public void recordInit(
      String label,
      String databaseId,
      String storeId,
      int pagesTotal,
      int pagesIndexed,
      int pagesFailed,
      double indexingCost,
      double imageCost) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("label", label);
    data.put("db_id", databaseId);
    data.put("store_name", storeId);
    data.put("pages_total", pagesTotal);
    data.put("pages_indexed", pagesIndexed);
    data.put("pages_failed", pagesFailed);
    data.put("indexing_cost", indexingCost);
    data.put("image_cost", imageCost);
    data.put("total_cost", indexingCost + imageCost);
    append(USAGE_DIR, INIT_FILE, data);
  }

  public void recordApiRequest(
      String method, String path, int statusCode, double elapsedSeconds, String clientIp) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("method", method);
    data.put("path", path);
    data.put("status_code", statusCode);
    data.put("elapsed", elapsedSeconds);
    if (clientIp != null) {
      data.put("client_ip", clientIp);
    }
    data.put("total_cost", 0.0);
    append(AUDIT_DIR, API_FILE, data);
  }

  private List<Map<String, Object>> imagesOf(List<ImageAnalysisRecord> images) {
    List<Map<String, Object>> result = new ArrayList<>();
    for (ImageAnalysisRecord image : images) {
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("url", image.url());
      item.put("caption", image.caption());
      item.put("type", image.classification());
      item.put("cost", image.cost());
      item.put("elapsed", image.elapsed().toMillis() / 1000.0);
      item.put("description_preview", image.descriptionPreview());
      result.add(item);
    }
    return result;
  }

  private synchronized void append(String category, String fileName, Map<String, Object> data) {
    data.put("timestamp", Instant.now(clock).toString());
    Path dir = baseDir.resolve(LocalDate.now(clock).toString()).resolve(category);
    try {
      String line = objectMapper.writeValueAsString(data) + "\n";
      Files.createDirectories(dir);
      Files.writeString(
          dir.resolve(fileName),
          line,
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND);
    } catch (JsonProcessingException e) {
      log.warn("Failed to serialize {} record: {}", fileName, e.getMessage());
    } catch (IOException e) {
      log.warn("Failed to append to {}/{}: {}", dir, fileName, e.getMessage());
    }
  }
}
