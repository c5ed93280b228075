package com.flamingo.ai.notionrag.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Aggregates the usage ledger into billing reports.
 *
 * <p>Only per-page indexing records are summed. Sync and init summaries repeat the same costs and
 * would count them twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingService {

  private final UsageLedger usageLedger;
  private final ObjectMapper objectMapper;

  public BillingSummary summarize(BillingPeriod period) {
    List<JsonNode> entries = scanIndexingRecords();
    CostBreakdown total = aggregate(null, entries);
    if (period == BillingPeriod.TOTAL) {
      return new BillingSummary(period, total, List.of());
    }

    Map<String, List<JsonNode>> groups = new TreeMap<>();
    for (JsonNode entry : entries) {
      String timestamp = entry.path("timestamp").asText("");
      if (!timestamp.isEmpty()) {
        groups.computeIfAbsent(period.keyOf(timestamp), k -> new ArrayList<>()).add(entry);
      }
    }
    List<CostBreakdown> breakdown = new ArrayList<>();
    groups.forEach((key, group) -> breakdown.add(aggregate(key, group)));
    return new BillingSummary(period, total, breakdown);
  }

  private CostBreakdown aggregate(String key, List<JsonNode> entries) {
    double embedding = 0.0;
    double vision = 0.0;
    for (JsonNode entry : entries) {
      embedding += entry.path("embedding_cost").asDouble(0.0);
      vision += entry.path("vision_cost").asDouble(0.0);
    }
    return new CostBreakdown(key, round(embedding), round(vision), round(embedding + vision));
  }

  private List<JsonNode> scanIndexingRecords() {
    Path baseDir = usageLedger.getBaseDir();
    List<JsonNode> entries = new ArrayList<>();
    if (!Files.isDirectory(baseDir)) {
      return entries;
    }
    try (Stream<Path> dateDirs = Files.list(baseDir)) {
      for (Path dateDir : dateDirs.sorted().toList()) {
        Path file = dateDir.resolve(UsageLedger.USAGE_DIR).resolve(UsageLedger.INDEXING_FILE);
        if (Files.isRegularFile(file)) {
          readLines(file, entries);
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to scan ledger directory " + baseDir, e);
    }
    return entries;
  }

  private void readLines(Path file, List<JsonNode> into) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        try {
          into.add(objectMapper.readTree(line));
        } catch (IOException e) {
          log.warn("Skipping malformed ledger line {}:{}: {}", file, lineNumber, e.getMessage());
        }
      }
    }
  }

  private static double round(double value) {
    return BigDecimal.valueOf(value).setScale(8, RoundingMode.HALF_UP).doubleValue();
  }
}
