package com.flamingo.ai.notionrag.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.notionrag.config.NotionRagConfig;
import com.flamingo.ai.notionrag.extraction.ImageAnalysisRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("UsageLedger Tests")
class UsageLedgerTest {

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private UsageLedger ledger;

  @BeforeEach
  void setUp() {
    NotionRagConfig config = new NotionRagConfig();
    config.getLedger().setBaseDir(tempDir.toString());
    Clock clock = Clock.fixed(Instant.parse("2025-02-10T08:30:00Z"), ZoneOffset.UTC);
    ledger = new UsageLedger(config, objectMapper, clock);
  }

  private List<JsonNode> read(String category, String file) throws Exception {
    Path path = tempDir.resolve("2025-02-10").resolve(category).resolve(file);
    return Files.readAllLines(path).stream().map(this::parse).toList();
  }

  private JsonNode parse(String line) {
    try {
      return objectMapper.readTree(line);
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }

  @Test
  @DisplayName("Should append indexing records with snake_case keys and total cost")
  void shouldAppendIndexingRecords() throws Exception {
    ledger.recordIndexing(
        IndexingEntry.builder()
            .label("kb")
            .pageId("p1")
            .title("Runbook")
            .embeddingModel("text-embedding-3-small")
            .embeddingTokens(1200)
            .embeddingCost(0.25)
            .visionModel("gpt-4o-mini")
            .visionCost(0.5)
            .build());
    ledger.recordIndexing(
        IndexingEntry.builder()
            .label("kb")
            .pageId("p2")
            .status(IndexingEntry.ERROR)
            .error("boom")
            .build());

    List<JsonNode> lines = read(UsageLedger.USAGE_DIR, UsageLedger.INDEXING_FILE);

    assertThat(lines).hasSize(2);
    JsonNode success = lines.get(0);
    assertThat(success.path("page_id").asText()).isEqualTo("p1");
    assertThat(success.path("embedding_tokens").asInt()).isEqualTo(1200);
    assertThat(success.path("total_cost").asDouble()).isEqualTo(0.75);
    assertThat(success.path("status").asText()).isEqualTo("success");
    assertThat(success.path("timestamp").asText()).isEqualTo("2025-02-10T08:30:00Z");
    assertThat(success.has("error")).isFalse();
    assertThat(success.has("images")).isFalse();

    JsonNode failure = lines.get(1);
    assertThat(failure.path("status").asText()).isEqualTo("error");
    assertThat(failure.path("error").asText()).isEqualTo("boom");
    assertThat(failure.path("total_cost").asDouble()).isZero();
  }

  @Test
  @DisplayName("Should include per-image details when present")
  void shouldIncludeImages() throws Exception {
    ImageAnalysisRecord image =
        new ImageAnalysisRecord(
            "https://img/a.png", "flow", "diagram", 0.5, Duration.ofMillis(1500), "A to B");
    ledger.recordIndexing(
        IndexingEntry.builder().label("kb").pageId("p").images(List.of(image)).build());

    JsonNode images = read(UsageLedger.USAGE_DIR, UsageLedger.INDEXING_FILE).get(0).path("images");
    assertThat(images).hasSize(1);
    assertThat(images.get(0).path("type").asText()).isEqualTo("diagram");
    assertThat(images.get(0).path("elapsed").asDouble()).isEqualTo(1.5);
    assertThat(images.get(0).path("description_preview").asText()).isEqualTo("A to B");
  }

  @Test
  @DisplayName("Should write sync, init and API audit records to their own files")
  void shouldWriteSummaryRecords() throws Exception {
    ledger.recordSync("kb", "db", 3, 1, 1, 1, 0.25, 0.5, true);
    ledger.recordInit("kb", "db", "store-kb", 4, 3, 1, 0.5, 0.25);
    ledger.recordApiRequest("POST", "/api/sync", 200, 1.5, "127.0.0.1");

    JsonNode sync = read(UsageLedger.USAGE_DIR, UsageLedger.SYNC_FILE).get(0);
    assertThat(sync.path("pages_updated").asInt()).isEqualTo(1);
    assertThat(sync.path("force").asBoolean()).isTrue();
    assertThat(sync.path("total_cost").asDouble()).isEqualTo(0.75);

    JsonNode init = read(UsageLedger.USAGE_DIR, UsageLedger.INIT_FILE).get(0);
    assertThat(init.path("store_name").asText()).isEqualTo("store-kb");
    assertThat(init.path("pages_indexed").asInt()).isEqualTo(3);

    JsonNode api = read(UsageLedger.AUDIT_DIR, UsageLedger.API_FILE).get(0);
    assertThat(api.path("status_code").asInt()).isEqualTo(200);
    assertThat(api.path("client_ip").asText()).isEqualTo("127.0.0.1");
    assertThat(api.path("total_cost").asDouble()).isZero();
  }
}
