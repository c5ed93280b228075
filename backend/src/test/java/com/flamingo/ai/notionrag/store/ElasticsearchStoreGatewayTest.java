package com.flamingo.ai.notionrag.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.ErrorResponse;
import co.elastic.clients.elasticsearch.core.IndexRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.util.ObjectBuilder;
import com.flamingo.ai.notionrag.config.NotionRagConfig;
import com.flamingo.ai.notionrag.exception.StoreOperationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ElasticsearchStoreGateway Tests")
@SuppressWarnings("unchecked")
class ElasticsearchStoreGatewayTest {

  @Mock private ElasticsearchClient elasticsearchClient;
  @Mock private EmbeddingService embeddingService;

  @Captor
  private ArgumentCaptor<
          Function<
              IndexRequest.Builder<ArtifactDocument>,
              ObjectBuilder<IndexRequest<ArtifactDocument>>>>
      indexCaptor;

  private SimpleMeterRegistry meterRegistry;
  private ElasticsearchStoreGateway gateway;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    gateway =
        new ElasticsearchStoreGateway(
            elasticsearchClient, embeddingService, meterRegistry, new NotionRagConfig());
  }

  private static ElasticsearchException missingIndex() {
    return new ElasticsearchException(
        "count",
        ErrorResponse.of(
            r ->
                r.status(404)
                    .error(e -> e.type("index_not_found_exception").reason("no such index"))));
  }

  @Test
  @DisplayName("Should derive a readable, stable index name from the label")
  void shouldDeriveIndexName() {
    assertThat(gateway.storeIdFor("Team Notes")).matches("notion-rag-team-notes-[0-9a-f]{10}");
    assertThat(gateway.storeIdFor("kb_2025")).matches("notion-rag-kb_2025-[0-9a-f]{10}");
    assertThat(gateway.storeIdFor("Team Notes")).isEqualTo(gateway.storeIdFor("Team Notes"));
  }

  @ParameterizedTest
  @CsvSource({"KB, kb", "회의록, 일정표", "team notes, team-notes", "a/b, a?b"})
  @DisplayName("Should never map two different labels to the same index")
  void shouldKeepLabelsApart(String first, String second) {
    String firstId = gateway.storeIdFor(first);
    String secondId = gateway.storeIdFor(second);

    assertThat(firstId).isNotEqualTo(secondId);
    assertThat(firstId).matches("notion-rag-[a-z0-9_-]+").doesNotEndWith("-");
    assertThat(secondId).matches("notion-rag-[a-z0-9_-]+").doesNotEndWith("-");
  }

  @Test
  @DisplayName("Should use the hash alone when nothing of the label survives")
  void shouldFallBackToHashOnlyName() {
    assertThat(gateway.storeIdFor("회의록")).matches("notion-rag-[0-9a-f]{10}");
  }

  @Test
  @DisplayName("Should count a missing index as empty")
  void shouldCountMissingIndexAsEmpty() throws Exception {
    when(elasticsearchClient.count(any(Function.class))).thenThrow(missingIndex());

    assertThat(gateway.countArtifacts("notion-rag-kb")).isZero();
  }

  @Test
  @DisplayName("Should embed the text and return a handle for the new artifact")
  void shouldUploadWithEmbedding() throws Exception {
    when(embeddingService.embedDocument("body")).thenReturn(List.of(0.1f, 0.2f));

    UploadHandle handle =
        gateway.upload(
            "notion-rag-kb",
            "body",
            "[p] Title",
            Map.of("page_id", "p", "last_edited", "2025-01-02T10:00:00.000Z"));

    assertThat(handle.storeId()).isEqualTo("notion-rag-kb");
    assertThat(handle.artifactId()).isNotBlank();
    verify(elasticsearchClient).index(indexCaptor.capture());
    IndexRequest<ArtifactDocument> request =
        indexCaptor.getValue().apply(new IndexRequest.Builder<>()).build();
    assertThat(request.index()).isEqualTo("notion-rag-kb");
    assertThat(request.id()).isEqualTo(handle.artifactId());
    ArtifactDocument document = request.document();
    assertThat(document.getArtifactId()).isEqualTo(handle.artifactId());
    assertThat(document.getContent()).isEqualTo("body");
    assertThat(document.getDisplayLabel()).isEqualTo("[p] Title");
    assertThat(document.getMetadata())
        .containsEntry("page_id", "p")
        .containsEntry("last_edited", "2025-01-02T10:00:00.000Z");
    assertThat(document.getEmbedding()).containsExactly(0.1f, 0.2f);
    assertThat(meterRegistry.counter("store.uploads").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should read artifacts back from typed search hits")
  void shouldListTypedArtifacts() throws Exception {
    ArtifactDocument stored =
        ArtifactDocument.builder()
            .artifactId("a1")
            .displayLabel("[p1] Runbook")
            .metadata(Map.of("page_id", "p1", "last_edited", "2025-01-02T10:00:00.000Z"))
            .build();
    SearchResponse<ArtifactDocument> response =
        SearchResponse.of(
            r ->
                r.took(1)
                    .timedOut(false)
                    .shards(sh -> sh.total(1).successful(1).failed(0))
                    .hits(
                        h ->
                            h.hits(
                                List.of(
                                    Hit.of(
                                        hit ->
                                            hit.index("notion-rag-kb")
                                                .id("a1")
                                                .source(stored))))));
    when(elasticsearchClient.search(any(Function.class), eq(ArtifactDocument.class)))
        .thenReturn(response);

    List<StoredArtifact> artifacts = gateway.listAll("notion-rag-kb");

    assertThat(artifacts)
        .singleElement()
        .satisfies(
            artifact -> {
              assertThat(artifact.id()).isEqualTo("a1");
              assertThat(artifact.storeId()).isEqualTo("notion-rag-kb");
              assertThat(artifact.displayLabel()).isEqualTo("[p1] Runbook");
              assertThat(artifact.pageId()).isEqualTo("p1");
              assertThat(artifact.lastEdited()).isEqualTo("2025-01-02T10:00:00.000Z");
            });
  }

  @Test
  @DisplayName("Should wrap transport failures in StoreOperationException")
  void shouldWrapTransportFailures() throws Exception {
    when(elasticsearchClient.delete(any(Function.class))).thenThrow(new IOException("down"));

    assertThatThrownBy(() -> gateway.delete("notion-rag-kb", "a1"))
        .isInstanceOfSatisfying(
            StoreOperationException.class,
            e -> {
              assertThat(e.getStoreId()).isEqualTo("notion-rag-kb");
              assertThat(e.getMessage()).contains("delete artifact a1").contains("down");
            });
    assertThat(meterRegistry.find("store.deletes").counter()).isNull();
  }
}
