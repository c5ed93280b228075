package com.flamingo.ai.notionrag.store;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.notionrag.config.NotionRagConfig;
import com.flamingo.ai.notionrag.exception.StoreOperationException;
import com.google.common.hash.Hashing;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link StoreGateway} backed by Elasticsearch: one index per store, one document per page.
 *
 * <p>Documents are indexed without a refresh, so a fresh upload becomes visible to search only
 * after the next index refresh. {@link #pollStatus(UploadHandle)} reports that moment.
 *
 * <p>Index names are {@code <prefix><slug>-<hash>}: the slug keeps the name readable, the hash of
 * the exact label keeps two labels from ever sharing an index.
 */
@Service
@Slf4j
public class ElasticsearchStoreGateway implements StoreGateway {

  static final String FIELD_ARTIFACT_ID = "artifactId";
  static final String FIELD_CONTENT = "content";
  static final String FIELD_DISPLAY_LABEL = "displayLabel";
  static final String FIELD_METADATA = "metadata";
  static final String FIELD_EMBEDDING = "embedding";
  static final String FIELD_INDEXED_AT = "indexedAt";
  static final String PAGE_ID_FIELD = FIELD_METADATA + "." + StoredArtifact.PAGE_ID;

  private static final int MAX_SLUG_LENGTH = 40;
  private static final int LABEL_HASH_LENGTH = 10;

  private final ElasticsearchClient elasticsearchClient;
  private final EmbeddingService embeddingService;
  private final MeterRegistry meterRegistry;
  private final String indexPrefix;
  private final int vectorDimensions;
  private final int listPageSize;

  public ElasticsearchStoreGateway(
      ElasticsearchClient elasticsearchClient,
      EmbeddingService embeddingService,
      MeterRegistry meterRegistry,
      NotionRagConfig config) {
    this.elasticsearchClient = elasticsearchClient;
    this.embeddingService = embeddingService;
    this.meterRegistry = meterRegistry;
    this.indexPrefix = config.getStore().getIndexPrefix();
    this.vectorDimensions = config.getStore().getVectorDimensions();
    this.listPageSize = config.getStore().getListPageSize();
  }

  @Override
  public String storeIdFor(String label) {
    String slug =
        label
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9_-]+", "-")
            .replaceAll("^[-_]+|[-_]+$", "");
    if (slug.length() > MAX_SLUG_LENGTH) {
      slug = slug.substring(0, MAX_SLUG_LENGTH);
    }
    String hash =
        Hashing.sha256()
            .hashString(label, StandardCharsets.UTF_8)
            .toString()
            .substring(0, LABEL_HASH_LENGTH);
    return slug.isEmpty() ? indexPrefix + hash : indexPrefix + slug + "-" + hash;
  }

  @Override
  @Retry(name = "elasticsearch")
  public boolean storeExists(String storeId) {
    try {
      return elasticsearchClient.indices().exists(e -> e.index(storeId)).value();
    } catch (IOException | ElasticsearchException e) {
      throw failure(storeId, "check store", e);
    }
  }

  @Override
  public void ensureStore(String storeId) {
    if (storeExists(storeId)) {
      return;
    }
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps the mapping to the declared fields only
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(storeId)
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    try {
      elasticsearchClient.indices().create(request);
      log.info("Created store index: {}", storeId);
    } catch (IOException | ElasticsearchException e) {
      throw failure(storeId, "create store", e);
    }
  }

  @Override
  public void deleteStore(String storeId) {
    try {
      elasticsearchClient.indices().delete(d -> d.index(storeId));
      log.info("Deleted store index: {}", storeId);
    } catch (IOException | ElasticsearchException e) {
      throw failure(storeId, "delete store", e);
    }
  }

  @Override
  @Retry(name = "elasticsearch")
  public long countArtifacts(String storeId) {
    try {
      return elasticsearchClient.count(c -> c.index(storeId)).count();
    } catch (ElasticsearchException e) {
      if (isMissingIndex(e)) {
        return 0;
      }
      throw failure(storeId, "count artifacts", e);
    } catch (IOException e) {
      throw failure(storeId, "count artifacts", e);
    }
  }

  @Override
  @Retry(name = "elasticsearch")
  public Optional<StoredArtifact> findByMetadataKey(String storeId, String key, String value) {
    try {
      SearchResponse<ArtifactDocument> response =
          elasticsearchClient.search(
              s ->
                  s.index(storeId)
                      .size(1)
                      .source(src -> src.filter(f -> f.excludes(FIELD_EMBEDDING, FIELD_CONTENT)))
                      .query(q -> q.term(t -> t.field(FIELD_METADATA + "." + key).value(value))),
              ArtifactDocument.class);
      return response.hits().hits().stream()
          .findFirst()
          .map(hit -> toArtifact(storeId, hit));
    } catch (ElasticsearchException e) {
      if (isMissingIndex(e)) {
        return Optional.empty();
      }
      throw failure(storeId, "find artifact", e);
    } catch (IOException e) {
      throw failure(storeId, "find artifact", e);
    }
  }

  @Override
  @Timed(value = "store.list", description = "Time to list every artifact of a store")
  @Retry(name = "elasticsearch")
  public List<StoredArtifact> listAll(String storeId) {
    List<StoredArtifact> artifacts = new ArrayList<>();
    List<FieldValue> searchAfter = List.of();
    try {
      while (true) {
        List<FieldValue> after = searchAfter;
        SearchResponse<ArtifactDocument> response =
            elasticsearchClient.search(
                s -> {
                  s.index(storeId)
                      .size(listPageSize)
                      .source(
                          src -> src.filter(f -> f.excludes(FIELD_EMBEDDING, FIELD_CONTENT)))
                      .query(q -> q.matchAll(m -> m))
                      .sort(so -> so.field(f -> f.field(PAGE_ID_FIELD).order(SortOrder.Asc)))
                      .sort(so -> so.field(f -> f.field(FIELD_ARTIFACT_ID).order(SortOrder.Asc)));
                  if (!after.isEmpty()) {
                    s.searchAfter(after);
                  }
                  return s;
                },
                ArtifactDocument.class);
        List<Hit<ArtifactDocument>> hits = response.hits().hits();
        for (Hit<ArtifactDocument> hit : hits) {
          artifacts.add(toArtifact(storeId, hit));
        }
        if (hits.size() < listPageSize) {
          break;
        }
        searchAfter = hits.get(hits.size() - 1).sort();
      }
    } catch (ElasticsearchException e) {
      if (isMissingIndex(e)) {
        return List.of();
      }
      throw failure(storeId, "list artifacts", e);
    } catch (IOException e) {
      throw failure(storeId, "list artifacts", e);
    }
    log.debug("Listed {} artifacts in {}", artifacts.size(), storeId);
    return artifacts;
  }

  @Override
  @Timed(value = "store.upload", description = "Time to embed and index a page")
  public UploadHandle upload(
      String storeId, String text, String displayLabel, Map<String, String> metadata) {
    List<Float> embedding = embeddingService.embedDocument(text);
    String artifactId = UUID.randomUUID().toString();

    ArtifactDocument document =
        ArtifactDocument.builder()
            .artifactId(artifactId)
            .content(text)
            .displayLabel(displayLabel)
            .metadata(Map.copyOf(metadata))
            .embedding(embedding.isEmpty() ? null : embedding)
            .indexedAt(Instant.now().toString())
            .build();

    try {
      elasticsearchClient.index(i -> i.index(storeId).id(artifactId).document(document));
    } catch (IOException | ElasticsearchException e) {
      throw failure(storeId, "upload artifact", e);
    }
    meterRegistry.counter("store.uploads").increment();
    log.debug("Uploaded artifact {} ({}) to {}", artifactId, displayLabel, storeId);
    return new UploadHandle(storeId, artifactId);
  }

  @Override
  @Retry(name = "elasticsearch")
  public boolean pollStatus(UploadHandle handle) {
    try {
      long visible =
          elasticsearchClient
              .count(
                  c ->
                      c.index(handle.storeId())
                          .query(q -> q.ids(ids -> ids.values(handle.artifactId()))))
              .count();
      return visible > 0;
    } catch (IOException | ElasticsearchException e) {
      throw failure(handle.storeId(), "poll upload status", e);
    }
  }

  @Override
  public void delete(String storeId, String artifactId) {
    try {
      elasticsearchClient.delete(d -> d.index(storeId).id(artifactId).refresh(Refresh.WaitFor));
    } catch (IOException | ElasticsearchException e) {
      throw failure(storeId, "delete artifact " + artifactId, e);
    }
    meterRegistry.counter("store.deletes").increment();
    log.debug("Deleted artifact {} from {}", artifactId, storeId);
  }

  private Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // metadata values and artifactId MUST be keyword type for exact matching
    properties.put(FIELD_ARTIFACT_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(
        FIELD_METADATA,
        Property.of(
            p ->
                p.object(
                    o ->
                        o.properties(StoredArtifact.PAGE_ID, Property.of(k -> k.keyword(kw -> kw)))
                            .properties(
                                StoredArtifact.LAST_EDITED,
                                Property.of(k -> k.keyword(kw -> kw))))));
    properties.put(FIELD_DISPLAY_LABEL, Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(FIELD_CONTENT, Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(FIELD_INDEXED_AT, Property.of(p -> p.date(d -> d)));
    properties.put(
        FIELD_EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  private static StoredArtifact toArtifact(String storeId, Hit<ArtifactDocument> hit) {
    ArtifactDocument source = hit.source() == null ? new ArtifactDocument() : hit.source();
    return source.toArtifact(hit.id(), storeId);
  }

  private static boolean isMissingIndex(ElasticsearchException e) {
    return e.status() == 404;
  }

  private StoreOperationException failure(String storeId, String action, Exception e) {
    log.error("Failed to {} in {}: {}", action, storeId, e.getMessage());
    return new StoreOperationException(storeId, "Failed to " + action + ": " + e.getMessage(), e);
  }
}
