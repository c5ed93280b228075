package com.flamingo.ai.notionrag.config;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.notionrag.store.ArtifactDocument;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ElasticsearchConfig Tests")
class ElasticsearchConfigTest {

  private final ElasticsearchConfig elasticsearchConfig = new ElasticsearchConfig();

  @Test
  @DisplayName("Should connect to the host configured under notion-rag.store")
  void shouldUseStoreConnectionSettings() throws Exception {
    NotionRagConfig config = new NotionRagConfig();
    config.getStore().setScheme("https");
    config.getStore().setHost("es.internal");
    config.getStore().setPort(9243);
    config.getStore().setApiKey("secret");

    try (Rest5Client client = elasticsearchConfig.rest5Client(config)) {
      assertThat(client.getNodes())
          .singleElement()
          .satisfies(
              node -> assertThat(node.getHost().toURI()).isEqualTo("https://es.internal:9243"));
    }
  }

  @Test
  @DisplayName("Should leave null fields out of stored documents")
  void shouldOmitNullFields() throws Exception {
    ObjectMapper applicationMapper = new ObjectMapper();
    ElasticsearchTransport transport =
        elasticsearchConfig.elasticsearchTransport(
            elasticsearchConfig.rest5Client(new NotionRagConfig()), applicationMapper);

    try (transport) {
      ObjectMapper storeMapper = ((JacksonJsonpMapper) transport.jsonpMapper()).objectMapper();
      String json =
          storeMapper.writeValueAsString(
              ArtifactDocument.builder()
                  .artifactId("a1")
                  .content("body")
                  .metadata(Map.of("page_id", "p1"))
                  .build());

      assertThat(json).contains("\"artifactId\":\"a1\"").doesNotContain("embedding");
      assertThat(storeMapper).isNotSameAs(applicationMapper);
    }
  }
}
