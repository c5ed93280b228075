package com.flamingo.ai.notionrag.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import co.elastic.clients.transport.rest5_client.low_level.Rest5ClientBuilder;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch client for the page stores, using Apache HttpComponents 5 (ES 9.0+).
 *
 * <p>Connection settings come from {@code notion-rag.store}. Artifact documents are serialized
 * with a copy of the application's {@link ObjectMapper} that leaves out null fields, so a page
 * without an embedding is stored without the vector field.
 */
@Configuration
@Slf4j
public class ElasticsearchConfig {

  @Bean(destroyMethod = "close")
  public Rest5Client rest5Client(NotionRagConfig config) {
    NotionRagConfig.Store store = config.getStore();
    HttpHost httpHost = new HttpHost(store.getScheme(), store.getHost(), store.getPort());
    Rest5ClientBuilder builder = Rest5Client.builder(httpHost);
    if (!store.getApiKey().isBlank()) {
      builder.setDefaultHeaders(
          new Header[] {new BasicHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + store.getApiKey())});
    }
    log.info(
        "Elasticsearch store at {} (index prefix '{}')", httpHost.toURI(), store.getIndexPrefix());
    return builder.build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(
      Rest5Client rest5Client, ObjectMapper objectMapper) {
    ObjectMapper storeMapper =
        objectMapper.copy().setSerializationInclusion(JsonInclude.Include.NON_NULL);
    return new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper(storeMapper));
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }
}
