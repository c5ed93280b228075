package com.flamingo.ai.notionrag.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/** HTTP clients for the Notion API and for image downloads. */
@Configuration
public class WebClientConfig {

  private static final int NOTION_MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

  @Bean
  public WebClient notionWebClient(NotionRagConfig config) {
    NotionRagConfig.Notion notion = config.getNotion();
    validateToken(notion.getToken());

    HttpClient httpClient =
        HttpClient.create()
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) notion.getConnectTimeout().toMillis())
            .responseTimeout(notion.getReadTimeout());

    return WebClient.builder()
        .baseUrl(notion.getBaseUrl())
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + notion.getToken())
        .defaultHeader("Notion-Version", notion.getApiVersion())
        .codecs(
            configurer -> configurer.defaultCodecs().maxInMemorySize(NOTION_MAX_RESPONSE_BYTES))
        .build();
  }

  /** Follows redirects; Notion-hosted images are served through signed S3 redirects. */
  @Bean
  public WebClient imageWebClient(NotionRagConfig config) {
    NotionRagConfig.Image image = config.getImage();
    HttpClient httpClient =
        HttpClient.create().followRedirect(true).responseTimeout(image.getDownloadTimeout());

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(image.getMaxBytes()))
        .build();
  }

  private void validateToken(String token) {
    if (token == null || token.isBlank()) {
      throw new IllegalStateException(
          "Notion integration token is required. Set NOTION_TOKEN environment variable.");
    }
  }
}
