package com.flamingo.ai.notionrag.notion;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.notionrag.config.NotionRagConfig;
import com.flamingo.ai.notionrag.exception.NotionApiException;
import com.flamingo.ai.notionrag.notion.model.BlockChildrenPage;
import com.flamingo.ai.notionrag.notion.model.PageProperties;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * {@link PageSource} backed by the Notion REST API.
 *
 * <p>Databases are queried through their first data source ({@code /data_sources/{id}/query});
 * databases that expose no data source fall back to the legacy {@code /databases/{id}/query}.
 */
@Service
@Slf4j
public class NotionPageSource implements PageSource {

  private final WebClient webClient;
  private final int pageSize;
  private final Duration timeout;

  public NotionPageSource(
      @Qualifier("notionWebClient") WebClient webClient, NotionRagConfig config) {
    this.webClient = webClient;
    this.pageSize = config.getNotion().getPageSize();
    this.timeout = config.getNotion().getReadTimeout();
  }

  @Override
  @Retry(name = "notion")
  @Timed(value = "notion.list_pages", description = "Time to list database pages")
  public List<String> listPages(String databaseId, Instant modifiedSince) {
    String queryPath = resolveQueryPath(databaseId);
    Map<String, Object> filter = modifiedSince == null ? null : editedOnOrAfter(modifiedSince);

    List<String> pageIds = new ArrayList<>();
    String cursor = null;
    do {
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("page_size", pageSize);
      if (filter != null) {
        body.put("filter", filter);
      }
      if (cursor != null) {
        body.put("start_cursor", cursor);
      }
      JsonNode response = execute("POST " + queryPath, () -> post(queryPath, body));
      for (JsonNode page : response.path("results")) {
        pageIds.add(NotionIds.normalize(page.path("id").asText()));
      }
      cursor = response.path("has_more").asBoolean(false) ? nextCursor(response) : null;
    } while (cursor != null);

    log.debug(
        "Database {} returned {} page(s) (modifiedSince={})",
        databaseId,
        pageIds.size(),
        modifiedSince);
    return pageIds;
  }

  @Override
  @Retry(name = "notion")
  public PageProperties getPageProperties(String pageId) {
    JsonNode page =
        execute(
            "GET /pages/" + pageId,
            () ->
                webClient.get().uri("/pages/{id}", pageId).retrieve().bodyToMono(JsonNode.class));
    return NotionJsonMapper.toPageProperties(page);
  }

  @Override
  @Retry(name = "notion")
  public BlockChildrenPage listBlockChildren(String blockId, String cursor) {
    JsonNode response =
        execute(
            "GET /blocks/" + blockId + "/children",
            () ->
                webClient
                    .get()
                    .uri(
                        builder -> {
                          builder.path("/blocks/{id}/children").queryParam("page_size", pageSize);
                          if (cursor != null) {
                            builder.queryParam("start_cursor", cursor);
                          }
                          return builder.build(blockId);
                        })
                    .retrieve()
                    .bodyToMono(JsonNode.class));
    return NotionJsonMapper.toChildrenPage(response);
  }

  private String resolveQueryPath(String databaseId) {
    JsonNode database =
        execute(
            "GET /databases/" + databaseId,
            () ->
                webClient
                    .get()
                    .uri("/databases/{id}", databaseId)
                    .retrieve()
                    .bodyToMono(JsonNode.class));
    JsonNode dataSources = database.path("data_sources");
    if (dataSources.isArray() && !dataSources.isEmpty()) {
      String dataSourceId = dataSources.get(0).path("id").asText();
      return "/data_sources/" + dataSourceId + "/query";
    }
    return "/databases/" + databaseId + "/query";
  }

  private Mono<JsonNode> post(String path, Map<String, Object> body) {
    return webClient
        .post()
        .uri(path)
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(body)
        .retrieve()
        .bodyToMono(JsonNode.class);
  }

  private JsonNode execute(String description, Supplier<Mono<JsonNode>> call) {
    try {
      JsonNode body = call.get().block(timeout);
      if (body == null) {
        throw new NotionApiException("Empty response from Notion for " + description, null);
      }
      return body;
    } catch (WebClientResponseException e) {
      int status = e.getStatusCode().value();
      throw new NotionApiException(
          String.format(
              "Notion returned %d for %s: %s", status, description, e.getResponseBodyAsString()),
          status,
          e);
    } catch (WebClientRequestException e) {
      throw new NotionApiException("Notion unreachable for " + description, e);
    } catch (IllegalStateException e) {
      // block(timeout) signals an elapsed timeout this way
      throw new NotionApiException("Notion timed out for " + description, e);
    }
  }

  private static Map<String, Object> editedOnOrAfter(Instant since) {
    return Map.of(
        "timestamp",
        "last_edited_time",
        "last_edited_time",
        Map.of("on_or_after", since.toString()));
  }

  private static String nextCursor(JsonNode response) {
    JsonNode cursor = response.path("next_cursor");
    return cursor.isNull() || cursor.isMissingNode() ? null : cursor.asText();
  }
}
