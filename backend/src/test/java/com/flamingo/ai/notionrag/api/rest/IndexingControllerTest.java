package com.flamingo.ai.notionrag.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.notionrag.exception.GlobalExceptionHandler;
import com.flamingo.ai.notionrag.exception.InvalidIdentifierException;
import com.flamingo.ai.notionrag.exception.NotionApiException;
import com.flamingo.ai.notionrag.exception.PageIndexingException;
import com.flamingo.ai.notionrag.exception.UnknownDatabaseException;
import com.flamingo.ai.notionrag.sync.ChangeStatus;
import com.flamingo.ai.notionrag.sync.InitResult;
import com.flamingo.ai.notionrag.sync.PageIndexResult;
import com.flamingo.ai.notionrag.sync.SyncOrchestrator;
import com.flamingo.ai.notionrag.sync.SyncResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("IndexingController Tests")
class IndexingControllerTest {

  private static final String DB_ID = "286c479a8fc21c807d134a19e9ae7065";

  @Mock private SyncOrchestrator syncOrchestrator;

  private SimpleMeterRegistry meterRegistry;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new IndexingController(syncOrchestrator))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Nested
  @DisplayName("POST /api/init")
  class Init {

    @Test
    @DisplayName("Should return the run summary with costs")
    void shouldReturnSummary() throws Exception {
      when(syncOrchestrator.initDatabase("kb", "https://www.notion.so/" + DB_ID))
          .thenReturn(
              new InitResult("kb", DB_ID, "notion-rag-kb", 3, 2, 1, List.of("p3"), 0.25, 0.5));

      mockMvc
          .perform(
              post("/api/init")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      "{\"label\": \"kb\", \"databaseUrl\": \"https://www.notion.so/"
                          + DB_ID
                          + "\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.storeName").value("notion-rag-kb"))
          .andExpect(jsonPath("$.pagesTotal").value(3))
          .andExpect(jsonPath("$.pagesFailed").value(1))
          .andExpect(jsonPath("$.failedPageIds[0]").value("p3"))
          .andExpect(jsonPath("$.totalCost").value(0.75));
    }

    @Test
    @DisplayName("Should map an invalid URL to 400")
    void shouldMapInvalidUrl() throws Exception {
      when(syncOrchestrator.initDatabase(anyString(), anyString()))
          .thenThrow(new InvalidIdentifierException("bogus"));

      mockMvc
          .perform(
              post("/api/init")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"label\": \"kb\", \"databaseUrl\": \"bogus\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("INPUT_001"))
          .andExpect(jsonPath("$.path").value("/api/init"));
    }

    @Test
    @DisplayName("Should map a missing label to 400")
    void shouldMapMissingLabel() throws Exception {
      when(syncOrchestrator.initDatabase(isNull(), anyString()))
          .thenThrow(
              new IllegalArgumentException("Label is required when providing a database URL"));

      mockMvc
          .perform(
              post("/api/init")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"databaseUrl\": \"" + DB_ID + "\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"))
          .andExpect(
              jsonPath("$.message").value("Label is required when providing a database URL"));
    }
  }

  @Nested
  @DisplayName("POST /api/sync")
  class Sync {

    @Test
    @DisplayName("Should sync the only database when no body is sent")
    void shouldSyncWithoutBody() throws Exception {
      when(syncOrchestrator.syncDatabase(null, false))
          .thenReturn(
              new SyncResult(
                  "kb", DB_ID, "notion-rag-kb", 2, 1, 1, List.of(), 0.25, 0.0, false));

      mockMvc
          .perform(post("/api/sync"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.pagesUpdated").value(1))
          .andExpect(jsonPath("$.force").value(false));
    }

    @Test
    @DisplayName("Should map an unknown label to 404")
    void shouldMapUnknownLabel() throws Exception {
      when(syncOrchestrator.syncDatabase("wiki", true))
          .thenThrow(
              new UnknownDatabaseException(
                  "wiki", "Unknown database label 'wiki'. Available labels: kb"));

      mockMvc
          .perform(
              post("/api/sync")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"label\": \"wiki\", \"force\": true}"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value("DATABASE_001"));
    }

    @Test
    @DisplayName("Should map Notion rate limiting to 429")
    void shouldMapRateLimit() throws Exception {
      when(syncOrchestrator.syncDatabase(any(), anyBoolean()))
          .thenThrow(new NotionApiException("Notion returned 429", 429, null));

      mockMvc
          .perform(post("/api/sync"))
          .andExpect(status().isTooManyRequests())
          .andExpect(jsonPath("$.code").value("NOTION_002"));
    }
  }

  @Nested
  @DisplayName("POST /api/pages")
  class Pages {

    @Test
    @DisplayName("Should report whether the page was updated")
    void shouldIndexPage() throws Exception {
      when(syncOrchestrator.indexSinglePage("kb", "abc", false))
          .thenReturn(new PageIndexResult("abc", "Runbook", ChangeStatus.NEW, 10, 0.25, 0.5, "a1"));

      mockMvc
          .perform(
              post("/api/pages")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"label\": \"kb\", \"page\": \"abc\"}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("NEW"))
          .andExpect(jsonPath("$.updated").value(true))
          .andExpect(jsonPath("$.totalCost").value(0.75));
    }

    @Test
    @DisplayName("Should reject a blank page reference")
    void shouldRejectBlankPage() throws Exception {
      mockMvc
          .perform(
              post("/api/pages")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"label\": \"kb\", \"page\": \"\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"));
      verifyNoInteractions(syncOrchestrator);
    }

    @Test
    @DisplayName("Should map a failed page to 502 and count the error")
    void shouldMapIndexingFailure() throws Exception {
      when(syncOrchestrator.indexSinglePage(any(), anyString(), anyBoolean()))
          .thenThrow(new PageIndexingException("abc", "upload rejected"));

      mockMvc
          .perform(
              post("/api/pages")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"page\": \"abc\"}"))
          .andExpect(status().isBadGateway())
          .andExpect(jsonPath("$.code").value("INDEXING_001"));
      verify(syncOrchestrator).indexSinglePage(null, "abc", false);
      assertThat(meterRegistry.find("api_errors_total").counter().count()).isEqualTo(1.0);
    }
  }
}
