package com.flamingo.ai.notionrag.store;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.TokenCountEstimator;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generates document embeddings and counts billable embedding tokens. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below for dense CJK text
  private static final int MAX_CHARS_PER_EMBEDDING = 6000;
  private static final int CHARS_PER_TOKEN_FALLBACK = 4;

  private final EmbeddingModel embeddingModel;
  private final TokenCountEstimator tokenCountEstimator;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a page body. Text beyond the model's input limit is truncated.
   *
   * @param text the rendered page text
   * @return embedding vector
   */
  @Timed(value = "embedding.embedDocument", description = "Time to embed a page")
  @Retry(name = "openai")
  public List<Float> embedDocument(String text) {
    String input = text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.debug(
          "Document too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    Response<Embedding> response = embeddingModel.embed(input);
    meterRegistry.counter("embedding.requests.success").increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Counts the tokens billed for storing {@code text}, using the embedding model's tokenizer and
   * falling back to a four-characters-per-token estimate.
   */
  public int countTokens(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    try {
      return tokenCountEstimator.estimateTokenCountInText(text);
    } catch (RuntimeException e) {
      log.warn("Token counting failed, using character estimate: {}", e.getMessage());
      return text.length() / CHARS_PER_TOKEN_FALLBACK;
    }
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
