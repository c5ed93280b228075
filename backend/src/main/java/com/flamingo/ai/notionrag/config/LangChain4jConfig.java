package com.flamingo.ai.notionrag.config;

import dev.langchain4j.model.TokenCountEstimator;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for LangChain4j models. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.vision-model.max-completion-tokens:1024}")
  private int maxCompletionTokens;

  @Bean
  public ChatModel visionChatModel(NotionRagConfig config) {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(config.getModels().getImageVision())
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(Duration.ofSeconds(60))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel(NotionRagConfig config) {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(config.getModels().getEmbedding())
        .dimensions(config.getStore().getVectorDimensions())
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  /** Tokenizer of the embedding model; counts billable tokens locally. */
  @Bean
  public TokenCountEstimator tokenCountEstimator(NotionRagConfig config) {
    return new OpenAiTokenCountEstimator(config.getModels().getEmbedding());
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
