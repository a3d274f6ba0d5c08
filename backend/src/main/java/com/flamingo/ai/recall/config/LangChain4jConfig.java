package com.flamingo.ai.recall.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI models behind the extraction and conflict agents and the embedding service.
 *
 * <p>The chat model answers in JSON mode and never retries on its own: one turn costs one
 * extraction request and one candidate at most one classification request. The embedding width
 * has to match the dense_vector mapping of the memory index.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String apiKey;

  @Value("${langchain4j.openai.base-url:}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-5-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:2048}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.timeout:30s}")
  private Duration chatTimeout;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  @Value("${langchain4j.openai.embedding-model.timeout:15s}")
  private Duration embeddingTimeout;

  @Value("${elasticsearch.vector-dimensions:1536}")
  private int indexDimensions;

  @Bean
  public ChatModel chatModel() {
    requireApiKey();

    return OpenAiChatModel.builder()
        .apiKey(apiKey)
        .baseUrl(blankToNull(baseUrl))
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .responseFormat("json_object")
        .timeout(chatTimeout)
        .maxRetries(0)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    requireApiKey();
    if (embeddingDimensions != indexDimensions) {
      throw new IllegalStateException(
          String.format(
              "Embedding dimensions (%d) do not match elasticsearch.vector-dimensions (%d)",
              embeddingDimensions, indexDimensions));
    }

    return OpenAiEmbeddingModel.builder()
        .apiKey(apiKey)
        .baseUrl(blankToNull(baseUrl))
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(embeddingTimeout)
        .build();
  }

  private void requireApiKey() {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "langchain4j.openai.api-key is not set. Export OPENAI_API_KEY before starting.");
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
