package com.flamingo.ai.recall.service.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for generating text embeddings using OpenAI's embedding model.
 *
 * <p>Each call is retried with exponential backoff before falling back. An empty list means the
 * provider was unavailable; callers treat it as "no embedding".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // Memory content is capped at 5000 chars, queries are truncated to the same bound
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a retrieval query.
   *
   * @param query the query text
   * @return embedding vector, empty when the provider is unavailable
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai", fallbackMethod = "embedTextFallback")
  public List<Float> embedQuery(String query) {
    Response<Embedding> response = embeddingModel.embed(truncate(query));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Embeds memory content for storage and duplicate detection.
   *
   * @param content the memory content
   * @return embedding vector, empty when the provider is unavailable
   */
  @Timed(value = "embedding.embedMemory", description = "Time to embed memory content")
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai", fallbackMethod = "embedTextFallback")
  public List<Float> embedMemory(String content) {
    Response<Embedding> response = embeddingModel.embed(truncate(content));
    meterRegistry.counter("embedding.requests.success", "type", "memory").increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Cosine similarity of two vectors of equal length.
   *
   * @return similarity in [-1, 1], or 0 when either vector is empty, zero or the lengths differ
   */
  public static double cosineSimilarity(List<Float> a, List<Float> b) {
    if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
      return 0.0;
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  private String truncate(String text) {
    if (text.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          text.length(),
          MAX_CHARS_PER_EMBEDDING);
      return text.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    return text;
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedTextFallback(String text, Throwable t) {
    log.warn("Embedding unavailable, continuing without vector: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
