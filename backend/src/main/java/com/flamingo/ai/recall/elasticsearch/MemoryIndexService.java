package com.flamingo.ai.recall.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.IndexRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.UpdateRequest;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.recall.exception.ExternalServiceUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch similarity index for memories.
 *
 * <p>Failures surface as {@link ExternalServiceUnavailableException}; callers decide how to
 * degrade.
 */
@Service
@Slf4j
public class MemoryIndexService {

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;

  @Value("${elasticsearch.memory-index-name:recall-memories}")
  private String indexName;

  @Value("${elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  public MemoryIndexService(ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn("Elasticsearch client not available, skipping memory index initialization");
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch memory index: {}", indexName);
      }
    } catch (Exception e) {
      // Writes fall back to INDEX_PENDING until the index is reachable.
      log.warn("Could not check/create Elasticsearch memory index: {}", e.getMessage());
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put("userId", Property.of(p -> p.keyword(k -> k)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("memoryType", Property.of(p -> p.keyword(k -> k)));
    properties.put("importanceScore", Property.of(p -> p.float_(f -> f)));
    properties.put("createdAt", Property.of(p -> p.long_(l -> l)));
    properties.put("superseded", Property.of(p -> p.boolean_(b -> b)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));

    CreateIndexRequest createIndexRequest =
        CreateIndexRequest.of(c -> c.index(indexName).mappings(m -> m.properties(properties)));

    elasticsearchClient.indices().create(createIndexRequest);
  }

  /**
   * Inserts or replaces the document for one memory.
   *
   * @param document the memory document, which must carry an embedding
   * @throws ExternalServiceUnavailableException when the index cannot be written
   */
  @Timed(value = "memory.index.upsert", description = "Time to upsert a memory document")
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  public void upsert(MemoryDocument document) {
    try {
      IndexRequest<Map<String, Object>> request =
          IndexRequest.of(
              i -> i.index(indexName).id(document.getId()).document(toElasticsearchDoc(document)));
      elasticsearchClient.index(request);
      meterRegistry.counter("memory.index.upserted").increment();
      log.debug("Indexed memory {}", document.getId());
    } catch (Exception e) {
      throw new ExternalServiceUnavailableException(
          ExternalServiceUnavailableException.INDEX,
          "Failed to index memory " + document.getId(),
          e);
    }
  }

  /**
   * Returns the user's non-superseded memories closest to the vector, most similar first.
   *
   * @param userId owning user
   * @param queryEmbedding query vector
   * @param topK maximum number of hits
   * @return hits with cosine similarity recovered from the Elasticsearch score
   * @throws ExternalServiceUnavailableException when the index cannot be queried
   */
  @Timed(value = "memory.index.query", description = "Time to query memory vectors")
  @CircuitBreaker(name = "elasticsearch")
  public List<SimilarityHit> query(String userId, List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest searchRequest =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .knn(
                          k ->
                              k.field("embedding")
                                  .queryVector(queryEmbedding)
                                  .k(topK)
                                  .numCandidates(Math.max(topK * 2, 100))
                                  .filter(f -> f.term(t -> t.field("userId").value(userId)))
                                  .filter(f -> f.term(t -> t.field("superseded").value(false))))
                      .size(topK)
                      .source(src -> src.fetch(false)));

      SearchResponse<Map> response = elasticsearchClient.search(searchRequest, Map.class);
      List<SimilarityHit> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        double score = hit.score() != null ? hit.score() : 0.0;
        results.add(new SimilarityHit(UUID.fromString(hit.id()), toCosineSimilarity(score)));
      }

      meterRegistry.counter("memory.index.queries").increment();
      return results;
    } catch (Exception e) {
      throw new ExternalServiceUnavailableException(
          ExternalServiceUnavailableException.INDEX, "Memory similarity query failed", e);
    }
  }

  /**
   * Flags a memory as superseded so kNN pre-filtering skips it.
   *
   * @param memoryId the superseded memory
   * @throws ExternalServiceUnavailableException when the update fails
   */
  @CircuitBreaker(name = "elasticsearch")
  public void markSuperseded(UUID memoryId) {
    try {
      Map<String, Object> partial = Map.of("superseded", true);
      UpdateRequest<Object, Map<String, Object>> request =
          UpdateRequest.of(u -> u.index(indexName).id(memoryId.toString()).doc(partial));
      elasticsearchClient.update(request, Object.class);
      log.debug("Marked memory {} superseded in index", memoryId);
    } catch (Exception e) {
      throw new ExternalServiceUnavailableException(
          ExternalServiceUnavailableException.INDEX,
          "Failed to mark memory " + memoryId + " superseded",
          e);
    }
  }

  /**
   * Removes one memory document.
   *
   * @param memoryId the memory to remove
   * @throws ExternalServiceUnavailableException when the delete fails
   */
  @CircuitBreaker(name = "elasticsearch")
  public void delete(UUID memoryId) {
    try {
      elasticsearchClient.delete(d -> d.index(indexName).id(memoryId.toString()));
      log.debug("Deleted memory {} from index", memoryId);
    } catch (Exception e) {
      throw new ExternalServiceUnavailableException(
          ExternalServiceUnavailableException.INDEX, "Failed to delete memory " + memoryId, e);
    }
  }

  /**
   * Deletes all memory documents of a user.
   *
   * @param userId the user
   */
  @Timed(value = "memory.index.delete_by_user", description = "Time to delete memories by user")
  public void deleteByUserId(String userId) {
    try {
      DeleteByQueryRequest deleteRequest =
          DeleteByQueryRequest.of(
              d -> d.index(indexName).query(q -> q.term(t -> t.field("userId").value(userId))));

      elasticsearchClient.deleteByQuery(deleteRequest);
      log.info("Deleted indexed memories for user: {}", userId);
    } catch (Exception e) {
      throw new ExternalServiceUnavailableException(
          ExternalServiceUnavailableException.INDEX,
          "Failed to delete indexed memories for user " + userId,
          e);
    }
  }

  /** Refreshes the index. */
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(indexName));
    } catch (Exception e) {
      log.warn("Failed to refresh memory index: {}", e.getMessage());
    }
  }

  public String getIndexName() {
    return indexName;
  }

  /** Elasticsearch reports cosine kNN scores as (1 + cos) / 2. */
  static double toCosineSimilarity(double score) {
    return 2.0 * score - 1.0;
  }

  private Map<String, Object> toElasticsearchDoc(MemoryDocument memory) {
    Map<String, Object> doc = new HashMap<>();
    doc.put("userId", memory.getUserId());
    doc.put("content", memory.getContent());
    doc.put("memoryType", memory.getMemoryType());
    doc.put("superseded", memory.isSuperseded());
    if (memory.getImportanceScore() != null) {
      doc.put("importanceScore", memory.getImportanceScore());
    }
    if (memory.getEmbedding() != null) {
      doc.put("embedding", memory.getEmbedding());
    }
    if (memory.getCreatedAt() != null) {
      doc.put("createdAt", memory.getCreatedAt());
    }
    return doc;
  }
}
