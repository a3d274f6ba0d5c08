package com.flamingo.ai.recall.service.retrieval;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.enums.QueryIntent;
import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import com.flamingo.ai.recall.elasticsearch.MemoryIndexService;
import com.flamingo.ai.recall.elasticsearch.SimilarityHit;
import com.flamingo.ai.recall.service.embedding.EmbeddingService;
import com.flamingo.ai.recall.service.scoring.HybridScorer;
import com.flamingo.ai.recall.service.scoring.ScoredMemory;
import com.flamingo.ai.recall.service.store.AccessTracker;
import com.flamingo.ai.recall.service.store.MemoryProfileCache;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval: intent routing, similarity search, composite scoring, top-K and token budget.
 *
 * <p>Never throws. Without the index or a query embedding it ranks recent memories by importance
 * and recency; without the durable store it returns an empty list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryRetrievalService {

  private final QueryIntentClassifier intentClassifier;
  private final EmbeddingService embeddingService;
  private final MemoryIndexService memoryIndexService;
  private final MemoryRepository memoryRepository;
  private final MemoryProfileCache profileCache;
  private final HybridScorer scorer;
  private final AccessTracker accessTracker;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Selects the user's memories relevant to a query.
   *
   * @param userId owning user
   * @param query query text
   * @param hint optional turn context, may be null
   * @return ranked memories within top-K and the token budget
   */
  @Timed(value = "memory.retrieval", description = "Time to retrieve memories")
  public List<ScoredMemory> retrieve(String userId, String query, RetrievalHint hint) {
    QueryIntent intent = intentClassifier.classify(query, hint);
    meterRegistry.counter("memory.retrieval.requests", "intent", intent.name()).increment();

    List<ScoredMemory> results;
    try {
      results =
          switch (intent) {
            case GREETING -> profile(userId);
            case BROAD -> List.of();
            case SPECIFIC -> specific(userId, query);
          };
    } catch (Exception e) {
      log.warn("Memory retrieval failed for user {}, returning none: {}", userId, e.getMessage());
      meterRegistry.counter("memory.retrieval.errors").increment();
      return List.of();
    }

    if (!results.isEmpty()) {
      List<UUID> ids = results.stream().map(s -> s.memory().getId()).toList();
      try {
        accessTracker.recordAccess(ids);
      } catch (Exception e) {
        log.warn("Could not schedule access tracking: {}", e.getMessage());
      }
    }
    log.debug("Retrieved {} memories for user {} (intent {})", results.size(), userId, intent);
    return results;
  }

  private List<ScoredMemory> profile(String userId) {
    LocalDateTime now = LocalDateTime.now(clock);
    List<ScoredMemory> results = new ArrayList<>();
    for (Memory memory : profileCache.getProfile(userId)) {
      results.add(scorer.fallbackScore(memory, now));
    }
    return results;
  }

  private List<ScoredMemory> specific(String userId, String query) {
    int poolSize = memoryConfig.getRetrieval().getCandidatePoolSize();

    List<Float> queryEmbedding;
    try {
      queryEmbedding = embeddingService.embedQuery(query);
    } catch (Exception e) {
      log.warn("Query embedding failed: {}", e.getMessage());
      queryEmbedding = List.of();
    }
    if (queryEmbedding.isEmpty()) {
      return fallback(userId);
    }

    List<SimilarityHit> hits;
    try {
      hits = memoryIndexService.query(userId, queryEmbedding, poolSize);
    } catch (Exception e) {
      log.warn("Memory index unavailable, using importance/recency ranking: {}", e.getMessage());
      return fallback(userId);
    }
    if (hits.isEmpty()) {
      return List.of();
    }

    Map<UUID, Double> similarityById = new HashMap<>();
    for (SimilarityHit hit : hits) {
      similarityById.merge(hit.memoryId(), hit.similarity(), Math::max);
    }

    LocalDateTime now = LocalDateTime.now(clock);
    List<ScoredMemory> scored = new ArrayList<>();
    for (Memory memory : memoryRepository.findAllById(similarityById.keySet())) {
      // The index may lag behind supersession or a purge
      if (!memory.isActive() || !userId.equals(memory.getUserId())) {
        continue;
      }
      scored.add(scorer.score(memory, similarityById.get(memory.getId()), now));
    }
    return select(scored);
  }

  private List<ScoredMemory> fallback(String userId) {
    meterRegistry.counter("memory.retrieval.fallback").increment();
    LocalDateTime now = LocalDateTime.now(clock);
    List<ScoredMemory> scored = new ArrayList<>();
    for (Memory memory :
        memoryRepository.findRecentActive(
            userId, PageRequest.of(0, memoryConfig.getRetrieval().getCandidatePoolSize()))) {
      scored.add(scorer.fallbackScore(memory, now));
    }
    return select(scored);
  }

  /** Ranks, keeps the top K, then drops the lowest scored entries until the budget fits. */
  @VisibleForTesting
  List<ScoredMemory> select(List<ScoredMemory> scored) {
    List<ScoredMemory> ranked = new ArrayList<>(scored);
    ranked.sort(ScoredMemory.RANKING);

    int topK = memoryConfig.getRetrieval().getTopK();
    if (ranked.size() > topK) {
      ranked = new ArrayList<>(ranked.subList(0, topK));
    }

    int budget = memoryConfig.getRetrieval().getTokenBudget();
    int tokens = ranked.stream().mapToInt(s -> TokenEstimator.estimate(s.memory())).sum();
    while (!ranked.isEmpty() && tokens > budget) {
      ScoredMemory dropped = ranked.remove(ranked.size() - 1);
      tokens -= TokenEstimator.estimate(dropped.memory());
    }
    return ranked;
  }
}
