package com.flamingo.ai.recall.service.dedup;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import com.flamingo.ai.recall.service.embedding.EmbeddingService;
import com.flamingo.ai.recall.service.extraction.CandidateMemory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Drops candidates that repeat an existing active memory of the same user.
 *
 * <p>A duplicate reinforces the memory it matched: its access count goes up by one and its
 * last-access time moves to now.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeduplicationFilter {

  private final MemoryRepository memoryRepository;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Checks a candidate against the user's recent active memories.
   *
   * @param userId owning user
   * @param candidate the validated candidate
   * @param embedding candidate embedding, empty when the provider was unavailable
   * @return the decision; a duplicate has already been reinforced
   */
  public DedupDecision check(String userId, CandidateMemory candidate, List<Float> embedding) {
    Optional<Memory> exact =
        memoryRepository.findByUserIdAndActiveContentHash(userId, candidate.contentHash());
    if (exact.isPresent()) {
      return reinforce(exact.get(), 1.0);
    }

    if (embedding == null || embedding.isEmpty()) {
      log.debug("No embedding for candidate, skipping similarity check");
      return DedupDecision.unique();
    }

    Memory best = null;
    double bestSimilarity = Double.NEGATIVE_INFINITY;
    for (Memory neighbor : loadNeighbors(userId, candidate)) {
      if (!neighbor.hasEmbedding()) {
        continue;
      }
      double similarity = EmbeddingService.cosineSimilarity(embedding, neighbor.getEmbedding());
      if (similarity > bestSimilarity
          || (similarity == bestSimilarity && neighbor.getAccessCount() > best.getAccessCount())) {
        best = neighbor;
        bestSimilarity = similarity;
      }
    }

    if (best != null && bestSimilarity >= memoryConfig.getDedup().getDuplicateThreshold()) {
      return reinforce(best, bestSimilarity);
    }
    return DedupDecision.unique();
  }

  private List<Memory> loadNeighbors(String userId, CandidateMemory candidate) {
    PageRequest window = PageRequest.of(0, memoryConfig.getDedup().getNeighborWindow());
    if (memoryConfig.getDedup().isSameTypeOnly()) {
      return memoryRepository.findRecentActiveByType(userId, candidate.type(), window);
    }
    return memoryRepository.findRecentActive(userId, window);
  }

  private DedupDecision reinforce(Memory match, double similarity) {
    memoryRepository.recordAccess(List.of(match.getId()), LocalDateTime.now(clock));
    meterRegistry.counter("memory.dedup.duplicates").increment();
    log.debug("Candidate duplicates memory {} (similarity {})", match.getId(), similarity);
    return DedupDecision.duplicateOf(match.getId(), similarity);
  }
}
