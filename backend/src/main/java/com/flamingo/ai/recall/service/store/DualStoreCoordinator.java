package com.flamingo.ai.recall.service.store;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.enums.IndexStatus;
import com.flamingo.ai.recall.domain.repository.ConversationTurnRepository;
import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import com.flamingo.ai.recall.elasticsearch.MemoryDocument;
import com.flamingo.ai.recall.elasticsearch.MemoryIndexService;
import com.flamingo.ai.recall.service.conflict.ConflictResolution;
import com.flamingo.ai.recall.service.embedding.EmbeddingService;
import com.flamingo.ai.recall.service.extraction.CandidateMemory;
import com.flamingo.ai.recall.service.extraction.TurnContext;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Keeps the durable store, the similarity index and the profile cache consistent.
 *
 * <p>Write order is durable commit, cache eviction, then index upsert. The durable store is the
 * source of truth; index drift is recorded in {@link Memory#getIndexStatus()} and repaired by the
 * reconciliation sweep.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DualStoreCoordinator {

  private final MemoryRepository memoryRepository;
  private final ConversationTurnRepository conversationTurnRepository;
  private final MemoryIndexService memoryIndexService;
  private final EmbeddingService embeddingService;
  private final MemoryProfileCache profileCache;
  private final TransactionTemplate transactionTemplate;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Persists a candidate together with the supersession of the memories it contradicts.
   *
   * @return the stored memory, or empty when an identical active memory won a concurrent insert
   */
  @Timed(value = "memory.store", description = "Time to store a memory in both stores")
  public Optional<Memory> store(
      TurnContext turn,
      CandidateMemory candidate,
      List<Float> embedding,
      ConflictResolution resolution) {
    LocalDateTime now = LocalDateTime.now(clock);
    List<UUID> superseded = new ArrayList<>();

    Memory saved;
    try {
      saved =
          transactionTemplate.execute(
              status -> {
                Memory memory =
                    memoryRepository.saveAndFlush(toMemory(turn, candidate, embedding, resolution));
                for (UUID olderId : resolution.conflictingIds()) {
                  supersedeInTransaction(olderId, memory, now).ifPresent(superseded::add);
                }
                return memory;
              });
    } catch (DataIntegrityViolationException e) {
      log.debug(
          "Identical active memory already stored for user {}, dropping insert", turn.userId());
      meterRegistry.counter("memory.write.duplicate_dropped").increment();
      return Optional.empty();
    }

    profileCache.evict(turn.userId());
    meterRegistry.counter("memory.write.stored").increment();

    for (UUID olderId : superseded) {
      markSupersededInIndex(olderId);
    }
    indexMemory(saved);
    return Optional.of(saved);
  }

  /**
   * Supersedes one active memory by another of the same user.
   *
   * @return true when the older memory was active and is now superseded
   */
  public boolean supersede(UUID olderId, UUID newerId) {
    LocalDateTime now = LocalDateTime.now(clock);
    Optional<String> userId =
        transactionTemplate.execute(
            status ->
                memoryRepository
                    .findById(newerId)
                    .flatMap(
                        newer ->
                            supersedeInTransaction(olderId, newer, now)
                                .map(id -> newer.getUserId())));
    if (userId == null || userId.isEmpty()) {
      return false;
    }
    profileCache.evict(userId.get());
    markSupersededInIndex(olderId);
    return true;
  }

  /**
   * Upserts a memory into the similarity index and records the outcome. A missing embedding is
   * computed first; without one the attempt counts as failed.
   *
   * @return the resulting index status
   */
  public IndexStatus indexMemory(Memory memory) {
    LocalDateTime now = LocalDateTime.now(clock);
    int attempts = memory.getIndexAttempts() + 1;
    IndexStatus status;
    try {
      if (!memory.hasEmbedding()) {
        List<Float> embedding = embeddingService.embedMemory(memory.getContent());
        if (embedding.isEmpty()) {
          throw new IllegalStateException("embedding provider unavailable");
        }
        memoryRepository.updateEmbedding(memory.getId(), embedding);
        memory.setEmbedding(embedding);
      }
      memoryIndexService.upsert(MemoryDocument.fromMemory(memory));
      status = IndexStatus.INDEXED;
      meterRegistry.counter("memory.index.success").increment();
    } catch (RuntimeException e) {
      status =
          attempts >= memoryConfig.getIndex().getMaxAttempts()
              ? IndexStatus.INDEX_FAILED
              : IndexStatus.INDEX_PENDING;
      meterRegistry.counter("memory.index.failures").increment();
      if (status == IndexStatus.INDEX_FAILED) {
        log.warn(
            "Memory {} could not be indexed after {} attempts, marking INDEX_FAILED: {}",
            memory.getId(),
            attempts,
            e.getMessage());
      } else {
        log.warn(
            "Indexing memory {} failed (attempt {}), will retry: {}",
            memory.getId(),
            attempts,
            e.getMessage());
      }
    }

    memoryRepository.updateIndexStatus(memory.getId(), status, attempts, now);
    memory.setIndexStatus(status);
    memory.setIndexAttempts(attempts);
    memory.setLastIndexAttemptAt(now);
    return status;
  }

  /**
   * Deletes every memory, turn, index entry and cache entry of a user.
   *
   * @return number of memories deleted from the durable store
   */
  public long purgeUser(String userId) {
    try {
      memoryIndexService.deleteByUserId(userId);
    } catch (RuntimeException e) {
      // Orphaned index entries are dropped at hydration time.
      log.warn("Failed to purge index entries for user {}: {}", userId, e.getMessage());
    }
    long deleted =
        transactionTemplate.execute(
            status -> {
              long memories = memoryRepository.deleteByUserId(userId);
              conversationTurnRepository.deleteByUserId(userId);
              return memories;
            });
    profileCache.evict(userId);
    log.info("Purged {} memories for user {}", deleted, userId);
    return deleted;
  }

  private Optional<UUID> supersedeInTransaction(UUID olderId, Memory newer, LocalDateTime now) {
    return memoryRepository
        .findById(olderId)
        .filter(Memory::isActive)
        .filter(older -> older.getUserId().equals(newer.getUserId()))
        .filter(older -> !older.getId().equals(newer.getId()))
        .map(
            older -> {
              older.supersede(newer.getId(), now);
              memoryRepository.save(older);
              meterRegistry.counter("memory.conflict.superseded").increment();
              log.debug("Memory {} superseded by {}", older.getId(), newer.getId());
              return older.getId();
            });
  }

  private void markSupersededInIndex(UUID memoryId) {
    try {
      memoryIndexService.markSuperseded(memoryId);
    } catch (RuntimeException e) {
      // Retrieval re-checks supersession against the durable store.
      log.warn("Failed to mark memory {} superseded in index: {}", memoryId, e.getMessage());
    }
  }

  private Memory toMemory(
      TurnContext turn,
      CandidateMemory candidate,
      List<Float> embedding,
      ConflictResolution resolution) {
    LocalDateTime now = LocalDateTime.now(clock);
    return Memory.builder()
        .userId(turn.userId())
        .memoryType(candidate.type())
        .content(candidate.content())
        .embedding(embedding == null || embedding.isEmpty() ? null : embedding)
        .confidence(candidate.confidence())
        .importanceLevel(candidate.importanceLevel())
        .importanceScore(candidate.importanceLevel().getScore())
        .tags(new LinkedHashSet<>(candidate.tags()))
        .entities(new LinkedHashSet<>(candidate.entities()))
        .contentHash(candidate.contentHash())
        .activeContentHash(candidate.contentHash())
        .conversationId(turn.conversationId())
        .sourceTurn(turn.turnNumber())
        .createdAt(now)
        .lastAccessed(now)
        .conflictCheckPending(resolution.deferred())
        .build();
  }
}
