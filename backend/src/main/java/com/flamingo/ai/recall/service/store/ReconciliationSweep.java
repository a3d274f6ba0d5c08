package com.flamingo.ai.recall.service.store;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.enums.IndexStatus;
import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import com.flamingo.ai.recall.service.conflict.ConflictResolution;
import com.flamingo.ai.recall.service.conflict.ConflictResolver;
import com.flamingo.ai.recall.service.embedding.EmbeddingService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic repair of everything the write path leaves unfinished.
 *
 * <ol>
 *   <li>Retries index writes for CREATED, INDEX_PENDING and (less often) INDEX_FAILED rows.
 *   <li>Re-runs conflict classification for memories stored while classification was down.
 *   <li>Consolidates near-duplicates that concurrent turns inserted past the dedup filter.
 * </ol>
 *
 * <p>Runs never overlap.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationSweep {

  private final MemoryRepository memoryRepository;
  private final DualStoreCoordinator coordinator;
  private final ConflictResolver conflictResolver;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final AtomicBoolean running = new AtomicBoolean(false);

  @PostConstruct
  public void registerGauges() {
    Gauge.builder(
            "memory.index.failed",
            memoryRepository,
            repo -> repo.countByIndexStatus(IndexStatus.INDEX_FAILED))
        .description("Memories that exhausted their index attempts")
        .register(meterRegistry);
    Gauge.builder(
            "memory.index.pending",
            memoryRepository,
            repo -> repo.countByIndexStatus(IndexStatus.INDEX_PENDING))
        .description("Memories waiting for an index retry")
        .register(meterRegistry);
  }

  @Scheduled(
      initialDelayString = "${memory.reconciliation.interval:PT60S}",
      fixedDelayString = "${memory.reconciliation.interval:PT60S}")
  public void scheduledSweep() {
    if (!memoryConfig.getReconciliation().isEnabled()) {
      return;
    }
    try {
      sweep();
    } catch (Exception e) {
      log.error("Reconciliation sweep failed: {}", e.getMessage(), e);
      meterRegistry.counter("memory.reconciliation.errors").increment();
    }
  }

  /**
   * Runs one reconciliation pass.
   *
   * @return counts for the pass, empty when another pass is still running
   */
  public SweepReport sweep() {
    if (!running.compareAndSet(false, true)) {
      log.debug("Reconciliation sweep already running, skipping");
      return SweepReport.empty();
    }
    try {
      LocalDateTime now = LocalDateTime.now(clock);
      int[] index = retryIndexWrites(now);
      int[] conflicts = recheckDeferredConflicts();
      int consolidated = consolidate(now);

      SweepReport report =
          new SweepReport(index[0], index[1], conflicts[0], conflicts[1] + consolidated);
      if (report.indexed() + report.indexFailures() + report.superseded() > 0) {
        log.info(
            "Reconciliation: indexed={}, indexFailures={}, conflictsRechecked={}, superseded={}",
            report.indexed(),
            report.indexFailures(),
            report.conflictsRechecked(),
            report.superseded());
      }
      return report;
    } finally {
      running.set(false);
    }
  }

  private int[] retryIndexWrites(LocalDateTime now) {
    MemoryConfig.Index config = memoryConfig.getIndex();
    PageRequest batch = PageRequest.of(0, memoryConfig.getReconciliation().getBatchSize());
    // CREATED rows younger than one interval may still be in flight on a worker
    LocalDateTime createdCutoff = now.minus(memoryConfig.getReconciliation().getInterval());

    List<Memory> candidates = new ArrayList<>();
    for (Memory memory :
        memoryRepository.findByIndexStatusOrderByCreatedAtAsc(IndexStatus.CREATED, batch)) {
      if (memory.getCreatedAt() == null || memory.getCreatedAt().isBefore(createdCutoff)) {
        candidates.add(memory);
      }
    }
    candidates.addAll(
        memoryRepository.findByIndexStatusOrderByCreatedAtAsc(IndexStatus.INDEX_PENDING, batch));
    candidates.addAll(
        memoryRepository.findIndexRetryCandidates(
            IndexStatus.INDEX_FAILED, now.minus(config.getFailedRetryInterval()), batch));

    int indexed = 0;
    int failed = 0;
    for (Memory memory : candidates) {
      if (coordinator.indexMemory(memory) == IndexStatus.INDEXED) {
        indexed++;
      } else {
        failed++;
      }
    }
    return new int[] {indexed, failed};
  }

  private int[] recheckDeferredConflicts() {
    List<Memory> pending =
        memoryRepository.findPendingConflictChecks(
            PageRequest.of(0, memoryConfig.getReconciliation().getBatchSize()));
    int rechecked = 0;
    int superseded = 0;
    for (Memory loaded : pending) {
      // An earlier recheck in this batch may have retired it
      Optional<Memory> current =
          memoryRepository.findById(loaded.getId()).filter(Memory::isActive);
      if (current.isEmpty()) {
        continue;
      }
      Memory memory = current.get();
      ConflictResolution resolution =
          conflictResolver.resolve(
              memory.getUserId(), memory.getMemoryType(), memory.getContent(), memory.getId());
      if (resolution.deferred()) {
        continue;
      }
      for (UUID otherId : resolution.conflictingIds()) {
        Optional<Memory> other = memoryRepository.findById(otherId).filter(Memory::isActive);
        if (other.isEmpty()) {
          continue;
        }
        // Recency wins
        if (isOlder(other.get(), memory)) {
          if (coordinator.supersede(otherId, memory.getId())) {
            superseded++;
          }
        } else if (coordinator.supersede(memory.getId(), otherId)) {
          superseded++;
          break;
        }
      }
      memoryRepository.clearConflictCheckPending(memory.getId());
      rechecked++;
    }
    if (rechecked > 0) {
      meterRegistry.counter("memory.conflict.rechecked").increment(rechecked);
    }
    return new int[] {rechecked, superseded};
  }

  private int consolidate(LocalDateTime now) {
    List<Memory> recent =
        memoryRepository.findActiveCreatedSince(
            now.minus(memoryConfig.getReconciliation().getConsolidationWindow()));
    Map<String, List<Memory>> byUser = new LinkedHashMap<>();
    for (Memory memory : recent) {
      if (memory.hasEmbedding()) {
        byUser.computeIfAbsent(memory.getUserId(), u -> new ArrayList<>()).add(memory);
      }
    }

    double threshold = memoryConfig.getDedup().getDuplicateThreshold();
    int consolidated = 0;
    for (List<Memory> memories : byUser.values()) {
      Set<UUID> retired = new HashSet<>();
      for (int i = 0; i < memories.size(); i++) {
        Memory a = memories.get(i);
        for (int j = i + 1; j < memories.size() && !retired.contains(a.getId()); j++) {
          Memory b = memories.get(j);
          if (retired.contains(b.getId())) {
            continue;
          }
          double similarity = EmbeddingService.cosineSimilarity(a.getEmbedding(), b.getEmbedding());
          if (similarity < threshold) {
            continue;
          }
          Memory loser = consolidationLoser(a, b);
          Memory winner = loser == a ? b : a;
          if (coordinator.supersede(loser.getId(), winner.getId())) {
            retired.add(loser.getId());
            consolidated++;
            log.debug(
                "Consolidated memory {} into {} (similarity {})",
                loser.getId(),
                winner.getId(),
                similarity);
          }
        }
      }
    }
    if (consolidated > 0) {
      meterRegistry.counter("memory.dedup.consolidated").increment(consolidated);
    }
    return consolidated;
  }

  /** Fewer accesses loses; on a tie the newer memory loses. */
  static Memory consolidationLoser(Memory a, Memory b) {
    if (a.getAccessCount() != b.getAccessCount()) {
      return a.getAccessCount() < b.getAccessCount() ? a : b;
    }
    return isOlder(a, b) ? b : a;
  }

  private static boolean isOlder(Memory candidate, Memory reference) {
    if (candidate.getCreatedAt() == null || reference.getCreatedAt() == null) {
      return false;
    }
    return !candidate.getCreatedAt().isAfter(reference.getCreatedAt());
  }
}
