package com.flamingo.ai.recall.service.memory;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.enums.IndexStatus;
import com.flamingo.ai.recall.domain.enums.MemoryType;
import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import com.flamingo.ai.recall.exception.MemoryNotFoundException;
import com.flamingo.ai.recall.service.extraction.TurnContext;
import com.flamingo.ai.recall.service.pipeline.MemoryWriteQueue;
import com.flamingo.ai.recall.service.retrieval.MemoryRetrievalService;
import com.flamingo.ai.recall.service.retrieval.RetrievalHint;
import com.flamingo.ai.recall.service.scoring.ScoredMemory;
import com.flamingo.ai.recall.service.scoring.TemporalDecayModel;
import com.flamingo.ai.recall.service.store.DualStoreCoordinator;
import com.flamingo.ai.recall.service.store.MemoryProfileCache;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of MemoryService wiring the write queue, retrieval and the stores. */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryServiceImpl implements MemoryService {

  private final MemoryWriteQueue writeQueue;
  private final MemoryRetrievalService retrievalService;
  private final MemoryRepository memoryRepository;
  private final MemoryProfileCache profileCache;
  private final DualStoreCoordinator coordinator;
  private final TemporalDecayModel decayModel;
  private final MemoryConfig memoryConfig;
  private final Clock clock;

  @Override
  public void ingestTurn(
      String userId,
      String conversationId,
      int turnNumber,
      String userMessage,
      String assistantMessage) {
    requireText(userId, "userId");
    requireText(conversationId, "conversationId");
    requireText(userMessage, "userMessage");
    if (turnNumber < 1) {
      throw new IllegalArgumentException("turnNumber must be positive: " + turnNumber);
    }

    writeQueue.submit(
        new TurnContext(userId, conversationId, turnNumber, userMessage, assistantMessage));
  }

  @Override
  public List<ScoredMemory> retrieve(String userId, String queryText, RetrievalHint hint) {
    if (userId == null || userId.isBlank()) {
      return List.of();
    }
    return retrievalService.retrieve(userId, queryText, hint);
  }

  @Override
  @Transactional(readOnly = true)
  public Memory getMemory(UUID memoryId) {
    return memoryRepository
        .findById(memoryId)
        .orElseThrow(() -> new MemoryNotFoundException(memoryId));
  }

  @Override
  public List<Memory> getProfile(String userId) {
    return profileCache.getProfile(userId);
  }

  @Override
  public String buildMemoryContext(List<ScoredMemory> memories) {
    if (memories == null || memories.isEmpty()) {
      return "";
    }

    StringBuilder context = new StringBuilder();
    context.append("What you remember about the user:\n");

    for (ScoredMemory scored : memories) {
      Memory memory = scored.memory();
      context.append(
          String.format(
              Locale.ROOT,
              "- [%s] %s%n",
              memory.getMemoryType().name(),
              memory.getContent()));
    }

    context.append("\nUse these memories when they are relevant; do not recite them unprompted.");

    return context.toString();
  }

  @Override
  @Transactional(readOnly = true)
  public MemoryStats getUserStats(String userId) {
    List<Memory> memories = memoryRepository.findByUserId(userId);
    LocalDateTime now = LocalDateTime.now(clock);
    int hotThreshold = memoryConfig.getStats().getHotAccessThreshold();

    Map<MemoryType, Long> byType = new EnumMap<>(MemoryType.class);
    Map<IndexStatus, Long> byStatus = new EnumMap<>(IndexStatus.class);
    long active = 0;
    long totalAccesses = 0;
    long hot = 0;
    long pending = 0;
    double confidenceSum = 0.0;
    double recencySum = 0.0;

    for (Memory memory : memories) {
      byStatus.merge(memory.getIndexStatus(), 1L, Long::sum);
      totalAccesses += memory.getAccessCount();
      if (!memory.isActive()) {
        continue;
      }
      active++;
      byType.merge(memory.getMemoryType(), 1L, Long::sum);
      confidenceSum += memory.getConfidence();
      recencySum += decayModel.recency(memory.getCreatedAt(), now);
      if (memory.getAccessCount() >= hotThreshold) {
        hot++;
      }
      if (memory.isConflictCheckPending()) {
        pending++;
      }
    }

    return MemoryStats.builder()
        .userId(userId)
        .totalMemories(memories.size())
        .activeMemories(active)
        .supersededMemories(memories.size() - active)
        .activeByType(byType)
        .byIndexStatus(byStatus)
        .averageConfidence(active == 0 ? 0.0 : confidenceSum / active)
        .totalAccesses(totalAccesses)
        .hotMemories(hot)
        .averageRecency(active == 0 ? 0.0 : recencySum / active)
        .pendingConflictChecks(pending)
        .build();
  }

  @Override
  public long purgeUser(String userId) {
    requireText(userId, "userId");
    return coordinator.purgeUser(userId);
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}
