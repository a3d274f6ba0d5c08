package com.flamingo.ai.recall.service.pipeline;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.entity.ConversationTurn;
import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.repository.ConversationTurnRepository;
import com.flamingo.ai.recall.service.conflict.ConflictResolution;
import com.flamingo.ai.recall.service.conflict.ConflictResolver;
import com.flamingo.ai.recall.service.dedup.DedupDecision;
import com.flamingo.ai.recall.service.dedup.DeduplicationFilter;
import com.flamingo.ai.recall.service.embedding.EmbeddingService;
import com.flamingo.ai.recall.service.extraction.CandidateMemory;
import com.flamingo.ai.recall.service.extraction.MemoryExtractionService;
import com.flamingo.ai.recall.service.extraction.TurnContext;
import com.flamingo.ai.recall.service.store.DualStoreCoordinator;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/** Write path for one turn: record the turn, extract, dedup, resolve conflicts, store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryWritePipeline {

  private final ConversationTurnRepository conversationTurnRepository;
  private final MemoryExtractionService extractionService;
  private final EmbeddingService embeddingService;
  private final DeduplicationFilter deduplicationFilter;
  private final ConflictResolver conflictResolver;
  private final DualStoreCoordinator coordinator;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public PipelineResult process(TurnContext turn) {
    if (!recordTurn(turn)) {
      log.debug(
          "Turn {} of conversation {} already processed, skipping",
          turn.turnNumber(),
          turn.conversationId());
      meterRegistry.counter("memory.write.skipped").increment();
      return PipelineResult.alreadyProcessed();
    }

    if (!memoryConfig.getExtraction().isEnabled()) {
      return new PipelineResult(false, 0, 0, 0, 0, 0, 0);
    }

    List<ConversationTurn> priorTurns =
        conversationTurnRepository.findPriorTurns(
            turn.conversationId(),
            turn.turnNumber(),
            PageRequest.of(0, memoryConfig.getExtraction().getContextWindow()));
    List<CandidateMemory> candidates = extractionService.extract(turn, priorTurns);

    int stored = 0;
    int duplicates = 0;
    int superseded = 0;
    int deferred = 0;
    int failed = 0;
    for (CandidateMemory candidate : candidates) {
      try {
        List<Float> embedding = embeddingService.embedMemory(candidate.content());

        DedupDecision decision = deduplicationFilter.check(turn.userId(), candidate, embedding);
        if (decision.duplicate()) {
          duplicates++;
          continue;
        }

        ConflictResolution resolution =
            conflictResolver.resolve(turn.userId(), candidate.type(), candidate.content(), null);
        Optional<Memory> saved = coordinator.store(turn, candidate, embedding, resolution);
        if (saved.isEmpty()) {
          duplicates++;
          continue;
        }
        stored++;
        superseded += resolution.conflictingIds().size();
        if (resolution.deferred()) {
          deferred++;
        }
      } catch (Exception e) {
        failed++;
        log.error(
            "Failed to write memory for user {} from turn {}: {}",
            turn.userId(),
            turn.turnNumber(),
            e.getMessage(),
            e);
        meterRegistry.counter("memory.write.candidate_errors").increment();
      }
    }

    PipelineResult result =
        new PipelineResult(
            false, candidates.size(), stored, duplicates, superseded, deferred, failed);
    if (!candidates.isEmpty()) {
      log.info(
          "Turn {} of conversation {}: {} candidates, {} stored, {} duplicates, {} superseded",
          turn.turnNumber(),
          turn.conversationId(),
          result.candidates(),
          result.stored(),
          result.duplicates(),
          result.superseded());
    }
    return result;
  }

  /** Persists the turn; false when it is already recorded. */
  private boolean recordTurn(TurnContext turn) {
    if (conversationTurnRepository.existsByConversationIdAndTurnNumber(
        turn.conversationId(), turn.turnNumber())) {
      return false;
    }
    try {
      conversationTurnRepository.saveAndFlush(
          ConversationTurn.builder()
              .userId(turn.userId())
              .conversationId(turn.conversationId())
              .turnNumber(turn.turnNumber())
              .userMessage(turn.userMessage())
              .assistantMessage(turn.assistantMessage())
              .createdAt(LocalDateTime.now(clock))
              .build());
      return true;
    } catch (DataIntegrityViolationException e) {
      // Concurrent submission of the same turn
      return false;
    }
  }
}
