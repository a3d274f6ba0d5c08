package com.flamingo.ai.recall.service.extraction;

import com.flamingo.ai.recall.agent.MemoryExtractionAgent;
import com.flamingo.ai.recall.agent.dto.ExtractedMemory;
import com.flamingo.ai.recall.domain.entity.ConversationTurn;
import com.flamingo.ai.recall.exception.ExtractionParseException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts candidate memories from one dialogue turn with a single LLM call.
 *
 * <p>The call is never retried: a failed or malformed response yields no candidates for the turn.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryExtractionService {

  private final MemoryExtractionAgent agent;
  private final CandidateValidator validator;
  private final MeterRegistry meterRegistry;

  /**
   * Extracts validated candidates from a turn.
   *
   * @param turn the completed turn
   * @param priorTurns earlier turns of the same conversation, newest first
   * @return validated candidates, possibly empty, never null
   */
  @Timed(value = "memory.extraction", description = "Time to extract memories from a turn")
  public List<CandidateMemory> extract(TurnContext turn, List<ConversationTurn> priorTurns) {
    meterRegistry.counter("memory.extraction.count").increment();

    List<ExtractedMemory> extracted;
    try {
      extracted =
          agent.extract(
              formatPriorTurns(priorTurns),
              turn.turnNumber(),
              turn.userMessage(),
              turn.assistantMessage() == null ? "" : turn.assistantMessage());
    } catch (Exception e) {
      log.warn(
          "Memory extraction failed for conversation {} turn {}: {}",
          turn.conversationId(),
          turn.turnNumber(),
          e.getMessage());
      meterRegistry.counter("memory.extraction.errors").increment();
      return List.of();
    }

    if (extracted == null || extracted.isEmpty()) {
      log.debug(
          "No memories extracted for conversation {} turn {}",
          turn.conversationId(),
          turn.turnNumber());
      return List.of();
    }

    List<CandidateMemory> candidates = new ArrayList<>();
    Set<String> seenHashes = new HashSet<>();
    for (ExtractedMemory raw : extracted) {
      try {
        CandidateMemory candidate = validator.validate(raw);
        if (seenHashes.add(candidate.contentHash())) {
          candidates.add(candidate);
        }
      } catch (ExtractionParseException e) {
        log.debug("Dropping extracted memory, invalid {}: {}", e.getField(), e.getMessage());
        meterRegistry.counter("memory.extraction.parse_errors").increment();
      }
    }

    meterRegistry.counter("memory.extraction.candidates").increment(candidates.size());
    return candidates;
  }

  private String formatPriorTurns(List<ConversationTurn> priorTurns) {
    if (priorTurns == null || priorTurns.isEmpty()) {
      return "(none)";
    }
    StringBuilder sb = new StringBuilder();
    // Oldest first reads naturally in the prompt
    for (int i = priorTurns.size() - 1; i >= 0; i--) {
      ConversationTurn prior = priorTurns.get(i);
      sb.append("Turn #").append(prior.getTurnNumber()).append('\n');
      sb.append("User: ").append(prior.getUserMessage()).append('\n');
      if (prior.getAssistantMessage() != null) {
        sb.append("Assistant: ").append(prior.getAssistantMessage()).append('\n');
      }
    }
    return sb.toString().trim();
  }
}
