package com.flamingo.ai.recall.service.scoring;

import com.flamingo.ai.recall.domain.entity.Memory;
import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * A memory with its composite retrieval score.
 *
 * @param memory the memory
 * @param score composite score
 * @param similarity cosine similarity to the query, 0 when no similarity was computed
 * @param recency recency weight at query time
 */
public record ScoredMemory(Memory memory, double score, double similarity, double recency) {

  /** Highest score first, then newest, then by id for a stable order. */
  public static final Comparator<ScoredMemory> RANKING =
      Comparator.comparingDouble(ScoredMemory::score)
          .reversed()
          .thenComparing(
              (ScoredMemory s) -> s.memory().getCreatedAt(),
              Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
          .thenComparing(s -> s.memory().getId().toString());
}
