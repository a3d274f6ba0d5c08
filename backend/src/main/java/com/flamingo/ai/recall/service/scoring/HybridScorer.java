package com.flamingo.ai.recall.service.scoring;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.entity.Memory;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Composite score combining similarity, importance, recency, access frequency and confidence.
 *
 * <p>score = w1*similarity + w2*importance + w3*recency + w4*accessFrequency + w5*confidence
 */
@Component
@RequiredArgsConstructor
public class HybridScorer {

  private final MemoryConfig memoryConfig;
  private final TemporalDecayModel decayModel;

  public ScoredMemory score(Memory memory, double similarity, LocalDateTime now) {
    MemoryConfig.Retrieval weights = memoryConfig.getRetrieval();
    double recency = decayModel.recency(memory.getCreatedAt(), now);
    double score =
        weights.getSimilarityWeight() * similarity
            + weights.getImportanceWeight() * memory.getImportanceScore()
            + weights.getRecencyWeight() * recency
            + weights.getAccessFrequencyWeight() * accessFrequency(memory.getAccessCount())
            + weights.getConfidenceWeight() * memory.getConfidence();
    return new ScoredMemory(memory, score, similarity, recency);
  }

  /** Importance and recency only; used when similarity is unavailable. */
  public ScoredMemory fallbackScore(Memory memory, LocalDateTime now) {
    MemoryConfig.Retrieval weights = memoryConfig.getRetrieval();
    double recency = decayModel.recency(memory.getCreatedAt(), now);
    double score =
        weights.getImportanceWeight() * memory.getImportanceScore()
            + weights.getRecencyWeight() * recency;
    return new ScoredMemory(memory, score, 0.0, recency);
  }

  /** min(1, ln(1 + accessCount) / C) */
  public double accessFrequency(long accessCount) {
    double constant = memoryConfig.getRetrieval().getAccessFrequencyConstant();
    return Math.min(1.0, Math.log1p(Math.max(0L, accessCount)) / constant);
  }
}
