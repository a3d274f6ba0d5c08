package com.flamingo.ai.recall.service.dedup;

import java.util.UUID;

/**
 * Outcome of the duplicate check for one candidate.
 *
 * @param duplicate whether the candidate should be dropped
 * @param matchedMemoryId existing memory the candidate duplicates, null when unique
 * @param similarity similarity to the matched memory (1.0 for an exact content match)
 */
public record DedupDecision(boolean duplicate, UUID matchedMemoryId, double similarity) {

  public static DedupDecision unique() {
    return new DedupDecision(false, null, 0.0);
  }

  public static DedupDecision duplicateOf(UUID memoryId, double similarity) {
    return new DedupDecision(true, memoryId, similarity);
  }
}
