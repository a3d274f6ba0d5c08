package com.flamingo.ai.recall.service.extraction;

import com.flamingo.ai.recall.domain.enums.ImportanceLevel;
import com.flamingo.ai.recall.domain.enums.MemoryType;
import java.util.Set;

/**
 * A validated, not yet persisted memory produced by extraction.
 *
 * @param type memory type, the discriminator of the candidate
 * @param content trimmed content, 1 to 5000 chars
 * @param confidence extraction confidence in [0,1]
 * @param importanceLevel importance level
 * @param tags normalized tags
 * @param entities normalized entity names
 * @param contentHash SHA-256 of the normalized content
 */
public record CandidateMemory(
    MemoryType type,
    String content,
    double confidence,
    ImportanceLevel importanceLevel,
    Set<String> tags,
    Set<String> entities,
    String contentHash) {

  public CandidateMemory {
    tags = Set.copyOf(tags);
    entities = Set.copyOf(entities);
  }
}
