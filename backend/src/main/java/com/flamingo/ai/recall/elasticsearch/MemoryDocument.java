package com.flamingo.ai.recall.elasticsearch;

import com.flamingo.ai.recall.domain.entity.Memory;
import java.time.ZoneId;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Elasticsearch document model for memories.
 *
 * <p>Carries only what the similarity query needs: the vector, the owning user and the supersession
 * flag used as a kNN pre-filter. The durable store remains the source of truth for everything else.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryDocument {

  /** Matches Memory.id */
  private String id;

  private String userId;

  private String content;

  private String memoryType;

  private Float importanceScore;

  /** Creation time as epoch millis */
  private Long createdAt;

  private boolean superseded;

  private List<Float> embedding;

  public static MemoryDocument fromMemory(Memory memory) {
    return MemoryDocument.builder()
        .id(memory.getId().toString())
        .userId(memory.getUserId())
        .content(memory.getContent())
        .memoryType(memory.getMemoryType().name())
        .importanceScore((float) memory.getImportanceScore())
        .createdAt(
            memory.getCreatedAt() != null
                ? memory.getCreatedAt().atZone(ZoneId.systemDefault()).toInstant().toEpochMilli()
                : null)
        .superseded(!memory.isActive())
        .embedding(memory.getEmbedding())
        .build();
  }
}
