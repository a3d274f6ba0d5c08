package com.flamingo.ai.recall.service.memory;

import com.flamingo.ai.recall.domain.enums.IndexStatus;
import com.flamingo.ai.recall.domain.enums.MemoryType;
import java.util.Map;
import lombok.Builder;

/** Per-user reporting snapshot of the memory store. */
@Builder
public record MemoryStats(
    String userId,
    long totalMemories,
    long activeMemories,
    long supersededMemories,
    Map<MemoryType, Long> activeByType,
    Map<IndexStatus, Long> byIndexStatus,
    double averageConfidence,
    long totalAccesses,
    long hotMemories,
    double averageRecency,
    long pendingConflictChecks) {}
