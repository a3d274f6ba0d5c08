package com.flamingo.ai.recall.service.store;

import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/** Records retrieval hits off the request thread. */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessTracker {

  private final MemoryRepository memoryRepository;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /** Increments accessCount and sets lastAccessed for every returned memory. */
  @Async("accessTrackingExecutor")
  public void recordAccess(Collection<UUID> memoryIds) {
    if (memoryIds.isEmpty()) {
      return;
    }
    try {
      int updated = memoryRepository.recordAccess(memoryIds, LocalDateTime.now(clock));
      meterRegistry.counter("memory.access.recorded").increment(updated);
    } catch (Exception e) {
      log.warn("Failed to record access for {} memories: {}", memoryIds.size(), e.getMessage());
      meterRegistry.counter("memory.access.errors").increment();
    }
  }
}
