package com.flamingo.ai.recall.service.conflict;

import com.flamingo.ai.recall.agent.ConflictClassificationAgent;
import com.flamingo.ai.recall.agent.dto.ConflictClassification;
import com.flamingo.ai.recall.agent.dto.ConflictVerdict;
import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.enums.ConflictCategory;
import com.flamingo.ai.recall.domain.enums.MemoryType;
import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Detects contradictions between a statement and the user's active memories in the categories the
 * statement bears (job, location, relationship, age, preference).
 *
 * <p>All categories are classified in one LLM request. Failure of that request is reported as a
 * deferred resolution, never as an exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConflictResolver {

  private final ConflictClassificationAgent agent;
  private final MemoryRepository memoryRepository;
  private final MemoryConfig memoryConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Classifies a new statement against the user's active memories.
   *
   * @param userId owning user
   * @param type memory type of the statement
   * @param content statement content
   * @param excludeId memory to leave out of the comparison (the statement itself when it is
   *     already stored), may be null
   * @return ids of contradicted memories, or a deferred resolution when classification failed
   */
  @Timed(value = "memory.conflict.resolve", description = "Time to classify conflicts")
  public ConflictResolution resolve(String userId, MemoryType type, String content, UUID excludeId) {
    if (!memoryConfig.getConflict().isEnabled()) {
      return ConflictResolution.none();
    }

    Set<ConflictCategory> categories = ConflictCategory.detect(content, type);
    if (categories.isEmpty()) {
      return ConflictResolution.none();
    }

    Map<ConflictCategory, List<Memory>> existing =
        groupByCategory(userId, categories, content, excludeId);
    if (existing.isEmpty()) {
      return ConflictResolution.none();
    }

    ConflictClassification classification;
    try {
      classification = agent.classify(type.name(), content, formatExisting(existing));
    } catch (Exception e) {
      log.warn("Conflict classification failed, deferring: {}", e.getMessage());
      meterRegistry.counter("memory.conflict.deferred").increment();
      return ConflictResolution.deferredCheck();
    }

    Set<UUID> conflicting = acceptVerdicts(classification, existing);
    if (!conflicting.isEmpty()) {
      meterRegistry.counter("memory.conflict.detected").increment(conflicting.size());
      log.debug("Statement contradicts memories {}", conflicting);
    }
    return ConflictResolution.conflicts(conflicting);
  }

  private Map<ConflictCategory, List<Memory>> groupByCategory(
      String userId, Set<ConflictCategory> categories, String content, UUID excludeId) {
    int perCategory = memoryConfig.getConflict().getMaxExistingPerCategory();
    List<Memory> active =
        memoryRepository.findRecentActive(
            userId, PageRequest.of(0, memoryConfig.getConflict().getScanWindow()));

    Map<ConflictCategory, List<Memory>> grouped = new EnumMap<>(ConflictCategory.class);
    for (Memory memory : active) {
      if (memory.getId().equals(excludeId) || memory.getContent().equalsIgnoreCase(content)) {
        continue;
      }
      for (ConflictCategory category :
          ConflictCategory.detect(memory.getContent(), memory.getMemoryType())) {
        if (!categories.contains(category)) {
          continue;
        }
        List<Memory> bucket = grouped.computeIfAbsent(category, c -> new ArrayList<>());
        if (bucket.size() < perCategory) {
          bucket.add(memory);
        }
      }
    }
    return grouped;
  }

  private String formatExisting(Map<ConflictCategory, List<Memory>> existing) {
    StringBuilder sb = new StringBuilder();
    existing.forEach(
        (category, memories) -> {
          sb.append('[').append(category.name().toLowerCase(Locale.ROOT)).append("]\n");
          for (Memory memory : memories) {
            sb.append("- id=")
                .append(memory.getId())
                .append(" (")
                .append(memory.getMemoryType().name().toLowerCase(Locale.ROOT))
                .append("): ")
                .append(memory.getContent())
                .append('\n');
          }
        });
    return sb.toString().trim();
  }

  /** Keeps only conflict verdicts that name a memory offered under the verdict's category. */
  private Set<UUID> acceptVerdicts(
      ConflictClassification classification, Map<ConflictCategory, List<Memory>> existing) {
    Set<UUID> accepted = new LinkedHashSet<>();
    if (classification == null || classification.verdicts() == null) {
      return accepted;
    }
    for (ConflictVerdict verdict : classification.verdicts()) {
      if (verdict == null || !verdict.conflict()) {
        continue;
      }
      Optional<ConflictCategory> category = ConflictCategory.parse(verdict.category());
      Optional<UUID> id = parseId(verdict.supersededId());
      if (category.isEmpty() || id.isEmpty()) {
        log.debug("Ignoring malformed conflict verdict: {}", verdict);
        continue;
      }
      List<Memory> offered = existing.getOrDefault(category.get(), List.of());
      if (offered.stream().anyMatch(m -> m.getId().equals(id.get()))) {
        accepted.add(id.get());
      } else {
        log.debug("Ignoring verdict naming memory {} not offered under {}", id.get(), category);
      }
    }
    return accepted;
  }

  private static Optional<UUID> parseId(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(UUID.fromString(raw.trim()));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
