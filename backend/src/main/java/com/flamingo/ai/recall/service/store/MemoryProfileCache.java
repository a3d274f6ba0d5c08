package com.flamingo.ai.recall.service.store;

import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.enums.ImportanceLevel;
import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import com.github.benmanes.caffeine.cache.Cache;
import java.util.EnumSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Read-through cache of each user's CRITICAL/HIGH active memories. */
@Component
@RequiredArgsConstructor
public class MemoryProfileCache {

  private static final EnumSet<ImportanceLevel> PROFILE_LEVELS =
      EnumSet.of(ImportanceLevel.CRITICAL, ImportanceLevel.HIGH);

  private final Cache<String, List<Memory>> profileCache;
  private final MemoryRepository memoryRepository;

  /** Profile ordered by importance then recency; loaded from the durable store on a miss. */
  public List<Memory> getProfile(String userId) {
    return profileCache.get(
        userId,
        id -> List.copyOf(memoryRepository.findActiveByImportanceLevels(id, PROFILE_LEVELS)));
  }

  public void evict(String userId) {
    profileCache.invalidate(userId);
  }
}
