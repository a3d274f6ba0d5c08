package com.flamingo.ai.recall.service.dedup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.enums.ImportanceLevel;
import com.flamingo.ai.recall.domain.enums.MemoryType;
import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import com.flamingo.ai.recall.service.extraction.CandidateMemory;
import com.flamingo.ai.recall.service.extraction.ContentHasher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeduplicationFilter Tests")
class DeduplicationFilterTest {

  private static final String USER = "user-1";

  @Mock private MemoryRepository memoryRepository;

  private MemoryConfig memoryConfig;
  private DeduplicationFilter filter;

  @BeforeEach
  void setUp() {
    memoryConfig = new MemoryConfig();
    Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    filter =
        new DeduplicationFilter(memoryRepository, memoryConfig, new SimpleMeterRegistry(), clock);
    lenient()
        .when(memoryRepository.findByUserIdAndActiveContentHash(anyString(), anyString()))
        .thenReturn(Optional.empty());
  }

  @Nested
  @DisplayName("exact content match")
  class ExactMatchTests {

    @Test
    @DisplayName("should treat an active memory with the same hash as duplicate and reinforce it")
    void shouldDetectExactMatch() {
      CandidateMemory candidate = candidate("Likes hiking");
      Memory existing = memory("Likes hiking", List.of(1f, 0f), 0);
      when(memoryRepository.findByUserIdAndActiveContentHash(USER, candidate.contentHash()))
          .thenReturn(Optional.of(existing));

      DedupDecision decision = filter.check(USER, candidate, List.of());

      assertThat(decision.duplicate()).isTrue();
      assertThat(decision.matchedMemoryId()).isEqualTo(existing.getId());
      verify(memoryRepository)
          .recordAccess(eq(List.of(existing.getId())), eq(LocalDateTime.of(2026, 1, 1, 0, 0)));
    }
  }

  @Nested
  @DisplayName("similarity match")
  class SimilarityTests {

    @Test
    @DisplayName("should flag candidate at or above the threshold")
    void shouldFlagSimilarCandidate() {
      Memory existing = memory("Enjoys hiking on weekends", List.of(1f, 0.01f), 0);
      when(memoryRepository.findRecentActive(eq(USER), any(Pageable.class)))
          .thenReturn(List.of(existing));

      DedupDecision decision =
          filter.check(USER, candidate("Likes to hike on weekends"), List.of(1f, 0f));

      assertThat(decision.duplicate()).isTrue();
      assertThat(decision.similarity()).isGreaterThanOrEqualTo(0.95);
    }

    @Test
    @DisplayName("should pass candidate below the threshold")
    void shouldPassDissimilarCandidate() {
      Memory existing = memory("Lives in Chennai", List.of(1f, 0.5f), 0);
      when(memoryRepository.findRecentActive(eq(USER), any(Pageable.class)))
          .thenReturn(List.of(existing));

      DedupDecision decision = filter.check(USER, candidate("Lives in Bangalore"), List.of(1f, 0f));

      assertThat(decision.duplicate()).isFalse();
      verify(memoryRepository, never()).recordAccess(anyCollection(), any());
    }

    @Test
    @DisplayName("should never flag when the user has no memories")
    void shouldPassWithEmptyNeighborSet() {
      when(memoryRepository.findRecentActive(eq(USER), any(Pageable.class))).thenReturn(List.of());

      assertThat(filter.check(USER, candidate("Has a cat"), List.of(1f, 0f)).duplicate()).isFalse();
    }

    @Test
    @DisplayName("should prefer the neighbor with more accesses on equal similarity")
    void shouldBreakTiesByAccessCount() {
      Memory rarelyUsed = memory("Drinks coffee", List.of(1f, 0f), 1);
      Memory oftenUsed = memory("Drinks coffee daily", List.of(1f, 0f), 9);
      when(memoryRepository.findRecentActive(eq(USER), any(Pageable.class)))
          .thenReturn(List.of(rarelyUsed, oftenUsed));

      DedupDecision decision = filter.check(USER, candidate("Loves coffee"), List.of(1f, 0f));

      assertThat(decision.matchedMemoryId()).isEqualTo(oftenUsed.getId());
    }

    @Test
    @DisplayName("should skip similarity when the candidate has no embedding")
    void shouldSkipWithoutEmbedding() {
      DedupDecision decision = filter.check(USER, candidate("Has a cat"), List.of());

      assertThat(decision.duplicate()).isFalse();
      verify(memoryRepository, never()).findRecentActive(anyString(), any(Pageable.class));
    }

    @Test
    @DisplayName("should restrict neighbors to the candidate type when configured")
    void shouldRestrictToSameType() {
      memoryConfig.getDedup().setSameTypeOnly(true);
      when(memoryRepository.findRecentActiveByType(
              eq(USER), eq(MemoryType.PREFERENCE), any(Pageable.class)))
          .thenReturn(List.of());

      filter.check(USER, candidate("Likes tea"), List.of(1f, 0f));

      verify(memoryRepository, never()).findRecentActive(anyString(), any(Pageable.class));
    }
  }

  private static CandidateMemory candidate(String content) {
    return new CandidateMemory(
        MemoryType.PREFERENCE,
        content,
        0.9,
        ImportanceLevel.MEDIUM,
        Set.of(),
        Set.of(),
        ContentHasher.hash(content));
  }

  private static Memory memory(String content, List<Float> embedding, long accessCount) {
    return Memory.builder()
        .id(UUID.randomUUID())
        .userId(USER)
        .memoryType(MemoryType.PREFERENCE)
        .content(content)
        .embedding(embedding)
        .confidence(0.9)
        .importanceLevel(ImportanceLevel.MEDIUM)
        .importanceScore(0.5)
        .contentHash(ContentHasher.hash(content))
        .accessCount(accessCount)
        .createdAt(LocalDateTime.of(2025, 12, 1, 0, 0))
        .build();
  }
}
