package com.flamingo.ai.recall.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.enums.ImportanceLevel;
import com.flamingo.ai.recall.domain.enums.MemoryType;
import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import com.flamingo.ai.recall.elasticsearch.MemoryIndexService;
import com.flamingo.ai.recall.elasticsearch.SimilarityHit;
import com.flamingo.ai.recall.exception.ExternalServiceUnavailableException;
import com.flamingo.ai.recall.service.embedding.EmbeddingService;
import com.flamingo.ai.recall.service.scoring.HybridScorer;
import com.flamingo.ai.recall.service.scoring.ScoredMemory;
import com.flamingo.ai.recall.service.scoring.TemporalDecayModel;
import com.flamingo.ai.recall.service.store.AccessTracker;
import com.flamingo.ai.recall.service.store.MemoryProfileCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
@DisplayName("MemoryRetrievalService Tests")
class MemoryRetrievalServiceTest {

  private static final String USER = "user-1";
  private static final LocalDateTime NOW = LocalDateTime.of(2026, 6, 1, 12, 0);
  private static final List<Float> QUERY_VECTOR = List.of(0.1f, 0.2f, 0.3f);

  @Mock private EmbeddingService embeddingService;
  @Mock private MemoryIndexService memoryIndexService;
  @Mock private MemoryRepository memoryRepository;
  @Mock private MemoryProfileCache profileCache;
  @Mock private AccessTracker accessTracker;

  private MemoryConfig memoryConfig;
  private SimpleMeterRegistry meterRegistry;
  private MemoryRetrievalService service;

  @BeforeEach
  void setUp() {
    memoryConfig = new MemoryConfig();
    meterRegistry = new SimpleMeterRegistry();
    Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    service =
        new MemoryRetrievalService(
            new QueryIntentClassifier(memoryConfig),
            embeddingService,
            memoryIndexService,
            memoryRepository,
            profileCache,
            new HybridScorer(memoryConfig, new TemporalDecayModel(memoryConfig)),
            accessTracker,
            memoryConfig,
            meterRegistry,
            clock);
  }

  @Nested
  @DisplayName("greeting")
  class GreetingTests {

    @Test
    @DisplayName("should return the whole CRITICAL/HIGH profile for 'hi' as first message")
    void shouldReturnProfileForGreeting() {
      List<Memory> profile =
          List.of(
              memory("Name is Priya", ImportanceLevel.CRITICAL, 3),
              memory("Works at Infosys", ImportanceLevel.HIGH, 20),
              memory("Allergic to peanuts", ImportanceLevel.HIGH, 40));
      when(profileCache.getProfile(USER)).thenReturn(profile);

      List<ScoredMemory> result = service.retrieve(USER, "hi", RetrievalHint.atTurn(1));

      assertThat(result).extracting(ScoredMemory::memory).containsExactlyElementsOf(profile);
      verifyNoInteractions(embeddingService, memoryIndexService);
      verify(accessTracker).recordAccess(anyList());
    }
  }

  @Nested
  @DisplayName("broad")
  class BroadTests {

    @Test
    @DisplayName("should return nothing for a content-free message")
    void shouldReturnEmptyForBroad() {
      assertThat(service.retrieve(USER, "ok thanks", RetrievalHint.atTurn(12))).isEmpty();
      verifyNoInteractions(embeddingService, memoryIndexService, memoryRepository, accessTracker);
    }
  }

  @Nested
  @DisplayName("specific")
  class SpecificTests {

    @Test
    @DisplayName("should surface an early color preference for a late paint question")
    void shouldSurfaceOldPreference() {
      Memory blue =
          memoryAt(
              "Favorite color is blue",
              MemoryType.PREFERENCE,
              ImportanceLevel.HIGH,
              NOW.minusDays(10));
      List<Memory> all = new ArrayList<>(List.of(blue));
      List<SimilarityHit> hits = new ArrayList<>(List.of(new SimilarityHit(blue.getId(), 0.62)));
      for (int i = 0; i < 29; i++) {
        Memory distractor =
            memoryAt(
                "Talked about topic " + i,
                MemoryType.EPISODIC,
                ImportanceLevel.MEDIUM,
                NOW.minusHours(i + 1));
        all.add(distractor);
        hits.add(new SimilarityHit(distractor.getId(), 0.30));
      }
      when(embeddingService.embedQuery(anyString())).thenReturn(QUERY_VECTOR);
      when(memoryIndexService.query(USER, QUERY_VECTOR, 50)).thenReturn(hits);
      when(memoryRepository.findAllById(anyCollection())).thenReturn(all);

      List<ScoredMemory> result =
          service.retrieve(USER, "What wall paint should I choose?", RetrievalHint.atTurn(55));

      assertThat(result).hasSizeLessThanOrEqualTo(15);
      assertThat(result).extracting(ScoredMemory::memory).contains(blue);
      assertThat(result.get(0).memory()).isEqualTo(blue);
    }

    @Test
    @DisplayName("should drop superseded rows even if the index still returns them")
    void shouldDropSuperseded() {
      Memory current = memory("Works at Microsoft", ImportanceLevel.HIGH, 1);
      Memory old = memory("Works at Google", ImportanceLevel.HIGH, 100);
      old.supersede(current.getId(), NOW);
      when(embeddingService.embedQuery(anyString())).thenReturn(QUERY_VECTOR);
      when(memoryIndexService.query(eq(USER), anyList(), anyInt()))
          .thenReturn(
              List.of(new SimilarityHit(old.getId(), 0.9), new SimilarityHit(current.getId(), 0.8)));
      when(memoryRepository.findAllById(anyCollection())).thenReturn(List.of(old, current));

      List<ScoredMemory> result = service.retrieve(USER, "where do I work", null);

      assertThat(result).extracting(ScoredMemory::memory).containsExactly(current);
    }
  }

  @Nested
  @DisplayName("degraded operation")
  class DegradedTests {

    @Test
    @DisplayName("should rank by importance and recency when the index is unreachable")
    void shouldFallBackWhenIndexDown() {
      List<Memory> recent = new ArrayList<>();
      for (int i = 0; i < 10; i++) {
        recent.add(
            memory(
                "Memory " + i, i == 7 ? ImportanceLevel.CRITICAL : ImportanceLevel.LOW, i + 1));
      }
      when(embeddingService.embedQuery(anyString())).thenReturn(QUERY_VECTOR);
      when(memoryIndexService.query(anyString(), anyList(), anyInt()))
          .thenThrow(
              new ExternalServiceUnavailableException(
                  ExternalServiceUnavailableException.INDEX, "connection refused"));
      when(memoryRepository.findRecentActive(eq(USER), any(Pageable.class))).thenReturn(recent);

      List<ScoredMemory> result = service.retrieve(USER, "where do I work", null);

      assertThat(result).hasSize(10);
      assertThat(result.get(0).memory().getContent()).isEqualTo("Memory 7");
      assertThat(result).allSatisfy(s -> assertThat(s.similarity()).isZero());
      assertThat(meterRegistry.counter("memory.retrieval.fallback").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should fall back when the query cannot be embedded")
    void shouldFallBackWithoutQueryEmbedding() {
      when(embeddingService.embedQuery(anyString())).thenReturn(List.of());
      when(memoryRepository.findRecentActive(eq(USER), any(Pageable.class)))
          .thenReturn(List.of(memory("Likes tea", ImportanceLevel.MEDIUM, 1)));

      assertThat(service.retrieve(USER, "what drink do I like", null)).hasSize(1);
      verify(memoryIndexService, never()).query(anyString(), anyList(), anyInt());
    }

    @Test
    @DisplayName("should return an empty list when the durable store is unreachable")
    void shouldReturnEmptyWhenStoreDown() {
      when(embeddingService.embedQuery(anyString())).thenReturn(List.of());
      when(memoryRepository.findRecentActive(eq(USER), any(Pageable.class)))
          .thenThrow(new DataAccessResourceFailureException("database is locked"));

      assertThat(service.retrieve(USER, "what drink do I like", null)).isEmpty();
      verifyNoInteractions(accessTracker);
    }
  }

  @Nested
  @DisplayName("selection")
  class SelectionTests {

    @Test
    @DisplayName("should keep at most top-K entries")
    void shouldCapAtTopK() {
      List<ScoredMemory> scored = new ArrayList<>();
      for (int i = 0; i < 20; i++) {
        scored.add(new ScoredMemory(memory("m" + i, ImportanceLevel.LOW, 1), i, 0, 1));
      }

      List<ScoredMemory> result = service.select(scored);

      assertThat(result).hasSize(15);
      assertThat(result.get(0).score()).isEqualTo(19.0);
    }

    @Test
    @DisplayName("should drop the lowest scored entries until the token budget fits")
    void shouldRespectTokenBudget() {
      String longContent = "x".repeat(3000);
      ScoredMemory best = new ScoredMemory(memory(longContent, ImportanceLevel.LOW, 1), 0.9, 0, 1);
      ScoredMemory middle =
          new ScoredMemory(memory(longContent + "y", ImportanceLevel.LOW, 1), 0.8, 0, 1);
      ScoredMemory worst =
          new ScoredMemory(memory(longContent + "z", ImportanceLevel.LOW, 1), 0.7, 0, 1);

      List<ScoredMemory> result = service.select(List.of(worst, best, middle));

      assertThat(result).containsExactly(best, middle);
      assertThat(result.stream().mapToInt(s -> TokenEstimator.estimate(s.memory())).sum())
          .isLessThanOrEqualTo(2000);
    }
  }

  private static Memory memory(String content, ImportanceLevel level, int ageDays) {
    return memoryAt(content, MemoryType.FACT, level, NOW.minusDays(ageDays));
  }

  private static Memory memoryAt(
      String content, MemoryType type, ImportanceLevel level, LocalDateTime createdAt) {
    return Memory.builder()
        .id(UUID.randomUUID())
        .userId(USER)
        .memoryType(type)
        .content(content)
        .confidence(0.9)
        .importanceLevel(level)
        .importanceScore(level.getScore())
        .contentHash(content)
        .createdAt(createdAt)
        .build();
  }
}
