package com.flamingo.ai.recall.service.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.enums.ImportanceLevel;
import com.flamingo.ai.recall.domain.enums.IndexStatus;
import com.flamingo.ai.recall.domain.enums.MemoryType;
import com.flamingo.ai.recall.domain.repository.ConversationTurnRepository;
import com.flamingo.ai.recall.domain.repository.MemoryRepository;
import com.flamingo.ai.recall.elasticsearch.MemoryDocument;
import com.flamingo.ai.recall.elasticsearch.MemoryIndexService;
import com.flamingo.ai.recall.exception.ExternalServiceUnavailableException;
import com.flamingo.ai.recall.service.conflict.ConflictResolution;
import com.flamingo.ai.recall.service.embedding.EmbeddingService;
import com.flamingo.ai.recall.service.extraction.CandidateMemory;
import com.flamingo.ai.recall.service.extraction.ContentHasher;
import com.flamingo.ai.recall.service.extraction.TurnContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
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
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DualStoreCoordinator Tests")
class DualStoreCoordinatorTest {

  private static final String USER = "user-1";
  private static final LocalDateTime NOW = LocalDateTime.of(2026, 6, 1, 12, 0);
  private static final List<Float> VECTOR = List.of(0.1f, 0.2f, 0.3f);

  @Mock private MemoryRepository memoryRepository;
  @Mock private ConversationTurnRepository conversationTurnRepository;
  @Mock private MemoryIndexService memoryIndexService;
  @Mock private EmbeddingService embeddingService;
  @Mock private MemoryProfileCache profileCache;
  @Mock private TransactionTemplate transactionTemplate;

  private MemoryConfig memoryConfig;
  private DualStoreCoordinator coordinator;
  private TurnContext turn;

  @BeforeEach
  void setUp() {
    memoryConfig = new MemoryConfig();
    Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    coordinator =
        new DualStoreCoordinator(
            memoryRepository,
            conversationTurnRepository,
            memoryIndexService,
            embeddingService,
            profileCache,
            transactionTemplate,
            memoryConfig,
            new SimpleMeterRegistry(),
            clock);
    turn = new TurnContext(USER, "conv-1", 7, "I now work at Microsoft", "Congrats!");

    lenient()
        .when(transactionTemplate.execute(any()))
        .thenAnswer(inv -> inv.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
    lenient()
        .when(memoryRepository.saveAndFlush(any(Memory.class)))
        .thenAnswer(
            inv -> {
              Memory memory = inv.getArgument(0);
              memory.setId(UUID.randomUUID());
              return memory;
            });
  }

  @Nested
  @DisplayName("store")
  class StoreTests {

    @Test
    @DisplayName("should commit, evict the profile, then index and mark INDEXED")
    void shouldStoreAndIndex() {
      Optional<Memory> saved =
          coordinator.store(
              turn, candidate("Works at Microsoft"), VECTOR, ConflictResolution.none());

      assertThat(saved).isPresent();
      Memory memory = saved.get();
      assertThat(memory.getIndexStatus()).isEqualTo(IndexStatus.INDEXED);
      assertThat(memory.getSourceTurn()).isEqualTo(7);
      assertThat(memory.getActiveContentHash()).isEqualTo(memory.getContentHash());
      verify(profileCache).evict(USER);
      verify(memoryIndexService).upsert(any(MemoryDocument.class));
      verify(memoryRepository).updateIndexStatus(memory.getId(), IndexStatus.INDEXED, 1, NOW);
    }

    @Test
    @DisplayName("should supersede the contradicted memory in the same transaction")
    void shouldSupersedeConflicts() {
      Memory google = existing("Works at Google");
      when(memoryRepository.findById(google.getId())).thenReturn(Optional.of(google));

      Memory microsoft =
          coordinator
              .store(
                  turn,
                  candidate("Works at Microsoft"),
                  VECTOR,
                  ConflictResolution.conflicts(Set.of(google.getId())))
              .orElseThrow();

      assertThat(google.isActive()).isFalse();
      assertThat(google.getSupersededBy()).isEqualTo(microsoft.getId());
      assertThat(google.getImportanceScore()).isZero();
      assertThat(google.getActiveContentHash()).isNull();
      assertThat(microsoft.isActive()).isTrue();
      verify(memoryRepository).save(google);
      verify(memoryIndexService).markSuperseded(google.getId());
    }

    @Test
    @DisplayName("should not supersede memories of another user")
    void shouldIgnoreForeignConflicts() {
      Memory foreign = existing("Works at Google");
      foreign.setUserId("someone-else");
      when(memoryRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

      coordinator.store(
          turn,
          candidate("Works at Microsoft"),
          VECTOR,
          ConflictResolution.conflicts(Set.of(foreign.getId())));

      assertThat(foreign.isActive()).isTrue();
    }

    @Test
    @DisplayName("should treat a unique constraint violation as an idempotent success")
    void shouldDropConcurrentDuplicate() {
      doThrow(new DataIntegrityViolationException("uk_memories_user_active_hash"))
          .when(transactionTemplate)
          .execute(any());

      Optional<Memory> saved =
          coordinator.store(turn, candidate("Likes tea"), VECTOR, ConflictResolution.none());

      assertThat(saved).isEmpty();
      verify(memoryIndexService, never()).upsert(any());
      verify(profileCache, never()).evict(anyString());
    }

    @Test
    @DisplayName("should keep the row INDEX_PENDING when the index write fails")
    void shouldMarkPendingOnIndexFailure() {
      doThrow(
              new ExternalServiceUnavailableException(
                  ExternalServiceUnavailableException.INDEX, "down"))
          .when(memoryIndexService)
          .upsert(any());

      Memory memory =
          coordinator
              .store(turn, candidate("Likes tea"), VECTOR, ConflictResolution.none())
              .orElseThrow();

      assertThat(memory.getIndexStatus()).isEqualTo(IndexStatus.INDEX_PENDING);
      verify(memoryRepository).updateIndexStatus(memory.getId(), IndexStatus.INDEX_PENDING, 1, NOW);
    }

    @Test
    @DisplayName("should flag the memory for a later conflict check when classification failed")
    void shouldFlagDeferredConflictCheck() {
      ArgumentCaptor<Memory> captor = ArgumentCaptor.forClass(Memory.class);

      coordinator.store(
          turn, candidate("Favorite color is green"), VECTOR, ConflictResolution.deferredCheck());

      verify(memoryRepository).saveAndFlush(captor.capture());
      assertThat(captor.getValue().isConflictCheckPending()).isTrue();
    }

    @Test
    @DisplayName("should not fail the write when marking superseded in the index fails")
    void shouldTolerateMarkSupersededFailure() {
      Memory google = existing("Works at Google");
      when(memoryRepository.findById(google.getId())).thenReturn(Optional.of(google));
      doThrow(new RuntimeException("index down"))
          .when(memoryIndexService)
          .markSuperseded(google.getId());

      assertThat(
              coordinator.store(
                  turn,
                  candidate("Works at Microsoft"),
                  VECTOR,
                  ConflictResolution.conflicts(Set.of(google.getId()))))
          .isPresent();
    }
  }

  @Nested
  @DisplayName("indexMemory")
  class IndexMemoryTests {

    @Test
    @DisplayName("should mark INDEX_FAILED once max attempts are exhausted")
    void shouldMarkFailedAfterMaxAttempts() {
      Memory memory = existing("Likes tea");
      memory.setIndexStatus(IndexStatus.INDEX_PENDING);
      memory.setIndexAttempts(4);
      doThrow(new RuntimeException("down")).when(memoryIndexService).upsert(any());

      IndexStatus status = coordinator.indexMemory(memory);

      assertThat(status).isEqualTo(IndexStatus.INDEX_FAILED);
      verify(memoryRepository).updateIndexStatus(memory.getId(), IndexStatus.INDEX_FAILED, 5, NOW);
    }

    @Test
    @DisplayName("should compute a missing embedding before indexing")
    void shouldEmbedMissingVector() {
      Memory memory = existing("Likes tea");
      memory.setEmbedding(null);
      when(embeddingService.embedMemory("Likes tea")).thenReturn(VECTOR);

      IndexStatus status = coordinator.indexMemory(memory);

      assertThat(status).isEqualTo(IndexStatus.INDEXED);
      verify(memoryRepository).updateEmbedding(memory.getId(), VECTOR);
    }

    @Test
    @DisplayName("should count an unavailable embedding provider as a failed attempt")
    void shouldFailWithoutEmbedding() {
      Memory memory = existing("Likes tea");
      memory.setEmbedding(null);
      when(embeddingService.embedMemory(anyString())).thenReturn(List.of());

      assertThat(coordinator.indexMemory(memory)).isEqualTo(IndexStatus.INDEX_PENDING);
      verify(memoryIndexService, never()).upsert(any());
    }
  }

  @Nested
  @DisplayName("purgeUser")
  class PurgeTests {

    @Test
    @DisplayName("should delete memories and turns even when the index is unreachable")
    void shouldPurgeDespiteIndexFailure() {
      doThrow(new RuntimeException("down")).when(memoryIndexService).deleteByUserId(USER);
      when(memoryRepository.deleteByUserId(USER)).thenReturn(3L);

      long deleted = coordinator.purgeUser(USER);

      assertThat(deleted).isEqualTo(3L);
      verify(conversationTurnRepository).deleteByUserId(USER);
      verify(profileCache).evict(USER);
    }
  }

  @Nested
  @DisplayName("supersede")
  class SupersedeTests {

    @Test
    @DisplayName("should supersede the older memory by the newer and evict the profile")
    void shouldSupersede() {
      Memory older = existing("Lives in Chennai");
      Memory newer = existing("Lives in Bangalore");
      when(memoryRepository.findById(older.getId())).thenReturn(Optional.of(older));
      when(memoryRepository.findById(newer.getId())).thenReturn(Optional.of(newer));

      boolean result = coordinator.supersede(older.getId(), newer.getId());

      assertThat(result).isTrue();
      assertThat(older.getSupersededBy()).isEqualTo(newer.getId());
      verify(profileCache).evict(USER);
      verify(memoryIndexService).markSuperseded(older.getId());
    }

    @Test
    @DisplayName("should do nothing when the older memory is already superseded")
    void shouldSkipInactive() {
      Memory older = existing("Lives in Chennai");
      Memory newer = existing("Lives in Bangalore");
      older.supersede(UUID.randomUUID(), NOW);
      when(memoryRepository.findById(older.getId())).thenReturn(Optional.of(older));
      when(memoryRepository.findById(newer.getId())).thenReturn(Optional.of(newer));

      assertThat(coordinator.supersede(older.getId(), newer.getId())).isFalse();
      verify(memoryIndexService, never()).markSuperseded(any());
    }
  }

  private static CandidateMemory candidate(String content) {
    return new CandidateMemory(
        MemoryType.FACT,
        content,
        0.95,
        ImportanceLevel.HIGH,
        Set.of("work"),
        Set.of(),
        ContentHasher.hash(content));
  }

  private static Memory existing(String content) {
    String hash = ContentHasher.hash(content);
    return Memory.builder()
        .id(UUID.randomUUID())
        .userId(USER)
        .memoryType(MemoryType.FACT)
        .content(content)
        .embedding(VECTOR)
        .confidence(0.9)
        .importanceLevel(ImportanceLevel.HIGH)
        .importanceScore(0.75)
        .contentHash(hash)
        .activeContentHash(hash)
        .createdAt(NOW.minusDays(30))
        .build();
  }
}
