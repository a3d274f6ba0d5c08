package com.flamingo.ai.recall.domain.entity;

import com.flamingo.ai.recall.domain.converter.EmbeddingConverter;
import com.flamingo.ai.recall.domain.converter.StringSetConverter;
import com.flamingo.ai.recall.domain.enums.ImportanceLevel;
import com.flamingo.ai.recall.domain.enums.IndexStatus;
import com.flamingo.ai.recall.domain.enums.MemoryType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

/**
 * A structured fact extracted from dialogue for one user.
 *
 * <p>{@code activeContentHash} mirrors {@code contentHash} while the memory is active and is
 * cleared when it is superseded, so the unique index on {@code (user_id,
 * active_content_hash)} only binds non-superseded rows. Updates write changed columns only, so a
 * supersession never overwrites a concurrent access-count increment.
 */
@Entity
@Table(
    name = "memories",
    indexes = {
      @Index(
          name = "uk_memories_user_active_hash",
          columnList = "user_id, active_content_hash",
          unique = true),
      @Index(name = "idx_memories_user_created", columnList = "user_id, created_at"),
      @Index(name = "idx_memories_index_status", columnList = "index_status")
    })
@DynamicUpdate
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Memory {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private MemoryType memoryType;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String content;

  @Convert(converter = EmbeddingConverter.class)
  @Column(columnDefinition = "TEXT")
  private List<Float> embedding;

  /** Extraction confidence from 0.0 to 1.0. */
  @Column(nullable = false)
  private double confidence;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ImportanceLevel importanceLevel;

  /** Derived from {@link #importanceLevel}; zeroed when superseded. */
  @Column(nullable = false)
  private double importanceScore;

  @Convert(converter = StringSetConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Set<String> tags = new LinkedHashSet<>();

  @Convert(converter = StringSetConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Set<String> entities = new LinkedHashSet<>();

  @Column(name = "content_hash", nullable = false, length = 64)
  private String contentHash;

  @Column(name = "active_content_hash", length = 64)
  private String activeContentHash;

  private String conversationId;

  private Integer sourceTurn;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime lastAccessed;

  @Column(nullable = false)
  @Builder.Default
  private long accessCount = 0L;

  @Enumerated(EnumType.STRING)
  @Column(name = "index_status", nullable = false)
  @Builder.Default
  private IndexStatus indexStatus = IndexStatus.CREATED;

  @Builder.Default private int indexAttempts = 0;

  private LocalDateTime lastIndexAttemptAt;

  private UUID supersededBy;

  private LocalDateTime supersededAt;

  /** Set when conflict classification failed open and must be re-run by the sweep. */
  @Builder.Default private boolean conflictCheckPending = false;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
    if (lastAccessed == null) {
      lastAccessed = createdAt;
    }
    if (importanceLevel != null && supersededBy == null) {
      importanceScore = importanceLevel.getScore();
    }
    if (supersededBy == null) {
      activeContentHash = contentHash;
    }
  }

  public boolean isActive() {
    return supersededBy == null;
  }

  /** Retires this memory in favour of a newer one; the row itself is kept for audit. */
  public void supersede(UUID newerMemoryId, LocalDateTime at) {
    this.supersededBy = newerMemoryId;
    this.supersededAt = at;
    this.importanceScore = 0.0;
    this.activeContentHash = null;
    this.conflictCheckPending = false;
  }

  public boolean hasEmbedding() {
    return embedding != null && !embedding.isEmpty();
  }
}
