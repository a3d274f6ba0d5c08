package com.flamingo.ai.recall.domain.repository;

import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.domain.enums.ImportanceLevel;
import com.flamingo.ai.recall.domain.enums.IndexStatus;
import com.flamingo.ai.recall.domain.enums.MemoryType;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for Memory entities. */
@Repository
public interface MemoryRepository extends JpaRepository<Memory, UUID> {

  /** Active memories of a user, newest first. */
  @Query(
      "SELECT m FROM Memory m WHERE m.userId = :userId AND m.supersededBy IS NULL "
          + "ORDER BY m.createdAt DESC")
  List<Memory> findRecentActive(@Param("userId") String userId, Pageable pageable);

  /** Active memories of a user and type, newest first. */
  @Query(
      "SELECT m FROM Memory m WHERE m.userId = :userId AND m.memoryType = :type "
          + "AND m.supersededBy IS NULL ORDER BY m.createdAt DESC")
  List<Memory> findRecentActiveByType(
      @Param("userId") String userId,
      @Param("type") MemoryType type,
      Pageable pageable);

  /** Active memory of a user holding the given normalized-content hash. */
  Optional<Memory> findByUserIdAndActiveContentHash(String userId, String activeContentHash);

  /** Active memories at the given importance levels, most important and newest first. */
  @Query(
      "SELECT m FROM Memory m WHERE m.userId = :userId AND m.supersededBy IS NULL "
          + "AND m.importanceLevel IN :levels ORDER BY m.importanceScore DESC, m.createdAt DESC")
  List<Memory> findActiveByImportanceLevels(
      @Param("userId") String userId, @Param("levels") Collection<ImportanceLevel> levels);

  List<Memory> findByUserId(String userId);

  /** Rows awaiting an index retry. */
  List<Memory> findByIndexStatusOrderByCreatedAtAsc(IndexStatus status, Pageable pageable);

  /** Failed rows whose last attempt is older than the cutoff. */
  @Query(
      "SELECT m FROM Memory m WHERE m.indexStatus = :status "
          + "AND (m.lastIndexAttemptAt IS NULL OR m.lastIndexAttemptAt < :cutoff) "
          + "ORDER BY m.createdAt ASC")
  List<Memory> findIndexRetryCandidates(
      @Param("status") IndexStatus status,
      @Param("cutoff") LocalDateTime cutoff,
      Pageable pageable);

  /** Active memories whose conflict classification was deferred. */
  @Query(
      "SELECT m FROM Memory m WHERE m.conflictCheckPending = true AND m.supersededBy IS NULL "
          + "ORDER BY m.createdAt ASC")
  List<Memory> findPendingConflictChecks(Pageable pageable);

  /** Active memories created after the given instant, oldest first. */
  @Query(
      "SELECT m FROM Memory m WHERE m.supersededBy IS NULL AND m.createdAt >= :since "
          + "ORDER BY m.userId ASC, m.createdAt ASC")
  List<Memory> findActiveCreatedSince(@Param("since") LocalDateTime since);

  long countByIndexStatus(IndexStatus status);

  /**
   * Increments the access counter in SQL so concurrent updates never lose an increment and the
   * counter never decreases.
   */
  @Modifying(clearAutomatically = true)
  @Transactional
  @Query(
      "UPDATE Memory m SET m.accessCount = m.accessCount + 1, m.lastAccessed = :now "
          + "WHERE m.id IN :ids")
  int recordAccess(@Param("ids") Collection<UUID> ids, @Param("now") LocalDateTime now);

  /** Records the outcome of an index write without touching any other column. */
  @Modifying(clearAutomatically = true)
  @Transactional
  @Query(
      "UPDATE Memory m SET m.indexStatus = :status, m.indexAttempts = :attempts, "
          + "m.lastIndexAttemptAt = :at WHERE m.id = :id")
  int updateIndexStatus(
      @Param("id") UUID id,
      @Param("status") IndexStatus status,
      @Param("attempts") int attempts,
      @Param("at") LocalDateTime at);

  @Modifying(clearAutomatically = true)
  @Transactional
  @Query("UPDATE Memory m SET m.embedding = :embedding WHERE m.id = :id")
  int updateEmbedding(@Param("id") UUID id, @Param("embedding") List<Float> embedding);

  /** Clears the deferred conflict flag once classification has run. */
  @Modifying(clearAutomatically = true)
  @Transactional
  @Query("UPDATE Memory m SET m.conflictCheckPending = false WHERE m.id = :id")
  int clearConflictCheckPending(@Param("id") UUID id);

  @Modifying
  @Transactional
  long deleteByUserId(String userId);
}
