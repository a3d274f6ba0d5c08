package com.flamingo.ai.recall.domain.repository;

import com.flamingo.ai.recall.domain.entity.ConversationTurn;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for ConversationTurn entities. */
@Repository
public interface ConversationTurnRepository extends JpaRepository<ConversationTurn, UUID> {

  boolean existsByConversationIdAndTurnNumber(String conversationId, int turnNumber);

  /** Turns preceding the given one, newest first. */
  @Query(
      "SELECT t FROM ConversationTurn t WHERE t.conversationId = :conversationId "
          + "AND t.turnNumber < :turnNumber ORDER BY t.turnNumber DESC")
  List<ConversationTurn> findPriorTurns(
      @Param("conversationId") String conversationId,
      @Param("turnNumber") int turnNumber,
      Pageable pageable);

  @Modifying
  @Transactional
  long deleteByUserId(String userId);
}
