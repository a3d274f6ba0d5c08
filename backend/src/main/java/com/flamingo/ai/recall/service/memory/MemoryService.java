package com.flamingo.ai.recall.service.memory;

import com.flamingo.ai.recall.domain.entity.Memory;
import com.flamingo.ai.recall.service.retrieval.RetrievalHint;
import com.flamingo.ai.recall.service.scoring.ScoredMemory;
import java.util.List;
import java.util.UUID;

/** Service interface for the long-term memory engine. */
public interface MemoryService {

  /**
   * Queues a completed turn for memory extraction. Returns immediately.
   *
   * @param userId owning user
   * @param conversationId conversation the turn belongs to
   * @param turnNumber turn number, unique within the conversation
   * @param userMessage the user's message
   * @param assistantMessage the assistant's reply, may be null
   */
  void ingestTurn(
      String userId,
      String conversationId,
      int turnNumber,
      String userMessage,
      String assistantMessage);

  /**
   * Retrieves memories relevant to a query. Never throws.
   *
   * @param userId owning user
   * @param queryText the query
   * @param hint optional turn context, may be null
   * @return ranked memories within the configured top-K and token budget
   */
  List<ScoredMemory> retrieve(String userId, String queryText, RetrievalHint hint);

  /**
   * Exact-id lookup against the durable store.
   *
   * @throws com.flamingo.ai.recall.exception.MemoryNotFoundException if absent
   */
  Memory getMemory(UUID memoryId);

  /** The user's CRITICAL/HIGH active memories, served from cache. */
  List<Memory> getProfile(String userId);

  /** Renders retrieved memories as a prompt block; empty string for no memories. */
  String buildMemoryContext(List<ScoredMemory> memories);

  MemoryStats getUserStats(String userId);

  /**
   * Deletes everything stored for a user.
   *
   * @return number of memories deleted
   */
  long purgeUser(String userId);
}
