package com.flamingo.ai.recall.domain.enums;

/**
 * Position of a memory in the similarity-index state machine.
 *
 * <p>{@code CREATED -> INDEXED} on the happy path, {@code CREATED -> INDEX_PENDING -> INDEXED}
 * after a retried upsert, and {@code INDEX_PENDING -> INDEX_FAILED} once the attempt budget is
 * spent.
 */
public enum IndexStatus {
  CREATED,
  INDEX_PENDING,
  INDEXED,
  INDEX_FAILED
}
