package com.flamingo.ai.recall.exception;

import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Thrown by an exact-id read when the durable store has no row for the id. Superseded memories
 * are still found; only deleted or never-written ids end up here.
 */
public class MemoryNotFoundException extends NoSuchElementException {

  private final UUID memoryId;

  public MemoryNotFoundException(UUID memoryId) {
    super("No memory with id " + memoryId);
    this.memoryId = memoryId;
  }

  public UUID getMemoryId() {
    return memoryId;
  }
}
