package com.flamingo.ai.recall.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Kind of fact a memory records. */
public enum MemoryType {
  /** Verifiable statement about the user (job, location, age). */
  FACT,

  /** Likes, dislikes and habits. */
  PREFERENCE,

  /** Promises, meetings, tasks and deadlines. */
  COMMITMENT,

  /** Something that happened in a conversation. */
  EPISODIC,

  /** A person, place or organization the user mentioned. */
  ENTITY;

  /** Parses a type name case-insensitively; empty for unknown or blank input. */
  public static Optional<MemoryType> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
