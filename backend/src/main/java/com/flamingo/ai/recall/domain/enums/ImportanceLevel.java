package com.flamingo.ai.recall.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Coarse importance of a memory; each level maps to a fixed score in [0,1]. */
public enum ImportanceLevel {
  /** Identity, goals and close relationships. */
  CRITICAL(1.0),

  /** Standing preferences, skills and commitments. */
  HIGH(0.75),

  /** Ordinary facts and interests. */
  MEDIUM(0.5),

  /** Small talk and temporary information. */
  LOW(0.25);

  private final double score;

  ImportanceLevel(double score) {
    this.score = score;
  }

  public double getScore() {
    return score;
  }

  /** True for the levels that make up a user's profile. */
  public boolean isProfileLevel() {
    return this == CRITICAL || this == HIGH;
  }

  public static Optional<ImportanceLevel> parse(String raw) {
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
