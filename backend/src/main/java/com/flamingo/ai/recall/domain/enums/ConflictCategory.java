package com.flamingo.ai.recall.domain.enums;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Categories of facts that can contradict each other over time. */
public enum ConflictCategory {
  JOB(
      List.of(
          "work at", "works at", "working at", "work for", "works for", "employed by", "job at",
          "job as", "position at", "work as", "works as")),
  LOCATION(
      List.of(
          "live in", "lives in", "living in", "based in", "located in", "moved to", "reside in",
          "resides in")),
  RELATIONSHIP(
      List.of(
          "married to", "dating", "engaged to", "partner", "girlfriend", "boyfriend", "husband",
          "wife", "fiance", "fiancé", "divorced", "single")),
  AGE(List.of("years old", "age is", "age:", "year-old")),
  PREFERENCE(
      List.of("favorite", "favourite", "prefer", "like", "love", "hate", "dislike", "enjoy"));

  private final List<String> cues;

  ConflictCategory(List<String> cues) {
    this.cues = cues;
  }

  public List<String> getCues() {
    return cues;
  }

  /**
   * Categories a statement bears. Every PREFERENCE-type memory bears {@link #PREFERENCE}
   * regardless of wording.
   */
  public static Set<ConflictCategory> detect(String content, MemoryType type) {
    Set<ConflictCategory> categories = EnumSet.noneOf(ConflictCategory.class);
    if (content != null) {
      String lower = content.toLowerCase(Locale.ROOT);
      for (ConflictCategory category : values()) {
        if (category.cues.stream().anyMatch(lower::contains)) {
          categories.add(category);
        }
      }
    }
    if (type == MemoryType.PREFERENCE) {
      categories.add(PREFERENCE);
    }
    return categories;
  }

  public static Optional<ConflictCategory> parse(String raw) {
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
