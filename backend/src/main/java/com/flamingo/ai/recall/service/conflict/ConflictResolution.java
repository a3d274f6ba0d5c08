package com.flamingo.ai.recall.service.conflict;

import java.util.Set;
import java.util.UUID;

/**
 * Result of conflict classification for one statement.
 *
 * @param conflictingIds existing memories the statement contradicts
 * @param deferred true when classification failed and must be re-run later
 */
public record ConflictResolution(Set<UUID> conflictingIds, boolean deferred) {

  public ConflictResolution {
    conflictingIds = Set.copyOf(conflictingIds);
  }

  public static ConflictResolution none() {
    return new ConflictResolution(Set.of(), false);
  }

  public static ConflictResolution deferredCheck() {
    return new ConflictResolution(Set.of(), true);
  }

  public static ConflictResolution conflicts(Set<UUID> ids) {
    return new ConflictResolution(ids, false);
  }

  public boolean hasConflicts() {
    return !conflictingIds.isEmpty();
  }
}
