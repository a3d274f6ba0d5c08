package com.flamingo.ai.recall.service.store;

/**
 * Counts from one reconciliation pass.
 *
 * @param indexed rows that reached INDEXED
 * @param indexFailures rows whose retry failed again
 * @param conflictsRechecked deferred conflict checks that completed
 * @param superseded memories superseded by conflict re-checks or consolidation
 */
public record SweepReport(
    int indexed, int indexFailures, int conflictsRechecked, int superseded) {

  public static SweepReport empty() {
    return new SweepReport(0, 0, 0, 0);
  }
}
