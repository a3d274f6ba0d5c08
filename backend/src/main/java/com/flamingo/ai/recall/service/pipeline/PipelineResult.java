package com.flamingo.ai.recall.service.pipeline;

/**
 * Outcome of the write path for one turn.
 *
 * @param skipped true when the turn had already been processed
 * @param candidates validated candidates extracted from the turn
 * @param stored memories persisted
 * @param duplicates candidates dropped as duplicates
 * @param superseded older memories superseded by stored ones
 * @param deferred stored memories whose conflict check was deferred
 * @param failed candidates whose write failed
 */
public record PipelineResult(
    boolean skipped,
    int candidates,
    int stored,
    int duplicates,
    int superseded,
    int deferred,
    int failed) {

  public static PipelineResult alreadyProcessed() {
    return new PipelineResult(true, 0, 0, 0, 0, 0, 0);
  }
}
