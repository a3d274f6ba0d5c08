package com.flamingo.ai.recall.elasticsearch;

import java.util.UUID;

/**
 * One result of a similarity query.
 *
 * @param memoryId id of the matched memory
 * @param similarity cosine similarity in [-1, 1]
 */
public record SimilarityHit(UUID memoryId, double similarity) {}
