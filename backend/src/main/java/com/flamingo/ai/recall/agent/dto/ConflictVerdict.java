package com.flamingo.ai.recall.agent.dto;

/**
 * Per-category outcome of a conflict classification.
 *
 * @param category one of job, location, relationship, age, preference
 * @param conflict whether the new statement contradicts an existing memory in the category
 * @param supersededId id of the contradicted memory, present only when {@code conflict} is true
 */
public record ConflictVerdict(String category, boolean conflict, String supersededId) {}
