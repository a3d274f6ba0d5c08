package com.flamingo.ai.recall.agent.dto;

import java.util.List;

/** Structured output from ConflictClassificationAgent: one verdict per category offered. */
public record ConflictClassification(List<ConflictVerdict> verdicts) {}
