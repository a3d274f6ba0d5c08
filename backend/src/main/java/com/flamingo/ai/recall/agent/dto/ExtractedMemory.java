package com.flamingo.ai.recall.agent.dto;

import java.util.List;

/**
 * Raw candidate as returned by MemoryExtractionAgent. Every field is untrusted until it passes
 * {@code CandidateValidator}.
 */
public record ExtractedMemory(
    String type, // fact|preference|commitment|episodic|entity
    String content,
    Double confidence, // 0.0 to 1.0
    String importanceLevel, // critical|high|medium|low
    List<String> tags,
    List<String> entities) {}
