package com.flamingo.ai.recall.service.extraction;

import com.flamingo.ai.recall.agent.dto.ExtractedMemory;
import com.flamingo.ai.recall.config.MemoryConfig;
import com.flamingo.ai.recall.domain.enums.ImportanceLevel;
import com.flamingo.ai.recall.domain.enums.MemoryType;
import com.flamingo.ai.recall.exception.ExtractionParseException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Turns raw LLM output into a {@link CandidateMemory}, rejecting anything out of range. */
@Component
@RequiredArgsConstructor
public class CandidateValidator {

  private final MemoryConfig memoryConfig;

  /**
   * Validates every field of one extracted item.
   *
   * @throws ExtractionParseException naming the first offending field
   */
  public CandidateMemory validate(ExtractedMemory raw) {
    if (raw == null) {
      throw new ExtractionParseException("candidate", "Candidate is null");
    }

    MemoryType type =
        MemoryType.parse(raw.type())
            .orElseThrow(
                () -> new ExtractionParseException("type", "Unknown memory type: " + raw.type()));

    String content = raw.content() == null ? "" : raw.content().trim();
    if (content.isEmpty()) {
      throw new ExtractionParseException("content", "Content is empty");
    }
    int maxLength = memoryConfig.getExtraction().getMaxContentLength();
    if (content.length() > maxLength) {
      throw new ExtractionParseException(
          "content", "Content exceeds " + maxLength + " chars: " + content.length());
    }

    Double confidence = raw.confidence();
    if (confidence == null || confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
      throw new ExtractionParseException("confidence", "Confidence out of range: " + confidence);
    }
    double minConfidence = memoryConfig.getExtraction().getMinConfidence();
    if (confidence < minConfidence) {
      throw new ExtractionParseException(
          "confidence", "Confidence " + confidence + " below minimum " + minConfidence);
    }

    ImportanceLevel importance =
        ImportanceLevel.parse(raw.importanceLevel())
            .orElseThrow(
                () ->
                    new ExtractionParseException(
                        "importanceLevel", "Unknown importance level: " + raw.importanceLevel()));

    return new CandidateMemory(
        type,
        content,
        confidence,
        importance,
        normalizeLabels(raw.tags()),
        normalizeLabels(raw.entities()),
        ContentHasher.hash(content));
  }

  private static Set<String> normalizeLabels(List<String> labels) {
    Set<String> result = new LinkedHashSet<>();
    if (labels == null) {
      return result;
    }
    for (String label : labels) {
      if (label != null && !label.isBlank()) {
        result.add(label.trim());
      }
    }
    return result;
  }
}
