package com.flamingo.ai.recall.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.List;

/**
 * Embedding vector column. A vector that cannot be read back counts as missing, and the next
 * index attempt re-embeds the memory.
 */
@Converter
public class EmbeddingConverter extends JsonColumnConverter<List<Float>> {

  public EmbeddingConverter() {
    super(new TypeReference<List<Float>>() {});
  }

  @Override
  protected List<Float> absent() {
    return null;
  }

  @Override
  protected boolean isEmpty(List<Float> attribute) {
    return attribute.isEmpty();
  }
}
