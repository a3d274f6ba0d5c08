package com.flamingo.ai.recall.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.LinkedHashSet;
import java.util.Set;

/** Tag and entity sets, insertion order preserved. */
@Converter
public class StringSetConverter extends JsonColumnConverter<Set<String>> {

  public StringSetConverter() {
    super(new TypeReference<LinkedHashSet<String>>() {});
  }

  @Override
  protected Set<String> absent() {
    return new LinkedHashSet<>();
  }

  @Override
  protected boolean isEmpty(Set<String> attribute) {
    return attribute.isEmpty();
  }
}
