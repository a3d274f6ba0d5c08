package com.flamingo.ai.recall.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores a collection attribute as a JSON array in a TEXT column.
 *
 * <p>Writing a value that Jackson cannot serialize is a programming error and fails the flush.
 * An unreadable column value is logged and mapped to {@link #absent()}.
 */
@Slf4j
abstract class JsonColumnConverter<T> implements AttributeConverter<T, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final TypeReference<? extends T> type;

  JsonColumnConverter(TypeReference<? extends T> type) {
    this.type = type;
  }

  /** Attribute value used for NULL, blank and unreadable columns. */
  protected abstract T absent();

  protected abstract boolean isEmpty(T attribute);

  @Override
  public String convertToDatabaseColumn(T attribute) {
    if (attribute == null || isEmpty(attribute)) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize column value", e);
    }
  }

  @Override
  public T convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return absent();
    }
    try {
      return MAPPER.readValue(dbData, type);
    } catch (JsonProcessingException e) {
      log.warn(
          "Unreadable {} column value, treating as absent: {}",
          getClass().getSimpleName(),
          e.getOriginalMessage());
      return absent();
    }
  }
}
