package com.flamingo.ai.recall.exception;

/** Exception thrown when LLM extraction output cannot be turned into a valid candidate memory. */
public class ExtractionParseException extends RuntimeException {

  private final String field;

  public ExtractionParseException(String field, String message) {
    super(message);
    this.field = field;
  }

  public ExtractionParseException(String message, Throwable cause) {
    super(message, cause);
    this.field = null;
  }

  /** The offending candidate field, or null when the whole response was unreadable. */
  public String getField() {
    return field;
  }
}
