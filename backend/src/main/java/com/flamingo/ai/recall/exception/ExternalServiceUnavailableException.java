package com.flamingo.ai.recall.exception;

/** Exception thrown when a collaborator (LLM, embedding provider, index, store) cannot be reached. */
public class ExternalServiceUnavailableException extends RuntimeException {

  public static final String LLM = "llm";
  public static final String EMBEDDING = "embedding";
  public static final String INDEX = "elasticsearch";
  public static final String STORE = "durable-store";

  private final String service;

  public ExternalServiceUnavailableException(String service, String message) {
    super(message);
    this.service = service;
  }

  public ExternalServiceUnavailableException(String service, String message, Throwable cause) {
    super(message, cause);
    this.service = service;
  }

  public String getService() {
    return service;
  }
}
