package com.flamingo.ai.workspace.exception;

/** Exception thrown when the embedding provider cannot produce a vector. */
public class EmbeddingException extends RuntimeException {

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return "Embedding service is temporarily unavailable. Please try again.";
  }
}
