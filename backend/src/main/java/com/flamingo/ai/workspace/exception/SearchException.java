package com.flamingo.ai.workspace.exception;

/** Exception thrown when a vector or full-text backend call fails. */
public class SearchException extends RuntimeException {

  /** Index or index pattern the failing call targeted. */
  private final String index;

  public SearchException(String index, String message, Throwable cause) {
    super(message + " [" + index + "]", cause);
    this.index = index;
  }

  public String getIndex() {
    return index;
  }

  public String getUserMessage() {
    return "Retrieval is temporarily unavailable. Please try again.";
  }
}
