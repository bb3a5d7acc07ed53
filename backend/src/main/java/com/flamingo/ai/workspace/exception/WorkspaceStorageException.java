package com.flamingo.ai.workspace.exception;

/** Exception thrown when a read or write against the artifact repository fails. */
public class WorkspaceStorageException extends RuntimeException {

  private final String path;

  public WorkspaceStorageException(String path, String message, Throwable cause) {
    super(message + " [" + path + "]", cause);
    this.path = path;
  }

  public String getPath() {
    return path;
  }

  public String getUserMessage() {
    return "Workspace storage is temporarily unavailable. Please try again.";
  }
}
