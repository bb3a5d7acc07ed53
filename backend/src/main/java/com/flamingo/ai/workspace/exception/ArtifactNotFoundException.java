package com.flamingo.ai.workspace.exception;

/** Raised by the REST layer when a requested artifact does not exist. */
public class ArtifactNotFoundException extends RuntimeException {

  private final String artifactId;

  public ArtifactNotFoundException(String artifactId) {
    super("Artifact not found: " + artifactId);
    this.artifactId = artifactId;
  }

  public String getArtifactId() {
    return artifactId;
  }
}
