package com.flamingo.ai.workspace.service.workspace;

import com.flamingo.ai.workspace.domain.model.Artifact;
import java.time.Instant;

/** Change to an artifact of a workspace, delivered after the change is persisted. */
public record WorkspaceEvent(Type type, String workspaceId, Artifact artifact, Instant timestamp) {

  public enum Type {
    CREATED,
    UPDATED,
    DELETED
  }

  public static WorkspaceEvent of(Type type, String workspaceId, Artifact artifact) {
    return new WorkspaceEvent(type, workspaceId, artifact, Instant.now());
  }
}
