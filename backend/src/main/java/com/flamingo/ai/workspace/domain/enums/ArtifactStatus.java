package com.flamingo.ai.workspace.domain.enums;

/** Lifecycle status of an artifact. */
public enum ArtifactStatus {
  /** Set on first construction. */
  DRAFT,

  /** Explicitly marked as finished. */
  COMPLETE,

  /** Content has been updated at least once. */
  EDITED,

  /** Soft-deleted. No further transitions are allowed. */
  ARCHIVED
}
