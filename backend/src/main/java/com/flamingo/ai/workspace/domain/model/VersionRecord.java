package com.flamingo.ai.workspace.domain.model;

import com.flamingo.ai.workspace.domain.enums.ArtifactStatus;

/**
 * Snapshot appended to an artifact's history on every state change.
 *
 * @param timestamp ISO-8601 instant of the change
 * @param description human readable reason
 * @param content content at the time of the change
 * @param status status after the change
 */
public record VersionRecord(
    String timestamp, String description, String content, ArtifactStatus status) {}
