package com.flamingo.ai.workspace.service.workspace;

import com.flamingo.ai.workspace.domain.model.Artifact;

/** An artifact matched by an artifact-level search, with its best similarity score. */
public record ArtifactSearchResult(Artifact artifact, double score) {}
