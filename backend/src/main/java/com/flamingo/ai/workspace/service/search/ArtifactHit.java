package com.flamingo.ai.workspace.service.search;

/**
 * Best vector match for one artifact.
 *
 * @param parentId empty for root artifacts
 * @param matchedChunkId chunk that produced the match, or null when the whole artifact was embedded
 */
public record ArtifactHit(
    String artifactId, String parentId, String artifactType, String matchedChunkId, double score) {}
