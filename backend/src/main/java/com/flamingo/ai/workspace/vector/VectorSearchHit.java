package com.flamingo.ai.workspace.vector;

/**
 * A search hit with its similarity score in {@code [0, 1]}, higher is closer.
 */
public record VectorSearchHit(VectorRecord record, double score) {}
