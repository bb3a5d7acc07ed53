package com.flamingo.ai.workspace.fulltext;

import java.util.Map;

/** Lexical search hit; {@code score} is the backend's raw relevance score. */
public record FulltextHit(
    String id,
    double score,
    String content,
    String artifactId,
    String chunkId,
    Map<String, Object> metadata) {}
