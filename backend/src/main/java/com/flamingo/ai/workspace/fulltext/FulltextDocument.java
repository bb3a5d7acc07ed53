package com.flamingo.ai.workspace.fulltext;

import java.util.Map;

/** A chunk or artifact text indexed for lexical search. */
public record FulltextDocument(
    String id, String content, String artifactId, String chunkId, Map<String, Object> metadata) {

  public FulltextDocument {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
