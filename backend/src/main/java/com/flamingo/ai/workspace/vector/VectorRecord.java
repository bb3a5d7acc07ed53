package com.flamingo.ai.workspace.vector;

import java.util.List;

/**
 * A stored embedding with the text it was computed from.
 *
 * @param id record id, the chunk id or artifact id
 * @param embedding vector; may be empty on records read back from a store
 * @param content source text
 * @param metadata identity of the chunk or artifact
 */
public record VectorRecord(
    String id, List<Float> embedding, String content, VectorMetadata metadata) {

  public VectorRecord {
    embedding = embedding == null ? List.of() : List.copyOf(embedding);
    content = content == null ? "" : content;
  }

  /** Copy without the vector, as returned by searches. */
  public VectorRecord withoutEmbedding() {
    return new VectorRecord(id, List.of(), content, metadata);
  }
}
