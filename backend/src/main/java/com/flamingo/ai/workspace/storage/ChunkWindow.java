package com.flamingo.ai.workspace.storage;

import com.flamingo.ai.workspace.domain.model.Chunk;
import java.util.List;
import java.util.Optional;

/**
 * A target chunk together with its sequence neighbours.
 *
 * @param preChunks preceding chunks, nearest first ({@code i-1, i-2, ...})
 * @param chunk the target chunk, or {@code null} when it does not exist
 * @param nextChunks following chunks in ascending index order
 */
public record ChunkWindow(List<Chunk> preChunks, Chunk chunk, List<Chunk> nextChunks) {

  private static final ChunkWindow EMPTY = new ChunkWindow(List.of(), null, List.of());

  public static ChunkWindow empty() {
    return EMPTY;
  }

  public Optional<Chunk> target() {
    return Optional.ofNullable(chunk);
  }

  public boolean isEmpty() {
    return chunk == null;
  }
}
