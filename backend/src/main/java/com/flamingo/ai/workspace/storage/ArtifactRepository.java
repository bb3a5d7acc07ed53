package com.flamingo.ai.workspace.storage;

import com.flamingo.ai.workspace.domain.model.Artifact;
import com.flamingo.ai.workspace.domain.model.Chunk;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists artifact trees and their chunk sequences.
 *
 * <p>All backends share the same layout relative to the workspace root:
 *
 * <pre>
 * index.json
 * versions/index_his_{unix_seconds}.json
 * artifacts/{artifact_id}/index.json
 * artifacts/{artifact_id}/sublist/{sub_id}/origin.{ext}
 * artifacts/{artifact_id}/chunks/{artifact_id}_chunk_{n}.json
 * artifacts/{parent_id}/sublist/{artifact_id}/chunks/{artifact_id}_chunk_{n}.json
 * artifacts/{artifact_id}/attachment_files/{file_name}
 * </pre>
 *
 * <p>Lookups return empty results for missing data and never throw for "not found". I/O failures
 * surface as {@link com.flamingo.ai.workspace.exception.WorkspaceStorageException}. Chunk rewrites
 * of the same artifact must be serialized by the caller.
 */
public interface ArtifactRepository {

  /**
   * Stores workspace-level data as {@code {"workspace": data}} in {@code index.json}. An existing
   * index is first moved to {@code versions/index_his_{unix_seconds}.json}.
   */
  void storeIndex(Map<String, Object> data);

  /** Returns the full content of {@code index.json}, or empty when it does not exist. */
  Optional<Map<String, Object>> getIndexData();

  /**
   * Writes the artifact descriptor to {@code artifacts/{id}/index.json}.
   *
   * @param artifact the artifact to store
   * @param saveSubListContent write each sub-artifact's content to its own {@code origin} file and
   *     clear it from the embedded descriptor
   * @param saveAttachmentFiles copy the artifact's attachment files into storage
   */
  void storeArtifact(Artifact artifact, boolean saveSubListContent, boolean saveAttachmentFiles);

  default void storeArtifact(Artifact artifact) {
    storeArtifact(artifact, true, true);
  }

  /** Reads the descriptor stored for a root artifact. */
  Optional<Map<String, Object>> retrieveArtifact(String artifactId);

  /** Reads the raw content stored for a sub-artifact. */
  Optional<String> getSubArtifactContent(String artifactId, String parentId);

  /** Reads an attachment file stored for an artifact. */
  Optional<byte[]> getAttachmentFile(String artifactId, String fileName);

  /**
   * Replaces the artifact's whole chunk directory with the given chunks. No chunk file from an
   * earlier write survives.
   */
  void storeArtifactChunks(Artifact artifact, List<Chunk> chunks);

  /** Reads every chunk of an artifact, in no particular order. */
  List<Chunk> getChunks(String artifactId, String parentId);

  /**
   * Reads the chunk at {@code chunkIndex} and up to {@code preN}/{@code nextN} neighbours on each
   * side. Expansion in each direction stops at the first missing chunk.
   *
   * @return the window, or {@link ChunkWindow#empty()} when the target chunk does not exist
   */
  ChunkWindow getChunkWindow(
      String artifactId, String parentId, int chunkIndex, int preN, int nextN);
}
