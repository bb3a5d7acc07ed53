package com.flamingo.ai.workspace.vector;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * Identity carried by every vector record. Chunk fields are null for records that embed a whole
 * artifact.
 */
@Builder(toBuilder = true)
public record VectorMetadata(
    String artifactId,
    String parentId,
    String artifactType,
    String chunkId,
    Integer chunkIndex,
    Integer chunkSize,
    Integer chunkOverlap,
    String embeddingModel,
    String createdAt,
    String updatedAt) {

  public static final String ARTIFACT_ID = "artifact_id";
  public static final String PARENT_ID = "parent_id";
  public static final String ARTIFACT_TYPE = "artifact_type";
  public static final String CHUNK_ID = "chunk_id";
  public static final String CHUNK_INDEX = "chunk_index";
  public static final String CHUNK_SIZE = "chunk_size";
  public static final String CHUNK_OVERLAP = "chunk_overlap";
  public static final String EMBEDDING_MODEL = "embedding_model";
  public static final String CREATED_AT = "created_at";
  public static final String UPDATED_AT = "updated_at";

  /** Whether this record points at a chunk rather than a whole artifact. */
  public boolean isChunk() {
    return chunkId != null && chunkIndex != null;
  }

  /** Flat map form used as stored metadata and for filter matching. Null fields are omitted. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    putIfPresent(map, ARTIFACT_ID, artifactId);
    putIfPresent(map, PARENT_ID, parentId);
    putIfPresent(map, ARTIFACT_TYPE, artifactType);
    putIfPresent(map, CHUNK_ID, chunkId);
    putIfPresent(map, CHUNK_INDEX, chunkIndex);
    putIfPresent(map, CHUNK_SIZE, chunkSize);
    putIfPresent(map, CHUNK_OVERLAP, chunkOverlap);
    putIfPresent(map, EMBEDDING_MODEL, embeddingModel);
    putIfPresent(map, CREATED_AT, createdAt);
    putIfPresent(map, UPDATED_AT, updatedAt);
    return map;
  }

  private static void putIfPresent(Map<String, Object> map, String key, Object value) {
    if (value != null) {
      map.put(key, value);
    }
  }
}
