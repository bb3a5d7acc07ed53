package com.flamingo.ai.workspace.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A contiguous, index-addressed segment of an artifact's content.
 *
 * <p>Storage identity is fully determined by the owning artifact id and {@code chunkIndex}; see
 * {@link #fileName(String, int)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Chunk {

  @JsonProperty("chunk_id")
  private String chunkId;

  @JsonProperty("chunk_metadata")
  @Builder.Default
  private ChunkMetadata chunkMetadata = new ChunkMetadata();

  @Builder.Default private String content = "";

  /** Builds the chunk id used for the chunk at {@code index} of an artifact. */
  public static String chunkId(String artifactId, int index) {
    return artifactId + "_chunk_" + index;
  }

  /** Builds the storage file name of the chunk at {@code index} of an artifact. */
  public static String fileName(String artifactId, int index) {
    return chunkId(artifactId, index) + ".json";
  }

  @JsonIgnore
  public String getArtifactId() {
    return chunkMetadata.getArtifactId();
  }

  @JsonIgnore
  public String getParentArtifactId() {
    return chunkMetadata.getParentArtifactId();
  }

  @JsonIgnore
  public int getChunkIndex() {
    return chunkMetadata.getChunkIndex();
  }

  @JsonIgnore
  public String getFileName() {
    return fileName(getArtifactId(), getChunkIndex());
  }
}
