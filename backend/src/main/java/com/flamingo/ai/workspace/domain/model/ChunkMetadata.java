package com.flamingo.ai.workspace.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Identity and sizing information stamped on every chunk. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChunkMetadata {

  @JsonProperty("chunk_index")
  private int chunkIndex;

  @JsonProperty("chunk_size")
  private int chunkSize;

  @JsonProperty("chunk_overlap")
  private int chunkOverlap;

  @JsonProperty("artifact_id")
  @Builder.Default
  private String artifactId = "";

  @JsonProperty("artifact_type")
  @Builder.Default
  private String artifactType = "";

  /** Empty or null for chunks of root artifacts. */
  @JsonProperty("parent_artifact_id")
  private String parentArtifactId;
}
