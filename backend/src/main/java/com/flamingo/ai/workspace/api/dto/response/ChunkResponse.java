package com.flamingo.ai.workspace.api.dto.response;

import com.flamingo.ai.workspace.domain.model.Chunk;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a single chunk. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private String chunkId;
  private String artifactId;
  private String parentArtifactId;
  private int chunkIndex;
  private String content;

  /** Creates a ChunkResponse from a Chunk. */
  public static ChunkResponse fromChunk(Chunk chunk) {
    return ChunkResponse.builder()
        .chunkId(chunk.getChunkId())
        .artifactId(chunk.getArtifactId())
        .parentArtifactId(chunk.getParentArtifactId())
        .chunkIndex(chunk.getChunkIndex())
        .content(chunk.getContent())
        .build();
  }

  static List<ChunkResponse> fromChunks(List<Chunk> chunks) {
    return chunks.stream().map(ChunkResponse::fromChunk).toList();
  }
}
