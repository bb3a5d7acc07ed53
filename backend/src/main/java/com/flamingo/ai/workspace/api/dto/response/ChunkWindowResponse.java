package com.flamingo.ai.workspace.api.dto.response;

import com.flamingo.ai.workspace.storage.ChunkWindow;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chunk and its neighbours, preceding chunks nearest first. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkWindowResponse {

  private List<ChunkResponse> preChunks;
  private ChunkResponse chunk;
  private List<ChunkResponse> nextChunks;

  public static ChunkWindowResponse fromWindow(ChunkWindow window) {
    return ChunkWindowResponse.builder()
        .preChunks(ChunkResponse.fromChunks(window.preChunks()))
        .chunk(ChunkResponse.fromChunk(window.chunk()))
        .nextChunks(ChunkResponse.fromChunks(window.nextChunks()))
        .build();
  }
}
