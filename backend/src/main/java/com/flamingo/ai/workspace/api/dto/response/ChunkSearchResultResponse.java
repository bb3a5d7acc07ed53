package com.flamingo.ai.workspace.api.dto.response;

import com.flamingo.ai.workspace.service.search.ChunkSearchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one windowed search hit. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkSearchResultResponse {

  private ChunkResponse chunk;
  private List<ChunkResponse> preNChunks;
  private List<ChunkResponse> nextNChunks;
  private double score;

  public static ChunkSearchResultResponse fromResult(ChunkSearchResult result) {
    return ChunkSearchResultResponse.builder()
        .chunk(ChunkResponse.fromChunk(result.chunk()))
        .preNChunks(ChunkResponse.fromChunks(result.preNChunks()))
        .nextNChunks(ChunkResponse.fromChunks(result.nextNChunks()))
        .score(result.score())
        .build();
  }
}
