package com.flamingo.ai.workspace.api.dto.response;

import com.flamingo.ai.workspace.service.workspace.ArtifactSearchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an artifact-level search hit. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactSearchResultResponse {

  private ArtifactResponse artifact;
  private double score;

  public static ArtifactSearchResultResponse fromResult(ArtifactSearchResult result) {
    return ArtifactSearchResultResponse.builder()
        .artifact(ArtifactResponse.fromArtifact(result.artifact()))
        .score(result.score())
        .build();
  }
}
