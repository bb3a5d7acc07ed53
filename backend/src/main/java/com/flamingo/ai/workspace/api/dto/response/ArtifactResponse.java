package com.flamingo.ai.workspace.api.dto.response;

import com.flamingo.ai.workspace.domain.enums.ArtifactStatus;
import com.flamingo.ai.workspace.domain.enums.ArtifactType;
import com.flamingo.ai.workspace.domain.model.Artifact;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for artifact data. Sub-artifacts are listed by id only. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactResponse {

  private String artifactId;
  private String parentId;
  private ArtifactType artifactType;
  private ArtifactStatus status;
  private String content;
  private Map<String, Object> metadata;
  private String createdAt;
  private String updatedAt;
  private int versionCount;
  private List<String> subArtifactIds;

  /** Creates an ArtifactResponse from an Artifact. */
  public static ArtifactResponse fromArtifact(Artifact artifact) {
    return ArtifactResponse.builder()
        .artifactId(artifact.getArtifactId())
        .parentId(artifact.getParentId())
        .artifactType(artifact.getArtifactType())
        .status(artifact.getStatus())
        .content(artifact.getContent())
        .metadata(artifact.getMetadata())
        .createdAt(artifact.getCreatedAt())
        .updatedAt(artifact.getUpdatedAt())
        .versionCount(artifact.getVersionHistory().size())
        .subArtifactIds(artifact.getSublist().stream().map(Artifact::getArtifactId).toList())
        .build();
  }
}
