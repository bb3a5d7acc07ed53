package com.flamingo.ai.workspace.api.dto.request;

import com.flamingo.ai.workspace.domain.enums.ArtifactType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a root artifact. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateArtifactRequest {

  @NotNull(message = "Artifact type is required")
  private ArtifactType type;

  /** Optional; generated when absent. Used as a storage path segment. */
  @Pattern(regexp = "[A-Za-z0-9._-]+", message = "Artifact id may only contain [A-Za-z0-9._-]")
  private String artifactId;

  private String content;

  private Map<String, Object> metadata;
}
