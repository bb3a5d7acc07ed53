package com.flamingo.ai.workspace.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for replacing an artifact's content. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateArtifactRequest {

  @NotNull(message = "Content is required")
  private String content;

  @Size(max = 500, message = "Description must not exceed 500 characters")
  private String description;
}
