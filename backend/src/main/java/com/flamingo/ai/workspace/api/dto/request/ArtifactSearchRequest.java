package com.flamingo.ai.workspace.api.dto.request;

import com.flamingo.ai.workspace.domain.enums.ArtifactType;
import com.flamingo.ai.workspace.service.search.ArtifactSearchQuery;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for artifact-level search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactSearchRequest {

  @NotBlank(message = "Query is required")
  private String query;

  private List<ArtifactType> types;

  @Min(value = 1, message = "Limit must be at least 1")
  @Max(value = 100, message = "Limit must not exceed 100")
  private Integer limit;

  @DecimalMin(value = "0.0", message = "Threshold must be at least 0")
  @DecimalMax(value = "1.0", message = "Threshold must be at most 1")
  private Double threshold;

  public ArtifactSearchQuery toQuery() {
    return ArtifactSearchQuery.builder()
        .query(query)
        .filterTypes(types == null ? Set.of() : Set.copyOf(types))
        .limit(limit)
        .threshold(threshold)
        .build();
  }
}
