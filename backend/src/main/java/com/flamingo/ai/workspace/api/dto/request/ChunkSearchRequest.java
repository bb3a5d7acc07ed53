package com.flamingo.ai.workspace.api.dto.request;

import com.flamingo.ai.workspace.service.search.ChunkSearchQuery;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for windowed chunk search. Omitted fields fall back to the configured defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkSearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 10000, message = "Query must not exceed 10000 characters")
  private String query;

  private Map<String, String> filters;

  @DecimalMin(value = "0.0", message = "Threshold must be at least 0")
  @DecimalMax(value = "1.0", message = "Threshold must be at most 1")
  private Double threshold;

  @Min(value = 1, message = "Limit must be at least 1")
  @Max(value = 100, message = "Limit must not exceed 100")
  private Integer limit;

  @Min(value = 0, message = "preN must not be negative")
  @Max(value = 20, message = "preN must not exceed 20")
  private Integer preN;

  @Min(value = 0, message = "nextN must not be negative")
  @Max(value = 20, message = "nextN must not exceed 20")
  private Integer nextN;

  private Boolean rerank;

  private Double rerankThreshold;

  /** Converts the request into a service query. */
  public ChunkSearchQuery toQuery() {
    return ChunkSearchQuery.builder()
        .query(query)
        .filters(filters == null ? Map.of() : Map.<String, Object>copyOf(filters))
        .threshold(threshold)
        .limit(limit)
        .preN(preN)
        .nextN(nextN)
        .rerank(rerank == null || rerank)
        .rerankThreshold(rerankThreshold)
        .build();
  }
}
