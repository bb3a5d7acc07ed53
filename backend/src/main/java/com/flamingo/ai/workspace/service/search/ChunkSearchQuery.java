package com.flamingo.ai.workspace.service.search;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Chunk-level search request. Null numeric fields fall back to {@code workspace.hybrid-search}
 * defaults.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ChunkSearchQuery {

  private final String query;

  /** Exact-match filter on vector metadata keys such as {@code artifact_id}. */
  @Builder.Default private final Map<String, Object> filters = Map.of();

  private final Double threshold;
  private final Integer limit;
  private final Integer preN;
  private final Integer nextN;

  /** Whether to apply the configured reranker. */
  @Builder.Default private final boolean rerank = true;

  /** Minimum rerank score, or null to keep every reranked result. */
  private final Double rerankThreshold;
}
