package com.flamingo.ai.workspace.service.search;

import com.flamingo.ai.workspace.domain.enums.ArtifactType;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Artifact-level search request; matches are deduplicated by artifact id. */
@Getter
@Builder
@ToString
public class ArtifactSearchQuery {

  private final String query;

  /** Artifact types to keep; empty keeps all. */
  @Builder.Default private final Set<ArtifactType> filterTypes = Set.of();

  private final Integer limit;
  private final Double threshold;
}
