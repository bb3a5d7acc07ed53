package com.flamingo.ai.workspace.service.workspace;

import java.util.List;

/**
 * Outcome of {@link WorkspaceService#rebuildIndex()}.
 *
 * @param artifactsIndexed artifacts and sub-artifacts whose index entries were rewritten
 * @param vectorsWritten vector records written
 * @param failedArtifactIds artifacts whose indexing failed; re-running the rebuild retries them
 * @param durationMs wall-clock time of the rebuild
 */
public record RebuildReport(
    int artifactsIndexed, int vectorsWritten, List<String> failedArtifactIds, long durationMs) {

  public boolean isComplete() {
    return failedArtifactIds.isEmpty();
  }
}
