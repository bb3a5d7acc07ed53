package com.flamingo.ai.workspace.api.rest;

import com.flamingo.ai.workspace.api.dto.request.ArtifactSearchRequest;
import com.flamingo.ai.workspace.api.dto.request.ChunkSearchRequest;
import com.flamingo.ai.workspace.api.dto.request.CreateArtifactRequest;
import com.flamingo.ai.workspace.api.dto.request.UpdateArtifactRequest;
import com.flamingo.ai.workspace.api.dto.response.ArtifactResponse;
import com.flamingo.ai.workspace.api.dto.response.ArtifactSearchResultResponse;
import com.flamingo.ai.workspace.api.dto.response.ChunkSearchResultResponse;
import com.flamingo.ai.workspace.api.dto.response.ChunkWindowResponse;
import com.flamingo.ai.workspace.domain.enums.ArtifactType;
import com.flamingo.ai.workspace.domain.model.Artifact;
import com.flamingo.ai.workspace.exception.ArtifactNotFoundException;
import com.flamingo.ai.workspace.fulltext.FulltextHit;
import com.flamingo.ai.workspace.service.search.HybridSearchService;
import com.flamingo.ai.workspace.service.workspace.RebuildReport;
import com.flamingo.ai.workspace.service.workspace.TreeNode;
import com.flamingo.ai.workspace.service.workspace.WorkspaceService;
import com.flamingo.ai.workspace.storage.ChunkWindow;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for artifacts, chunk windows and retrieval in the configured workspace. */
@RestController
@RequestMapping("/workspace")
@RequiredArgsConstructor
public class WorkspaceController {

  private final WorkspaceService workspaceService;
  private final HybridSearchService hybridSearchService;

  /** Creates a root artifact and indexes it. */
  @PostMapping("/artifacts")
  public ResponseEntity<ArtifactResponse> createArtifact(
      @Valid @RequestBody CreateArtifactRequest request) {
    Artifact artifact =
        workspaceService.createArtifact(
            request.getType(), request.getArtifactId(), request.getContent(), request.getMetadata());
    return ResponseEntity.status(HttpStatus.CREATED).body(ArtifactResponse.fromArtifact(artifact));
  }

  /** Lists root artifacts, optionally filtered by type. */
  @GetMapping("/artifacts")
  public ResponseEntity<List<ArtifactResponse>> listArtifacts(
      @RequestParam(name = "type", required = false) List<ArtifactType> types) {
    return ResponseEntity.ok(
        workspaceService.listArtifacts(types).stream().map(ArtifactResponse::fromArtifact).toList());
  }

  /** Gets an artifact, or a sub-artifact when {@code parentId} is given. */
  @GetMapping("/artifacts/{artifactId}")
  public ResponseEntity<ArtifactResponse> getArtifact(
      @PathVariable String artifactId, @RequestParam(required = false) String parentId) {
    Artifact artifact =
        workspaceService
            .getArtifact(artifactId, parentId)
            .orElseThrow(() -> new ArtifactNotFoundException(artifactId));
    return ResponseEntity.ok(ArtifactResponse.fromArtifact(artifact));
  }

  /** Replaces an artifact's content. */
  @PutMapping("/artifacts/{artifactId}")
  public ResponseEntity<ArtifactResponse> updateArtifact(
      @PathVariable String artifactId, @Valid @RequestBody UpdateArtifactRequest request) {
    Artifact artifact =
        workspaceService
            .updateArtifact(artifactId, request.getContent(), request.getDescription())
            .orElseThrow(() -> new ArtifactNotFoundException(artifactId));
    return ResponseEntity.ok(ArtifactResponse.fromArtifact(artifact));
  }

  /** Archives an artifact and removes it from the index. */
  @DeleteMapping("/artifacts/{artifactId}")
  public ResponseEntity<Void> deleteArtifact(@PathVariable String artifactId) {
    if (!workspaceService.deleteArtifact(artifactId)) {
      throw new ArtifactNotFoundException(artifactId);
    }
    return ResponseEntity.noContent().build();
  }

  /** Reads a chunk with up to {@code preN} preceding and {@code nextN} following chunks. */
  @GetMapping("/artifacts/{artifactId}/chunks/{chunkIndex}/window")
  public ResponseEntity<ChunkWindowResponse> getChunkWindow(
      @PathVariable String artifactId,
      @PathVariable int chunkIndex,
      @RequestParam(required = false) String parentId,
      @RequestParam(defaultValue = "0") int preN,
      @RequestParam(defaultValue = "0") int nextN) {
    ChunkWindow window =
        workspaceService.getChunkWindow(artifactId, parentId, chunkIndex, preN, nextN);
    if (window.isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(ChunkWindowResponse.fromWindow(window));
  }

  /** Semantic chunk search with neighbour expansion. */
  @PostMapping("/chunks/search")
  public ResponseEntity<List<ChunkSearchResultResponse>> searchChunks(
      @Valid @RequestBody ChunkSearchRequest request) {
    return ResponseEntity.ok(
        hybridSearchService.searchChunks(request.toQuery()).stream()
            .map(ChunkSearchResultResponse::fromResult)
            .toList());
  }

  /** Artifact-level search, one hit per artifact. */
  @PostMapping("/artifacts/search")
  public ResponseEntity<List<ArtifactSearchResultResponse>> searchArtifacts(
      @Valid @RequestBody ArtifactSearchRequest request) {
    return ResponseEntity.ok(
        workspaceService.retrieveArtifacts(request.toQuery()).stream()
            .map(ArtifactSearchResultResponse::fromResult)
            .toList());
  }

  /** Lexical search over the full-text index. */
  @GetMapping("/keywords/search")
  public ResponseEntity<List<FulltextHit>> searchKeywords(
      @RequestParam("q") String query,
      @RequestParam(defaultValue = "10") int limit,
      @RequestParam(defaultValue = "0") int offset) {
    return ResponseEntity.ok(hybridSearchService.searchKeywords(query, limit, offset));
  }

  @GetMapping("/tree")
  public ResponseEntity<TreeNode> getTree() {
    return ResponseEntity.ok(workspaceService.generateTreeData());
  }

  /** Re-chunks and re-embeds every artifact. */
  @PostMapping("/index/rebuild")
  public ResponseEntity<RebuildReport> rebuildIndex() {
    return ResponseEntity.ok(workspaceService.rebuildIndex());
  }
}
