package com.flamingo.ai.workspace.service.search;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import com.flamingo.ai.workspace.domain.enums.ArtifactType;
import com.flamingo.ai.workspace.domain.model.Chunk;
import com.flamingo.ai.workspace.exception.WorkspaceStorageException;
import com.flamingo.ai.workspace.fulltext.FulltextHit;
import com.flamingo.ai.workspace.fulltext.FulltextStore;
import com.flamingo.ai.workspace.service.embedding.EmbeddingService;
import com.flamingo.ai.workspace.service.rerank.NoopReranker;
import com.flamingo.ai.workspace.service.rerank.Reranker;
import com.flamingo.ai.workspace.service.rerank.RerankerRegistry;
import com.flamingo.ai.workspace.storage.ArtifactRepository;
import com.flamingo.ai.workspace.storage.ChunkWindow;
import com.flamingo.ai.workspace.vector.VectorMetadata;
import com.flamingo.ai.workspace.vector.VectorSearchHit;
import com.flamingo.ai.workspace.vector.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval: embeds the query, runs a vector search over the workspace collection, expands
 * every hit into its chunk window and optionally reranks the results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridSearchService {

  /** Artifact search over-fetches so that deduplication still fills the limit. */
  private static final int ARTIFACT_CANDIDATE_MULTIPLIER = 3;

  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final ArtifactRepository artifactRepository;
  private final RerankerRegistry rerankerRegistry;
  private final FulltextStore fulltextStore;
  private final WorkspaceConfig workspaceConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Searches chunks and returns each match with its surrounding chunks.
   *
   * @param query the search request
   * @return ranked results; empty when hybrid search, chunking or embedding is disabled
   * @throws IllegalArgumentException for a malformed query, before any backend is called
   */
  @Timed(value = "workspace.search.chunks", description = "Time for chunk search")
  public List<ChunkSearchResult> searchChunks(ChunkSearchQuery query) {
    WorkspaceConfig.HybridSearch defaults = workspaceConfig.getHybridSearch();
    String text = query.getQuery();
    int limit = orDefault(query.getLimit(), defaults.getTopK());
    double threshold = orDefault(query.getThreshold(), defaults.getThreshold());
    int preN = orDefault(query.getPreN(), defaults.getPreN());
    int nextN = orDefault(query.getNextN(), defaults.getNextN());
    validate(text, limit, threshold);
    if (preN < 0 || nextN < 0) {
      throw new IllegalArgumentException(
          "preN and nextN must not be negative, got preN=" + preN + ", nextN=" + nextN);
    }

    if (!searchAvailable() || !workspaceConfig.getChunking().isEnabled()) {
      log.debug("Chunk search skipped: hybrid search, chunking or embedding disabled");
      return List.of();
    }

    String collection = workspaceConfig.getId();
    log.debug(
        "Starting chunk search in {} with query: {} (limit={}, threshold={}, preN={}, nextN={})",
        collection,
        text,
        limit,
        threshold,
        preN,
        nextN);
    List<Float> queryEmbedding = embeddingService.embedQuery(text);
    List<VectorSearchHit> hits =
        vectorStore.search(
            collection, List.of(queryEmbedding), query.getFilters(), limit, threshold);
    log.debug("Vector search returned {} hits", hits.size());

    List<ChunkSearchResult> results = new ArrayList<>();
    Set<String> seenChunkIds = new HashSet<>();
    for (VectorSearchHit hit : hits) {
      VectorMetadata metadata = hit.record().metadata();
      if (metadata == null || !metadata.isChunk()) {
        log.debug("Skipping non-chunk hit {}", hit.record().id());
        continue;
      }
      if (!seenChunkIds.add(metadata.chunkId())) {
        log.debug("Skipping duplicate chunk {}", metadata.chunkId());
        continue;
      }
      resolveWindow(metadata, preN, nextN)
          .ifPresent(window -> results.add(toResult(window, hit.score())));
    }

    List<ChunkSearchResult> ranked = query.isRerank() ? rerank(text, results, query) : results;
    meterRegistry.counter("workspace.search.success", "type", "chunk").increment();
    log.debug("Chunk search returned {} results", ranked.size());
    return ranked;
  }

  /**
   * Searches the workspace and returns the best match per artifact.
   *
   * @throws IllegalArgumentException for a malformed query, before any backend is called
   */
  @Timed(value = "workspace.search.artifacts", description = "Time for artifact search")
  public List<ArtifactHit> searchArtifacts(ArtifactSearchQuery query) {
    WorkspaceConfig.HybridSearch defaults = workspaceConfig.getHybridSearch();
    int limit = orDefault(query.getLimit(), defaults.getTopK());
    double threshold = orDefault(query.getThreshold(), defaults.getThreshold());
    validate(query.getQuery(), limit, threshold);

    if (!searchAvailable()) {
      log.debug("Artifact search skipped: hybrid search or embedding disabled");
      return List.of();
    }

    List<Float> queryEmbedding = embeddingService.embedQuery(query.getQuery());
    List<VectorSearchHit> hits =
        vectorStore.search(
            workspaceConfig.getId(),
            List.of(queryEmbedding),
            Map.of(),
            limit * ARTIFACT_CANDIDATE_MULTIPLIER,
            threshold);

    Map<String, ArtifactHit> byArtifact = new LinkedHashMap<>();
    for (VectorSearchHit hit : hits) {
      VectorMetadata metadata = hit.record().metadata();
      if (metadata == null || metadata.artifactId() == null) {
        continue;
      }
      if (!matchesTypes(metadata.artifactType(), query.getFilterTypes())) {
        continue;
      }
      if (byArtifact.size() >= limit && !byArtifact.containsKey(metadata.artifactId())) {
        continue;
      }
      byArtifact.putIfAbsent(
          metadata.artifactId(),
          new ArtifactHit(
              metadata.artifactId(),
              metadata.parentId() == null ? "" : metadata.parentId(),
              metadata.artifactType(),
              metadata.chunkId(),
              hit.score()));
    }
    meterRegistry.counter("workspace.search.success", "type", "artifact").increment();
    return List.copyOf(byArtifact.values());
  }

  /**
   * Lexical search over the full-text index. Empty when full-text indexing is disabled.
   *
   * @throws IllegalArgumentException for a blank query or a non-positive limit
   */
  @Timed(value = "workspace.search.keywords", description = "Time for keyword search")
  public List<FulltextHit> searchKeywords(String query, int limit, int offset) {
    validate(query, limit, 0.0);
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative, got " + offset);
    }
    return fulltextStore.search(workspaceConfig.getId(), query, Map.of(), limit, offset);
  }

  private boolean searchAvailable() {
    return workspaceConfig.getHybridSearch().isEnabled() && embeddingService.isEnabled();
  }

  private Optional<ChunkWindow> resolveWindow(
      VectorMetadata metadata, int preN, int nextN) {
    try {
      ChunkWindow window =
          artifactRepository.getChunkWindow(
              metadata.artifactId(),
              metadata.parentId() == null ? "" : metadata.parentId(),
              metadata.chunkIndex(),
              preN,
              nextN);
      if (window.isEmpty()) {
        log.warn(
            "Chunk {} of artifact {} not found in repository, skipping hit",
            metadata.chunkIndex(),
            metadata.artifactId());
        meterRegistry.counter("workspace.search.unresolved").increment();
        return Optional.empty();
      }
      return Optional.of(window);
    } catch (WorkspaceStorageException e) {
      log.warn(
          "Failed to load window for chunk {} of artifact {}, skipping hit: {}",
          metadata.chunkIndex(),
          metadata.artifactId(),
          e.getMessage());
      meterRegistry.counter("workspace.search.unresolved").increment();
      return Optional.empty();
    }
  }

  private static ChunkSearchResult toResult(ChunkWindow window, double score) {
    return new ChunkSearchResult(
        window.chunk(), window.preChunks(), window.nextChunks(), score);
  }

  private List<ChunkSearchResult> rerank(
      String query, List<ChunkSearchResult> results, ChunkSearchQuery request) {
    Reranker reranker = rerankerRegistry.getReranker();
    if (results.isEmpty() || NoopReranker.STRATEGY.equals(reranker.getStrategy())) {
      return results;
    }
    Map<String, ChunkSearchResult> byChunkId = new HashMap<>();
    List<Reranker.Candidate> candidates = new ArrayList<>(results.size());
    for (ChunkSearchResult result : results) {
      Chunk chunk = result.chunk();
      byChunkId.put(chunk.getChunkId(), result);
      candidates.add(new Reranker.Candidate(chunk.getChunkId(), chunk.getContent(), result.score()));
    }
    List<ChunkSearchResult> reranked = new ArrayList<>();
    for (Reranker.ScoredCandidate scored :
        reranker.rerank(query, candidates, results.size(), request.getRerankThreshold())) {
      reranked.add(byChunkId.get(scored.candidate().id()).withScore(scored.score()));
    }
    log.debug(
        "{} reranking kept {} of {} results", reranker.getStrategy(), reranked.size(), results.size());
    return reranked;
  }

  private static boolean matchesTypes(String artifactType, Set<ArtifactType> filterTypes) {
    if (filterTypes == null || filterTypes.isEmpty()) {
      return true;
    }
    return artifactType != null
        && filterTypes.stream().anyMatch(type -> type.name().equals(artifactType));
  }

  private static void validate(String text, int limit, double threshold) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive, got " + limit);
    }
    if (threshold < 0.0 || threshold > 1.0) {
      throw new IllegalArgumentException("threshold must be within [0, 1], got " + threshold);
    }
  }

  private static int orDefault(Integer value, int fallback) {
    return value == null ? fallback : value;
  }

  private static double orDefault(Double value, double fallback) {
    return value == null ? fallback : value;
  }
}
