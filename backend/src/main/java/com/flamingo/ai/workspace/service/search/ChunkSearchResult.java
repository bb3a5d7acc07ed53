package com.flamingo.ai.workspace.service.search;

import com.flamingo.ai.workspace.domain.model.Chunk;
import java.util.List;

/**
 * A matched chunk with its neighbours.
 *
 * @param preNChunks preceding chunks, nearest first; shorter at the start of the artifact
 * @param nextNChunks following chunks in ascending order; shorter at the end of the artifact
 * @param score vector similarity, or the rerank score when reranking ran
 */
public record ChunkSearchResult(
    Chunk chunk, List<Chunk> preNChunks, List<Chunk> nextNChunks, double score) {

  public ChunkSearchResult withScore(double newScore) {
    return new ChunkSearchResult(chunk, preNChunks, nextNChunks, newScore);
  }
}
