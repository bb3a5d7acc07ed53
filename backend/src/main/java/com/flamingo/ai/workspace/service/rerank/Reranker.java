package com.flamingo.ai.workspace.service.rerank;

import java.util.List;

/**
 * Reorders retrieved candidates by relevance to the query. Implementations may score lexically
 * (BM25) or call an external cross-encoder service.
 */
public interface Reranker {

  /**
   * Reranks candidates and returns the best {@code topN}.
   *
   * @param query the search query
   * @param candidates candidates in retrieval order
   * @param topN number of results to return
   * @param threshold minimum score, or null to keep every candidate
   * @return scored candidates sorted by score descending
   */
  List<ScoredCandidate> rerank(
      String query, List<Candidate> candidates, int topN, Double threshold);

  /** Strategy id, as configured in {@code workspace.reranking.strategy}. */
  String getStrategy();

  /**
   * A retrieved text with the score it was retrieved with.
   *
   * @param id caller-side identity, for example the chunk id
   */
  record Candidate(String id, String content, double score) {}

  /** A candidate paired with its rerank score. */
  record ScoredCandidate(Candidate candidate, double score) {}
}
