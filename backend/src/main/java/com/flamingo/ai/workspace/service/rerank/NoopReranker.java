package com.flamingo.ai.workspace.service.rerank;

import java.util.List;

/** Keeps the retrieval order and scores. */
public class NoopReranker implements Reranker {

  public static final String STRATEGY = "none";

  @Override
  public String getStrategy() {
    return STRATEGY;
  }

  @Override
  public List<ScoredCandidate> rerank(
      String query, List<Candidate> candidates, int topN, Double threshold) {
    return candidates.stream()
        .filter(c -> threshold == null || c.score() >= threshold)
        .limit(Math.max(0, topN))
        .map(c -> new ScoredCandidate(c, c.score()))
        .toList();
  }
}
