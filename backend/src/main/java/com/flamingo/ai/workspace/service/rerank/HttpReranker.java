package com.flamingo.ai.workspace.service.rerank;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Reranker backed by an external cross-encoder service. When the service fails the candidates are
 * returned in their incoming order with their retrieval scores.
 */
@Slf4j
public class HttpReranker implements Reranker {

  public static final String STRATEGY = "http";

  private final HttpRerankerClient client;
  private final CircuitBreaker circuitBreaker;
  private final Retry retry;
  private final MeterRegistry meterRegistry;

  public HttpReranker(
      HttpRerankerClient client,
      CircuitBreaker circuitBreaker,
      Retry retry,
      MeterRegistry meterRegistry) {
    this.client = client;
    this.circuitBreaker = circuitBreaker;
    this.retry = retry;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public String getStrategy() {
    return STRATEGY;
  }

  @Override
  public List<ScoredCandidate> rerank(
      String query, List<Candidate> candidates, int topN, Double threshold) {
    if (candidates.isEmpty() || topN <= 0) {
      log.debug("No candidates to rerank");
      return List.of();
    }
    List<String> texts = candidates.stream().map(Candidate::content).toList();
    Supplier<List<HttpRerankerClient.RerankResult>> call =
        () -> client.rerank(query, texts, topN, threshold);

    List<HttpRerankerClient.RerankResult> results;
    try {
      results =
          Retry.decorateSupplier(retry, CircuitBreaker.decorateSupplier(circuitBreaker, call))
              .get();
    } catch (RuntimeException e) {
      return fallback(candidates, topN, e);
    }

    List<ScoredCandidate> scored = new ArrayList<>();
    for (HttpRerankerClient.RerankResult result : results) {
      if (result.index() < 0 || result.index() >= candidates.size()) {
        log.warn("Rerank result index {} out of range, skipping", result.index());
        continue;
      }
      if (threshold != null && result.score() < threshold) {
        continue;
      }
      scored.add(new ScoredCandidate(candidates.get(result.index()), result.score()));
    }
    scored.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
    meterRegistry.counter("rerank.http.invocations").increment();
    log.debug(
        "HTTP reranking complete, {} results, top score: {}",
        scored.size(),
        scored.isEmpty() ? "N/A" : String.format("%.3f", scored.get(0).score()));
    return scored.size() > topN ? List.copyOf(scored.subList(0, topN)) : scored;
  }

  /** Keeps the retrieval ordering; it is already a reasonable ranking. */
  private List<ScoredCandidate> fallback(List<Candidate> candidates, int topN, Throwable t) {
    log.warn("HTTP reranker unavailable, using retrieval scores as fallback: {}", t.getMessage());
    meterRegistry.counter("rerank.http.fallback").increment();
    return candidates.stream()
        .limit(topN)
        .map(candidate -> new ScoredCandidate(candidate, candidate.score()))
        .toList();
  }
}
