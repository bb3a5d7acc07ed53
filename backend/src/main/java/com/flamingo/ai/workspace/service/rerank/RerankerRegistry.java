package com.flamingo.ai.workspace.service.rerank;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Resolves the configured rerank strategy once at startup. */
@Component
@Slf4j
public class RerankerRegistry {

  static final String RESILIENCE_NAME = "reranker";

  private final Reranker reranker;

  public RerankerRegistry(
      WorkspaceConfig workspaceConfig,
      CircuitBreakerRegistry circuitBreakerRegistry,
      RetryRegistry retryRegistry,
      MeterRegistry meterRegistry) {
    Map<String, Function<WorkspaceConfig.Reranking, Reranker>> providers =
        Map.of(
            NoopReranker.STRATEGY,
            config -> new NoopReranker(),
            Bm25Reranker.STRATEGY,
            config -> new Bm25Reranker(config.getBm25().getK1(), config.getBm25().getB()),
            HttpReranker.STRATEGY,
            config ->
                new HttpReranker(
                    new HttpRerankerClient(config.getHttp()),
                    circuitBreakerRegistry.circuitBreaker(RESILIENCE_NAME),
                    retryRegistry.retry(RESILIENCE_NAME),
                    meterRegistry));
    WorkspaceConfig.Reranking reranking = workspaceConfig.getReranking();
    Function<WorkspaceConfig.Reranking, Reranker> constructor =
        providers.get(reranking.getStrategy());
    if (constructor == null) {
      throw new IllegalArgumentException(
          "Unsupported rerank strategy '"
              + reranking.getStrategy()
              + "', expected one of "
              + providers.keySet());
    }
    this.reranker = constructor.apply(reranking);
    log.info("Reranker initialized: strategy={}", reranker.getStrategy());
  }

  public Reranker getReranker() {
    return reranker;
  }
}
