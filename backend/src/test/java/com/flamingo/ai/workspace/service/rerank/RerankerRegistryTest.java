package com.flamingo.ai.workspace.service.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RerankerRegistryTest {

  @Mock private MeterRegistry meterRegistry;

  private RerankerRegistry registry(String strategy) {
    WorkspaceConfig config = new WorkspaceConfig();
    config.getReranking().setStrategy(strategy);
    return new RerankerRegistry(
        config, CircuitBreakerRegistry.ofDefaults(), RetryRegistry.ofDefaults(), meterRegistry);
  }

  @ParameterizedTest
  @ValueSource(strings = {"none", "bm25", "http"})
  @DisplayName("should build the configured strategy")
  void shouldBuildStrategy(String strategy) {
    assertThat(registry(strategy).getReranker().getStrategy()).isEqualTo(strategy);
  }

  @Test
  @DisplayName("should reject an unknown strategy at startup")
  void shouldRejectUnknownStrategy() {
    assertThatThrownBy(() -> registry("cohere"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("cohere");
  }

  @Test
  @DisplayName("should keep retrieval order with the none strategy")
  void shouldKeepOrderWithNone() {
    Reranker reranker = registry("none").getReranker();

    assertThat(
            reranker.rerank(
                "q",
                List.of(
                    new Reranker.Candidate("a", "x", 0.9), new Reranker.Candidate("b", "y", 0.4)),
                5,
                0.5))
        .extracting(r -> r.candidate().id())
        .containsExactly("a");
  }
}
