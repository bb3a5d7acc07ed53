package com.flamingo.ai.workspace.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import com.flamingo.ai.workspace.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private WorkspaceConfig workspaceConfig;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);

    workspaceConfig = new WorkspaceConfig();
    embeddingService =
        new EmbeddingService(Optional.of(embeddingModel), workspaceConfig, meterRegistry);
  }

  @Nested
  @DisplayName("embedQuery")
  class EmbedQueryTests {

    @Test
    @DisplayName("should return the model vector and count the success")
    void shouldEmbedQuery() {
      when(embeddingModel.embed(anyString()))
          .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f})));

      List<Float> result = embeddingService.embedQuery("What is a chunk window?");

      assertThat(result).containsExactly(0.1f, 0.2f, 0.3f);
      verify(meterRegistry.counter("embedding.requests.success", "type", "query")).increment();
    }

    @Test
    @DisplayName("should truncate very long queries")
    void shouldTruncate() {
      when(embeddingModel.embed(anyString()))
          .thenReturn(Response.from(Embedding.from(new float[] {0.1f})));

      embeddingService.embedQuery("a".repeat(6000));

      ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
      verify(embeddingModel).embed(captor.capture());
      assertThat(captor.getValue()).hasSize(5000);
    }

    @Test
    @DisplayName("should wrap provider failures")
    void shouldWrapFailures() {
      when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("rate limited"));

      assertThatThrownBy(() -> embeddingService.embedQuery("q"))
          .isInstanceOf(EmbeddingException.class)
          .hasCauseInstanceOf(RuntimeException.class);
    }
  }

  @Nested
  @DisplayName("embedTexts")
  class EmbedTextsTests {

    @Test
    @DisplayName("should return one vector per input in order")
    void shouldEmbedBatch() {
      when(embeddingModel.embedAll(anyList()))
          .thenReturn(
              Response.from(
                  List.of(
                      Embedding.from(new float[] {1f, 0f}), Embedding.from(new float[] {0f, 1f}))));

      List<List<Float>> result = embeddingService.embedTexts(List.of("first", "second"));

      assertThat(result).containsExactly(List.of(1f, 0f), List.of(0f, 1f));
    }

    @Test
    @DisplayName("should reject a short provider response")
    void shouldRejectShortResponse() {
      List<Embedding> single = List.of(Embedding.from(new float[] {1f}));
      when(embeddingModel.embedAll(anyList())).thenReturn(Response.from(single));

      assertThatThrownBy(() -> embeddingService.embedTexts(List.of("a", "b")))
          .isInstanceOf(EmbeddingException.class)
          .hasMessageContaining("1 vectors for 2 passages");
    }

    @Test
    @DisplayName("should not call the provider for empty input")
    void shouldSkipEmptyInput() {
      assertThat(embeddingService.embedTexts(List.<String>of())).isEmpty();
      verifyNoInteractions(embeddingModel);
    }
  }

  @Nested
  @DisplayName("disabled")
  class DisabledTests {

    @Test
    @DisplayName("should report disabled without a model")
    void shouldBeDisabledWithoutModel() {
      EmbeddingService service =
          new EmbeddingService(Optional.empty(), workspaceConfig, meterRegistry);

      assertThat(service.isEnabled()).isFalse();
      assertThatThrownBy(() -> service.embedQuery("q")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should report disabled when switched off in configuration")
    void shouldBeDisabledByConfig() {
      workspaceConfig.getEmbedding().setEnabled(false);

      assertThat(embeddingService.isEnabled()).isFalse();
      assertThatThrownBy(() -> embeddingService.embedTexts(List.of("x")))
          .isInstanceOf(IllegalStateException.class);
    }
  }

  @Nested
  @DisplayName("EmbeddingModelRegistry")
  class RegistryTests {

    @Test
    @DisplayName("should build an OpenAI model when a key is set")
    void shouldBuildOpenAi() {
      WorkspaceConfig.Embedding config = new WorkspaceConfig.Embedding();
      config.setApiKey("sk-test");

      assertThat(EmbeddingModelRegistry.create(config)).isNotNull();
    }

    @Test
    @DisplayName("should build an Ollama model")
    void shouldBuildOllama() {
      WorkspaceConfig.Embedding config = new WorkspaceConfig.Embedding();
      config.setProvider("ollama");
      config.setBaseUrl("http://localhost:11434");
      config.setModelName("nomic-embed-text");

      assertThat(EmbeddingModelRegistry.create(config)).isNotNull();
    }

    @Test
    @DisplayName("should fail fast without an OpenAI key")
    void shouldRequireApiKey() {
      assertThatThrownBy(() -> EmbeddingModelRegistry.create(new WorkspaceConfig.Embedding()))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    @DisplayName("should reject an unknown provider")
    void shouldRejectUnknownProvider() {
      WorkspaceConfig.Embedding config = new WorkspaceConfig.Embedding();
      config.setProvider("bedrock");

      assertThatThrownBy(() -> EmbeddingModelRegistry.create(config))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
