package com.flamingo.ai.workspace.service.embedding;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/** Maps embedding provider ids to LangChain4j model constructors. */
public final class EmbeddingModelRegistry {

  public static final String OPENAI = "openai";
  public static final String OLLAMA = "ollama";

  private static final Map<String, Function<WorkspaceConfig.Embedding, EmbeddingModel>> PROVIDERS =
      Map.of(
          OPENAI, EmbeddingModelRegistry::openAi,
          OLLAMA, EmbeddingModelRegistry::ollama);

  private EmbeddingModelRegistry() {}

  /**
   * Builds the embedding model for the configured provider.
   *
   * @throws IllegalArgumentException for an unknown provider
   * @throws IllegalStateException when the provider's credentials or endpoint are missing
   */
  public static EmbeddingModel create(WorkspaceConfig.Embedding config) {
    Function<WorkspaceConfig.Embedding, EmbeddingModel> constructor =
        PROVIDERS.get(config.getProvider());
    if (constructor == null) {
      throw new IllegalArgumentException(
          "Unsupported embedding provider '"
              + config.getProvider()
              + "', expected one of "
              + PROVIDERS.keySet());
    }
    return constructor.apply(config);
  }

  public static Set<String> providers() {
    return PROVIDERS.keySet();
  }

  private static EmbeddingModel openAi(WorkspaceConfig.Embedding config) {
    if (config.getApiKey() == null || config.getApiKey().isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
    return OpenAiEmbeddingModel.builder()
        .apiKey(config.getApiKey())
        .baseUrl(config.getBaseUrl())
        .modelName(config.getModelName())
        .dimensions(config.getDimensions())
        .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
        .build();
  }

  private static EmbeddingModel ollama(WorkspaceConfig.Embedding config) {
    if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
      throw new IllegalStateException(
          "Ollama base URL is required. Set EMBEDDING_BASE_URL environment variable.");
    }
    return OllamaEmbeddingModel.builder()
        .baseUrl(config.getBaseUrl())
        .modelName(config.getModelName())
        .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
        .build();
  }
}
