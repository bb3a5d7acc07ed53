package com.flamingo.ai.workspace.config;

import com.flamingo.ai.workspace.service.embedding.EmbeddingModelRegistry;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for LangChain4j models. */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Bean
  @ConditionalOnProperty(
      name = "workspace.embedding.enabled",
      havingValue = "true",
      matchIfMissing = true)
  public EmbeddingModel embeddingModel(WorkspaceConfig workspaceConfig) {
    WorkspaceConfig.Embedding embedding = workspaceConfig.getEmbedding();
    EmbeddingModel model = EmbeddingModelRegistry.create(embedding);
    log.info(
        "Embedding model initialized: provider={}, model={}, timeout={}s",
        embedding.getProvider(),
        embedding.getModelName(),
        embedding.getTimeoutSeconds());
    return model;
  }
}
