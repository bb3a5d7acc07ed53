package com.flamingo.ai.workspace.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executor for artifact embedding work. */
@Configuration
public class AsyncConfig {

  /**
   * Pool sized by {@code workspace.embedding.max-concurrent}. Work beyond the pool size waits in an
   * unbounded in-memory queue.
   */
  @Bean(name = "embeddingExecutor", destroyMethod = "shutdown")
  public ThreadPoolTaskExecutor embeddingExecutor(WorkspaceConfig workspaceConfig) {
    int maxConcurrent = Math.max(1, workspaceConfig.getEmbedding().getMaxConcurrent());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(maxConcurrent);
    executor.setMaxPoolSize(maxConcurrent);
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }
}
