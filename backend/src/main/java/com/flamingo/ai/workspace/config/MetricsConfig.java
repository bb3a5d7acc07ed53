package com.flamingo.ai.workspace.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics setup: {@code @Timed} support and a {@code workspace} tag on every meter. */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /**
   * Tags all meters with the workspace id so several workspaces can report to one backend.
   *
   * @param workspaceConfig workspace properties
   * @return the registry customizer
   */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> workspaceTagCustomizer(
      WorkspaceConfig workspaceConfig) {
    return registry -> registry.config().commonTags("workspace", workspaceConfig.getId());
  }
}
