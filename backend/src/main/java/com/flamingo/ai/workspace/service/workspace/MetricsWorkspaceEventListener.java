package com.flamingo.ai.workspace.service.workspace;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Counts artifact changes per event type. */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsWorkspaceEventListener implements WorkspaceEventListener {

  private final MeterRegistry meterRegistry;

  @Override
  public void onEvent(WorkspaceEvent event) {
    meterRegistry
        .counter("workspace.artifact.events", "type", event.type().name().toLowerCase())
        .increment();
    log.debug(
        "Workspace {} artifact {} {}",
        event.workspaceId(),
        event.artifact().getArtifactId(),
        event.type());
  }
}
