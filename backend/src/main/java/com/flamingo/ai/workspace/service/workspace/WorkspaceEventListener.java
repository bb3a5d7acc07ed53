package com.flamingo.ai.workspace.service.workspace;

/**
 * Receives artifact changes. Listener beans are handed to {@link WorkspaceService} at construction;
 * an exception thrown here is logged and does not affect the operation that raised the event.
 */
@FunctionalInterface
public interface WorkspaceEventListener {

  void onEvent(WorkspaceEvent event);
}
