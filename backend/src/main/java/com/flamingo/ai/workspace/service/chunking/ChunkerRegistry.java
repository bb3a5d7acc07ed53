package com.flamingo.ai.workspace.service.chunking;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps chunker provider ids to their constructors and holds the chunker resolved from the
 * configuration at startup.
 */
@Component
@Slf4j
public class ChunkerRegistry {

  private static final Map<String, Function<WorkspaceConfig.Chunking, Chunker>> PROVIDERS =
      Map.of(
          CharacterChunker.PROVIDER, CharacterChunker::new,
          SentenceChunker.PROVIDER, SentenceChunker::new,
          MarkdownChunker.PROVIDER, MarkdownChunker::new,
          SmartChunker.PROVIDER, SmartChunker::new);

  private final Chunker defaultChunker;

  public ChunkerRegistry(WorkspaceConfig workspaceConfig) {
    this.defaultChunker = create(workspaceConfig.getChunking());
    log.info(
        "Chunker initialized: provider={}, size={}, overlap={}",
        defaultChunker.getProvider(),
        workspaceConfig.getChunking().getSize(),
        workspaceConfig.getChunking().getOverlap());
  }

  /** Chunker for the configured provider. */
  public Chunker getChunker() {
    return defaultChunker;
  }

  /**
   * Builds a chunker for an explicit configuration, for example when re-chunking with other
   * settings.
   *
   * @throws IllegalArgumentException for an unknown provider or an invalid size/overlap pair
   */
  public static Chunker create(WorkspaceConfig.Chunking config) {
    Function<WorkspaceConfig.Chunking, Chunker> constructor = PROVIDERS.get(config.getProvider());
    if (constructor == null) {
      throw new IllegalArgumentException(
          "Unsupported chunker provider '"
              + config.getProvider()
              + "', expected one of "
              + PROVIDERS.keySet());
    }
    return constructor.apply(config);
  }

  public static Set<String> providers() {
    return PROVIDERS.keySet();
  }
}
