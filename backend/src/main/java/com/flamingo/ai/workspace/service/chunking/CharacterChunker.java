package com.flamingo.ai.workspace.service.chunking;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits content on the configured separator and merges the pieces into chunks of at most {@code
 * size} characters with {@code overlap} characters of trailing context.
 *
 * <p>A single piece longer than the chunk size is emitted on its own.
 */
public class CharacterChunker extends AbstractChunker {

  public static final String PROVIDER = "character";

  public CharacterChunker(WorkspaceConfig.Chunking config) {
    super(config);
  }

  @Override
  public String getProvider() {
    return PROVIDER;
  }

  @Override
  protected List<String> split(String content) {
    List<String> pieces = new ArrayList<>();
    for (String piece : content.split(Pattern.quote(separator))) {
      if (!piece.isEmpty()) {
        pieces.add(piece);
      }
    }
    return mergeSplits(pieces, separator);
  }
}
