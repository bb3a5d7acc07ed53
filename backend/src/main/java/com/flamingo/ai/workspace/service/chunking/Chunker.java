package com.flamingo.ai.workspace.service.chunking;

import com.flamingo.ai.workspace.domain.model.Artifact;
import com.flamingo.ai.workspace.domain.model.Chunk;
import java.util.List;

/**
 * Splits an {@link Artifact}'s content into an ordered list of {@link Chunk}s.
 *
 * <p>Implementations differ only in how they cut the text. All of them number chunks densely from
 * 0 and stamp each chunk with the owning artifact's id, type and parent id. They must be stateless
 * and return the same chunks for the same content and configuration.
 */
public interface Chunker {

  /**
   * Produces chunks from the artifact's content.
   *
   * @param artifact the artifact to split
   * @return ordered chunks, empty when the artifact has no content
   */
  List<Chunk> chunk(Artifact artifact);

  /** Provider id this chunker is registered under. */
  String getProvider();
}
