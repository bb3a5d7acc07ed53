package com.flamingo.ai.workspace.service.chunking;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import com.flamingo.ai.workspace.domain.model.Artifact;
import com.flamingo.ai.workspace.domain.model.Chunk;
import com.flamingo.ai.workspace.domain.model.ChunkMetadata;
import java.util.ArrayList;
import java.util.List;

/** Base class holding the chunk configuration and the chunk construction shared by providers. */
public abstract class AbstractChunker implements Chunker {

  protected final int chunkSize;
  protected final int chunkOverlap;
  protected final String separator;

  protected AbstractChunker(WorkspaceConfig.Chunking config) {
    if (config.getSize() <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive, got " + config.getSize());
    }
    if (config.getOverlap() < 0 || config.getOverlap() > config.getSize()) {
      throw new IllegalArgumentException(
          "Chunk overlap must be between 0 and chunk size ("
              + config.getSize()
              + "), got "
              + config.getOverlap());
    }
    this.chunkSize = config.getSize();
    this.chunkOverlap = config.getOverlap();
    this.separator =
        config.getSeparator() == null || config.getSeparator().isEmpty()
            ? "\n"
            : config.getSeparator();
  }

  @Override
  public List<Chunk> chunk(Artifact artifact) {
    String content = artifact.getContent();
    if (content == null || content.isBlank()) {
      return List.of();
    }
    return createChunks(split(content), artifact);
  }

  /**
   * Cuts the content into chunk texts.
   *
   * @param content non-blank artifact content
   * @return ordered chunk texts
   */
  protected abstract List<String> split(String content);

  protected List<Chunk> createChunks(List<String> texts, Artifact artifact) {
    List<Chunk> chunks = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      chunks.add(buildChunk(artifact, i, text, text.length()));
    }
    return chunks;
  }

  protected Chunk buildChunk(Artifact artifact, int index, String content, int size) {
    return Chunk.builder()
        .chunkId(Chunk.chunkId(artifact.getArtifactId(), index))
        .content(content)
        .chunkMetadata(
            ChunkMetadata.builder()
                .chunkIndex(index)
                .chunkSize(size)
                .chunkOverlap(chunkOverlap)
                .artifactId(artifact.getArtifactId())
                .artifactType(artifact.getArtifactType().name())
                .parentArtifactId(artifact.getParentId())
                .build())
        .build();
  }

  /**
   * Greedily merges pieces into chunks of at most {@code chunkSize} characters, carrying trailing
   * pieces of up to {@code chunkOverlap} characters into the next chunk.
   */
  protected List<String> mergeSplits(List<String> pieces, String joiner) {
    int joinerLength = joiner.length();
    List<String> chunks = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int total = 0;
    for (String piece : pieces) {
      int length = piece.length();
      if (total + length + (current.isEmpty() ? 0 : joinerLength) > chunkSize
          && !current.isEmpty()) {
        addIfNotBlank(chunks, String.join(joiner, current));
        // Drop leading pieces until what is left fits the overlap and leaves room for this piece
        while (total > chunkOverlap
            || (total > 0 && total + length + (current.isEmpty() ? 0 : joinerLength) > chunkSize)) {
          total -= current.get(0).length() + (current.size() > 1 ? joinerLength : 0);
          current.remove(0);
        }
      }
      current.add(piece);
      total += length + (current.size() > 1 ? joinerLength : 0);
    }
    addIfNotBlank(chunks, String.join(joiner, current));
    return chunks;
  }

  private static void addIfNotBlank(List<String> chunks, String text) {
    String trimmed = text.strip();
    if (!trimmed.isEmpty()) {
      chunks.add(trimmed);
    }
  }
}
