package com.flamingo.ai.workspace.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.workspace.domain.enums.ArtifactType;
import com.flamingo.ai.workspace.domain.model.Artifact;
import com.flamingo.ai.workspace.domain.model.AttachmentFile;
import com.flamingo.ai.workspace.domain.model.Chunk;
import com.flamingo.ai.workspace.exception.WorkspaceStorageException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/**
 * Repository logic shared by every backend: the path layout, JSON serialization and chunk
 * windowing. Subclasses only provide byte-level primitives over keys relative to the workspace
 * root, using {@code /} as separator.
 */
@Slf4j
public abstract class AbstractArtifactRepository implements ArtifactRepository {

  static final String INDEX_FILE = "index.json";
  static final String VERSIONS_DIR = "versions";
  static final String ARTIFACTS_DIR = "artifacts";
  static final String SUBLIST_DIR = "sublist";
  static final String CHUNKS_DIR = "chunks";
  static final String ATTACHMENTS_DIR = "attachment_files";
  static final String ORIGIN_FILE = "origin";

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  protected final ObjectMapper objectMapper;

  protected AbstractArtifactRepository(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  // ---- backend primitives ----

  /** Reads the object at {@code key}, or empty when it does not exist. */
  protected abstract Optional<byte[]> readBytes(String key);

  protected abstract void writeBytes(String key, byte[] data, String contentType);

  protected abstract boolean exists(String key);

  /** Lists the keys of all files below {@code dirKey}. */
  protected abstract List<String> listFiles(String dirKey);

  protected abstract void move(String fromKey, String toKey);

  /**
   * Replaces everything below {@code dirKey} with {@code files}, keyed by file name. Staged data is
   * removed on every failure path.
   */
  protected abstract void replaceDirectory(String dirKey, Map<String, byte[]> files);

  // ---- path layout ----

  static String artifactDir(String artifactId) {
    return ARTIFACTS_DIR + "/" + artifactId;
  }

  static String artifactIndexKey(String artifactId) {
    return artifactDir(artifactId) + "/" + INDEX_FILE;
  }

  static String subArtifactDir(String artifactId, String parentId) {
    return artifactDir(parentId) + "/" + SUBLIST_DIR + "/" + artifactId;
  }

  static String subArtifactContentKey(String artifactId, String parentId, String extension) {
    return subArtifactDir(artifactId, parentId) + "/" + ORIGIN_FILE + "." + extension;
  }

  static String chunkDir(String artifactId, String parentId) {
    if (parentId == null || parentId.isEmpty()) {
      return artifactDir(artifactId) + "/" + CHUNKS_DIR;
    }
    return subArtifactDir(artifactId, parentId) + "/" + CHUNKS_DIR;
  }

  static String chunkKey(String artifactId, String parentId, int chunkIndex) {
    return chunkDir(artifactId, parentId) + "/" + Chunk.fileName(artifactId, chunkIndex);
  }

  static String attachmentKey(String artifactId, String fileName) {
    return artifactDir(artifactId) + "/" + ATTACHMENTS_DIR + "/" + fileName;
  }

  static String indexHistoryKey(long epochSeconds) {
    return VERSIONS_DIR + "/index_his_" + epochSeconds + ".json";
  }

  // ---- index ----

  @Override
  public void storeIndex(Map<String, Object> data) {
    if (exists(INDEX_FILE)) {
      String historyKey = indexHistoryKey(Instant.now().getEpochSecond());
      move(INDEX_FILE, historyKey);
      log.debug("Moved previous workspace index to {}", historyKey);
    }
    Map<String, Object> index = new LinkedHashMap<>();
    index.put("workspace", data);
    writeJson(INDEX_FILE, index);
    log.info("Stored workspace index");
  }

  @Override
  public Optional<Map<String, Object>> getIndexData() {
    return readJson(INDEX_FILE);
  }

  // ---- artifacts ----

  @Override
  @SuppressWarnings("unchecked")
  public void storeArtifact(
      Artifact artifact, boolean saveSubListContent, boolean saveAttachmentFiles) {
    String artifactId = artifact.getArtifactId();
    Map<String, Object> descriptor = artifact.toMap(true);

    if (saveSubListContent) {
      for (Map<String, Object> sub : (List<Map<String, Object>>) descriptor.get(Artifact.KEY_SUBLIST)) {
        Object content = sub.get(Artifact.KEY_CONTENT);
        if (content == null) {
          continue;
        }
        String subId = sub.get(Artifact.KEY_ARTIFACT_ID).toString();
        ArtifactType type = ArtifactType.valueOf(sub.get(Artifact.KEY_ARTIFACT_TYPE).toString());
        String key = subArtifactContentKey(subId, artifactId, type.contentExtension());
        writeBytes(key, content.toString().getBytes(StandardCharsets.UTF_8), contentType(key));
        sub.put(Artifact.KEY_CONTENT, "");
      }
    }

    if (saveAttachmentFiles) {
      for (AttachmentFile attachment : artifact.getAttachmentFiles()) {
        String key = attachmentKey(artifactId, attachment.fileName());
        writeBytes(key, readLocalFile(attachment.filePath(), key), contentType(key));
      }
    }

    writeJson(artifactIndexKey(artifactId), descriptor);
    log.debug(
        "Stored artifact {} [{}] with {} sub-artifacts",
        artifactId,
        artifact.getArtifactType(),
        artifact.getSublist().size());
  }

  @Override
  public Optional<Map<String, Object>> retrieveArtifact(String artifactId) {
    return readJson(artifactIndexKey(artifactId));
  }

  @Override
  public Optional<String> getSubArtifactContent(String artifactId, String parentId) {
    String prefix = subArtifactDir(artifactId, parentId) + "/" + ORIGIN_FILE + ".";
    return listFiles(subArtifactDir(artifactId, parentId)).stream()
        .filter(key -> key.startsWith(prefix))
        .findFirst()
        .flatMap(this::readBytes)
        .map(bytes -> new String(bytes, StandardCharsets.UTF_8));
  }

  @Override
  public Optional<byte[]> getAttachmentFile(String artifactId, String fileName) {
    return readBytes(attachmentKey(artifactId, fileName));
  }

  // ---- chunks ----

  @Override
  public void storeArtifactChunks(Artifact artifact, List<Chunk> chunks) {
    String dir = chunkDir(artifact.getArtifactId(), artifact.getParentId());
    Map<String, byte[]> files = new LinkedHashMap<>();
    for (Chunk chunk : chunks) {
      files.put(chunk.getFileName(), toJson(dir + "/" + chunk.getFileName(), chunk));
    }
    replaceDirectory(dir, files);
    log.info("Stored {} chunks for artifact {} in {}", chunks.size(), artifact.getArtifactId(), dir);
  }

  @Override
  public List<Chunk> getChunks(String artifactId, String parentId) {
    List<Chunk> chunks = new ArrayList<>();
    for (String key : listFiles(chunkDir(artifactId, parentId))) {
      if (!key.endsWith(".json")) {
        continue;
      }
      readBytes(key).flatMap(bytes -> parseChunk(key, bytes)).ifPresent(chunks::add);
    }
    return chunks;
  }

  @Override
  public ChunkWindow getChunkWindow(
      String artifactId, String parentId, int chunkIndex, int preN, int nextN) {
    Optional<Chunk> target = readChunk(artifactId, parentId, chunkIndex);
    if (target.isEmpty()) {
      log.debug("Chunk {} of artifact {} not found", chunkIndex, artifactId);
      return ChunkWindow.empty();
    }
    List<Chunk> pre = new ArrayList<>();
    for (int i = 1; i <= preN && chunkIndex - i >= 0; i++) {
      Optional<Chunk> chunk = readChunk(artifactId, parentId, chunkIndex - i);
      if (chunk.isEmpty()) {
        break;
      }
      pre.add(chunk.get());
    }
    List<Chunk> next = new ArrayList<>();
    for (int i = 1; i <= nextN; i++) {
      Optional<Chunk> chunk = readChunk(artifactId, parentId, chunkIndex + i);
      if (chunk.isEmpty()) {
        break;
      }
      next.add(chunk.get());
    }
    return new ChunkWindow(pre, target.get(), next);
  }

  private Optional<Chunk> readChunk(String artifactId, String parentId, int chunkIndex) {
    String key = chunkKey(artifactId, parentId, chunkIndex);
    return readBytes(key).flatMap(bytes -> parseChunk(key, bytes));
  }

  /** Corrupt chunk files are skipped by listings and end window expansion like missing ones. */
  private Optional<Chunk> parseChunk(String key, byte[] bytes) {
    try {
      return Optional.of(objectMapper.readValue(bytes, Chunk.class));
    } catch (IOException e) {
      log.warn("Skipping unreadable chunk file {}: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  // ---- serialization helpers ----

  protected void writeJson(String key, Object value) {
    try {
      byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
      writeBytes(key, bytes, MediaType.APPLICATION_JSON_VALUE);
    } catch (JsonProcessingException e) {
      throw new WorkspaceStorageException(key, "Failed to serialize JSON", e);
    }
  }

  protected Optional<Map<String, Object>> readJson(String key) {
    return readBytes(key).map(bytes -> fromJson(key, bytes, MAP_TYPE));
  }

  private byte[] toJson(String key, Object value) {
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new WorkspaceStorageException(key, "Failed to serialize JSON", e);
    }
  }

  private <T> T fromJson(String key, byte[] bytes, TypeReference<T> type) {
    try {
      return objectMapper.readValue(bytes, type);
    } catch (IOException e) {
      throw new WorkspaceStorageException(key, "Failed to parse JSON", e);
    }
  }

  private static byte[] readLocalFile(String filePath, String targetKey) {
    try {
      return Files.readAllBytes(Path.of(filePath));
    } catch (IOException e) {
      throw new WorkspaceStorageException(
          targetKey, "Failed to read attachment source " + filePath, e);
    }
  }

  /** Guesses a content type from the key's file extension. */
  protected static String contentType(String key) {
    return MediaTypeFactory.getMediaType(key)
        .orElse(MediaType.APPLICATION_OCTET_STREAM)
        .toString();
  }
}
