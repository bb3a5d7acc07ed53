package com.flamingo.ai.workspace.domain.model;

import com.flamingo.ai.workspace.domain.enums.ArtifactStatus;
import com.flamingo.ai.workspace.domain.enums.ArtifactType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

/**
 * A content unit (document, chapter, page) with identity, metadata, version history and optional
 * child artifacts.
 *
 * <p>Status moves from {@link ArtifactStatus#DRAFT} to {@link ArtifactStatus#EDITED} or {@link
 * ArtifactStatus#COMPLETE} and finally to {@link ArtifactStatus#ARCHIVED}, which is terminal. Every
 * transition appends a {@link VersionRecord}; history never shrinks.
 */
@Getter
public class Artifact {

  public static final String KEY_ARTIFACT_ID = "artifact_id";
  public static final String KEY_ARTIFACT_TYPE = "artifact_type";
  public static final String KEY_CONTENT = "content";
  public static final String KEY_METADATA = "metadata";
  public static final String KEY_CREATED_AT = "created_at";
  public static final String KEY_UPDATED_AT = "updated_at";
  public static final String KEY_STATUS = "status";
  public static final String KEY_PARENT_ID = "parent_id";
  public static final String KEY_SUBLIST = "sublist";
  public static final String KEY_VERSION_HISTORY = "version_history";

  private final String artifactId;
  private final ArtifactType artifactType;

  /** Empty for root artifacts. */
  @Setter private String parentId;

  /** Raw content; may be emptied once it has been persisted elsewhere. */
  @Setter private String content;

  private final Map<String, Object> metadata;
  private String createdAt;
  private String updatedAt;
  private ArtifactStatus status;
  private final List<VersionRecord> versionHistory = new ArrayList<>();
  private final List<Artifact> sublist = new ArrayList<>();
  private final List<AttachmentFile> attachmentFiles = new ArrayList<>();
  @Setter private List<Chunk> chunkList = new ArrayList<>();

  @Builder
  private Artifact(
      String artifactId,
      String parentId,
      ArtifactType artifactType,
      String content,
      Map<String, Object> metadata,
      List<Artifact> sublist,
      List<AttachmentFile> attachmentFiles) {
    this.artifactId =
        artifactId == null || artifactId.isBlank() ? UUID.randomUUID().toString() : artifactId;
    this.artifactType = Objects.requireNonNull(artifactType, "artifactType");
    this.parentId = parentId == null ? "" : parentId;
    this.content = content;
    this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
    this.createdAt = Instant.now().toString();
    this.updatedAt = createdAt;
    if (sublist != null) {
      sublist.forEach(this::addSubArtifact);
    }
    if (attachmentFiles != null) {
      this.attachmentFiles.addAll(attachmentFiles);
    }
    this.status = ArtifactStatus.DRAFT;
    recordVersion("Initial version");
  }

  /** Replaces the content and moves the artifact to {@link ArtifactStatus#EDITED}. */
  public void updateContent(String newContent, String description) {
    ensureNotArchived("update content");
    this.content = newContent;
    this.status = ArtifactStatus.EDITED;
    recordVersion(description == null ? "Content update" : description);
  }

  /** Merges the given entries into the metadata map. */
  public void updateMetadata(Map<String, Object> entries) {
    metadata.putAll(entries);
    this.updatedAt = Instant.now().toString();
  }

  public void markComplete() {
    ensureNotArchived("mark complete");
    this.status = ArtifactStatus.COMPLETE;
    recordVersion("Marked as complete");
  }

  /** Soft-deletes the artifact. Archiving an archived artifact is a no-op. */
  public void archive() {
    if (status == ArtifactStatus.ARCHIVED) {
      return;
    }
    this.status = ArtifactStatus.ARCHIVED;
    recordVersion("Artifact archived");
  }

  public boolean isArchived() {
    return status == ArtifactStatus.ARCHIVED;
  }

  /**
   * Returns the history entry at {@code index}.
   *
   * @param index zero-based history index
   * @return the entry, or empty when out of range
   */
  public Optional<VersionRecord> getVersion(int index) {
    if (index < 0 || index >= versionHistory.size()) {
      return Optional.empty();
    }
    return Optional.of(versionHistory.get(index));
  }

  /**
   * Restores content and status from history entry {@code index} and appends a new entry.
   *
   * @param index zero-based history index
   * @return false when the index is out of range
   */
  public boolean revertToVersion(int index) {
    Optional<VersionRecord> version = getVersion(index);
    if (version.isEmpty()) {
      return false;
    }
    ensureNotArchived("revert");
    this.content = version.get().content();
    this.status = version.get().status();
    recordVersion("Reverted to version " + index);
    return true;
  }

  /** Adds a child artifact and stamps it with this artifact's id as its parent. */
  public void addSubArtifact(Artifact child) {
    child.setParentId(artifactId);
    sublist.add(child);
  }

  public Optional<Artifact> findSubArtifact(String subArtifactId) {
    return sublist.stream().filter(s -> s.getArtifactId().equals(subArtifactId)).findFirst();
  }

  public void addAttachmentFile(AttachmentFile file) {
    attachmentFiles.add(file);
  }

  public boolean isRoot() {
    return parentId == null || parentId.isEmpty();
  }

  /** Text handed to the embedding model, or empty when there is no content. */
  public Optional<String> getEmbeddingText() {
    return content == null || content.isEmpty() ? Optional.empty() : Optional.of(content);
  }

  /**
   * Returns a metadata value as a string.
   *
   * @param key metadata key
   * @return the value, or empty when absent
   */
  public Optional<String> getMetadataString(String key) {
    Object value = metadata.get(key);
    return value == null ? Optional.empty() : Optional.of(value.toString());
  }

  /**
   * Returns a metadata value that callers rely on being present.
   *
   * @throws IllegalStateException when the key is missing
   */
  public Object requireMetadata(String key) {
    Object value = metadata.get(key);
    if (value == null) {
      throw new IllegalStateException(
          "Artifact " + artifactId + " is missing required metadata '" + key + "'");
    }
    return value;
  }

  /** Display name used in tree views: the {@code filename} metadata entry or the id. */
  public String getDisplayName() {
    return getMetadataString("filename").orElse(artifactId);
  }

  public List<Artifact> getSublist() {
    return Collections.unmodifiableList(sublist);
  }

  public List<VersionRecord> getVersionHistory() {
    return Collections.unmodifiableList(versionHistory);
  }

  /**
   * Serializes the artifact to its wire form. Sub-artifacts are always written without history.
   *
   * @param includeVersionHistory whether to include this artifact's version history
   * @return a JSON-compatible map
   */
  public Map<String, Object> toMap(boolean includeVersionHistory) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(KEY_ARTIFACT_ID, artifactId);
    map.put(KEY_ARTIFACT_TYPE, artifactType.name());
    map.put(KEY_CONTENT, content);
    map.put(KEY_METADATA, new LinkedHashMap<>(metadata));
    map.put(KEY_CREATED_AT, createdAt);
    map.put(KEY_UPDATED_AT, updatedAt);
    map.put(KEY_STATUS, status.name());
    map.put(KEY_PARENT_ID, parentId);
    List<Map<String, Object>> subs = new ArrayList<>();
    for (Artifact sub : sublist) {
      subs.add(sub.toMap(false));
    }
    map.put(KEY_SUBLIST, subs);
    if (includeVersionHistory) {
      List<Map<String, Object>> history = new ArrayList<>();
      for (VersionRecord record : versionHistory) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", record.timestamp());
        entry.put("description", record.description());
        entry.put("content", record.content());
        entry.put("status", record.status().name());
        history.add(entry);
      }
      map.put(KEY_VERSION_HISTORY, history);
    }
    return map;
  }

  public Map<String, Object> toMap() {
    return toMap(true);
  }

  /**
   * Restores an artifact from its wire form.
   *
   * @param data map produced by {@link #toMap(boolean)}
   * @return the artifact, or empty when {@code artifact_id} is missing
   */
  @SuppressWarnings("unchecked")
  public static Optional<Artifact> fromMap(Map<String, Object> data) {
    if (data == null) {
      return Optional.empty();
    }
    Object id = data.get(KEY_ARTIFACT_ID);
    if (id == null || id.toString().isBlank()) {
      return Optional.empty();
    }
    Artifact artifact =
        Artifact.builder()
            .artifactId(id.toString())
            .artifactType(ArtifactType.valueOf(String.valueOf(data.get(KEY_ARTIFACT_TYPE))))
            .content(data.get(KEY_CONTENT) == null ? null : data.get(KEY_CONTENT).toString())
            .metadata((Map<String, Object>) data.get(KEY_METADATA))
            .parentId((String) data.get(KEY_PARENT_ID))
            .build();
    if (data.get(KEY_CREATED_AT) != null) {
      artifact.createdAt = data.get(KEY_CREATED_AT).toString();
    }
    if (data.get(KEY_UPDATED_AT) != null) {
      artifact.updatedAt = data.get(KEY_UPDATED_AT).toString();
    }
    if (data.get(KEY_STATUS) != null) {
      artifact.status = ArtifactStatus.valueOf(data.get(KEY_STATUS).toString());
    }
    Object history = data.get(KEY_VERSION_HISTORY);
    if (history instanceof List<?> entries) {
      artifact.versionHistory.clear();
      for (Object entry : entries) {
        Map<String, Object> e = (Map<String, Object>) entry;
        artifact.versionHistory.add(
            new VersionRecord(
                String.valueOf(e.get("timestamp")),
                String.valueOf(e.get("description")),
                e.get("content") == null ? null : e.get("content").toString(),
                ArtifactStatus.valueOf(String.valueOf(e.get("status")))));
      }
    }
    Object subs = data.get(KEY_SUBLIST);
    if (subs instanceof List<?> children) {
      for (Object child : children) {
        fromMap((Map<String, Object>) child).ifPresent(artifact::addSubArtifact);
      }
    }
    return Optional.of(artifact);
  }

  private void recordVersion(String description) {
    String timestamp = Instant.now().toString();
    versionHistory.add(new VersionRecord(timestamp, description, content, status));
    this.updatedAt = timestamp;
  }

  private void ensureNotArchived(String operation) {
    if (status == ArtifactStatus.ARCHIVED) {
      throw new IllegalStateException(
          "Cannot " + operation + " on archived artifact " + artifactId);
    }
  }
}
