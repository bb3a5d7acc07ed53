package com.flamingo.ai.workspace.service.workspace;

import com.flamingo.ai.workspace.config.WorkspaceConfig;
import com.flamingo.ai.workspace.domain.enums.ArtifactType;
import com.flamingo.ai.workspace.domain.model.Artifact;
import com.flamingo.ai.workspace.domain.model.Chunk;
import com.flamingo.ai.workspace.exception.WorkspaceStorageException;
import com.flamingo.ai.workspace.fulltext.FulltextDocument;
import com.flamingo.ai.workspace.fulltext.FulltextStore;
import com.flamingo.ai.workspace.service.chunking.ChunkerRegistry;
import com.flamingo.ai.workspace.service.embedding.EmbeddingService;
import com.flamingo.ai.workspace.service.search.ArtifactHit;
import com.flamingo.ai.workspace.service.search.ArtifactSearchQuery;
import com.flamingo.ai.workspace.service.search.HybridSearchService;
import com.flamingo.ai.workspace.storage.ArtifactRepository;
import com.flamingo.ai.workspace.storage.ChunkWindow;
import com.flamingo.ai.workspace.vector.VectorMetadata;
import com.flamingo.ai.workspace.vector.VectorRecord;
import com.flamingo.ai.workspace.vector.VectorStore;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Owns the artifacts of one workspace: keeps the in-memory artifact list, persists it through the
 * {@link ArtifactRepository} and keeps the vector and full-text indexes in step with it.
 *
 * <p>The three stores are written independently. When they drift apart, {@link #rebuildIndex()}
 * rewrites chunks, vectors and full-text entries from the repository state.
 */
@Service
@Slf4j
public class WorkspaceService {

  private static final String KEY_WORKSPACE = "workspace";

  private final WorkspaceConfig workspaceConfig;
  private final ArtifactRepository artifactRepository;
  private final ChunkerRegistry chunkerRegistry;
  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final FulltextStore fulltextStore;
  private final HybridSearchService hybridSearchService;
  private final Executor embeddingExecutor;
  private final List<WorkspaceEventListener> listeners;
  private final MeterRegistry meterRegistry;

  private final List<Artifact> artifacts = new CopyOnWriteArrayList<>();
  private final Map<String, ReentrantLock> artifactLocks = new ConcurrentHashMap<>();
  private final Object membershipLock = new Object();
  private final Map<String, Object> metadata = new ConcurrentHashMap<>();
  private volatile String createdAt = Instant.now().toString();
  private volatile String updatedAt = createdAt;

  public WorkspaceService(
      WorkspaceConfig workspaceConfig,
      ArtifactRepository artifactRepository,
      ChunkerRegistry chunkerRegistry,
      EmbeddingService embeddingService,
      VectorStore vectorStore,
      FulltextStore fulltextStore,
      HybridSearchService hybridSearchService,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor,
      List<WorkspaceEventListener> listeners,
      MeterRegistry meterRegistry) {
    this.workspaceConfig = workspaceConfig;
    this.artifactRepository = artifactRepository;
    this.chunkerRegistry = chunkerRegistry;
    this.embeddingService = embeddingService;
    this.vectorStore = vectorStore;
    this.fulltextStore = fulltextStore;
    this.hybridSearchService = hybridSearchService;
    this.embeddingExecutor = embeddingExecutor;
    this.listeners = List.copyOf(listeners);
    this.meterRegistry = meterRegistry;
  }

  public String getWorkspaceId() {
    return workspaceConfig.getId();
  }

  // ---- lifecycle ----

  /** Restores the workspace from {@code index.json} and the stored artifact descriptors. */
  @PostConstruct
  public void load() {
    Optional<Map<String, Object>> index = artifactRepository.getIndexData();
    Object workspace = index.map(data -> data.get(KEY_WORKSPACE)).orElse(null);
    if (!(workspace instanceof Map<?, ?> data)) {
      log.info("No stored index for workspace {}, starting empty", getWorkspaceId());
      return;
    }
    if (data.get("created_at") != null) {
      createdAt = data.get("created_at").toString();
    }
    if (data.get("updated_at") != null) {
      updatedAt = data.get("updated_at").toString();
    }
    if (data.get("metadata") instanceof Map<?, ?> stored) {
      stored.forEach(
          (k, v) -> {
            if (v != null) {
              metadata.put(String.valueOf(k), v);
            }
          });
    }
    List<Artifact> restored = new ArrayList<>();
    if (data.get("artifacts") instanceof List<?> entries) {
      for (Object entry : entries) {
        if (!(entry instanceof Map<?, ?> meta)) {
          continue;
        }
        Object id = meta.get("artifact_id") != null ? meta.get("artifact_id") : meta.get("id");
        if (id == null) {
          continue;
        }
        loadArtifact(id.toString()).ifPresent(restored::add);
      }
    }
    synchronized (membershipLock) {
      artifacts.clear();
      artifacts.addAll(restored);
    }
    log.info("Loaded workspace {} with {} artifacts", getWorkspaceId(), restored.size());
  }

  private Optional<Artifact> loadArtifact(String artifactId) {
    try {
      Optional<Artifact> artifact =
          artifactRepository.retrieveArtifact(artifactId).flatMap(Artifact::fromMap);
      if (artifact.isEmpty()) {
        log.warn("Artifact {} listed in index but not found in storage", artifactId);
      }
      return artifact;
    } catch (WorkspaceStorageException e) {
      log.error("Failed to load artifact {}: {}", artifactId, e.getMessage(), e);
      meterRegistry.counter("workspace.load.failures").increment();
      return Optional.empty();
    }
  }

  /** Writes the workspace index; the previous index is kept under {@code versions/}. */
  public void save() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("workspace_id", getWorkspaceId());
    data.put("name", workspaceConfig.getName());
    data.put("created_at", createdAt);
    data.put("updated_at", updatedAt);
    data.put("metadata", new LinkedHashMap<>(metadata));
    List<String> ids = new ArrayList<>();
    List<Map<String, Object>> entries = new ArrayList<>();
    for (Artifact artifact : artifacts) {
      ids.add(artifact.getArtifactId());
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("artifact_id", artifact.getArtifactId());
      entry.put("type", artifact.getArtifactType().name());
      entry.put("metadata", artifact.getMetadata());
      entries.add(entry);
    }
    data.put("artifact_ids", ids);
    data.put("artifacts", entries);
    artifactRepository.storeIndex(data);
    log.info("Saved workspace {} ({} artifacts)", getWorkspaceId(), ids.size());
  }

  // ---- artifact operations ----

  /**
   * Creates and adds a root artifact.
   *
   * @param artifactId id to use, or null to generate one
   * @throws IllegalArgumentException when an artifact with the id already exists
   */
  public Artifact createArtifact(
      ArtifactType type, String artifactId, String content, Map<String, Object> metadata) {
    Artifact artifact =
        Artifact.builder()
            .artifactId(artifactId)
            .artifactType(type)
            .content(content)
            .metadata(metadata)
            .build();
    addArtifact(artifact);
    return artifact;
  }

  /**
   * Adds an artifact, stores it, indexes it and its sub-artifacts, then saves the workspace index.
   * Indexing failures are logged and counted; {@link #rebuildIndex()} repairs them. When storing
   * fails the artifact is not added and the id can be used again.
   *
   * @throws IllegalArgumentException when an artifact with the same id already exists
   * @throws com.flamingo.ai.workspace.exception.WorkspaceStorageException when storing fails
   */
  @Timed(value = "workspace.artifact.add", description = "Time to add an artifact")
  public void addArtifact(Artifact artifact) {
    synchronized (membershipLock) {
      if (findArtifact(artifact.getArtifactId()).isPresent()) {
        throw new IllegalArgumentException(
            "Artifact with ID " + artifact.getArtifactId() + " already exists");
      }
      artifacts.add(artifact);
    }
    try {
      storeAndIndex(artifact);
    } catch (RuntimeException e) {
      synchronized (membershipLock) {
        artifacts.remove(artifact);
      }
      log.error("Failed to add artifact {}: {}", artifact.getArtifactId(), e.getMessage());
      meterRegistry.counter("workspace.artifact.add.failures").increment();
      throw e;
    }
    touch();
    save();
    notifyListeners(WorkspaceEvent.Type.CREATED, artifact);
  }

  /**
   * Replaces an artifact's content, re-stores and re-indexes it.
   *
   * @return the updated artifact, or empty when no root artifact has the id
   */
  @Timed(value = "workspace.artifact.update", description = "Time to update an artifact")
  public Optional<Artifact> updateArtifact(String artifactId, String content, String description) {
    Optional<Artifact> found = findArtifact(artifactId);
    if (found.isEmpty()) {
      log.debug("Update skipped, artifact {} not found", artifactId);
      return Optional.empty();
    }
    Artifact artifact = found.get();
    artifact.updateContent(content, description);
    storeAndIndex(artifact);
    touch();
    save();
    notifyListeners(WorkspaceEvent.Type.UPDATED, artifact);
    return Optional.of(artifact);
  }

  /**
   * Archives an artifact, removes it from the workspace listing and drops its index entries. The
   * archived descriptor stays in storage.
   *
   * @return false when no root artifact has the id
   */
  @Timed(value = "workspace.artifact.delete", description = "Time to delete an artifact")
  public boolean deleteArtifact(String artifactId) {
    Artifact artifact;
    synchronized (membershipLock) {
      Optional<Artifact> found = findArtifact(artifactId);
      if (found.isEmpty()) {
        return false;
      }
      artifact = found.get();
      artifacts.remove(artifact);
    }
    artifact.archive();
    artifactRepository.storeArtifact(artifact, false, false);
    dropIndexEntries(artifact);
    for (Artifact sub : artifact.getSublist()) {
      dropIndexEntries(sub);
    }
    touch();
    save();
    notifyListeners(WorkspaceEvent.Type.DELETED, artifact);
    return true;
  }

  /**
   * Looks up a root artifact, or a sub-artifact when {@code parentId} is given. A sub-artifact's
   * content is loaded from storage.
   */
  public Optional<Artifact> getArtifact(String artifactId, String parentId) {
    if (parentId == null || parentId.isBlank()) {
      return findArtifact(artifactId);
    }
    Optional<Artifact> sub =
        findArtifact(parentId).flatMap(parent -> parent.findSubArtifact(artifactId));
    sub.ifPresent(
        s -> artifactRepository.getSubArtifactContent(artifactId, parentId).ifPresent(s::setContent));
    return sub;
  }

  public Optional<Artifact> getArtifact(String artifactId) {
    return getArtifact(artifactId, null);
  }

  /** Root artifacts, optionally restricted to the given types. */
  public List<Artifact> listArtifacts(Collection<ArtifactType> types) {
    if (types == null || types.isEmpty()) {
      return List.copyOf(artifacts);
    }
    return artifacts.stream().filter(a -> types.contains(a.getArtifactType())).toList();
  }

  public List<Artifact> listArtifacts() {
    return listArtifacts(null);
  }

  /** Reads a chunk and its neighbours from storage. */
  public ChunkWindow getChunkWindow(
      String artifactId, String parentId, int chunkIndex, int preN, int nextN) {
    if (chunkIndex < 0 || preN < 0 || nextN < 0) {
      throw new IllegalArgumentException(
          "chunkIndex, preN and nextN must not be negative, got "
              + chunkIndex
              + ", "
              + preN
              + ", "
              + nextN);
    }
    return artifactRepository.getChunkWindow(
        artifactId, parentId == null ? "" : parentId, chunkIndex, preN, nextN);
  }

  /** Tree of the workspace's artifacts and their sub-artifacts. */
  public TreeNode generateTreeData() {
    List<TreeNode> children = new ArrayList<>();
    for (Artifact artifact : artifacts) {
      children.add(treeNode(artifact, TreeNode.ROOT_ID, 1));
    }
    return TreeNode.root(workspaceConfig.getName(), children);
  }

  private static TreeNode treeNode(Artifact artifact, String parentId, int depth) {
    List<TreeNode> children = new ArrayList<>();
    for (Artifact sub : artifact.getSublist()) {
      children.add(treeNode(sub, artifact.getArtifactId(), depth + 1));
    }
    return new TreeNode(
        artifact.getDisplayName(),
        artifact.getArtifactId(),
        artifact.getArtifactType().name(),
        artifact.getArtifactId(),
        parentId,
        depth,
        false,
        children);
  }

  // ---- retrieval ----

  /**
   * Artifact-level search. Each artifact appears once, with its best score; hits whose artifact is
   * no longer in the workspace are skipped.
   */
  public List<ArtifactSearchResult> retrieveArtifacts(ArtifactSearchQuery query) {
    List<ArtifactSearchResult> results = new ArrayList<>();
    for (ArtifactHit hit : hybridSearchService.searchArtifacts(query)) {
      Optional<Artifact> artifact = getArtifact(hit.artifactId(), hit.parentId());
      if (artifact.isEmpty()) {
        log.warn("Search hit for unknown artifact {}, skipping", hit.artifactId());
        continue;
      }
      results.add(new ArtifactSearchResult(artifact.get(), hit.score()));
    }
    log.debug("Artifact retrieval returned {} results", results.size());
    return results;
  }

  // ---- indexing ----

  /**
   * Re-chunks and re-embeds every artifact and sub-artifact. Safe to run repeatedly; failures of
   * single artifacts are reported, not thrown.
   */
  @Timed(value = "workspace.index.rebuild", description = "Time to rebuild the workspace index")
  public RebuildReport rebuildIndex() {
    long start = System.currentTimeMillis();
    if (!embeddingService.isEnabled()) {
      log.warn("Index rebuild skipped for workspace {}: embedding disabled", getWorkspaceId());
      return new RebuildReport(0, 0, List.of(), 0);
    }
    int indexed = 0;
    int vectors = 0;
    List<String> failed = new ArrayList<>();
    for (Artifact artifact : artifacts) {
      for (Artifact sub : artifact.getSublist()) {
        if (sub.getContent() == null || sub.getContent().isEmpty()) {
          artifactRepository
              .getSubArtifactContent(sub.getArtifactId(), artifact.getArtifactId())
              .ifPresent(sub::setContent);
        }
      }
      IndexingOutcome outcome = indexTree(artifact);
      indexed += outcome.indexed();
      vectors += outcome.vectors();
      failed.addAll(outcome.failedArtifactIds());
    }
    long duration = System.currentTimeMillis() - start;
    log.info(
        "Rebuilt index of workspace {}: {} artifacts, {} vectors, {} failures in {} ms",
        getWorkspaceId(),
        indexed,
        vectors,
        failed.size(),
        duration);
    return new RebuildReport(indexed, vectors, List.copyOf(failed), duration);
  }

  private void storeAndIndex(Artifact artifact) {
    artifactRepository.storeArtifact(artifact);
    log.info(
        "Stored artifact {} [{}]", artifact.getArtifactId(), artifact.getArtifactType());
    if (embeddingService.isEnabled()) {
      indexTree(artifact);
    }
  }

  /** Indexes an artifact and its sub-artifacts on the embedding executor and waits for all. */
  private IndexingOutcome indexTree(Artifact artifact) {
    List<Artifact> targets = new ArrayList<>();
    targets.add(artifact);
    targets.addAll(artifact.getSublist());

    List<CompletableFuture<Integer>> tasks = new ArrayList<>(targets.size());
    for (Artifact target : targets) {
      tasks.add(CompletableFuture.supplyAsync(() -> indexArtifact(target), embeddingExecutor));
    }
    int vectors = 0;
    int indexed = 0;
    List<String> failed = new ArrayList<>();
    for (int i = 0; i < tasks.size(); i++) {
      Artifact target = targets.get(i);
      try {
        vectors += tasks.get(i).join();
        indexed++;
      } catch (RuntimeException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.error(
            "Indexing failed for artifact {} [{}]: {}",
            target.getArtifactId(),
            target.getArtifactType(),
            cause.getMessage(),
            cause);
        meterRegistry.counter("workspace.indexing.failures").increment();
        failed.add(target.getArtifactId());
      }
    }
    if (targets.size() > 1) {
      log.info(
          "Indexed {} of {} artifacts (1 main + {} sub-artifacts)",
          indexed,
          targets.size(),
          targets.size() - 1);
    }
    return new IndexingOutcome(indexed, vectors, failed);
  }

  /**
   * Replaces the index entries of one artifact: chunks in storage, vectors and full-text entries.
   *
   * @return number of vector records written
   */
  @VisibleForTesting
  int indexArtifact(Artifact artifact) {
    ReentrantLock lock =
        artifactLocks.computeIfAbsent(artifact.getArtifactId(), id -> new ReentrantLock());
    lock.lock();
    try {
      removeIndexEntries(artifact);
      boolean chunked =
          workspaceConfig.getChunking().isEnabled()
              && artifact.getArtifactType().supportsChunking();
      Optional<String> text = artifact.getEmbeddingText();
      if (text.isEmpty()) {
        if (chunked) {
          clearChunks(artifact);
        }
        log.info(
            "Skipping embedding of artifact {} [{}]: no content",
            artifact.getArtifactId(),
            artifact.getArtifactType());
        return 0;
      }
      if (chunked) {
        return indexChunks(artifact);
      }
      List<Float> vector = embeddingService.embedTexts(List.of(text.get())).get(0);
      VectorMetadata vectorMetadata = baseMetadata(artifact).build();
      vectorStore.upsert(
          getWorkspaceId(),
          List.of(new VectorRecord(artifact.getArtifactId(), vector, text.get(), vectorMetadata)));
      fulltextStore.index(
          getWorkspaceId(),
          List.of(
              new FulltextDocument(
                  artifact.getArtifactId(),
                  text.get(),
                  artifact.getArtifactId(),
                  null,
                  vectorMetadata.toMap())));
      log.info("Embedded artifact {} [{}]", artifact.getArtifactId(), artifact.getArtifactType());
      return 1;
    } finally {
      lock.unlock();
    }
  }

  private int indexChunks(Artifact artifact) {
    List<Chunk> chunks = chunkerRegistry.getChunker().chunk(artifact);
    if (chunks.isEmpty()) {
      log.info("Artifact {} produced no chunks", artifact.getArtifactId());
      clearChunks(artifact);
      return 0;
    }
    artifactRepository.storeArtifactChunks(artifact, chunks);
    artifact.setChunkList(chunks);

    List<List<Float>> vectors =
        embeddingService.embedTexts(chunks.stream().map(Chunk::getContent).toList());
    List<VectorRecord> records = new ArrayList<>(chunks.size());
    List<FulltextDocument> documents = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      Chunk chunk = chunks.get(i);
      VectorMetadata vectorMetadata =
          baseMetadata(artifact)
              .chunkId(chunk.getChunkId())
              .chunkIndex(chunk.getChunkIndex())
              .chunkSize(chunk.getChunkMetadata().getChunkSize())
              .chunkOverlap(chunk.getChunkMetadata().getChunkOverlap())
              .build();
      records.add(
          new VectorRecord(chunk.getChunkId(), vectors.get(i), chunk.getContent(), vectorMetadata));
      documents.add(
          new FulltextDocument(
              chunk.getChunkId(),
              chunk.getContent(),
              artifact.getArtifactId(),
              chunk.getChunkId(),
              vectorMetadata.toMap()));
    }
    vectorStore.upsert(getWorkspaceId(), records);
    fulltextStore.index(getWorkspaceId(), documents);
    log.info(
        "Chunked and embedded artifact {} [{}]: {} chunks",
        artifact.getArtifactId(),
        artifact.getArtifactType(),
        chunks.size());
    return records.size();
  }

  private VectorMetadata.VectorMetadataBuilder baseMetadata(Artifact artifact) {
    return VectorMetadata.builder()
        .artifactId(artifact.getArtifactId())
        .parentId(artifact.getParentId())
        .artifactType(artifact.getArtifactType().name())
        .embeddingModel(embeddingService.getModelName())
        .createdAt(artifact.getCreatedAt())
        .updatedAt(artifact.getUpdatedAt());
  }

  /** Chunk files, vectors and full-text entries must always describe the same content. */
  private void clearChunks(Artifact artifact) {
    artifactRepository.storeArtifactChunks(artifact, List.of());
    artifact.setChunkList(new ArrayList<>());
  }

  /** Removes an artifact's index entries and forgets its lock once no indexing holds it. */
  private void dropIndexEntries(Artifact artifact) {
    ReentrantLock lock =
        artifactLocks.computeIfAbsent(artifact.getArtifactId(), id -> new ReentrantLock());
    lock.lock();
    try {
      removeIndexEntries(artifact);
    } finally {
      artifactLocks.remove(artifact.getArtifactId(), lock);
      lock.unlock();
    }
  }

  @VisibleForTesting
  boolean hasIndexLock(String artifactId) {
    return artifactLocks.containsKey(artifactId);
  }

  private void removeIndexEntries(Artifact artifact) {
    vectorStore.delete(
        getWorkspaceId(), List.of(), Map.of(VectorMetadata.ARTIFACT_ID, artifact.getArtifactId()));
    fulltextStore.deleteByArtifact(getWorkspaceId(), artifact.getArtifactId());
  }

  // ---- helpers ----

  private Optional<Artifact> findArtifact(String artifactId) {
    return artifacts.stream().filter(a -> a.getArtifactId().equals(artifactId)).findFirst();
  }

  private void touch() {
    updatedAt = Instant.now().toString();
  }

  private void notifyListeners(WorkspaceEvent.Type type, Artifact artifact) {
    WorkspaceEvent event = WorkspaceEvent.of(type, getWorkspaceId(), artifact);
    for (WorkspaceEventListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        log.warn(
            "Listener {} failed on {} of artifact {}: {}",
            listener.getClass().getSimpleName(),
            type,
            artifact.getArtifactId(),
            e.getMessage(),
            e);
        meterRegistry.counter("workspace.listener.failures").increment();
      }
    }
  }

  private record IndexingOutcome(int indexed, int vectors, List<String> failedArtifactIds) {}
}
