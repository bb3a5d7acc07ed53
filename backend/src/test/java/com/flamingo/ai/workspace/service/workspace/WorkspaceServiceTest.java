package com.flamingo.ai.workspace.service.workspace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.workspace.config.WorkspaceConfig;
import com.flamingo.ai.workspace.domain.enums.ArtifactStatus;
import com.flamingo.ai.workspace.domain.enums.ArtifactType;
import com.flamingo.ai.workspace.domain.model.Artifact;
import com.flamingo.ai.workspace.domain.model.AttachmentFile;
import com.flamingo.ai.workspace.exception.EmbeddingException;
import com.flamingo.ai.workspace.exception.WorkspaceStorageException;
import com.flamingo.ai.workspace.fulltext.FulltextStore;
import com.flamingo.ai.workspace.service.chunking.ChunkerRegistry;
import com.flamingo.ai.workspace.service.embedding.EmbeddingService;
import com.flamingo.ai.workspace.service.search.ArtifactHit;
import com.flamingo.ai.workspace.service.search.ArtifactSearchQuery;
import com.flamingo.ai.workspace.service.search.HybridSearchService;
import com.flamingo.ai.workspace.storage.LocalPathArtifactRepository;
import com.flamingo.ai.workspace.vector.InMemoryVectorStore;
import com.flamingo.ai.workspace.vector.VectorRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WorkspaceServiceTest {

  private static final String WORKSPACE = "ws";
  private static final String THREE_LINES = "first line here\nsecond line here\nthird line here";

  @Mock private EmbeddingService embeddingService;
  @Mock private FulltextStore fulltextStore;
  @Mock private HybridSearchService hybridSearchService;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  @TempDir Path tempDir;

  private WorkspaceConfig workspaceConfig;
  private LocalPathArtifactRepository repository;
  private InMemoryVectorStore vectorStore;
  private final List<WorkspaceEvent> events = new ArrayList<>();
  private WorkspaceService workspaceService;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);
    lenient().when(embeddingService.isEnabled()).thenReturn(true);
    lenient().when(embeddingService.getModelName()).thenReturn("test-model");
    lenient()
        .when(embeddingService.embedTexts(anyList()))
        .thenAnswer(
            invocation -> {
              List<String> texts = invocation.getArgument(0);
              List<List<Float>> vectors = new ArrayList<>();
              for (int i = 0; i < texts.size(); i++) {
                vectors.add(List.of(1f, (float) i));
              }
              return vectors;
            });

    workspaceConfig = new WorkspaceConfig();
    workspaceConfig.setId(WORKSPACE);
    workspaceConfig.setName("My workspace");
    workspaceConfig.getChunking().setSize(20);
    workspaceConfig.getChunking().setOverlap(0);

    repository = new LocalPathArtifactRepository(tempDir, new ObjectMapper());
    vectorStore = new InMemoryVectorStore();
    workspaceService = newService();
  }

  private WorkspaceService newService() {
    return new WorkspaceService(
        workspaceConfig,
        repository,
        new ChunkerRegistry(workspaceConfig),
        embeddingService,
        vectorStore,
        fulltextStore,
        hybridSearchService,
        Runnable::run,
        List.<WorkspaceEventListener>of(
            events::add, new MetricsWorkspaceEventListener(meterRegistry)),
        meterRegistry);
  }

  private Artifact book() {
    Artifact chapter =
        Artifact.builder()
            .artifactId("ch1")
            .artifactType(ArtifactType.MARKDOWN)
            .content("# Chapter")
            .build();
    return Artifact.builder()
        .artifactId("book")
        .artifactType(ArtifactType.NOVEL)
        .content("intro")
        .metadata(Map.of("filename", "book.txt"))
        .sublist(List.of(chapter))
        .build();
  }

  @Nested
  @DisplayName("createArtifact")
  class CreateTests {

    @Test
    @DisplayName("should store, chunk, embed and announce a new artifact")
    void shouldCreateArtifact() {
      Artifact artifact =
          workspaceService.createArtifact(ArtifactType.TEXT, "doc1", THREE_LINES, Map.of());

      assertThat(repository.retrieveArtifact("doc1")).isPresent();
      assertThat(repository.getChunks("doc1", "")).hasSize(3);
      assertThat(artifact.getChunkList()).hasSize(3);
      assertThat(vectorStore.get(WORKSPACE))
          .extracting(VectorRecord::id)
          .containsExactlyInAnyOrder("doc1_chunk_0", "doc1_chunk_1", "doc1_chunk_2");
      assertThat(vectorStore.get(WORKSPACE).get(0).metadata().embeddingModel())
          .isEqualTo("test-model");
      verify(fulltextStore).index(eq(WORKSPACE), anyList());
      assertThat(events)
          .extracting(WorkspaceEvent::type)
          .containsExactly(WorkspaceEvent.Type.CREATED);
      verify(meterRegistry).counter("workspace.artifact.events", "type", "created");
    }

    @Test
    @DisplayName("should save the workspace index")
    void shouldSaveIndex() {
      workspaceService.createArtifact(ArtifactType.TEXT, "doc1", "hello", Map.of());

      @SuppressWarnings("unchecked")
      Map<String, Object> workspace =
          (Map<String, Object>) repository.getIndexData().orElseThrow().get("workspace");
      assertThat(workspace)
          .containsEntry("workspace_id", WORKSPACE)
          .containsEntry("artifact_ids", List.of("doc1"));
    }

    @Test
    @DisplayName("should reject a duplicate id")
    void shouldRejectDuplicate() {
      workspaceService.createArtifact(ArtifactType.TEXT, "doc1", "hello", Map.of());

      assertThatThrownBy(
              () -> workspaceService.createArtifact(ArtifactType.TEXT, "doc1", "again", Map.of()))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("doc1");
      assertThat(workspaceService.listArtifacts()).hasSize(1);
    }

    @Test
    @DisplayName("should index sub-artifacts under their parent")
    void shouldIndexSubArtifacts() {
      workspaceService.addArtifact(book());

      assertThat(repository.getChunks("ch1", "book")).hasSize(1);
      assertThat(vectorStore.get(WORKSPACE))
          .extracting(VectorRecord::id)
          .containsExactlyInAnyOrder("book_chunk_0", "ch1_chunk_0");
    }

    @Test
    @DisplayName("should keep the artifact when embedding fails")
    void shouldSurviveEmbeddingFailure() {
      doThrow(new EmbeddingException("Batch embedding failed", null))
          .when(embeddingService)
          .embedTexts(anyList());

      workspaceService.createArtifact(ArtifactType.TEXT, "doc1", "hello", Map.of());

      assertThat(workspaceService.getArtifact("doc1")).isPresent();
      assertThat(vectorStore.get(WORKSPACE)).isEmpty();
      verify(meterRegistry).counter("workspace.indexing.failures");
    }

    @Test
    @DisplayName("should not list an artifact whose storage failed and allow the id again")
    void shouldRollBackFailedStore() {
      Artifact broken =
          Artifact.builder()
              .artifactId("doc1")
              .artifactType(ArtifactType.TEXT)
              .content("hello")
              .attachmentFiles(
                  List.of(new AttachmentFile("a.txt", tempDir.resolve("absent.txt").toString())))
              .build();

      assertThatThrownBy(() -> workspaceService.addArtifact(broken))
          .isInstanceOf(WorkspaceStorageException.class);

      assertThat(workspaceService.listArtifacts()).isEmpty();
      assertThat(workspaceService.getArtifact("doc1")).isEmpty();
      assertThat(events).isEmpty();
      verify(meterRegistry).counter("workspace.artifact.add.failures");

      workspaceService.createArtifact(ArtifactType.TEXT, "doc1", "hello", Map.of());
      assertThat(workspaceService.listArtifacts())
          .extracting(Artifact::getArtifactId)
          .containsExactly("doc1");
    }

    @Test
    @DisplayName("should skip indexing when embedding is disabled")
    void shouldSkipIndexingWhenDisabled() {
      when(embeddingService.isEnabled()).thenReturn(false);

      workspaceService.createArtifact(ArtifactType.TEXT, "doc1", THREE_LINES, Map.of());

      assertThat(repository.retrieveArtifact("doc1")).isPresent();
      assertThat(repository.getChunks("doc1", "")).isEmpty();
      verify(embeddingService, never()).embedTexts(anyList());
    }

    @Test
    @DisplayName("should isolate failing listeners")
    void shouldIsolateListeners() {
      WorkspaceEventListener failing =
          event -> {
            throw new IllegalStateException("listener down");
          };
      WorkspaceService service =
          new WorkspaceService(
              workspaceConfig,
              repository,
              new ChunkerRegistry(workspaceConfig),
              embeddingService,
              vectorStore,
              fulltextStore,
              hybridSearchService,
              Runnable::run,
              List.<WorkspaceEventListener>of(failing, events::add),
              meterRegistry);

      service.createArtifact(ArtifactType.TEXT, "doc1", "hello", Map.of());

      assertThat(events).hasSize(1);
      verify(meterRegistry).counter("workspace.listener.failures");
    }
  }

  @Nested
  @DisplayName("updateArtifact")
  class UpdateTests {

    @Test
    @DisplayName("should re-chunk and replace the artifact's vectors")
    void shouldReplaceVectors() {
      workspaceService.createArtifact(ArtifactType.TEXT, "doc1", THREE_LINES, Map.of());

      Artifact updated =
          workspaceService.updateArtifact("doc1", "only line", "shorter").orElseThrow();

      assertThat(updated.getStatus()).isEqualTo(ArtifactStatus.EDITED);
      assertThat(repository.getChunks("doc1", "")).hasSize(1);
      assertThat(vectorStore.get(WORKSPACE))
          .extracting(VectorRecord::id)
          .containsExactly("doc1_chunk_0");
      verify(fulltextStore, atLeastOnce()).deleteByArtifact(WORKSPACE, "doc1");
      assertThat(events)
          .extracting(WorkspaceEvent::type)
          .containsExactly(WorkspaceEvent.Type.CREATED, WorkspaceEvent.Type.UPDATED);
    }

    @Test
    @DisplayName("should clear stored chunks and vectors when the content becomes empty")
    void shouldClearChunksForEmptyContent() {
      workspaceService.createArtifact(ArtifactType.TEXT, "doc1", THREE_LINES, Map.of());

      Artifact updated = workspaceService.updateArtifact("doc1", "", "emptied").orElseThrow();

      assertThat(updated.getChunkList()).isEmpty();
      assertThat(repository.getChunks("doc1", "")).isEmpty();
      assertThat(workspaceService.getChunkWindow("doc1", "", 0, 1, 1).isEmpty()).isTrue();
      assertThat(vectorStore.get(WORKSPACE)).isEmpty();
      verify(fulltextStore, atLeastOnce()).deleteByArtifact(WORKSPACE, "doc1");
    }

    @Test
    @DisplayName("should return empty for an unknown artifact")
    void shouldReturnEmptyForUnknown() {
      assertThat(workspaceService.updateArtifact("missing", "x", null)).isEmpty();
      assertThat(events).isEmpty();
    }
  }

  @Nested
  @DisplayName("deleteArtifact")
  class DeleteTests {

    @Test
    @DisplayName("should archive, unlist and unindex the artifact and its sub-artifacts")
    void shouldDelete() {
      workspaceService.addArtifact(book());

      assertThat(workspaceService.deleteArtifact("book")).isTrue();

      assertThat(workspaceService.listArtifacts()).isEmpty();
      assertThat(vectorStore.get(WORKSPACE)).isEmpty();
      verify(fulltextStore, atLeastOnce()).deleteByArtifact(WORKSPACE, "ch1");
      assertThat(repository.retrieveArtifact("book").orElseThrow())
          .containsEntry(Artifact.KEY_STATUS, ArtifactStatus.ARCHIVED.name());
      assertThat(events).extracting(WorkspaceEvent::type).endsWith(WorkspaceEvent.Type.DELETED);
    }

    @Test
    @DisplayName("should release the per-artifact locks of the artifact and its sub-artifacts")
    void shouldReleaseLocks() {
      workspaceService.addArtifact(book());
      assertThat(workspaceService.hasIndexLock("book")).isTrue();
      assertThat(workspaceService.hasIndexLock("ch1")).isTrue();

      workspaceService.deleteArtifact("book");

      assertThat(workspaceService.hasIndexLock("book")).isFalse();
      assertThat(workspaceService.hasIndexLock("ch1")).isFalse();
    }

    @Test
    @DisplayName("should return false for an unknown artifact")
    void shouldReturnFalseForUnknown() {
      assertThat(workspaceService.deleteArtifact("missing")).isFalse();
    }
  }

  @Nested
  @DisplayName("lookup and listing")
  class LookupTests {

    @Test
    @DisplayName("should filter the listing by type")
    void shouldListByType() {
      workspaceService.createArtifact(ArtifactType.TEXT, "a", "x", Map.of());
      workspaceService.createArtifact(ArtifactType.CODE, "b", "y", Map.of());

      assertThat(workspaceService.listArtifacts(List.of(ArtifactType.CODE)))
          .extracting(Artifact::getArtifactId)
          .containsExactly("b");
      assertThat(workspaceService.listArtifacts(List.of())).hasSize(2);
    }

    @Test
    @DisplayName("should restore artifacts and load sub-artifact content from storage")
    void shouldLoadFromStorage() {
      workspaceService.addArtifact(book());

      WorkspaceService reloaded = newService();
      reloaded.load();

      assertThat(reloaded.listArtifacts())
          .extracting(Artifact::getArtifactId)
          .containsExactly("book");
      assertThat(reloaded.getArtifact("ch1", "book"))
          .hasValueSatisfying(sub -> assertThat(sub.getContent()).isEqualTo("# Chapter"));
      assertThat(reloaded.getArtifact("ch1", "other")).isEmpty();
    }

    @Test
    @DisplayName("should skip artifacts whose descriptor is missing on load")
    void shouldSkipMissingOnLoad() throws Exception {
      workspaceService.createArtifact(ArtifactType.TEXT, "a", "x", Map.of());
      workspaceService.createArtifact(ArtifactType.TEXT, "b", "y", Map.of());
      Files.delete(repository.getRoot().resolve("artifacts/a/index.json"));

      WorkspaceService reloaded = newService();
      reloaded.load();

      assertThat(reloaded.listArtifacts()).extracting(Artifact::getArtifactId).containsExactly("b");
    }

    @Test
    @DisplayName("should build the tree with depths and parent ids")
    void shouldBuildTree() {
      workspaceService.addArtifact(book());

      TreeNode root = workspaceService.generateTreeData();

      assertThat(root.name()).isEqualTo("My workspace");
      assertThat(root.id()).isEqualTo("-1");
      TreeNode bookNode = root.children().get(0);
      assertThat(bookNode.name()).isEqualTo("book.txt");
      assertThat(bookNode.parentId()).isEqualTo("-1");
      assertThat(bookNode.depth()).isEqualTo(1);
      assertThat(bookNode.expanded()).isFalse();
      TreeNode chapterNode = bookNode.children().get(0);
      assertThat(chapterNode.artifactId()).isEqualTo("ch1");
      assertThat(chapterNode.parentId()).isEqualTo("book");
      assertThat(chapterNode.depth()).isEqualTo(2);
    }

    @Test
    @DisplayName("should validate chunk window arguments")
    void shouldValidateWindowArguments() {
      assertThatThrownBy(() -> workspaceService.getChunkWindow("doc1", null, -1, 0, 0))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> workspaceService.getChunkWindow("doc1", null, 0, -1, 0))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should read chunk windows through the repository")
    void shouldReadChunkWindow() {
      workspaceService.createArtifact(ArtifactType.TEXT, "doc1", THREE_LINES, Map.of());

      assertThat(workspaceService.getChunkWindow("doc1", null, 1, 5, 5).preChunks()).hasSize(1);
      assertThat(workspaceService.getChunkWindow("doc1", null, 1, 5, 5).nextChunks()).hasSize(1);
    }
  }

  @Nested
  @DisplayName("retrieval and rebuild")
  class RetrievalTests {

    @Test
    @DisplayName("should resolve artifact hits and skip unknown artifacts")
    void shouldRetrieveArtifacts() {
      workspaceService.createArtifact(ArtifactType.TEXT, "doc1", "hello", Map.of());
      ArtifactSearchQuery query = ArtifactSearchQuery.builder().query("hello").build();
      when(hybridSearchService.searchArtifacts(query))
          .thenReturn(
              List.of(
                  new ArtifactHit("doc1", "", "TEXT", "doc1_chunk_0", 0.9),
                  new ArtifactHit("gone", "", "TEXT", "gone_chunk_0", 0.8)));

      List<ArtifactSearchResult> results = workspaceService.retrieveArtifacts(query);

      assertThat(results).hasSize(1);
      assertThat(results.get(0).artifact().getArtifactId()).isEqualTo("doc1");
      assertThat(results.get(0).score()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("should rebuild every artifact idempotently")
    void shouldRebuild() {
      workspaceService.createArtifact(ArtifactType.TEXT, "doc1", THREE_LINES, Map.of());
      workspaceService.addArtifact(book());

      RebuildReport first = workspaceService.rebuildIndex();
      RebuildReport second = workspaceService.rebuildIndex();

      assertThat(first.artifactsIndexed()).isEqualTo(3);
      assertThat(first.vectorsWritten()).isEqualTo(5);
      assertThat(first.isComplete()).isTrue();
      assertThat(second.vectorsWritten()).isEqualTo(first.vectorsWritten());
      assertThat(vectorStore.get(WORKSPACE)).hasSize(5);
    }

    @Test
    @DisplayName("should report artifacts that failed to index")
    void shouldReportFailures() {
      workspaceService.createArtifact(ArtifactType.TEXT, "doc1", "hello", Map.of());
      doThrow(new EmbeddingException("down", null)).when(embeddingService).embedTexts(anyList());

      RebuildReport report = workspaceService.rebuildIndex();

      assertThat(report.failedArtifactIds()).containsExactly("doc1");
      assertThat(report.isComplete()).isFalse();
    }

    @Test
    @DisplayName("should do nothing when embedding is disabled")
    void shouldSkipRebuildWhenDisabled() {
      when(embeddingService.isEnabled()).thenReturn(false);

      RebuildReport report = workspaceService.rebuildIndex();

      assertThat(report.artifactsIndexed()).isZero();
      assertThat(report.isComplete()).isTrue();
    }
  }
}
