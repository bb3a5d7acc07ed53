package com.flamingo.ai.workspace.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.workspace.domain.enums.ArtifactStatus;
import com.flamingo.ai.workspace.domain.enums.ArtifactType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ArtifactTest {

  private static Artifact artifact(String id, String content) {
    return Artifact.builder().artifactId(id).artifactType(ArtifactType.TEXT).content(content).build();
  }

  @Nested
  @DisplayName("construction")
  class ConstructionTests {

    @Test
    @DisplayName("should generate an id when none is given")
    void shouldGenerateId() {
      Artifact artifact = Artifact.builder().artifactType(ArtifactType.TEXT).build();

      assertThat(artifact.getArtifactId()).isNotBlank();
      assertThat(artifact.isRoot()).isTrue();
    }

    @Test
    @DisplayName("should start as draft with one history entry")
    void shouldStartAsDraft() {
      Artifact artifact = artifact("doc1", "hello");

      assertThat(artifact.getStatus()).isEqualTo(ArtifactStatus.DRAFT);
      assertThat(artifact.getVersionHistory()).hasSize(1);
      assertThat(artifact.getVersionHistory().get(0).content()).isEqualTo("hello");
    }

    @Test
    @DisplayName("should stamp sub-artifacts with the parent id")
    void shouldStampSubArtifacts() {
      Artifact child = artifact("page1", "text");
      Artifact parent =
          Artifact.builder()
              .artifactId("book")
              .artifactType(ArtifactType.NOVEL)
              .sublist(List.of(child))
              .build();

      assertThat(child.getParentId()).isEqualTo("book");
      assertThat(child.isRoot()).isFalse();
      assertThat(parent.findSubArtifact("page1")).contains(child);
    }

    @Test
    @DisplayName("should reject a missing type")
    void shouldRejectMissingType() {
      assertThatThrownBy(() -> Artifact.builder().artifactId("x").build())
          .isInstanceOf(NullPointerException.class);
    }
  }

  @Nested
  @DisplayName("lifecycle")
  class LifecycleTests {

    @Test
    @DisplayName("should append history on every transition")
    void shouldAppendHistory() {
      Artifact artifact = artifact("doc1", "v1");

      artifact.updateContent("v2", "second");
      artifact.markComplete();

      assertThat(artifact.getStatus()).isEqualTo(ArtifactStatus.COMPLETE);
      assertThat(artifact.getVersionHistory())
          .extracting(VersionRecord::description)
          .containsExactly("Initial version", "second", "Marked as complete");
      assertThat(artifact.getContent()).isEqualTo("v2");
    }

    @Test
    @DisplayName("should treat archived as terminal")
    void shouldTreatArchivedAsTerminal() {
      Artifact artifact = artifact("doc1", "v1");
      artifact.archive();
      artifact.archive();

      assertThat(artifact.isArchived()).isTrue();
      assertThat(artifact.getVersionHistory()).hasSize(2);
      assertThatThrownBy(() -> artifact.updateContent("v2", null))
          .isInstanceOf(IllegalStateException.class);
      assertThatThrownBy(artifact::markComplete).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should revert to an earlier version and record it")
    void shouldRevert() {
      Artifact artifact = artifact("doc1", "v1");
      artifact.updateContent("v2", null);

      assertThat(artifact.revertToVersion(0)).isTrue();
      assertThat(artifact.getContent()).isEqualTo("v1");
      assertThat(artifact.getStatus()).isEqualTo(ArtifactStatus.DRAFT);
      assertThat(artifact.getVersionHistory()).hasSize(3);
      assertThat(artifact.revertToVersion(42)).isFalse();
    }
  }

  @Nested
  @DisplayName("metadata")
  class MetadataTests {

    @Test
    @DisplayName("should fail loudly on missing required metadata")
    void shouldRequireMetadata() {
      Artifact artifact =
          Artifact.builder()
              .artifactId("doc1")
              .artifactType(ArtifactType.TEXT)
              .metadata(Map.of("filename", "notes.txt"))
              .build();

      assertThat(artifact.requireMetadata("filename")).isEqualTo("notes.txt");
      assertThat(artifact.getDisplayName()).isEqualTo("notes.txt");
      assertThatThrownBy(() -> artifact.requireMetadata("author"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("author");
    }

    @Test
    @DisplayName("should have no embedding text when content is empty")
    void shouldHaveNoEmbeddingTextWhenEmpty() {
      assertThat(artifact("a", "").getEmbeddingText()).isEmpty();
      assertThat(artifact("b", null).getEmbeddingText()).isEmpty();
      assertThat(artifact("c", "text").getEmbeddingText()).contains("text");
    }
  }

  @Nested
  @DisplayName("wire form")
  class WireFormTests {

    @Test
    @DisplayName("should restore identity, status, history and sub-artifacts")
    void shouldRestoreFromMap() {
      Artifact parent =
          Artifact.builder()
              .artifactId("book")
              .artifactType(ArtifactType.NOVEL)
              .content("intro")
              .metadata(Map.of("filename", "book.txt"))
              .sublist(List.of(artifact("ch1", "chapter one")))
              .build();
      parent.updateContent("intro v2", "edit");

      Artifact restored = Artifact.fromMap(parent.toMap()).orElseThrow();

      assertThat(restored.getArtifactId()).isEqualTo("book");
      assertThat(restored.getStatus()).isEqualTo(ArtifactStatus.EDITED);
      assertThat(restored.getContent()).isEqualTo("intro v2");
      assertThat(restored.getVersionHistory()).hasSize(2);
      assertThat(restored.getCreatedAt()).isEqualTo(parent.getCreatedAt());
      assertThat(restored.getSublist()).hasSize(1);
      assertThat(restored.getSublist().get(0).getParentId()).isEqualTo("book");
    }

    @Test
    @DisplayName("should omit history of sub-artifacts")
    void shouldOmitSubHistory() {
      Artifact parent =
          Artifact.builder()
              .artifactId("book")
              .artifactType(ArtifactType.NOVEL)
              .sublist(List.of(artifact("ch1", "x")))
              .build();

      @SuppressWarnings("unchecked")
      List<Map<String, Object>> subs =
          (List<Map<String, Object>>) parent.toMap(true).get(Artifact.KEY_SUBLIST);

      assertThat(subs.get(0)).doesNotContainKey(Artifact.KEY_VERSION_HISTORY);
    }

    @Test
    @DisplayName("should return empty for a map without artifact id")
    void shouldReturnEmptyWithoutId() {
      assertThat(Artifact.fromMap(Map.of("artifact_type", "TEXT"))).isEmpty();
      assertThat(Artifact.fromMap(null)).isEmpty();
    }
  }
}
