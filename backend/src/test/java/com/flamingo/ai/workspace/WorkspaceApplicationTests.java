package com.flamingo.ai.workspace;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.workspace.fulltext.FulltextStore;
import com.flamingo.ai.workspace.fulltext.NoopFulltextStore;
import com.flamingo.ai.workspace.service.embedding.EmbeddingService;
import com.flamingo.ai.workspace.service.rerank.Bm25Reranker;
import com.flamingo.ai.workspace.service.rerank.RerankerRegistry;
import com.flamingo.ai.workspace.service.search.HybridSearchService;
import com.flamingo.ai.workspace.service.workspace.WorkspaceService;
import com.flamingo.ai.workspace.storage.ArtifactRepository;
import com.flamingo.ai.workspace.storage.LocalPathArtifactRepository;
import com.flamingo.ai.workspace.vector.InMemoryVectorStore;
import com.flamingo.ai.workspace.vector.VectorStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies that the application context loads without external services: in-memory vectors, local
 * storage under the temp directory, no embedding provider and no full-text backend.
 */
@SpringBootTest(
    properties = {
      "workspace.id=context-test",
      "workspace.vector-store.provider=memory",
      "workspace.embedding.enabled=false",
      "workspace.fulltext.enabled=false",
      "workspace.storage.type=local",
      "workspace.storage.local.base-path=${java.io.tmpdir}/workspace-context-test",
      "workspace.reranking.strategy=bm25"
    })
class WorkspaceApplicationTests {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Backends should follow the configured providers")
  void shouldSelectConfiguredBackends() {
    assertThat(applicationContext.getBean(VectorStore.class))
        .isInstanceOf(InMemoryVectorStore.class);
    assertThat(applicationContext.getBean(FulltextStore.class))
        .isInstanceOf(NoopFulltextStore.class);
    assertThat(applicationContext.getBean(ArtifactRepository.class))
        .isInstanceOf(LocalPathArtifactRepository.class);
    assertThat(applicationContext.getBean(RerankerRegistry.class).getReranker().getStrategy())
        .isEqualTo(Bm25Reranker.STRATEGY);
  }

  @Test
  @DisplayName("Core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(WorkspaceService.class).getWorkspaceId())
        .isEqualTo("context-test");
    assertThat(applicationContext.getBean(HybridSearchService.class)).isNotNull();
    assertThat(applicationContext.getBean(EmbeddingService.class).isEnabled()).isFalse();
  }
}
