package com.flamingo.ai.workspace.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.KnnSearch;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import co.elastic.clients.elasticsearch.indices.GetIndexResponse;
import co.elastic.clients.elasticsearch.indices.IndexState;
import co.elastic.clients.transport.endpoints.BooleanResponse;
import com.flamingo.ai.workspace.config.WorkspaceConfig;
import com.flamingo.ai.workspace.vector.VectorSearchHit;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ElasticsearchVectorStoreTest {

  private static final String COLLECTION = "ws";
  private static final List<List<Float>> QUERY = List.of(List.of(1f, 0f));

  @Mock private ElasticsearchClient elasticsearchClient;
  @Mock private ElasticsearchIndicesClient indicesClient;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private ElasticsearchVectorStore vectorStore;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() throws IOException {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    lenient().when(elasticsearchClient.indices()).thenReturn(indicesClient);
    lenient()
        .when(indicesClient.exists(any(Function.class)))
        .thenReturn(new BooleanResponse(true));
    vectorStore =
        new ElasticsearchVectorStore(elasticsearchClient, meterRegistry, new WorkspaceConfig());
  }

  private static Hit<VectorDocument> hit(String id, double score) {
    VectorDocument document =
        VectorDocument.builder()
            .artifactId("doc1")
            .chunkId(id)
            .chunkIndex(0)
            .content("text of " + id)
            .build();
    return Hit.of(h -> h.index("workspace-vectors-ws").id(id).score(score).source(document));
  }

  private static SearchResponse<VectorDocument> response(List<Hit<VectorDocument>> hits) {
    return SearchResponse.of(
        r ->
            r.took(1)
                .timedOut(false)
                .shards(s -> s.total(1).successful(1).failed(0))
                .hits(h -> h.hits(hits)));
  }

  private void respondWith(List<Hit<VectorDocument>> hits) throws IOException {
    when(elasticsearchClient.search(any(SearchRequest.class), eq(VectorDocument.class)))
        .thenReturn(response(hits));
  }

  @Nested
  @DisplayName("search")
  class SearchTests {

    @Test
    @DisplayName("should report kNN scores as similarities in [0, 1], best first")
    void shouldMapScores() throws IOException {
      respondWith(List.of(hit("c", 0.5), hit("a", 1.0), hit("b", 0.75), hit("z", 0.0)));

      List<VectorSearchHit> hits = vectorStore.search(COLLECTION, QUERY, Map.of(), 10, 0.0);

      assertThat(hits).extracting(h -> h.record().id()).containsExactly("a", "b", "c", "z");
      assertThat(hits.get(0).score()).isCloseTo(1.0, within(1e-9));
      assertThat(hits.get(1).score()).isCloseTo(0.75, within(1e-9));
      assertThat(hits.get(2).score()).isCloseTo(0.5, within(1e-9));
      assertThat(hits.get(3).score()).isCloseTo(0.0, within(1e-9));
      assertThat(hits.get(0).record().content()).isEqualTo("text of a");
      assertThat(hits.get(0).record().metadata().artifactId()).isEqualTo("doc1");
      assertThat(hits.get(0).record().embedding()).isEmpty();
    }

    @Test
    @DisplayName("should drop hits below the threshold and cut to the limit")
    void shouldApplyThresholdAndLimit() throws IOException {
      respondWith(List.of(hit("a", 0.95), hit("b", 0.8), hit("c", 0.6), hit("d", 0.4)));

      List<VectorSearchHit> hits = vectorStore.search(COLLECTION, QUERY, Map.of(), 2, 0.5);

      assertThat(hits).extracting(h -> h.record().id()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("should keep the best score of a record across query vectors")
    void shouldMergeQueryVectors() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(VectorDocument.class)))
          .thenReturn(response(List.of(hit("a", 0.6), hit("b", 0.7))))
          .thenReturn(response(List.of(hit("a", 0.9))));

      List<VectorSearchHit> hits =
          vectorStore.search(
              COLLECTION, List.of(List.of(1f, 0f), List.of(0f, 1f)), Map.of(), 5, 0.0);

      assertThat(hits).extracting(h -> h.record().id()).containsExactly("a", "b");
      assertThat(hits.get(0).score()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    @DisplayName("should send a kNN request on the embedding field sized to the limit")
    void shouldBuildKnnRequest() throws IOException {
      respondWith(new ArrayList<>());
      ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);

      vectorStore.search(COLLECTION, QUERY, Map.of("artifact_id", "doc1"), 3, 0.0);

      verify(elasticsearchClient).search(captor.capture(), eq(VectorDocument.class));
      SearchRequest request = captor.getValue();
      assertThat(request.index()).containsExactly(vectorStore.indexName(COLLECTION));
      KnnSearch knn = request.knn().get(0);
      assertThat(knn.field()).isEqualTo(ElasticsearchVectorStore.EMBEDDING);
      assertThat(knn.k()).isEqualTo(3);
      assertThat(knn.numCandidates()).isEqualTo(10);
      assertThat(knn.filter()).hasSize(1);
      assertThat(request.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("should return nothing without searching when the index does not exist")
    @SuppressWarnings("unchecked")
    void shouldSkipMissingIndex() throws IOException {
      when(indicesClient.exists(any(Function.class))).thenReturn(new BooleanResponse(false));

      assertThat(vectorStore.search(COLLECTION, QUERY, Map.of(), 5, 0.0)).isEmpty();
      assertThat(vectorStore.search(COLLECTION, QUERY, Map.of(), 0, 0.0)).isEmpty();
      verify(elasticsearchClient, never())
          .search(any(SearchRequest.class), eq(VectorDocument.class));
    }
  }

  @Nested
  @DisplayName("reset")
  class ResetTests {

    @Test
    @DisplayName("should delete every index carrying the store prefix")
    @SuppressWarnings("unchecked")
    void shouldDeleteAllPrefixedIndices() throws IOException {
      GetIndexResponse response = mock(GetIndexResponse.class);
      when(response.indices())
          .thenReturn(
              Map.of(
                  "workspace-vectors-a", mock(IndexState.class),
                  "workspace-vectors-b", mock(IndexState.class)));
      when(indicesClient.get(any(Function.class))).thenReturn(response);

      vectorStore.reset();

      verify(indicesClient, times(2)).delete(any(Function.class));
    }
  }
}
