package com.flamingo.ai.workspace.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.workspace.config.WorkspaceConfig;
import com.flamingo.ai.workspace.vector.VectorMetadata;
import com.flamingo.ai.workspace.vector.VectorRecord;
import com.flamingo.ai.workspace.vector.VectorSearchHit;
import com.flamingo.ai.workspace.vector.VectorStore;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

/**
 * {@link VectorStore} on an Elasticsearch {@code dense_vector} field with cosine similarity.
 *
 * <p>For cosine fields Elasticsearch scores kNN hits as {@code (1 + cos) / 2}, which equals {@code 1
 * - d/2} for the cosine distance {@code d = 1 - cos}; hit scores therefore come back already
 * normalized.
 */
@Service
@ConditionalOnProperty(
    name = "workspace.vector-store.provider",
    havingValue = "elasticsearch",
    matchIfMissing = true)
@Slf4j
public class ElasticsearchVectorStore extends AbstractElasticsearchCollectionStore
    implements VectorStore {

  static final String CONTENT = "content";
  static final String EMBEDDING = "embedding";
  private static final int MAX_RESULT_WINDOW = 10_000;

  public ElasticsearchVectorStore(
      @Lazy ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      WorkspaceConfig workspaceConfig) {
    super(
        elasticsearchClient, meterRegistry, workspaceConfig.getVectorStore().getIndexPrefix());
  }

  @Override
  protected Map<String, Property> defineIndexProperties(Integer vectorDimensions) {
    Map<String, Property> properties = new HashMap<>();
    properties.put(CONTENT, Property.of(p -> p.text(t -> t)));
    if (vectorDimensions != null) {
      properties.put(
          EMBEDDING,
          Property.of(
              p ->
                  p.denseVector(
                      DenseVectorProperty.of(
                          d ->
                              d.dims(vectorDimensions)
                                  .index(true)
                                  .similarity(DenseVectorSimilarity.Cosine)))));
    }
    // identity fields MUST be keyword/integer for exact term filters
    for (String field :
        List.of(
            VectorMetadata.ARTIFACT_ID,
            VectorMetadata.PARENT_ID,
            VectorMetadata.ARTIFACT_TYPE,
            VectorMetadata.CHUNK_ID,
            VectorMetadata.EMBEDDING_MODEL,
            VectorMetadata.CREATED_AT,
            VectorMetadata.UPDATED_AT)) {
      properties.put(field, Property.of(p -> p.keyword(k -> k)));
    }
    for (String field :
        List.of(
            VectorMetadata.CHUNK_INDEX, VectorMetadata.CHUNK_SIZE, VectorMetadata.CHUNK_OVERLAP)) {
      properties.put(field, Property.of(p -> p.integer(i -> i)));
    }
    return properties;
  }

  @Override
  protected String getMetricPrefix() {
    return "vector_store";
  }

  @Override
  @Timed(value = "vector_store.insert", description = "Time to insert vectors")
  @CircuitBreaker(name = "elasticsearch")
  public void insert(String collection, List<VectorRecord> records) {
    write(collection, records, false);
  }

  @Override
  @Timed(value = "vector_store.upsert", description = "Time to upsert vectors")
  @CircuitBreaker(name = "elasticsearch")
  public void upsert(String collection, List<VectorRecord> records) {
    write(collection, records, true);
  }

  private void write(String collection, List<VectorRecord> records, boolean overwrite) {
    if (records.isEmpty()) {
      return;
    }
    ensureIndex(collection, records.get(0).embedding().size());
    String index = indexName(collection);
    List<BulkOperation> operations = new ArrayList<>(records.size());
    for (VectorRecord record : records) {
      VectorDocument document = VectorDocument.from(record);
      if (overwrite) {
        operations.add(
            BulkOperation.of(
                op -> op.index(idx -> idx.index(index).id(record.id()).document(document))));
      } else {
        operations.add(
            BulkOperation.of(
                op -> op.create(c -> c.index(index).id(record.id()).document(document))));
      }
    }
    bulk(collection, operations);
  }

  @Override
  @Timed(value = "vector_store.search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch")
  public List<VectorSearchHit> search(
      String collection,
      List<List<Float>> queryVectors,
      Map<String, Object> filter,
      int limit,
      double threshold) {
    if (limit <= 0 || queryVectors.isEmpty() || !indexExists(collection)) {
      return List.of();
    }
    String index = indexName(collection);
    boolean filtered = filter != null && !filter.isEmpty();
    Query filterQuery = filterQuery(filter);

    Map<String, VectorSearchHit> best = new LinkedHashMap<>();
    for (List<Float> queryVector : queryVectors) {
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(index)
                      .knn(
                          k -> {
                            k.field(EMBEDDING)
                                .queryVector(queryVector)
                                .k(limit)
                                .numCandidates(Math.max(limit * 2, 10));
                            if (filtered) {
                              k.filter(filterQuery);
                            }
                            return k;
                          })
                      .source(src -> src.filter(f -> f.excludes(EMBEDDING)))
                      .size(limit));
      for (Hit<VectorDocument> hit : search(collection, request, VectorDocument.class)) {
        if (hit.score() == null || hit.source() == null) {
          continue;
        }
        double similarity = VectorStore.similarityFromCosineDistance(2.0 * (1.0 - hit.score()));
        if (similarity < threshold) {
          continue;
        }
        VectorSearchHit candidate = new VectorSearchHit(hit.source().toRecord(hit.id()), similarity);
        best.merge(hit.id(), candidate, (a, b) -> a.score() >= b.score() ? a : b);
      }
    }
    meterRegistry.counter(getMetricPrefix() + ".search").increment();
    List<VectorSearchHit> hits =
        best.values().stream()
            .sorted(Comparator.comparingDouble(VectorSearchHit::score).reversed())
            .limit(limit)
            .toList();
    log.debug(
        "[vectorSearch] index={} vectors={} returned={} threshold={}",
        index,
        queryVectors.size(),
        hits.size(),
        threshold);
    return hits;
  }

  @Override
  public List<VectorRecord> query(String collection, Map<String, Object> filter, int limit) {
    if (limit <= 0 || !indexExists(collection)) {
      return List.of();
    }
    String index = indexName(collection);
    Query query = filterQuery(filter);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(index)
                    .query(query)
                    .source(src -> src.filter(f -> f.excludes(EMBEDDING)))
                    .size(Math.min(limit, MAX_RESULT_WINDOW)));
    List<VectorRecord> records = new ArrayList<>();
    for (Hit<VectorDocument> hit : search(collection, request, VectorDocument.class)) {
      if (hit.source() != null) {
        records.add(hit.source().toRecord(hit.id()));
      }
    }
    return records;
  }

  @Override
  public List<VectorRecord> get(String collection) {
    return query(collection, Map.of(), MAX_RESULT_WINDOW);
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public void delete(String collection, List<String> ids, Map<String, Object> filter) {
    if (!indexExists(collection)) {
      return;
    }
    if (ids != null && !ids.isEmpty()) {
      deleteByQuery(collection, Query.of(q -> q.ids(i -> i.values(ids))));
    } else if (filter != null && !filter.isEmpty()) {
      deleteByQuery(collection, filterQuery(filter));
    } else {
      deleteIndex(collection);
    }
  }

  @Override
  public boolean hasCollection(String collection) {
    return indexExists(collection);
  }

  @Override
  public void deleteCollection(String collection) {
    deleteIndex(collection);
  }

  @Override
  public void reset() {
    deleteAllIndices();
  }
}
