package com.flamingo.ai.workspace.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.workspace.config.WorkspaceConfig;
import com.flamingo.ai.workspace.fulltext.FulltextDocument;
import com.flamingo.ai.workspace.fulltext.FulltextHit;
import com.flamingo.ai.workspace.fulltext.FulltextStore;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

/** {@link FulltextStore} on an analyzed Elasticsearch text field. */
@Service
@ConditionalOnProperty(name = "workspace.fulltext.enabled", havingValue = "true")
@Slf4j
public class ElasticsearchFulltextStore extends AbstractElasticsearchCollectionStore
    implements FulltextStore {

  static final String CONTENT = "content";
  static final String ARTIFACT_ID = "artifact_id";
  static final String CHUNK_ID = "chunk_id";
  static final String METADATA = "metadata";

  private final String analyzer;

  public ElasticsearchFulltextStore(
      @Lazy ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      WorkspaceConfig workspaceConfig) {
    super(elasticsearchClient, meterRegistry, workspaceConfig.getFulltext().getIndexPrefix());
    this.analyzer = workspaceConfig.getFulltext().getAnalyzer();
    if (!"standard".equals(analyzer)
        && !"ik_max_word".equals(analyzer)
        && !"ik_smart".equals(analyzer)) {
      log.warn("Using custom analyzer '{}'. Ensure it's installed in Elasticsearch.", analyzer);
    }
  }

  @Override
  protected Map<String, Property> defineIndexProperties(Integer vectorDimensions) {
    Map<String, Property> properties = new HashMap<>();
    properties.put(
        CONTENT, Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(analyzer)))));
    properties.put(ARTIFACT_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(CHUNK_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(METADATA, Property.of(p -> p.object(o -> o.enabled(false))));
    return properties;
  }

  @Override
  protected String getMetricPrefix() {
    return "fulltext";
  }

  @Override
  @Timed(value = "fulltext.index", description = "Time to index full-text documents")
  @CircuitBreaker(name = "elasticsearch")
  public void index(String collection, List<FulltextDocument> documents) {
    if (documents.isEmpty()) {
      return;
    }
    ensureIndex(collection, null);
    String index = indexName(collection);
    List<BulkOperation> operations = new ArrayList<>(documents.size());
    for (FulltextDocument document : documents) {
      FulltextIndexDocument source = FulltextIndexDocument.from(document);
      operations.add(
          BulkOperation.of(
              op -> op.index(idx -> idx.index(index).id(document.id()).document(source))));
    }
    bulk(collection, operations);
  }

  @Override
  @Timed(value = "fulltext.search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch")
  public List<FulltextHit> search(
      String collection, String query, Map<String, Object> filter, int limit, int offset) {
    if (limit <= 0 || !indexExists(collection)) {
      return List.of();
    }
    String index = indexName(collection);
    Query filterQuery = filterQuery(filter);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(index)
                    .query(
                        q ->
                            q.bool(
                                b ->
                                    b.filter(filterQuery)
                                        .must(m -> m.match(mt -> mt.field(CONTENT).query(query)))))
                    .from(Math.max(0, offset))
                    .size(limit));
    List<FulltextHit> hits = new ArrayList<>();
    for (Hit<FulltextIndexDocument> hit :
        search(collection, request, FulltextIndexDocument.class)) {
      if (hit.source() != null) {
        hits.add(hit.source().toHit(hit.id(), hit.score() == null ? 0.0 : hit.score()));
      }
    }
    meterRegistry.counter(getMetricPrefix() + ".keyword_search").increment();
    log.debug("[keywordSearch] index={} query='{}' returned={}", index, query, hits.size());
    return hits;
  }

  @Override
  public void deleteByArtifact(String collection, String artifactId) {
    if (!indexExists(collection)) {
      return;
    }
    deleteByQuery(
        collection, Query.of(q -> q.term(t -> t.field(ARTIFACT_ID).value(artifactId))));
  }

  @Override
  public void deleteCollection(String collection) {
    deleteIndex(collection);
  }
}
