package com.flamingo.ai.workspace.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.workspace.exception.SearchException;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for stores that keep one Elasticsearch index per collection.
 *
 * <p>Indices are named {@code {prefix}-{collection}} and created on first write. On first use of
 * an existing index its mapping is checked: missing fields are added, type mismatches fail fast.
 */
@Slf4j
public abstract class AbstractElasticsearchCollectionStore {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;
  private final String indexPrefix;
  private final Set<String> verifiedIndices = ConcurrentHashMap.newKeySet();

  protected AbstractElasticsearchCollectionStore(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, String indexPrefix) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexPrefix = sanitize(indexPrefix);
  }

  /**
   * Defines the index properties (schema).
   *
   * @param vectorDimensions dimensions of the dense vector field, or null when unknown
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties(Integer vectorDimensions);

  /** Metric name prefix, e.g. {@code vector_store}. */
  protected abstract String getMetricPrefix();

  /** Index holding {@code collection}. */
  public String indexName(String collection) {
    return indexPrefix + "-" + sanitize(collection);
  }

  protected boolean indexExists(String collection) {
    String index = indexName(collection);
    if (verifiedIndices.contains(index)) {
      return true;
    }
    try {
      return elasticsearchClient.indices().exists(e -> e.index(index)).value();
    } catch (IOException e) {
      log.error("Failed to check index {}: {}", index, e.getMessage(), e);
      throw new SearchException(index, "Failed to check index", e);
    }
  }

  /** Creates the index for {@code collection}, or validates its mapping if it already exists. */
  protected void ensureIndex(String collection, Integer vectorDimensions) {
    String index = indexName(collection);
    if (verifiedIndices.contains(index)) {
      return;
    }
    try {
      Map<String, Property> properties = defineIndexProperties(vectorDimensions);
      if (elasticsearchClient.indices().exists(e -> e.index(index)).value()) {
        updateAndValidateMappings(index, properties);
      } else {
        // dynamic=false keeps Elasticsearch from auto-mapping undeclared fields
        CreateIndexRequest request =
            CreateIndexRequest.of(
                c ->
                    c.index(index)
                        .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
        elasticsearchClient.indices().create(request);
        log.info("Created Elasticsearch index: {}", index);
      }
      verifiedIndices.add(index);
    } catch (IOException e) {
      log.error("Failed to initialize Elasticsearch index '{}': {}", index, e.getMessage(), e);
      throw new SearchException(index, "Failed to initialize index", e);
    }
  }

  private void updateAndValidateMappings(String index, Map<String, Property> expected)
      throws IOException {
    var response = elasticsearchClient.indices().getMapping(g -> g.index(index));
    var indexMapping = response.get(index);
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actual = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expected.entrySet()) {
      Property existing = actual.get(entry.getKey());
      if (existing != null && existing._kind() != entry.getValue()._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), existing._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      log.error("Mapping mismatch in index '{}': {}", index, mismatches);
      throw new IllegalStateException(
          "Index '"
              + index
              + "' has incompatible field type(s): "
              + String.join("; ", mismatches)
              + ". Delete the index and rebuild the workspace index.");
    }

    Map<String, Property> missing = new HashMap<>();
    for (Map.Entry<String, Property> entry : expected.entrySet()) {
      if (!actual.containsKey(entry.getKey())) {
        missing.put(entry.getKey(), entry.getValue());
      }
    }
    if (!missing.isEmpty()) {
      elasticsearchClient
          .indices()
          .putMapping(PutMappingRequest.of(p -> p.index(index).properties(missing)));
      log.info("Added {} new field(s) to index '{}': {}", missing.size(), index, missing.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", index);
    }
  }

  /** Sends bulk operations against {@code collection}, waiting until they are searchable. */
  protected void bulk(String collection, List<BulkOperation> operations) {
    if (operations.isEmpty()) {
      return;
    }
    String index = indexName(collection);
    try {
      BulkResponse response =
          elasticsearchClient.bulk(
              BulkRequest.of(b -> b.operations(operations).refresh(Refresh.WaitFor)));
      if (response.errors()) {
        long failed = response.items().stream().filter(i -> i.error() != null).count();
        log.warn("{} of {} bulk operations failed in {}", failed, operations.size(), index);
        response.items().stream()
            .filter(i -> i.error() != null)
            .limit(5)
            .forEach(i -> log.warn("  id={} error={}", i.id(), i.error().reason()));
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment(failed);
      } else {
        log.debug("Applied {} bulk operations to {}", operations.size(), index);
        meterRegistry.counter(getMetricPrefix() + ".indexed").increment(operations.size());
      }
    } catch (IOException e) {
      log.error("Failed to index documents to {}: {}", index, e.getMessage(), e);
      throw new SearchException(index, "Failed to index documents", e);
    }
  }

  /**
   * Runs a search and maps each hit's source to {@code documentType}; the caller builds the
   * request against {@link #indexName(String)}.
   */
  protected <T> List<Hit<T>> search(
      String collection, SearchRequest request, Class<T> documentType) {
    try {
      SearchResponse<T> response = elasticsearchClient.search(request, documentType);
      return response.hits().hits();
    } catch (IOException e) {
      log.error("Search failed for {}: {}", indexName(collection), e.getMessage(), e);
      throw new SearchException(indexName(collection), "Search failed", e);
    }
  }

  protected void deleteByQuery(String collection, Query query) {
    String index = indexName(collection);
    try {
      elasticsearchClient.deleteByQuery(
          DeleteByQueryRequest.of(d -> d.index(index).query(query).refresh(true)));
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
      log.info("Deleted documents from {}", index);
    } catch (IOException e) {
      log.error("Failed to delete documents from {}: {}", index, e.getMessage(), e);
      throw new SearchException(index, "Failed to delete documents", e);
    }
  }

  protected void deleteIndex(String collection) {
    String index = indexName(collection);
    if (!indexExists(collection)) {
      return;
    }
    try {
      elasticsearchClient.indices().delete(d -> d.index(index));
      verifiedIndices.remove(index);
      log.info("Deleted Elasticsearch index: {}", index);
    } catch (IOException e) {
      log.error("Failed to delete index {}: {}", index, e.getMessage(), e);
      throw new SearchException(index, "Failed to delete index", e);
    }
  }

  /** Deletes every index carrying this store's prefix. */
  protected void deleteAllIndices() {
    String pattern = indexPrefix + "-*";
    try {
      Set<String> indices =
          elasticsearchClient.indices().get(g -> g.index(pattern)).indices().keySet();
      for (String index : indices) {
        elasticsearchClient.indices().delete(d -> d.index(index));
        log.info("Deleted Elasticsearch index: {}", index);
      }
      verifiedIndices.clear();
    } catch (IOException e) {
      log.error("Failed to reset indices {}: {}", pattern, e.getMessage(), e);
      throw new SearchException(pattern, "Failed to reset indices", e);
    }
  }

  /** AND of exact term filters; match-all when {@code filter} is empty. */
  protected static Query filterQuery(Map<String, Object> filter) {
    if (filter == null || filter.isEmpty()) {
      return Query.of(q -> q.matchAll(m -> m));
    }
    BoolQuery.Builder bool = new BoolQuery.Builder();
    for (Map.Entry<String, Object> condition : filter.entrySet()) {
      FieldValue value = fieldValue(condition.getValue());
      bool.filter(Query.of(q -> q.term(t -> t.field(condition.getKey()).value(value))));
    }
    BoolQuery query = bool.build();
    return Query.of(q -> q.bool(query));
  }

  private static FieldValue fieldValue(Object value) {
    if (value instanceof Integer || value instanceof Long) {
      return FieldValue.of(((Number) value).longValue());
    }
    if (value instanceof Number number) {
      return FieldValue.of(number.doubleValue());
    }
    if (value instanceof Boolean bool) {
      return FieldValue.of(bool);
    }
    return FieldValue.of(String.valueOf(value));
  }

  private static String sanitize(String name) {
    return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
  }
}
