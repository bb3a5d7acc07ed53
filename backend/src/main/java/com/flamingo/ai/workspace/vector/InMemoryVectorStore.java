package com.flamingo.ai.workspace.vector;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** {@link VectorStore} kept in process memory, for local runs and tests. */
@Component
@ConditionalOnProperty(name = "workspace.vector-store.provider", havingValue = "memory")
@Slf4j
public class InMemoryVectorStore implements VectorStore {

  private final Map<String, Map<String, VectorRecord>> collections = new ConcurrentHashMap<>();

  @Override
  public void insert(String collection, List<VectorRecord> records) {
    Map<String, VectorRecord> target = collection(collection);
    synchronized (target) {
      for (VectorRecord record : records) {
        if (target.putIfAbsent(record.id(), record) != null) {
          log.debug("Record {} already present in {}, skipping insert", record.id(), collection);
        }
      }
    }
  }

  @Override
  public void upsert(String collection, List<VectorRecord> records) {
    Map<String, VectorRecord> target = collection(collection);
    synchronized (target) {
      for (VectorRecord record : records) {
        target.put(record.id(), record);
      }
    }
  }

  @Override
  public List<VectorSearchHit> search(
      String collection,
      List<List<Float>> queryVectors,
      Map<String, Object> filter,
      int limit,
      double threshold) {
    Map<String, VectorRecord> source = collections.get(collection);
    if (source == null || queryVectors.isEmpty() || limit <= 0) {
      return List.of();
    }
    List<Embedding> queries = queryVectors.stream().map(Embedding::from).toList();
    List<VectorSearchHit> hits = new ArrayList<>();
    for (VectorRecord record : snapshot(source)) {
      if (record.embedding().isEmpty() || !matches(record, filter)) {
        continue;
      }
      Embedding candidate = Embedding.from(record.embedding());
      double best = 0.0;
      for (Embedding query : queries) {
        double distance = 1.0 - CosineSimilarity.between(query, candidate);
        best = Math.max(best, VectorStore.similarityFromCosineDistance(distance));
      }
      if (best >= threshold) {
        hits.add(new VectorSearchHit(record.withoutEmbedding(), best));
      }
    }
    return hits.stream()
        .sorted(Comparator.comparingDouble(VectorSearchHit::score).reversed())
        .limit(limit)
        .toList();
  }

  @Override
  public List<VectorRecord> query(String collection, Map<String, Object> filter, int limit) {
    Map<String, VectorRecord> source = collections.get(collection);
    if (source == null) {
      return List.of();
    }
    return snapshot(source).stream().filter(r -> matches(r, filter)).limit(limit).toList();
  }

  @Override
  public List<VectorRecord> get(String collection) {
    Map<String, VectorRecord> source = collections.get(collection);
    return source == null ? List.of() : snapshot(source);
  }

  @Override
  public void delete(String collection, List<String> ids, Map<String, Object> filter) {
    Map<String, VectorRecord> target = collections.get(collection);
    if (target == null) {
      return;
    }
    if (ids != null && !ids.isEmpty()) {
      synchronized (target) {
        ids.forEach(target::remove);
      }
    } else if (filter != null && !filter.isEmpty()) {
      synchronized (target) {
        target.values().removeIf(r -> matches(r, filter));
      }
    } else {
      deleteCollection(collection);
    }
  }

  @Override
  public boolean hasCollection(String collection) {
    return collections.containsKey(collection);
  }

  @Override
  public void deleteCollection(String collection) {
    collections.remove(collection);
  }

  @Override
  public void reset() {
    collections.clear();
  }

  private Map<String, VectorRecord> collection(String name) {
    return collections.computeIfAbsent(name, n -> new LinkedHashMap<>());
  }

  private static List<VectorRecord> snapshot(Map<String, VectorRecord> source) {
    synchronized (source) {
      return new ArrayList<>(source.values());
    }
  }

  static boolean matches(VectorRecord record, Map<String, Object> filter) {
    if (filter == null || filter.isEmpty()) {
      return true;
    }
    Map<String, Object> metadata =
        record.metadata() == null ? Map.of() : record.metadata().toMap();
    for (Map.Entry<String, Object> condition : filter.entrySet()) {
      Object actual = metadata.get(condition.getKey());
      if (actual == null || !Objects.equals(actual.toString(), String.valueOf(condition.getValue()))) {
        return false;
      }
    }
    return true;
  }
}
