package com.flamingo.ai.workspace.vector;

import java.util.List;
import java.util.Map;

/**
 * Similarity-search backend holding named collections of {@link VectorRecord}s.
 *
 * <p>Filters are exact matches on {@link VectorMetadata#toMap()} keys, combined with AND. An empty
 * filter matches every record. Operations on a collection that does not exist return empty results
 * instead of failing.
 */
public interface VectorStore {

  /** Adds records, creating the collection on first use. Existing ids are left unchanged. */
  void insert(String collection, List<VectorRecord> records);

  /** Adds records, replacing any record with the same id. */
  void upsert(String collection, List<VectorRecord> records);

  /**
   * Nearest-neighbour search.
   *
   * <p>Scores are cosine distances normalized with {@link #similarityFromCosineDistance(double)}.
   * When several query vectors are given, each record keeps its best score.
   *
   * @param collection collection name
   * @param queryVectors one or more query embeddings
   * @param filter metadata filter, may be empty
   * @param limit maximum number of hits
   * @param threshold minimum similarity; hits below it are dropped
   * @return hits ordered by descending score
   */
  List<VectorSearchHit> search(
      String collection,
      List<List<Float>> queryVectors,
      Map<String, Object> filter,
      int limit,
      double threshold);

  /** Records matching {@code filter}, at most {@code limit} of them. */
  List<VectorRecord> query(String collection, Map<String, Object> filter, int limit);

  /** Every record in the collection. */
  List<VectorRecord> get(String collection);

  /**
   * Deletes records by id, or by filter when {@code ids} is empty. With neither given the whole
   * collection is dropped.
   */
  void delete(String collection, List<String> ids, Map<String, Object> filter);

  boolean hasCollection(String collection);

  void deleteCollection(String collection);

  /** Drops every collection owned by this store. */
  void reset();

  /**
   * Maps a cosine distance ({@code 0} identical, {@code 2} opposite) to a similarity in {@code [0,
   * 1]}.
   */
  static double similarityFromCosineDistance(double distance) {
    double clamped = Math.max(0.0, Math.min(2.0, distance));
    return 1.0 - clamped / 2.0;
  }
}
