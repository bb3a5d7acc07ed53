package com.flamingo.ai.workspace.fulltext;

import java.util.List;
import java.util.Map;

/**
 * Lexical index kept next to the vector store. Collections map to one index each; a missing
 * collection yields no hits.
 */
public interface FulltextStore {

  /** Indexes documents, replacing any with the same id. */
  void index(String collection, List<FulltextDocument> documents);

  /**
   * Full-text search over document content.
   *
   * @param filter exact matches on {@code artifact_id} or {@code chunk_id}, may be empty
   */
  List<FulltextHit> search(
      String collection, String query, Map<String, Object> filter, int limit, int offset);

  void deleteByArtifact(String collection, String artifactId);

  void deleteCollection(String collection);
}
