package com.flamingo.ai.workspace.fulltext;

import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when {@code workspace.fulltext.enabled} is false. */
@Component
@ConditionalOnProperty(
    name = "workspace.fulltext.enabled",
    havingValue = "false",
    matchIfMissing = true)
@Slf4j
public class NoopFulltextStore implements FulltextStore {

  public NoopFulltextStore() {
    log.info("Full-text indexing disabled");
  }

  @Override
  public void index(String collection, List<FulltextDocument> documents) {}

  @Override
  public List<FulltextHit> search(
      String collection, String query, Map<String, Object> filter, int limit, int offset) {
    return List.of();
  }

  @Override
  public void deleteByArtifact(String collection, String artifactId) {}

  @Override
  public void deleteCollection(String collection) {}
}
