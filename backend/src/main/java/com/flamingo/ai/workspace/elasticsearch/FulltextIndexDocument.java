package com.flamingo.ai.workspace.elasticsearch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.workspace.fulltext.FulltextDocument;
import com.flamingo.ai.workspace.fulltext.FulltextHit;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Source of a full-text index document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FulltextIndexDocument {

  @JsonProperty(ElasticsearchFulltextStore.CONTENT)
  private String content;

  @JsonProperty(ElasticsearchFulltextStore.ARTIFACT_ID)
  private String artifactId;

  @JsonProperty(ElasticsearchFulltextStore.CHUNK_ID)
  private String chunkId;

  @JsonProperty(ElasticsearchFulltextStore.METADATA)
  private Map<String, Object> metadata;

  static FulltextIndexDocument from(FulltextDocument document) {
    return FulltextIndexDocument.builder()
        .content(document.content())
        .artifactId(document.artifactId())
        .chunkId(document.chunkId())
        .metadata(document.metadata())
        .build();
  }

  FulltextHit toHit(String id, double score) {
    return new FulltextHit(
        id,
        score,
        content == null ? "" : content,
        artifactId,
        chunkId,
        metadata == null ? Map.of() : metadata);
  }
}
