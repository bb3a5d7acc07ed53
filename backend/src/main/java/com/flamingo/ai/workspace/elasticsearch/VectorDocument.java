package com.flamingo.ai.workspace.elasticsearch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.workspace.vector.VectorMetadata;
import com.flamingo.ai.workspace.vector.VectorRecord;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Source of a vector index document. Metadata fields sit at the top level so they can be used in
 * term filters; field names match the keys of {@link VectorMetadata#toMap()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class VectorDocument {

  @JsonProperty(VectorMetadata.ARTIFACT_ID)
  private String artifactId;

  @JsonProperty(VectorMetadata.PARENT_ID)
  private String parentId;

  @JsonProperty(VectorMetadata.ARTIFACT_TYPE)
  private String artifactType;

  @JsonProperty(VectorMetadata.CHUNK_ID)
  private String chunkId;

  @JsonProperty(VectorMetadata.CHUNK_INDEX)
  private Integer chunkIndex;

  @JsonProperty(VectorMetadata.CHUNK_SIZE)
  private Integer chunkSize;

  @JsonProperty(VectorMetadata.CHUNK_OVERLAP)
  private Integer chunkOverlap;

  @JsonProperty(VectorMetadata.EMBEDDING_MODEL)
  private String embeddingModel;

  @JsonProperty(VectorMetadata.CREATED_AT)
  private String createdAt;

  @JsonProperty(VectorMetadata.UPDATED_AT)
  private String updatedAt;

  @JsonProperty(ElasticsearchVectorStore.CONTENT)
  private String content;

  /** Null in search results, which exclude the vector from the returned source. */
  @JsonProperty(ElasticsearchVectorStore.EMBEDDING)
  private List<Float> embedding;

  static VectorDocument from(VectorRecord record) {
    VectorDocumentBuilder builder =
        VectorDocument.builder().content(record.content()).embedding(record.embedding());
    VectorMetadata metadata = record.metadata();
    if (metadata != null) {
      builder
          .artifactId(metadata.artifactId())
          .parentId(metadata.parentId())
          .artifactType(metadata.artifactType())
          .chunkId(metadata.chunkId())
          .chunkIndex(metadata.chunkIndex())
          .chunkSize(metadata.chunkSize())
          .chunkOverlap(metadata.chunkOverlap())
          .embeddingModel(metadata.embeddingModel())
          .createdAt(metadata.createdAt())
          .updatedAt(metadata.updatedAt());
    }
    return builder.build();
  }

  VectorRecord toRecord(String id) {
    VectorMetadata metadata =
        VectorMetadata.builder()
            .artifactId(artifactId)
            .parentId(parentId)
            .artifactType(artifactType)
            .chunkId(chunkId)
            .chunkIndex(chunkIndex)
            .chunkSize(chunkSize)
            .chunkOverlap(chunkOverlap)
            .embeddingModel(embeddingModel)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    return new VectorRecord(id, List.of(), content == null ? "" : content, metadata);
  }
}
